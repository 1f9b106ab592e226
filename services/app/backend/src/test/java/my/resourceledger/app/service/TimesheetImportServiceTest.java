package my.resourceledger.app.service;

import my.resourceledger.app.domain.FinancialResource;
import my.resourceledger.app.domain.RawTimesheetEntry;
import my.resourceledger.app.dto.ImportResultDto;
import my.resourceledger.app.dto.TimesheetEntryDto;
import my.resourceledger.app.importer.ImportIssue;
import my.resourceledger.app.repository.FinancialResourceRepository;
import my.resourceledger.app.repository.RawTimesheetEntryRepository;
import my.resourceledger.app.support.DirectImportBatchWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.math.BigDecimal;
import java.sql.Date;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TimesheetImportServiceTest {
	private static final String HEADER = "Stream,Month,Name of employee or applicant,Personnel Number,Date,Activity Type,General receiver,Number (unit)\n";

	@Mock
	private NamedParameterJdbcTemplate namedParameterJdbcTemplate;

	@Mock
	private RawTimesheetEntryRepository timesheetRepository;

	@Mock
	private FinancialResourceRepository resourceRepository;

	private TimesheetImportService service;

	@BeforeEach
	void setUp() {
		service = new TimesheetImportService(new DirectImportBatchWriter(), namedParameterJdbcTemplate,
				timesheetRepository, resourceRepository, TestProperties.defaults());
	}

	@Test
	void importsValidRowsAndLinksResourcesByPersonnelNumber() {
		String csv = HEADER
				+ "Payments,2025-01,Jane Doe,1001,15-01-2025,N3_CAP,WBS-100,7.5\n"
				+ "Payments,2025-01,John Roe,2002,16-01-2025,N3_CAP,WBS-100,8\n";
		FinancialResource jane = new FinancialResource();
		jane.setResourceId(42L);
		jane.setEmployeeId("1001");
		when(resourceRepository.findByEmployeeIdIn(anyCollection())).thenReturn(List.of(jane));

		ImportResultDto result = service.importTimesheets(csv);

		assertThat(result.success()).isTrue();
		assertThat(result.recordsProcessed()).isEqualTo(2);
		assertThat(result.recordsImported()).isEqualTo(2);
		assertThat(result.recordsFailed()).isZero();
		assertThat(result.errors()).isEmpty();

		ArgumentCaptor<MapSqlParameterSource> params = ArgumentCaptor.forClass(MapSqlParameterSource.class);
		verify(namedParameterJdbcTemplate, times(2)).update(anyString(), params.capture());
		MapSqlParameterSource first = params.getAllValues().get(0);
		assertThat(first.getValue("resourceId")).isEqualTo(42L);
		assertThat(first.getValue("workDate")).isEqualTo(Date.valueOf(LocalDate.of(2025, 1, 15)));
		assertThat((BigDecimal) first.getValue("hours")).isEqualByComparingTo("7.5");
		assertThat(params.getAllValues().get(1).getValue("resourceId")).isNull();
	}

	@Test
	void hoursBeyondTwoDecimalsAreRoundedWithWarning() {
		String csv = HEADER
				+ "Payments,2025-01,Jane Doe,1001,15-01-2025,N3_CAP,WBS-100,7.255\n"
				+ "Payments,2025-01,Jane Doe,1001,16-01-2025,N3_CAP,WBS-100,7.500\n";
		when(resourceRepository.findByEmployeeIdIn(anyCollection())).thenReturn(List.of());

		ImportResultDto result = service.importTimesheets(csv);

		assertThat(result.recordsImported()).isEqualTo(2);
		assertThat(result.warnings()).singleElement()
				.satisfies(warning -> {
					assertThat(warning.row()).isEqualTo(2);
					assertThat(warning.message()).isEqualTo("Hours rounded to 7.26");
				});
		ArgumentCaptor<MapSqlParameterSource> params = ArgumentCaptor.forClass(MapSqlParameterSource.class);
		verify(namedParameterJdbcTemplate, times(2)).update(anyString(), params.capture());
		assertThat(params.getAllValues().get(0).getValue("hours")).isEqualTo(new BigDecimal("7.26"));
	}

	@Test
	void hoursAboveDailyMaximumOnlyWarn() {
		String csv = HEADER + "Payments,2025-01,Jane Doe,1001,15-01-2025,N3_CAP,WBS-100,30\n";
		when(resourceRepository.findByEmployeeIdIn(anyCollection())).thenReturn(List.of());

		ImportResultDto result = service.importTimesheets(csv);

		assertThat(result.recordsImported()).isEqualTo(1);
		assertThat(result.errors()).isEmpty();
		assertThat(result.warnings()).hasSize(1);
		ImportIssue warning = result.warnings().get(0);
		assertThat(warning.row()).isEqualTo(2);
		assertThat(warning.field()).isEqualTo("Number (unit)");
		assertThat(warning.isError()).isFalse();
	}

	@Test
	void rejectsBadDatesAndNegativeHours() {
		String csv = HEADER
				+ "Payments,2025-01,Jane Doe,1001,2025/31/01,N3_CAP,WBS-100,8\n"
				+ "Payments,2025-01,Jane Doe,1001,16-01-2025,N3_CAP,WBS-100,-2\n"
				+ "Payments,2025-01,Jane Doe,1001,17-01-2025,N3_CAP,WBS-100,eight\n";

		ImportResultDto result = service.importTimesheets(csv);

		assertThat(result.success()).isFalse();
		assertThat(result.recordsProcessed()).isEqualTo(3);
		assertThat(result.recordsImported()).isZero();
		assertThat(result.recordsFailed()).isEqualTo(3);
		assertThat(result.errors()).extracting(ImportIssue::row).containsExactly(2, 3, 4);
		assertThat(result.errors()).extracting(ImportIssue::field).containsExactly("Date", "Number (unit)", "Number (unit)");
		verifyNoInteractions(namedParameterJdbcTemplate);
	}

	@Test
	void nonNumericPersonnelNumberIsAWarning() {
		String csv = HEADER + "Payments,2025-01,Contractor,C-77,15-01-2025,N3_CAP,WBS-100,8\n";
		when(resourceRepository.findByEmployeeIdIn(anyCollection())).thenReturn(List.of());

		ImportResultDto result = service.importTimesheets(csv);

		assertThat(result.recordsImported()).isEqualTo(1);
		assertThat(result.warnings()).extracting(ImportIssue::field).containsExactly("Personnel Number");
	}

	@Test
	void failedInsertIsCountedAndBatchContinues() {
		String csv = HEADER
				+ "Payments,2025-01,Jane Doe,,15-01-2025,N3_CAP,WBS-100,8\n"
				+ "Payments,2025-01,Jane Doe,,16-01-2025,N3_CAP,WBS-100,8\n"
				+ "Payments,2025-01,Jane Doe,,17-01-2025,N3_CAP,WBS-100,bad\n";
		when(namedParameterJdbcTemplate.update(anyString(), any(MapSqlParameterSource.class)))
				.thenThrow(new DataIntegrityViolationException("value too long"))
				.thenReturn(1);

		ImportResultDto result = service.importTimesheets(csv);

		assertThat(result.success()).isTrue();
		assertThat(result.recordsImported()).isEqualTo(1);
		assertThat(result.recordsFailed()).isEqualTo(2);
		assertThat(result.recordsProcessed())
				.isEqualTo(result.recordsImported() + result.recordsFailed());
		assertThat(result.errors()).extracting(ImportIssue::message)
				.anyMatch(message -> message.startsWith("Insert failed:"));
		verify(resourceRepository, never()).findByEmployeeIdIn(anyCollection());
	}

	@Test
	void missingHeaderColumnYieldsFailedResult() {
		String csv = "Stream,Month\nPayments,2025-01\n";

		ImportResultDto result = service.importTimesheets(csv);

		assertThat(result.success()).isFalse();
		assertThat(result.recordsProcessed()).isZero();
		assertThat(result.errors()).hasSize(1);
		assertThat(result.errors().get(0).row()).isZero();
		assertThat(result.errors().get(0).message()).contains("Missing required columns");
	}

	@Test
	void listsUnprocessedAndMarksProcessed() {
		RawTimesheetEntry entry = new RawTimesheetEntry();
		entry.setTimesheetId(5L);
		entry.setEmployeeName("Jane Doe");
		entry.setWorkDate(LocalDate.of(2025, 1, 15));
		entry.setHours(new BigDecimal("8"));
		when(timesheetRepository.findByProcessedFalseOrderByWorkDateAscTimesheetIdAsc()).thenReturn(List.of(entry));
		when(timesheetRepository.markProcessed(List.of(5L))).thenReturn(1);

		List<TimesheetEntryDto> unprocessed = service.getUnprocessedTimesheets();
		int updated = service.markAsProcessed(List.of(5L));

		assertThat(unprocessed).extracting(TimesheetEntryDto::timesheetId).containsExactly(5L);
		assertThat(updated).isEqualTo(1);
		assertThat(service.markAsProcessed(List.of())).isZero();
	}
}
