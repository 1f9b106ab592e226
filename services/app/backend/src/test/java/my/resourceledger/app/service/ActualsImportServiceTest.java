package my.resourceledger.app.service;

import my.resourceledger.app.domain.ActualType;
import my.resourceledger.app.domain.RawActualEntry;
import my.resourceledger.app.dto.CategorizationResultDto;
import my.resourceledger.app.dto.ImportResultDto;
import my.resourceledger.app.importer.ImportIssue;
import my.resourceledger.app.repository.RawActualEntryRepository;
import my.resourceledger.app.support.DirectImportBatchWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ActualsImportServiceTest {
	private static final String HEADER = "Month,Posting Date,Cost Element,WBS element,Value in Obj. Crcy,Personnel Number,Fiscal Year\n";

	@Mock
	private NamedParameterJdbcTemplate namedParameterJdbcTemplate;

	@Mock
	private RawActualEntryRepository actualRepository;

	private ActualsImportService service;

	@BeforeEach
	void setUp() {
		service = new ActualsImportService(new DirectImportBatchWriter(), namedParameterJdbcTemplate,
				actualRepository, TestProperties.defaults());
	}

	@Test
	void importsActualsWithCurrencyAmounts() {
		String csv = HEADER
				+ "2025-01,31-01-2025,11510000,WBS-100,\"$1,234.50\",,2025\n"
				+ "2025-01,31-01-2025,11600000,WBS-100,-200,,2025\n";

		ImportResultDto result = service.importActuals(csv);

		assertThat(result.success()).isTrue();
		assertThat(result.recordsImported()).isEqualTo(2);
		ArgumentCaptor<MapSqlParameterSource> params = ArgumentCaptor.forClass(MapSqlParameterSource.class);
		verify(namedParameterJdbcTemplate, times(2)).update(anyString(), params.capture());
		assertThat((BigDecimal) params.getAllValues().get(0).getValue("amount")).isEqualByComparingTo("1234.50");
		assertThat(params.getAllValues().get(0).getValue("fiscalYear")).isEqualTo(2025);
		assertThat(params.getAllValues().get(0).getValue("personnelNumber")).isNull();
	}

	@Test
	void amountsBeyondCentsAreRoundedWithWarning() {
		String csv = HEADER + "2025-01,31-01-2025,11510000,WBS-100,100.125,,2025\n";

		ImportResultDto result = service.importActuals(csv);

		assertThat(result.recordsImported()).isEqualTo(1);
		assertThat(result.warnings()).extracting(ImportIssue::field, ImportIssue::message)
				.containsExactly(tuple("Value in Obj. Crcy", "Amount rounded to 100.13"));
		ArgumentCaptor<MapSqlParameterSource> params = ArgumentCaptor.forClass(MapSqlParameterSource.class);
		verify(namedParameterJdbcTemplate).update(anyString(), params.capture());
		assertThat(params.getValue().getValue("amount")).isEqualTo(new BigDecimal("100.13"));
	}

	@Test
	void rejectsUnparseableAmountAndWarnsOnCostElement() {
		String csv = HEADER
				+ "2025-01,31-01-2025,11510000,WBS-100,\"1,00.50\",,\n"
				+ "2025-01,31-01-2025,CE-9,WBS-100,10,,\n";

		ImportResultDto result = service.importActuals(csv);

		assertThat(result.recordsImported()).isEqualTo(1);
		assertThat(result.recordsFailed()).isEqualTo(1);
		assertThat(result.errors()).extracting(ImportIssue::field).containsExactly("Value in Obj. Crcy");
		assertThat(result.warnings()).extracting(ImportIssue::field).containsExactly("Cost Element");
	}

	@Test
	void categorizesBySoftwareThenContractorThenHardware() {
		RawActualEntry software = actual("11510000", "12345");
		RawActualEntry contractor = actual("11600000", "12345");
		RawActualEntry hardware = actual("11600000", "0");
		RawActualEntry other = actual("40000000", null);
		when(actualRepository.findByActualTypeIsNull()).thenReturn(List.of(software, contractor, hardware, other));

		CategorizationResultDto result = service.categorizeActuals();

		assertThat(software.getActualType()).isEqualTo(ActualType.SOFTWARE);
		assertThat(contractor.getActualType()).isEqualTo(ActualType.CONTRACTOR);
		assertThat(hardware.getActualType()).isEqualTo(ActualType.HARDWARE);
		assertThat(other.getActualType()).isNull();
		assertThat(result.software()).isEqualTo(1);
		assertThat(result.contractor()).isEqualTo(1);
		assertThat(result.hardware()).isEqualTo(1);
		assertThat(result.uncategorized()).isEqualTo(1);
		assertThat(result.categorized()).isEqualTo(3);
		verify(actualRepository).saveAll(List.of(software, contractor, hardware));
	}

	@Test
	void secondCategorizationRunChangesNothing() {
		List<RawActualEntry> store = new ArrayList<>(List.of(actual("11510000", null), actual("40000000", null)));
		when(actualRepository.findByActualTypeIsNull()).thenAnswer(invocation ->
				store.stream().filter(entry -> entry.getActualType() == null).toList());

		CategorizationResultDto first = service.categorizeActuals();
		CategorizationResultDto second = service.categorizeActuals();

		assertThat(first.categorized()).isEqualTo(1);
		assertThat(second.categorized()).isZero();
		assertThat(second.uncategorized()).isEqualTo(1);
		verify(actualRepository).saveAll(anyList());
	}

	@Test
	void nothingToCategorizeSavesNothing() {
		when(actualRepository.findByActualTypeIsNull()).thenReturn(List.of());

		CategorizationResultDto result = service.categorizeActuals();

		assertThat(result.categorized()).isZero();
		verify(actualRepository, never()).saveAll(anyList());
	}

	private RawActualEntry actual(String costElement, String personnelNumber) {
		RawActualEntry entry = new RawActualEntry();
		entry.setCostElement(costElement);
		entry.setPersonnelNumber(personnelNumber);
		entry.setAmount(BigDecimal.TEN);
		return entry;
	}
}
