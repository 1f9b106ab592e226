package my.resourceledger.app.service;

import my.resourceledger.app.dto.ImportResultDto;
import my.resourceledger.app.importer.ImportIssue;
import my.resourceledger.app.support.DirectImportBatchWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class LabourRateImportServiceTest {
	private static final String TITLE = "Labour Rate Card\nRates in NZD excl. GST\n";
	private static final String HEADER = "Band,,Activity Type,Hourly Rate,Daily Rate,$ Uplift,% Uplift\n";

	@Mock
	private NamedParameterJdbcTemplate namedParameterJdbcTemplate;

	private LabourRateImportService service;

	@BeforeEach
	void setUp() {
		service = new LabourRateImportService(new DirectImportBatchWriter(), namedParameterJdbcTemplate);
	}

	@Test
	void replacesFiscalYearRatesBeforeInserting() {
		String csv = TITLE + HEADER + "N3,Analyst,N3_CAP,$120.00,$960.00,$5.00,4.5%\n";

		ImportResultDto result = service.importLabourRates(csv, "FY25");

		assertThat(result.success()).isTrue();
		assertThat(result.warnings()).isEmpty();
		InOrder order = inOrder(namedParameterJdbcTemplate);
		order.verify(namedParameterJdbcTemplate).update(startsWith("delete from labour_rates"), any(MapSqlParameterSource.class));
		ArgumentCaptor<MapSqlParameterSource> params = ArgumentCaptor.forClass(MapSqlParameterSource.class);
		order.verify(namedParameterJdbcTemplate).update(startsWith("insert into labour_rates"), params.capture());
		assertThat(params.getValue().getValue("fiscalYear")).isEqualTo("FY25");
		assertThat(params.getValue().getValue("localBand")).isEqualTo("Analyst");
		assertThat((BigDecimal) params.getValue().getValue("hourlyRate")).isEqualByComparingTo("120.00");
		assertThat((BigDecimal) params.getValue().getValue("upliftPercent")).isEqualByComparingTo("4.5");
	}

	@Test
	void dailyRateFarFromEightHoursWarns() {
		String csv = TITLE + HEADER + "N3,Analyst,N3_CAP,100,1000,,\n";

		ImportResultDto result = service.importLabourRates(csv, "FY25");

		assertThat(result.recordsImported()).isEqualTo(1);
		assertThat(result.warnings()).extracting(ImportIssue::field).containsExactly("Daily Rate");
	}

	@Test
	void invalidRatesAreRejectedAndExistingYearIsKept() {
		String csv = TITLE + HEADER + "N3,Analyst,N3_CAP,abc,-5,,\n";

		ImportResultDto result = service.importLabourRates(csv, "FY25");

		assertThat(result.success()).isFalse();
		assertThat(result.errors()).extracting(ImportIssue::field).containsExactly("Hourly Rate", "Daily Rate");
		verify(namedParameterJdbcTemplate, never()).update(startsWith("delete"), any(MapSqlParameterSource.class));
	}

	@Test
	void blankFiscalYearFailsWithoutTouchingRates() {
		ImportResultDto result = service.importLabourRates(TITLE + HEADER + "N3,Analyst,N3_CAP,$120.00,$960.00,,\n", " ");

		assertThat(result.success()).isFalse();
		assertThat(result.recordsImported()).isZero();
		assertThat(result.errors()).singleElement()
				.satisfies(error -> {
					assertThat(error.row()).isZero();
					assertThat(error.message()).isEqualTo("Fiscal year is required");
				});
		verifyNoInteractions(namedParameterJdbcTemplate);
	}
}
