package my.resourceledger.app.service;

import my.resourceledger.app.domain.LabourRate;
import my.resourceledger.app.dto.ImportResultDto;
import my.resourceledger.app.importer.CsvImportOptions;
import my.resourceledger.app.importer.CsvRow;
import my.resourceledger.app.importer.ImportIssue;
import my.resourceledger.app.persistence.ImportBatchWriter;
import my.resourceledger.app.util.FieldParsers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Imports a fiscal year's rate card. The export carries two title lines above the header
 * and an unnamed second column holding the local band description. Importing a year
 * replaces all rates previously stored for it.
 */
@Service
public class LabourRateImportService extends AbstractCsvImportService<LabourRate> {
	private static final Logger logger = LoggerFactory.getLogger(LabourRateImportService.class);

	static final String BAND = "Band";
	static final String ACTIVITY_TYPE = "Activity Type";
	static final String HOURLY_RATE = "Hourly Rate";
	static final String DAILY_RATE = "Daily Rate";
	static final List<String> REQUIRED_FIELDS = List.of(BAND, ACTIVITY_TYPE, HOURLY_RATE, DAILY_RATE);

	private static final int TITLE_LINES = 2;
	private static final BigDecimal HOURS_PER_DAY = BigDecimal.valueOf(8);
	private static final BigDecimal DAILY_RATE_TOLERANCE = new BigDecimal("0.10");

	private static final String DELETE_SQL = "delete from labour_rates where fiscal_year = :fiscalYear";
	private static final String INSERT_SQL = """
			insert into labour_rates (band, local_band, activity_type, fiscal_year, hourly_rate, daily_rate,
			    uplift_amount, uplift_percent, imported_at)
			values (:band, :localBand, :activityType, :fiscalYear, :hourlyRate, :dailyRate,
			    :upliftAmount, :upliftPercent, :importedAt)
			""";

	private final NamedParameterJdbcTemplate namedParameterJdbcTemplate;

	public LabourRateImportService(ImportBatchWriter batchWriter, NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
		super(batchWriter);
		this.namedParameterJdbcTemplate = namedParameterJdbcTemplate;
	}

	@Transactional
	public ImportResultDto importLabourRates(String csvText, String fiscalYear) {
		String year = FieldParsers.trimToNull(fiscalYear);
		if (year == null) {
			logger.warn("Labour rate import rejected: no fiscal year given");
			return ImportResultDto.structuralFailure("Fiscal year is required");
		}
		CsvImportOptions options = new CsvImportOptions(REQUIRED_FIELDS, this::validate, TITLE_LINES);
		LocalDateTime importedAt = LocalDateTime.now();
		return runImport(csvText, options, row -> toRate(row, year, importedAt), rows -> {
			if (!rows.isEmpty()) {
				deleteFiscalYear(year);
			}
		});
	}

	@Override
	protected String importName() {
		return "Labour rate";
	}

	@Override
	protected void insert(LabourRate rate) {
		MapSqlParameterSource params = new MapSqlParameterSource()
				.addValue("band", rate.getBand())
				.addValue("localBand", rate.getLocalBand())
				.addValue("activityType", rate.getActivityType())
				.addValue("fiscalYear", rate.getFiscalYear())
				.addValue("hourlyRate", rate.getHourlyRate())
				.addValue("dailyRate", rate.getDailyRate())
				.addValue("upliftAmount", rate.getUpliftAmount())
				.addValue("upliftPercent", rate.getUpliftPercent())
				.addValue("importedAt", Timestamp.valueOf(rate.getImportedAt()));
		namedParameterJdbcTemplate.update(INSERT_SQL, params);
	}

	List<ImportIssue> validate(CsvRow row) {
		List<ImportIssue> issues = new ArrayList<>();
		if (row.isBlank(ACTIVITY_TYPE)) {
			issues.add(ImportIssue.error(row.rowNumber(), ACTIVITY_TYPE, row.get(ACTIVITY_TYPE), "Activity type is required"));
		}
		BigDecimal hourly = FieldParsers.parseAmount(row.get(HOURLY_RATE));
		if (hourly == null || hourly.signum() < 0) {
			issues.add(ImportIssue.error(row.rowNumber(), HOURLY_RATE, row.get(HOURLY_RATE), "Invalid hourly rate"));
		}
		BigDecimal daily = FieldParsers.parseAmount(row.get(DAILY_RATE));
		if (daily == null || daily.signum() < 0) {
			issues.add(ImportIssue.error(row.rowNumber(), DAILY_RATE, row.get(DAILY_RATE), "Invalid daily rate"));
		}
		if (hourly != null && daily != null && hourly.signum() > 0 && daily.signum() > 0) {
			BigDecimal expected = hourly.multiply(HOURS_PER_DAY);
			BigDecimal deviation = daily.subtract(expected).abs().divide(expected, 4, RoundingMode.HALF_UP);
			if (deviation.compareTo(DAILY_RATE_TOLERANCE) > 0) {
				issues.add(ImportIssue.warning(row.rowNumber(), DAILY_RATE, row.get(DAILY_RATE),
						"Daily rate (" + daily.toPlainString() + ") should be ~8x hourly rate (" + hourly.toPlainString() + ")"));
			}
		}
		return issues;
	}

	private void deleteFiscalYear(String fiscalYear) {
		int removed = namedParameterJdbcTemplate.update(DELETE_SQL, new MapSqlParameterSource("fiscalYear", fiscalYear));
		if (removed > 0) {
			logger.info("Replacing {} labour rates for fiscal year {}", removed, fiscalYear);
		}
	}

	private LabourRate toRate(CsvRow row, String fiscalYear, LocalDateTime importedAt) {
		LabourRate rate = new LabourRate();
		rate.setBand(row.get(BAND));
		rate.setLocalBand(FieldParsers.trimToNull(row.get("")));
		rate.setActivityType(row.get(ACTIVITY_TYPE));
		rate.setFiscalYear(fiscalYear);
		rate.setHourlyRate(FieldParsers.parseAmount(row.get(HOURLY_RATE)));
		rate.setDailyRate(FieldParsers.parseAmount(row.get(DAILY_RATE)));
		rate.setUpliftAmount(FieldParsers.parseAmount(row.get("$ Uplift")));
		rate.setUpliftPercent(FieldParsers.parsePercent(row.get("% Uplift")));
		rate.setImportedAt(importedAt);
		return rate;
	}
}
