package my.resourceledger.app.service;

import my.resourceledger.app.domain.PublicHoliday;
import my.resourceledger.app.dto.ImportResultDto;
import my.resourceledger.app.importer.CsvImportOptions;
import my.resourceledger.app.importer.CsvRow;
import my.resourceledger.app.importer.ImportIssue;
import my.resourceledger.app.persistence.ImportBatchWriter;
import my.resourceledger.app.util.FieldParsers;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Service
public class PublicHolidayImportService extends AbstractCsvImportService<PublicHoliday> {
	static final String NAME = "Name";
	static final String DATE = "Date";
	static final String SOURCE_CSV = "csv";

	private static final String INSERT_SQL = """
			insert into public_holidays (name, holiday_date, source, created_at)
			values (:name, :holidayDate, :source, :createdAt)
			""";

	private final NamedParameterJdbcTemplate namedParameterJdbcTemplate;

	public PublicHolidayImportService(ImportBatchWriter batchWriter, NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
		super(batchWriter);
		this.namedParameterJdbcTemplate = namedParameterJdbcTemplate;
	}

	@Transactional
	public ImportResultDto importHolidays(String csvText) {
		CsvImportOptions options = CsvImportOptions.of(List.of(NAME, DATE), this::validate);
		LocalDateTime createdAt = LocalDateTime.now();
		return runImport(csvText, options, row -> toHoliday(row, createdAt), null);
	}

	@Override
	protected String importName() {
		return "Public holiday";
	}

	@Override
	protected void insert(PublicHoliday holiday) {
		MapSqlParameterSource params = new MapSqlParameterSource()
				.addValue("name", holiday.getName())
				.addValue("holidayDate", Date.valueOf(holiday.getHolidayDate()))
				.addValue("source", holiday.getSource())
				.addValue("createdAt", Timestamp.valueOf(holiday.getCreatedAt()));
		namedParameterJdbcTemplate.update(INSERT_SQL, params);
	}

	List<ImportIssue> validate(CsvRow row) {
		List<ImportIssue> issues = new ArrayList<>();
		if (row.isBlank(NAME)) {
			issues.add(ImportIssue.error(row.rowNumber(), NAME, row.get(NAME), "Holiday name is required"));
		}
		String date = row.get(DATE);
		if (FieldParsers.parseDayMonthYear(date) == null) {
			issues.add(ImportIssue.error(row.rowNumber(), DATE, date,
					"Invalid date format. Expected DD-MM-YYYY, got: " + date));
		}
		return issues;
	}

	private PublicHoliday toHoliday(CsvRow row, LocalDateTime createdAt) {
		PublicHoliday holiday = new PublicHoliday();
		holiday.setName(row.get(NAME));
		holiday.setHolidayDate(FieldParsers.parseDayMonthYear(row.get(DATE)));
		holiday.setSource(SOURCE_CSV);
		holiday.setCreatedAt(createdAt);
		return holiday;
	}
}
