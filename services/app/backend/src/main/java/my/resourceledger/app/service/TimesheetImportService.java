package my.resourceledger.app.service;

import my.resourceledger.app.config.AppProperties;
import my.resourceledger.app.domain.FinancialResource;
import my.resourceledger.app.domain.RawTimesheetEntry;
import my.resourceledger.app.dto.ImportResultDto;
import my.resourceledger.app.dto.TimesheetEntryDto;
import my.resourceledger.app.importer.CsvImportOptions;
import my.resourceledger.app.importer.CsvRow;
import my.resourceledger.app.importer.ImportIssue;
import my.resourceledger.app.persistence.ImportBatchWriter;
import my.resourceledger.app.persistence.MappedRow;
import my.resourceledger.app.repository.FinancialResourceRepository;
import my.resourceledger.app.repository.RawTimesheetEntryRepository;
import my.resourceledger.app.util.FieldParsers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class TimesheetImportService extends AbstractCsvImportService<RawTimesheetEntry> {
	private static final Logger logger = LoggerFactory.getLogger(TimesheetImportService.class);

	static final String STREAM = "Stream";
	static final String MONTH = "Month";
	static final String EMPLOYEE_NAME = "Name of employee or applicant";
	static final String PERSONNEL_NUMBER = "Personnel Number";
	static final String DATE = "Date";
	static final String ACTIVITY_TYPE = "Activity Type";
	static final String GENERAL_RECEIVER = "General receiver";
	static final String HOURS = "Number (unit)";
	static final List<String> REQUIRED_FIELDS = List.of(
			STREAM, MONTH, EMPLOYEE_NAME, PERSONNEL_NUMBER, DATE, ACTIVITY_TYPE, GENERAL_RECEIVER, HOURS
	);

	private static final int STORED_SCALE = 2;
	private static final String INSERT_SQL = """
			insert into raw_timesheets (stream, period_month, sender_cost_center, employee_name, personnel_number,
			    work_date, activity_type, general_receiver, acct_assignment_text, hours, internal_uom,
			    att_absence_type, object_description, resource_id, imported_at, processed)
			values (:stream, :month, :senderCostCenter, :employeeName, :personnelNumber,
			    :workDate, :activityType, :generalReceiver, :accountAssignmentText, :hours, :internalUom,
			    :absenceType, :objectDescription, :resourceId, :importedAt, false)
			""";

	private final NamedParameterJdbcTemplate namedParameterJdbcTemplate;
	private final RawTimesheetEntryRepository timesheetRepository;
	private final FinancialResourceRepository resourceRepository;
	private final BigDecimal maxDailyHours;

	public TimesheetImportService(ImportBatchWriter batchWriter,
								  NamedParameterJdbcTemplate namedParameterJdbcTemplate,
								  RawTimesheetEntryRepository timesheetRepository,
								  FinancialResourceRepository resourceRepository,
								  AppProperties properties) {
		super(batchWriter);
		this.namedParameterJdbcTemplate = namedParameterJdbcTemplate;
		this.timesheetRepository = timesheetRepository;
		this.resourceRepository = resourceRepository;
		this.maxDailyHours = properties.imports().maxDailyHours();
	}

	@Transactional
	public ImportResultDto importTimesheets(String csvText) {
		CsvImportOptions options = CsvImportOptions.of(REQUIRED_FIELDS, this::validate);
		LocalDateTime importedAt = LocalDateTime.now();
		return runImport(csvText, options, row -> toEntry(row, importedAt), this::linkResources);
	}

	@Transactional(readOnly = true)
	public List<TimesheetEntryDto> getUnprocessedTimesheets() {
		return timesheetRepository.findByProcessedFalseOrderByWorkDateAscTimesheetIdAsc().stream()
				.map(TimesheetEntryDto::from)
				.toList();
	}

	@Transactional
	public int markAsProcessed(Collection<Long> timesheetIds) {
		if (timesheetIds == null || timesheetIds.isEmpty()) {
			return 0;
		}
		int updated = timesheetRepository.markProcessed(timesheetIds);
		logger.info("Marked {} of {} timesheet rows as processed", updated, timesheetIds.size());
		return updated;
	}

	@Override
	protected String importName() {
		return "Timesheet";
	}

	@Override
	protected void insert(RawTimesheetEntry entry) {
		MapSqlParameterSource params = new MapSqlParameterSource()
				.addValue("stream", entry.getStream())
				.addValue("month", entry.getMonth())
				.addValue("senderCostCenter", entry.getSenderCostCenter())
				.addValue("employeeName", entry.getEmployeeName())
				.addValue("personnelNumber", entry.getPersonnelNumber())
				.addValue("workDate", Date.valueOf(entry.getWorkDate()))
				.addValue("activityType", entry.getActivityType())
				.addValue("generalReceiver", entry.getGeneralReceiver())
				.addValue("accountAssignmentText", entry.getAccountAssignmentText())
				.addValue("hours", entry.getHours())
				.addValue("internalUom", entry.getInternalUom())
				.addValue("absenceType", entry.getAbsenceType())
				.addValue("objectDescription", entry.getObjectDescription())
				.addValue("resourceId", entry.getResourceId())
				.addValue("importedAt", Timestamp.valueOf(entry.getImportedAt()));
		namedParameterJdbcTemplate.update(INSERT_SQL, params);
	}

	List<ImportIssue> validate(CsvRow row) {
		List<ImportIssue> issues = new ArrayList<>();
		String date = row.get(DATE);
		if (FieldParsers.parseDayMonthYear(date) == null) {
			issues.add(ImportIssue.error(row.rowNumber(), DATE, date,
					"Invalid date format. Expected DD-MM-YYYY, got: " + date));
		}

		String rawHours = row.get(HOURS);
		BigDecimal hours = FieldParsers.parseDecimal(rawHours);
		if (hours == null || hours.signum() < 0) {
			issues.add(ImportIssue.error(row.rowNumber(), HOURS, rawHours,
					"Invalid hours value. Must be a non-negative number, got: " + rawHours));
		} else {
			if (hours.compareTo(maxDailyHours) > 0) {
				issues.add(ImportIssue.warning(row.rowNumber(), HOURS, rawHours,
						"Hours exceed " + maxDailyHours.stripTrailingZeros().toPlainString() + " for a single day"));
			}
			if (FieldParsers.hasMoreDecimalsThan(hours, STORED_SCALE)) {
				issues.add(ImportIssue.warning(row.rowNumber(), HOURS, rawHours,
						"Hours rounded to " + hours.setScale(STORED_SCALE, RoundingMode.HALF_UP).toPlainString()));
			}
		}

		String personnelNumber = row.get(PERSONNEL_NUMBER);
		if (!personnelNumber.isBlank() && !FieldParsers.isDigits(personnelNumber)) {
			issues.add(ImportIssue.warning(row.rowNumber(), PERSONNEL_NUMBER, personnelNumber,
					"Personnel number should be numeric"));
		}
		return issues;
	}

	private RawTimesheetEntry toEntry(CsvRow row, LocalDateTime importedAt) {
		RawTimesheetEntry entry = new RawTimesheetEntry();
		entry.setStream(row.get(STREAM));
		entry.setMonth(row.get(MONTH));
		entry.setSenderCostCenter(FieldParsers.trimToNull(row.get("Sender Cost Center")));
		entry.setEmployeeName(row.get(EMPLOYEE_NAME));
		entry.setPersonnelNumber(FieldParsers.trimToNull(row.get(PERSONNEL_NUMBER)));
		entry.setWorkDate(FieldParsers.parseDayMonthYear(row.get(DATE)));
		entry.setActivityType(row.get(ACTIVITY_TYPE));
		entry.setGeneralReceiver(row.get(GENERAL_RECEIVER));
		entry.setAccountAssignmentText(FieldParsers.trimToNull(row.get("Acct assgnt text")));
		entry.setHours(FieldParsers.parseDecimal(row.get(HOURS)).setScale(STORED_SCALE, RoundingMode.HALF_UP));
		entry.setInternalUom(FieldParsers.trimToNull(row.get("Internal UoM")));
		entry.setAbsenceType(FieldParsers.trimToNull(row.get("Att./Absence type")));
		entry.setObjectDescription(FieldParsers.trimToNull(row.get("Object Description")));
		entry.setImportedAt(importedAt);
		return entry;
	}

	private void linkResources(List<MappedRow<RawTimesheetEntry>> rows) {
		Set<String> personnelNumbers = rows.stream()
				.map(row -> row.record().getPersonnelNumber())
				.filter(Objects::nonNull)
				.collect(Collectors.toSet());
		if (personnelNumbers.isEmpty()) {
			return;
		}
		Map<String, Long> resourceIds = resourceRepository.findByEmployeeIdIn(personnelNumbers).stream()
				.collect(Collectors.toMap(FinancialResource::getEmployeeId, FinancialResource::getResourceId, (a, b) -> a));
		for (MappedRow<RawTimesheetEntry> row : rows) {
			String personnelNumber = row.record().getPersonnelNumber();
			if (personnelNumber != null) {
				row.record().setResourceId(resourceIds.get(personnelNumber));
			}
		}
		logger.debug("Linked timesheet rows to {} of {} personnel numbers", resourceIds.size(), personnelNumbers.size());
	}
}
