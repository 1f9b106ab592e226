package my.resourceledger.app.service;

import my.resourceledger.app.config.AppProperties;
import my.resourceledger.app.domain.ActualType;
import my.resourceledger.app.domain.RawActualEntry;
import my.resourceledger.app.dto.CategorizationResultDto;
import my.resourceledger.app.dto.ImportResultDto;
import my.resourceledger.app.importer.CsvImportOptions;
import my.resourceledger.app.importer.CsvRow;
import my.resourceledger.app.importer.ImportIssue;
import my.resourceledger.app.persistence.ImportBatchWriter;
import my.resourceledger.app.repository.RawActualEntryRepository;
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
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class ActualsImportService extends AbstractCsvImportService<RawActualEntry> {
	private static final Logger logger = LoggerFactory.getLogger(ActualsImportService.class);

	static final String MONTH = "Month";
	static final String POSTING_DATE = "Posting Date";
	static final String COST_ELEMENT = "Cost Element";
	static final String WBS_ELEMENT = "WBS element";
	static final String AMOUNT = "Value in Obj. Crcy";
	static final String DOCUMENT_DATE = "Document Date";
	static final List<String> REQUIRED_FIELDS = List.of(MONTH, POSTING_DATE, COST_ELEMENT, WBS_ELEMENT, AMOUNT);

	private static final String NO_PERSONNEL_NUMBER = "0";
	private static final int STORED_SCALE = 2;
	private static final String INSERT_SQL = """
			insert into raw_actuals (period_month, posting_date, document_date, cost_element, cost_element_descr,
			    wbs_element, amount, period, fiscal_year, transaction_currency, personnel_number,
			    document_number, name, imported_at, processed)
			values (:month, :postingDate, :documentDate, :costElement, :costElementDescription,
			    :wbsElement, :amount, :period, :fiscalYear, :transactionCurrency, :personnelNumber,
			    :documentNumber, :name, :importedAt, false)
			""";

	private final NamedParameterJdbcTemplate namedParameterJdbcTemplate;
	private final RawActualEntryRepository actualRepository;
	private final String softwarePrefix;
	private final String hardwarePrefix;

	public ActualsImportService(ImportBatchWriter batchWriter,
								NamedParameterJdbcTemplate namedParameterJdbcTemplate,
								RawActualEntryRepository actualRepository,
								AppProperties properties) {
		super(batchWriter);
		this.namedParameterJdbcTemplate = namedParameterJdbcTemplate;
		this.actualRepository = actualRepository;
		this.softwarePrefix = properties.imports().softwareCostElementPrefix();
		this.hardwarePrefix = properties.imports().hardwareCostElementPrefix();
	}

	@Transactional
	public ImportResultDto importActuals(String csvText) {
		CsvImportOptions options = CsvImportOptions.of(REQUIRED_FIELDS, this::validate);
		LocalDateTime importedAt = LocalDateTime.now();
		return runImport(csvText, options, row -> toEntry(row, importedAt), null);
	}

	/**
	 * Assigns a type to every actual that has none. Rows that already carry a type are never
	 * revisited, so repeating the pass changes nothing.
	 */
	@Transactional
	public CategorizationResultDto categorizeActuals() {
		List<RawActualEntry> pending = actualRepository.findByActualTypeIsNull();
		Map<ActualType, Integer> counts = new EnumMap<>(ActualType.class);
		List<RawActualEntry> categorized = new ArrayList<>();
		for (RawActualEntry actual : pending) {
			ActualType type = classify(actual);
			if (type == null) {
				continue;
			}
			actual.setActualType(type);
			categorized.add(actual);
			counts.merge(type, 1, Integer::sum);
		}
		if (!categorized.isEmpty()) {
			actualRepository.saveAll(categorized);
		}
		CategorizationResultDto result = new CategorizationResultDto(
				counts.getOrDefault(ActualType.SOFTWARE, 0),
				counts.getOrDefault(ActualType.HARDWARE, 0),
				counts.getOrDefault(ActualType.CONTRACTOR, 0),
				pending.size() - categorized.size()
		);
		logger.info("Categorized {} actuals (software={}, hardware={}, contractor={}), {} left uncategorized",
				categorized.size(), result.software(), result.hardware(), result.contractor(), result.uncategorized());
		return result;
	}

	ActualType classify(RawActualEntry actual) {
		String costElement = FieldParsers.trim(actual.getCostElement());
		if (costElement.startsWith(softwarePrefix)) {
			return ActualType.SOFTWARE;
		}
		String personnelNumber = FieldParsers.trim(actual.getPersonnelNumber());
		if (!personnelNumber.isEmpty() && !NO_PERSONNEL_NUMBER.equals(personnelNumber)) {
			return ActualType.CONTRACTOR;
		}
		if (costElement.startsWith(hardwarePrefix)) {
			return ActualType.HARDWARE;
		}
		return null;
	}

	@Override
	protected String importName() {
		return "Actuals";
	}

	@Override
	protected void insert(RawActualEntry entry) {
		MapSqlParameterSource params = new MapSqlParameterSource()
				.addValue("month", entry.getMonth())
				.addValue("postingDate", toSqlDate(entry.getPostingDate()))
				.addValue("documentDate", toSqlDate(entry.getDocumentDate()))
				.addValue("costElement", entry.getCostElement())
				.addValue("costElementDescription", entry.getCostElementDescription())
				.addValue("wbsElement", entry.getWbsElement())
				.addValue("amount", entry.getAmount())
				.addValue("period", entry.getPeriod())
				.addValue("fiscalYear", entry.getFiscalYear())
				.addValue("transactionCurrency", entry.getTransactionCurrency())
				.addValue("personnelNumber", entry.getPersonnelNumber())
				.addValue("documentNumber", entry.getDocumentNumber())
				.addValue("name", entry.getName())
				.addValue("importedAt", Timestamp.valueOf(entry.getImportedAt()));
		namedParameterJdbcTemplate.update(INSERT_SQL, params);
	}

	List<ImportIssue> validate(CsvRow row) {
		List<ImportIssue> issues = new ArrayList<>();
		String rawAmount = row.get(AMOUNT);
		BigDecimal amount = FieldParsers.parseAmount(rawAmount);
		if (amount == null) {
			issues.add(ImportIssue.error(row.rowNumber(), AMOUNT, rawAmount,
					"Invalid amount. Must be a number, got: " + rawAmount));
		} else if (FieldParsers.hasMoreDecimalsThan(amount, STORED_SCALE)) {
			issues.add(ImportIssue.warning(row.rowNumber(), AMOUNT, rawAmount,
					"Amount rounded to " + amount.setScale(STORED_SCALE, RoundingMode.HALF_UP).toPlainString()));
		}

		String postingDate = row.get(POSTING_DATE);
		if (FieldParsers.parseDayMonthYear(postingDate) == null) {
			issues.add(ImportIssue.error(row.rowNumber(), POSTING_DATE, postingDate,
					"Invalid date format. Expected DD-MM-YYYY, got: " + postingDate));
		}

		String documentDate = row.get(DOCUMENT_DATE);
		if (!documentDate.isBlank() && FieldParsers.parseDayMonthYear(documentDate) == null) {
			issues.add(ImportIssue.warning(row.rowNumber(), DOCUMENT_DATE, documentDate,
					"Unreadable document date ignored"));
		}

		String costElement = row.get(COST_ELEMENT);
		if (!costElement.isBlank() && !FieldParsers.isDigits(costElement)) {
			issues.add(ImportIssue.warning(row.rowNumber(), COST_ELEMENT, costElement,
					"Cost element should be numeric"));
		}
		return issues;
	}

	private RawActualEntry toEntry(CsvRow row, LocalDateTime importedAt) {
		RawActualEntry entry = new RawActualEntry();
		entry.setMonth(row.get(MONTH));
		entry.setPostingDate(FieldParsers.parseDayMonthYear(row.get(POSTING_DATE)));
		entry.setDocumentDate(FieldParsers.parseDayMonthYear(row.get(DOCUMENT_DATE)));
		entry.setCostElement(row.get(COST_ELEMENT));
		entry.setCostElementDescription(FieldParsers.trimToNull(row.get("Cost element descr.")));
		entry.setWbsElement(row.get(WBS_ELEMENT));
		BigDecimal amount = FieldParsers.parseAmount(row.get(AMOUNT)).setScale(STORED_SCALE, RoundingMode.HALF_UP);
		entry.setAmount(amount);
		entry.setPeriod(FieldParsers.parseInteger(row.get("Period")));
		entry.setFiscalYear(FieldParsers.parseInteger(row.get("Fiscal Year")));
		entry.setTransactionCurrency(FieldParsers.trimToNull(row.get("Transaction Currency")));
		entry.setPersonnelNumber(FieldParsers.trimToNull(row.get("Personnel Number")));
		entry.setDocumentNumber(FieldParsers.trimToNull(row.get("Document Number")));
		entry.setName(FieldParsers.trimToNull(row.get("Name")));
		entry.setImportedAt(importedAt);
		return entry;
	}

	private static Date toSqlDate(LocalDate date) {
		return date == null ? null : Date.valueOf(date);
	}
}
