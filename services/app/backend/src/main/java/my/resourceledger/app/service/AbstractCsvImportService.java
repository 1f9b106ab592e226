package my.resourceledger.app.service;

import my.resourceledger.app.dto.ImportResultDto;
import my.resourceledger.app.importer.CsvImportOptions;
import my.resourceledger.app.importer.CsvImportParser;
import my.resourceledger.app.importer.CsvParseResult;
import my.resourceledger.app.importer.CsvRow;
import my.resourceledger.app.importer.CsvStructureException;
import my.resourceledger.app.importer.ImportIssue;
import my.resourceledger.app.persistence.ImportBatchWriter;
import my.resourceledger.app.persistence.MappedRow;
import my.resourceledger.app.persistence.WriteOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Shared parse, map and persist flow of the CSV importers. Subclasses call
 * {@link #runImport} from a transactional entry point.
 */
public abstract class AbstractCsvImportService<T> {
	private static final Logger logger = LoggerFactory.getLogger(AbstractCsvImportService.class);

	private final CsvImportParser parser = new CsvImportParser();
	private final ImportBatchWriter batchWriter;

	protected AbstractCsvImportService(ImportBatchWriter batchWriter) {
		this.batchWriter = batchWriter;
	}

	protected abstract String importName();

	protected abstract void insert(T record);

	protected ImportResultDto runImport(String csvText,
										CsvImportOptions options,
										Function<CsvRow, T> mapper,
										Consumer<List<MappedRow<T>>> beforeWrite) {
		CsvParseResult parsed;
		try {
			parsed = parser.parse(csvText, options);
		} catch (CsvStructureException ex) {
			logger.warn("{} import rejected: {}", importName(), ex.getMessage());
			return ImportResultDto.structuralFailure(ex.getMessage());
		}

		List<MappedRow<T>> mapped = new ArrayList<>(parsed.rows().size());
		for (CsvRow row : parsed.rows()) {
			mapped.add(new MappedRow<>(row.rowNumber(), mapper.apply(row)));
		}
		if (beforeWrite != null) {
			beforeWrite.accept(mapped);
		}
		WriteOutcome outcome = batchWriter.writeEach(mapped, this::insert);

		List<ImportIssue> errors = new ArrayList<>();
		List<ImportIssue> warnings = new ArrayList<>();
		for (ImportIssue issue : parsed.issues()) {
			if (issue.isError()) {
				errors.add(issue);
			} else {
				warnings.add(issue);
			}
		}
		errors.addAll(outcome.failures());

		int failed = parsed.meta().errorRowCount() + outcome.failures().size();
		ImportResultDto result = new ImportResultDto(
				outcome.written() > 0,
				parsed.meta().totalRows(),
				outcome.written(),
				failed,
				errors,
				warnings
		);
		logger.info("{} import finished: processed={}, imported={}, failed={}, warnings={}",
				importName(), result.recordsProcessed(), result.recordsImported(), result.recordsFailed(), warnings.size());
		return result;
	}
}
