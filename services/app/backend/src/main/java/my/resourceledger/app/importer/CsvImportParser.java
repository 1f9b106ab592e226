package my.resourceledger.app.importer;

import my.resourceledger.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads delimited text into header-keyed rows and runs the configured row validation.
 * Individual malformed rows never abort parsing; only a document without a usable header
 * raises {@link CsvStructureException}.
 */
public class CsvImportParser {
	private static final int FIRST_DATA_ROW = 2;

	public CsvParseResult parse(String csvText, CsvImportOptions options) {
		String content = CsvParsing.skipLines(CsvParsing.stripBom(csvText), options.skipLeadingLines());
		if (content == null || content.isBlank()) {
			throw new CsvStructureException("CSV document is empty");
		}
		char delimiter = CsvParsing.sniffDelimiter(content.substring(0, Math.min(content.length(), 2048)));

		List<CsvRow> validRows = new ArrayList<>();
		List<ImportIssue> issues = new ArrayList<>();
		int totalRows = 0;
		int errorRows = 0;

		try (CSVParser parser = CSVParser.parse(
				new StringReader(content),
				CSVFormat.DEFAULT.withDelimiter(delimiter).withFirstRecordAsHeader().withAllowMissingColumnNames()
		)) {
			Map<String, String> headers = trimmedHeaders(parser.getHeaderNames());
			if (headers.keySet().stream().allMatch(String::isEmpty)) {
				throw new CsvStructureException("CSV document has no header row");
			}
			List<String> missing = options.requiredFields().stream()
					.filter(field -> !headers.containsKey(field))
					.toList();
			if (!missing.isEmpty()) {
				throw new CsvStructureException("CSV header validation failed. Missing required columns: "
						+ String.join(", ", missing) + ". Found columns: " + headers.keySet().stream()
								.filter(name -> !name.isEmpty())
								.collect(Collectors.joining(", ")));
			}

			int index = 0;
			for (CSVRecord record : parser) {
				int rowNumber = index + FIRST_DATA_ROW;
				index += 1;
				Map<String, String> values = readValues(record, headers);
				if (values.values().stream().allMatch(String::isBlank)) {
					continue;
				}
				totalRows += 1;
				CsvRow row = new CsvRow(rowNumber, values);

				List<ImportIssue> missingCells = options.requiredFields().stream()
						.filter(field -> !values.containsKey(field))
						.map(field -> ImportIssue.error(rowNumber, field, null, "Missing required field: " + field))
						.toList();
				if (!missingCells.isEmpty()) {
					issues.addAll(missingCells);
					errorRows += 1;
					continue;
				}

				if (options.validator() != null) {
					List<ImportIssue> rowIssues = options.validator().validate(row);
					issues.addAll(rowIssues);
					if (rowIssues.stream().anyMatch(ImportIssue::isError)) {
						errorRows += 1;
						continue;
					}
				}
				validRows.add(row);
			}
		} catch (IOException | UncheckedIOException exc) {
			throw new CsvStructureException("Failed to read CSV: " + exc.getMessage(), exc);
		} catch (IllegalArgumentException exc) {
			throw new CsvStructureException("Invalid CSV header: " + exc.getMessage(), exc);
		}

		return new CsvParseResult(validRows, issues, new CsvParseResult.Meta(totalRows, validRows.size(), errorRows));
	}

	private Map<String, String> trimmedHeaders(List<String> headerNames) {
		Map<String, String> headers = new LinkedHashMap<>();
		for (String header : headerNames) {
			if (header == null) {
				continue;
			}
			// an unnamed column is addressable under ""
			headers.putIfAbsent(header.trim(), header);
		}
		return headers;
	}

	private Map<String, String> readValues(CSVRecord record, Map<String, String> headers) {
		Map<String, String> values = new LinkedHashMap<>();
		for (Map.Entry<String, String> header : headers.entrySet()) {
			if (record.isSet(header.getValue())) {
				String value = record.get(header.getValue());
				values.put(header.getKey(), value == null ? "" : value.trim());
			}
		}
		return values;
	}
}
