package my.resourceledger.app.importer;

import java.util.Map;

/**
 * One data row keyed by trimmed header name. {@code rowNumber} is the spreadsheet row, so
 * the first data row below the header is 2.
 */
public record CsvRow(int rowNumber, Map<String, String> values) {
	public CsvRow {
		values = Map.copyOf(values);
	}

	public String get(String field) {
		String value = values.get(field);
		return value == null ? "" : value;
	}

	public boolean isBlank(String field) {
		return get(field).isBlank();
	}
}
