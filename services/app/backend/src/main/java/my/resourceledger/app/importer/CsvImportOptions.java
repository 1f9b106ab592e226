package my.resourceledger.app.importer;

import java.util.List;

/**
 * @param requiredFields header columns that must exist; a row without a cell for one of them is rejected
 * @param validator      optional domain validation run on rows that have all required cells
 * @param skipLeadingLines title lines above the header row
 */
public record CsvImportOptions(List<String> requiredFields, RowValidator validator, int skipLeadingLines) {
	public CsvImportOptions {
		requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
		if (skipLeadingLines < 0) {
			throw new IllegalArgumentException("skipLeadingLines must not be negative");
		}
	}

	public static CsvImportOptions of(List<String> requiredFields, RowValidator validator) {
		return new CsvImportOptions(requiredFields, validator, 0);
	}
}
