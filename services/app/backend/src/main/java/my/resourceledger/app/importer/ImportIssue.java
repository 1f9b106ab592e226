package my.resourceledger.app.importer;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A problem found while reading or persisting one row. Row 0 refers to the document as a
 * whole.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImportIssue(int row,
						  String field,
						  String value,
						  String message,
						  IssueSeverity severity) {
	public static ImportIssue error(int row, String field, String value, String message) {
		return new ImportIssue(row, field, value, message, IssueSeverity.ERROR);
	}

	public static ImportIssue error(int row, String message) {
		return new ImportIssue(row, null, null, message, IssueSeverity.ERROR);
	}

	public static ImportIssue warning(int row, String field, String value, String message) {
		return new ImportIssue(row, field, value, message, IssueSeverity.WARNING);
	}

	public boolean isError() {
		return severity == IssueSeverity.ERROR;
	}
}
