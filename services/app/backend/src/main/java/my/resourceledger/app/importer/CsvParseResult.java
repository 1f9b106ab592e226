package my.resourceledger.app.importer;

import java.util.List;

public record CsvParseResult(List<CsvRow> rows, List<ImportIssue> issues, Meta meta) {
	public CsvParseResult {
		rows = List.copyOf(rows);
		issues = List.copyOf(issues);
	}

	public record Meta(int totalRows, int validRows, int errorRowCount) {
	}
}
