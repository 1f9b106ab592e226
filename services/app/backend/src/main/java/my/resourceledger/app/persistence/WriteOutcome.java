package my.resourceledger.app.persistence;

import my.resourceledger.app.importer.ImportIssue;

import java.util.List;

public record WriteOutcome(int written, List<ImportIssue> failures) {
	public WriteOutcome {
		failures = List.copyOf(failures);
	}
}
