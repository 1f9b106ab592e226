package my.resourceledger.app.importer;

import java.util.List;

@FunctionalInterface
public interface RowValidator {
	List<ImportIssue> validate(CsvRow row);
}
