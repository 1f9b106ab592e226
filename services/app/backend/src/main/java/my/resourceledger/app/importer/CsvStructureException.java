package my.resourceledger.app.importer;

/**
 * Raised when a document cannot be read as a table at all: no header, a missing required
 * column, or broken quoting.
 */
public class CsvStructureException extends RuntimeException {
	public CsvStructureException(String message) {
		super(message);
	}

	public CsvStructureException(String message, Throwable cause) {
		super(message, cause);
	}
}
