package my.resourceledger.app.service;

/**
 * Raised when ledger data cannot be read; carries the query context in its message.
 */
public class FinanceLedgerException extends RuntimeException {
	public FinanceLedgerException(String message, Throwable cause) {
		super(message, cause);
	}
}
