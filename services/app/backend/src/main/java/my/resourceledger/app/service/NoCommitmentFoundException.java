package my.resourceledger.app.service;

import java.time.LocalDate;

public class NoCommitmentFoundException extends RuntimeException {
	public NoCommitmentFoundException(Long resourceId, LocalDate periodStart, LocalDate periodEnd) {
		super("No commitment found for resource " + resourceId + " between " + periodStart + " and " + periodEnd);
	}
}
