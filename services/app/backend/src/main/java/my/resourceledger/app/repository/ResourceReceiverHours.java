package my.resourceledger.app.repository;

import java.math.BigDecimal;

/**
 * Timesheet hours of one resource summed per general receiver.
 */
public record ResourceReceiverHours(Long resourceId, String generalReceiver, BigDecimal hours) {
}
