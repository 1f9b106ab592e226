package my.resourceledger.app.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import my.resourceledger.app.domain.CommitmentCadence;
import my.resourceledger.app.domain.ResourceCommitment;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import static my.resourceledger.app.util.FieldParsers.DAY_MONTH_YEAR_PATTERN;

public record CommitmentDto(UUID commitmentId,
							Long resourceId,
							@JsonFormat(pattern = DAY_MONTH_YEAR_PATTERN) LocalDate periodStart,
							@JsonFormat(pattern = DAY_MONTH_YEAR_PATTERN) LocalDate periodEnd,
							CommitmentCadence cadence,
							BigDecimal committedHours,
							BigDecimal totalAvailableHours,
							BigDecimal allocatedHours,
							BigDecimal remainingCapacity,
							LocalDateTime createdAt) {
	public static CommitmentDto from(ResourceCommitment commitment) {
		return new CommitmentDto(
				commitment.getCommitmentId(),
				commitment.getResourceId(),
				commitment.getPeriodStart(),
				commitment.getPeriodEnd(),
				commitment.getCadence(),
				commitment.getCommittedHours(),
				commitment.getTotalAvailableHours(),
				commitment.getAllocatedHours(),
				commitment.getRemainingCapacity(),
				commitment.getCreatedAt()
		);
	}
}
