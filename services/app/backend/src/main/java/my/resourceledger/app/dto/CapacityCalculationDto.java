package my.resourceledger.app.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.swagger.v3.oas.annotations.media.Schema;
import my.resourceledger.app.domain.UtilizationStatus;

import java.math.BigDecimal;
import java.time.LocalDate;

import static my.resourceledger.app.util.FieldParsers.DAY_MONTH_YEAR_PATTERN;

@Schema(description = "Committed capacity of one resource compared with the hours it booked.")
public record CapacityCalculationDto(
		Long resourceId,
		String resourceName,
		@JsonFormat(pattern = DAY_MONTH_YEAR_PATTERN) LocalDate periodStart,
		@JsonFormat(pattern = DAY_MONTH_YEAR_PATTERN) LocalDate periodEnd,
		@Schema(description = "Total available hours of the matching commitment.")
		BigDecimal totalCapacityHours,
		BigDecimal allocatedHours,
		@Schema(description = "Timesheet hours booked within the period.")
		BigDecimal actualHours,
		BigDecimal remainingCapacity,
		BigDecimal utilizationPercent,
		UtilizationStatus status
) {
}
