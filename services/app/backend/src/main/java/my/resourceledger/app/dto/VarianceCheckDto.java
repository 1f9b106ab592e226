package my.resourceledger.app.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import my.resourceledger.app.domain.VarianceSeverity;
import my.resourceledger.app.domain.VarianceType;

import java.math.BigDecimal;

@Schema(description = "One detected deviation between planned and booked hours or cost.")
public record VarianceCheckDto(
		VarianceType type,
		VarianceSeverity severity,
		@Schema(allowableValues = {"resource", "project"})
		String entityType,
		String entityId,
		String message,
		@Schema(description = "Planned figure: allocated or available hours, or forecast budget.")
		BigDecimal expected,
		@Schema(description = "Booked hours, allocated hours or actual cost.")
		BigDecimal actual,
		@Schema(description = "Deviation as a percent of the expected figure; absent when it cannot be computed.")
		BigDecimal variancePercent
) {
}
