package my.resourceledger.app.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

public record CapacityReportDto(
		List<CapacityCalculationDto> capacities,
		@Schema(description = "Resources whose latest commitment could not be evaluated.")
		List<SkippedCapacityDto> skipped
) {
	public CapacityReportDto {
		capacities = List.copyOf(capacities);
		skipped = List.copyOf(skipped);
	}
}
