package my.resourceledger.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid @NotNull Imports imports,
		@Valid @NotNull Capacity capacity,
		@Valid @NotNull Variance variance
) {
	public record Imports(
			@NotNull @Positive BigDecimal maxDailyHours,
			@NotBlank String softwareCostElementPrefix,
			@NotBlank String hardwareCostElementPrefix
	) {
	}

	/**
	 * Utilization percentages bounding the optimal band; both bounds count as optimal.
	 */
	public record Capacity(
			@NotNull @PositiveOrZero BigDecimal underUtilizedBelow,
			@NotNull @PositiveOrZero BigDecimal overCommittedAbove
	) {
	}

	/**
	 * Percent deviation above which a variance is reported. Severity rises at 1.5, 2 and 3
	 * times the threshold.
	 */
	public record Variance(
			@NotNull @Positive BigDecimal hoursPercent,
			@NotNull @Positive BigDecimal costPercent
	) {
	}
}
