package my.resourceledger.app.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.time.LocalDate;

import static my.resourceledger.app.util.FieldParsers.DAY_MONTH_YEAR_PATTERN;

public record CommitmentCreateRequest(
		@NotNull Long resourceId,
		@NotNull @JsonFormat(pattern = DAY_MONTH_YEAR_PATTERN) LocalDate periodStart,
		@NotNull @JsonFormat(pattern = DAY_MONTH_YEAR_PATTERN) LocalDate periodEnd,
		@Schema(description = "Unit the committed hours are expressed in.", allowableValues = {"per-day", "per-week", "per-fortnight"})
		@NotBlank String cadence,
		@NotNull @PositiveOrZero BigDecimal committedHours
) {
}
