package my.resourceledger.app.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

@Schema(description = "Budget, forecast and actual spend of one workstream.")
public record FinanceLedgerRowDto(
		String workstream,
		String wbse,
		BigDecimal budget,
		@Schema(description = "Allocated hours priced at labour rates, or the stored forecast budget when that yields nothing.")
		BigDecimal forecast,
		BigDecimal actual,
		@Schema(description = "Actual minus forecast; positive means overspend.")
		BigDecimal variance,
		BigDecimal variancePercent
) {
}
