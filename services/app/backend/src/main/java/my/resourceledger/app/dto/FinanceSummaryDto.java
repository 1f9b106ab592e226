package my.resourceledger.app.dto;

import java.math.BigDecimal;

public record FinanceSummaryDto(BigDecimal totalBudget,
								BigDecimal totalForecast,
								BigDecimal totalActual,
								BigDecimal totalVariance,
								BigDecimal totalVariancePercent) {
}
