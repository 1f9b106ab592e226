package my.resourceledger.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;

@Entity
@Table(name = "project_financial_detail")
public class ProjectFinancialDetail {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "detail_id")
	private Long detailId;

	@Column(name = "project_id", nullable = false)
	private String projectId;

	@Column(name = "wbse", nullable = false)
	private String wbse;

	@Column(name = "wbse_desc")
	private String wbseDescription;

	@Column(name = "original_budget", nullable = false)
	private BigDecimal originalBudget;

	@Column(name = "forecast_budget", nullable = false)
	private BigDecimal forecastBudget;

	@Column(name = "actual_cost", nullable = false)
	private BigDecimal actualCost;

	public Long getDetailId() {
		return detailId;
	}

	public void setDetailId(Long detailId) {
		this.detailId = detailId;
	}

	public String getProjectId() {
		return projectId;
	}

	public void setProjectId(String projectId) {
		this.projectId = projectId;
	}

	public String getWbse() {
		return wbse;
	}

	public void setWbse(String wbse) {
		this.wbse = wbse;
	}

	public String getWbseDescription() {
		return wbseDescription;
	}

	public void setWbseDescription(String wbseDescription) {
		this.wbseDescription = wbseDescription;
	}

	public BigDecimal getOriginalBudget() {
		return originalBudget;
	}

	public void setOriginalBudget(BigDecimal originalBudget) {
		this.originalBudget = originalBudget;
	}

	public BigDecimal getForecastBudget() {
		return forecastBudget;
	}

	public void setForecastBudget(BigDecimal forecastBudget) {
		this.forecastBudget = forecastBudget;
	}

	public BigDecimal getActualCost() {
		return actualCost;
	}

	public void setActualCost(BigDecimal actualCost) {
		this.actualCost = actualCost;
	}
}
