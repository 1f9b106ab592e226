package my.resourceledger.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "labour_rates")
public class LabourRate {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "rate_id")
	private Long rateId;

	@Column(name = "band", nullable = false)
	private String band;

	@Column(name = "local_band")
	private String localBand;

	@Column(name = "activity_type", nullable = false)
	private String activityType;

	@Column(name = "fiscal_year", nullable = false)
	private String fiscalYear;

	@Column(name = "hourly_rate", nullable = false)
	private BigDecimal hourlyRate;

	@Column(name = "daily_rate", nullable = false)
	private BigDecimal dailyRate;

	@Column(name = "uplift_amount")
	private BigDecimal upliftAmount;

	@Column(name = "uplift_percent")
	private BigDecimal upliftPercent;

	@Column(name = "imported_at", nullable = false)
	private LocalDateTime importedAt;

	public Long getRateId() {
		return rateId;
	}

	public void setRateId(Long rateId) {
		this.rateId = rateId;
	}

	public String getBand() {
		return band;
	}

	public void setBand(String band) {
		this.band = band;
	}

	public String getLocalBand() {
		return localBand;
	}

	public void setLocalBand(String localBand) {
		this.localBand = localBand;
	}

	public String getActivityType() {
		return activityType;
	}

	public void setActivityType(String activityType) {
		this.activityType = activityType;
	}

	public String getFiscalYear() {
		return fiscalYear;
	}

	public void setFiscalYear(String fiscalYear) {
		this.fiscalYear = fiscalYear;
	}

	public BigDecimal getHourlyRate() {
		return hourlyRate;
	}

	public void setHourlyRate(BigDecimal hourlyRate) {
		this.hourlyRate = hourlyRate;
	}

	public BigDecimal getDailyRate() {
		return dailyRate;
	}

	public void setDailyRate(BigDecimal dailyRate) {
		this.dailyRate = dailyRate;
	}

	public BigDecimal getUpliftAmount() {
		return upliftAmount;
	}

	public void setUpliftAmount(BigDecimal upliftAmount) {
		this.upliftAmount = upliftAmount;
	}

	public BigDecimal getUpliftPercent() {
		return upliftPercent;
	}

	public void setUpliftPercent(BigDecimal upliftPercent) {
		this.upliftPercent = upliftPercent;
	}

	public LocalDateTime getImportedAt() {
		return importedAt;
	}

	public void setImportedAt(LocalDateTime importedAt) {
		this.importedAt = importedAt;
	}
}
