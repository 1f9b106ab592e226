package my.resourceledger.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "resource_commitments")
public class ResourceCommitment {
	@Id
	@Column(name = "commitment_id")
	private UUID commitmentId;

	@Column(name = "resource_id", nullable = false)
	private Long resourceId;

	@Column(name = "period_start", nullable = false)
	private LocalDate periodStart;

	@Column(name = "period_end", nullable = false)
	private LocalDate periodEnd;

	@Enumerated(EnumType.STRING)
	@Column(name = "cadence", nullable = false)
	private CommitmentCadence cadence;

	@Column(name = "committed_hours", nullable = false)
	private BigDecimal committedHours;

	@Column(name = "total_available_hours", nullable = false)
	private BigDecimal totalAvailableHours;

	@Column(name = "allocated_hours", nullable = false)
	private BigDecimal allocatedHours;

	@Column(name = "remaining_capacity", nullable = false)
	private BigDecimal remainingCapacity;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

	public UUID getCommitmentId() {
		return commitmentId;
	}

	public void setCommitmentId(UUID commitmentId) {
		this.commitmentId = commitmentId;
	}

	public Long getResourceId() {
		return resourceId;
	}

	public void setResourceId(Long resourceId) {
		this.resourceId = resourceId;
	}

	public LocalDate getPeriodStart() {
		return periodStart;
	}

	public void setPeriodStart(LocalDate periodStart) {
		this.periodStart = periodStart;
	}

	public LocalDate getPeriodEnd() {
		return periodEnd;
	}

	public void setPeriodEnd(LocalDate periodEnd) {
		this.periodEnd = periodEnd;
	}

	public CommitmentCadence getCadence() {
		return cadence;
	}

	public void setCadence(CommitmentCadence cadence) {
		this.cadence = cadence;
	}

	public BigDecimal getCommittedHours() {
		return committedHours;
	}

	public void setCommittedHours(BigDecimal committedHours) {
		this.committedHours = committedHours;
	}

	public BigDecimal getTotalAvailableHours() {
		return totalAvailableHours;
	}

	public void setTotalAvailableHours(BigDecimal totalAvailableHours) {
		this.totalAvailableHours = totalAvailableHours;
	}

	public BigDecimal getAllocatedHours() {
		return allocatedHours;
	}

	public void setAllocatedHours(BigDecimal allocatedHours) {
		this.allocatedHours = allocatedHours;
	}

	public BigDecimal getRemainingCapacity() {
		return remainingCapacity;
	}

	public void setRemainingCapacity(BigDecimal remainingCapacity) {
		this.remainingCapacity = remainingCapacity;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}

	public LocalDateTime getUpdatedAt() {
		return updatedAt;
	}

	public void setUpdatedAt(LocalDateTime updatedAt) {
		this.updatedAt = updatedAt;
	}
}
