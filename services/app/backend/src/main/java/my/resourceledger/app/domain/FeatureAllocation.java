package my.resourceledger.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "feature_allocations")
public class FeatureAllocation {
	@Id
	@Column(name = "allocation_id")
	private UUID allocationId;

	@Column(name = "resource_id", nullable = false)
	private Long resourceId;

	@Column(name = "feature_id", nullable = false)
	private String featureId;

	@Column(name = "project_id", nullable = false)
	private String projectId;

	@Column(name = "allocated_hours", nullable = false)
	private BigDecimal allocatedHours;

	public UUID getAllocationId() {
		return allocationId;
	}

	public void setAllocationId(UUID allocationId) {
		this.allocationId = allocationId;
	}

	public Long getResourceId() {
		return resourceId;
	}

	public void setResourceId(Long resourceId) {
		this.resourceId = resourceId;
	}

	public String getFeatureId() {
		return featureId;
	}

	public void setFeatureId(String featureId) {
		this.featureId = featureId;
	}

	public String getProjectId() {
		return projectId;
	}

	public void setProjectId(String projectId) {
		this.projectId = projectId;
	}

	public BigDecimal getAllocatedHours() {
		return allocatedHours;
	}

	public void setAllocatedHours(BigDecimal allocatedHours) {
		this.allocatedHours = allocatedHours;
	}
}
