package my.resourceledger.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "financial_resources")
public class FinancialResource {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "resource_id")
	private Long resourceId;

	@Column(name = "roadmap_resource_id")
	private Integer roadmapResourceId;

	@Column(name = "resource_name", nullable = false)
	private String resourceName;

	@Column(name = "email")
	private String email;

	@Column(name = "work_area")
	private String workArea;

	@Column(name = "activity_type_cap")
	private String activityTypeCap;

	@Column(name = "activity_type_opx")
	private String activityTypeOpx;

	@Convert(converter = ContractTypeConverter.class)
	@Column(name = "contract_type")
	private ContractType contractType;

	@Column(name = "employee_id")
	private String employeeId;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

	public Long getResourceId() {
		return resourceId;
	}

	public void setResourceId(Long resourceId) {
		this.resourceId = resourceId;
	}

	public Integer getRoadmapResourceId() {
		return roadmapResourceId;
	}

	public void setRoadmapResourceId(Integer roadmapResourceId) {
		this.roadmapResourceId = roadmapResourceId;
	}

	public String getResourceName() {
		return resourceName;
	}

	public void setResourceName(String resourceName) {
		this.resourceName = resourceName;
	}

	public String getEmail() {
		return email;
	}

	public void setEmail(String email) {
		this.email = email;
	}

	public String getWorkArea() {
		return workArea;
	}

	public void setWorkArea(String workArea) {
		this.workArea = workArea;
	}

	public String getActivityTypeCap() {
		return activityTypeCap;
	}

	public void setActivityTypeCap(String activityTypeCap) {
		this.activityTypeCap = activityTypeCap;
	}

	public String getActivityTypeOpx() {
		return activityTypeOpx;
	}

	public void setActivityTypeOpx(String activityTypeOpx) {
		this.activityTypeOpx = activityTypeOpx;
	}

	public ContractType getContractType() {
		return contractType;
	}

	public void setContractType(ContractType contractType) {
		this.contractType = contractType;
	}

	public String getEmployeeId() {
		return employeeId;
	}

	public void setEmployeeId(String employeeId) {
		this.employeeId = employeeId;
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
