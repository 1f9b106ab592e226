package my.resourceledger.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;


@Entity
@Table(name = "financial_workstreams")
public class FinancialWorkstream {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "workstream_id")
	private Long workstreamId;

	@Column(name = "project_id", nullable = false)
	private String projectId;

	@Column(name = "workstream_name", nullable = false)
	private String workstreamName;

	@Column(name = "wbse", nullable = false)
	private String wbse;

	@Column(name = "wbse_desc")
	private String wbseDescription;

	public Long getWorkstreamId() {
		return workstreamId;
	}

	public void setWorkstreamId(Long workstreamId) {
		this.workstreamId = workstreamId;
	}

	public String getProjectId() {
		return projectId;
	}

	public void setProjectId(String projectId) {
		this.projectId = projectId;
	}

	public String getWorkstreamName() {
		return workstreamName;
	}

	public void setWorkstreamName(String workstreamName) {
		this.workstreamName = workstreamName;
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
}
