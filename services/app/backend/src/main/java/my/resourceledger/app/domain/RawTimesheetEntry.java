package my.resourceledger.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "raw_timesheets")
public class RawTimesheetEntry {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "timesheet_id")
	private Long timesheetId;

	@Column(name = "stream", nullable = false)
	private String stream;

	@Column(name = "period_month", nullable = false)
	private String month;

	@Column(name = "sender_cost_center")
	private String senderCostCenter;

	@Column(name = "employee_name", nullable = false)
	private String employeeName;

	@Column(name = "personnel_number")
	private String personnelNumber;

	@Column(name = "work_date", nullable = false)
	private LocalDate workDate;

	@Column(name = "activity_type", nullable = false)
	private String activityType;

	@Column(name = "general_receiver", nullable = false)
	private String generalReceiver;

	@Column(name = "acct_assignment_text")
	private String accountAssignmentText;

	@Column(name = "hours", nullable = false)
	private BigDecimal hours;

	@Column(name = "internal_uom")
	private String internalUom;

	@Column(name = "att_absence_type")
	private String absenceType;

	@Column(name = "object_description")
	private String objectDescription;

	@Column(name = "resource_id")
	private Long resourceId;

	@Column(name = "imported_at", nullable = false)
	private LocalDateTime importedAt;

	@Column(name = "processed", nullable = false)
	private boolean processed;

	public Long getTimesheetId() {
		return timesheetId;
	}

	public void setTimesheetId(Long timesheetId) {
		this.timesheetId = timesheetId;
	}

	public String getStream() {
		return stream;
	}

	public void setStream(String stream) {
		this.stream = stream;
	}

	public String getMonth() {
		return month;
	}

	public void setMonth(String month) {
		this.month = month;
	}

	public String getSenderCostCenter() {
		return senderCostCenter;
	}

	public void setSenderCostCenter(String senderCostCenter) {
		this.senderCostCenter = senderCostCenter;
	}

	public String getEmployeeName() {
		return employeeName;
	}

	public void setEmployeeName(String employeeName) {
		this.employeeName = employeeName;
	}

	public String getPersonnelNumber() {
		return personnelNumber;
	}

	public void setPersonnelNumber(String personnelNumber) {
		this.personnelNumber = personnelNumber;
	}

	public LocalDate getWorkDate() {
		return workDate;
	}

	public void setWorkDate(LocalDate workDate) {
		this.workDate = workDate;
	}

	public String getActivityType() {
		return activityType;
	}

	public void setActivityType(String activityType) {
		this.activityType = activityType;
	}

	public String getGeneralReceiver() {
		return generalReceiver;
	}

	public void setGeneralReceiver(String generalReceiver) {
		this.generalReceiver = generalReceiver;
	}

	public String getAccountAssignmentText() {
		return accountAssignmentText;
	}

	public void setAccountAssignmentText(String accountAssignmentText) {
		this.accountAssignmentText = accountAssignmentText;
	}

	public BigDecimal getHours() {
		return hours;
	}

	public void setHours(BigDecimal hours) {
		this.hours = hours;
	}

	public String getInternalUom() {
		return internalUom;
	}

	public void setInternalUom(String internalUom) {
		this.internalUom = internalUom;
	}

	public String getAbsenceType() {
		return absenceType;
	}

	public void setAbsenceType(String absenceType) {
		this.absenceType = absenceType;
	}

	public String getObjectDescription() {
		return objectDescription;
	}

	public void setObjectDescription(String objectDescription) {
		this.objectDescription = objectDescription;
	}

	public Long getResourceId() {
		return resourceId;
	}

	public void setResourceId(Long resourceId) {
		this.resourceId = resourceId;
	}

	public LocalDateTime getImportedAt() {
		return importedAt;
	}

	public void setImportedAt(LocalDateTime importedAt) {
		this.importedAt = importedAt;
	}

	public boolean isProcessed() {
		return processed;
	}

	public void setProcessed(boolean processed) {
		this.processed = processed;
	}
}
