package my.resourceledger.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "raw_actuals")
public class RawActualEntry {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "actual_id")
	private Long actualId;

	@Column(name = "period_month", nullable = false)
	private String month;

	@Column(name = "posting_date")
	private LocalDate postingDate;

	@Column(name = "document_date")
	private LocalDate documentDate;

	@Column(name = "cost_element", nullable = false)
	private String costElement;

	@Column(name = "cost_element_descr")
	private String costElementDescription;

	@Column(name = "wbs_element", nullable = false)
	private String wbsElement;

	@Column(name = "amount", nullable = false)
	private BigDecimal amount;

	@Column(name = "period")
	private Integer period;

	@Column(name = "fiscal_year")
	private Integer fiscalYear;

	@Column(name = "transaction_currency")
	private String transactionCurrency;

	@Column(name = "personnel_number")
	private String personnelNumber;

	@Column(name = "document_number")
	private String documentNumber;

	@Column(name = "name")
	private String name;

	@Convert(converter = ActualTypeConverter.class)
	@Column(name = "actual_type")
	private ActualType actualType;

	@Column(name = "imported_at", nullable = false)
	private LocalDateTime importedAt;

	@Column(name = "processed", nullable = false)
	private boolean processed;

	public Long getActualId() {
		return actualId;
	}

	public void setActualId(Long actualId) {
		this.actualId = actualId;
	}

	public String getMonth() {
		return month;
	}

	public void setMonth(String month) {
		this.month = month;
	}

	public LocalDate getPostingDate() {
		return postingDate;
	}

	public void setPostingDate(LocalDate postingDate) {
		this.postingDate = postingDate;
	}

	public LocalDate getDocumentDate() {
		return documentDate;
	}

	public void setDocumentDate(LocalDate documentDate) {
		this.documentDate = documentDate;
	}

	public String getCostElement() {
		return costElement;
	}

	public void setCostElement(String costElement) {
		this.costElement = costElement;
	}

	public String getCostElementDescription() {
		return costElementDescription;
	}

	public void setCostElementDescription(String costElementDescription) {
		this.costElementDescription = costElementDescription;
	}

	public String getWbsElement() {
		return wbsElement;
	}

	public void setWbsElement(String wbsElement) {
		this.wbsElement = wbsElement;
	}

	public BigDecimal getAmount() {
		return amount;
	}

	public void setAmount(BigDecimal amount) {
		this.amount = amount;
	}

	public Integer getPeriod() {
		return period;
	}

	public void setPeriod(Integer period) {
		this.period = period;
	}

	public Integer getFiscalYear() {
		return fiscalYear;
	}

	public void setFiscalYear(Integer fiscalYear) {
		this.fiscalYear = fiscalYear;
	}

	public String getTransactionCurrency() {
		return transactionCurrency;
	}

	public void setTransactionCurrency(String transactionCurrency) {
		this.transactionCurrency = transactionCurrency;
	}

	public String getPersonnelNumber() {
		return personnelNumber;
	}

	public void setPersonnelNumber(String personnelNumber) {
		this.personnelNumber = personnelNumber;
	}

	public String getDocumentNumber() {
		return documentNumber;
	}

	public void setDocumentNumber(String documentNumber) {
		this.documentNumber = documentNumber;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public ActualType getActualType() {
		return actualType;
	}

	public void setActualType(ActualType actualType) {
		this.actualType = actualType;
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
