package my.resourceledger.app.service;

import my.resourceledger.app.domain.FeatureAllocation;
import my.resourceledger.app.domain.FinancialResource;
import my.resourceledger.app.domain.FinancialWorkstream;
import my.resourceledger.app.domain.LabourRate;
import my.resourceledger.app.domain.ProjectFinancialDetail;
import my.resourceledger.app.dto.FinanceLedgerRowDto;
import my.resourceledger.app.dto.FinanceSummaryDto;
import my.resourceledger.app.repository.FeatureAllocationRepository;
import my.resourceledger.app.repository.FinancialResourceRepository;
import my.resourceledger.app.repository.FinancialWorkstreamRepository;
import my.resourceledger.app.repository.LabourRateRepository;
import my.resourceledger.app.repository.ProjectFinancialDetailRepository;
import my.resourceledger.app.repository.RawActualEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reconciles workstream budgets with labour-priced forecasts and booked actuals.
 */
@Service
public class FinanceLedgerService {
	private static final Logger logger = LoggerFactory.getLogger(FinanceLedgerService.class);
	private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);
	private static final int PERCENT_SCALE = 2;
	private static final String PROJECT_TOTAL = "Project Total";
	private static final Pattern YEAR_DIGITS = Pattern.compile("\\d{1,9}");

	private final FinancialWorkstreamRepository workstreamRepository;
	private final ProjectFinancialDetailRepository projectDetailRepository;
	private final FeatureAllocationRepository allocationRepository;
	private final FinancialResourceRepository resourceRepository;
	private final LabourRateRepository labourRateRepository;
	private final RawActualEntryRepository actualRepository;

	public FinanceLedgerService(FinancialWorkstreamRepository workstreamRepository,
								ProjectFinancialDetailRepository projectDetailRepository,
								FeatureAllocationRepository allocationRepository,
								FinancialResourceRepository resourceRepository,
								LabourRateRepository labourRateRepository,
								RawActualEntryRepository actualRepository) {
		this.workstreamRepository = workstreamRepository;
		this.projectDetailRepository = projectDetailRepository;
		this.allocationRepository = allocationRepository;
		this.resourceRepository = resourceRepository;
		this.labourRateRepository = labourRateRepository;
		this.actualRepository = actualRepository;
	}

	/**
	 * One row per workstream ordered by name. Without workstreams for the given project the
	 * project's stored financial detail becomes a single row.
	 */
	@Transactional(readOnly = true)
	public List<FinanceLedgerRowDto> getFinanceLedger(String projectId, String month) {
		try {
			List<FinancialWorkstream> workstreams = projectId == null
					? workstreamRepository.findAllByOrderByWorkstreamNameAsc()
					: workstreamRepository.findByProjectIdOrderByWorkstreamNameAsc(projectId);

			List<FinanceLedgerRowDto> rows = new ArrayList<>();
			if (!workstreams.isEmpty()) {
				Map<String, BigDecimal> hourlyRates = latestHourlyRates();
				Map<String, Optional<ProjectFinancialDetail>> details = new HashMap<>();
				for (FinancialWorkstream workstream : workstreams) {
					Optional<ProjectFinancialDetail> detail = details.computeIfAbsent(
							workstream.getProjectId(), projectDetailRepository::findByProjectId);
					rows.add(ledgerRow(workstream, detail.orElse(null), hourlyRates, month));
				}
			} else if (projectId != null) {
				projectDetailRepository.findByProjectId(projectId)
						.map(this::projectTotalRow)
						.ifPresent(rows::add);
			}
			return rows;
		} catch (DataAccessException ex) {
			logger.error("Failed to read finance ledger for project={} month={}", projectId, month, ex);
			throw new FinanceLedgerException(
					"Failed to calculate finance ledger for project " + projectId + " and month " + month, ex);
		}
	}

	/**
	 * Totals of the ledger rows; the percent is recomputed from the totals, not averaged.
	 */
	@Transactional(readOnly = true)
	public FinanceSummaryDto getFinanceSummary(String projectId, String month) {
		BigDecimal budget = BigDecimal.ZERO;
		BigDecimal forecast = BigDecimal.ZERO;
		BigDecimal actual = BigDecimal.ZERO;
		BigDecimal variance = BigDecimal.ZERO;
		for (FinanceLedgerRowDto row : getFinanceLedger(projectId, month)) {
			budget = budget.add(row.budget());
			forecast = forecast.add(row.forecast());
			actual = actual.add(row.actual());
			variance = variance.add(row.variance());
		}
		return new FinanceSummaryDto(budget, forecast, actual, variance, percentOf(variance, forecast));
	}

	@Transactional(readOnly = true)
	public Optional<FinanceLedgerRowDto> getWorkstreamFinance(String wbse) {
		return getFinanceLedger(null, null).stream()
				.filter(row -> row.wbse().equals(wbse))
				.findFirst();
	}

	@Transactional(readOnly = true)
	public List<String> getAvailableMonths() {
		try {
			return actualRepository.findDistinctMonths();
		} catch (DataAccessException ex) {
			throw new FinanceLedgerException("Failed to read available months", ex);
		}
	}

	private FinanceLedgerRowDto ledgerRow(FinancialWorkstream workstream,
										  ProjectFinancialDetail detail,
										  Map<String, BigDecimal> hourlyRates,
										  String month) {
		String wbse = workstream.getWbse();
		BigDecimal forecast = labourForecast(wbse, hourlyRates);
		if (forecast.signum() == 0 && detail != null && detail.getForecastBudget() != null) {
			forecast = detail.getForecastBudget();
		}
		BigDecimal actual = month == null
				? actualRepository.sumAmountByWbse(wbse)
				: actualRepository.sumAmountByWbseAndMonth(wbse, month);
		actual = nullToZero(actual);
		BigDecimal budget = detail == null ? BigDecimal.ZERO : nullToZero(detail.getOriginalBudget());
		BigDecimal variance = actual.subtract(forecast);
		return new FinanceLedgerRowDto(workstream.getWorkstreamName(), wbse, budget, forecast, actual, variance,
				percentOf(variance, forecast));
	}

	private FinanceLedgerRowDto projectTotalRow(ProjectFinancialDetail detail) {
		BigDecimal forecast = nullToZero(detail.getForecastBudget());
		BigDecimal actual = nullToZero(detail.getActualCost());
		BigDecimal variance = actual.subtract(forecast);
		String name = detail.getWbseDescription() == null || detail.getWbseDescription().isBlank()
				? PROJECT_TOTAL
				: detail.getWbseDescription();
		return new FinanceLedgerRowDto(name, detail.getWbse(), nullToZero(detail.getOriginalBudget()), forecast, actual,
				variance, percentOf(variance, forecast));
	}

	/**
	 * Prices the allocations of every project that owns the WBSE. The CAP activity type's
	 * rate wins over the OPX one; allocations without any rate add nothing.
	 */
	private BigDecimal labourForecast(String wbse, Map<String, BigDecimal> hourlyRates) {
		Set<String> projectIds = workstreamRepository.findByWbse(wbse).stream()
				.map(FinancialWorkstream::getProjectId)
				.collect(Collectors.toSet());
		if (projectIds.isEmpty()) {
			return BigDecimal.ZERO;
		}
		List<FeatureAllocation> allocations = allocationRepository.findByProjectIdIn(projectIds);
		if (allocations.isEmpty()) {
			return BigDecimal.ZERO;
		}
		Set<Long> resourceIds = allocations.stream().map(FeatureAllocation::getResourceId).collect(Collectors.toSet());
		Map<Long, FinancialResource> resources = resourceRepository.findAllById(resourceIds).stream()
				.collect(Collectors.toMap(FinancialResource::getResourceId, Function.identity()));

		BigDecimal forecast = BigDecimal.ZERO;
		for (FeatureAllocation allocation : allocations) {
			FinancialResource resource = resources.get(allocation.getResourceId());
			if (resource == null || allocation.getAllocatedHours() == null) {
				continue;
			}
			BigDecimal rate = hourlyRates.get(resource.getActivityTypeCap());
			if (rate == null) {
				rate = hourlyRates.get(resource.getActivityTypeOpx());
			}
			if (rate != null) {
				forecast = forecast.add(allocation.getAllocatedHours().multiply(rate));
			}
		}
		return forecast;
	}

	private Map<String, BigDecimal> latestHourlyRates() {
		List<LabourRate> newestFirst = new ArrayList<>(labourRateRepository.findAll());
		newestFirst.sort(Comparator.comparingInt((LabourRate rate) -> fiscalYearNumber(rate.getFiscalYear())).reversed());
		Map<String, BigDecimal> rates = new HashMap<>();
		for (LabourRate rate : newestFirst) {
			rates.putIfAbsent(rate.getActivityType(), rate.getHourlyRate());
		}
		return rates;
	}

	/**
	 * First run of digits in a fiscal-year label ({@code FY9} is 9, {@code FY2025} is 2025),
	 * or -1 when the label has none.
	 */
	static int fiscalYearNumber(String fiscalYear) {
		if (fiscalYear == null) {
			return -1;
		}
		Matcher digits = YEAR_DIGITS.matcher(fiscalYear);
		return digits.find() ? Integer.parseInt(digits.group()) : -1;
	}

	static BigDecimal percentOf(BigDecimal variance, BigDecimal forecast) {
		if (forecast.signum() == 0) {
			return BigDecimal.ZERO.setScale(PERCENT_SCALE);
		}
		return variance.multiply(ONE_HUNDRED).divide(forecast, PERCENT_SCALE, RoundingMode.HALF_UP);
	}

	private static BigDecimal nullToZero(BigDecimal value) {
		return value == null ? BigDecimal.ZERO : value;
	}
}
