package my.resourceledger.app.service;

import my.resourceledger.app.config.AppProperties;
import my.resourceledger.app.domain.FeatureAllocation;
import my.resourceledger.app.domain.FinancialResource;
import my.resourceledger.app.domain.FinancialWorkstream;
import my.resourceledger.app.domain.ProjectFinancialDetail;
import my.resourceledger.app.domain.ResourceCommitment;
import my.resourceledger.app.domain.VarianceSeverity;
import my.resourceledger.app.domain.VarianceType;
import my.resourceledger.app.dto.VarianceCheckDto;
import my.resourceledger.app.repository.FeatureAllocationRepository;
import my.resourceledger.app.repository.FinancialResourceRepository;
import my.resourceledger.app.repository.FinancialWorkstreamRepository;
import my.resourceledger.app.repository.ProjectFinancialDetailRepository;
import my.resourceledger.app.repository.RawTimesheetEntryRepository;
import my.resourceledger.app.repository.ResourceCommitmentRepository;
import my.resourceledger.app.repository.ResourceReceiverHours;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Threshold checks over booked hours, allocations, commitments and project cost. Results are
 * computed on each call and not stored.
 */
@Service
public class VarianceDetectionService {
	private static final Logger logger = LoggerFactory.getLogger(VarianceDetectionService.class);
	private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);
	private static final BigDecimal HIGH_OVER_COMMITMENT = BigDecimal.valueOf(25);
	private static final BigDecimal CRITICAL_OVER_COMMITMENT = BigDecimal.valueOf(50);
	private static final BigDecimal MEDIUM_FACTOR = new BigDecimal("1.5");
	private static final BigDecimal HIGH_FACTOR = BigDecimal.valueOf(2);
	private static final BigDecimal CRITICAL_FACTOR = BigDecimal.valueOf(3);
	private static final int RATIO_SCALE = 10;
	private static final int PERCENT_SCALE = 2;
	private static final String RESOURCE = "resource";
	private static final String PROJECT = "project";

	private final ResourceCommitmentRepository commitmentRepository;
	private final FeatureAllocationRepository allocationRepository;
	private final RawTimesheetEntryRepository timesheetRepository;
	private final FinancialResourceRepository resourceRepository;
	private final FinancialWorkstreamRepository workstreamRepository;
	private final ProjectFinancialDetailRepository projectDetailRepository;
	private final BigDecimal hoursThreshold;
	private final BigDecimal costThreshold;

	public VarianceDetectionService(ResourceCommitmentRepository commitmentRepository,
									FeatureAllocationRepository allocationRepository,
									RawTimesheetEntryRepository timesheetRepository,
									FinancialResourceRepository resourceRepository,
									FinancialWorkstreamRepository workstreamRepository,
									ProjectFinancialDetailRepository projectDetailRepository,
									AppProperties properties) {
		this.commitmentRepository = commitmentRepository;
		this.allocationRepository = allocationRepository;
		this.timesheetRepository = timesheetRepository;
		this.resourceRepository = resourceRepository;
		this.workstreamRepository = workstreamRepository;
		this.projectDetailRepository = projectDetailRepository;
		this.hoursThreshold = properties.variance().hoursPercent();
		this.costThreshold = properties.variance().costPercent();
	}

	@Transactional(readOnly = true)
	public List<VarianceCheckDto> detectAllVariances() {
		List<VarianceCheckDto> checks = new ArrayList<>();
		checks.addAll(detectTimesheetNoAllocation());
		checks.addAll(detectAllocationVariances());
		checks.addAll(detectCapacityExceeded());
		checks.addAll(detectCostVariances());
		logger.info("Variance detection found {} checks", checks.size());
		return checks;
	}

	/**
	 * Resources that booked hours to a project's WBSE without holding an allocation on that
	 * project. Hours on receivers that belong to no known project are not attributed.
	 */
	@Transactional(readOnly = true)
	public List<VarianceCheckDto> detectTimesheetNoAllocation() {
		Map<ResourceProject, BigDecimal> booked = bookedHours();
		Map<ResourceProject, BigDecimal> allocated = allocatedHours();
		Map<Long, String> names = resourceNames(booked.keySet().stream().map(ResourceProject::resourceId).toList());

		List<VarianceCheckDto> checks = new ArrayList<>();
		booked.forEach((key, hours) -> {
			if (allocated.containsKey(key)) {
				return;
			}
			checks.add(new VarianceCheckDto(
					VarianceType.TIMESHEET_NO_ALLOCATION,
					VarianceSeverity.MEDIUM,
					RESOURCE,
					String.valueOf(key.resourceId()),
					"Resource " + nameOf(names, key.resourceId()) + " booked " + hours.stripTrailingZeros().toPlainString()
							+ " hours to project " + key.projectId() + " without allocation",
					BigDecimal.ZERO,
					hours,
					null));
		});
		return checks;
	}

	/**
	 * Allocations whose booked hours deviate from the allocated hours by more than the hours
	 * threshold, compared per resource and project.
	 */
	@Transactional(readOnly = true)
	public List<VarianceCheckDto> detectAllocationVariances() {
		Map<ResourceProject, BigDecimal> allocated = allocatedHours();
		Map<ResourceProject, BigDecimal> booked = bookedHours();
		Map<Long, String> names = resourceNames(allocated.keySet().stream().map(ResourceProject::resourceId).toList());

		List<VarianceCheckDto> checks = new ArrayList<>();
		allocated.forEach((key, planned) -> {
			if (planned.signum() == 0) {
				return;
			}
			BigDecimal actual = booked.getOrDefault(key, BigDecimal.ZERO);
			BigDecimal percent = deviationPercent(actual, planned);
			if (percent.compareTo(hoursThreshold) <= 0) {
				return;
			}
			checks.add(new VarianceCheckDto(
					VarianceType.ALLOCATION_VARIANCE,
					severityFor(percent, hoursThreshold),
					RESOURCE,
					String.valueOf(key.resourceId()),
					nameOf(names, key.resourceId()) + " has " + oneDecimal(percent) + "% hours variance on project "
							+ key.projectId(),
					planned,
					actual,
					percent.setScale(PERCENT_SCALE, RoundingMode.HALF_UP)));
		});
		return checks;
	}

	/**
	 * Commitments whose allocated hours exceed their total available hours.
	 */
	@Transactional(readOnly = true)
	public List<VarianceCheckDto> detectCapacityExceeded() {
		List<ResourceCommitment> overAllocated = commitmentRepository.findOverAllocated();
		Map<Long, String> names = resourceNames(overAllocated.stream().map(ResourceCommitment::getResourceId).toList());

		List<VarianceCheckDto> checks = new ArrayList<>();
		for (ResourceCommitment commitment : overAllocated) {
			BigDecimal total = commitment.getTotalAvailableHours();
			BigDecimal allocated = commitment.getAllocatedHours();
			BigDecimal overPercent = total.signum() == 0
					? null
					: allocated.subtract(total).multiply(ONE_HUNDRED).divide(total, RATIO_SCALE, RoundingMode.HALF_UP);

			VarianceSeverity severity;
			if (overPercent == null || overPercent.compareTo(CRITICAL_OVER_COMMITMENT) > 0) {
				severity = VarianceSeverity.CRITICAL;
			} else if (overPercent.compareTo(HIGH_OVER_COMMITMENT) > 0) {
				severity = VarianceSeverity.HIGH;
			} else {
				severity = VarianceSeverity.MEDIUM;
			}
			String overBy = overPercent == null
					? allocated.stripTrailingZeros().toPlainString() + " hours with no available capacity"
					: oneDecimal(overPercent) + "%";
			checks.add(new VarianceCheckDto(
					VarianceType.CAPACITY_EXCEEDED,
					severity,
					RESOURCE,
					String.valueOf(commitment.getResourceId()),
					nameOf(names, commitment.getResourceId()) + " is over-committed by " + overBy,
					total,
					allocated,
					overPercent == null ? null : overPercent.setScale(PERCENT_SCALE, RoundingMode.HALF_UP)));
		}
		return checks;
	}

	/**
	 * Projects with booked cost whose actual cost deviates from the forecast budget by more
	 * than the cost threshold. Projects without a forecast are not evaluated.
	 */
	@Transactional(readOnly = true)
	public List<VarianceCheckDto> detectCostVariances() {
		List<VarianceCheckDto> checks = new ArrayList<>();
		for (ProjectFinancialDetail detail : projectDetailRepository.findByActualCostGreaterThanOrderByProjectIdAsc(BigDecimal.ZERO)) {
			BigDecimal forecast = detail.getForecastBudget();
			if (forecast == null || forecast.signum() == 0) {
				continue;
			}
			BigDecimal percent = deviationPercent(detail.getActualCost(), forecast);
			if (percent.compareTo(costThreshold) <= 0) {
				continue;
			}
			checks.add(new VarianceCheckDto(
					VarianceType.COST_VARIANCE,
					severityFor(percent, costThreshold),
					PROJECT,
					detail.getProjectId(),
					detail.getProjectId() + " has " + oneDecimal(percent) + "% cost variance",
					forecast,
					detail.getActualCost(),
					percent.setScale(PERCENT_SCALE, RoundingMode.HALF_UP)));
		}
		return checks;
	}

	static VarianceSeverity severityFor(BigDecimal percent, BigDecimal threshold) {
		if (percent.compareTo(threshold.multiply(CRITICAL_FACTOR)) > 0) {
			return VarianceSeverity.CRITICAL;
		}
		if (percent.compareTo(threshold.multiply(HIGH_FACTOR)) > 0) {
			return VarianceSeverity.HIGH;
		}
		if (percent.compareTo(threshold.multiply(MEDIUM_FACTOR)) > 0) {
			return VarianceSeverity.MEDIUM;
		}
		return VarianceSeverity.LOW;
	}

	private static BigDecimal deviationPercent(BigDecimal actual, BigDecimal expected) {
		return actual.subtract(expected).abs().multiply(ONE_HUNDRED).divide(expected.abs(), RATIO_SCALE, RoundingMode.HALF_UP);
	}

	private static String oneDecimal(BigDecimal percent) {
		return percent.setScale(1, RoundingMode.HALF_UP).toPlainString();
	}

	private Map<ResourceProject, BigDecimal> allocatedHours() {
		Map<ResourceProject, BigDecimal> allocated = new LinkedHashMap<>();
		for (FeatureAllocation allocation : allocationRepository.findAll()) {
			allocated.merge(new ResourceProject(allocation.getResourceId(), allocation.getProjectId()),
					allocation.getAllocatedHours(), BigDecimal::add);
		}
		return allocated;
	}

	private Map<ResourceProject, BigDecimal> bookedHours() {
		Map<String, Set<String>> projects = projectsByWbse();
		Map<ResourceProject, BigDecimal> booked = new LinkedHashMap<>();
		for (ResourceReceiverHours row : timesheetRepository.sumHoursByResourceAndReceiver()) {
			for (String projectId : projects.getOrDefault(row.generalReceiver(), Set.of())) {
				booked.merge(new ResourceProject(row.resourceId(), projectId), row.hours(), BigDecimal::add);
			}
		}
		return booked;
	}

	private Map<String, Set<String>> projectsByWbse() {
		Map<String, Set<String>> projects = new HashMap<>();
		for (FinancialWorkstream workstream : workstreamRepository.findAll()) {
			projects.computeIfAbsent(workstream.getWbse(), wbse -> new TreeSet<>()).add(workstream.getProjectId());
		}
		for (ProjectFinancialDetail detail : projectDetailRepository.findAll()) {
			projects.computeIfAbsent(detail.getWbse(), wbse -> new TreeSet<>()).add(detail.getProjectId());
		}
		return projects;
	}

	private Map<Long, String> resourceNames(Collection<Long> resourceIds) {
		if (resourceIds.isEmpty()) {
			return Map.of();
		}
		return resourceRepository.findAllById(Set.copyOf(resourceIds)).stream()
				.collect(Collectors.toMap(FinancialResource::getResourceId, FinancialResource::getResourceName));
	}

	private static String nameOf(Map<Long, String> names, Long resourceId) {
		return names.getOrDefault(resourceId, String.valueOf(resourceId));
	}

	private record ResourceProject(Long resourceId, String projectId) {
	}
}
