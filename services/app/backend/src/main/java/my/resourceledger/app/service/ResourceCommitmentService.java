package my.resourceledger.app.service;

import my.resourceledger.app.config.AppProperties;
import my.resourceledger.app.domain.CommitmentCadence;
import my.resourceledger.app.domain.FinancialResource;
import my.resourceledger.app.domain.ResourceCommitment;
import my.resourceledger.app.domain.UtilizationStatus;
import my.resourceledger.app.dto.CapacityCalculationDto;
import my.resourceledger.app.dto.CapacityReportDto;
import my.resourceledger.app.dto.CommitmentCreateRequest;
import my.resourceledger.app.dto.CommitmentDto;
import my.resourceledger.app.dto.SkippedCapacityDto;
import my.resourceledger.app.repository.FeatureAllocationRepository;
import my.resourceledger.app.repository.FinancialResourceRepository;
import my.resourceledger.app.repository.RawTimesheetEntryRepository;
import my.resourceledger.app.repository.ResourceCommitmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Service
public class ResourceCommitmentService {
	private static final Logger logger = LoggerFactory.getLogger(ResourceCommitmentService.class);
	private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);
	private static final int HOURS_SCALE = 2;
	private static final int RATIO_SCALE = 10;

	private final ResourceCommitmentRepository commitmentRepository;
	private final FeatureAllocationRepository allocationRepository;
	private final RawTimesheetEntryRepository timesheetRepository;
	private final FinancialResourceRepository resourceRepository;
	private final WorkingDayCalendarService calendarService;
	private final BigDecimal underUtilizedBelow;
	private final BigDecimal overCommittedAbove;

	public ResourceCommitmentService(ResourceCommitmentRepository commitmentRepository,
									 FeatureAllocationRepository allocationRepository,
									 RawTimesheetEntryRepository timesheetRepository,
									 FinancialResourceRepository resourceRepository,
									 WorkingDayCalendarService calendarService,
									 AppProperties properties) {
		this.commitmentRepository = commitmentRepository;
		this.allocationRepository = allocationRepository;
		this.timesheetRepository = timesheetRepository;
		this.resourceRepository = resourceRepository;
		this.calendarService = calendarService;
		this.underUtilizedBelow = properties.capacity().underUtilizedBelow();
		this.overCommittedAbove = properties.capacity().overCommittedAbove();
	}

	/**
	 * Stores a commitment whose total available hours are the committed hours scaled to the
	 * working days of the period. Allocation starts at zero.
	 */
	@Transactional
	public CommitmentDto createCommitment(CommitmentCreateRequest request) {
		CommitmentCadence cadence = CommitmentCadence.fromCode(request.cadence());
		if (request.periodEnd().isBefore(request.periodStart())) {
			throw new IllegalArgumentException("periodEnd must not be before periodStart");
		}
		if (request.committedHours().signum() < 0) {
			throw new IllegalArgumentException("committedHours must not be negative");
		}
		if (!resourceRepository.existsById(request.resourceId())) {
			throw new IllegalArgumentException("Unknown resource: " + request.resourceId());
		}

		int workingDays = calendarService.workingDaysBetween(request.periodStart(), request.periodEnd());
		BigDecimal total = totalAvailableHours(request.committedHours(), cadence, workingDays);
		LocalDateTime now = LocalDateTime.now();

		ResourceCommitment commitment = new ResourceCommitment();
		commitment.setCommitmentId(UUID.randomUUID());
		commitment.setResourceId(request.resourceId());
		commitment.setPeriodStart(request.periodStart());
		commitment.setPeriodEnd(request.periodEnd());
		commitment.setCadence(cadence);
		commitment.setCommittedHours(request.committedHours());
		commitment.setTotalAvailableHours(total);
		commitment.setAllocatedHours(BigDecimal.ZERO);
		commitment.setRemainingCapacity(total);
		commitment.setCreatedAt(now);
		commitment.setUpdatedAt(now);
		ResourceCommitment saved = commitmentRepository.save(commitment);
		logger.info("Created {} commitment for resource {}: {} working days, {} hours available",
				cadence.code(), request.resourceId(), workingDays, total);
		return CommitmentDto.from(saved);
	}

	/**
	 * Recomputes allocated hours from the resource's feature allocations and applies them to
	 * every commitment of the resource.
	 */
	@Transactional
	public List<CommitmentDto> updateAllocatedHoursForResource(Long resourceId) {
		BigDecimal allocated = nullToZero(allocationRepository.sumAllocatedHours(resourceId));
		LocalDateTime now = LocalDateTime.now();
		List<ResourceCommitment> commitments = commitmentRepository.findByResourceId(resourceId);
		for (ResourceCommitment commitment : commitments) {
			commitment.setAllocatedHours(allocated);
			commitment.setRemainingCapacity(commitment.getTotalAvailableHours().subtract(allocated));
			commitment.setUpdatedAt(now);
		}
		commitmentRepository.saveAll(commitments);
		logger.debug("Applied {} allocated hours to {} commitments of resource {}", allocated, commitments.size(), resourceId);
		return commitments.stream().map(CommitmentDto::from).toList();
	}

	@Transactional(readOnly = true)
	public CapacityCalculationDto getCapacityCalculation(Long resourceId, LocalDate periodStart, LocalDate periodEnd) {
		if (resourceId == null || periodStart == null || periodEnd == null) {
			throw new IllegalArgumentException("resourceId, periodStart and periodEnd are required");
		}
		ResourceCommitment commitment = commitmentRepository.findOverlapping(resourceId, periodStart, periodEnd).stream()
				.findFirst()
				.orElseThrow(() -> new NoCommitmentFoundException(resourceId, periodStart, periodEnd));

		BigDecimal actualHours = nullToZero(timesheetRepository.sumHoursForResource(resourceId, periodStart, periodEnd));
		BigDecimal total = commitment.getTotalAvailableHours();
		// status is taken from the unrounded quotient, only the reported figure is rounded
		BigDecimal utilization = total.signum() == 0
				? BigDecimal.ZERO
				: actualHours.multiply(ONE_HUNDRED).divide(total, RATIO_SCALE, RoundingMode.HALF_UP);

		String resourceName = resourceRepository.findById(resourceId)
				.map(FinancialResource::getResourceName)
				.orElse(String.valueOf(resourceId));

		return new CapacityCalculationDto(
				resourceId,
				resourceName,
				periodStart,
				periodEnd,
				total,
				commitment.getAllocatedHours(),
				actualHours,
				commitment.getRemainingCapacity(),
				utilization.setScale(HOURS_SCALE, RoundingMode.HALF_UP),
				statusFor(utilization)
		);
	}

	/**
	 * Evaluates each resource's most recently created commitment over its own period.
	 * Resources that fail evaluation are listed as skipped with the reason.
	 */
	public CapacityReportDto getAllCapacities() {
		List<CapacityCalculationDto> capacities = new ArrayList<>();
		List<SkippedCapacityDto> skipped = new ArrayList<>();
		Set<Long> seen = new HashSet<>();
		for (ResourceCommitment latest : commitmentRepository.findAllByOrderByResourceIdAscCreatedAtDesc()) {
			if (!seen.add(latest.getResourceId())) {
				continue;
			}
			try {
				capacities.add(getCapacityCalculation(latest.getResourceId(), latest.getPeriodStart(), latest.getPeriodEnd()));
			} catch (NoCommitmentFoundException | DataAccessException ex) {
				logger.warn("Skipping capacity of resource {}: {}", latest.getResourceId(), ex.getMessage());
				skipped.add(new SkippedCapacityDto(latest.getResourceId(), ex.getMessage()));
			}
		}
		return new CapacityReportDto(capacities, skipped);
	}

	UtilizationStatus statusFor(BigDecimal utilization) {
		if (utilization.compareTo(underUtilizedBelow) < 0) {
			return UtilizationStatus.UNDER_UTILIZED;
		}
		if (utilization.compareTo(overCommittedAbove) > 0) {
			return UtilizationStatus.OVER_COMMITTED;
		}
		return UtilizationStatus.OPTIMAL;
	}

	static BigDecimal totalAvailableHours(BigDecimal committedHours, CommitmentCadence cadence, int workingDays) {
		return committedHours.multiply(BigDecimal.valueOf(workingDays))
				.divide(cadence.workingDaysPerPeriod(), HOURS_SCALE, RoundingMode.HALF_UP);
	}

	private static BigDecimal nullToZero(BigDecimal value) {
		return value == null ? BigDecimal.ZERO : value;
	}
}
