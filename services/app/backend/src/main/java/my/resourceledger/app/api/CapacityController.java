package my.resourceledger.app.api;

import jakarta.validation.Valid;
import my.resourceledger.app.dto.CapacityCalculationDto;
import my.resourceledger.app.dto.CapacityReportDto;
import my.resourceledger.app.dto.CommitmentCreateRequest;
import my.resourceledger.app.dto.CommitmentDto;
import my.resourceledger.app.service.ResourceCommitmentService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

import static my.resourceledger.app.util.FieldParsers.DAY_MONTH_YEAR_PATTERN;

@RestController
@RequestMapping("/api/capacity")
public class CapacityController {
	private final ResourceCommitmentService commitmentService;

	public CapacityController(ResourceCommitmentService commitmentService) {
		this.commitmentService = commitmentService;
	}

	@PostMapping("/commitments")
	@ResponseStatus(HttpStatus.CREATED)
	public CommitmentDto createCommitment(@Valid @RequestBody CommitmentCreateRequest request) {
		return commitmentService.createCommitment(request);
	}

	@PostMapping("/resources/{resourceId}/recompute")
	public List<CommitmentDto> recompute(@PathVariable Long resourceId) {
		return commitmentService.updateAllocatedHoursForResource(resourceId);
	}

	@GetMapping("/resources/{resourceId}")
	public CapacityCalculationDto capacity(@PathVariable Long resourceId,
										   @RequestParam @DateTimeFormat(pattern = DAY_MONTH_YEAR_PATTERN) LocalDate periodStart,
										   @RequestParam @DateTimeFormat(pattern = DAY_MONTH_YEAR_PATTERN) LocalDate periodEnd) {
		return commitmentService.getCapacityCalculation(resourceId, periodStart, periodEnd);
	}

	@GetMapping
	public CapacityReportDto all() {
		return commitmentService.getAllCapacities();
	}
}
