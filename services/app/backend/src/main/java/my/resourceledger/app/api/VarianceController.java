package my.resourceledger.app.api;

import my.resourceledger.app.domain.VarianceType;
import my.resourceledger.app.dto.VarianceCheckDto;
import my.resourceledger.app.service.VarianceDetectionService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/variances")
public class VarianceController {
	private final VarianceDetectionService varianceDetectionService;

	public VarianceController(VarianceDetectionService varianceDetectionService) {
		this.varianceDetectionService = varianceDetectionService;
	}

	@GetMapping
	public List<VarianceCheckDto> variances(@RequestParam(required = false) String type) {
		if (type == null) {
			return varianceDetectionService.detectAllVariances();
		}
		return switch (VarianceType.fromCode(type)) {
			case TIMESHEET_NO_ALLOCATION -> varianceDetectionService.detectTimesheetNoAllocation();
			case ALLOCATION_VARIANCE -> varianceDetectionService.detectAllocationVariances();
			case CAPACITY_EXCEEDED -> varianceDetectionService.detectCapacityExceeded();
			case COST_VARIANCE -> varianceDetectionService.detectCostVariances();
		};
	}
}
