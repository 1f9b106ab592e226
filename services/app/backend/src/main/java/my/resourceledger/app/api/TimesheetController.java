package my.resourceledger.app.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import my.resourceledger.app.dto.TimesheetEntryDto;
import my.resourceledger.app.service.TimesheetImportService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/timesheets")
public class TimesheetController {
	private final TimesheetImportService timesheetImportService;

	public TimesheetController(TimesheetImportService timesheetImportService) {
		this.timesheetImportService = timesheetImportService;
	}

	@GetMapping("/unprocessed")
	public List<TimesheetEntryDto> unprocessed() {
		return timesheetImportService.getUnprocessedTimesheets();
	}

	@PostMapping("/processed")
	public Map<String, Integer> markProcessed(@Valid @RequestBody MarkProcessedRequest request) {
		return Map.of("updated", timesheetImportService.markAsProcessed(request.timesheetIds()));
	}

	public record MarkProcessedRequest(@NotEmpty List<Long> timesheetIds) {
	}
}
