package my.resourceledger.app.api;

import my.resourceledger.app.dto.WorkingDaysDto;
import my.resourceledger.app.service.WorkingDayCalendarService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

import static my.resourceledger.app.util.FieldParsers.DAY_MONTH_YEAR_PATTERN;

@RestController
@RequestMapping("/api/calendar")
public class CalendarController {
	private final WorkingDayCalendarService calendarService;

	public CalendarController(WorkingDayCalendarService calendarService) {
		this.calendarService = calendarService;
	}

	@GetMapping("/working-days")
	public WorkingDaysDto workingDays(@RequestParam @DateTimeFormat(pattern = DAY_MONTH_YEAR_PATTERN) LocalDate start,
									  @RequestParam @DateTimeFormat(pattern = DAY_MONTH_YEAR_PATTERN) LocalDate end) {
		return new WorkingDaysDto(start, end, calendarService.workingDaysBetween(start, end));
	}
}
