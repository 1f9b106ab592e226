package my.resourceledger.app.service;

import my.resourceledger.app.domain.PublicHoliday;
import my.resourceledger.app.repository.PublicHolidayRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Counts working days: weekdays that are not stored public holidays.
 */
@Service
public class WorkingDayCalendarService {
	private final PublicHolidayRepository holidayRepository;

	public WorkingDayCalendarService(PublicHolidayRepository holidayRepository) {
		this.holidayRepository = holidayRepository;
	}

	/**
	 * @return working days in {@code [start, end]}, both ends inclusive; 0 when end precedes start
	 */
	@Transactional(readOnly = true)
	public int workingDaysBetween(LocalDate start, LocalDate end) {
		if (start == null || end == null) {
			throw new IllegalArgumentException("start and end are required");
		}
		if (end.isBefore(start)) {
			return 0;
		}
		Set<LocalDate> holidays = holidayRepository.findByHolidayDateBetween(start, end).stream()
				.map(PublicHoliday::getHolidayDate)
				.collect(Collectors.toSet());
		int count = 0;
		for (LocalDate day = start; !day.isAfter(end); day = day.plusDays(1)) {
			if (!isWeekend(day) && !holidays.contains(day)) {
				count += 1;
			}
		}
		return count;
	}

	@Transactional(readOnly = true)
	public boolean isWorkingDay(LocalDate date) {
		if (date == null) {
			throw new IllegalArgumentException("date is required");
		}
		return !isWeekend(date) && !holidayRepository.existsByHolidayDate(date);
	}

	private static boolean isWeekend(LocalDate day) {
		DayOfWeek dayOfWeek = day.getDayOfWeek();
		return dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY;
	}
}
