package my.resourceledger.app.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import my.resourceledger.app.domain.RawTimesheetEntry;

import java.math.BigDecimal;
import java.time.LocalDate;

import static my.resourceledger.app.util.FieldParsers.DAY_MONTH_YEAR_PATTERN;

public record TimesheetEntryDto(Long timesheetId,
								Long resourceId,
								String employeeName,
								String personnelNumber,
								@JsonFormat(pattern = DAY_MONTH_YEAR_PATTERN) LocalDate workDate,
								String activityType,
								String generalReceiver,
								BigDecimal hours) {
	public static TimesheetEntryDto from(RawTimesheetEntry entry) {
		return new TimesheetEntryDto(
				entry.getTimesheetId(),
				entry.getResourceId(),
				entry.getEmployeeName(),
				entry.getPersonnelNumber(),
				entry.getWorkDate(),
				entry.getActivityType(),
				entry.getGeneralReceiver(),
				entry.getHours()
		);
	}
}
