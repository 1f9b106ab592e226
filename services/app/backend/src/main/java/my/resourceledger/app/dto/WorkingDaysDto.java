package my.resourceledger.app.dto;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;

import static my.resourceledger.app.util.FieldParsers.DAY_MONTH_YEAR_PATTERN;

public record WorkingDaysDto(@JsonFormat(pattern = DAY_MONTH_YEAR_PATTERN) LocalDate start,
							 @JsonFormat(pattern = DAY_MONTH_YEAR_PATTERN) LocalDate end,
							 int workingDays) {
}
