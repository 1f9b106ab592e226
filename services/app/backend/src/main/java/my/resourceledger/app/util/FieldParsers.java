package my.resourceledger.app.util;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Typed parsing of CSV cell values. Every parser returns {@code null} for blank or
 * malformed input so validators decide how to report it.
 */
public final class FieldParsers {
	/** Day-month-year form used for dates exchanged over the REST API. */
	public static final String DAY_MONTH_YEAR_PATTERN = "dd-MM-yyyy";

	private static final Pattern DAY_MONTH_YEAR = Pattern.compile("^(\\d{1,2})[-/.](\\d{1,2})[-/.](\\d{4}|\\d{2})$");
	private static final Pattern YEAR_MONTH_DAY = Pattern.compile("^(\\d{4})[-/.](\\d{1,2})[-/.](\\d{1,2})$");
	private static final Pattern DECIMAL = Pattern.compile("^[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)$");
	private static final Pattern AMOUNT = Pattern.compile("^[+-]?(?:(?:\\d{1,3}(?:,\\d{3})+|\\d+)(?:\\.\\d+)?|\\.\\d+)$");
	private static final Pattern INTEGER = Pattern.compile("^[+-]?\\d+$");
	private static final Pattern DIGITS = Pattern.compile("^\\d+$");
	private static final int MIN_YEAR = 1900;
	private static final int MAX_YEAR = 2100;

	private FieldParsers() {
	}

	/**
	 * Parses {@code dd-MM-yyyy} (also {@code /} or {@code .} separated, two-digit years
	 * pivot at 50) and falls back to year-first {@code yyyy-MM-dd}.
	 */
	public static LocalDate parseDayMonthYear(String raw) {
		String value = trimToNull(raw);
		if (value == null) {
			return null;
		}
		Matcher dmy = DAY_MONTH_YEAR.matcher(value);
		if (dmy.matches()) {
			int year = Integer.parseInt(dmy.group(3));
			if (dmy.group(3).length() == 2) {
				year += year < 50 ? 2000 : 1900;
			}
			return toDate(year, Integer.parseInt(dmy.group(2)), Integer.parseInt(dmy.group(1)));
		}
		Matcher ymd = YEAR_MONTH_DAY.matcher(value);
		if (ymd.matches()) {
			return toDate(Integer.parseInt(ymd.group(1)), Integer.parseInt(ymd.group(2)), Integer.parseInt(ymd.group(3)));
		}
		return null;
	}

	/**
	 * Whether the value carries significant digits beyond {@code scale} decimals; trailing
	 * zeros do not count.
	 */
	public static boolean hasMoreDecimalsThan(BigDecimal value, int scale) {
		return value != null && value.stripTrailingZeros().scale() > scale;
	}

	public static BigDecimal parseDecimal(String raw) {
		String value = trimToNull(raw);
		if (value == null || !DECIMAL.matcher(value).matches()) {
			return null;
		}
		return new BigDecimal(value);
	}

	/**
	 * Parses a ledger amount. Currency markers and whitespace are ignored; thousands
	 * separators must group exactly three digits, so {@code 1,00.50} is rejected.
	 */
	public static BigDecimal parseAmount(String raw) {
		String value = trimToNull(raw);
		if (value == null) {
			return null;
		}
		String cleaned = value.replace("NZD", "")
				.replace("$", "")
				.replaceAll("\\s+", "");
		if (!AMOUNT.matcher(cleaned).matches()) {
			return null;
		}
		return new BigDecimal(cleaned.replace(",", ""));
	}

	public static BigDecimal parsePercent(String raw) {
		String value = trimToNull(raw);
		if (value == null) {
			return null;
		}
		return parseDecimal(value.replace("%", ""));
	}

	public static Integer parseInteger(String raw) {
		String value = trimToNull(raw);
		if (value == null || !INTEGER.matcher(value).matches()) {
			return null;
		}
		try {
			return Integer.valueOf(value);
		} catch (NumberFormatException ex) {
			return null;
		}
	}

	public static boolean isDigits(String raw) {
		return raw != null && DIGITS.matcher(raw.trim()).matches();
	}

	public static String trim(String value) {
		return value == null ? "" : value.trim();
	}

	public static String trimToNull(String value) {
		if (value == null) {
			return null;
		}
		String trimmed = value.trim();
		return trimmed.isEmpty() ? null : trimmed;
	}

	private static LocalDate toDate(int year, int month, int day) {
		if (year < MIN_YEAR || year > MAX_YEAR) {
			return null;
		}
		try {
			return LocalDate.of(year, month, day);
		} catch (DateTimeException ex) {
			return null;
		}
	}
}
