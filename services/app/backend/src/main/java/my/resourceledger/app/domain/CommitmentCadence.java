package my.resourceledger.app.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Locale;

/**
 * Unit period a commitment is expressed in, with the number of working days that period
 * spans.
 */
public enum CommitmentCadence {
	PER_DAY("per-day", 1),
	PER_WEEK("per-week", 5),
	PER_FORTNIGHT("per-fortnight", 10);

	private final String code;
	private final int workingDays;

	CommitmentCadence(String code, int workingDays) {
		this.code = code;
		this.workingDays = workingDays;
	}

	@JsonValue
	public String code() {
		return code;
	}

	public BigDecimal workingDaysPerPeriod() {
		return BigDecimal.valueOf(workingDays);
	}

	public static CommitmentCadence fromCode(String raw) {
		String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
		return Arrays.stream(values())
				.filter(cadence -> cadence.code.equals(value))
				.findFirst()
				.orElseThrow(() -> new IllegalArgumentException("Unknown commitment type: " + raw));
	}
}
