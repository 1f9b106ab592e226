package my.resourceledger.app.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VarianceType {
	TIMESHEET_NO_ALLOCATION("timesheet-no-allocation"),
	ALLOCATION_VARIANCE("allocation-variance"),
	CAPACITY_EXCEEDED("capacity-exceeded"),
	COST_VARIANCE("cost-variance");

	private final String code;

	VarianceType(String code) {
		this.code = code;
	}

	@JsonValue
	public String code() {
		return code;
	}

	public static VarianceType fromCode(String code) {
		for (VarianceType type : values()) {
			if (type.code.equals(code)) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown variance type: " + code);
	}
}
