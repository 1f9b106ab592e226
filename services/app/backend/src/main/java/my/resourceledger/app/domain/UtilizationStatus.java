package my.resourceledger.app.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum UtilizationStatus {
	UNDER_UTILIZED("under-utilized"),
	OPTIMAL("optimal"),
	OVER_COMMITTED("over-committed");

	private final String code;

	UtilizationStatus(String code) {
		this.code = code;
	}

	@JsonValue
	public String code() {
		return code;
	}
}
