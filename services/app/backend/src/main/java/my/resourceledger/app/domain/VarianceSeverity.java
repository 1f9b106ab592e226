package my.resourceledger.app.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VarianceSeverity {
	LOW("low"),
	MEDIUM("medium"),
	HIGH("high"),
	CRITICAL("critical");

	private final String code;

	VarianceSeverity(String code) {
		this.code = code;
	}

	@JsonValue
	public String code() {
		return code;
	}
}
