package my.resourceledger.app.importer;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IssueSeverity {
	ERROR,
	WARNING;

	@JsonValue
	public String code() {
		return name().toLowerCase(Locale.ROOT);
	}
}
