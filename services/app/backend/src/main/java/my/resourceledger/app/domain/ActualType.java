package my.resourceledger.app.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum ActualType {
	SOFTWARE("software"),
	HARDWARE("hardware"),
	CONTRACTOR("contractor"),
	PROFESSIONAL_SERVICES("professional-services");

	private final String code;

	ActualType(String code) {
		this.code = code;
	}

	@JsonValue
	public String code() {
		return code;
	}

	public static Optional<ActualType> fromCode(String code) {
		return Arrays.stream(values())
				.filter(type -> type.code.equals(code))
				.findFirst();
	}
}
