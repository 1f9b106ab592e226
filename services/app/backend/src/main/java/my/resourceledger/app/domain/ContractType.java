package my.resourceledger.app.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum ContractType {
	FTE("FTE"),
	SOW("SOW"),
	EXTERNAL_SQUAD("External Squad");

	private final String label;

	ContractType(String label) {
		this.label = label;
	}

	@JsonValue
	public String label() {
		return label;
	}

	public static Optional<ContractType> fromLabel(String raw) {
		if (raw == null) {
			return Optional.empty();
		}
		String value = raw.trim();
		return Arrays.stream(values())
				.filter(type -> type.label.equals(value))
				.findFirst();
	}
}
