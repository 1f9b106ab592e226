package my.resourceledger.app.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores an {@link ActualType} under its lower-case code, e.g. {@code software}.
 */
@Converter
public class ActualTypeConverter implements AttributeConverter<ActualType, String> {
	@Override
	public String convertToDatabaseColumn(ActualType type) {
		return type == null ? null : type.code();
	}

	@Override
	public ActualType convertToEntityAttribute(String code) {
		if (code == null) {
			return null;
		}
		return ActualType.fromCode(code)
				.orElseThrow(() -> new IllegalArgumentException("Unknown actual type: " + code));
	}
}
