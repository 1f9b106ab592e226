package my.resourceledger.app.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores a {@link ContractType} under the label the resource sheet uses, e.g. {@code External Squad}.
 */
@Converter
public class ContractTypeConverter implements AttributeConverter<ContractType, String> {
	@Override
	public String convertToDatabaseColumn(ContractType type) {
		return type == null ? null : type.label();
	}

	@Override
	public ContractType convertToEntityAttribute(String label) {
		if (label == null) {
			return null;
		}
		return ContractType.fromLabel(label)
				.orElseThrow(() -> new IllegalArgumentException("Unknown contract type: " + label));
	}
}
