package my.resourceledger.app.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnumColumnConverterTest {
	private final ActualTypeConverter actualTypes = new ActualTypeConverter();
	private final ContractTypeConverter contractTypes = new ContractTypeConverter();

	@Test
	void actualTypesAreStoredByCode() {
		assertThat(actualTypes.convertToDatabaseColumn(ActualType.PROFESSIONAL_SERVICES)).isEqualTo("professional-services");
		assertThat(actualTypes.convertToEntityAttribute("software")).isEqualTo(ActualType.SOFTWARE);
		assertThat(actualTypes.convertToDatabaseColumn(null)).isNull();
		assertThat(actualTypes.convertToEntityAttribute(null)).isNull();
	}

	@Test
	void contractTypesAreStoredByLabel() {
		assertThat(contractTypes.convertToDatabaseColumn(ContractType.EXTERNAL_SQUAD)).isEqualTo("External Squad");
		assertThat(contractTypes.convertToEntityAttribute("SOW")).isEqualTo(ContractType.SOW);
		assertThat(contractTypes.convertToEntityAttribute(null)).isNull();
	}

	@Test
	void unknownStoredValuesFail() {
		assertThatThrownBy(() -> actualTypes.convertToEntityAttribute("SOFTWARE"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("SOFTWARE");
		assertThatThrownBy(() -> contractTypes.convertToEntityAttribute("EXTERNAL_SQUAD"))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
