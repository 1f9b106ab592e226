package my.resourceledger.app.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class CsvParsingTest {
	@Test
	void stripBomRemovesLeadingMarker() {
		assertThat(CsvParsing.stripBom("\uFEFFStream,Month")).isEqualTo("Stream,Month");
	}

	@Test
	void stripBomHandlesNullAndEmpty() {
		assertThat(CsvParsing.stripBom(null)).isNull();
		assertThat(CsvParsing.stripBom("")).isEqualTo("");
	}

	@Test
	void sniffDelimiterPrefersSemicolon() {
		assertThat(CsvParsing.sniffDelimiter("Band;Activity Type;Hourly Rate\nN1;N1_CAP;100")).isEqualTo(';');
	}

	@Test
	void sniffDelimiterOnlyLooksAtHeaderLine() {
		String sample = "Name,Date\n\"Waitangi; Day\",06-02-2025\n\"Anzac; Day\",25-04-2025";
		assertThat(CsvParsing.sniffDelimiter(sample)).isEqualTo(',');
	}

	@Test
	void sniffDelimiterDefaultsToComma() {
		assertThat(CsvParsing.sniffDelimiter("Name")).isEqualTo(',');
		assertThat(CsvParsing.sniffDelimiter(null)).isEqualTo(',');
		assertThat(CsvParsing.sniffDelimiter("")).isEqualTo(',');
	}

	@Test
	void decodeUtf8RemovesBom() {
		byte[] payload = "\uFEFFName,Date".getBytes(StandardCharsets.UTF_8);
		assertThat(CsvParsing.decodeUtf8(payload)).isEqualTo("Name,Date");
	}

	@Test
	void skipLinesDropsTitleRows() {
		String text = "Rate Card FY25\nAll amounts NZD\nBand,Activity Type\nN1,N1_CAP\n";
		assertThat(CsvParsing.skipLines(text, 2)).isEqualTo("Band,Activity Type\nN1,N1_CAP\n");
		assertThat(CsvParsing.skipLines(text, 0)).isEqualTo(text);
		assertThat(CsvParsing.skipLines("only one line", 2)).isEmpty();
	}
}
