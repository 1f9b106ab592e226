package my.resourceledger.app.util;

import java.nio.charset.StandardCharsets;

public final class CsvParsing {
	private CsvParsing() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		if (value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}

	/**
	 * Picks ';' or ',' by counting occurrences in the header line only.
	 */
	public static char sniffDelimiter(String sample) {
		if (sample == null || sample.isEmpty()) {
			return ',';
		}
		int lineEnd = sample.indexOf('\n');
		String headerLine = lineEnd < 0 ? sample : sample.substring(0, lineEnd);
		long semicolons = headerLine.chars().filter(c -> c == ';').count();
		long commas = headerLine.chars().filter(c -> c == ',').count();
		return semicolons > commas ? ';' : ',';
	}

	public static String decodeUtf8(byte[] payload) {
		String raw = new String(payload, StandardCharsets.UTF_8);
		return stripBom(raw);
	}

	/**
	 * Drops the first {@code count} physical lines, used for exports that carry title rows
	 * above the header.
	 */
	public static String skipLines(String text, int count) {
		if (text == null || count <= 0) {
			return text;
		}
		int index = 0;
		for (int skipped = 0; skipped < count; skipped++) {
			int next = text.indexOf('\n', index);
			if (next < 0) {
				return "";
			}
			index = next + 1;
		}
		return text.substring(index);
	}
}
