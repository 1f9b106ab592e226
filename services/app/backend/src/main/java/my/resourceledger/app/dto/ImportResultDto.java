package my.resourceledger.app.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import my.resourceledger.app.importer.ImportIssue;

import java.util.List;

@Schema(description = "Outcome of one CSV import call.")
public record ImportResultDto(
		@Schema(description = "True when at least one record was stored.")
		boolean success,
		@Schema(description = "Non-empty data rows read from the file.")
		int recordsProcessed,
		int recordsImported,
		@Schema(description = "Rows rejected by validation plus rows whose insert failed.")
		int recordsFailed,
		List<ImportIssue> errors,
		List<ImportIssue> warnings
) {
	public ImportResultDto {
		errors = errors == null ? List.of() : List.copyOf(errors);
		warnings = warnings == null ? List.of() : List.copyOf(warnings);
	}

	public static ImportResultDto structuralFailure(String message) {
		return new ImportResultDto(false, 0, 0, 0, List.of(ImportIssue.error(0, message)), List.of());
	}
}
