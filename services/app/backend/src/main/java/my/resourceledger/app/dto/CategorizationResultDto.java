package my.resourceledger.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Rows typed by one categorization pass over uncategorized actuals.")
public record CategorizationResultDto(int software,
									  int hardware,
									  int contractor,
									  @Schema(description = "Rows that matched no rule and stay uncategorized.")
									  int uncategorized) {
	@JsonProperty("categorized")
	public int categorized() {
		return software + hardware + contractor;
	}
}
