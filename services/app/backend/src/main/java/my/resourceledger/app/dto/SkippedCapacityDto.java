package my.resourceledger.app.dto;

public record SkippedCapacityDto(Long resourceId, String reason) {
}
