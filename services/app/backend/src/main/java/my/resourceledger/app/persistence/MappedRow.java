package my.resourceledger.app.persistence;

/**
 * A record mapped from a validated CSV row, keeping the row number for error reporting.
 */
public record MappedRow<T>(int rowNumber, T record) {
}
