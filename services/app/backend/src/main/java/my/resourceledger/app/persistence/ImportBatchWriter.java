package my.resourceledger.app.persistence;

import java.util.List;

/**
 * Persists mapped rows one at a time so that a failing row is reported without discarding
 * the rows written before or after it.
 */
public interface ImportBatchWriter {
	<T> WriteOutcome writeEach(List<MappedRow<T>> rows, RecordInserter<T> inserter);

	@FunctionalInterface
	interface RecordInserter<T> {
		void insert(T record);
	}
}
