package my.resourceledger.app.persistence;

import my.resourceledger.app.importer.ImportIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Savepoint;
import java.util.ArrayList;
import java.util.List;

/**
 * Wraps every insert in a JDBC savepoint on the caller's transaction. A
 * {@link DataAccessException} rolls back to that savepoint only, so PostgreSQL keeps the
 * transaction usable for the next row.
 */
@Component
public class JdbcImportBatchWriter implements ImportBatchWriter {
	private static final Logger logger = LoggerFactory.getLogger(JdbcImportBatchWriter.class);

	private final JdbcTemplate jdbcTemplate;

	public JdbcImportBatchWriter(JdbcTemplate jdbcTemplate) {
		this.jdbcTemplate = jdbcTemplate;
	}

	@Override
	@Transactional(propagation = Propagation.MANDATORY)
	public <T> WriteOutcome writeEach(List<MappedRow<T>> rows, RecordInserter<T> inserter) {
		if (rows.isEmpty()) {
			return new WriteOutcome(0, List.of());
		}
		return jdbcTemplate.execute((ConnectionCallback<WriteOutcome>) connection -> {
			int written = 0;
			List<ImportIssue> failures = new ArrayList<>();
			for (MappedRow<T> row : rows) {
				Savepoint savepoint = connection.setSavepoint();
				try {
					inserter.insert(row.record());
					connection.releaseSavepoint(savepoint);
					written += 1;
				} catch (DataAccessException ex) {
					connection.rollback(savepoint);
					String reason = ex.getMostSpecificCause().getMessage();
					logger.warn("Insert failed for row {}: {}", row.rowNumber(), reason);
					failures.add(ImportIssue.error(row.rowNumber(), "Insert failed: " + reason));
				}
			}
			return new WriteOutcome(written, failures);
		});
	}
}
