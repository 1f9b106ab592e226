package my.resourceledger.app.repository;

import my.resourceledger.app.domain.FinancialWorkstream;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FinancialWorkstreamRepository extends JpaRepository<FinancialWorkstream, Long> {
	List<FinancialWorkstream> findAllByOrderByWorkstreamNameAsc();

	List<FinancialWorkstream> findByProjectIdOrderByWorkstreamNameAsc(String projectId);

	List<FinancialWorkstream> findByWbse(String wbse);
}
