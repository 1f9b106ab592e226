package my.resourceledger.app.repository;

import my.resourceledger.app.domain.ProjectFinancialDetail;
import org.springframework.data.jpa.repository.JpaRepository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public interface ProjectFinancialDetailRepository extends JpaRepository<ProjectFinancialDetail, Long> {
	Optional<ProjectFinancialDetail> findByProjectId(String projectId);

	List<ProjectFinancialDetail> findByWbse(String wbse);

	List<ProjectFinancialDetail> findByActualCostGreaterThanOrderByProjectIdAsc(BigDecimal actualCost);
}
