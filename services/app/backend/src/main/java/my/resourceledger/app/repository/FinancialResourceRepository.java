package my.resourceledger.app.repository;

import my.resourceledger.app.domain.FinancialResource;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface FinancialResourceRepository extends JpaRepository<FinancialResource, Long> {
	Optional<FinancialResource> findByEmployeeId(String employeeId);

	List<FinancialResource> findByEmployeeIdIn(Collection<String> employeeIds);
}
