package my.resourceledger.app.repository;

import my.resourceledger.app.domain.FeatureAllocation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface FeatureAllocationRepository extends JpaRepository<FeatureAllocation, UUID> {
	@Query("select sum(a.allocatedHours) from FeatureAllocation a where a.resourceId = :resourceId")
	BigDecimal sumAllocatedHours(Long resourceId);

	List<FeatureAllocation> findByProjectIdIn(Collection<String> projectIds);
}
