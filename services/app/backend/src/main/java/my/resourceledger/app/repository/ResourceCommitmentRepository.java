package my.resourceledger.app.repository;

import my.resourceledger.app.domain.ResourceCommitment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public interface ResourceCommitmentRepository extends JpaRepository<ResourceCommitment, UUID> {
	List<ResourceCommitment> findByResourceId(Long resourceId);

	@Query("""
			select c from ResourceCommitment c
			where c.resourceId = :resourceId and c.periodStart <= :periodEnd and c.periodEnd >= :periodStart
			order by c.createdAt desc
			""")
	List<ResourceCommitment> findOverlapping(Long resourceId, LocalDate periodStart, LocalDate periodEnd);

	List<ResourceCommitment> findAllByOrderByResourceIdAscCreatedAtDesc();

	@Query("""
			select c from ResourceCommitment c
			where c.allocatedHours > c.totalAvailableHours
			order by c.resourceId, c.periodStart
			""")
	List<ResourceCommitment> findOverAllocated();
}
