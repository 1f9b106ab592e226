package my.resourceledger.app.repository;

import my.resourceledger.app.domain.LabourRate;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LabourRateRepository extends JpaRepository<LabourRate, Long> {
}
