package my.resourceledger.app.repository;

import my.resourceledger.app.domain.RawActualEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.math.BigDecimal;
import java.util.List;

public interface RawActualEntryRepository extends JpaRepository<RawActualEntry, Long> {
	List<RawActualEntry> findByActualTypeIsNull();

	@Query("select sum(a.amount) from RawActualEntry a where a.wbsElement = :wbse")
	BigDecimal sumAmountByWbse(String wbse);

	@Query("select sum(a.amount) from RawActualEntry a where a.wbsElement = :wbse and a.month = :month")
	BigDecimal sumAmountByWbseAndMonth(String wbse, String month);

	@Query("select distinct a.month from RawActualEntry a order by a.month desc")
	List<String> findDistinctMonths();
}
