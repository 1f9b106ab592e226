package my.resourceledger.app.repository;

import my.resourceledger.app.domain.RawTimesheetEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public interface RawTimesheetEntryRepository extends JpaRepository<RawTimesheetEntry, Long> {
	@Query("""
			select sum(t.hours) from RawTimesheetEntry t
			where t.resourceId = :resourceId and t.workDate between :start and :end
			""")
	BigDecimal sumHoursForResource(Long resourceId, LocalDate start, LocalDate end);

	@Query("""
			select new my.resourceledger.app.repository.ResourceReceiverHours(t.resourceId, t.generalReceiver, sum(t.hours))
			from RawTimesheetEntry t
			where t.resourceId is not null
			group by t.resourceId, t.generalReceiver
			order by t.resourceId, t.generalReceiver
			""")
	List<ResourceReceiverHours> sumHoursByResourceAndReceiver();

	List<RawTimesheetEntry> findByProcessedFalseOrderByWorkDateAscTimesheetIdAsc();

	@Modifying
	@Query("update RawTimesheetEntry t set t.processed = true where t.timesheetId in :ids and t.processed = false")
	int markProcessed(Collection<Long> ids);
}
