package com.ads.guardian.persistence;

import com.ads.guardian.service.TickOutcome;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface TickRecordRepository extends JpaRepository<TickRecordEntity, Long> {

    @Query("SELECT t FROM TickRecordEntity t ORDER BY t.id DESC")
    List<TickRecordEntity> findRecent(Pageable pageable);

    @Query("SELECT COUNT(t) FROM TickRecordEntity t WHERE t.outcome = :outcome AND t.tickTime >= :since")
    long countByOutcomeSince(@Param("outcome") TickOutcome outcome, @Param("since") LocalDateTime since);

    @Query("SELECT t FROM TickRecordEntity t WHERE t.outcome = :outcome ORDER BY t.id ASC")
    List<TickRecordEntity> findByOutcome(@Param("outcome") TickOutcome outcome);
}
