package com.ads.guardian.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface MetricsSnapshotRepository extends JpaRepository<MetricsSnapshotEntity, Long> {

    /**
     * Snapshots of an entity taken before the given tick and not older than {@code since}, newest first.
     */
    @Query("SELECT s FROM MetricsSnapshotEntity s WHERE s.entityId = :entityId " +
            "AND s.tickTime < :before AND s.tickTime >= :since ORDER BY s.tickTime DESC")
    List<MetricsSnapshotEntity> findRecentBefore(@Param("entityId") String entityId,
                                                 @Param("before") LocalDateTime before,
                                                 @Param("since") LocalDateTime since,
                                                 Pageable pageable);

    boolean existsByEntityIdAndTickTime(String entityId, LocalDateTime tickTime);

    @Modifying
    @Query("DELETE FROM MetricsSnapshotEntity s WHERE s.tickTime < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDateTime cutoff);
}
