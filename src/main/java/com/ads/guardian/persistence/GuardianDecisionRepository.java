package com.ads.guardian.persistence;

import com.ads.guardian.action.ApplyStatus;
import com.ads.guardian.decision.ActionIntent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface GuardianDecisionRepository extends JpaRepository<GuardianDecisionEntity, Long> {

    /**
     * Most recent decisions of an entity first.
     */
    @Query("SELECT d FROM GuardianDecisionEntity d WHERE d.entityId = :entityId ORDER BY d.id DESC")
    List<GuardianDecisionEntity> findRecentByEntity(@Param("entityId") String entityId, Pageable pageable);

    /**
     * Full history of an entity, oldest first. Used for replay.
     */
    @Query("SELECT d FROM GuardianDecisionEntity d WHERE d.entityId = :entityId ORDER BY d.id ASC")
    List<GuardianDecisionEntity> findHistoryByEntity(@Param("entityId") String entityId);

    Optional<GuardianDecisionEntity> findFirstByEntityIdOrderByIdDesc(String entityId);

    @Query("SELECT d FROM GuardianDecisionEntity d WHERE d.tickTime = :tickTime ORDER BY d.entityId")
    List<GuardianDecisionEntity> findByTickTime(@Param("tickTime") LocalDateTime tickTime);

    @Query("SELECT COUNT(d) FROM GuardianDecisionEntity d WHERE d.action = :action AND d.tickTime >= :since")
    long countByActionSince(@Param("action") ActionIntent action, @Param("since") LocalDateTime since);

    @Query("SELECT COUNT(d) FROM GuardianDecisionEntity d WHERE d.applyStatus = :status AND d.tickTime >= :since")
    long countByApplyStatusSince(@Param("status") ApplyStatus status, @Param("since") LocalDateTime since);
}
