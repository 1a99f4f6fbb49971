package com.ads.guardian.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface LossLedgerEntryRepository extends JpaRepository<LossLedgerEntryEntity, Long> {

    @Query("SELECT e FROM LossLedgerEntryEntity e WHERE e.campaignId = :campaignId " +
            "AND e.intervalEnd > :since ORDER BY e.intervalEnd ASC")
    List<LossLedgerEntryEntity> findInWindow(@Param("campaignId") String campaignId,
                                             @Param("since") LocalDateTime since);

    /**
     * Roll entries out of the window.
     */
    @Modifying
    @Query("DELETE FROM LossLedgerEntryEntity e WHERE e.campaignId = :campaignId AND e.intervalEnd <= :cutoff")
    int deleteRolledOut(@Param("campaignId") String campaignId, @Param("cutoff") LocalDateTime cutoff);
}
