package com.ads.guardian.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LossLedgerRepository extends JpaRepository<LossLedgerEntity, String> {

    @Query("SELECT l FROM LossLedgerEntity l WHERE l.halted = true ORDER BY l.haltedAt ASC")
    List<LossLedgerEntity> findHalted();
}
