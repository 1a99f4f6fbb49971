package com.ads.guardian.persistence;

import com.ads.guardian.platform.EntityKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ManagedEntityRepository extends JpaRepository<ManagedEntityEntity, String> {

    @Query("SELECT e FROM ManagedEntityEntity e WHERE e.monitored = true ORDER BY e.campaignId, e.kind, e.entityId")
    List<ManagedEntityEntity> findMonitored();

    @Query("SELECT e FROM ManagedEntityEntity e WHERE e.campaignId = :campaignId ORDER BY e.kind, e.entityId")
    List<ManagedEntityEntity> findByCampaign(@Param("campaignId") String campaignId);

    @Query("SELECT COUNT(e) FROM ManagedEntityEntity e WHERE e.monitored = true AND e.kind = :kind")
    long countMonitoredByKind(@Param("kind") EntityKind kind);
}
