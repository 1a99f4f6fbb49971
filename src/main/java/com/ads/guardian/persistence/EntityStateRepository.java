package com.ads.guardian.persistence;

import com.ads.guardian.decision.LifecycleState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EntityStateRepository extends JpaRepository<EntityStateEntity, String> {

    @Query("SELECT s FROM EntityStateEntity s WHERE s.state = :state ORDER BY s.entityId")
    List<EntityStateEntity> findByState(@Param("state") LifecycleState state);

    @Query("SELECT COUNT(s) FROM EntityStateEntity s WHERE s.state = :state")
    long countByState(@Param("state") LifecycleState state);
}
