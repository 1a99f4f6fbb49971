package com.ads.guardian.persistence;

import com.ads.guardian.service.AlertType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OperatorAlertRepository extends JpaRepository<OperatorAlertEntity, Long> {

    @Query("SELECT a FROM OperatorAlertEntity a WHERE a.acknowledged = false ORDER BY a.createdAt DESC")
    List<OperatorAlertEntity> findOpen();

    @Query("SELECT a FROM OperatorAlertEntity a WHERE a.alertType = :type ORDER BY a.createdAt DESC")
    List<OperatorAlertEntity> findByType(@Param("type") AlertType type);

    @Query("SELECT COUNT(a) FROM OperatorAlertEntity a WHERE a.acknowledged = false")
    long countOpen();
}
