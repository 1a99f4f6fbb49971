package com.ads.guardian.persistence;

import com.ads.guardian.service.AlertSeverity;
import com.ads.guardian.service.AlertType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "operator_alert", indexes = {
        @Index(name = "idx_alert_open", columnList = "acknowledged, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperatorAlertEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "alert_type", length = 30, nullable = false)
    private AlertType alertType;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", length = 10, nullable = false)
    private AlertSeverity severity;

    @Column(name = "entity_id", length = 64)
    private String entityId;

    @Column(name = "campaign_id", length = 64)
    private String campaignId;

    @Column(name = "message", length = 1000, nullable = false)
    private String message;

    @Column(name = "acknowledged")
    private boolean acknowledged;

    @Column(name = "acknowledged_at")
    private LocalDateTime acknowledgedAt;

    @Column(name = "sent_to_telegram")
    private boolean sentToTelegram;
}
