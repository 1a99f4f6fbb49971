package com.ads.guardian.persistence;

import com.ads.guardian.platform.MetricsSnapshot;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "metrics_snapshot", uniqueConstraints = {
        @UniqueConstraint(name = "uk_snapshot_entity_tick", columnNames = {"entity_id", "tick_time"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsSnapshotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_id", length = 64, nullable = false)
    private String entityId;

    @Column(name = "tick_time", nullable = false)
    private LocalDateTime tickTime;

    @Column(name = "spend", precision = 18, scale = 4, nullable = false)
    private BigDecimal spend;

    @Column(name = "conversions", precision = 18, scale = 4, nullable = false)
    private BigDecimal conversions;

    @Column(name = "conversion_value", precision = 18, scale = 4)
    private BigDecimal conversionValue;

    @Column(name = "clicks", nullable = false)
    private long clicks;

    @Column(name = "impressions", nullable = false)
    private long impressions;

    @Column(name = "elapsed_day_fraction")
    private Double elapsedDayFraction;

    public static MetricsSnapshotEntity from(MetricsSnapshot snapshot) {
        return MetricsSnapshotEntity.builder()
                .entityId(snapshot.getEntityId())
                .tickTime(snapshot.getTickTime())
                .spend(snapshot.getSpend() != null ? snapshot.getSpend() : BigDecimal.ZERO)
                .conversions(snapshot.getConversions() != null ? snapshot.getConversions() : BigDecimal.ZERO)
                .conversionValue(snapshot.getConversionValue())
                .clicks(snapshot.getClicks())
                .impressions(snapshot.getImpressions())
                .elapsedDayFraction(snapshot.getElapsedDayFraction())
                .build();
    }

    public MetricsSnapshot toSnapshot() {
        return MetricsSnapshot.builder()
                .entityId(entityId)
                .tickTime(tickTime)
                .spend(spend)
                .conversions(conversions)
                .conversionValue(conversionValue)
                .clicks(clicks)
                .impressions(impressions)
                .elapsedDayFraction(elapsedDayFraction)
                .build();
    }
}
