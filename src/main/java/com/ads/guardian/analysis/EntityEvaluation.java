package com.ads.guardian.analysis;

import com.ads.guardian.persistence.ManagedEntityEntity;
import com.ads.guardian.platform.EntityKind;
import com.ads.guardian.platform.MetricsSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Evaluator output for one entity in one tick.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityEvaluation {

    private String entityId;
    private String campaignId;
    private EntityKind kind;

    private boolean stale;
    private String staleReason;

    private MetricsSnapshot snapshot;
    private PacingState pacing;
    private ProfitabilitySignal signal;

    // latest interval only, used for loss accounting
    private BigDecimal intervalSpend;
    private BigDecimal intervalValue;
    // null when unknown; the protector then assumes one tick interval
    private LocalDateTime intervalStart;

    public static EntityEvaluation stale(ManagedEntityEntity entity, String reason) {
        return EntityEvaluation.builder()
                .entityId(entity.getEntityId())
                .campaignId(entity.getCampaignId())
                .kind(entity.getKind())
                .stale(true)
                .staleReason(reason)
                .build();
    }

    /**
     * Net loss of the latest interval. Negative means a gain.
     */
    public BigDecimal getIntervalNetLoss() {
        if (stale || intervalSpend == null) {
            return BigDecimal.ZERO;
        }
        return intervalSpend.subtract(intervalValue != null ? intervalValue : BigDecimal.ZERO);
    }
}
