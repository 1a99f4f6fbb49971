package com.ads.guardian.persistence;

import com.ads.guardian.action.ApplyStatus;
import com.ads.guardian.analysis.Confidence;
import com.ads.guardian.analysis.PacingStatus;
import com.ads.guardian.analysis.SignalBasis;
import com.ads.guardian.analysis.SignalDirection;
import com.ads.guardian.decision.ActionIntent;
import com.ads.guardian.decision.DecisionSource;
import com.ads.guardian.decision.HysteresisCounters;
import com.ads.guardian.decision.LifecycleState;
import com.ads.guardian.decision.ReasonCode;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Append-only decision log. One row per entity per tick, plus one per operator transition.
 * Holds the inputs the engine saw so the state can be replayed.
 */
@Entity
@Table(name = "guardian_decision", indexes = {
        @Index(name = "idx_decision_entity", columnList = "entity_id, id"),
        @Index(name = "idx_decision_tick", columnList = "tick_time")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuardianDecisionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_id", length = 64, nullable = false)
    private String entityId;

    @Column(name = "campaign_id", length = 64)
    private String campaignId;

    @Column(name = "tick_time", nullable = false)
    private LocalDateTime tickTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", length = 10, nullable = false)
    private DecisionSource source;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_state", length = 20, nullable = false)
    private LifecycleState fromState;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_state", length = 20, nullable = false)
    private LifecycleState toState;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", length = 10, nullable = false)
    private ActionIntent action;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", length = 40, nullable = false)
    private ReasonCode reason;

    // Inputs
    @Column(name = "stale", nullable = false)
    private boolean stale;

    @Column(name = "halt_asserted", nullable = false)
    private boolean haltAsserted;

    @Enumerated(EnumType.STRING)
    @Column(name = "signal_direction", length = 10)
    private SignalDirection signalDirection;

    @Enumerated(EnumType.STRING)
    @Column(name = "confidence", length = 10)
    private Confidence confidence;

    @Enumerated(EnumType.STRING)
    @Column(name = "signal_basis", length = 15)
    private SignalBasis signalBasis;

    @Enumerated(EnumType.STRING)
    @Column(name = "pacing_status", length = 15)
    private PacingStatus pacingStatus;

    @Column(name = "profit_estimate", precision = 18, scale = 4)
    private BigDecimal profitEstimate;

    @Column(name = "pacing_ratio", precision = 10, scale = 4)
    private BigDecimal pacingRatio;

    @Column(name = "recommended_hourly_spend", precision = 18, scale = 4)
    private BigDecimal recommendedHourlySpend;

    // Counters after this decision
    @Column(name = "negative_streak", nullable = false)
    private int negativeStreak;

    @Column(name = "non_negative_streak", nullable = false)
    private int nonNegativeStreak;

    @Column(name = "halt_clear_streak", nullable = false)
    private int haltClearStreak;

    // Application
    @Enumerated(EnumType.STRING)
    @Column(name = "apply_status", length = 15, nullable = false)
    private ApplyStatus applyStatus;

    @Column(name = "idempotency_key", length = 120)
    private String idempotencyKey;

    @Column(name = "attempts")
    private int attempts;

    @Column(name = "failure_message", length = 500)
    private String failureMessage;

    @Column(name = "note", length = 500)
    private String note;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public HysteresisCounters counters() {
        return new HysteresisCounters(negativeStreak, nonNegativeStreak, haltClearStreak);
    }

    /**
     * State the entity is in after this decision, taking a failed apply into account.
     */
    public LifecycleState effectiveState() {
        return applyStatus == ApplyStatus.FAILED ? fromState : toState;
    }
}
