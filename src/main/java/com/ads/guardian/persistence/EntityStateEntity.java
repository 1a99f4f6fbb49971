package com.ads.guardian.persistence;

import com.ads.guardian.decision.EntityStateView;
import com.ads.guardian.decision.HysteresisCounters;
import com.ads.guardian.decision.LifecycleState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Current lifecycle state and hysteresis counters of one entity.
 * Always equal to what the latest decision record says.
 */
@Entity
@Table(name = "entity_state")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityStateEntity {

    @Id
    @Column(name = "entity_id", length = 64)
    private String entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", length = 20, nullable = false)
    private LifecycleState state;

    @Column(name = "negative_streak", nullable = false)
    private int negativeStreak;

    @Column(name = "non_negative_streak", nullable = false)
    private int nonNegativeStreak;

    @Column(name = "halt_clear_streak", nullable = false)
    private int haltClearStreak;

    @Column(name = "last_decision_id")
    private Long lastDecisionId;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static EntityStateEntity initial(String entityId, LocalDateTime now) {
        return EntityStateEntity.builder()
                .entityId(entityId)
                .state(LifecycleState.ACTIVE)
                .updatedAt(now)
                .build();
    }

    public HysteresisCounters counters() {
        return new HysteresisCounters(negativeStreak, nonNegativeStreak, haltClearStreak);
    }

    public void applyCounters(HysteresisCounters counters) {
        this.negativeStreak = counters.getNegativeStreak();
        this.nonNegativeStreak = counters.getNonNegativeStreak();
        this.haltClearStreak = counters.getHaltClearStreak();
    }

    public EntityStateView toView() {
        return new EntityStateView(entityId, state, counters());
    }
}
