package com.ads.guardian.persistence;

import com.ads.guardian.service.TickOutcome;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

@Entity
@Table(name = "tick_record", indexes = {
        @Index(name = "idx_tick_record_time", columnList = "tick_time")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TickRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tick_time", nullable = false)
    private LocalDateTime tickTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", length = 10, nullable = false)
    private TickOutcome outcome;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "finished_at")
    private LocalDateTime finishedAt;

    @Column(name = "reason", length = 500)
    private String reason;

    @Column(name = "entities_evaluated")
    private int entitiesEvaluated;

    @Column(name = "entities_stale")
    private int entitiesStale;

    @Column(name = "decisions_recorded")
    private int decisionsRecorded;

    @Column(name = "actions_applied")
    private int actionsApplied;

    @Column(name = "actions_failed")
    private int actionsFailed;

    @Column(name = "campaigns_halted")
    private int campaignsHalted;

    public Duration getDuration() {
        if (finishedAt == null) return Duration.ZERO;
        return Duration.between(startedAt, finishedAt);
    }
}
