package com.ads.guardian.service;

import com.ads.guardian.platform.MetricsSnapshot;
import com.ads.guardian.protection.HaltAssessment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything one tick writes, committed in a single transaction.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TickBatch {

    private LocalDateTime tickTime;
    private LocalDateTime startedAt;

    @Builder.Default
    private List<MetricsSnapshot> snapshots = new ArrayList<>();

    @Builder.Default
    private List<HaltAssessment> assessments = new ArrayList<>();

    @Builder.Default
    private List<TickDecision> decisions = new ArrayList<>();

    private int staleCount;

    public long countApplied() {
        return decisions.stream()
                .filter(d -> d.getApplyOutcome() != null && !d.getApplyOutcome().isFailed())
                .count();
    }

    public long countFailed() {
        return decisions.stream()
                .filter(d -> d.getApplyOutcome() != null && d.getApplyOutcome().isFailed())
                .count();
    }

    public long countHalted() {
        return assessments.stream().filter(HaltAssessment::isHalted).count();
    }
}
