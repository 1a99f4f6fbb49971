package com.ads.guardian.decision;

import com.ads.guardian.analysis.Confidence;
import com.ads.guardian.analysis.EntityEvaluation;
import com.ads.guardian.analysis.PacingStatus;
import com.ads.guardian.analysis.SignalBasis;
import com.ads.guardian.analysis.SignalDirection;
import com.ads.guardian.persistence.GuardianDecisionEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything the engine reads for one decision. Recorded on each decision so the
 * state machine can be replayed from history alone.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionInputs {

    private boolean stale;
    private boolean haltAsserted;

    // null when stale
    private SignalDirection direction;
    private Confidence confidence;
    private SignalBasis basis;
    private PacingStatus pacingStatus;

    public static DecisionInputs from(EntityEvaluation evaluation, boolean haltAsserted) {
        if (evaluation.isStale()) {
            return DecisionInputs.builder()
                    .stale(true)
                    .haltAsserted(haltAsserted)
                    .build();
        }
        return DecisionInputs.builder()
                .stale(false)
                .haltAsserted(haltAsserted)
                .direction(evaluation.getSignal().getDirection())
                .confidence(evaluation.getSignal().getConfidence())
                .basis(evaluation.getSignal().getBasis())
                .pacingStatus(evaluation.getPacing().getStatus())
                .build();
    }

    public static DecisionInputs fromRecord(GuardianDecisionEntity record) {
        return DecisionInputs.builder()
                .stale(record.isStale())
                .haltAsserted(record.isHaltAsserted())
                .direction(record.getSignalDirection())
                .confidence(record.getConfidence())
                .basis(record.getSignalBasis())
                .pacingStatus(record.getPacingStatus())
                .build();
    }

    public boolean isOverPace() {
        return pacingStatus == PacingStatus.OVER_PACE;
    }
}
