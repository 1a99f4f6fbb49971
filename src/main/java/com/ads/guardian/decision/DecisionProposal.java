package com.ads.guardian.decision;

import com.ads.guardian.action.ApplyStatus;
import com.ads.guardian.platform.PlatformStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionProposal {

    private String entityId;
    private LifecycleState fromState;
    private LifecycleState toState;
    private ActionIntent action;
    private ReasonCode reason;
    private HysteresisCounters counters;
    // counters before a transition reset them; kept when the transition could not be applied
    private HysteresisCounters retainedCounters;
    private DecisionInputs inputs;

    public boolean isTransition() {
        return fromState != toState;
    }

    /**
     * True when the platform serving status must change for this decision.
     */
    public boolean requiresStatusChange() {
        return fromState.getPlatformStatus() != toState.getPlatformStatus();
    }

    public PlatformStatus getTargetStatus() {
        return toState.getPlatformStatus();
    }

    /**
     * Counters to persist. A failed apply keeps the pre-reset streaks so the next tick
     * proposes the same transition again.
     */
    public HysteresisCounters countersAfter(ApplyStatus applyStatus) {
        if (applyStatus == ApplyStatus.FAILED && retainedCounters != null) {
            return retainedCounters;
        }
        return counters;
    }
}
