package com.ads.guardian.service;

import com.ads.guardian.action.ApplyOutcome;
import com.ads.guardian.action.ApplyStatus;
import com.ads.guardian.analysis.EntityEvaluation;
import com.ads.guardian.decision.DecisionProposal;
import com.ads.guardian.decision.LifecycleState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A proposal together with what the tick observed and what applying it did.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TickDecision {

    private DecisionProposal proposal;
    private EntityEvaluation evaluation;

    // null when no platform call was needed
    private ApplyOutcome applyOutcome;

    public ApplyStatus getApplyStatus() {
        return applyOutcome != null ? applyOutcome.getStatus() : ApplyStatus.NOT_REQUIRED;
    }

    /**
     * State to persist: the proposed state, or the from-state when applying failed.
     */
    public LifecycleState getEffectiveState() {
        return getApplyStatus() == ApplyStatus.FAILED ? proposal.getFromState() : proposal.getToState();
    }
}
