package com.ads.guardian.decision;

import com.ads.guardian.action.ApplyStatus;
import com.ads.guardian.persistence.GuardianDecisionEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds an entity's lifecycle state and counters from its decision history by
 * re-running the engine over the recorded inputs.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DecisionReplayer {

    private final DecisionEngine decisionEngine;

    /**
     * @param history decisions of one entity, oldest first
     */
    public ReplayResult replay(String entityId, List<GuardianDecisionEntity> history) {
        EntityStateView view = EntityStateView.initial(entityId);
        List<Long> mismatches = new ArrayList<>();

        for (GuardianDecisionEntity record : history) {
            if (record.getSource() == DecisionSource.OPERATOR) {
                view = new EntityStateView(entityId, record.getToState(), record.counters());
                continue;
            }

            DecisionProposal proposal = decisionEngine.decide(view, DecisionInputs.fromRecord(record));

            if (proposal.getFromState() != record.getFromState()
                    || proposal.getToState() != record.getToState()
                    || proposal.getAction() != record.getAction()) {
                log.warn("Replay mismatch for {} at decision {}: recorded {} -> {} ({}), recomputed {} -> {} ({})",
                        entityId, record.getId(),
                        record.getFromState(), record.getToState(), record.getAction(),
                        proposal.getFromState(), proposal.getToState(), proposal.getAction());
                mismatches.add(record.getId());
            }

            LifecycleState next = record.getApplyStatus() == ApplyStatus.FAILED
                    ? proposal.getFromState() : proposal.getToState();
            view = new EntityStateView(entityId, next, proposal.countersAfter(record.getApplyStatus()));
        }

        return new ReplayResult(view, history.size(), mismatches);
    }
}
