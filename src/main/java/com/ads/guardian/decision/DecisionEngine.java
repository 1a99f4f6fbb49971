package com.ads.guardian.decision;

import com.ads.guardian.analysis.Confidence;
import com.ads.guardian.analysis.EntityEvaluation;
import com.ads.guardian.analysis.SignalBasis;
import com.ads.guardian.analysis.SignalDirection;
import com.ads.guardian.config.GuardianSettings;
import org.springframework.stereotype.Component;

/**
 * Per-entity lifecycle state machine.
 *
 * Rules, in priority order:
 * 1. MANUALLY_PAUSED is never changed here; the tick is only observed.
 * 2. A circuit halt on the parent campaign moves ACTIVE and GUARDIAN_PAUSED entities to
 *    CIRCUIT_HALTED. Halt beats any resume condition in the same tick.
 * 3. CIRCUIT_HALTED returns to ACTIVE only on the second consecutive tick without a halt.
 * 4. ACTIVE pauses after K consecutive actionable negative ticks.
 * 5. GUARDIAN_PAUSED resumes after K consecutive non-negative ticks.
 *
 * Pure: the result depends only on the current state view and the inputs.
 */
@Component
public class DecisionEngine {

    static final int HALT_CLEAR_TICKS_FOR_REENTRY = 2;

    private final GuardianSettings settings;

    public DecisionEngine(GuardianSettings settings) {
        this.settings = settings;
    }

    public DecisionProposal decide(EntityStateView current, EntityEvaluation evaluation, boolean haltAsserted) {
        return decide(current, DecisionInputs.from(evaluation, haltAsserted));
    }

    public DecisionProposal decide(EntityStateView current, DecisionInputs inputs) {
        LifecycleState from = current.getState();
        HysteresisCounters counters = current.getCounters() != null
                ? current.getCounters().copy() : HysteresisCounters.zero();

        if (from == LifecycleState.MANUALLY_PAUSED) {
            return proposal(current, from, ActionIntent.NONE, ReasonCode.MANUAL_PAUSE_OBSERVED, counters, inputs);
        }

        if (!inputs.isStale()) {
            updateStreaks(counters, inputs);
        }

        if (inputs.isHaltAsserted()) {
            counters.setHaltClearStreak(0);
            return switch (from) {
                case ACTIVE -> proposal(current, LifecycleState.CIRCUIT_HALTED, ActionIntent.PAUSE,
                        ReasonCode.CIRCUIT_HALT_ASSERTED, counters, inputs);
                case GUARDIAN_PAUSED -> proposal(current, LifecycleState.CIRCUIT_HALTED, ActionIntent.NONE,
                        ReasonCode.CIRCUIT_HALT_ASSERTED, counters, inputs);
                default -> proposal(current, from, ActionIntent.NONE,
                        ReasonCode.CIRCUIT_HALT_ACTIVE, counters, inputs);
            };
        }

        if (from == LifecycleState.CIRCUIT_HALTED) {
            return decideHaltReentry(current, counters, inputs);
        }

        if (inputs.isStale()) {
            return proposal(current, from, ActionIntent.NONE, ReasonCode.STALE_METRICS, counters, inputs);
        }

        if (from == LifecycleState.GUARDIAN_PAUSED) {
            return decidePaused(current, counters, inputs);
        }
        return decideActive(current, counters, inputs);
    }

    /**
     * Negative with enough confidence to justify a pause.
     */
    public boolean isActionableNegative(DecisionInputs inputs) {
        if (inputs.getDirection() != SignalDirection.NEGATIVE) {
            return false;
        }
        if (inputs.getConfidence() == null || inputs.getConfidence() == Confidence.LOW) {
            return false;
        }
        return !(settings.isProxyRequiresHighConfidence()
                && inputs.getBasis() == SignalBasis.PROXY
                && inputs.getConfidence() != Confidence.HIGH);
    }

    private void updateStreaks(HysteresisCounters counters, DecisionInputs inputs) {
        if (isActionableNegative(inputs)) {
            counters.setNegativeStreak(counters.getNegativeStreak() + 1);
        } else {
            counters.setNegativeStreak(0);
        }

        if (inputs.getDirection() == SignalDirection.NEGATIVE) {
            counters.setNonNegativeStreak(0);
        } else {
            counters.setNonNegativeStreak(counters.getNonNegativeStreak() + 1);
        }
    }

    private DecisionProposal decideHaltReentry(EntityStateView current, HysteresisCounters counters,
                                               DecisionInputs inputs) {
        counters.setHaltClearStreak(counters.getHaltClearStreak() + 1);

        if (counters.getHaltClearStreak() >= HALT_CLEAR_TICKS_FOR_REENTRY) {
            return transition(current, LifecycleState.ACTIVE, ActionIntent.RESUME,
                    ReasonCode.CIRCUIT_HALT_CLEARED, counters, inputs);
        }
        return proposal(current, LifecycleState.CIRCUIT_HALTED, ActionIntent.NONE,
                ReasonCode.HALT_CLEARED_PENDING_REEVALUATION, counters, inputs);
    }

    private DecisionProposal decideActive(EntityStateView current, HysteresisCounters counters,
                                          DecisionInputs inputs) {
        int k = settings.getHysteresisTicks();

        if (counters.getNegativeStreak() >= k) {
            ReasonCode reason = inputs.getBasis() == SignalBasis.PROXY
                    ? ReasonCode.NEGATIVE_PROFIT_PROXY : ReasonCode.NEGATIVE_PROFIT_VALUE;
            return transition(current, LifecycleState.GUARDIAN_PAUSED, ActionIntent.PAUSE,
                    reason, counters, inputs);
        }

        if (inputs.isOverPace()) {
            return proposal(current, LifecycleState.ACTIVE, ActionIntent.REPACE,
                    ReasonCode.OVER_PACE, counters, inputs);
        }

        if (inputs.getDirection() == SignalDirection.NEGATIVE) {
            if (!isActionableNegative(inputs)) {
                return proposal(current, LifecycleState.ACTIVE, ActionIntent.REPACE,
                        ReasonCode.LOW_CONFIDENCE_NEGATIVE, counters, inputs);
            }
            return proposal(current, LifecycleState.ACTIVE, ActionIntent.NONE,
                    ReasonCode.NEGATIVE_PENDING_HYSTERESIS, counters, inputs);
        }

        ReasonCode reason = inputs.getDirection() == SignalDirection.POSITIVE
                ? ReasonCode.PROFITABLE : ReasonCode.NEUTRAL_SIGNAL;
        return proposal(current, LifecycleState.ACTIVE, ActionIntent.NONE, reason, counters, inputs);
    }

    private DecisionProposal decidePaused(EntityStateView current, HysteresisCounters counters,
                                          DecisionInputs inputs) {
        if (counters.getNonNegativeStreak() >= settings.getHysteresisTicks()) {
            return transition(current, LifecycleState.ACTIVE, ActionIntent.RESUME,
                    ReasonCode.PROFITABILITY_RECOVERED, counters, inputs);
        }

        ReasonCode reason = inputs.getDirection() == SignalDirection.NEGATIVE
                ? ReasonCode.STILL_UNPROFITABLE : ReasonCode.RECOVERY_PENDING_HYSTERESIS;
        return proposal(current, LifecycleState.GUARDIAN_PAUSED, ActionIntent.NONE, reason, counters, inputs);
    }

    /**
     * A transition that starts the new state with zeroed counters. The accumulated ones are
     * retained in case the platform rejects the change.
     */
    private DecisionProposal transition(EntityStateView current, LifecycleState to, ActionIntent action,
                                        ReasonCode reason, HysteresisCounters accumulated, DecisionInputs inputs) {
        DecisionProposal proposal = proposal(current, to, action, reason, HysteresisCounters.zero(), inputs);
        proposal.setRetainedCounters(accumulated);
        return proposal;
    }

    private DecisionProposal proposal(EntityStateView current, LifecycleState to, ActionIntent action,
                                      ReasonCode reason, HysteresisCounters counters, DecisionInputs inputs) {
        return DecisionProposal.builder()
                .entityId(current.getEntityId())
                .fromState(current.getState())
                .toState(to)
                .action(action)
                .reason(reason)
                .counters(counters)
                .retainedCounters(counters)
                .inputs(inputs)
                .build();
    }
}
