package com.ads.guardian.service;

import com.ads.guardian.action.ApplyOutcome;
import com.ads.guardian.action.ApplyStatus;
import com.ads.guardian.analysis.EntityEvaluation;
import com.ads.guardian.decision.ActionIntent;
import com.ads.guardian.decision.DecisionProposal;
import com.ads.guardian.decision.DecisionSource;
import com.ads.guardian.decision.EntityStateView;
import com.ads.guardian.decision.HysteresisCounters;
import com.ads.guardian.decision.LifecycleState;
import com.ads.guardian.decision.ReasonCode;
import com.ads.guardian.persistence.*;
import com.ads.guardian.platform.MetricsSnapshot;
import com.ads.guardian.protection.HaltAssessment;
import com.ads.guardian.protection.HaltTrigger;
import com.ads.guardian.protection.LedgerEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sole writer of lifecycle state, decisions, ledgers and tick records.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GuardianStateStore {

    private static final int SNAPSHOT_RETENTION_HOURS = 48;

    private final ManagedEntityRepository entityRepository;
    private final EntityStateRepository stateRepository;
    private final GuardianDecisionRepository decisionRepository;
    private final MetricsSnapshotRepository snapshotRepository;
    private final LossLedgerRepository ledgerRepository;
    private final LossLedgerEntryRepository ledgerEntryRepository;
    private final TickRecordRepository tickRecordRepository;
    private final Clock clock;

    // ==================== Reads ====================

    @Transactional(readOnly = true)
    public List<ManagedEntityEntity> loadMonitoredEntities() {
        return entityRepository.findMonitored();
    }

    /**
     * Current state of each entity. Entities without a stored state start ACTIVE.
     */
    @Transactional(readOnly = true)
    public Map<String, EntityStateView> loadStates(Collection<String> entityIds) {
        Map<String, EntityStateView> states = new LinkedHashMap<>();
        for (String entityId : entityIds) {
            states.put(entityId, stateRepository.findById(entityId)
                    .map(EntityStateEntity::toView)
                    .orElseGet(() -> EntityStateView.initial(entityId)));
        }
        return states;
    }

    @Transactional(readOnly = true)
    public Map<LifecycleState, Long> countStates() {
        Map<LifecycleState, Long> counts = new EnumMap<>(LifecycleState.class);
        for (LifecycleState state : LifecycleState.values()) {
            counts.put(state, stateRepository.countByState(state));
        }
        return counts;
    }

    /**
     * Up to {@code maxTicks} snapshots of the entity taken before {@code before}, oldest first.
     */
    @Transactional(readOnly = true)
    public List<MetricsSnapshot> loadHistory(String entityId, LocalDateTime before, int maxTicks) {
        List<MetricsSnapshotEntity> rows = snapshotRepository.findRecentBefore(
                entityId, before, before.minusHours(24), PageRequest.of(0, maxTicks));
        List<MetricsSnapshot> history = new ArrayList<>(rows.size());
        for (MetricsSnapshotEntity row : rows) {
            history.add(row.toSnapshot());
        }
        Collections.reverse(history);
        return history;
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> loadLedgerEntries(String campaignId, LocalDateTime since) {
        List<LedgerEntry> entries = new ArrayList<>();
        for (LossLedgerEntryEntity row : ledgerEntryRepository.findInWindow(campaignId, since)) {
            entries.add(row.toEntry());
        }
        return entries;
    }

    @Transactional(readOnly = true)
    public boolean isHalted(String campaignId) {
        return ledgerRepository.findById(campaignId)
                .map(LossLedgerEntity::isHalted)
                .orElse(false);
    }

    @Transactional(readOnly = true)
    public List<GuardianDecisionEntity> loadDecisionHistory(String entityId) {
        return decisionRepository.findHistoryByEntity(entityId);
    }

    // ==================== Writes ====================

    /**
     * Commit one tick: snapshots, ledgers, decisions, lifecycle states and the tick record.
     * A decision whose from-state no longer matches the stored state (an operator changed it
     * while the tick ran) is dropped.
     */
    @Transactional
    public TickRecordEntity commitTick(TickBatch batch) {
        LocalDateTime tickTime = batch.getTickTime();

        int snapshotsSaved = 0;
        for (MetricsSnapshot snapshot : batch.getSnapshots()) {
            if (snapshotRepository.existsByEntityIdAndTickTime(snapshot.getEntityId(), snapshot.getTickTime())) {
                continue;
            }
            snapshotRepository.save(MetricsSnapshotEntity.from(snapshot));
            snapshotsSaved++;
        }

        int pruned = snapshotRepository.deleteOlderThan(tickTime.minusHours(SNAPSHOT_RETENTION_HOURS));
        if (pruned > 0) {
            log.debug("Pruned {} snapshots older than {}h", pruned, SNAPSHOT_RETENTION_HOURS);
        }

        for (HaltAssessment assessment : batch.getAssessments()) {
            saveLedger(assessment);
        }

        int recorded = 0;
        for (TickDecision decision : batch.getDecisions()) {
            if (saveDecision(decision, tickTime)) {
                recorded++;
            }
        }

        TickRecordEntity record = tickRecordRepository.save(TickRecordEntity.builder()
                .tickTime(tickTime)
                .outcome(TickOutcome.COMPLETED)
                .startedAt(batch.getStartedAt())
                .finishedAt(LocalDateTime.now(clock))
                .entitiesEvaluated(batch.getDecisions().size())
                .entitiesStale(batch.getStaleCount())
                .decisionsRecorded(recorded)
                .actionsApplied((int) batch.countApplied())
                .actionsFailed((int) batch.countFailed())
                .campaignsHalted((int) batch.countHalted())
                .build());

        log.info("Tick {} committed: {} snapshots, {} decisions, {} ledgers",
                tickTime, snapshotsSaved, recorded, batch.getAssessments().size());
        return record;
    }

    /**
     * Record a tick that committed nothing else (skipped, disabled or aborted).
     * Runs in its own transaction so it survives a rolled back tick.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public TickRecordEntity recordTickOutcome(LocalDateTime tickTime, TickOutcome outcome, String reason,
                                              LocalDateTime startedAt) {
        return tickRecordRepository.save(TickRecordEntity.builder()
                .tickTime(tickTime)
                .outcome(outcome)
                .startedAt(startedAt)
                .finishedAt(LocalDateTime.now(clock))
                .reason(truncate(reason, 500))
                .build());
    }

    /**
     * Ensure a newly registered entity has a stored ACTIVE state.
     */
    @Transactional
    public EntityStateEntity initializeState(String entityId) {
        return stateRepository.findById(entityId)
                .orElseGet(() -> stateRepository.save(EntityStateEntity.initial(entityId, LocalDateTime.now(clock))));
    }

    /**
     * Record an operator transition. Counters restart from zero.
     *
     * @param applyOutcome result of the platform call, null when none was needed
     */
    @Transactional
    public GuardianDecisionEntity recordOperatorTransition(String entityId, LifecycleState expectedFrom,
                                                           LifecycleState to, ReasonCode reason, String note,
                                                           ApplyOutcome applyOutcome) {
        LocalDateTime now = LocalDateTime.now(clock);
        EntityStateEntity state = stateRepository.findById(entityId)
                .orElseGet(() -> EntityStateEntity.initial(entityId, now));

        if (state.getState() != expectedFrom) {
            throw new IllegalStateException("Entity " + entityId + " is " + state.getState()
                    + ", expected " + expectedFrom);
        }

        String campaignId = entityRepository.findById(entityId)
                .map(ManagedEntityEntity::getCampaignId)
                .orElse(null);

        ActionIntent action = to.getPlatformStatus() == expectedFrom.getPlatformStatus() ? ActionIntent.NONE
                : (to == LifecycleState.ACTIVE ? ActionIntent.RESUME : ActionIntent.PAUSE);

        GuardianDecisionEntity decision = decisionRepository.save(GuardianDecisionEntity.builder()
                .entityId(entityId)
                .campaignId(campaignId)
                .tickTime(now)
                .source(DecisionSource.OPERATOR)
                .fromState(expectedFrom)
                .toState(to)
                .action(action)
                .reason(reason)
                .applyStatus(applyOutcome != null ? applyOutcome.getStatus() : ApplyStatus.NOT_REQUIRED)
                .idempotencyKey(applyOutcome != null ? applyOutcome.getIntent().getIdempotencyKey() : null)
                .attempts(applyOutcome != null ? applyOutcome.getAttempts() : 0)
                .note(truncate(note, 500))
                .createdAt(now)
                .build());

        state.setState(to);
        state.applyCounters(HysteresisCounters.zero());
        state.setLastDecisionId(decision.getId());
        state.setUpdatedAt(now);
        stateRepository.save(state);

        log.info("Operator moved {} from {} to {} ({})", entityId, expectedFrom, to, reason);
        return decision;
    }

    private boolean saveDecision(TickDecision tickDecision, LocalDateTime tickTime) {
        DecisionProposal proposal = tickDecision.getProposal();
        String entityId = proposal.getEntityId();
        LocalDateTime now = LocalDateTime.now(clock);

        EntityStateEntity state = stateRepository.findById(entityId)
                .orElseGet(() -> EntityStateEntity.initial(entityId, now));

        if (state.getState() != proposal.getFromState()) {
            log.warn("Dropping decision for {}: state changed to {} during tick (proposal was from {})",
                    entityId, state.getState(), proposal.getFromState());
            return false;
        }

        EntityEvaluation evaluation = tickDecision.getEvaluation();
        ApplyOutcome outcome = tickDecision.getApplyOutcome();
        HysteresisCounters counters = proposal.countersAfter(tickDecision.getApplyStatus());

        GuardianDecisionEntity.GuardianDecisionEntityBuilder row = GuardianDecisionEntity.builder()
                .entityId(entityId)
                .campaignId(evaluation != null ? evaluation.getCampaignId() : null)
                .tickTime(tickTime)
                .source(DecisionSource.GUARDIAN)
                .fromState(proposal.getFromState())
                .toState(proposal.getToState())
                .action(proposal.getAction())
                .reason(proposal.getReason())
                .stale(proposal.getInputs().isStale())
                .haltAsserted(proposal.getInputs().isHaltAsserted())
                .signalDirection(proposal.getInputs().getDirection())
                .confidence(proposal.getInputs().getConfidence())
                .signalBasis(proposal.getInputs().getBasis())
                .pacingStatus(proposal.getInputs().getPacingStatus())
                .negativeStreak(counters.getNegativeStreak())
                .nonNegativeStreak(counters.getNonNegativeStreak())
                .haltClearStreak(counters.getHaltClearStreak())
                .applyStatus(tickDecision.getApplyStatus())
                .createdAt(now);

        if (evaluation != null && !evaluation.isStale()) {
            row.profitEstimate(evaluation.getSignal().getProfitEstimate())
                    .pacingRatio(evaluation.getPacing().getPacingRatio());
            if (proposal.getAction() == ActionIntent.REPACE) {
                row.recommendedHourlySpend(evaluation.getPacing().getRecommendedHourlySpend());
            }
        } else if (evaluation != null) {
            row.note(truncate(evaluation.getStaleReason(), 500));
        }

        if (outcome != null) {
            row.idempotencyKey(outcome.getIntent().getIdempotencyKey())
                    .attempts(outcome.getAttempts())
                    .failureMessage(truncate(outcome.getFailureMessage(), 500));
        }

        GuardianDecisionEntity saved = decisionRepository.save(row.build());

        state.setState(tickDecision.getEffectiveState());
        state.applyCounters(counters);
        state.setLastDecisionId(saved.getId());
        state.setUpdatedAt(now);
        stateRepository.save(state);
        return true;
    }

    private void saveLedger(HaltAssessment assessment) {
        String campaignId = assessment.getCampaignId();

        if (assessment.getNewEntry() != null) {
            ledgerEntryRepository.save(LossLedgerEntryEntity.builder()
                    .campaignId(campaignId)
                    .intervalStart(assessment.getNewEntry().getIntervalStart())
                    .intervalEnd(assessment.getNewEntry().getIntervalEnd())
                    .amount(assessment.getNewEntry().getAmount())
                    .build());
        }
        ledgerEntryRepository.deleteRolledOut(campaignId, assessment.getWindowStart());

        LossLedgerEntity ledger = ledgerRepository.findById(campaignId)
                .orElseGet(() -> LossLedgerEntity.builder().campaignId(campaignId).build());

        ledger.setCumulativeLoss(assessment.getCumulativeLoss());
        ledger.setWindowStart(assessment.getWindowStart());
        ledger.setLossRatePerHour(assessment.getLossRatePerHour());
        ledger.setUpdatedAt(assessment.getTickTime());

        if (assessment.isHalted()) {
            if (!ledger.isHalted()) {
                ledger.setHaltedAt(assessment.getTickTime());
            }
            ledger.setHalted(true);
            ledger.setHaltTrigger(assessment.getTrigger());
        } else {
            ledger.setHalted(false);
            ledger.setHaltedAt(null);
            ledger.setHaltTrigger(HaltTrigger.NONE);
        }
        ledgerRepository.save(ledger);
    }

    @Transactional(readOnly = true)
    public Optional<LossLedgerEntity> findLedger(String campaignId) {
        return ledgerRepository.findById(campaignId);
    }

    static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
