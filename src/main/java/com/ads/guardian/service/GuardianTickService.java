package com.ads.guardian.service;

import com.ads.guardian.action.ActionApplier;
import com.ads.guardian.action.ApplyOutcome;
import com.ads.guardian.action.StatusChangeIntent;
import com.ads.guardian.analysis.EntityEvaluation;
import com.ads.guardian.analysis.PerformanceEvaluator;
import com.ads.guardian.config.GuardianSettings;
import com.ads.guardian.decision.ActionIntent;
import com.ads.guardian.decision.DecisionEngine;
import com.ads.guardian.decision.DecisionProposal;
import com.ads.guardian.decision.EntityStateView;
import com.ads.guardian.persistence.ManagedEntityEntity;
import com.ads.guardian.persistence.TickRecordEntity;
import com.ads.guardian.platform.FetchException;
import com.ads.guardian.platform.MetricsSnapshot;
import com.ads.guardian.protection.CapitalProtector;
import com.ads.guardian.protection.HaltAssessment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One guardian tick: fetch, evaluate, protect, decide, apply, commit.
 * Per-entity failures are recorded and never abort the tick.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GuardianTickService {

    private final GuardianStateStore stateStore;
    private final MetricsSnapshotFetcher fetcher;
    private final PerformanceEvaluator evaluator;
    private final CapitalProtector protector;
    private final DecisionEngine decisionEngine;
    private final ActionApplier actionApplier;
    private final OperatorAlertService alertService;
    private final GuardianContext context;
    private final GuardianSettings settings;
    private final Clock clock;

    /**
     * Run one tick now on the calling thread. Empty when another tick is in flight.
     */
    public Optional<TickRecordEntity> runNow() {
        if (!context.tryBeginTick()) {
            log.info("Manual tick refused: a tick is already in flight");
            return Optional.empty();
        }
        LocalDateTime tickTime = currentTickTime();
        TickRecordEntity record = null;
        try {
            record = runTick(tickTime);
            return Optional.of(record);
        } finally {
            context.endTick(tickTime, record != null ? record.getOutcome() : TickOutcome.ABORTED);
        }
    }

    public LocalDateTime currentTickTime() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
    }

    /**
     * Run one tick. Callers must hold the tick slot of {@link GuardianContext}.
     */
    public TickRecordEntity runTick(LocalDateTime tickTime) {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        log.info("=== Guardian tick {} ===", tickTime);

        try {
            return executeTick(tickTime, startedAt);
        } catch (TickAbortedException e) {
            return abort(tickTime, startedAt, e.getMessage(), e);
        } catch (DataAccessException e) {
            return abort(tickTime, startedAt, "State store unavailable: " + e.getMessage(), e);
        }
    }

    public TickRecordEntity recordSkipped(LocalDateTime tickTime, String reason) {
        log.warn("Tick {} skipped: {}", tickTime, reason);
        return stateStore.recordTickOutcome(tickTime, TickOutcome.SKIPPED, reason, LocalDateTime.now(clock));
    }

    public TickRecordEntity recordDisabled(LocalDateTime tickTime) {
        log.debug("Tick {} not run: guardian disabled", tickTime);
        return stateStore.recordTickOutcome(tickTime, TickOutcome.DISABLED, "Guardian disabled",
                LocalDateTime.now(clock));
    }

    private TickRecordEntity executeTick(LocalDateTime tickTime, LocalDateTime startedAt) {
        List<ManagedEntityEntity> entities = stateStore.loadMonitoredEntities();
        if (entities.isEmpty()) {
            log.info("No monitored entities");
            return stateStore.commitTick(TickBatch.builder().tickTime(tickTime).startedAt(startedAt).build());
        }

        FetchReport report = fetcher.fetch(entities, tickTime);
        List<String> ids = new ArrayList<>();
        for (ManagedEntityEntity entity : entities) {
            ids.add(entity.getEntityId());
        }
        Map<String, EntityStateView> states = stateStore.loadStates(ids);

        // Evaluate
        Map<String, EntityEvaluation> evaluations = new LinkedHashMap<>();
        Map<String, List<EntityEvaluation>> byCampaign = new LinkedHashMap<>();
        List<MetricsSnapshot> snapshots = new ArrayList<>();
        int staleCount = 0;

        for (ManagedEntityEntity entity : entities) {
            EntityEvaluation evaluation = evaluate(entity, report, tickTime);
            if (evaluation.isStale()) {
                staleCount++;
            } else {
                snapshots.add(evaluation.getSnapshot());
            }
            evaluations.put(entity.getEntityId(), evaluation);
            byCampaign.computeIfAbsent(entity.getCampaignId(), k -> new ArrayList<>()).add(evaluation);
        }

        // Protect
        Map<String, HaltAssessment> assessments = new LinkedHashMap<>();
        LocalDateTime ledgerSince = tickTime.minus(settings.getLossWindow());
        for (Map.Entry<String, List<EntityEvaluation>> campaign : byCampaign.entrySet()) {
            String campaignId = campaign.getKey();
            assessments.put(campaignId, protector.assess(campaignId, campaign.getValue(),
                    stateStore.loadLedgerEntries(campaignId, ledgerSince),
                    stateStore.isHalted(campaignId), tickTime));
        }

        // Decide
        List<DecisionProposal> proposals = new ArrayList<>();
        List<StatusChangeIntent> intents = new ArrayList<>();
        for (ManagedEntityEntity entity : entities) {
            boolean halted = assessments.get(entity.getCampaignId()).isHalted();
            DecisionProposal proposal = decisionEngine.decide(
                    states.get(entity.getEntityId()), evaluations.get(entity.getEntityId()), halted);
            proposals.add(proposal);

            if (proposal.requiresStatusChange()) {
                intents.add(StatusChangeIntent.of(entity.getEntityId(),
                        proposal.getFromState(), proposal.getToState(), tickTime));
            }
            if (proposal.isTransition() || proposal.getAction() != ActionIntent.NONE) {
                log.info("Entity {}: {} -> {} [{}] {}", entity.getEntityId(), proposal.getFromState(),
                        proposal.getToState(), proposal.getAction(), proposal.getReason());
            }
        }

        // Apply
        Map<String, ApplyOutcome> outcomes = actionApplier.applyAll(intents);

        List<TickDecision> decisions = new ArrayList<>();
        for (DecisionProposal proposal : proposals) {
            decisions.add(TickDecision.builder()
                    .proposal(proposal)
                    .evaluation(evaluations.get(proposal.getEntityId()))
                    .applyOutcome(outcomes.get(proposal.getEntityId()))
                    .build());
        }

        // Commit
        TickBatch batch = TickBatch.builder()
                .tickTime(tickTime)
                .startedAt(startedAt)
                .snapshots(snapshots)
                .assessments(new ArrayList<>(assessments.values()))
                .decisions(decisions)
                .staleCount(staleCount)
                .build();
        TickRecordEntity record = stateStore.commitTick(batch);

        raiseAlerts(report, batch);

        log.info("Tick {} completed: {} entities, {} stale, {} applied, {} failed, {} campaigns halted",
                tickTime, entities.size(), staleCount, batch.countApplied(), batch.countFailed(), batch.countHalted());
        return record;
    }

    private EntityEvaluation evaluate(ManagedEntityEntity entity, FetchReport report, LocalDateTime tickTime) {
        Optional<MetricsSnapshot> snapshot = report.snapshotOf(entity.getEntityId());
        if (snapshot.isEmpty()) {
            FetchException error = report.getFailures().get(entity.getEntityId());
            String prefix = report.isSkipped(entity.getEntityId()) ? "SKIPPED" : "STALE";
            return EntityEvaluation.stale(entity, prefix + ": " + (error != null ? error.getMessage() : "no data"));
        }
        List<MetricsSnapshot> history = stateStore.loadHistory(entity.getEntityId(), tickTime, settings.getHistoryTicks());
        return evaluator.evaluate(entity, snapshot.get(), history);
    }

    private void raiseAlerts(FetchReport report, TickBatch batch) {
        for (Map.Entry<String, FetchException> failure : report.getFailures().entrySet()) {
            if (!failure.getValue().isRetryable()) {
                alertService.raise(AlertType.PERMANENT_FETCH_FAILURE, AlertSeverity.WARNING, failure.getKey(), null,
                        "Metrics unavailable, entity skipped: " + failure.getValue().getMessage());
            }
        }

        for (HaltAssessment assessment : batch.getAssessments()) {
            if (assessment.isNewlyHalted()) {
                alertService.raise(AlertType.CIRCUIT_HALT, AlertSeverity.CRITICAL, null, assessment.getCampaignId(),
                        String.format("%s. Loss %s in window, %s/h", assessment.getTrigger().getDescription(),
                                assessment.getCumulativeLoss(), assessment.getLossRatePerHour()));
            } else if (assessment.isCleared()) {
                alertService.raise(AlertType.CIRCUIT_HALT_CLEARED, AlertSeverity.INFO, null, assessment.getCampaignId(),
                        "Loss back under limits: " + assessment.getCumulativeLoss() + " in window");
            }
        }

        for (TickDecision decision : batch.getDecisions()) {
            DecisionProposal proposal = decision.getProposal();
            String campaignId = decision.getEvaluation() != null ? decision.getEvaluation().getCampaignId() : null;
            ApplyOutcome outcome = decision.getApplyOutcome();

            if (outcome != null && outcome.isFailed()) {
                alertService.raise(AlertType.ACTION_FAILED, AlertSeverity.CRITICAL, proposal.getEntityId(), campaignId,
                        String.format("%s to %s failed after %d attempts: %s", proposal.getAction(),
                                proposal.getTargetStatus(), outcome.getAttempts(), outcome.getFailureMessage()));
            } else if (outcome != null && proposal.getAction() == ActionIntent.PAUSE) {
                alertService.raise(AlertType.ENTITY_PAUSED, AlertSeverity.WARNING, proposal.getEntityId(), campaignId,
                        "Paused (" + proposal.getReason() + ")");
            } else if (outcome != null && proposal.getAction() == ActionIntent.RESUME) {
                alertService.raise(AlertType.ENTITY_RESUMED, AlertSeverity.INFO, proposal.getEntityId(), campaignId,
                        "Resumed (" + proposal.getReason() + ")");
            }
        }
    }

    private TickRecordEntity abort(LocalDateTime tickTime, LocalDateTime startedAt, String reason, Exception cause) {
        log.error("Tick {} aborted: {}", tickTime, reason, cause);
        TickRecordEntity record = stateStore.recordTickOutcome(tickTime, TickOutcome.ABORTED, reason, startedAt);
        alertService.raise(AlertType.TICK_ABORTED, AlertSeverity.CRITICAL, null, null, reason);
        return record;
    }
}
