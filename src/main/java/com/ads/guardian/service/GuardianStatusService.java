package com.ads.guardian.service;

import com.ads.guardian.action.ActionApplier;
import com.ads.guardian.action.ApplyOutcome;
import com.ads.guardian.action.ApplyStatus;
import com.ads.guardian.action.StatusChangeIntent;
import com.ads.guardian.decision.ActionIntent;
import com.ads.guardian.decision.LifecycleState;
import com.ads.guardian.decision.ReasonCode;
import com.ads.guardian.persistence.*;
import com.ads.guardian.platform.EntityKind;
import com.ads.guardian.protection.HaltTrigger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the guardian plus the operator operations that run outside the tick loop.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GuardianStatusService {

    private final ManagedEntityRepository entityRepository;
    private final EntityStateRepository stateRepository;
    private final GuardianDecisionRepository decisionRepository;
    private final LossLedgerRepository ledgerRepository;
    private final TickRecordRepository tickRecordRepository;
    private final GuardianStateStore stateStore;
    private final OperatorAlertService alertService;
    private final ActionApplier actionApplier;
    private final GuardianContext context;
    private final Clock clock;

    // ==================== Queries ====================

    @Transactional(readOnly = true)
    public Optional<EntityStatusView> getCurrentState(String entityId) {
        Optional<EntityStateEntity> state = stateRepository.findById(entityId);
        if (state.isEmpty()) {
            return Optional.empty();
        }
        GuardianDecisionEntity last = decisionRepository.findFirstByEntityIdOrderByIdDesc(entityId).orElse(null);
        return Optional.of(EntityStatusView.builder()
                .entityId(entityId)
                .state(state.get().getState())
                .counters(state.get().counters())
                .lastDecision(last)
                .build());
    }

    /**
     * Ledger of a campaign. A campaign with no recorded loss yields a zero ledger.
     */
    @Transactional(readOnly = true)
    public LossLedgerView getLossLedger(String campaignId) {
        return ledgerRepository.findById(campaignId)
                .map(ledger -> LossLedgerView.builder()
                        .campaignId(campaignId)
                        .cumulativeLoss(ledger.getCumulativeLoss())
                        .windowStart(ledger.getWindowStart())
                        .lossRatePerHour(ledger.getLossRatePerHour())
                        .halted(ledger.isHalted())
                        .haltedAt(ledger.getHaltedAt())
                        .haltTrigger(ledger.getHaltTrigger())
                        .build())
                .orElseGet(() -> LossLedgerView.builder()
                        .campaignId(campaignId)
                        .cumulativeLoss(BigDecimal.ZERO)
                        .lossRatePerHour(BigDecimal.ZERO)
                        .halted(false)
                        .haltTrigger(HaltTrigger.NONE)
                        .build());
    }

    /**
     * Most recent decisions first.
     */
    @Transactional(readOnly = true)
    public List<GuardianDecisionEntity> listDecisionHistory(String entityId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        return decisionRepository.findRecentByEntity(entityId, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<TickRecordEntity> listRecentTicks(int limit) {
        return tickRecordRepository.findRecent(PageRequest.of(0, Math.max(1, limit)));
    }

    @Transactional(readOnly = true)
    public List<OperatorAlertEntity> listOpenAlerts() {
        return alertService.listOpen();
    }

    public boolean acknowledgeAlert(long alertId) {
        return alertService.acknowledge(alertId);
    }

    @Transactional(readOnly = true)
    public DailyStats getDailyStats(LocalDate date) {
        LocalDateTime since = date.atStartOfDay();
        return DailyStats.builder()
                .date(date)
                .ticksCompleted(tickRecordRepository.countByOutcomeSince(TickOutcome.COMPLETED, since))
                .ticksSkipped(tickRecordRepository.countByOutcomeSince(TickOutcome.SKIPPED, since))
                .ticksAborted(tickRecordRepository.countByOutcomeSince(TickOutcome.ABORTED, since))
                .pauses(decisionRepository.countByActionSince(ActionIntent.PAUSE, since))
                .resumes(decisionRepository.countByActionSince(ActionIntent.RESUME, since))
                .repaces(decisionRepository.countByActionSince(ActionIntent.REPACE, since))
                .failedActions(decisionRepository.countByApplyStatusSince(ApplyStatus.FAILED, since))
                .haltedCampaigns(ledgerRepository.findHalted().size())
                .openAlerts(alertService.listOpen().size())
                .build();
    }

    public DailyStats getDailyStats() {
        return getDailyStats(LocalDate.now(clock));
    }

    // ==================== Operator operations ====================

    /**
     * Register an entity for guardianship. A campaign is its own parent.
     */
    @Transactional
    public ManagedEntityEntity registerEntity(String entityId, EntityKind kind, String campaignId,
                                              String displayName, BigDecimal dailyBudget) {
        if (entityRepository.existsById(entityId)) {
            throw new IllegalArgumentException("Entity already registered: " + entityId);
        }
        if (dailyBudget == null || dailyBudget.signum() < 0) {
            throw new IllegalArgumentException("Daily budget must not be negative");
        }
        String parent = kind == EntityKind.CAMPAIGN ? entityId : campaignId;
        if (parent == null || parent.isBlank()) {
            throw new IllegalArgumentException("Campaign id required for " + kind.getDisplayName());
        }

        ManagedEntityEntity entity = entityRepository.save(ManagedEntityEntity.builder()
                .entityId(entityId)
                .kind(kind)
                .campaignId(parent)
                .displayName(displayName)
                .dailyBudget(dailyBudget)
                .monitored(true)
                .createdAt(LocalDateTime.now(clock))
                .build());
        stateStore.initializeState(entityId);

        log.info("Registered {} {} in campaign {} with budget {}", kind.getDisplayName(), entityId, parent, dailyBudget);
        return entity;
    }

    /**
     * Change the daily budget target. Picked up by the next tick.
     */
    @Transactional
    public ManagedEntityEntity updateBudgetTarget(String entityId, BigDecimal dailyBudget) {
        if (dailyBudget == null || dailyBudget.signum() < 0) {
            throw new IllegalArgumentException("Daily budget must not be negative");
        }
        ManagedEntityEntity entity = entityRepository.findById(entityId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity: " + entityId));
        BigDecimal previous = entity.getDailyBudget();
        entity.setDailyBudget(dailyBudget);
        entity.setBudgetUpdatedAt(LocalDateTime.now(clock));
        log.info("Budget of {} changed from {} to {}", entityId, previous, dailyBudget);
        return entityRepository.save(entity);
    }

    /**
     * Hand an entity to the operator. The guardian stops acting on it until released.
     * Pauses it on the platform when it is currently serving.
     */
    public GuardianDecisionEntity markManuallyPaused(String entityId, String note) {
        claimSlot(entityId);
        try {
            LifecycleState from = requireState(entityId);
            if (from == LifecycleState.MANUALLY_PAUSED) {
                throw new IllegalStateException("Entity " + entityId + " is already manually paused");
            }
            ApplyOutcome outcome = applyIfNeeded(entityId, from, LifecycleState.MANUALLY_PAUSED);
            return stateStore.recordOperatorTransition(entityId, from, LifecycleState.MANUALLY_PAUSED,
                    ReasonCode.OPERATOR_MANUAL_PAUSE, note, outcome);
        } finally {
            context.releaseSlot();
        }
    }

    /**
     * Return a manually paused entity to the guardian as ACTIVE and enable it on the platform.
     */
    public GuardianDecisionEntity releaseManualPause(String entityId, String note) {
        claimSlot(entityId);
        try {
            LifecycleState from = requireState(entityId);
            if (from != LifecycleState.MANUALLY_PAUSED) {
                throw new IllegalStateException("Entity " + entityId + " is not manually paused (" + from + ")");
            }
            ApplyOutcome outcome = applyIfNeeded(entityId, from, LifecycleState.ACTIVE);
            return stateStore.recordOperatorTransition(entityId, from, LifecycleState.ACTIVE,
                    ReasonCode.OPERATOR_MANUAL_RELEASE, note, outcome);
        } finally {
            context.releaseSlot();
        }
    }

    /**
     * Operator transitions hold the tick slot so a tick cannot act on a state they are changing.
     */
    private void claimSlot(String entityId) {
        if (!context.tryBeginTick()) {
            log.warn("Refusing operator transition of {}: a tick is in flight", entityId);
            throw new IllegalStateException("A guardian tick is in progress, retry " + entityId + " shortly");
        }
    }

    private LifecycleState requireState(String entityId) {
        if (!entityRepository.existsById(entityId)) {
            throw new IllegalArgumentException("Unknown entity: " + entityId);
        }
        return stateRepository.findById(entityId)
                .map(EntityStateEntity::getState)
                .orElse(LifecycleState.ACTIVE);
    }

    private ApplyOutcome applyIfNeeded(String entityId, LifecycleState from, LifecycleState to) {
        if (from.getPlatformStatus() == to.getPlatformStatus()) {
            return null;
        }
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
        ApplyOutcome outcome = actionApplier.apply(StatusChangeIntent.of(entityId, from, to, now));
        if (outcome.isFailed()) {
            throw new IllegalStateException("Could not set " + entityId + " to " + to.getPlatformStatus()
                    + ": " + outcome.getFailureMessage());
        }
        return outcome;
    }
}
