package com.ads.guardian.service;

import com.ads.guardian.BaseIntegrationTest;
import com.ads.guardian.action.ApplyStatus;
import com.ads.guardian.decision.ActionIntent;
import com.ads.guardian.decision.DecisionReplayer;
import com.ads.guardian.decision.LifecycleState;
import com.ads.guardian.decision.ReasonCode;
import com.ads.guardian.decision.ReplayResult;
import com.ads.guardian.persistence.EntityStateEntity;
import com.ads.guardian.persistence.GuardianDecisionEntity;
import com.ads.guardian.persistence.LossLedgerEntity;
import com.ads.guardian.persistence.TickRecordEntity;
import com.ads.guardian.platform.EntityKind;
import com.ads.guardian.platform.MetricsSnapshot;
import com.ads.guardian.platform.PlatformException;
import com.ads.guardian.platform.PlatformStatus;
import com.ads.guardian.protection.HaltTrigger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full ticks against H2 and the in-memory ads platform.
 */
@DisplayName("GuardianTickService Tests")
class GuardianTickServiceTest extends BaseIntegrationTest {

    private static final LocalDateTime NOON = LocalDateTime.of(2024, 3, 4, 12, 0);

    @Autowired
    private GuardianTickService tickService;

    @Autowired
    private GuardianStatusService statusService;

    @Autowired
    private GuardianStateStore stateStore;

    @Autowired
    private DecisionReplayer replayer;

    @BeforeEach
    void setUp() {
        resetGuardian();
    }

    private void register(String id, EntityKind kind, String campaignId) {
        statusService.registerEntity(id, kind, campaignId, id, BigDecimal.valueOf(100));
    }

    private void metrics(String id, double spend, long clicks) {
        platform.setMetrics(MetricsSnapshot.builder()
                .entityId(id)
                .spend(BigDecimal.valueOf(spend))
                .conversions(BigDecimal.ZERO)
                .clicks(clicks)
                .impressions(clicks * 20)
                .elapsedDayFraction(0.5)
                .build());
    }

    private LifecycleState stateOf(String id) {
        return stateRepository.findById(id).map(EntityStateEntity::getState).orElseThrow();
    }

    private GuardianDecisionEntity lastDecision(String id) {
        return decisionRepository.findFirstByEntityIdOrderByIdDesc(id).orElseThrow();
    }

    @Nested
    @DisplayName("Guardian pause")
    class PauseTests {

        @Test
        @DisplayName("Two unprofitable ticks pause the keyword exactly once")
        void twoNegativeTicksPause() {
            register("kw-1", EntityKind.KEYWORD, "c-1");

            // Tick 1: 80 spent against a 50 target, no conversions
            metrics("kw-1", 80, 40);
            TickRecordEntity first = tickService.runTick(NOON);

            assertThat(first.getOutcome()).isEqualTo(TickOutcome.COMPLETED);
            GuardianDecisionEntity repace = lastDecision("kw-1");
            assertThat(repace.getAction()).isEqualTo(ActionIntent.REPACE);
            assertThat(repace.getReason()).isEqualTo(ReasonCode.OVER_PACE);
            assertThat(repace.getPacingRatio()).isEqualByComparingTo("1.6");
            assertThat(repace.getRecommendedHourlySpend()).isEqualByComparingTo("1.67");
            assertThat(repace.getNegativeStreak()).isEqualTo(1);
            assertThat(stateOf("kw-1")).isEqualTo(LifecycleState.ACTIVE);
            assertThat(platform.getStatusCalls()).isZero();

            // the 80 accrued over the first 12 hours, well under the 40/h rate limit
            LossLedgerEntity afterFirst = ledgerRepository.findById("c-1").orElseThrow();
            assertThat(afterFirst.isHalted()).isFalse();
            assertThat(afterFirst.getLossRatePerHour()).isEqualByComparingTo("6.6667");

            // Tick 2: 15 more, still nothing
            metrics("kw-1", 95, 55);
            TickRecordEntity second = tickService.runTick(NOON.plusMinutes(15));

            GuardianDecisionEntity pause = lastDecision("kw-1");
            assertThat(pause.getAction()).isEqualTo(ActionIntent.PAUSE);
            assertThat(pause.getReason()).isEqualTo(ReasonCode.NEGATIVE_PROFIT_PROXY);
            assertThat(pause.getApplyStatus()).isEqualTo(ApplyStatus.APPLIED);
            assertThat(pause.getIdempotencyKey()).startsWith("kw-1:PAUSED:");
            assertThat(stateOf("kw-1")).isEqualTo(LifecycleState.GUARDIAN_PAUSED);
            assertThat(platform.statusOf("kw-1")).isEqualTo(PlatformStatus.PAUSED);
            assertThat(platform.effectiveChanges("kw-1")).isEqualTo(1);
            assertThat(second.getActionsApplied()).isEqualTo(1);
            assertThat(alertRepository.findByType(AlertType.ENTITY_PAUSED)).hasSize(1);

            LossLedgerEntity ledger = ledgerRepository.findById("c-1").orElseThrow();
            assertThat(ledger.getCumulativeLoss()).isEqualByComparingTo("95");
            assertThat(ledger.isHalted()).isFalse();
        }

        @Test
        @DisplayName("Paused keyword makes no further platform calls while still unprofitable")
        void noRepeatedPause() {
            register("kw-1", EntityKind.KEYWORD, "c-1");
            metrics("kw-1", 80, 40);
            tickService.runTick(NOON);
            metrics("kw-1", 95, 55);
            tickService.runTick(NOON.plusMinutes(15));

            tickService.runTick(NOON.plusMinutes(30));

            assertThat(stateOf("kw-1")).isEqualTo(LifecycleState.GUARDIAN_PAUSED);
            assertThat(lastDecision("kw-1").getReason()).isEqualTo(ReasonCode.STILL_UNPROFITABLE);
            assertThat(platform.getStatusCalls()).isEqualTo(1);
        }

        @Test
        @DisplayName("Replaying the decision log reproduces the stored state")
        void replayMatchesStoredState() {
            register("kw-1", EntityKind.KEYWORD, "c-1");
            metrics("kw-1", 80, 40);
            tickService.runTick(NOON);
            metrics("kw-1", 95, 55);
            tickService.runTick(NOON.plusMinutes(15));
            tickService.runTick(NOON.plusMinutes(30));

            ReplayResult replay = replayer.replay("kw-1", stateStore.loadDecisionHistory("kw-1"));
            EntityStateEntity stored = stateRepository.findById("kw-1").orElseThrow();

            assertThat(replay.isConsistent()).isTrue();
            assertThat(replay.getDecisionsReplayed()).isEqualTo(3);
            assertThat(replay.getFinalState().getState()).isEqualTo(stored.getState());
            assertThat(replay.getFinalState().getCounters()).isEqualTo(stored.counters());
        }
    }

    @Nested
    @DisplayName("Failed actions")
    class FailedActionTests {

        @Test
        @DisplayName("Rejected pause keeps the entity ACTIVE and raises an alert")
        void rejectedPause() {
            register("kw-1", EntityKind.KEYWORD, "c-1");
            metrics("kw-1", 80, 40);
            tickService.runTick(NOON);

            platform.failStatusUpdate("kw-1", new PlatformException("403 Forbidden", false));
            metrics("kw-1", 95, 55);
            TickRecordEntity record = tickService.runTick(NOON.plusMinutes(15));

            GuardianDecisionEntity decision = lastDecision("kw-1");
            assertThat(decision.getToState()).isEqualTo(LifecycleState.GUARDIAN_PAUSED);
            assertThat(decision.getApplyStatus()).isEqualTo(ApplyStatus.FAILED);
            assertThat(decision.getFailureMessage()).contains("403");
            assertThat(stateOf("kw-1")).isEqualTo(LifecycleState.ACTIVE);
            assertThat(platform.statusOf("kw-1")).isEqualTo(PlatformStatus.ENABLED);
            assertThat(record.getActionsFailed()).isEqualTo(1);
            assertThat(alertRepository.findByType(AlertType.ACTION_FAILED)).hasSize(1);

            ReplayResult replay = replayer.replay("kw-1", stateStore.loadDecisionHistory("kw-1"));
            assertThat(replay.isConsistent()).isTrue();
            assertThat(replay.getFinalState().getState()).isEqualTo(LifecycleState.ACTIVE);
        }

        @Test
        @DisplayName("Rejected pause is retried on the next unprofitable tick")
        void rejectedPauseRetriedNextTick() {
            register("kw-1", EntityKind.KEYWORD, "c-1");
            metrics("kw-1", 80, 40);
            tickService.runTick(NOON);

            platform.failStatusUpdate("kw-1", new PlatformException("403 Forbidden", false));
            metrics("kw-1", 95, 55);
            tickService.runTick(NOON.plusMinutes(15));
            assertThat(stateOf("kw-1")).isEqualTo(LifecycleState.ACTIVE);
            assertThat(stateRepository.findById("kw-1").orElseThrow().getNegativeStreak()).isEqualTo(2);

            metrics("kw-1", 100, 70);
            tickService.runTick(NOON.plusMinutes(30));

            GuardianDecisionEntity retry = lastDecision("kw-1");
            assertThat(retry.getAction()).isEqualTo(ActionIntent.PAUSE);
            assertThat(retry.getApplyStatus()).isEqualTo(ApplyStatus.APPLIED);
            assertThat(stateOf("kw-1")).isEqualTo(LifecycleState.GUARDIAN_PAUSED);
            assertThat(platform.statusOf("kw-1")).isEqualTo(PlatformStatus.PAUSED);

            ReplayResult replay = replayer.replay("kw-1", stateStore.loadDecisionHistory("kw-1"));
            EntityStateEntity stored = stateRepository.findById("kw-1").orElseThrow();
            assertThat(replay.isConsistent()).isTrue();
            assertThat(replay.getFinalState().getState()).isEqualTo(LifecycleState.GUARDIAN_PAUSED);
            assertThat(replay.getFinalState().getCounters()).isEqualTo(stored.counters());
        }
    }

    @Nested
    @DisplayName("Circuit halt")
    class HaltTests {

        @BeforeEach
        void registerCampaign() {
            register("c-9", EntityKind.CAMPAIGN, null);
            register("ag-9", EntityKind.AD_GROUP, "c-9");
            register("kw-9", EntityKind.KEYWORD, "c-9");
        }

        @Test
        @DisplayName("Loss above the absolute limit halts every entity of the campaign")
        void absoluteLimitHaltsCampaign() {
            metrics("c-9", 120, 5);
            metrics("ag-9", 60, 3);
            metrics("kw-9", 30, 2);

            TickRecordEntity record = tickService.runTick(NOON);

            assertThat(record.getCampaignsHalted()).isEqualTo(1);
            for (String id : List.of("c-9", "ag-9", "kw-9")) {
                assertThat(stateOf(id)).isEqualTo(LifecycleState.CIRCUIT_HALTED);
                assertThat(lastDecision(id).getReason()).isEqualTo(ReasonCode.CIRCUIT_HALT_ASSERTED);
                assertThat(platform.statusOf(id)).isEqualTo(PlatformStatus.PAUSED);
            }

            // only the campaign layer is booked
            LossLedgerEntity ledger = ledgerRepository.findById("c-9").orElseThrow();
            assertThat(ledger.getCumulativeLoss()).isEqualByComparingTo("120");
            assertThat(ledger.getHaltTrigger()).isEqualTo(HaltTrigger.ABSOLUTE_LIMIT);
            assertThat(ledger.getHaltedAt()).isEqualTo(NOON);
            assertThat(alertRepository.findByType(AlertType.CIRCUIT_HALT)).hasSize(1);
        }

        @Test
        @DisplayName("Halt clears once the loss rolls out, entities re-enter after two clean ticks")
        void haltClearsAndEntitiesReenter() {
            metrics("c-9", 120, 5);
            metrics("ag-9", 60, 3);
            metrics("kw-9", 30, 2);
            tickService.runTick(NOON);

            metrics("c-9", 0, 0);
            metrics("ag-9", 0, 0);
            metrics("kw-9", 0, 0);
            LocalDateTime nextDay = NOON.plusHours(25);

            tickService.runTick(nextDay);

            assertThat(ledgerRepository.findById("c-9").orElseThrow().isHalted()).isFalse();
            assertThat(alertRepository.findByType(AlertType.CIRCUIT_HALT_CLEARED)).hasSize(1);
            assertThat(stateOf("kw-9")).isEqualTo(LifecycleState.CIRCUIT_HALTED);
            assertThat(lastDecision("kw-9").getReason()).isEqualTo(ReasonCode.HALT_CLEARED_PENDING_REEVALUATION);
            assertThat(platform.statusOf("kw-9")).isEqualTo(PlatformStatus.PAUSED);

            tickService.runTick(nextDay.plusMinutes(15));

            for (String id : List.of("c-9", "ag-9", "kw-9")) {
                assertThat(stateOf(id)).isEqualTo(LifecycleState.ACTIVE);
                assertThat(lastDecision(id).getAction()).isEqualTo(ActionIntent.RESUME);
                assertThat(platform.statusOf(id)).isEqualTo(PlatformStatus.ENABLED);
            }
            assertThat(ledgerEntryRepository.findInWindow("c-9", NOON.minusDays(1))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Degraded ticks")
    class DegradedTickTests {

        @Test
        @DisplayName("Entity without metrics is skipped while the others are evaluated")
        void missingEntityIsSkipped() {
            register("kw-1", EntityKind.KEYWORD, "c-1");
            register("kw-2", EntityKind.KEYWORD, "c-1");
            metrics("kw-1", 10, 20);

            TickRecordEntity record = tickService.runTick(NOON);

            assertThat(record.getOutcome()).isEqualTo(TickOutcome.COMPLETED);
            assertThat(record.getEntitiesStale()).isEqualTo(1);
            GuardianDecisionEntity skipped = lastDecision("kw-2");
            assertThat(skipped.isStale()).isTrue();
            assertThat(skipped.getReason()).isEqualTo(ReasonCode.STALE_METRICS);
            assertThat(skipped.getNote()).startsWith("SKIPPED");
            assertThat(lastDecision("kw-1").isStale()).isFalse();
            assertThat(alertRepository.findByType(AlertType.PERMANENT_FETCH_FAILURE)).hasSize(1);
        }

        @Test
        @DisplayName("Stale tick leaves the hysteresis counters untouched")
        void staleKeepsCounters() {
            register("kw-1", EntityKind.KEYWORD, "c-1");
            register("kw-2", EntityKind.KEYWORD, "c-1");
            metrics("kw-1", 80, 40);
            metrics("kw-2", 1, 1);
            tickService.runTick(NOON);
            assertThat(stateRepository.findById("kw-1").orElseThrow().getNegativeStreak()).isEqualTo(1);

            platform.removeMetrics("kw-1");
            tickService.runTick(NOON.plusMinutes(15));

            EntityStateEntity state = stateRepository.findById("kw-1").orElseThrow();
            assertThat(state.getState()).isEqualTo(LifecycleState.ACTIVE);
            assertThat(state.getNegativeStreak()).isEqualTo(1);
        }

        @Test
        @DisplayName("Platform outage aborts the tick without touching state")
        void outageAborts() {
            register("kw-1", EntityKind.KEYWORD, "c-1");
            metrics("kw-1", 80, 40);
            platform.failAllFetches(new IllegalStateException("Connection refused"));

            TickRecordEntity record = tickService.runTick(NOON);

            assertThat(record.getOutcome()).isEqualTo(TickOutcome.ABORTED);
            assertThat(record.getReason()).contains("all");
            assertThat(decisionRepository.count()).isZero();
            assertThat(stateOf("kw-1")).isEqualTo(LifecycleState.ACTIVE);
            assertThat(alertRepository.findByType(AlertType.TICK_ABORTED)).hasSize(1);
        }

        @Test
        @DisplayName("No monitored entities still completes")
        void emptyTick() {
            TickRecordEntity record = tickService.runTick(NOON);

            assertThat(record.getOutcome()).isEqualTo(TickOutcome.COMPLETED);
            assertThat(record.getEntitiesEvaluated()).isZero();
            assertThat(platform.getFetchCalls()).isZero();
        }
    }

    @Nested
    @DisplayName("Manual pause")
    class ManualPauseTests {

        @Test
        @DisplayName("The guardian leaves a manually paused entity alone")
        void manualPauseIsRespected() {
            register("kw-1", EntityKind.KEYWORD, "c-1");
            statusService.markManuallyPaused("kw-1", "checking landing page");
            assertThat(platform.statusOf("kw-1")).isEqualTo(PlatformStatus.PAUSED);
            int callsAfterPause = platform.getStatusCalls();

            metrics("kw-1", 10, 40);
            tickService.runTick(NOON);
            tickService.runTick(NOON.plusMinutes(15));
            tickService.runTick(NOON.plusMinutes(30));

            assertThat(stateOf("kw-1")).isEqualTo(LifecycleState.MANUALLY_PAUSED);
            assertThat(lastDecision("kw-1").getReason()).isEqualTo(ReasonCode.MANUAL_PAUSE_OBSERVED);
            assertThat(platform.getStatusCalls()).isEqualTo(callsAfterPause);
            assertThat(platform.statusOf("kw-1")).isEqualTo(PlatformStatus.PAUSED);
        }
    }
}
