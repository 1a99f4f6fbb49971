package com.ads.guardian.service;

import com.ads.guardian.BaseIntegrationTest;
import com.ads.guardian.decision.ActionIntent;
import com.ads.guardian.decision.DecisionSource;
import com.ads.guardian.decision.LifecycleState;
import com.ads.guardian.decision.ReasonCode;
import com.ads.guardian.persistence.GuardianDecisionEntity;
import com.ads.guardian.persistence.ManagedEntityEntity;
import com.ads.guardian.persistence.OperatorAlertEntity;
import com.ads.guardian.persistence.TickRecordEntity;
import com.ads.guardian.platform.EntityKind;
import com.ads.guardian.platform.PlatformException;
import com.ads.guardian.platform.PlatformStatus;
import com.ads.guardian.protection.HaltTrigger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GuardianStatusService Tests")
class GuardianStatusServiceTest extends BaseIntegrationTest {

    @Autowired
    private GuardianStatusService statusService;

    @Autowired
    private GuardianStateStore stateStore;

    @Autowired
    private OperatorAlertService alertService;

    @Autowired
    private GuardianContext context;

    @BeforeEach
    void setUp() {
        resetGuardian();
    }

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("Campaign is its own parent and starts ACTIVE")
        void campaignIsOwnParent() {
            ManagedEntityEntity campaign = statusService.registerEntity("c-1", EntityKind.CAMPAIGN, null,
                    "Spring sale", BigDecimal.valueOf(500));

            assertEquals("c-1", campaign.getCampaignId());
            Optional<EntityStatusView> view = statusService.getCurrentState("c-1");
            assertTrue(view.isPresent());
            assertEquals(LifecycleState.ACTIVE, view.get().getState());
            assertNull(view.get().getLastDecision());
        }

        @Test
        @DisplayName("Duplicate and invalid registrations are rejected")
        void invalidRegistrations() {
            statusService.registerEntity("kw-1", EntityKind.KEYWORD, "c-1", "shoes", BigDecimal.TEN);

            assertThrows(IllegalArgumentException.class, () ->
                    statusService.registerEntity("kw-1", EntityKind.KEYWORD, "c-1", "shoes", BigDecimal.TEN));
            assertThrows(IllegalArgumentException.class, () ->
                    statusService.registerEntity("kw-2", EntityKind.KEYWORD, null, "boots", BigDecimal.TEN));
            assertThrows(IllegalArgumentException.class, () ->
                    statusService.registerEntity("kw-3", EntityKind.KEYWORD, "c-1", "socks", BigDecimal.valueOf(-1)));
        }

        @Test
        @DisplayName("Budget target can be changed")
        void updateBudget() {
            statusService.registerEntity("kw-1", EntityKind.KEYWORD, "c-1", "shoes", BigDecimal.TEN);

            ManagedEntityEntity updated = statusService.updateBudgetTarget("kw-1", BigDecimal.valueOf(25));

            assertThat(updated.getDailyBudget()).isEqualByComparingTo("25");
            assertNotNull(updated.getBudgetUpdatedAt());
            assertThrows(IllegalArgumentException.class,
                    () -> statusService.updateBudgetTarget("missing", BigDecimal.ONE));
        }
    }

    @Nested
    @DisplayName("Queries")
    class QueryTests {

        @Test
        @DisplayName("Unknown entity has no state")
        void unknownEntity() {
            assertTrue(statusService.getCurrentState("nope").isEmpty());
        }

        @Test
        @DisplayName("Campaign without losses yields a zero ledger")
        void zeroLedger() {
            LossLedgerView ledger = statusService.getLossLedger("c-404");

            assertThat(ledger.getCumulativeLoss()).isEqualByComparingTo(BigDecimal.ZERO);
            assertFalse(ledger.isHalted());
            assertEquals(HaltTrigger.NONE, ledger.getHaltTrigger());
        }

        @Test
        @DisplayName("History limit must be positive")
        void historyLimit() {
            assertThrows(IllegalArgumentException.class, () -> statusService.listDecisionHistory("kw-1", 0));
        }

        @Test
        @DisplayName("Recent ticks are newest first")
        void recentTicks() {
            LocalDateTime t1 = LocalDateTime.of(2024, 3, 4, 12, 0);
            stateStore.recordTickOutcome(t1, TickOutcome.DISABLED, "Guardian disabled", t1);
            stateStore.recordTickOutcome(t1.plusMinutes(15), TickOutcome.SKIPPED, "busy", t1.plusMinutes(15));

            List<TickRecordEntity> ticks = statusService.listRecentTicks(10);

            assertEquals(2, ticks.size());
            assertEquals(TickOutcome.SKIPPED, ticks.get(0).getOutcome());
        }

        @Test
        @DisplayName("Daily stats count ticks of the day")
        void dailyStats() {
            LocalDateTime noon = LocalDateTime.of(2024, 3, 4, 12, 0);
            stateStore.recordTickOutcome(noon, TickOutcome.SKIPPED, "busy", noon);
            stateStore.recordTickOutcome(noon.plusMinutes(15), TickOutcome.ABORTED, "down", noon);

            DailyStats stats = statusService.getDailyStats(LocalDate.of(2024, 3, 4));

            assertEquals(1, stats.getTicksSkipped());
            assertEquals(1, stats.getTicksAborted());
            assertEquals(0, stats.getTicksCompleted());
        }
    }

    @Nested
    @DisplayName("Manual pause")
    class ManualPauseTests {

        @BeforeEach
        void registerKeyword() {
            statusService.registerEntity("kw-1", EntityKind.KEYWORD, "c-1", "shoes", BigDecimal.TEN);
        }

        @Test
        @DisplayName("Pause and release round trip through the platform")
        void pauseAndRelease() {
            GuardianDecisionEntity pause = statusService.markManuallyPaused("kw-1", "promo ended");

            assertEquals(DecisionSource.OPERATOR, pause.getSource());
            assertEquals(ActionIntent.PAUSE, pause.getAction());
            assertEquals(ReasonCode.OPERATOR_MANUAL_PAUSE, pause.getReason());
            assertEquals(PlatformStatus.PAUSED, platform.statusOf("kw-1"));
            assertEquals(LifecycleState.MANUALLY_PAUSED, statusService.getCurrentState("kw-1").orElseThrow().getState());

            GuardianDecisionEntity release = statusService.releaseManualPause("kw-1", "promo back");

            assertEquals(ActionIntent.RESUME, release.getAction());
            assertEquals(PlatformStatus.ENABLED, platform.statusOf("kw-1"));
            assertEquals(LifecycleState.ACTIVE, statusService.getCurrentState("kw-1").orElseThrow().getState());
            assertThat(statusService.listDecisionHistory("kw-1", 10))
                    .extracting(GuardianDecisionEntity::getReason)
                    .containsExactly(ReasonCode.OPERATOR_MANUAL_RELEASE, ReasonCode.OPERATOR_MANUAL_PAUSE);
        }

        @Test
        @DisplayName("Release of an entity that is not manually paused is refused")
        void releaseRequiresManualPause() {
            assertThrows(IllegalStateException.class, () -> statusService.releaseManualPause("kw-1", null));
        }

        @Test
        @DisplayName("A platform refusal records nothing")
        void platformRefusal() {
            platform.failStatusUpdate("kw-1", new PlatformException("403 Forbidden", false));

            assertThrows(IllegalStateException.class, () -> statusService.markManuallyPaused("kw-1", null));
            assertEquals(LifecycleState.ACTIVE, statusService.getCurrentState("kw-1").orElseThrow().getState());
            assertEquals(0, decisionRepository.count());
            assertFalse(context.isTickInFlight());
        }

        @Test
        @DisplayName("Operator transitions are refused while a tick is in flight")
        void refusedDuringTick() {
            assertTrue(context.tryBeginTick());
            try {
                IllegalStateException e = assertThrows(IllegalStateException.class,
                        () -> statusService.markManuallyPaused("kw-1", "mid-tick"));
                assertThat(e.getMessage()).contains("tick is in progress");
                assertEquals(0, platform.getStatusCalls());
                assertEquals(0, decisionRepository.count());
                assertEquals(LifecycleState.ACTIVE, statusService.getCurrentState("kw-1").orElseThrow().getState());
            } finally {
                context.releaseSlot();
            }

            statusService.markManuallyPaused("kw-1", "after tick");
            assertTrue(context.tryBeginTick());
            try {
                assertThrows(IllegalStateException.class, () -> statusService.releaseManualPause("kw-1", null));
                assertEquals(PlatformStatus.PAUSED, platform.statusOf("kw-1"));
            } finally {
                context.releaseSlot();
            }
        }

        @Test
        @DisplayName("The tick slot is free again after an operator transition")
        void slotReleasedAfterTransition() {
            statusService.markManuallyPaused("kw-1", null);

            assertFalse(context.isTickInFlight());
            assertTrue(context.tryBeginTick());
            context.releaseSlot();
        }
    }

    @Nested
    @DisplayName("Alerts")
    class AlertTests {

        @Test
        @DisplayName("Acknowledged alerts leave the open list")
        void acknowledge() {
            OperatorAlertEntity alert = alertService.raise(AlertType.TICK_ABORTED, AlertSeverity.CRITICAL,
                    null, null, "State store unavailable");
            alertService.raise(AlertType.ENTITY_RESUMED, AlertSeverity.INFO, "kw-1", "c-1", "Resumed");

            assertEquals(2, statusService.listOpenAlerts().size());
            assertTrue(statusService.acknowledgeAlert(alert.getId()));
            assertEquals(1, statusService.listOpenAlerts().size());
            assertFalse(statusService.acknowledgeAlert(-1L));
        }

        @Test
        @DisplayName("Alert text is HTML escaped")
        void formatEscapes() {
            OperatorAlertEntity alert = OperatorAlertEntity.builder()
                    .createdAt(LocalDateTime.of(2024, 3, 4, 12, 0))
                    .alertType(AlertType.ACTION_FAILED)
                    .severity(AlertSeverity.CRITICAL)
                    .entityId("kw-1")
                    .message("PAUSE failed: <timeout> & retry")
                    .build();

            String text = OperatorAlertService.format(alert);

            assertThat(text).contains("&lt;timeout&gt; &amp; retry");
            assertThat(text).contains("<code>kw-1</code>");
            assertThat(text).contains("2024-03-04 12:00");
        }
    }
}
