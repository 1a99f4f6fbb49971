package com.ads.guardian.telegram;

import com.ads.guardian.decision.ActionIntent;
import com.ads.guardian.decision.HysteresisCounters;
import com.ads.guardian.decision.LifecycleState;
import com.ads.guardian.decision.ReasonCode;
import com.ads.guardian.persistence.GuardianDecisionEntity;
import com.ads.guardian.protection.HaltTrigger;
import com.ads.guardian.service.DailyStats;
import com.ads.guardian.service.EntityStatusView;
import com.ads.guardian.service.GuardianContext;
import com.ads.guardian.service.GuardianStatusService;
import com.ads.guardian.service.GuardianTickService;
import com.ads.guardian.service.LossLedgerView;
import com.ads.guardian.service.OperatorAlertService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.*;

@DisplayName("GuardianTelegramBot Tests")
class GuardianTelegramBotTest {

    private GuardianContext context;
    private GuardianStatusService statusService;
    private GuardianTickService tickService;
    private GuardianTelegramBot bot;

    @BeforeEach
    void setUp() {
        context = mock(GuardianContext.class);
        statusService = mock(GuardianStatusService.class);
        tickService = mock(GuardianTickService.class);
        bot = new GuardianTelegramBot("test-token", "1, 42", context, tickService,
                statusService, mock(OperatorAlertService.class));
    }

    @AfterEach
    void tearDown() {
        bot.close();
    }

    @Test
    @DisplayName("Unknown commands point to /help")
    void unknownCommand() {
        assertThat(bot.processCommand("/frobnicate", 1L)).contains("/help");
        assertThat(bot.processCommand("/help", 1L)).contains("/pause_manual");
    }

    @Test
    @DisplayName("Enable and disable flip the guardian switch")
    void enableDisable() {
        bot.processCommand("/enable", 1L);
        bot.processCommand("/DISABLE", 1L);

        verify(context).enable();
        verify(context).disable();
    }

    @Test
    @DisplayName("Status shows today's counts")
    void status() {
        when(context.isEnabled()).thenReturn(true);
        when(statusService.getDailyStats()).thenReturn(DailyStats.builder().ticksCompleted(4).pauses(2).build());

        String text = bot.processCommand("/status", 1L);

        assertThat(text).contains("Guardian: ENABLED").contains("4 completed").contains("Pauses: 2");
    }

    @Test
    @DisplayName("State shows the last decision")
    void state() {
        GuardianDecisionEntity last = GuardianDecisionEntity.builder()
                .tickTime(LocalDateTime.of(2024, 3, 4, 12, 15))
                .fromState(LifecycleState.ACTIVE)
                .toState(LifecycleState.GUARDIAN_PAUSED)
                .reason(ReasonCode.NEGATIVE_PROFIT_PROXY)
                .action(ActionIntent.PAUSE)
                .build();
        when(statusService.getCurrentState("kw-1")).thenReturn(Optional.of(EntityStatusView.builder()
                .entityId("kw-1")
                .state(LifecycleState.GUARDIAN_PAUSED)
                .counters(HysteresisCounters.zero())
                .lastDecision(last)
                .build()));

        String text = bot.processCommand("/state kw-1", 1L);

        assertThat(text).contains("State: GUARDIAN_PAUSED").contains("ACTIVE -> GUARDIAN_PAUSED [PAUSE]");
        assertThat(bot.processCommand("/state kw-404", 1L)).contains("Unknown entity");
    }

    @Test
    @DisplayName("Halted ledger names its trigger")
    void ledger() {
        when(statusService.getLossLedger("c-1")).thenReturn(LossLedgerView.builder()
                .campaignId("c-1")
                .cumulativeLoss(new BigDecimal("120.00"))
                .lossRatePerHour(new BigDecimal("480.00"))
                .halted(true)
                .haltedAt(LocalDateTime.of(2024, 3, 4, 12, 0))
                .haltTrigger(HaltTrigger.ABSOLUTE_LIMIT)
                .build());

        String text = bot.processCommand("/ledger c-1", 1L);

        assertThat(text).contains("Cumulative loss: 120.00").contains("Halted: YES")
                .contains(HaltTrigger.ABSOLUTE_LIMIT.getDescription());
    }

    @Test
    @DisplayName("Commands that need an argument say how to use them")
    void missingArgument() {
        assertThrows(IllegalArgumentException.class, () -> bot.processCommand("/pause_manual", 1L));
        assertThat(bot.processCommand("/ack abc", 1L)).contains("Invalid alert id");
    }

    @Test
    @DisplayName("Commands that change live status are refused outside the operator chats")
    void operatorCommandsRestricted() {
        for (String command : new String[]{"/enable", "/disable", "/run", "/pause_manual kw-1",
                "/release_manual kw-1", "/ack 7"}) {
            assertThat(bot.processCommand(command, 999L)).contains("restricted to the operator chat");
        }

        verifyNoInteractions(tickService);
        verify(context, never()).enable();
        verify(context, never()).disable();
        verify(statusService, never()).markManuallyPaused(anyString(), any());
        verify(statusService, never()).releaseManualPause(anyString(), any());
        verify(statusService, never()).acknowledgeAlert(anyLong());
    }

    @Test
    @DisplayName("Read-only commands work from any chat, operator commands from every listed chat")
    void readOnlyCommandsOpen() {
        when(statusService.getDailyStats()).thenReturn(DailyStats.builder().build());

        assertThat(bot.processCommand("/status", 999L)).contains("Profit Guardian");
        assertThat(bot.processCommand("/help", 999L)).contains("/pause_manual");

        bot.processCommand("/enable", 42L);
        verify(context).enable();
    }

    @Test
    @DisplayName("Without a configured operator chat every operator command is refused")
    void noOperatorChatRefusesAll() {
        GuardianTelegramBot unconfigured = new GuardianTelegramBot("test-token", "", context, tickService,
                statusService, mock(OperatorAlertService.class));
        try {
            assertThat(unconfigured.processCommand("/enable", 1L)).contains("restricted");
            verify(context, never()).enable();
        } finally {
            unconfigured.close();
        }
    }

    @Test
    @DisplayName("A failing manual tick is reported instead of lost")
    void failedRunIsReported() {
        when(tickService.runNow()).thenThrow(new IllegalStateException("database unavailable"));

        assertThat(bot.runTickAndReport()).isEqualTo("Tick failed: database unavailable");
    }

    @Test
    @DisplayName("A manual tick that could not start says so")
    void runNotStarted() {
        when(tickService.runNow()).thenReturn(Optional.empty());

        assertThat(bot.runTickAndReport()).contains("another tick is in flight");
    }
}
