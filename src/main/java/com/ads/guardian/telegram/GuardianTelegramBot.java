package com.ads.guardian.telegram;

import com.ads.guardian.action.ApplyStatus;
import com.ads.guardian.decision.DecisionSource;
import com.ads.guardian.decision.LifecycleState;
import com.ads.guardian.persistence.GuardianDecisionEntity;
import com.ads.guardian.persistence.OperatorAlertEntity;
import com.ads.guardian.persistence.TickRecordEntity;
import com.ads.guardian.service.DailyStats;
import com.ads.guardian.service.EntityStatusView;
import com.ads.guardian.service.GuardianContext;
import com.ads.guardian.service.GuardianStatusService;
import com.ads.guardian.service.GuardianTickService;
import com.ads.guardian.service.LossLedgerView;
import com.ads.guardian.service.OperatorAlertService;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Operator channel. Commands read guardian state and run operator transitions;
 * alerts are pushed through {@link OperatorAlertService}.
 *
 * Commands that change the guardian or live ad status are only accepted from the chats in
 * {@code telegram.bot.operator-chat-ids}, which defaults to the alert chat.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "telegram.bot.enabled", havingValue = "true")
public class GuardianTelegramBot extends TelegramLongPollingBot {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final int HISTORY_LIMIT = 10;
    private static final Set<String> OPERATOR_COMMANDS =
            Set.of("/enable", "/disable", "/run", "/pause_manual", "/release_manual", "/ack");

    private final GuardianContext context;
    private final GuardianTickService tickService;
    private final GuardianStatusService statusService;
    private final OperatorAlertService alertService;
    private final Set<String> operatorChatIds;
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @Value("${telegram.bot.username}")
    private String botUsername;

    public GuardianTelegramBot(@Value("${telegram.bot.token}") String botToken,
                               @Value("${telegram.bot.operator-chat-ids:${telegram.alert.chat-id:}}") String operatorChatIds,
                               GuardianContext context,
                               GuardianTickService tickService,
                               GuardianStatusService statusService,
                               OperatorAlertService alertService) {
        super(botToken);
        this.context = context;
        this.tickService = tickService;
        this.statusService = statusService;
        this.alertService = alertService;
        this.operatorChatIds = ImmutableSet.copyOf(
                Splitter.on(',').trimResults().omitEmptyStrings().split(operatorChatIds != null ? operatorChatIds : ""));
    }

    @PostConstruct
    public void init() {
        try {
            TelegramBotsApi botsApi = new TelegramBotsApi(DefaultBotSession.class);
            botsApi.registerBot(this);
            alertService.setTelegramBot(this);
            if (operatorChatIds.isEmpty()) {
                log.warn("No operator chat configured, operator commands are refused");
            }
            log.info("Telegram bot registered successfully");
        } catch (TelegramApiException e) {
            log.error("Failed to register Telegram bot: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void close() {
        executor.shutdownNow();
    }

    @Override
    public String getBotUsername() {
        return botUsername;
    }

    @Override
    public void onUpdateReceived(Update update) {
        if (!update.hasMessage() || !update.getMessage().hasText()) {
            return;
        }

        String messageText = update.getMessage().getText();
        long chatId = update.getMessage().getChatId();

        log.debug("Received message: {} from chat: {}", messageText, chatId);

        String response;
        try {
            response = processCommand(messageText, chatId);
        } catch (IllegalArgumentException | IllegalStateException e) {
            response = "Error: " + e.getMessage();
        }
        sendMessage(chatId, response);
    }

    String processCommand(String command, long chatId) {
        String[] parts = command.trim().split("\\s+", 2);
        String baseCmd = parts[0].toLowerCase();
        String args = parts.length > 1 ? parts[1].trim() : "";

        if (OPERATOR_COMMANDS.contains(baseCmd) && !operatorChatIds.contains(String.valueOf(chatId))) {
            log.warn("Refused {} from chat {}: not an operator chat", baseCmd, chatId);
            return "Command " + baseCmd + " is restricted to the operator chat.";
        }

        return switch (baseCmd) {
            case "/start", "/help" -> handleHelp();
            case "/status" -> handleStatus();
            case "/enable" -> handleEnable();
            case "/disable" -> handleDisable();
            case "/run" -> handleRun(chatId);
            case "/state" -> handleState(args);
            case "/history" -> handleHistory(args);
            case "/ledger" -> handleLedger(args);
            case "/pause_manual" -> handlePauseManual(args);
            case "/release_manual" -> handleReleaseManual(args);
            case "/alerts" -> handleAlerts();
            case "/ack" -> handleAck(args);
            default -> "Unknown command. Use /help to see available commands.";
        };
    }

    private String handleHelp() {
        return """
                Profit Guardian

                /status - Guardian status and today's activity
                /enable - Enable automatic ticks
                /disable - Disable automatic ticks
                /run - Run one tick now

                /state <entity> - Lifecycle state of an entity
                /history <entity> - Recent decisions
                /ledger <campaign> - Loss ledger of a campaign

                /pause_manual <entity> - Hand entity to operator
                /release_manual <entity> - Return entity to guardian

                /alerts - Open alerts
                /ack <id> - Acknowledge an alert
                """;
    }

    private String handleStatus() {
        DailyStats stats = statusService.getDailyStats();

        StringBuilder sb = new StringBuilder();
        sb.append("Profit Guardian\n\n");
        sb.append("Guardian: ").append(context.isEnabled() ? "ENABLED" : "DISABLED").append("\n");
        sb.append("Tick in flight: ").append(context.isTickInFlight() ? "yes" : "no").append("\n");
        if (context.getLastTickTime() != null) {
            sb.append("Last tick: ").append(context.getLastTickTime().format(DATE_FORMAT))
                    .append(" (").append(context.getLastOutcome()).append(")\n");
        }

        sb.append("\nToday (UTC)\n");
        sb.append("Ticks: ").append(stats.getTicksCompleted()).append(" completed, ")
                .append(stats.getTicksSkipped()).append(" skipped, ")
                .append(stats.getTicksAborted()).append(" aborted\n");
        sb.append("Pauses: ").append(stats.getPauses()).append("\n");
        sb.append("Resumes: ").append(stats.getResumes()).append("\n");
        sb.append("Repace advisories: ").append(stats.getRepaces()).append("\n");
        sb.append("Failed actions: ").append(stats.getFailedActions()).append("\n");
        sb.append("Halted campaigns: ").append(stats.getHaltedCampaigns()).append("\n");
        sb.append("Open alerts: ").append(stats.getOpenAlerts());
        return sb.toString();
    }

    private String handleEnable() {
        context.enable();
        return "Guardian enabled. Next scheduled tick will run.";
    }

    private String handleDisable() {
        context.disable();
        return "Guardian disabled. Scheduled ticks will be recorded as DISABLED.";
    }

    private String handleRun(long chatId) {
        if (context.isTickInFlight()) {
            return "A tick is already in flight.";
        }

        executor.execute(() -> sendMessage(chatId, runTickAndReport()));

        return "Tick started.";
    }

    String runTickAndReport() {
        try {
            Optional<TickRecordEntity> record = tickService.runNow();
            return record
                    .map(r -> String.format("Tick %s: %s\nEntities: %d, stale: %d\nApplied: %d, failed: %d\nHalted campaigns: %d%s",
                            r.getTickTime().format(DATE_FORMAT), r.getOutcome(),
                            r.getEntitiesEvaluated(), r.getEntitiesStale(),
                            r.getActionsApplied(), r.getActionsFailed(), r.getCampaignsHalted(),
                            r.getReason() != null ? "\nReason: " + r.getReason() : ""))
                    .orElse("Tick not started: another tick is in flight.");
        } catch (RuntimeException e) {
            log.error("Manual tick failed: {}", e.getMessage(), e);
            return "Tick failed: " + e.getMessage();
        }
    }

    private String handleState(String entityId) {
        requireArgument(entityId, "/state <entity>");
        Optional<EntityStatusView> view = statusService.getCurrentState(entityId);
        if (view.isEmpty()) {
            return "Unknown entity: " + entityId;
        }

        EntityStatusView status = view.get();
        StringBuilder sb = new StringBuilder();
        sb.append("Entity ").append(entityId).append("\n\n");
        sb.append("State: ").append(status.getState()).append("\n");
        sb.append("Negative streak: ").append(status.getCounters().getNegativeStreak()).append("\n");
        sb.append("Non-negative streak: ").append(status.getCounters().getNonNegativeStreak()).append("\n");
        if (status.getState() == LifecycleState.CIRCUIT_HALTED) {
            sb.append("Halt-clear streak: ").append(status.getCounters().getHaltClearStreak()).append("\n");
        }

        GuardianDecisionEntity last = status.getLastDecision();
        if (last != null) {
            sb.append("\nLast decision: ").append(formatDecision(last));
        }
        return sb.toString();
    }

    private String handleHistory(String entityId) {
        requireArgument(entityId, "/history <entity>");
        List<GuardianDecisionEntity> history = statusService.listDecisionHistory(entityId, HISTORY_LIMIT);
        if (history.isEmpty()) {
            return "No decisions for " + entityId;
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Last ").append(history.size()).append(" decisions for ").append(entityId).append("\n\n");
        for (GuardianDecisionEntity decision : history) {
            sb.append(formatDecision(decision)).append("\n");
        }
        return sb.toString();
    }

    private String handleLedger(String campaignId) {
        requireArgument(campaignId, "/ledger <campaign>");
        LossLedgerView ledger = statusService.getLossLedger(campaignId);

        StringBuilder sb = new StringBuilder();
        sb.append("Loss ledger ").append(campaignId).append("\n\n");
        sb.append("Cumulative loss: ").append(ledger.getCumulativeLoss()).append("\n");
        sb.append("Loss rate: ").append(ledger.getLossRatePerHour()).append("/h\n");
        if (ledger.getWindowStart() != null) {
            sb.append("Window start: ").append(ledger.getWindowStart().format(DATE_FORMAT)).append("\n");
        }
        sb.append("Halted: ").append(ledger.isHalted() ? "YES" : "no");
        if (ledger.isHalted() && ledger.getHaltedAt() != null) {
            sb.append(" since ").append(ledger.getHaltedAt().format(DATE_FORMAT))
                    .append(" (").append(ledger.getHaltTrigger().getDescription()).append(")");
        }
        return sb.toString();
    }

    private String handlePauseManual(String entityId) {
        requireArgument(entityId, "/pause_manual <entity>");
        GuardianDecisionEntity decision = statusService.markManuallyPaused(entityId, "via Telegram");
        return "Entity " + entityId + " manually paused (was " + decision.getFromState() + ").";
    }

    private String handleReleaseManual(String entityId) {
        requireArgument(entityId, "/release_manual <entity>");
        statusService.releaseManualPause(entityId, "via Telegram");
        return "Entity " + entityId + " released to the guardian as ACTIVE.";
    }

    private String handleAlerts() {
        List<OperatorAlertEntity> alerts = statusService.listOpenAlerts();
        if (alerts.isEmpty()) {
            return "No open alerts.";
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Open alerts: ").append(alerts.size()).append("\n\n");
        for (OperatorAlertEntity alert : alerts.subList(0, Math.min(alerts.size(), HISTORY_LIMIT))) {
            sb.append("#").append(alert.getId()).append(" ")
                    .append(alert.getCreatedAt().format(DATE_FORMAT)).append(" ")
                    .append(alert.getSeverity()).append(" ")
                    .append(alert.getAlertType().getTitle()).append("\n")
                    .append("  ").append(alert.getMessage()).append("\n");
        }
        if (alerts.size() > HISTORY_LIMIT) {
            sb.append("... and ").append(alerts.size() - HISTORY_LIMIT).append(" more");
        }
        return sb.toString();
    }

    private String handleAck(String args) {
        requireArgument(args, "/ack <id>");
        long id;
        try {
            id = Long.parseLong(args);
        } catch (NumberFormatException e) {
            return "Invalid alert id: " + args;
        }
        return statusService.acknowledgeAlert(id) ? "Alert #" + id + " acknowledged." : "Alert #" + id + " not found.";
    }

    private String formatDecision(GuardianDecisionEntity d) {
        StringBuilder sb = new StringBuilder();
        sb.append(d.getTickTime().format(DATE_FORMAT)).append(" ")
                .append(d.getFromState()).append(" -> ").append(d.getToState())
                .append(" [").append(d.getAction()).append("] ")
                .append(d.getReason());
        if (d.getSource() != null && d.getSource() != DecisionSource.GUARDIAN) {
            sb.append(" by ").append(d.getSource());
        }
        if (d.getProfitEstimate() != null) {
            sb.append(" profit=").append(d.getProfitEstimate());
        }
        if (d.getPacingRatio() != null) {
            sb.append(" pacing=").append(d.getPacingRatio());
        }
        if (d.getApplyStatus() != null && d.getApplyStatus() != ApplyStatus.NOT_REQUIRED) {
            sb.append(" apply=").append(d.getApplyStatus());
        }
        return sb.toString();
    }

    private static void requireArgument(String value, String usage) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Usage: " + usage);
        }
    }

    private void sendMessage(long chatId, String text) {
        SendMessage message = new SendMessage();
        message.setChatId(String.valueOf(chatId));
        message.setText(text);

        try {
            execute(message);
        } catch (TelegramApiException e) {
            log.error("Failed to send message: {}", e.getMessage());
        }
    }
}
