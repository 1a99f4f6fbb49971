package com.ads.guardian.service;

import com.ads.guardian.persistence.OperatorAlertEntity;
import com.ads.guardian.persistence.OperatorAlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Persists operator alerts and pushes them to the alert chat when a bot is attached.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OperatorAlertService {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final OperatorAlertRepository alertRepository;
    private final Clock clock;

    @Value("${telegram.alert.chat-id:}")
    private String alertChatId;

    @Value("${telegram.alert.min-severity:WARNING}")
    private AlertSeverity minPushSeverity;

    private AbsSender telegramBot;

    public void setTelegramBot(AbsSender bot) {
        this.telegramBot = bot;
    }

    /**
     * Save an alert in its own transaction, so it is kept even when the caller rolls back.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public OperatorAlertEntity raise(AlertType type, AlertSeverity severity, String entityId,
                                     String campaignId, String message) {
        OperatorAlertEntity alert = OperatorAlertEntity.builder()
                .createdAt(LocalDateTime.now(clock))
                .alertType(type)
                .severity(severity)
                .entityId(entityId)
                .campaignId(campaignId)
                .message(message.length() > 1000 ? message.substring(0, 1000) : message)
                .build();

        switch (severity) {
            case CRITICAL -> log.error("[{}] {}", type, message);
            case WARNING -> log.warn("[{}] {}", type, message);
            default -> log.info("[{}] {}", type, message);
        }

        if (severity.isAtLeast(minPushSeverity)) {
            alert.setSentToTelegram(push(alert));
        }
        return alertRepository.save(alert);
    }

    @Transactional(readOnly = true)
    public List<OperatorAlertEntity> listOpen() {
        return alertRepository.findOpen();
    }

    @Transactional
    public boolean acknowledge(long alertId) {
        return alertRepository.findById(alertId)
                .map(alert -> {
                    if (!alert.isAcknowledged()) {
                        alert.setAcknowledged(true);
                        alert.setAcknowledgedAt(LocalDateTime.now(clock));
                        alertRepository.save(alert);
                    }
                    return true;
                })
                .orElse(false);
    }

    private boolean push(OperatorAlertEntity alert) {
        if (telegramBot == null || alertChatId == null || alertChatId.isEmpty()) {
            log.debug("Alert not pushed: bot or chat not configured");
            return false;
        }

        SendMessage sendMessage = new SendMessage();
        sendMessage.setChatId(alertChatId);
        sendMessage.setText(format(alert));
        sendMessage.setParseMode("HTML");

        try {
            telegramBot.execute(sendMessage);
            return true;
        } catch (TelegramApiException e) {
            log.error("Failed to push alert {}: {}", alert.getAlertType(), e.getMessage());
            return false;
        }
    }

    static String format(OperatorAlertEntity alert) {
        StringBuilder sb = new StringBuilder();
        sb.append("<b>").append(alert.getSeverity()).append(": ").append(alert.getAlertType().getTitle()).append("</b>\n\n");
        if (alert.getCampaignId() != null) {
            sb.append("Campaign: <code>").append(alert.getCampaignId()).append("</code>\n");
        }
        if (alert.getEntityId() != null) {
            sb.append("Entity: <code>").append(alert.getEntityId()).append("</code>\n");
        }
        sb.append(escape(alert.getMessage())).append("\n\n");
        sb.append("<i>").append(alert.getCreatedAt().format(DATE_FORMAT)).append(" UTC</i>");
        return sb.toString();
    }

    private static String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
