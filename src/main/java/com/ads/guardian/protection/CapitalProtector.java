package com.ads.guardian.protection;

import com.ads.guardian.analysis.EntityEvaluation;
import com.ads.guardian.config.GuardianSettings;
import com.ads.guardian.platform.EntityKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Campaign-level loss accounting and circuit halt.
 *
 * Only the coarsest entity kind present in a campaign is summed, so a campaign and its
 * ad groups are never counted twice. A halt holds while the cumulative loss or the loss
 * rate is above its limit, and clears on its own once both are back under. The rate is
 * measured from the start of the earliest interval in the window.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CapitalProtector {

    private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(3600);

    private final GuardianSettings settings;

    /**
     * @param campaignId       campaign being assessed
     * @param evaluations      this tick's evaluations of the campaign's entities
     * @param priorEntries     ledger entries recorded so far, any order
     * @param previouslyHalted halt flag persisted by the previous tick
     * @param tickTime         current tick
     */
    public HaltAssessment assess(String campaignId, List<EntityEvaluation> evaluations,
                                 List<LedgerEntry> priorEntries, boolean previouslyHalted,
                                 LocalDateTime tickTime) {
        LocalDateTime windowStart = tickTime.minus(settings.getLossWindow());

        EntityKind coarsest = coarsestKind(evaluations);
        BigDecimal netLoss = intervalNetLoss(evaluations, coarsest);
        BigDecimal booked = netLoss.subtract(settings.getAcceptableLossPerInterval()).max(BigDecimal.ZERO);

        List<LedgerEntry> window = new ArrayList<>();
        for (LedgerEntry entry : priorEntries) {
            if (entry.getIntervalEnd().isAfter(windowStart) && !entry.getIntervalEnd().isAfter(tickTime)) {
                window.add(entry);
            }
        }
        LedgerEntry newEntry = null;
        if (booked.signum() > 0) {
            newEntry = new LedgerEntry(intervalStart(evaluations, coarsest, tickTime), tickTime, booked);
            window.add(newEntry);
        }
        window.sort(Comparator.comparing(LedgerEntry::getIntervalEnd));

        BigDecimal cumulative = window.stream()
                .map(LedgerEntry::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal rate = lossRate(cumulative, window, tickTime);

        HaltTrigger trigger = HaltTrigger.NONE;
        if (cumulative.compareTo(settings.getAbsoluteLossLimit()) > 0) {
            trigger = HaltTrigger.ABSOLUTE_LIMIT;
        } else if (rate.compareTo(settings.getLossRateLimit()) > 0) {
            trigger = HaltTrigger.LOSS_RATE;
        }
        boolean halted = trigger != HaltTrigger.NONE;

        if (halted && !previouslyHalted) {
            log.warn("Circuit halt on campaign {}: {} (cumulative={}, rate={}/h)",
                    campaignId, trigger.getDescription(), cumulative, rate);
        } else if (!halted && previouslyHalted) {
            log.info("Circuit halt cleared on campaign {} (cumulative={}, rate={}/h)", campaignId, cumulative, rate);
        } else {
            log.debug("Campaign {} ledger: interval={}, booked={}, cumulative={}, rate={}/h",
                    campaignId, netLoss, booked, cumulative, rate);
        }

        return HaltAssessment.builder()
                .campaignId(campaignId)
                .tickTime(tickTime)
                .intervalNetLoss(netLoss)
                .newEntry(newEntry)
                .windowEntries(window)
                .cumulativeLoss(cumulative)
                .windowStart(windowStart)
                .lossRatePerHour(rate)
                .halted(halted)
                .trigger(trigger)
                .previouslyHalted(previouslyHalted)
                .build();
    }

    private static EntityKind coarsestKind(List<EntityEvaluation> evaluations) {
        EntityKind coarsest = null;
        for (EntityEvaluation evaluation : evaluations) {
            if (evaluation.isStale()) {
                continue;
            }
            if (coarsest == null || evaluation.getKind().isCoarserThan(coarsest)) {
                coarsest = evaluation.getKind();
            }
        }
        return coarsest;
    }

    /**
     * Net loss of the latest interval over the coarsest non-stale kind.
     */
    BigDecimal intervalNetLoss(List<EntityEvaluation> evaluations) {
        return intervalNetLoss(evaluations, coarsestKind(evaluations));
    }

    private BigDecimal intervalNetLoss(List<EntityEvaluation> evaluations, EntityKind coarsest) {
        if (coarsest == null) {
            return BigDecimal.ZERO;
        }

        BigDecimal total = BigDecimal.ZERO;
        for (EntityEvaluation evaluation : evaluations) {
            if (!evaluation.isStale() && evaluation.getKind() == coarsest) {
                total = total.add(evaluation.getIntervalNetLoss());
            }
        }
        return total;
    }

    /**
     * Earliest interval start among the summed entities, one tick interval back when none is known.
     */
    private LocalDateTime intervalStart(List<EntityEvaluation> evaluations, EntityKind coarsest, LocalDateTime tickTime) {
        LocalDateTime earliest = null;
        for (EntityEvaluation evaluation : evaluations) {
            if (evaluation.isStale() || evaluation.getKind() != coarsest || evaluation.getIntervalStart() == null) {
                continue;
            }
            if (earliest == null || evaluation.getIntervalStart().isBefore(earliest)) {
                earliest = evaluation.getIntervalStart();
            }
        }
        if (earliest == null || earliest.isAfter(tickTime)) {
            return tickTime.minus(settings.getTickInterval());
        }
        return earliest;
    }

    private BigDecimal lossRate(BigDecimal cumulative, List<LedgerEntry> window, LocalDateTime tickTime) {
        if (cumulative.signum() == 0 || window.isEmpty()) {
            return BigDecimal.ZERO.setScale(4);
        }
        LocalDateTime earliest = window.stream()
                .map(entry -> entry.getIntervalStart() != null ? entry.getIntervalStart() : entry.getIntervalEnd())
                .min(Comparator.naturalOrder())
                .orElse(tickTime);
        Duration span = Duration.between(earliest, tickTime);
        long seconds = Math.max(span.getSeconds(), settings.getTickInterval().getSeconds());
        BigDecimal hours = BigDecimal.valueOf(seconds).divide(SECONDS_PER_HOUR, 6, RoundingMode.HALF_UP);
        return cumulative.divide(hours, 4, RoundingMode.HALF_UP);
    }
}
