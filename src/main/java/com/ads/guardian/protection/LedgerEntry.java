package com.ads.guardian.protection;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Loss booked for one campaign for the interval {@code (intervalStart, intervalEnd]}. Never negative.
 *
 * The first interval of an entity's day starts when the active day started, so the spend
 * accrued before the guardian first saw it is not rated as one tick's worth.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LedgerEntry {

    private LocalDateTime intervalStart;
    private LocalDateTime intervalEnd;
    private BigDecimal amount;

    public LedgerEntry(LocalDateTime intervalEnd, BigDecimal amount) {
        this(intervalEnd, intervalEnd, amount);
    }
}
