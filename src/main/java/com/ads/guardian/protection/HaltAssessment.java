package com.ads.guardian.protection;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Capital protection verdict for one campaign in one tick, with the ledger state to commit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HaltAssessment {

    private String campaignId;
    private LocalDateTime tickTime;

    // raw spend minus value of the latest interval, may be negative
    private BigDecimal intervalNetLoss;

    // null when nothing was booked this tick
    private LedgerEntry newEntry;

    // entries inside the window after this tick, oldest first
    private List<LedgerEntry> windowEntries;

    private BigDecimal cumulativeLoss;
    private LocalDateTime windowStart;
    private BigDecimal lossRatePerHour;

    private boolean halted;
    private HaltTrigger trigger;
    private boolean previouslyHalted;

    public boolean isNewlyHalted() {
        return halted && !previouslyHalted;
    }

    public boolean isCleared() {
        return !halted && previouslyHalted;
    }
}
