package com.ads.guardian.service;

import com.ads.guardian.protection.HaltTrigger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LossLedgerView {

    private String campaignId;
    private BigDecimal cumulativeLoss;
    private LocalDateTime windowStart;
    private BigDecimal lossRatePerHour;
    private boolean halted;
    private LocalDateTime haltedAt;
    private HaltTrigger haltTrigger;
}
