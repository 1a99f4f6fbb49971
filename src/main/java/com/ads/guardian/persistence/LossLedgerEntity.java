package com.ads.guardian.persistence;

import com.ads.guardian.protection.HaltTrigger;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Rolling loss summary of one campaign, rewritten on each tick from the entries in the window.
 */
@Entity
@Table(name = "loss_ledger")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LossLedgerEntity {

    @Id
    @Column(name = "campaign_id", length = 64)
    private String campaignId;

    @Column(name = "cumulative_loss", precision = 18, scale = 4, nullable = false)
    private BigDecimal cumulativeLoss;

    @Column(name = "window_start", nullable = false)
    private LocalDateTime windowStart;

    @Column(name = "loss_rate_per_hour", precision = 18, scale = 4, nullable = false)
    private BigDecimal lossRatePerHour;

    @Column(name = "halted", nullable = false)
    private boolean halted;

    @Column(name = "halted_at")
    private LocalDateTime haltedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "halt_trigger", length = 20)
    private HaltTrigger haltTrigger;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
