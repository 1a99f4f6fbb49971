package com.ads.guardian.persistence;

import com.ads.guardian.protection.LedgerEntry;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "loss_ledger_entry", indexes = {
        @Index(name = "idx_ledger_entry_campaign", columnList = "campaign_id, interval_end")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LossLedgerEntryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "campaign_id", length = 64, nullable = false)
    private String campaignId;

    // null on rows booked before interval starts were tracked
    @Column(name = "interval_start")
    private LocalDateTime intervalStart;

    @Column(name = "interval_end", nullable = false)
    private LocalDateTime intervalEnd;

    @Column(name = "amount", precision = 18, scale = 4, nullable = false)
    private BigDecimal amount;

    public LedgerEntry toEntry() {
        return new LedgerEntry(intervalStart != null ? intervalStart : intervalEnd, intervalEnd, amount);
    }
}
