package com.ads.guardian.persistence;

import com.ads.guardian.platform.EntityKind;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Campaign, ad group or keyword under guardianship.
 * Only the daily budget target changes after registration.
 */
@Entity
@Table(name = "managed_entity", indexes = {
        @Index(name = "idx_managed_entity_campaign", columnList = "campaign_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManagedEntityEntity {

    @Id
    @Column(name = "entity_id", length = 64)
    private String entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", length = 20, nullable = false)
    private EntityKind kind;

    // a campaign is its own parent
    @Column(name = "campaign_id", length = 64, nullable = false)
    private String campaignId;

    @Column(name = "display_name", length = 200)
    private String displayName;

    @Column(name = "daily_budget", precision = 18, scale = 4, nullable = false)
    private BigDecimal dailyBudget;

    @Column(name = "monitored", nullable = false)
    private boolean monitored;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "budget_updated_at")
    private LocalDateTime budgetUpdatedAt;

    public boolean isCampaign() {
        return kind == EntityKind.CAMPAIGN;
    }
}
