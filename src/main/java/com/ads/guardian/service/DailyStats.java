package com.ads.guardian.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Guardian activity for one UTC day.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyStats {

    private LocalDate date;

    private long ticksCompleted;
    private long ticksSkipped;
    private long ticksAborted;

    private long pauses;
    private long resumes;
    private long repaces;
    private long failedActions;

    private long haltedCampaigns;
    private long openAlerts;
}
