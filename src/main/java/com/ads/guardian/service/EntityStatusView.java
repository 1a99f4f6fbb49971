package com.ads.guardian.service;

import com.ads.guardian.decision.HysteresisCounters;
import com.ads.guardian.decision.LifecycleState;
import com.ads.guardian.persistence.GuardianDecisionEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityStatusView {

    private String entityId;
    private LifecycleState state;
    private HysteresisCounters counters;

    // null before the first decision
    private GuardianDecisionEntity lastDecision;
}
