package com.ads.guardian.decision;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityStateView {

    private String entityId;
    private LifecycleState state;
    private HysteresisCounters counters;

    public static EntityStateView initial(String entityId) {
        return new EntityStateView(entityId, LifecycleState.ACTIVE, HysteresisCounters.zero());
    }
}
