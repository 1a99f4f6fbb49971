package com.ads.guardian.action;

import com.ads.guardian.decision.LifecycleState;
import com.ads.guardian.platform.PlatformStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusChangeIntent {

    private String entityId;
    private LifecycleState fromState;
    private LifecycleState toState;
    private PlatformStatus targetStatus;
    private LocalDateTime tickTime;
    private String idempotencyKey;

    public static StatusChangeIntent of(String entityId, LifecycleState from, LifecycleState to,
                                        LocalDateTime tickTime) {
        PlatformStatus target = to.getPlatformStatus();
        return StatusChangeIntent.builder()
                .entityId(entityId)
                .fromState(from)
                .toState(to)
                .targetStatus(target)
                .tickTime(tickTime)
                .idempotencyKey(idempotencyKey(entityId, target, tickTime))
                .build();
    }

    /**
     * Format: {entityId}:{targetStatus}:{tickEpochMillis}
     */
    public static String idempotencyKey(String entityId, PlatformStatus target, LocalDateTime tickTime) {
        return entityId + ":" + target.name() + ":" + tickTime.toInstant(ZoneOffset.UTC).toEpochMilli();
    }
}
