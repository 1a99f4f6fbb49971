package com.ads.guardian.decision;

import com.ads.guardian.platform.PlatformStatus;

/**
 * Lifecycle of a managed entity. Only the decision engine moves an entity between
 * ACTIVE, GUARDIAN_PAUSED and CIRCUIT_HALTED; MANUALLY_PAUSED is entered and left by operators.
 */
public enum LifecycleState {

    ACTIVE(PlatformStatus.ENABLED),

    GUARDIAN_PAUSED(PlatformStatus.PAUSED),

    MANUALLY_PAUSED(PlatformStatus.PAUSED),

    CIRCUIT_HALTED(PlatformStatus.PAUSED);

    private final PlatformStatus platformStatus;

    LifecycleState(PlatformStatus platformStatus) {
        this.platformStatus = platformStatus;
    }

    /**
     * Serving status the platform must show for an entity in this state.
     */
    public PlatformStatus getPlatformStatus() {
        return platformStatus;
    }
}
