package com.ads.guardian.decision;

public enum ActionIntent {
    NONE,
    PAUSE,
    RESUME,
    /** Advisory: spend is ahead of pace or the loss signal is too weak to pause on. */
    REPACE
}
