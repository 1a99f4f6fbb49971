package com.ads.guardian.action;

public enum ApplyStatus {
    /** No platform status change was needed for the decision. */
    NOT_REQUIRED,
    APPLIED,
    FAILED
}
