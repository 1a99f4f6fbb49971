package com.ads.guardian.analysis;

/**
 * Sample-size confidence of a signal, from click volume in the window.
 * LOW signals never justify a pause.
 */
public enum Confidence {

    LOW, MEDIUM, HIGH;

    static final int HIGH_MULTIPLIER = 3;

    public static Confidence forClicks(long clicks, int minClicks) {
        if (clicks < minClicks) {
            return LOW;
        }
        if (clicks < (long) minClicks * HIGH_MULTIPLIER) {
            return MEDIUM;
        }
        return HIGH;
    }
}
