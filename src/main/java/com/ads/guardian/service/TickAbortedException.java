package com.ads.guardian.service;

/**
 * Tick-wide failure. Nothing from the tick is committed except its ABORTED record.
 */
public class TickAbortedException extends RuntimeException {

    public TickAbortedException(String message) {
        super(message);
    }

    public TickAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
