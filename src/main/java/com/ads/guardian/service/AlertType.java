package com.ads.guardian.service;

public enum AlertType {

    PERMANENT_FETCH_FAILURE("Metrics unavailable"),
    ACTION_FAILED("Status change failed"),
    CIRCUIT_HALT("Circuit halt"),
    CIRCUIT_HALT_CLEARED("Circuit halt cleared"),
    ENTITY_PAUSED("Entity paused"),
    ENTITY_RESUMED("Entity resumed"),
    TICK_ABORTED("Tick aborted");

    private final String title;

    AlertType(String title) {
        this.title = title;
    }

    public String getTitle() {
        return title;
    }
}
