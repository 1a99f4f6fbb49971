package com.ads.guardian.protection;

public enum HaltTrigger {

    NONE("No halt"),

    ABSOLUTE_LIMIT("Cumulative loss above absolute limit"),

    LOSS_RATE("Loss rate above limit");

    private final String description;

    HaltTrigger(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
