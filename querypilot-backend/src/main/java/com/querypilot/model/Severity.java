package com.querypilot.model;

public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    /**
     * Whether an issue of this severity fails validation.
     */
    public boolean isBlocking() {
        return this == ERROR || this == CRITICAL;
    }
}
