package com.querypilot.execution;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
