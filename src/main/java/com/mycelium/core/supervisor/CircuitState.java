package com.mycelium.core.supervisor;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
