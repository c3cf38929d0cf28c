package com.mycelium.core.model;

/**
 * Directives the strategic coordinator sends to tactical supervisors.
 */
public enum ControlAction implements ActionKind {
    REDUCE_CONCURRENCY,
    RESTORE_CONCURRENCY,
    PREFER_ALTERNATE;

    public static final String CAPABILITY = "control";

    @Override
    public String capability() {
        return CAPABILITY;
    }
}
