package com.mycelium.core.model;

/**
 * Position of an agent in the supervision hierarchy.
 */
public enum Tier {
    EXECUTION,
    TACTICAL,
    STRATEGIC
}
