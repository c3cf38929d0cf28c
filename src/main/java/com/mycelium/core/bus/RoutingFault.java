package com.mycelium.core.bus;

/**
 * Routing failures that are reported synchronously to the caller.
 */
public enum RoutingFault {
    UNKNOWN_RECIPIENT,
    UNDELIVERABLE,
    POOL_EXHAUSTED,
    NO_CAPABLE_SUPERVISOR,
    CIRCUIT_OPEN
}
