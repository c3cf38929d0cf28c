package com.mycelium.core.bus;

/**
 * Thrown when an envelope cannot be routed. The fault is machine-readable and doubles
 * as the error code of the failed report the caller usually turns this into.
 */
public class RoutingException extends RuntimeException {

    private final RoutingFault fault;

    public RoutingException(RoutingFault fault, String message) {
        super(message);
        this.fault = fault;
    }

    public RoutingFault getFault() {
        return fault;
    }
}
