package com.mycelium.core.bus;

public class DuplicateIdentityException extends RuntimeException {

    public DuplicateIdentityException(String agentId) {
        super("Agent already registered: " + agentId);
    }
}
