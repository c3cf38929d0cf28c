package com.mycelium.core.supervisor;

/**
 * A pool a supervisor owns: {@code size} children made by {@code factory}.
 */
public record PoolSpec(AgentFactory factory, int size) {

    public PoolSpec {
        if (factory == null) {
            throw new IllegalArgumentException("factory is required");
        }
        if (size < 1) {
            throw new IllegalArgumentException("pool size must be at least 1");
        }
    }

    public String capability() {
        return factory.capability();
    }
}
