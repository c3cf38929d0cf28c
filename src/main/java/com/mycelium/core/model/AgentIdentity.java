package com.mycelium.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable identity of a registered agent.
 *
 * @param id           unique agent id
 * @param capabilities capability strings the agent advertises, in declaration order
 * @param tier         hierarchy tier
 * @param parentId     id of the supervising agent; {@code null} for the root and for proxies
 */
public record AgentIdentity(
    String id,
    Set<String> capabilities,
    Tier tier,
    String parentId
) {

    public AgentIdentity {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("agent id cannot be empty");
        }
        if (tier == null) {
            throw new IllegalArgumentException("tier is required for agent " + id);
        }
        capabilities = capabilities == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(capabilities));
    }

    public static AgentIdentity of(String id, Tier tier, String parentId, String... capabilities) {
        return new AgentIdentity(id, new LinkedHashSet<>(List.of(capabilities)), tier, parentId);
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }
}
