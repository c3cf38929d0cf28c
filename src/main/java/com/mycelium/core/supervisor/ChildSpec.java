package com.mycelium.core.supervisor;

/**
 * Request to spawn one child.
 *
 * @param capability pool the child joins; must be one the supervisor declared
 * @param childId    id to use, or {@code null} to generate one
 */
public record ChildSpec(String capability, String childId) {

    public static ChildSpec of(String capability) {
        return new ChildSpec(capability, null);
    }
}
