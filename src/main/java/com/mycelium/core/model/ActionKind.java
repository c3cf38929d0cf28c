package com.mycelium.core.model;

/**
 * An action a directive asks for. Implemented by one enum per capability so the set
 * of actions for a capability is closed and handlers can switch over it exhaustively.
 */
public interface ActionKind {

    /** Capability that executes this action; used for routing. */
    String capability();

    /** Constant name, supplied by {@link Enum#name()}. */
    String name();

    /** Wire form, e.g. {@code echo:REVERSE}. */
    default String qualifiedName() {
        return capability() + ":" + name();
    }
}
