package com.mycelium.core.supervisor;

import com.mycelium.core.model.ActionKind;
import com.mycelium.core.runtime.Agent;

import java.util.List;

/**
 * Creates fresh execution agents for one capability. Used on spawn and on every
 * restart, so each call must return a new instance.
 */
public interface AgentFactory {

    String capability();

    /** Actions agents of this capability understand. */
    List<ActionKind> actions();

    Agent create();
}
