package com.mycelium.core.bridge;

import com.mycelium.core.model.ActionKind;
import com.mycelium.core.model.ControlAction;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves wire names such as {@code echo:REVERSE} back to action constants. Only
 * actions registered here can be read from the CLI or from the remote bridge.
 */
public class ActionCatalog {

    private final Map<String, ActionKind> actions = new LinkedHashMap<>();

    public ActionCatalog(Collection<? extends ActionKind> known) {
        register(List.of(ControlAction.values()));
        register(known);
    }

    private void register(Collection<? extends ActionKind> known) {
        for (ActionKind action : known) {
            ActionKind previous = actions.putIfAbsent(action.qualifiedName(), action);
            if (previous != null && previous != action) {
                throw new IllegalArgumentException("Conflicting action " + action.qualifiedName());
            }
        }
    }

    /**
     * @throws IllegalArgumentException for names not in the catalog
     */
    public ActionKind resolve(String qualifiedName) {
        ActionKind action = actions.get(qualifiedName);
        if (action == null) {
            throw new IllegalArgumentException("Unknown action '" + qualifiedName + "', expected one of " + names());
        }
        return action;
    }

    public boolean contains(String qualifiedName) {
        return actions.containsKey(qualifiedName);
    }

    public Set<String> names() {
        return actions.keySet();
    }
}
