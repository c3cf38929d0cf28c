package com.mycelium.agents;

import com.mycelium.core.model.ActionKind;
import com.mycelium.core.runtime.Agent;
import com.mycelium.core.supervisor.AgentFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class EchoAgentFactory implements AgentFactory {

    @Override
    public String capability() {
        return EchoAction.CAPABILITY;
    }

    @Override
    public List<ActionKind> actions() {
        return List.of(EchoAction.values());
    }

    @Override
    public Agent create() {
        return new EchoAgent();
    }
}
