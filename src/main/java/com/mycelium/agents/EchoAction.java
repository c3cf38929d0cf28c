package com.mycelium.agents;

import com.mycelium.core.model.ActionKind;

public enum EchoAction implements ActionKind {
    ECHO,
    REVERSE;

    public static final String CAPABILITY = "echo";

    @Override
    public String capability() {
        return CAPABILITY;
    }
}
