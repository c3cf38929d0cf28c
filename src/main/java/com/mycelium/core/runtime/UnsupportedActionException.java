package com.mycelium.core.runtime;

public class UnsupportedActionException extends RuntimeException {

    public UnsupportedActionException(String action, String expected) {
        super("Action " + action + " is not a " + expected);
    }
}
