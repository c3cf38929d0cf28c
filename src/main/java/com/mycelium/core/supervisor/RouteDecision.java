package com.mycelium.core.supervisor;

/**
 * Where a directive went.
 *
 * @param outcome  dispatched to a child or queued for the next free one
 * @param childId  chosen child, {@code null} when queued
 */
public record RouteDecision(Outcome outcome, String childId) {

    public enum Outcome { DISPATCHED, QUEUED }

    public static RouteDecision dispatched(String childId) {
        return new RouteDecision(Outcome.DISPATCHED, childId);
    }

    public static RouteDecision queued() {
        return new RouteDecision(Outcome.QUEUED, null);
    }
}
