package com.mycelium.core.supervisor;

import com.mycelium.core.bus.RoutingException;
import com.mycelium.core.bus.RoutingFault;
import com.mycelium.core.runtime.AgentRuntime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Interchangeable children of one capability with busy/idle accounting, a concurrency
 * limit and a bounded wait queue.
 * <p>
 * Mutated only from the owning supervisor's thread; methods are synchronized so that
 * {@link #snapshot()} can be read from anywhere.
 */
public class ChildPool {

    /** One pool member. */
    public static final class Child {
        private final String id;
        private final CircuitBreaker breaker;
        private AgentRuntime runtime;
        private boolean busy;
        private int restarts;

        Child(String id, AgentRuntime runtime, CircuitBreaker breaker) {
            this.id = id;
            this.runtime = runtime;
            this.breaker = breaker;
        }

        public String id() {
            return id;
        }

        public CircuitBreaker breaker() {
            return breaker;
        }

        public AgentRuntime runtime() {
            return runtime;
        }

        void replaceRuntime(AgentRuntime runtime) {
            this.runtime = runtime;
        }

        public boolean isBusy() {
            return busy;
        }

        public int restarts() {
            return restarts;
        }

        int incrementRestarts() {
            return ++restarts;
        }
    }

    private final String capability;
    private final int maxSize;
    private final int queueDepth;
    private final List<Child> members = new ArrayList<>();
    private final Deque<String> waiting = new ArrayDeque<>();
    private int concurrencyLimit;
    private int cursor;
    private int peakBusy;

    public ChildPool(String capability, int maxSize, int queueDepth) {
        this.capability = capability;
        this.maxSize = maxSize;
        this.queueDepth = queueDepth;
        this.concurrencyLimit = maxSize;
    }

    public String capability() {
        return capability;
    }

    public synchronized boolean isFull() {
        return members.size() >= maxSize;
    }

    synchronized void add(Child child) {
        if (members.size() >= maxSize) {
            throw new IllegalStateException("Pool " + capability + " is full (" + maxSize + ")");
        }
        members.add(child);
    }

    synchronized void remove(Child child) {
        members.remove(child);
        if (cursor >= members.size()) {
            cursor = 0;
        }
    }

    public synchronized Optional<Child> member(String childId) {
        return members.stream().filter(c -> c.id.equals(childId)).findFirst();
    }

    public synchronized List<Child> members() {
        return List.copyOf(members);
    }

    public synchronized int size() {
        return members.size();
    }

    /**
     * Picks a child for the next directive and claims its breaker.
     *
     * @param preferred child to use if it is free, or {@code null}
     * @return the child, or {@code null} when the preferred child or every admissible
     *         child is busy, or the concurrency limit is reached
     * @throws RoutingException POOL_EXHAUSTED for an empty pool, CIRCUIT_OPEN when no
     *                          breaker admits a call or the preferred child's breaker
     *                          does not
     */
    synchronized Child select(String preferred) {
        if (members.isEmpty()) {
            throw new RoutingException(RoutingFault.POOL_EXHAUSTED, "Pool " + capability + " has no children");
        }
        if (members.stream().noneMatch(c -> c.breaker.allowsRequest())) {
            throw new RoutingException(RoutingFault.CIRCUIT_OPEN,
                    "All " + members.size() + " " + capability + " circuit(s) are open");
        }
        Child target = preferred == null ? null
                : members.stream().filter(c -> c.id.equals(preferred)).findFirst().orElse(null);
        if (target != null && !target.breaker.allowsRequest()) {
            throw new RoutingException(RoutingFault.CIRCUIT_OPEN,
                    "Circuit of preferred child " + preferred + " is " + target.breaker.state());
        }
        if (busyCount() >= concurrencyLimit) {
            return null;
        }
        if (target != null) {
            return !target.busy && target.breaker.tryAcquire() ? target : null;
        }
        int n = members.size();
        for (int i = 0; i < n; i++) {
            int index = (cursor + i) % n;
            Child candidate = members.get(index);
            if (!candidate.busy && candidate.breaker.tryAcquire()) {
                cursor = (index + 1) % n;
                return candidate;
            }
        }
        return null;
    }

    /** Whether a call with no preferred child could be placed right now. */
    synchronized boolean hasIdleCapacity() {
        return busyCount() < concurrencyLimit
                && members.stream().anyMatch(c -> !c.busy && c.breaker.allowsRequest());
    }

    /** Whether any child's breaker would admit a call now. */
    synchronized boolean anyAdmits() {
        return members.stream().anyMatch(c -> c.breaker.allowsRequest());
    }

    synchronized void markBusy(Child child) {
        child.busy = true;
        peakBusy = Math.max(peakBusy, busyCount());
    }

    synchronized void markIdle(Child child) {
        child.busy = false;
    }

    synchronized boolean enqueue(String correlationKey) {
        if (waiting.size() >= queueDepth) {
            return false;
        }
        waiting.addLast(correlationKey);
        return true;
    }

    /** Waiting correlation keys, oldest first. */
    synchronized List<String> waitingKeys() {
        return new ArrayList<>(waiting);
    }

    synchronized boolean removeWaiting(String correlationKey) {
        return waiting.remove(correlationKey);
    }

    public synchronized int queued() {
        return waiting.size();
    }

    public synchronized int busyCount() {
        return (int) members.stream().filter(c -> c.busy).count();
    }

    /** Halves the concurrency limit, never below one. */
    synchronized int reduceConcurrency() {
        concurrencyLimit = Math.max(1, concurrencyLimit / 2);
        return concurrencyLimit;
    }

    synchronized int restoreConcurrency() {
        concurrencyLimit = maxSize;
        return concurrencyLimit;
    }

    public synchronized int concurrencyLimit() {
        return concurrencyLimit;
    }

    public synchronized PoolSnapshot snapshot() {
        Map<String, CircuitState> breakers = new LinkedHashMap<>();
        for (Child child : members) {
            breakers.put(child.id, child.breaker.state());
        }
        return new PoolSnapshot(capability, members.size(), maxSize, busyCount(), peakBusy,
                waiting.size(), concurrencyLimit, breakers);
    }
}
