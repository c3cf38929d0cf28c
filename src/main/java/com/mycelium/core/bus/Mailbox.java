package com.mycelium.core.bus;

import com.mycelium.core.model.Envelope;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded per-agent queue ordered by priority (highest first), then by enqueue order.
 * <p>
 * The bus is the only producer and the owning runtime the only consumer. Once closed
 * the mailbox rejects offers and hands its remaining content back for dead-lettering.
 */
public class Mailbox {

    public enum OfferResult { ACCEPTED, FULL, CLOSED }

    private record Entry(Envelope envelope, long sequence) {}

    private static final Comparator<Entry> ORDER = Comparator
            .comparingInt((Entry e) -> e.envelope().priority()).reversed()
            .thenComparingLong(Entry::sequence);

    private final int capacity;
    private final PriorityQueue<Entry> queue = new PriorityQueue<>(ORDER);
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private long nextSequence;
    private boolean closed;

    public Mailbox(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("mailbox capacity must be positive");
        }
        this.capacity = capacity;
    }

    public OfferResult offer(Envelope envelope) {
        lock.lock();
        try {
            if (closed) {
                return OfferResult.CLOSED;
            }
            if (queue.size() >= capacity) {
                return OfferResult.FULL;
            }
            queue.add(new Entry(envelope, nextSequence++));
            notEmpty.signal();
            return OfferResult.ACCEPTED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for the next envelope.
     *
     * @return the next envelope, or {@code null} on timeout or when the mailbox is closed
     */
    public Envelope poll(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (queue.isEmpty()) {
                if (closed || nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return queue.poll().envelope();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the mailbox and returns whatever was still queued, in dispatch order.
     * Calling it again returns an empty list.
     */
    public List<Envelope> close() {
        lock.lock();
        try {
            closed = true;
            List<Envelope> remaining = new ArrayList<>(queue.size());
            while (!queue.isEmpty()) {
                remaining.add(queue.poll().envelope());
            }
            notEmpty.signalAll();
            return remaining;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
