package com.evolver.evolution;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Rolling window of weighted entries keyed by a unique identifier.
 *
 * <p>Design:
 * <ul>
 *   <li>A {@link ConcurrentLinkedQueue} holds entries in insertion (time) order.</li>
 *   <li>A {@link ConcurrentHashMap} provides dedup lookups by identifier.</li>
 *   <li>Two {@link AtomicInteger}s track the live entry count and weight total.</li>
 *   <li>Expired entries are drained from the queue head on every read or write.</li>
 * </ul>
 * Time comes from an injected {@link Clock}; {@link #rollover()} starts a new window
 * immediately.
 */
public class RollingWindowCounter {

    private final long windowSizeMs;
    private final Clock clock;

    // Oldest entries at the head
    private final ConcurrentLinkedQueue<Entry> timeQueue = new ConcurrentLinkedQueue<>();

    private final ConcurrentHashMap<String, Entry> identifiers = new ConcurrentHashMap<>();

    private final AtomicInteger size = new AtomicInteger(0);
    private final AtomicInteger total = new AtomicInteger(0);

    public RollingWindowCounter(long windowSizeMs, Clock clock) {
        if (windowSizeMs <= 0) {
            throw new IllegalArgumentException("Window size must be positive");
        }
        this.windowSizeMs = windowSizeMs;
        this.clock = clock;
    }

    /**
     * Add an entry unless the identifier is already in the window.
     *
     * @return true if added
     */
    public boolean tryAdd(String identifier, int weight) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        evictExpired();

        Entry entry = new Entry(identifier, clock.millis(), weight);
        if (identifiers.putIfAbsent(identifier, entry) == null) {
            timeQueue.offer(entry);
            size.incrementAndGet();
            total.addAndGet(weight);
            return true;
        }
        return false;
    }

    /**
     * Number of entries in the window.
     */
    public int count() {
        evictExpired();
        return size.get();
    }

    /**
     * Sum of the weights of the entries in the window.
     */
    public int total() {
        evictExpired();
        return total.get();
    }

    public boolean contains(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return false;
        }
        evictExpired();
        return identifiers.containsKey(identifier);
    }

    /**
     * Drop every entry, starting a fresh window.
     */
    public synchronized void rollover() {
        timeQueue.clear();
        identifiers.clear();
        size.set(0);
        total.set(0);
    }

    public long getWindowSizeMs() {
        return windowSizeMs;
    }

    /**
     * Drain expired entries from the head of the queue. Entries are inserted in time
     * order, so polling stops at the first live one.
     */
    private void evictExpired() {
        long windowStart = clock.millis() - windowSizeMs;

        Entry head;
        while ((head = timeQueue.peek()) != null && head.timestamp <= windowStart) {
            Entry polled = timeQueue.poll();
            if (polled == null) {
                break;
            }
            // Only account for the entry if it still owns its slot (a rollover may have raced)
            if (identifiers.remove(polled.identifier, polled)) {
                size.decrementAndGet();
                total.addAndGet(-polled.weight);
            }
        }
    }

    private record Entry(String identifier, long timestamp, int weight) {}
}
