/*
 * StoreTimer.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2024 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.segset.record.provider.common;

import io.segset.annotation.API;
import io.segset.record.RecordCoreException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An accumulator of timing information.
 * <p>
 * A store timer is a thread-safe record of call counts and nanosecond call times for various operations,
 * classified by an {@link Event}. Operations that are handed a store timer record into it; it is up to the caller
 * to connect this information to any monitoring system.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class StoreTimer {
    @Nonnull
    protected final Map<Event, Counter> counters;
    protected long lastReset;

    /**
     * An identifier for occurrences that need to be timed.
     */
    public interface Event {
        /**
         * Get the name of this event for machine processing.
         *
         * @return the name
         */
        String name();

        /**
         * Get the title of this event for user displays.
         *
         * @return the user-visible title
         */
        String title();

        /**
         * Get the key of this event for logging with {@link io.segset.record.logging.KeyValueLogMessage}s.
         *
         * @return the key to use for logging
         */
        default String logKey() {
            return this.name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * {@link Event}s that only count occurrences or total size.
     * There is no meaningful time duration associated with these events.
     */
    public interface Count extends StoreTimer.Event {
        /**
         * Get whether the count value is actually a size in bytes.
         *
         * @return {@code true} if the count value is actually a size in bytes
         */
        boolean isSize();
    }

    /**
     * Contains the number of occurrences and cumulative time spent on the associated {@link StoreTimer.Event}.
     */
    public static class Counter {
        private final AtomicLong timeNanos;
        private final AtomicInteger count;
        private final boolean immutable;

        public Counter() {
            this(0, 0L, false);
        }

        public Counter(int count, long timeNanos, boolean immutable) {
            this.count = new AtomicInteger(count);
            this.timeNanos = new AtomicLong(timeNanos);
            this.immutable = immutable;
        }

        public int getCount() {
            return count.get();
        }

        public long getTimeNanos() {
            return timeNanos.get();
        }

        /**
         * Add time spent in one more occurrence of the associated event.
         *
         * @param timeDifferenceNanos time spent performing the associated event
         */
        public void record(long timeDifferenceNanos) {
            checkImmutable();
            timeNanos.addAndGet(timeDifferenceNanos);
            count.incrementAndGet();
        }

        /**
         * Add an additional number of occurrences of the associated event.
         *
         * @param amount additional number of occurrences
         */
        public void increment(int amount) {
            checkImmutable();
            count.addAndGet(amount);
        }

        /**
         * Add the value of another counter into this one.
         *
         * @param counter the counter to add
         */
        public void add(@Nonnull Counter counter) {
            checkImmutable();
            timeNanos.addAndGet(counter.getTimeNanos());
            count.addAndGet(counter.getCount());
        }

        private void checkImmutable() {
            if (immutable) {
                throw new RecordCoreException("immutable counter");
            }
        }
    }

    public StoreTimer() {
        counters = new ConcurrentHashMap<>();
        lastReset = System.nanoTime();
    }

    /**
     * Return the counter for a given event.
     *
     * @param event the event to have its counter retrieved
     * @return the counter for the event or {@code null} if no counter exists
     */
    @Nullable
    public Counter getCounter(@Nonnull Event event) {
        return counters.get(event);
    }

    @Nonnull
    protected Counter getOrCreateCounter(@Nonnull Event event) {
        return counters.computeIfAbsent(event, ignore -> new Counter());
    }

    /**
     * Record the amount of time an event took to run.
     * Subclasses can extend this to also update metrics aggregation or monitoring services.
     *
     * @param event the event being recorded
     * @param timeDifferenceNanos the time that the instrumented event took to run
     */
    public void record(@Nonnull Event event, long timeDifferenceNanos) {
        getOrCreateCounter(event).record(timeDifferenceNanos);
    }

    /**
     * Record time since given time.
     *
     * @param event the event being recorded
     * @param startTime the {@code System.nanoTime()} when the event started
     */
    public void recordSinceNanoTime(@Nonnull Event event, long startTime) {
        record(event, System.nanoTime() - startTime);
    }

    /**
     * Record that an event occurred once.
     *
     * @param event the event being recorded
     */
    public void increment(@Nonnull Count event) {
        increment(event, 1);
    }

    /**
     * Record that an event occurred one or more times.
     *
     * @param event the event being recorded
     * @param amount the number of times the event occurred
     */
    public void increment(@Nonnull Count event, int amount) {
        getOrCreateCounter(event).increment(amount);
    }

    /**
     * Get the total time spent for a given event.
     *
     * @param event the event to get time information for
     * @return the total number of nanoseconds recorded for the event
     */
    public long getTimeNanos(@Nonnull Event event) {
        @Nullable Counter counter = getCounter(event);
        return counter == null ? 0L : counter.getTimeNanos();
    }

    /**
     * Get the total count for a given event.
     *
     * @param event the event to get count information for
     * @return the total number times that event was recorded
     */
    public int getCount(@Nonnull Event event) {
        @Nullable Counter counter = getCounter(event);
        return counter == null ? 0 : counter.getCount();
    }

    /**
     * Get all events known to this timer.
     *
     * @return a collection of events for which timing information was recorded
     */
    @Nonnull
    public Collection<Event> getEvents() {
        return counters.keySet();
    }

    public void add(@Nonnull StoreTimer other) {
        for (Map.Entry<Event, Counter> entry : other.counters.entrySet()) {
            getOrCreateCounter(entry.getKey()).add(entry.getValue());
        }
    }

    /**
     * Suitable for {@link io.segset.record.logging.KeyValueLogMessage}.
     *
     * @return a map of recorded times and counts for logging
     */
    @Nonnull
    public Map<String, Number> getKeysAndValues() {
        Map<String, Number> result = new HashMap<>(counters.size() * 2);
        for (Map.Entry<Event, Counter> entry : counters.entrySet()) {
            Event event = entry.getKey();
            Counter counter = entry.getValue();
            result.put(event.logKey() + "_count", counter.getCount());
            if (!(event instanceof Count)) {
                result.put(event.logKey() + "_micros", counter.getTimeNanos() / 1000L);
            }
        }
        return result;
    }

    /**
     * Get the time of the last reset, in {@code System.nanoTime()} terms.
     *
     * @return the time when this timer was created or last reset
     */
    public long getLastReset() {
        return lastReset;
    }

    /**
     * Clear all recorded timing information.
     */
    public void reset() {
        counters.clear();
        lastReset = System.nanoTime();
    }
}
