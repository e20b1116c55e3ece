/*
 * Copyright 2025 AxonOps
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

package com.axonops.libacm.util;

import com.axonops.libacm.api.ResourceException;
import com.axonops.libacm.metrics.ACMMetricsRegistry;
import com.axonops.libacm.metrics.MetricNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Tracks state and cursor usage of one automaton for enforcing limits and monitoring.
 *
 * CRITICAL: Tracks LIVE (simultaneous) states, not cumulative total. Unregistering a keyword
 * prunes states and gives their budget back.
 *
 * @since 1.0.0
 */
public final class ResourceTracker {
    private final Logger logger = LoggerFactory.getLogger(ResourceTracker.class);

    // LIVE counts - AtomicInteger for fast limit checks
    private final AtomicInteger activeStatesCount = new AtomicInteger(0);
    private final AtomicInteger activeCursorsCount = new AtomicInteger(0);

    // Cumulative counters (lifetime, for statistics only)
    private final LongAdder totalStatesAllocated = new LongAdder();
    private final LongAdder totalStatesFreed = new LongAdder();
    private final LongAdder totalCursorsOpened = new LongAdder();
    private final LongAdder totalCursorsClosed = new LongAdder();

    private final LongAdder stateLimitRejections = new LongAdder();

    public ResourceTracker() {
        // Instance per automaton
    }

    /**
     * Tracks states about to be allocated. Nothing is counted if the limit would be exceeded.
     *
     * @param count number of new states
     * @param maxStates maximum allowed live states
     * @param metricsRegistry optional metrics registry to record errors
     * @throws ResourceException if the live limit would be exceeded
     */
    public void trackStatesAllocated(int count, int maxStates, ACMMetricsRegistry metricsRegistry) {
        int current = activeStatesCount.addAndGet(count);

        if (current > maxStates) {
            activeStatesCount.addAndGet(-count); // Roll back
            stateLimitRejections.increment();

            if (metricsRegistry != null) {
                metricsRegistry.incrementCounter(MetricNames.ERRORS_RESOURCE_EXHAUSTED);
            }
            logger.warn("ACM: State limit reached - live: {}, requested: {}, max: {}",
                current - count, count, maxStates);

            throw new ResourceException(
                "Maximum live states exceeded: " + maxStates + " (requested " + count
                    + " more with " + (current - count)
                    + " live - unregister keywords or raise maxStates)");
        }
        totalStatesAllocated.add(count);

        logger.trace("ACM: States allocated - live: {}, cumulative: {}", current, totalStatesAllocated.sum());
    }

    /**
     * Tracks states that were freed.
     *
     * @param count number of freed states
     */
    public void trackStatesFreed(int count) {
        int current = activeStatesCount.addAndGet(-count);
        totalStatesFreed.add(count);

        if (current < 0) {
            logger.error("ACM: State count went negative ({})! This is a bug.", current);
            activeStatesCount.set(0);
        }

        logger.trace("ACM: States freed - live: {}, cumulative freed: {}", current, totalStatesFreed.sum());
    }

    /**
     * Gets current LIVE state count, root included.
     */
    public int getActiveStateCount() {
        return activeStatesCount.get();
    }

    public long getTotalStatesAllocated() {
        return totalStatesAllocated.sum();
    }

    public long getTotalStatesFreed() {
        return totalStatesFreed.sum();
    }

    /**
     * Gets rejection count for the state limit.
     */
    public long getStateLimitRejections() {
        return stateLimitRejections.sum();
    }

    /**
     * Tracks a new cursor.
     */
    public void trackCursorOpened() {
        activeCursorsCount.incrementAndGet();
        totalCursorsOpened.increment();
    }

    /**
     * Tracks a cursor being closed.
     */
    public void trackCursorClosed() {
        int current = activeCursorsCount.decrementAndGet();
        totalCursorsClosed.increment();

        if (current < 0) {
            logger.error("ACM: Cursor count went negative! This is a bug.");
            activeCursorsCount.set(0);
        }
    }

    /**
     * Gets cursors created and not yet closed.
     */
    public int getActiveCursorCount() {
        return activeCursorsCount.get();
    }

    public long getTotalCursorsOpened() {
        return totalCursorsOpened.sum();
    }

    public long getTotalCursorsClosed() {
        return totalCursorsClosed.sum();
    }

    /**
     * Resets all counters (for testing only).
     */
    public void reset() {
        activeStatesCount.set(0);
        activeCursorsCount.set(0);
        totalStatesAllocated.reset();
        totalStatesFreed.reset();
        totalCursorsOpened.reset();
        totalCursorsClosed.reset();
        stateLimitRejections.reset();
        logger.trace("ACM: ResourceTracker reset");
    }

    /**
     * Gets statistics snapshot.
     */
    public ResourceStatistics getStatistics() {
        return new ResourceStatistics(
            activeStatesCount.get(),
            totalStatesAllocated.sum(),
            totalStatesFreed.sum(),
            activeCursorsCount.get(),
            totalCursorsOpened.sum(),
            totalCursorsClosed.sum(),
            stateLimitRejections.sum()
        );
    }

    public record ResourceStatistics(
        int activeStates,
        long totalStatesAllocated,
        long totalStatesFreed,
        int activeCursors,
        long totalCursorsOpened,
        long totalCursorsClosed,
        long stateLimitRejections
    ) {
        /**
         * True if cursors are still open although every state was freed, i.e. the automaton was
         * released underneath cursors nobody closed. A live automaton always holds its root state.
         */
        public boolean hasPotentialLeaks() {
            return activeCursors > 0 && activeStates == 0 && totalStatesAllocated > 0;
        }

        /**
         * True if allocation and release accounting disagree with the live count.
         */
        public boolean isStateAccountingConsistent() {
            return totalStatesAllocated - totalStatesFreed == activeStates;
        }
    }
}
