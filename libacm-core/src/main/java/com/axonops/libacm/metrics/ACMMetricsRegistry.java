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

package com.axonops.libacm.metrics;

import java.util.function.Supplier;

/**
 * Abstract metrics registry interface for libacm.
 *
 * <p>Lets the core library report metrics without depending on Dropwizard Metrics at runtime.
 * Implementations can use Dropwizard Metrics, a custom metrics system, or no-op.
 *
 * <p><strong>Metric Types (following Dropwizard patterns):</strong>
 * <ul>
 *   <li><strong>Counter:</strong> monotonically increasing long</li>
 *   <li><strong>Timer:</strong> durations in nanoseconds with histogram</li>
 *   <li><strong>Gauge:</strong> value computed on demand via supplier</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> All implementations must be thread-safe.
 *
 * @since 1.0.0
 * @see MetricNames
 */
public interface ACMMetricsRegistry {

    /**
     * Increment a counter by 1.
     *
     * @param name metric name (e.g., "keywords.registered.total.count")
     */
    void incrementCounter(String name);

    /**
     * Increment a counter by a specific delta.
     *
     * @param name metric name (e.g., "matching.matches.total.count")
     * @param delta amount to increment (must be non-negative)
     */
    void incrementCounter(String name, long delta);

    /**
     * Record a timer measurement in nanoseconds.
     *
     * @param name metric name (e.g., "automaton.rebuild.latency")
     * @param durationNanos duration in nanoseconds
     */
    void recordTimer(String name, long durationNanos);

    /**
     * Register a gauge that computes its value on demand.
     *
     * <p>The supplier is called each time the gauge is read (e.g., via JMX) and must not block.
     * Several automata may register under the same name; the gauge then reports the sum of their
     * suppliers.
     *
     * @param name metric name (e.g., "automaton.states.current.count")
     * @param valueSupplier function that returns the current value
     */
    void registerGauge(String name, Supplier<Number> valueSupplier);

    /**
     * Withdraw a supplier previously passed to {@link #registerGauge}. The gauge itself is removed
     * once no supplier is left under its name. No-op if the supplier is not registered.
     *
     * @param name metric name
     * @param valueSupplier the same supplier instance that was registered
     */
    void removeGauge(String name, Supplier<Number> valueSupplier);
}
