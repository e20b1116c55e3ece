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

import com.codahale.metrics.Gauge;
import com.codahale.metrics.Metric;
import com.codahale.metrics.MetricRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Dropwizard Metrics adapter for libacm.
 *
 * <p>Wraps a Dropwizard {@link MetricRegistry} and delegates every metric operation to it, so
 * automata report into whatever registry the host application already exports.
 *
 * <p>Gauges are shared per name. Every automaton reporting into the same registry under the same
 * prefix contributes one value source, and the gauge reads the sum of the live sources. Releasing
 * an automaton withdraws its source only; the gauge leaves the registry with the last one. This
 * holds across adapter instances, since the sources live in the gauge itself.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * ACMMetricsRegistry metrics = new DropwizardMetricsAdapter(registry, "com.myapp.keywords");
 * }</pre>
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements ACMMetricsRegistry {

    /** Prefix used when none is given. */
    public static final String DEFAULT_PREFIX = "com.axonops.libacm";

    private final MetricRegistry registry;
    private final String prefix;

    /**
     * Creates adapter with default metric prefix: {@code com.axonops.libacm}
     *
     * @param registry the Dropwizard MetricRegistry to register metrics with
     * @throws NullPointerException if registry is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Creates adapter with custom metric prefix.
     *
     * <p>With prefix {@code "com.myapp.keywords"} the rebuild counter appears as
     * {@code com.myapp.keywords.automaton.rebuilds.total.count}.
     *
     * @param registry the Dropwizard MetricRegistry to register metrics with
     * @param prefix the metric name prefix
     * @throws NullPointerException if registry or prefix is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
    }

    @Override
    public void incrementCounter(String name) {
        registry.counter(metricName(name)).inc();
    }

    @Override
    public void incrementCounter(String name, long delta) {
        registry.counter(metricName(name)).inc(delta);
    }

    @Override
    public void recordTimer(String name, long durationNanos) {
        registry.timer(metricName(name)).update(durationNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void registerGauge(String name, Supplier<Number> valueSupplier) {
        String fullName = metricName(name);
        synchronized (registry) {
            Metric existing = registry.getMetrics().get(fullName);
            SummingGauge gauge;
            if (existing instanceof SummingGauge) {
                gauge = (SummingGauge) existing;
            } else {
                // Replace a foreign metric left under this name
                if (existing != null) {
                    registry.remove(fullName);
                }
                gauge = registry.register(fullName, new SummingGauge());
            }
            gauge.add(valueSupplier);
        }
    }

    @Override
    public void removeGauge(String name, Supplier<Number> valueSupplier) {
        String fullName = metricName(name);
        synchronized (registry) {
            Metric existing = registry.getMetrics().get(fullName);
            if (existing instanceof SummingGauge && ((SummingGauge) existing).remove(valueSupplier)) {
                registry.remove(fullName);
            }
        }
    }

    /** The underlying registry. */
    public MetricRegistry getRegistry() {
        return registry;
    }

    /** The prefix prepended to every metric name. */
    public String getPrefix() {
        return prefix;
    }

    private String metricName(String name) {
        return MetricRegistry.name(prefix, name);
    }

    /** Sum of the values of every automaton registered under one gauge name. */
    private static final class SummingGauge implements Gauge<Long> {
        private final List<Supplier<Number>> sources = new CopyOnWriteArrayList<>();

        void add(Supplier<Number> source) {
            sources.add(source);
        }

        /** @return true if no source is left */
        boolean remove(Supplier<Number> source) {
            sources.remove(source);
            return sources.isEmpty();
        }

        @Override
        public Long getValue() {
            long sum = 0;
            for (Supplier<Number> source : sources) {
                sum += source.get().longValue();
            }
            return sum;
        }
    }
}
