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

package com.axonops.libacm.dropwizard;

import com.axonops.libacm.config.ACMConfig;
import com.axonops.libacm.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for ACMConfig with Dropwizard Metrics integration.
 *
 * <p>Wires a {@link DropwizardMetricsAdapter} into the configuration and, optionally, exposes the
 * registry over JMX. Works with any host that already owns a {@link MetricRegistry}.
 *
 * <p><strong>Usage Examples:</strong>
 * <pre>{@code
 * // Defaults plus metrics under "com.myapp.keywords", visible in JMX:
 * ACMConfig config = ACMMetricsConfig.withMetrics(registry, "com.myapp.keywords");
 *
 * // Custom limits plus metrics:
 * ACMConfig config = ACMMetricsConfig.builderWithMetrics(registry, "com.myapp.keywords", false)
 *     .maxStates(1_000_000)
 *     .build();
 * }</pre>
 *
 * <p><strong>JMX Exposure:</strong> One JmxReporter is shared by the whole JVM. It is started for
 * the first registry passed with JMX enabled; later registries are not reported unless the caller
 * reports them.
 *
 * @since 1.0.0
 */
public final class ACMMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(ACMMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private ACMMetricsConfig() {
        // Utility class
    }

    /**
     * Creates ACMConfig with Dropwizard Metrics integration and automatic JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return configured ACMConfig with metrics enabled
     */
    public static ACMConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates ACMConfig with Dropwizard Metrics integration.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to automatically set up JMX exposure
     * @return configured ACMConfig with metrics enabled
     */
    public static ACMConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        return builderWithMetrics(registry, metricPrefix, enableJmx).build();
    }

    /**
     * Creates ACMConfig with Dropwizard Metrics using the default prefix
     * {@value DropwizardMetricsAdapter#DEFAULT_PREFIX} and automatic JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return configured ACMConfig with metrics enabled
     */
    public static ACMConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Creates a builder with metrics already wired, for callers that also tune limits.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to automatically set up JMX exposure
     * @return builder with defaults and the metrics registry set
     */
    public static ACMConfig.Builder builderWithMetrics(
            MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return ACMConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix));
    }

    /**
     * True if the shared JmxReporter is running.
     */
    public static boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    /**
     * Starts the shared JmxReporter for {@code registry} unless one is already running.
     *
     * @param registry the MetricRegistry to expose via JMX
     */
    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                JmxReporter reporter = JmxReporter.forRegistry(registry).build();
                reporter.start();
                jmxReporter = reporter;
                logger.info("ACM: JmxReporter started - metrics available via JMX");
            } catch (RuntimeException e) {
                // Not fatal - metrics still reach the registry
                logger.warn("ACM: Failed to start JmxReporter (may already be configured)", e);
            }
        }
    }

    /**
     * Stops the shared JmxReporter, if running.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("ACM: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
