package com.axonops.libacm.metrics;

import static com.axonops.libacm.test.TestUtils.kw;
import static com.axonops.libacm.test.TestUtils.testConfigBuilder;
import static com.axonops.libacm.test.TestUtils.testConfigWithMetrics;
import static org.assertj.core.api.Assertions.*;

import com.axonops.libacm.api.AhoCorasick;
import com.axonops.libacm.api.Automaton;
import com.axonops.libacm.api.Cursor;
import com.axonops.libacm.api.ResourceException;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies that automaton operations reach a Dropwizard registry under the expected names.
 */
class MetricsIntegrationTest {

    private static final String PREFIX = "test.acm";

    private MetricRegistry registry;
    private Automaton<Character, Void> acm;

    @BeforeEach
    void setup() {
        registry = new MetricRegistry();
        acm = AhoCorasick.forText(testConfigWithMetrics(registry, PREFIX));
    }

    @AfterEach
    void cleanup() {
        acm.release();
    }

    @Test
    void testRegistrationCounters() {
        acm.register(kw("he"));
        acm.register(kw("she"));
        acm.register(kw("he"));
        acm.unregister(kw("she"));

        assertThat(counter(MetricNames.KEYWORDS_REGISTERED)).isEqualTo(2);
        assertThat(counter(MetricNames.KEYWORDS_DUPLICATE)).isEqualTo(1);
        assertThat(counter(MetricNames.KEYWORDS_UNREGISTERED)).isEqualTo(1);
    }

    @Test
    void testScanMetrics() {
        acm.register(kw("he"));
        acm.register(kw("she"));

        acm.findAll(kw("she and he"));
        acm.containsAny(kw("nothing"));

        assertThat(counter(MetricNames.MATCHING_SCANS)).isEqualTo(2);
        assertThat(counter(MetricNames.MATCHING_MATCHES)).isEqualTo(3);
        assertThat(registry.timer(name(MetricNames.MATCHING_SCAN_LATENCY)).getCount()).isEqualTo(2);
        assertThat(counter(MetricNames.AUTOMATON_REBUILDS)).isEqualTo(1);
        assertThat(registry.timer(name(MetricNames.AUTOMATON_REBUILD_LATENCY)).getCount()).isEqualTo(1);
    }

    @Test
    void testGauges() {
        acm.register(kw("abc"));
        acm.register(kw("abd"));

        assertThat(gauge(MetricNames.KEYWORDS_CURRENT)).isEqualTo(2);
        assertThat(gauge(MetricNames.STATES_CURRENT)).isEqualTo(5);
        assertThat(gauge(MetricNames.STATES_PEAK)).isEqualTo(5);

        acm.unregister(kw("abd"));

        assertThat(gauge(MetricNames.STATES_CURRENT)).isEqualTo(4);
        assertThat(gauge(MetricNames.STATES_PEAK)).isEqualTo(5);
    }

    @Test
    void testCursorMetrics() {
        Cursor<Character, Void> cursor = acm.cursor();
        assertThat(counter(MetricNames.CURSORS_CREATED)).isEqualTo(1);
        assertThat(gauge(MetricNames.CURSORS_ACTIVE)).isEqualTo(1);

        cursor.close();

        assertThat(gauge(MetricNames.CURSORS_ACTIVE)).isZero();
    }

    @Test
    void testResourceErrorsCounted() {
        Automaton<Character, Void> small = AhoCorasick.forText(testConfigBuilder()
            .maxStates(3)
            .maxKeywordLength(2)
            .metricsRegistry(new DropwizardMetricsAdapter(registry, "test.small"))
            .build());
        try {
            assertThatThrownBy(() -> small.register(kw("abc"))).isInstanceOf(ResourceException.class);
            small.register(kw("ab"));
            assertThatThrownBy(() -> small.register(kw("x"))).isInstanceOf(ResourceException.class);

            assertThat(registry.counter("test.small." + MetricNames.ERRORS_RESOURCE_EXHAUSTED).getCount())
                .isEqualTo(2);
        } finally {
            small.release();
        }
    }

    @Test
    void testGaugesRemovedOnRelease() {
        assertThat(registry.getGauges()).containsKey(name(MetricNames.STATES_CURRENT));

        acm.release();

        assertThat(registry.getGauges()).doesNotContainKey(name(MetricNames.STATES_CURRENT));
    }

    @Test
    void testGaugesSumAutomataSharingOneAdapter() {
        DropwizardMetricsAdapter shared = new DropwizardMetricsAdapter(registry, "test.shared");
        Automaton<Character, Void> first = AhoCorasick.forText(testConfigBuilder().metricsRegistry(shared).build());
        Automaton<Character, Void> second = AhoCorasick.forText(testConfigBuilder().metricsRegistry(shared).build());
        String keywords = "test.shared." + MetricNames.KEYWORDS_CURRENT;
        String states = "test.shared." + MetricNames.STATES_CURRENT;
        try {
            first.register(kw("he"));
            second.register(kw("hello"));

            assertThat(sharedGauge(keywords)).isEqualTo(2);
            // root + 2 and root + 5
            assertThat(sharedGauge(states)).isEqualTo(9);

            first.release();

            assertThat(registry.getGauges()).containsKey(keywords);
            assertThat(sharedGauge(keywords)).isEqualTo(1);
            assertThat(sharedGauge(states)).isEqualTo(6);
        } finally {
            first.release();
            second.release();
        }
        assertThat(registry.getGauges()).doesNotContainKeys(keywords, states);
    }

    @Test
    void testGaugesSurviveReleaseOfAutomatonWithSeparateAdapter() {
        Automaton<Character, Void> other = AhoCorasick.forText(testConfigWithMetrics(registry, PREFIX));
        acm.register(kw("abc"));
        other.register(kw("xy"));
        assertThat(gauge(MetricNames.KEYWORDS_CURRENT)).isEqualTo(2);

        other.release();

        assertThat(gauge(MetricNames.KEYWORDS_CURRENT)).isEqualTo(1);
        assertThat(gauge(MetricNames.STATES_CURRENT)).isEqualTo(4);
    }

    private static String name(String metric) {
        return PREFIX + "." + metric;
    }

    private long counter(String metric) {
        return registry.counter(name(metric)).getCount();
    }

    private int gauge(String metric) {
        return sharedGauge(name(metric));
    }

    private int sharedGauge(String fullName) {
        Gauge<?> gauge = registry.getGauges().get(fullName);
        assertThat(gauge).as("gauge %s", fullName).isNotNull();
        return ((Number) gauge.getValue()).intValue();
    }
}
