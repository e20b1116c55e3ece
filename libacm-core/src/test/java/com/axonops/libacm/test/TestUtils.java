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
package com.axonops.libacm.test;

import com.axonops.libacm.api.AhoCorasick;
import com.axonops.libacm.api.Occurrence;
import com.axonops.libacm.config.ACMConfig;
import com.axonops.libacm.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Random;

/**
 * Test utilities for automaton tests.
 *
 * <h2>Usage Patterns</h2>
 *
 * <pre>{@code
 * try (Automaton<Character, String> acm = AhoCorasick.forText(TestUtils.testConfig())) {
 *     acm.register(TestUtils.kw("he"), "he");
 *     assertThat(TestUtils.describe(acm.findAll(TestUtils.kw("ushers")))).containsExactly("he@2");
 * }
 * }</pre>
 */
public final class TestUtils {

    private TestUtils() {
        // Utility class
    }

    /**
     * Builder with test defaults: verification after every rebuild, metrics disabled.
     */
    public static ACMConfig.Builder testConfigBuilder() {
        return ACMConfig.builder().validateAfterRebuild(true);
    }

    public static ACMConfig testConfig() {
        return testConfigBuilder().build();
    }

    /**
     * Test config reporting into {@code registry} under {@code prefix}.
     */
    public static ACMConfig testConfigWithMetrics(MetricRegistry registry, String prefix) {
        return testConfigBuilder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, prefix))
            .build();
    }

    /**
     * Keyword or text as a symbol list.
     */
    public static List<Character> kw(String text) {
        return AhoCorasick.symbols(text);
    }

    /**
     * Renders occurrences as {@code keyword@start}, in reported order.
     */
    public static List<String> describe(List<? extends Occurrence<Character, ?>> occurrences) {
        List<String> result = new ArrayList<>(occurrences.size());
        for (Occurrence<Character, ?> o : occurrences) {
            result.add(AhoCorasick.text(o.match().keyword()) + "@" + o.start());
        }
        return result;
    }

    /**
     * Reference search: every occurrence of every keyword, by end position and longest first,
     * rendered like {@link #describe}. Quadratic, for small inputs only.
     */
    public static List<String> bruteForce(Collection<String> keywords, String text) {
        List<String> result = new ArrayList<>();
        for (int end = 1; end <= text.length(); end++) {
            for (int start = 0; start < end; start++) {
                String candidate = text.substring(start, end);
                if (keywords.contains(candidate)) {
                    result.add(candidate + "@" + start);
                }
            }
        }
        return result;
    }

    /**
     * Random string over the first {@code alphabetSize} lowercase letters.
     */
    public static String randomText(Random random, int length, int alphabetSize) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append((char) ('a' + random.nextInt(alphabetSize)));
        }
        return sb.toString();
    }
}
