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
package com.axonops.libacm.performance;

import com.axonops.libacm.api.AhoCorasick;
import com.axonops.libacm.api.Automaton;
import com.axonops.libacm.api.Cursor;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Dictionary-against-book throughput: thousands of space-prefixed words counted in a large
 * generated text, the way a word-frequency job would use the automaton.
 * These tests are skipped under QEMU emulation as performance is not representative.
 */
class ScanThroughputPerformanceTest {
    private static final Logger logger = LoggerFactory.getLogger(ScanThroughputPerformanceTest.class);

    private static final int DICTIONARY_SIZE = 2_000;
    private static final int TEXT_WORDS = 20_000;

    /**
     * Detects if running under QEMU emulation (set by CI workflow).
     */
    private static boolean isQemuEmulation() {
        return "true".equals(System.getenv("QEMU_EMULATION"));
    }

    @Test
    void testDictionaryScan_MatchesNaiveCount() {
        assumeTrue(!isQemuEmulation(), "Skipping performance test under QEMU emulation");

        Random random = new Random(20240601L);
        List<String> dictionary = dictionary(random);
        String text = text(random, dictionary);

        try (Automaton<Character, Void> acm = AhoCorasick.forText()) {
            long registerStart = System.nanoTime();
            for (String word : dictionary) {
                acm.register(AhoCorasick.symbols(" " + word));
            }
            long registerDuration = System.nanoTime() - registerStart;

            long rebuildStart = System.nanoTime();
            acm.prepare();
            long rebuildDuration = System.nanoTime() - rebuildStart;

            // Warmup (JIT compilation)
            for (int i = 0; i < 3; i++) {
                acm.scan(AhoCorasick.symbols(text), o -> { });
            }

            long scanStart = System.nanoTime();
            long found = acm.scan(AhoCorasick.symbols(text), o -> { });
            long scanDuration = System.nanoTime() - scanStart;

            long naiveStart = System.nanoTime();
            long expected = naiveCount(dictionary, text);
            long naiveDuration = System.nanoTime() - naiveStart;

            assertThat(found).isEqualTo(expected);

            logger.info("=== Dictionary scan ({} keywords, {} chars) ===", acm.keywordCount(), text.length());
            logger.info("Register: {} ms, rebuild: {} ms, states: {}",
                registerDuration / 1_000_000.0, rebuildDuration / 1_000_000.0, acm.statistics().stateCount());
            logger.info("Automaton scan: {} ms ({} MB/s), naive indexOf: {} ms",
                scanDuration / 1_000_000.0,
                String.format("%.1f", text.length() / (scanDuration / 1_000_000_000.0) / 1_000_000.0),
                naiveDuration / 1_000_000.0);
            logger.info("Occurrences: {}", found);
            logger.info("================================================");
        }
    }

    @Test
    void testCursorVsScan_SameCount() {
        assumeTrue(!isQemuEmulation(), "Skipping performance test under QEMU emulation");

        Random random = new Random(7L);
        List<String> dictionary = dictionary(random);
        String text = text(random, dictionary);

        try (Automaton<Character, Void> acm = AhoCorasick.forTextIgnoreCase()) {
            for (String word : dictionary) {
                acm.register(AhoCorasick.symbols(word));
            }
            long scanned = acm.scan(AhoCorasick.symbols(text), o -> { });

            long cursorStart = System.nanoTime();
            long counted = 0;
            try (Cursor<Character, Void> cursor = acm.cursor()) {
                for (int i = 0; i < text.length(); i++) {
                    counted += cursor.advance(text.charAt(i));
                }
            }
            long cursorDuration = System.nanoTime() - cursorStart;

            assertThat(counted).isEqualTo(scanned);
            logger.info("Cursor pass over {} chars: {} ms, {} occurrences",
                text.length(), cursorDuration / 1_000_000.0, counted);
        }
    }

    @Test
    void testChurn_RegisterUnregisterThroughput() {
        assumeTrue(!isQemuEmulation(), "Skipping performance test under QEMU emulation");

        Random random = new Random(99L);
        List<String> dictionary = dictionary(random);

        try (Automaton<Character, Void> acm = AhoCorasick.forText()) {
            long start = System.nanoTime();
            for (int round = 0; round < 10; round++) {
                for (String word : dictionary) {
                    acm.register(AhoCorasick.symbols(word));
                }
                for (String word : dictionary) {
                    acm.unregister(AhoCorasick.symbols(word));
                }
            }
            long duration = System.nanoTime() - start;

            assertThat(acm.keywordCount()).isZero();
            assertThat(acm.statistics().stateCount()).isEqualTo(1);
            logger.info("10 rounds of {} registrations + removals: {} ms, peak states: {}",
                dictionary.size(), duration / 1_000_000.0, acm.statistics().peakStateCount());
        }
    }

    private static List<String> dictionary(Random random) {
        Set<String> words = new LinkedHashSet<>();
        while (words.size() < DICTIONARY_SIZE) {
            int length = 2 + random.nextInt(8);
            StringBuilder sb = new StringBuilder(length);
            for (int i = 0; i < length; i++) {
                sb.append((char) ('a' + random.nextInt(26)));
            }
            words.add(sb.toString());
        }
        return new ArrayList<>(words);
    }

    private static String text(Random random, List<String> dictionary) {
        StringBuilder sb = new StringBuilder(TEXT_WORDS * 7);
        for (int i = 0; i < TEXT_WORDS; i++) {
            sb.append(' ');
            if (random.nextInt(4) == 0) {
                // Filler that rarely matches
                sb.append("zq").append(random.nextInt(1000));
            } else {
                sb.append(dictionary.get(random.nextInt(dictionary.size())));
            }
        }
        return sb.toString();
    }

    private static long naiveCount(List<String> dictionary, String text) {
        long count = 0;
        for (String word : dictionary) {
            String keyword = " " + word;
            int from = text.indexOf(keyword);
            while (from >= 0) {
                count++;
                from = text.indexOf(keyword, from + 1);
            }
        }
        return count;
    }
}
