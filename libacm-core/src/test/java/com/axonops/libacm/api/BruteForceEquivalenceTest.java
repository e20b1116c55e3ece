package com.axonops.libacm.api;

import static com.axonops.libacm.test.TestUtils.bruteForce;
import static com.axonops.libacm.test.TestUtils.describe;
import static com.axonops.libacm.test.TestUtils.kw;
import static com.axonops.libacm.test.TestUtils.randomText;
import static com.axonops.libacm.test.TestUtils.testConfig;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Compares the automaton against a quadratic reference search over random keyword sets and texts
 * on small alphabets, where overlaps and shared suffixes are frequent.
 */
class BruteForceEquivalenceTest {

  @ParameterizedTest
  @ValueSource(longs = {1, 2, 3, 42, 1234, 98765})
  void randomKeywords_SameOccurrencesAsReference(long seed) {
    Random random = new Random(seed);
    Set<String> keywords = new LinkedHashSet<>();

    try (Automaton<Character, Void> acm = AhoCorasick.forText(testConfig())) {
      for (int i = 0; i < 40; i++) {
        String k = randomText(random, 1 + random.nextInt(5), 3);
        assertThat(acm.register(kw(k))).isEqualTo(keywords.add(k));
      }

      String text = randomText(random, 300, 3);
      assertThat(describe(acm.findAll(kw(text)))).isEqualTo(bruteForce(keywords, text));
    }
  }

  @ParameterizedTest
  @ValueSource(longs = {7, 11, 13, 2024})
  void interleavedRegisterAndUnregister_StaysEquivalent(long seed) {
    Random random = new Random(seed);
    Set<String> keywords = new LinkedHashSet<>();

    try (Automaton<Character, Void> acm = AhoCorasick.forText(testConfig())) {
      for (int round = 0; round < 20; round++) {
        for (int i = 0; i < 5; i++) {
          String k = randomText(random, 1 + random.nextInt(4), 3);
          assertThat(acm.register(kw(k))).isEqualTo(keywords.add(k));
        }
        List<String> current = new ArrayList<>(keywords);
        for (int i = 0; i < 2 && !current.isEmpty(); i++) {
          String victim = current.remove(random.nextInt(current.size()));
          assertThat(acm.unregister(kw(victim))).isTrue();
          keywords.remove(victim);
        }

        String text = randomText(random, 80, 3);
        assertThat(describe(acm.findAll(kw(text))))
            .as("round %d", round)
            .isEqualTo(bruteForce(keywords, text));
        assertThat(acm.keywordCount()).isEqualTo(keywords.size());
      }
      assertThat(acm.statistics().rebuildCount()).isEqualTo(20);
    }
  }

  @ParameterizedTest
  @ValueSource(longs = {5, 17})
  void unregisterEverything_ReturnsToSingleRoot(long seed) {
    Random random = new Random(seed);
    Set<String> keywords = new LinkedHashSet<>();

    try (Automaton<Character, Void> acm = AhoCorasick.forText(testConfig())) {
      for (int i = 0; i < 100; i++) {
        String k = randomText(random, 1 + random.nextInt(8), 4);
        acm.register(kw(k));
        keywords.add(k);
      }
      for (String k : keywords) {
        assertThat(acm.unregister(kw(k))).isTrue();
      }

      assertThat(acm.statistics().stateCount()).isEqualTo(1);
      assertThat(acm.getResourceTracker().getActiveStateCount()).isEqualTo(1);
      assertThat(acm.getResourceTracker().getStatistics().isStateAccountingConsistent()).isTrue();
    }
  }
}
