package com.axonops.libacm.api;

import static org.assertj.core.api.Assertions.*;

import com.axonops.libacm.config.ACMConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/**
 * Readers racing for the lazy rebuild, repeated over many mutation batches, plus a large
 * dictionary grown and shrunk back to the root.
 */
class RebuildRaceIT {

  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(16);
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    executor.shutdownNow();
    executor.awaitTermination(10, TimeUnit.SECONDS);
  }

  @Test
  @Timeout(value = 120, unit = TimeUnit.SECONDS)
  void testEveryBatchRebuiltExactlyOnce() throws Exception {
    int batches = 200;
    int readers = 16;

    try (Automaton<Character, Integer> acm =
        AhoCorasick.forText(ACMConfig.builder().validateAfterRebuild(true).build())) {
      for (int batch = 0; batch < batches; batch++) {
        for (int k = 0; k < 5; k++) {
          acm.register(AhoCorasick.symbols("b" + batch + "k" + k + ";"), batch);
        }
        String text = "b" + batch + "k0; b" + batch + "k4;";

        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> results = new ArrayList<>();
        for (int r = 0; r < readers; r++) {
          results.add(executor.submit(() -> {
            start.await();
            return acm.findAll(AhoCorasick.symbols(text)).size();
          }));
        }
        start.countDown();

        for (Future<Integer> result : results) {
          assertThat(result.get(30, TimeUnit.SECONDS)).isEqualTo(2);
        }
        assertThat(acm.statistics().rebuildCount()).isEqualTo(batch + 1L);
      }
      assertThat(acm.keywordCount()).isEqualTo(batches * 5);
    }
  }

  @Test
  @Timeout(value = 120, unit = TimeUnit.SECONDS)
  void testLargeDictionaryGrowAndShrink() throws Exception {
    int words = 100_000;

    try (Automaton<Character, Integer> acm = AhoCorasick.forText()) {
      for (int i = 0; i < words; i++) {
        acm.register(AhoCorasick.symbols("key-" + i + "|"), i);
      }
      assertThat(acm.keywordCount()).isEqualTo(words);

      AtomicInteger mismatches = new AtomicInteger();
      List<Future<?>> scans = new ArrayList<>();
      for (int t = 0; t < 8; t++) {
        int offset = t;
        scans.add(executor.submit(() -> {
          for (int i = offset; i < words; i += 997) {
            List<Occurrence<Character, Integer>> found =
                acm.findAll(AhoCorasick.symbols("..key-" + i + "|.."));
            if (found.size() != 1 || found.get(0).match().value() != i) {
              mismatches.incrementAndGet();
            }
          }
        }));
      }
      for (Future<?> scan : scans) {
        scan.get(60, TimeUnit.SECONDS);
      }
      assertThat(mismatches.get()).isZero();

      for (int i = 0; i < words; i++) {
        assertThat(acm.unregister(AhoCorasick.symbols("key-" + i + "|"))).isTrue();
      }
      assertThat(acm.statistics().stateCount()).isEqualTo(1);
      assertThat(acm.getResourceTracker().getStatistics().isStateAccountingConsistent()).isTrue();
    }
  }
}
