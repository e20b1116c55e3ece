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

package com.axonops.libacm.config;

import com.axonops.libacm.metrics.ACMMetricsRegistry;
import com.axonops.libacm.metrics.NoOpMetricsRegistry;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for an {@link com.axonops.libacm.api.Automaton}: resource limits, post-build
 * verification and metrics integration.
 *
 * <p>Immutable configuration using Java 17 records.
 *
 * <h2>Resource Limits</h2>
 *
 * <ul>
 *   <li><b>maxStates</b> - Maximum LIVE states, root included (not cumulative). A registration that
 *       would need more states fails with {@link com.axonops.libacm.api.ResourceException} and
 *       leaves the automaton unchanged. Unregistering prunes states and gives budget back.
 *   <li><b>maxKeywordLength</b> - Longest keyword accepted, in symbols. Bounds the depth of the
 *       trie and the size of each keyword copy handed to callers.
 * </ul>
 *
 * <h2>Verification</h2>
 *
 * <p>{@code validateAfterRebuild} re-checks every fail link and output count after each rebuild.
 * The check is linear in the number of states. Useful in tests and while developing a custom
 * {@link com.axonops.libacm.api.SymbolPolicy}; leave it off in production.
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Defaults (10M states, 64K symbols per keyword, no verification, metrics disabled)
 * Automaton<Character, String> acm = Automaton.create(SymbolPolicy.natural(), ACMConfig.DEFAULT);
 *
 * // Small budget, metrics enabled
 * ACMConfig config = ACMConfig.builder()
 *     .maxStates(100_000)
 *     .maxKeywordLength(256)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.acm"))
 *     .build();
 * }</pre>
 *
 * @param maxStates maximum simultaneously live states, root included (must be > 0)
 * @param maxKeywordLength maximum keyword length in symbols (must be > 0)
 * @param validateAfterRebuild verify fail links and output counts after every rebuild
 * @param metricsRegistry metrics implementation (use {@link NoOpMetricsRegistry} for zero
 *     overhead)
 * @since 1.0.0
 * @see com.axonops.libacm.metrics.MetricNames
 */
public record ACMConfig(
    int maxStates,
    int maxKeywordLength,
    boolean validateAfterRebuild,
    ACMMetricsRegistry metricsRegistry) {

  private static final Logger logger = LoggerFactory.getLogger(ACMConfig.class);

  /** Default maximum live states. */
  public static final int DEFAULT_MAX_STATES = 10_000_000;

  /** Default maximum keyword length. */
  public static final int DEFAULT_MAX_KEYWORD_LENGTH = 65_536;

  /**
   * Default configuration for production use.
   *
   * <p>10M live states, keywords up to 64K symbols, no post-build verification, metrics disabled
   * (NoOp - zero overhead).
   */
  public static final ACMConfig DEFAULT =
      new ACMConfig(
          DEFAULT_MAX_STATES,
          DEFAULT_MAX_KEYWORD_LENGTH,
          false, // No verification
          NoOpMetricsRegistry.INSTANCE // Metrics disabled (zero overhead)
          );

  /** Compact constructor with validation. */
  public ACMConfig {
    if (maxStates <= 0) {
      throw new IllegalArgumentException(
          "maxStates must be positive (the root state always counts against the limit)");
    }
    if (maxKeywordLength <= 0) {
      throw new IllegalArgumentException("maxKeywordLength must be positive");
    }
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");

    // Still valid, the state limit simply bites first
    if (maxKeywordLength >= maxStates) {
      logger.warn(
          "ACM: maxKeywordLength ({}) is not below maxStates ({}) - the longest keywords can never"
              + " be registered",
          maxKeywordLength,
          maxStates);
    }
  }

  /**
   * Creates a builder starting from {@link #DEFAULT}.
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for custom configuration. All fields start with the values of {@link #DEFAULT}. */
  public static class Builder {
    private int maxStates = DEFAULT_MAX_STATES;
    private int maxKeywordLength = DEFAULT_MAX_KEYWORD_LENGTH;
    private boolean validateAfterRebuild = false;
    private ACMMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Set maximum simultaneously live states.
     *
     * <p><b>Default: 10,000,000</b>
     *
     * <p>Each registration needs at most one state per symbol; shared prefixes need fewer. Monitor
     * {@code automaton.states.current.count} to tune.
     *
     * @param max maximum live states, root included (must be > 0)
     * @return this builder
     */
    public Builder maxStates(int max) {
      this.maxStates = max;
      return this;
    }

    /**
     * Set maximum keyword length in symbols.
     *
     * <p><b>Default: 65,536</b>
     *
     * @param max maximum keyword length (must be > 0)
     * @return this builder
     */
    public Builder maxKeywordLength(int max) {
      this.maxKeywordLength = max;
      return this;
    }

    /**
     * Enable verification of fail links and output counts after every rebuild.
     *
     * @param enabled true to verify, false to skip (default)
     * @return this builder
     */
    public Builder validateAfterRebuild(boolean enabled) {
      this.validateAfterRebuild = enabled;
      return this;
    }

    /**
     * Set metrics registry for instrumentation.
     *
     * <p><b>Default: NoOpMetricsRegistry</b> (zero overhead)
     *
     * <pre>{@code
     * MetricRegistry registry = new MetricRegistry();
     * ACMConfig config = ACMConfig.builder()
     *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.acm"))
     *     .build();
     * }</pre>
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(ACMMetricsRegistry metricsRegistry) {
      this.metricsRegistry = Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Build configuration with validation.
     *
     * @return validated configuration
     * @throws IllegalArgumentException if configuration is invalid
     */
    public ACMConfig build() {
      return new ACMConfig(maxStates, maxKeywordLength, validateAfterRebuild, metricsRegistry);
    }
  }
}
