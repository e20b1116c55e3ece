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

/**
 * Metric name constants for automaton instrumentation.
 *
 * <p>Names are relative; {@link DropwizardMetricsAdapter} prepends its prefix.
 *
 * <h2>Lifecycle</h2>
 *
 * <p>An automaton is mutated by registering and unregistering keywords. Each mutation marks the
 * fail links stale; the next scan or {@code prepare()} rebuilds them exactly once, no matter how
 * many threads are waiting. The rebuild counter therefore tracks mutation BATCHES, not mutations.
 * A rebuild count close to the registration count means callers interleave mutations with scans,
 * which makes every scan pay for a full rebuild.
 *
 * <h2>Naming</h2>
 *
 * <ul>
 *   <li>{@code *.total.count} - monotonic counters
 *   <li>{@code *.current.count} / {@code *.peak.count} - gauges, read on demand
 *   <li>{@code *.latency} - timers in nanoseconds
 * </ul>
 *
 * @since 1.0.0
 */
public final class MetricNames {

  private MetricNames() {
    // Constants only
  }

  // ========== Keyword Metrics ==========

  /** Keywords successfully registered. Duplicates are not counted here. */
  public static final String KEYWORDS_REGISTERED = "keywords.registered.total.count";

  /** Registrations refused because the keyword was already registered. */
  public static final String KEYWORDS_DUPLICATE = "keywords.duplicate.total.count";

  /** Keywords successfully unregistered. */
  public static final String KEYWORDS_UNREGISTERED = "keywords.unregistered.total.count";

  /** Gauge: keywords currently registered. */
  public static final String KEYWORDS_CURRENT = "automaton.keywords.current.count";

  // ========== Automaton Metrics ==========

  /** Fail-link rebuilds performed. */
  public static final String AUTOMATON_REBUILDS = "automaton.rebuilds.total.count";

  /** Timer: fail-link rebuild duration. */
  public static final String AUTOMATON_REBUILD_LATENCY = "automaton.rebuild.latency";

  /** Gauge: live states, root included. */
  public static final String STATES_CURRENT = "automaton.states.current.count";

  /** Gauge: most states ever live at once. */
  public static final String STATES_PEAK = "automaton.states.peak.count";

  // ========== Matching Metrics ==========

  /** Whole-sequence scans ({@code scan}, {@code findAll}, {@code findFirst}, {@code containsAny}). */
  public static final String MATCHING_SCANS = "matching.scans.total.count";

  /** Occurrences reported by whole-sequence scans. Cursor matches are not counted. */
  public static final String MATCHING_MATCHES = "matching.matches.total.count";

  /** Timer: whole-sequence scan duration. */
  public static final String MATCHING_SCAN_LATENCY = "matching.scan.latency";

  // ========== Cursor Metrics ==========

  /** Cursors created. */
  public static final String CURSORS_CREATED = "cursors.created.total.count";

  /** Gauge: cursors created and not yet closed. */
  public static final String CURSORS_ACTIVE = "cursors.active.current.count";

  // ========== Error Metrics ==========

  /** Registrations refused by the state or keyword-length limit. */
  public static final String ERRORS_RESOURCE_EXHAUSTED = "errors.resource.exhausted.total.count";
}
