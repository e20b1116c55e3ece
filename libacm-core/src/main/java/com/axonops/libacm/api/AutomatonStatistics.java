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

package com.axonops.libacm.api;

/**
 * Automaton statistics for monitoring and metrics.
 *
 * <p>Immutable snapshot of automaton state at a point in time.
 *
 * @since 1.0.0
 */
public record AutomatonStatistics(
    int keywordCount,
    int stateCount,
    int peakStateCount,
    long nextRank,
    long rebuildCount,
    long lastRebuildNanos,
    int activeCursors,
    boolean rebuildPending) {

  /** Ranks handed out to keywords that have since been unregistered. */
  public long retiredRanks() {
    return nextRank - keywordCount;
  }

  /**
   * States per registered keyword, root excluded.
   *
   * @return average, or 0.0 with no keywords
   */
  public double statesPerKeyword() {
    return keywordCount == 0 ? 0.0 : (double) (stateCount - 1) / keywordCount;
  }
}
