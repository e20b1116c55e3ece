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

package com.axonops.libacm.trie;

/**
 * Accounting hook for state allocation.
 *
 * <p>{@link KeywordTrie} reserves before it allocates anything, so a vetoed insertion leaves the
 * trie untouched.
 *
 * @since 1.0.0
 */
public interface StateBudget {

  /** Budget that never refuses. */
  StateBudget UNLIMITED =
      new StateBudget() {
        @Override
        public void reserve(int states) {}

        @Override
        public void release(int states) {}
      };

  /**
   * Called before {@code states} new states are allocated.
   *
   * @param states number of states about to be allocated (always positive)
   * @throws RuntimeException to refuse the allocation
   */
  void reserve(int states);

  /**
   * Called after {@code states} states were freed.
   *
   * @param states number of states freed (always positive)
   */
  void release(int states);
}
