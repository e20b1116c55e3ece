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

import com.axonops.libacm.api.SymbolPolicy;

/**
 * Computes fail links and output counts for every state (Aho-Corasick, Algorithm 3).
 *
 * <p>Breadth-first over the trie, so the fail target of every state is final before any deeper
 * state consults it. The alphabet cannot be enumerated, so the root gets no explicit self-loops;
 * {@link MatchEngine#follow} stands in for them.
 *
 * <p>Each build replaces all previous fail and output values, so it can run after any mix of
 * insertions and removals.
 */
final class FailureFunctionBuilder {

  private FailureFunctionBuilder() {
    // Utility class
  }

  static <S, V> void rebuild(StateArena<S, V> arena, SymbolPolicy<S> policy) {
    arena.forEachLive(
        id -> {
          State<S, V> state = arena.get(id);
          state.outputCount = state.terminal ? 1 : 0;
        });

    State<S, V> root = arena.root();
    root.fail = StateArena.NONE;

    int[] queue = new int[arena.liveCount()];
    int tail = 0;
    for (int i = 0; i < root.transitions.size(); i++) {
      int child = root.transitions.targetAt(i);
      arena.get(child).fail = StateArena.ROOT;
      queue[tail++] = child;
    }

    int head = 0;
    while (head < tail) {
      State<S, V> r = arena.get(queue[head++]);
      Transitions<S> edges = r.transitions;
      for (int i = 0; i < edges.size(); i++) {
        int child = edges.targetAt(i);
        State<S, V> s = arena.get(child);
        s.fail = MatchEngine.follow(arena, policy, r.fail, edges.symbolAt(i));
        s.outputCount += arena.get(s.fail).outputCount;
        queue[tail++] = child;
      }
    }
  }

  /**
   * Checks the invariants a completed build must satisfy.
   *
   * <ul>
   *   <li>the root has no fail link, is not terminal and has no output
   *   <li>every other state fails to a live, strictly shallower state, so every chain ends at the
   *       root
   *   <li>output count = (terminal ? 1 : 0) + output count of the fail target
   * </ul>
   *
   * @throws IllegalStateException describing the first violation found
   */
  static <S, V> void validate(StateArena<S, V> arena) {
    State<S, V> root = arena.root();
    if (root.fail != StateArena.NONE || root.terminal || root.outputCount != 0) {
      throw new IllegalStateException(
          "ACM: Invalid root state - fail: " + root.fail + ", terminal: " + root.terminal
              + ", outputCount: " + root.outputCount);
    }
    arena.forEachLive(
        id -> {
          if (id == StateArena.ROOT) {
            return;
          }
          State<S, V> state = arena.get(id);
          State<S, V> target = state.fail == StateArena.NONE ? null : arena.get(state.fail);
          if (target == null) {
            throw new IllegalStateException("ACM: State " + id + " has no live fail target");
          }
          if (target.depth >= state.depth) {
            throw new IllegalStateException(
                "ACM: State " + id + " (depth " + state.depth + ") fails to state " + state.fail
                    + " (depth " + target.depth + ")");
          }
          int expected = (state.terminal ? 1 : 0) + target.outputCount;
          if (state.outputCount != expected) {
            throw new IllegalStateException(
                "ACM: State " + id + " has outputCount " + state.outputCount + ", expected "
                    + expected);
          }
        });
  }
}
