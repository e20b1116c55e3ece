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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only walks over a built automaton: the goto function with failure fallback, and output
 * enumeration along the fail chain.
 *
 * <p>None of these methods mutate state, so any number of threads may call them concurrently once
 * the fail links are up to date.
 */
final class MatchEngine {

  private MatchEngine() {
    // Utility class
  }

  /**
   * Goto with failure fallback.
   *
   * <p>Follows fail links until some state has a transition on {@code symbol}. The root has an
   * implicit self-loop on every symbol it has no edge for, so the walk ends there at the latest.
   * Only fail links of states strictly shallower than a state being built are read, which is what
   * lets the failure builder call this mid-construction.
   */
  static <S, V> int follow(StateArena<S, V> arena, SymbolPolicy<S> policy, int from, S symbol) {
    int current = from;
    while (true) {
      State<S, V> state = arena.get(current);
      int next = state.transitions.find(symbol, policy);
      if (next != StateArena.NONE) {
        return next;
      }
      if (current == StateArena.ROOT) {
        return StateArena.ROOT;
      }
      current = state.fail;
    }
  }

  /**
   * Finds the {@code index}-th terminal state on the fail chain starting at {@code from} itself.
   * Index 0 is the deepest, i.e. the longest keyword ending at this position.
   *
   * <p>Callers guarantee {@code 0 <= index < outputCount(from)}.
   */
  static <S, V> int terminalAt(StateArena<S, V> arena, int from, int index) {
    int current = from;
    for (int i = 0; ; i++) {
      State<S, V> state = arena.get(current);
      while (!state.terminal) {
        if (current == StateArena.ROOT) {
          throw new IllegalStateException(
              "ACM: Fail chain from state " + from + " holds fewer than " + (index + 1)
                  + " terminal states");
        }
        current = state.fail;
        state = arena.get(current);
      }
      if (i == index) {
        return current;
      }
      current = state.fail;
    }
  }

  /** Rebuilds the keyword spelled by the path from the root to {@code id}. */
  static <S, V> List<S> keywordOf(StateArena<S, V> arena, int id) {
    State<S, V> state = arena.get(id);
    List<S> symbols = new ArrayList<>(Collections.<S>nCopies(state.depth, null));
    for (int i = symbols.size() - 1; i >= 0; i--) {
      symbols.set(i, state.symbol);
      state = arena.get(state.parent);
    }
    return Collections.unmodifiableList(symbols);
  }
}
