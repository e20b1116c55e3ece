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
import java.util.Arrays;
import java.util.List;

/**
 * Outgoing goto edges of one state: an unordered list of (symbol, target slot) pairs.
 *
 * <p>The alphabet is opaque (only an equality test is available), so lookups are a linear scan
 * through the policy. Symbols held here are the automaton's own copies; whoever removes an edge is
 * responsible for destroying its symbol.
 */
final class Transitions<S> {

  private static final int[] NO_TARGETS = new int[0];

  // Most states have one or two edges; allocated on first add
  private List<S> symbols;
  private int[] targets = NO_TARGETS;

  int size() {
    return symbols == null ? 0 : symbols.size();
  }

  boolean isEmpty() {
    return size() == 0;
  }

  S symbolAt(int index) {
    return symbols.get(index);
  }

  int targetAt(int index) {
    return targets[index];
  }

  /**
   * Finds the target reached on {@code input}.
   *
   * @return the target slot, or {@link StateArena#NONE} if no stored symbol equals {@code input}
   */
  int find(S input, SymbolPolicy<S> policy) {
    int size = size();
    for (int i = 0; i < size; i++) {
      if (policy.equal(symbols.get(i), input)) {
        return targets[i];
      }
    }
    return StateArena.NONE;
  }

  void add(S symbol, int target) {
    if (symbols == null) {
      symbols = new ArrayList<>(2);
    }
    int size = symbols.size();
    if (size == targets.length) {
      targets = Arrays.copyOf(targets, size == 0 ? 2 : size << 1);
    }
    symbols.add(symbol);
    targets[size] = target;
  }

  /**
   * Removes the edge leading to {@code target}. Order is not preserved.
   *
   * @return the symbol that labelled the removed edge
   * @throws IllegalStateException if no edge leads to {@code target}
   */
  S removeTarget(int target) {
    int size = size();
    for (int i = 0; i < size; i++) {
      if (targets[i] == target) {
        int last = size - 1;
        S removed = symbols.get(i);
        symbols.set(i, symbols.get(last));
        symbols.remove(last);
        targets[i] = targets[last];
        if (last == 0) {
          clear();
        }
        return removed;
      }
    }
    throw new IllegalStateException("ACM: No transition leads to state " + target);
  }

  void clear() {
    symbols = null;
    targets = NO_TARGETS;
  }
}
