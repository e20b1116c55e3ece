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
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * The goto store: a trie of keyword prefixes with incremental insertion and pruning removal, plus
 * the fail links built over it.
 *
 * <p>State handles returned by {@link #follow} and {@link #terminalAt} are arena slots. They stay
 * valid until the next {@link #insert}, {@link #remove} or {@link #release}; slots freed by a
 * removal are reused.
 *
 * <p>NOT thread-safe. Public for {@code com.axonops.libacm.api.Automaton}, which owns the locking
 * and the lazy-rebuild protocol; not part of the public API.
 *
 * @since 1.0.0
 */
public final class KeywordTrie<S, V> {

  /** Handle of the root state. */
  public static final int ROOT = StateArena.ROOT;

  /** Returned by lookups that find nothing. */
  public static final int NONE = StateArena.NONE;

  private final SymbolPolicy<S> policy;
  private final StateBudget budget;
  private final StateArena<S, V> arena;

  private long nextRank;
  private int keywordCount;

  public KeywordTrie(SymbolPolicy<S> policy, StateBudget budget) {
    this.policy = Objects.requireNonNull(policy, "policy cannot be null");
    this.budget = Objects.requireNonNull(budget, "budget cannot be null");
    budget.reserve(1);
    this.arena = new StateArena<>();
  }

  /**
   * Registers {@code keyword}.
   *
   * <p>Follows existing transitions as far as they match, then appends one new state per remaining
   * symbol, storing a policy copy of each symbol. If the final state is already terminal nothing
   * changes: rank and value stay as they were and {@code value} is not adopted.
   *
   * @return true if inserted, false if already registered or empty
   * @throws RuntimeException whatever the {@link StateBudget} throws; the trie is then unchanged
   */
  public boolean insert(List<? extends S> keyword, V value, Consumer<? super V> destructor) {
    if (keyword.isEmpty()) {
      return false;
    }
    int state = ROOT;
    int matched = 0;
    Iterator<? extends S> symbols = keyword.iterator();
    S pending = null;
    while (symbols.hasNext()) {
      S symbol = symbols.next();
      int next = arena.get(state).transitions.find(symbol, policy);
      if (next == NONE) {
        pending = symbol;
        break;
      }
      state = next;
      matched++;
    }

    int missing = keyword.size() - matched;
    if (missing == 0) {
      if (arena.get(state).terminal) {
        return false;
      }
    } else {
      budget.reserve(missing);
      state = arena.allocate(state, policy.copy(pending));
      while (symbols.hasNext()) {
        state = arena.allocate(state, policy.copy(symbols.next()));
      }
    }

    State<S, V> last = arena.get(state);
    last.releaseValue();
    last.value = value;
    last.valueDestructor = destructor;
    last.terminal = true;
    last.rank = nextRank++;
    keywordCount++;
    return true;
  }

  /**
   * Unregisters {@code keyword}.
   *
   * <p>The terminal marking and value go first. A state that still has children stays, since other
   * keywords pass through it. Otherwise it is deleted, and deletion climbs towards the root while
   * the parent is neither the root, terminal, nor left with other children. Ranks are never handed
   * out again.
   *
   * @return true if the keyword was registered
   */
  public boolean remove(List<? extends S> keyword) {
    int state = find(keyword);
    if (state == NONE) {
      return false;
    }
    State<S, V> last = arena.get(state);
    last.terminal = false;
    last.releaseValue();
    keywordCount--;
    if (!last.transitions.isEmpty()) {
      return true;
    }

    int freed = 0;
    int current = state;
    while (true) {
      int parent = arena.get(current).parent;
      State<S, V> parentState = arena.get(parent);
      policy.destroy(parentState.transitions.removeTarget(current));
      arena.free(current);
      freed++;
      if (parent == ROOT || parentState.terminal || !parentState.transitions.isEmpty()) {
        break;
      }
      current = parent;
    }
    budget.release(freed);
    return true;
  }

  /**
   * Exact lookup, no mutation.
   *
   * @return the terminal state for {@code keyword}, or {@link #NONE} if it is not registered
   */
  public int find(List<? extends S> keyword) {
    if (keyword.isEmpty()) {
      return NONE;
    }
    int state = ROOT;
    for (S symbol : keyword) {
      state = arena.get(state).transitions.find(symbol, policy);
      if (state == NONE) {
        return NONE;
      }
    }
    return arena.get(state).terminal ? state : NONE;
  }

  /** Depth-first walk calling {@code visitor} once per registered keyword, order unspecified. */
  public void forEachKeyword(KeywordVisitor<S, V> visitor) {
    int[] stack = new int[16];
    int top = 0;
    stack[top++] = ROOT;
    while (top > 0) {
      int id = stack[--top];
      State<S, V> state = arena.get(id);
      if (state.terminal) {
        visitor.visit(MatchEngine.keywordOf(arena, id), state.rank, state.value);
      }
      Transitions<S> edges = state.transitions;
      if (top + edges.size() > stack.length) {
        stack = Arrays.copyOf(stack, Math.max(stack.length << 1, top + edges.size()));
      }
      for (int i = edges.size() - 1; i >= 0; i--) {
        stack[top++] = edges.targetAt(i);
      }
    }
  }

  /** Recomputes every fail link and output count from scratch. */
  public void rebuildFailureFunction() {
    FailureFunctionBuilder.rebuild(arena, policy);
  }

  /**
   * Verifies fail-link and output-count invariants of the last build.
   *
   * @throws IllegalStateException on the first violation
   */
  public void validate() {
    FailureFunctionBuilder.validate(arena);
  }

  /** Goto with failure fallback. Requires an up-to-date build. */
  public int follow(int state, S symbol) {
    return MatchEngine.follow(arena, policy, state, symbol);
  }

  /** Number of keywords ending at {@code state}: itself plus its fail chain. */
  public int outputCount(int state) {
    return arena.get(state).outputCount;
  }

  /** The {@code index}-th terminal state on the fail chain of {@code state}, longest first. */
  public int terminalAt(int state, int index) {
    return MatchEngine.terminalAt(arena, state, index);
  }

  public List<S> keywordOf(int state) {
    return MatchEngine.keywordOf(arena, state);
  }

  public long rankOf(int state) {
    return arena.get(state).rank;
  }

  public V valueOf(int state) {
    return arena.get(state).value;
  }

  public int depthOf(int state) {
    return arena.get(state).depth;
  }

  public int keywordCount() {
    return keywordCount;
  }

  /** Rank the next registration will receive. */
  public long nextRank() {
    return nextRank;
  }

  /** Live states, root included. */
  public int stateCount() {
    return arena.liveCount();
  }

  public int peakStateCount() {
    return arena.peakLiveCount();
  }

  /**
   * Destroys every stored symbol and releases every attached value, leaving an empty trie.
   *
   * @return number of states dropped, root included
   */
  public int release() {
    arena.forEachLive(
        id -> {
          State<S, V> state = arena.get(id);
          Transitions<S> edges = state.transitions;
          for (int i = 0; i < edges.size(); i++) {
            policy.destroy(edges.symbolAt(i));
          }
          edges.clear();
          state.releaseValue();
        });
    int dropped = arena.clear();
    keywordCount = 0;
    budget.release(dropped);
    return dropped;
  }
}
