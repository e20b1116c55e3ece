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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Slot storage for trie states, addressed by integer handle.
 *
 * <p>Slot {@link #ROOT} always holds the root. Freed slots go on a free list and are handed out
 * again by later allocations, so a handle is only meaningful until the next structural change.
 *
 * <p>NOT thread-safe. Mutation is serialized by the owning automaton.
 */
final class StateArena<S, V> {

  static final int ROOT = 0;
  static final int NONE = -1;

  private static final int INITIAL_CAPACITY = 16;

  private List<State<S, V>> slots;
  private int[] freeSlots = new int[INITIAL_CAPACITY];
  private int freeCount;
  private int nextUnused;
  private int liveCount;
  private int peakLiveCount;

  StateArena() {
    this.slots = new ArrayList<>(INITIAL_CAPACITY);
    allocateRoot();
  }

  /**
   * Allocates a child of {@code parent} reached on {@code symbol} and links it into the parent's
   * transitions.
   *
   * @return the new slot
   */
  int allocate(int parent, S symbol) {
    State<S, V> parentState = get(parent);
    int id = takeSlot();
    slots.set(id, new State<>(parent, symbol, parentState.depth + 1));
    parentState.transitions.add(symbol, id);
    return id;
  }

  /** Empties slot {@code id}. The caller has already unlinked it from its parent. */
  void free(int id) {
    if (id == ROOT) {
      throw new IllegalArgumentException("ACM: The root state cannot be freed");
    }
    slots.set(id, null);
    if (freeCount == freeSlots.length) {
      freeSlots = Arrays.copyOf(freeSlots, freeCount << 1);
    }
    freeSlots[freeCount++] = id;
    liveCount--;
  }

  State<S, V> get(int id) {
    return slots.get(id);
  }

  State<S, V> root() {
    return slots.get(ROOT);
  }

  int liveCount() {
    return liveCount;
  }

  int peakLiveCount() {
    return peakLiveCount;
  }

  /** Visits every live slot, root first. Order of the others is slot order. */
  void forEachLive(IntConsumer visitor) {
    for (int id = 0; id < nextUnused; id++) {
      if (slots.get(id) != null) {
        visitor.accept(id);
      }
    }
  }

  /**
   * Drops every state and starts over with a fresh root.
   *
   * @return the number of live states dropped, root included
   */
  int clear() {
    int dropped = liveCount;
    slots = new ArrayList<>(INITIAL_CAPACITY);
    freeSlots = new int[INITIAL_CAPACITY];
    freeCount = 0;
    nextUnused = 0;
    liveCount = 0;
    allocateRoot();
    return dropped;
  }

  private void allocateRoot() {
    int id = takeSlot();
    slots.set(id, new State<>(NONE, null, 0));
  }

  private int takeSlot() {
    int id;
    if (freeCount > 0) {
      id = freeSlots[--freeCount];
    } else {
      id = nextUnused++;
      slots.add(null);
    }
    liveCount++;
    if (liveCount > peakLiveCount) {
      peakLiveCount = liveCount;
    }
    return id;
  }
}
