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

import java.util.function.Consumer;

/**
 * One trie node, stored in a {@link StateArena} slot.
 *
 * <p>{@code parent} and {@code fail} are slot indices, never owning references. {@code symbol} is
 * the label of the edge from the parent; the parent's {@link Transitions} own it.
 */
final class State<S, V> {

  final int parent;
  final S symbol;
  final int depth;
  final Transitions<S> transitions = new Transitions<>();

  int fail = StateArena.NONE;
  int outputCount;

  boolean terminal;
  long rank;
  V value;
  Consumer<? super V> valueDestructor;

  State(int parent, S symbol, int depth) {
    this.parent = parent;
    this.symbol = symbol;
    this.depth = depth;
  }

  /** Releases the attached value through its destructor, if both are present. */
  void releaseValue() {
    V released = value;
    Consumer<? super V> destructor = valueDestructor;
    value = null;
    valueDestructor = null;
    if (released != null && destructor != null) {
      destructor.accept(released);
    }
  }
}
