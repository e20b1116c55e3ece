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

import java.util.List;
import java.util.Objects;

/**
 * A registered keyword reported by a match or a lookup.
 *
 * <p>Immutable snapshot: later changes to the automaton do not affect it.
 *
 * @param keyword the keyword's stored symbols, unmodifiable
 * @param rank insertion rank, unique for the automaton's lifetime and never reused
 * @param value value attached at registration, possibly null
 * @param <S> symbol type
 * @param <V> value type
 * @since 1.0.0
 */
public record Match<S, V>(List<S> keyword, long rank, V value) {

  public Match {
    Objects.requireNonNull(keyword, "keyword cannot be null");
  }

  /** Keyword length in symbols. */
  public int length() {
    return keyword.size();
  }
}
