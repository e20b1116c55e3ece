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

import java.util.List;

/**
 * Receives each registered keyword during {@link KeywordTrie#forEachKeyword}.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface KeywordVisitor<S, V> {

  /**
   * @param keyword immutable copy of the keyword's symbols
   * @param rank insertion rank
   * @param value associated value, possibly null
   */
  void visit(List<S> keyword, long rank, V value);
}
