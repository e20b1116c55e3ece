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

import java.util.Objects;

/**
 * A keyword occurrence in a scanned sequence.
 *
 * <p>Positions count symbols from the start of the scan. {@code end} is exclusive, so the keyword
 * occupies {@code [start, end)} and {@code end - start == match.length()}.
 *
 * @param start position of the keyword's first symbol
 * @param end position just past the keyword's last symbol
 * @param match the keyword found
 * @param <S> symbol type
 * @param <V> value type
 * @since 1.0.0
 */
public record Occurrence<S, V>(long start, long end, Match<S, V> match) {

  public Occurrence {
    Objects.requireNonNull(match, "match cannot be null");
    if (start < 0 || end - start != match.length()) {
      throw new IllegalArgumentException(
          "Occurrence [" + start + ", " + end + ") does not fit keyword of length "
              + match.length());
    }
  }
}
