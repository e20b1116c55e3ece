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

package com.axonops.libacm.util;

import java.util.List;

/**
 * Utility for hashing keywords for logging purposes.
 *
 * <p>Keywords may hold sensitive terms and can be long, so logs carry a short hash instead. The
 * same keyword always gets the same hash, so a registration can be traced through the log by
 * grepping for it.
 *
 * <p>Example: keyword {@code [h, e, r, s]} → hash "30cb2e" with length suffix "30cb2e[4]"
 *
 * @since 1.0.0
 */
public final class KeywordHasher {

    private KeywordHasher() {
        // Utility class
    }

    /**
     * Creates a compact hex hash of a keyword for logging.
     *
     * <p>Uses {@link List#hashCode()}, so the result depends on the symbols' own hash codes.
     *
     * @param keyword the keyword's symbols
     * @return hex string (e.g., "7a3f2b1c")
     */
    public static String hash(List<?> keyword) {
        if (keyword == null) {
            return "null";
        }
        return Integer.toHexString(keyword.hashCode());
    }

    /**
     * Creates a hash with the keyword's length appended.
     *
     * @param keyword the keyword's symbols
     * @return hash with length (e.g., "7a3f2b1c[4]")
     */
    public static String hashWithLength(List<?> keyword) {
        if (keyword == null) {
            return "null";
        }
        return hash(keyword) + "[" + keyword.size() + "]";
    }
}
