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

import com.axonops.libacm.config.ACMConfig;

import java.util.AbstractList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;

/**
 * Convenience entry point for matching over text.
 *
 * Text automata use {@link Character} symbols, i.e. UTF-16 code units; a keyword containing a
 * surrogate pair matches the same pair in the input.
 *
 * Example:
 * <pre>
 * List&lt;Occurrence&lt;Character, String&gt;&gt; hits =
 *     AhoCorasick.findAll(List.of("he", "she", "his", "hers"), "ushers");
 * </pre>
 *
 * @since 1.0.0
 */
public final class AhoCorasick {

    private AhoCorasick() {
        // Utility class
    }

    /**
     * Case-sensitive text automaton with default configuration.
     */
    public static <V> Automaton<Character, V> forText() {
        return forText(ACMConfig.DEFAULT);
    }

    /**
     * Case-sensitive text automaton.
     */
    public static <V> Automaton<Character, V> forText(ACMConfig config) {
        return Automaton.create(SymbolPolicy.natural(), config);
    }

    /**
     * Case-insensitive text automaton with default configuration.
     */
    public static <V> Automaton<Character, V> forTextIgnoreCase() {
        return forTextIgnoreCase(ACMConfig.DEFAULT);
    }

    /**
     * Case-insensitive text automaton.
     */
    public static <V> Automaton<Character, V> forTextIgnoreCase(ACMConfig config) {
        return Automaton.create(SymbolPolicy.caseInsensitive(), config);
    }

    /**
     * Read-only view of {@code text} as symbols. Does not copy; the view tracks {@code text}.
     */
    public static List<Character> symbols(CharSequence text) {
        Objects.requireNonNull(text, "text cannot be null");
        return new CharSequenceList(text);
    }

    /**
     * Joins symbols back into a string, e.g. to print {@link Match#keyword()}.
     */
    public static String text(List<Character> symbols) {
        Objects.requireNonNull(symbols, "symbols cannot be null");
        StringBuilder sb = new StringBuilder(symbols.size());
        for (Character c : symbols) {
            sb.append(c.charValue());
        }
        return sb.toString();
    }

    /**
     * One-shot search. Each occurrence's value is the keyword string it matched.
     *
     * @param keywords keywords to look for; empty strings and duplicates are ignored
     * @param text text to scan
     * @return every occurrence, by end position, longest first per position
     */
    public static List<Occurrence<Character, String>> findAll(Collection<String> keywords, CharSequence text) {
        Objects.requireNonNull(keywords, "keywords cannot be null");
        Objects.requireNonNull(text, "text cannot be null");
        try (Automaton<Character, String> automaton = forText()) {
            for (String keyword : keywords) {
                automaton.register(symbols(keyword), keyword);
            }
            return automaton.findAll(symbols(text));
        }
    }

    private static final class CharSequenceList extends AbstractList<Character> implements RandomAccess {
        private final CharSequence text;

        CharSequenceList(CharSequence text) {
            this.text = text;
        }

        @Override
        public Character get(int index) {
            return text.charAt(index);
        }

        @Override
        public int size() {
            return text.length();
        }
    }
}
