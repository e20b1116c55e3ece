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

import com.axonops.libacm.trie.KeywordTrie;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Incremental matching position within an {@link Automaton}.
 *
 * NOT Thread-Safe: Each Cursor must be confined to a single thread. The Automaton CAN be shared -
 * create one Cursor per thread.
 *
 * A cursor positioned past the root is invalidated by any later register or unregister: the
 * state it points at may have been freed and reused. Using it then fails with
 * {@link ContractViolationException}; call {@link #reset()} to start over.
 *
 * Example:
 * <pre>
 * try (Cursor&lt;Character, Void&gt; cursor = automaton.cursor()) {
 *     for (char c : text.toCharArray()) {
 *         int n = cursor.advance(c);
 *         for (int i = 0; i &lt; n; i++) {
 *             Match&lt;Character, Void&gt; match = cursor.getMatch(i);  // longest first
 *         }
 *     }
 * }
 * </pre>
 *
 * @since 1.0.0
 */
public final class Cursor<S, V> implements AutoCloseable {

    private final Automaton<S, V> automaton;
    private final KeywordTrie<S, V> trie;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private int state = KeywordTrie.ROOT;
    private int positionedAt;
    private int matchCount;
    private long position;

    Cursor(Automaton<S, V> automaton) {
        this.automaton = automaton;
        this.trie = automaton.trie();
    }

    /**
     * Consumes one input symbol.
     *
     * The first advance after a mutation rebuilds the automaton's fail links, blocking concurrent
     * readers until it is done.
     *
     * @param symbol next input symbol
     * @return number of registered keywords ending here (0 if none)
     * @throws ContractViolationException if closed, stale, released, or symbol is null
     */
    public int advance(S symbol) {
        checkUsable();
        Automaton.checkSymbol(symbol);
        automaton.ensureBuilt();

        int modCount = automaton.modCount();
        state = trie.follow(state, symbol);
        positionedAt = modCount;
        matchCount = trie.outputCount(state);
        position++;
        return matchCount;
    }

    /**
     * Number of keywords ending at the current position, as returned by the last advance.
     */
    public int matchCount() {
        checkUsable();
        return matchCount;
    }

    /**
     * The {@code index}-th keyword ending at the current position. Index 0 is the longest; higher
     * indices are progressively shorter suffixes.
     *
     * @throws ContractViolationException if index is outside {@code [0, matchCount())}, or the
     *     cursor is closed, stale or released
     */
    public Match<S, V> getMatch(int index) {
        checkUsable();
        if (index < 0 || index >= matchCount) {
            throw new ContractViolationException(
                "match index " + index + " out of range (" + matchCount + " matches at position " + position + ")");
        }
        return automaton.matchAt(trie.terminalAt(state, index));
    }

    /**
     * All keywords ending at the current position, longest first.
     */
    public List<Match<S, V>> matches() {
        checkUsable();
        if (matchCount == 0) {
            return Collections.emptyList();
        }
        List<Match<S, V>> result = new ArrayList<>(matchCount);
        for (int i = 0; i < matchCount; i++) {
            result.add(automaton.matchAt(trie.terminalAt(state, i)));
        }
        return result;
    }

    /**
     * Symbols consumed since creation or the last reset.
     */
    public long position() {
        checkNotClosed();
        return position;
    }

    /**
     * Returns to the root, as if no symbol had been consumed. Also clears staleness.
     */
    public void reset() {
        checkNotClosed();
        automaton.checkNotReleased();
        state = KeywordTrie.ROOT;
        matchCount = 0;
        position = 0;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            automaton.resourceTracker().trackCursorClosed();
        }
    }

    private void checkUsable() {
        checkNotClosed();
        automaton.checkNotReleased();
        if (state != KeywordTrie.ROOT && positionedAt != automaton.modCount()) {
            throw new ContractViolationException(
                "cursor is stale: the automaton was modified after the cursor moved (call reset())");
        }
    }

    private void checkNotClosed() {
        if (closed.get()) {
            throw new ContractViolationException("cursor is closed");
        }
    }
}
