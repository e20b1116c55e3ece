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
import com.axonops.libacm.metrics.ACMMetricsRegistry;
import com.axonops.libacm.metrics.MetricNames;
import com.axonops.libacm.trie.KeywordTrie;
import com.axonops.libacm.trie.StateBudget;
import com.axonops.libacm.util.KeywordHasher;
import com.axonops.libacm.util.ResourceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * An Aho-Corasick automaton over an arbitrary symbol type.
 *
 * Keywords (sequences of symbols) are registered and unregistered incrementally. Scanning reports
 * every registered keyword ending at each position of the input, overlapping occurrences included,
 * in a single left-to-right pass.
 *
 * Lazy Rebuild: Mutations only mark the fail links stale. The first scan or cursor advance after
 * a batch of mutations rebuilds them, exactly once, under a double-checked lock; concurrent
 * readers racing to that first advance block until it is done. {@link #prepare()} rebuilds
 * eagerly.
 *
 * Thread Safety:
 * <ul>
 *   <li>Any number of threads may scan concurrently, each with its own {@link Cursor}.</li>
 *   <li>Mutators are serialized by an internal lock.</li>
 *   <li>Mutating while other threads scan or look up is NOT supported: callers must quiesce
 *       readers first. Cursors positioned before a mutation detect it and refuse to continue.</li>
 * </ul>
 *
 * Example:
 * <pre>
 * try (Automaton&lt;Character, String&gt; acm = AhoCorasick.forText()) {
 *     acm.register(AhoCorasick.symbols("he"), "pronoun");
 *     acm.register(AhoCorasick.symbols("hers"), "possessive");
 *     for (Occurrence&lt;Character, String&gt; o : acm.findAll(AhoCorasick.symbols("ushers"))) {
 *         System.out.println(o.start() + ": " + o.match().value());
 *     }
 * }
 * </pre>
 *
 * @param <S> symbol type
 * @param <V> type of the value attached to each keyword
 * @since 1.0.0
 */
public final class Automaton<S, V> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Automaton.class);

    private final SymbolPolicy<S> policy;
    private final ACMConfig config;
    private final ACMMetricsRegistry metrics;
    private final ResourceTracker resourceTracker = new ResourceTracker();
    private final KeywordTrie<S, V> trie;

    // Guards mutation and the rebuild
    private final ReentrantLock lock = new ReentrantLock();

    // Written last by a rebuild, so reading false publishes the fail links
    private volatile boolean dirty = true;

    // Bumped by every structural change; cursors compare against it
    private volatile int modCount;

    private volatile boolean released;

    private final AtomicLong rebuildCount = new AtomicLong();
    private volatile long lastRebuildNanos;

    // This automaton's own suppliers, so release withdraws exactly these
    private final Map<String, Supplier<Number>> gauges = new LinkedHashMap<>();

    private Automaton(SymbolPolicy<S> policy, ACMConfig config) {
        this.policy = policy;
        this.config = config;
        this.metrics = config.metricsRegistry();
        this.trie = new KeywordTrie<>(policy, new TrackedBudget());
        registerGauges();

        logger.debug("ACM: Automaton created - maxStates: {}, maxKeywordLength: {}, validateAfterRebuild: {}",
            config.maxStates(), config.maxKeywordLength(), config.validateAfterRebuild());
    }

    /**
     * Creates an empty automaton with {@link ACMConfig#DEFAULT}.
     *
     * @param policy symbol equality, copy and destroy (required)
     * @throws ContractViolationException if policy is null
     */
    public static <S, V> Automaton<S, V> create(SymbolPolicy<S> policy) {
        return create(policy, ACMConfig.DEFAULT);
    }

    /**
     * Creates an empty automaton.
     *
     * @param policy symbol equality, copy and destroy (required)
     * @param config limits, verification and metrics
     * @throws ContractViolationException if policy is null
     * @throws NullPointerException if config is null
     */
    public static <S, V> Automaton<S, V> create(SymbolPolicy<S> policy, ACMConfig config) {
        if (policy == null) {
            throw new ContractViolationException("a symbol policy is required");
        }
        Objects.requireNonNull(config, "config cannot be null");
        return new Automaton<>(policy, config);
    }

    // ========== Keyword management ==========

    /**
     * Registers a keyword with no value.
     *
     * @see #register(List, Object, Consumer)
     */
    public boolean register(List<? extends S> keyword) {
        return register(keyword, null, null);
    }

    /**
     * Registers a keyword with a value and no destructor.
     *
     * @see #register(List, Object, Consumer)
     */
    public boolean register(List<? extends S> keyword, V value) {
        return register(keyword, value, null);
    }

    /**
     * Registers a keyword.
     *
     * Stores a {@link SymbolPolicy#copy} of each new symbol; prefixes shared with earlier keywords
     * are not stored twice. The keyword receives the next rank. If it is already registered nothing
     * changes: rank and value stay as they were and {@code destructor} is not called on
     * {@code value}.
     *
     * @param keyword symbols of the keyword (an empty keyword is ignored)
     * @param value value reported with each match, may be null
     * @param destructor called with the value once the automaton lets go of it (on unregister or
     *     release), may be null
     * @return true if inserted, false if already registered or empty
     * @throws ContractViolationException if released, or keyword is or contains null
     * @throws ResourceException if the keyword is too long or the state budget is exhausted; the
     *     automaton is then unchanged
     */
    public boolean register(List<? extends S> keyword, V value, Consumer<? super V> destructor) {
        checkNotReleased();
        checkKeyword(keyword);

        if (keyword.size() > config.maxKeywordLength()) {
            metrics.incrementCounter(MetricNames.ERRORS_RESOURCE_EXHAUSTED);
            logger.warn("ACM: Keyword rejected - hash: {}, length: {}, maxKeywordLength: {}",
                KeywordHasher.hash(keyword), keyword.size(), config.maxKeywordLength());
            throw new ResourceException(
                "Keyword length " + keyword.size() + " exceeds maxKeywordLength " + config.maxKeywordLength());
        }
        if (keyword.isEmpty()) {
            logger.debug("ACM: Empty keyword ignored");
            return false;
        }

        boolean inserted;
        lock.lock();
        try {
            checkNotReleased();
            inserted = trie.insert(keyword, value, destructor);
            if (inserted) {
                markModified();
            }
        } finally {
            lock.unlock();
        }

        if (inserted) {
            metrics.incrementCounter(MetricNames.KEYWORDS_REGISTERED);
            if (logger.isTraceEnabled()) {
                logger.trace("ACM: Keyword registered - hash: {}", KeywordHasher.hashWithLength(keyword));
            }
        } else {
            metrics.incrementCounter(MetricNames.KEYWORDS_DUPLICATE);
            if (logger.isTraceEnabled()) {
                logger.trace("ACM: Keyword already registered - hash: {}", KeywordHasher.hashWithLength(keyword));
            }
        }
        return inserted;
    }

    /**
     * Unregisters a keyword.
     *
     * The keyword's value goes to its destructor. States no other keyword needs are freed and
     * their symbols destroyed. The keyword's rank is never handed out again.
     *
     * @return true if it was registered
     * @throws ContractViolationException if released, or keyword is or contains null
     */
    public boolean unregister(List<? extends S> keyword) {
        checkNotReleased();
        checkKeyword(keyword);
        if (keyword.isEmpty()) {
            return false;
        }

        boolean removed;
        lock.lock();
        try {
            checkNotReleased();
            removed = trie.remove(keyword);
            if (removed) {
                markModified();
            }
        } finally {
            lock.unlock();
        }

        if (removed) {
            metrics.incrementCounter(MetricNames.KEYWORDS_UNREGISTERED);
            if (logger.isTraceEnabled()) {
                logger.trace("ACM: Keyword unregistered - hash: {}", KeywordHasher.hashWithLength(keyword));
            }
        }
        return removed;
    }

    /**
     * Exact membership test. Does not rebuild.
     *
     * @throws ContractViolationException if released, or keyword is or contains null
     */
    public boolean isRegistered(List<? extends S> keyword) {
        checkNotReleased();
        checkKeyword(keyword);
        return trie.find(keyword) != KeywordTrie.NONE;
    }

    /**
     * Exact lookup returning the stored symbols, rank and value. Does not rebuild.
     *
     * @return the match, or empty if not registered
     * @throws ContractViolationException if released, or keyword is or contains null
     */
    public Optional<Match<S, V>> lookup(List<? extends S> keyword) {
        checkNotReleased();
        checkKeyword(keyword);
        int state = trie.find(keyword);
        return state == KeywordTrie.NONE ? Optional.empty() : Optional.of(matchAt(state));
    }

    public int keywordCount() {
        checkNotReleased();
        return trie.keywordCount();
    }

    /**
     * Calls {@code action} once per registered keyword with its stored symbols and value, in no
     * particular order.
     *
     * @throws ContractViolationException if released, or if {@code action} modifies the automaton
     */
    public void forEachKeyword(BiConsumer<? super List<S>, ? super V> action) {
        checkNotReleased();
        Objects.requireNonNull(action, "action cannot be null");
        int expectedModCount = modCount;
        trie.forEachKeyword((keyword, rank, value) -> {
            action.accept(keyword, value);
            checkUnmodified(expectedModCount, "keyword iteration");
        });
    }

    /**
     * Snapshot of every registered keyword, sorted by rank.
     */
    public List<Match<S, V>> keywords() {
        checkNotReleased();
        List<Match<S, V>> result = new ArrayList<>(trie.keywordCount());
        trie.forEachKeyword((keyword, rank, value) -> result.add(new Match<>(keyword, rank, value)));
        result.sort((a, b) -> Long.compare(a.rank(), b.rank()));
        return Collections.unmodifiableList(result);
    }

    // ========== Matching ==========

    /**
     * Creates a cursor at the root. Cursors are confined to one thread and must be closed.
     *
     * @throws ContractViolationException if released
     */
    public Cursor<S, V> cursor() {
        checkNotReleased();
        Cursor<S, V> cursor = new Cursor<>(this);
        resourceTracker.trackCursorOpened();
        metrics.incrementCounter(MetricNames.CURSORS_CREATED);
        return cursor;
    }

    /**
     * Rebuilds the fail links now if any mutation is pending, so the first scan does not pay for
     * it. Lets a writer hand a ready automaton to reader threads.
     *
     * @throws ContractViolationException if released
     */
    public void prepare() {
        checkNotReleased();
        ensureBuilt();
    }

    /**
     * Scans {@code input} and reports every occurrence of every registered keyword.
     *
     * @param listener called per occurrence, ordered by end position, longest first per position;
     *     must not register, unregister or release
     * @return number of occurrences reported
     * @throws ContractViolationException if released, if input holds a null symbol, or if the
     *     automaton is modified while the scan runs
     */
    public long scan(Iterable<? extends S> input, MatchListener<S, V> listener) {
        checkNotReleased();
        Objects.requireNonNull(input, "input cannot be null");
        Objects.requireNonNull(listener, "listener cannot be null");
        ensureBuilt();

        int expectedModCount = modCount;
        long startNanos = System.nanoTime();
        long found = 0;
        long position = 0;
        int state = KeywordTrie.ROOT;
        for (S symbol : input) {
            checkSymbol(symbol);
            state = trie.follow(state, symbol);
            position++;
            int count = trie.outputCount(state);
            for (int i = 0; i < count; i++) {
                int terminal = trie.terminalAt(state, i);
                listener.onMatch(new Occurrence<>(position - trie.depthOf(terminal), position, matchAt(terminal)));
                checkUnmodified(expectedModCount, "scan");
            }
            found += count;
        }
        recordScan(startNanos, found);
        return found;
    }

    /**
     * All occurrences in {@code input}.
     *
     * @see #scan(Iterable, MatchListener)
     */
    public List<Occurrence<S, V>> findAll(Iterable<? extends S> input) {
        List<Occurrence<S, V>> result = new ArrayList<>();
        scan(input, result::add);
        return result;
    }

    /**
     * The occurrence that ends first, the longest one if several end at the same position. Stops
     * reading {@code input} there.
     *
     * @throws ContractViolationException if released, or input holds a null symbol
     */
    public Optional<Occurrence<S, V>> findFirst(Iterable<? extends S> input) {
        checkNotReleased();
        Objects.requireNonNull(input, "input cannot be null");
        ensureBuilt();

        long startNanos = System.nanoTime();
        long position = 0;
        int state = KeywordTrie.ROOT;
        for (S symbol : input) {
            checkSymbol(symbol);
            state = trie.follow(state, symbol);
            position++;
            if (trie.outputCount(state) > 0) {
                int terminal = trie.terminalAt(state, 0);
                recordScan(startNanos, 1);
                return Optional.of(new Occurrence<>(position - trie.depthOf(terminal), position, matchAt(terminal)));
            }
        }
        recordScan(startNanos, 0);
        return Optional.empty();
    }

    /**
     * True if any registered keyword occurs in {@code input}.
     */
    public boolean containsAny(Iterable<? extends S> input) {
        return findFirst(input).isPresent();
    }

    // ========== Lifecycle ==========

    /**
     * Statistics snapshot.
     *
     * @throws ContractViolationException if released
     */
    public AutomatonStatistics statistics() {
        checkNotReleased();
        return new AutomatonStatistics(
            trie.keywordCount(),
            trie.stateCount(),
            trie.peakStateCount(),
            trie.nextRank(),
            rebuildCount.get(),
            lastRebuildNanos,
            resourceTracker.getActiveCursorCount(),
            dirty);
    }

    /**
     * Gets the resource tracker of this automaton (for testing/monitoring).
     */
    public ResourceTracker getResourceTracker() {
        return resourceTracker;
    }

    public ACMConfig config() {
        return config;
    }

    /**
     * Destroys every stored symbol, hands every value to its destructor and frees all states.
     * Idempotent. Every later operation other than release, close and {@link #isReleased()} fails
     * with {@link ContractViolationException}.
     */
    public void release() {
        lock.lock();
        try {
            if (released) {
                return;
            }
            released = true;
            modCount++;
            int keywords = trie.keywordCount();
            int states = trie.release();
            removeGauges();
            logger.debug("ACM: Automaton released - keywords: {}, states: {}", keywords, states);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Same as {@link #release()}.
     */
    @Override
    public void close() {
        release();
    }

    public boolean isReleased() {
        return released;
    }

    // ========== Package-private, for Cursor ==========

    KeywordTrie<S, V> trie() {
        return trie;
    }

    int modCount() {
        return modCount;
    }

    ResourceTracker resourceTracker() {
        return resourceTracker;
    }

    Match<S, V> matchAt(int terminal) {
        return new Match<>(trie.keywordOf(terminal), trie.rankOf(terminal), trie.valueOf(terminal));
    }

    /**
     * Runs the pending rebuild, if any. Double-checked: the common path is one volatile read.
     */
    void ensureBuilt() {
        if (!dirty) {
            return;
        }
        lock.lock();
        try {
            checkNotReleased();
            if (dirty) {
                rebuild();
            }
        } finally {
            lock.unlock();
        }
    }

    private void checkUnmodified(int expectedModCount, String operation) {
        if (modCount != expectedModCount) {
            throw new ContractViolationException("automaton was modified during " + operation);
        }
    }

    void checkNotReleased() {
        if (released) {
            throw new ContractViolationException("automaton has been released");
        }
    }

    static void checkSymbol(Object symbol) {
        if (symbol == null) {
            throw new ContractViolationException("null symbols are not allowed");
        }
    }

    // ========== Internals ==========

    private void rebuild() {
        long startNanos = System.nanoTime();
        trie.rebuildFailureFunction();
        if (config.validateAfterRebuild()) {
            try {
                trie.validate();
            } catch (IllegalStateException e) {
                logger.error("ACM: Automaton failed validation after rebuild - states: {}", trie.stateCount(), e);
                throw e;
            }
        }
        long durationNanos = System.nanoTime() - startNanos;

        lastRebuildNanos = durationNanos;
        rebuildCount.incrementAndGet();
        metrics.incrementCounter(MetricNames.AUTOMATON_REBUILDS);
        metrics.recordTimer(MetricNames.AUTOMATON_REBUILD_LATENCY, durationNanos);

        // Publishes everything written above
        dirty = false;

        logger.debug("ACM: Automaton rebuilt - keywords: {}, states: {}, timeNs: {}",
            trie.keywordCount(), trie.stateCount(), durationNanos);
    }

    private void markModified() {
        modCount++;
        dirty = true;
    }

    private void recordScan(long startNanos, long found) {
        long durationNanos = System.nanoTime() - startNanos;
        metrics.incrementCounter(MetricNames.MATCHING_SCANS);
        if (found > 0) {
            metrics.incrementCounter(MetricNames.MATCHING_MATCHES, found);
        }
        metrics.recordTimer(MetricNames.MATCHING_SCAN_LATENCY, durationNanos);
    }

    private static void checkKeyword(List<?> keyword) {
        if (keyword == null) {
            throw new ContractViolationException("keyword cannot be null");
        }
        for (Object symbol : keyword) {
            checkSymbol(symbol);
        }
    }

    private void registerGauges() {
        gauges.put(MetricNames.KEYWORDS_CURRENT, trie::keywordCount);
        gauges.put(MetricNames.STATES_CURRENT, resourceTracker::getActiveStateCount);
        gauges.put(MetricNames.STATES_PEAK, trie::peakStateCount);
        gauges.put(MetricNames.CURSORS_ACTIVE, resourceTracker::getActiveCursorCount);
        gauges.forEach(metrics::registerGauge);
    }

    private void removeGauges() {
        gauges.forEach(metrics::removeGauge);
        gauges.clear();
    }

    /** Charges trie states against the configured limit. */
    private final class TrackedBudget implements StateBudget {
        @Override
        public void reserve(int states) {
            resourceTracker.trackStatesAllocated(states, config.maxStates(), metrics);
        }

        @Override
        public void release(int states) {
            resourceTracker.trackStatesFreed(states);
        }
    }
}
