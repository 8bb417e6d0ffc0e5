package com.ryuqq.runlist.adapter.inmemory.store;

import com.ryuqq.runlist.core.model.Run;
import com.ryuqq.runlist.core.spi.MergePolicy;
import com.ryuqq.runlist.core.spi.RunStore;
import com.ryuqq.runlist.core.spi.RunStoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * {@link RunStore} backed by a {@link TreeMap} keyed by run begin.
 *
 * <p>Predecessor and successor lookups are logarithmic, so locating the span of
 * stored runs affected by an insert or remove costs O(log N) plus the number of
 * runs in the span.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>runs:</strong> TreeMap&lt;C, Run&lt;C&gt;&gt; - begin → run, ascending</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>insert:</strong> O(log N + K) - lowerEntry + subMap over K merged runs</li>
 *   <li><strong>remove:</strong> O(log N + K) - lowerEntry + subMap over K cut runs</li>
 *   <li><strong>floor:</strong> O(log N) - floorEntry</li>
 *   <li><strong>runs / copy:</strong> O(N)</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Not thread-safe; guard each instance with a single exclusive lock if shared</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * RunStore&lt;Long&gt; store = new TreeMapRunStore&lt;&gt;();
 * store.insert(Run.of(0L, 5L));
 * store.insert(Run.of(3L, 8L));   // → [0, 8)
 * store.remove(Run.of(2L, 4L));   // → [0, 2), [4, 8)
 * </pre>
 *
 * @param <C> domain value type
 * @author RunList Team
 * @since 1.0.0
 */
public class TreeMapRunStore<C extends Comparable<? super C>> implements RunStore<C> {

    private static final Logger log = LoggerFactory.getLogger(TreeMapRunStore.class);

    private final RunStoreConfig config;

    /**
     * Stored runs keyed by begin. Invariant: sorted, non-overlapping and, under
     * COALESCE_ADJACENT, non-touching.
     */
    private final TreeMap<C, Run<C>> runs;

    /**
     * Creates an empty store with the default configuration.
     */
    public TreeMapRunStore() {
        this(new RunStoreConfig());
    }

    /**
     * Creates an empty store.
     *
     * @param config store configuration
     * @throws IllegalArgumentException if config is null
     */
    public TreeMapRunStore(RunStoreConfig config) {
        this(config, new TreeMap<>());
    }

    private TreeMapRunStore(RunStoreConfig config, TreeMap<C, Run<C>> runs) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.runs = runs;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Only the run just below {@code run.begin} can start earlier and still merge</li>
     *   <li>Every stored run beginning inside {@code [run.begin, run.end)} overlaps;
     *       one beginning exactly at {@code run.end} touches</li>
     *   <li>The affected span is cleared through a subMap view, then the merged run is put</li>
     * </ul>
     */
    @Override
    public void insert(Run<C> run) {
        requireRun(run);
        MergePolicy policy = config.mergePolicy();

        C from = run.begin();
        Map.Entry<C, Run<C>> left = runs.lowerEntry(run.begin());
        if (left != null && policy.shouldMerge(left.getValue().end(), run.begin())) {
            from = left.getKey();
        }

        NavigableMap<C, Run<C>> span = runs.subMap(
            from, true,
            run.end(), policy == MergePolicy.COALESCE_ADJACENT
        );

        Run<C> merged = run;
        for (Run<C> stored : span.values()) {
            merged = merged.span(stored);
        }
        int absorbed = span.size();
        span.clear();
        runs.put(merged.begin(), merged);

        if (absorbed > 0 && log.isTraceEnabled()) {
            log.trace("Merged {} stored run(s) with {} into {}", absorbed, run, merged);
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Only the first and last affected runs can extend past {@code run}; their
     *       outside parts are put back as trimmed runs</li>
     *   <li>Trimmed parts keep an original boundary, so they cannot touch a neighbour</li>
     * </ul>
     */
    @Override
    public void remove(Run<C> run) {
        requireRun(run);

        C from = run.begin();
        Map.Entry<C, Run<C>> left = runs.lowerEntry(run.begin());
        if (left != null && left.getValue().end().compareTo(run.begin()) > 0) {
            from = left.getKey();
        }

        NavigableMap<C, Run<C>> span = runs.subMap(from, true, run.end(), false);
        if (span.isEmpty()) {
            return;
        }

        Run<C> first = span.firstEntry().getValue();
        Run<C> last = span.lastEntry().getValue();
        int cut = span.size();
        span.clear();

        if (first.begin().compareTo(run.begin()) < 0) {
            runs.put(first.begin(), Run.of(first.begin(), run.begin()));
        }
        if (last.end().compareTo(run.end()) > 0) {
            runs.put(run.end(), Run.of(run.end(), last.end()));
        }

        if (!log.isTraceEnabled()) {
            return;
        }
        if (cut == 1 && first.begin().compareTo(run.begin()) < 0 && first.end().compareTo(run.end()) > 0) {
            log.trace("Split {} around {}", first, run);
        } else {
            log.trace("Removed {} from {} stored run(s)", run, cut);
        }
    }

    @Override
    public Run<C> floor(C key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Map.Entry<C, Run<C>> entry = runs.floorEntry(key);
        return entry == null ? null : entry.getValue();
    }

    @Override
    public List<Run<C>> runs() {
        return List.copyOf(runs.values());
    }

    @Override
    public int size() {
        return runs.size();
    }

    @Override
    public void clear() {
        if (!runs.isEmpty()) {
            log.debug("Clearing {} stored run(s)", runs.size());
        }
        runs.clear();
    }

    @Override
    public RunStore<C> copy() {
        return new TreeMapRunStore<>(config, new TreeMap<>(runs));
    }

    @Override
    public RunStoreConfig config() {
        return config;
    }

    @Override
    public String toString() {
        return "TreeMapRunStore{" + config.mergePolicy() + ", runs=" + new ArrayList<>(runs.values()) + '}';
    }

    private static void requireRun(Run<?> run) {
        if (run == null) {
            throw new IllegalArgumentException("run cannot be null");
        }
    }
}
