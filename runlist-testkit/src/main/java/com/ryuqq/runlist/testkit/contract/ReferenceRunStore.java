package com.ryuqq.runlist.testkit.contract;

import com.ryuqq.runlist.core.model.Run;
import com.ryuqq.runlist.core.spi.MergePolicy;
import com.ryuqq.runlist.core.spi.RunStore;
import com.ryuqq.runlist.core.spi.RunStoreConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Linear-scan reference implementation of {@link RunStore} for testing purposes.
 *
 * <p>Every operation walks the whole list from the start. This is slow but easy to
 * verify by reading, which makes it a useful oracle for randomized comparison
 * against faster adapters.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>O(N) insert, remove and floor</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @param <C> domain value type
 * @author RunList Team
 * @since 1.0.0
 */
public class ReferenceRunStore<C extends Comparable<? super C>> implements RunStore<C> {

    private final RunStoreConfig config;
    private final List<Run<C>> runs;

    /**
     * Creates an empty store with the default configuration.
     */
    public ReferenceRunStore() {
        this(new RunStoreConfig());
    }

    /**
     * Creates an empty store.
     *
     * @param config store configuration
     * @throws IllegalArgumentException if config is null
     */
    public ReferenceRunStore(RunStoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.runs = new ArrayList<>();
    }

    @Override
    public void insert(Run<C> run) {
        requireRun(run);
        Run<C> merged = run;
        List<Run<C>> kept = new ArrayList<>();
        for (Run<C> stored : runs) {
            if (merges(stored, merged)) {
                merged = merged.span(stored);
            } else {
                kept.add(stored);
            }
        }
        kept.add(merged);
        Collections.sort(kept);
        runs.clear();
        runs.addAll(kept);
    }

    @Override
    public void remove(Run<C> run) {
        requireRun(run);
        List<Run<C>> kept = new ArrayList<>();
        for (Run<C> stored : runs) {
            if (!stored.overlaps(run)) {
                kept.add(stored);
                continue;
            }
            if (stored.begin().compareTo(run.begin()) < 0) {
                kept.add(Run.of(stored.begin(), run.begin()));
            }
            if (stored.end().compareTo(run.end()) > 0) {
                kept.add(Run.of(run.end(), stored.end()));
            }
        }
        runs.clear();
        runs.addAll(kept);
    }

    @Override
    public Run<C> floor(C key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Run<C> result = null;
        for (Run<C> stored : runs) {
            if (stored.begin().compareTo(key) > 0) {
                break;
            }
            result = stored;
        }
        return result;
    }

    @Override
    public List<Run<C>> runs() {
        return List.copyOf(runs);
    }

    @Override
    public int size() {
        return runs.size();
    }

    @Override
    public void clear() {
        runs.clear();
    }

    @Override
    public RunStore<C> copy() {
        ReferenceRunStore<C> copy = new ReferenceRunStore<>(config);
        copy.runs.addAll(runs);
        return copy;
    }

    @Override
    public RunStoreConfig config() {
        return config;
    }

    @Override
    public String toString() {
        return "ReferenceRunStore{" + config.mergePolicy() + ", runs=" + runs + '}';
    }

    private boolean merges(Run<C> a, Run<C> b) {
        return config.mergePolicy() == MergePolicy.COALESCE_ADJACENT ? a.touches(b) : a.overlaps(b);
    }

    private static void requireRun(Run<?> run) {
        if (run == null) {
            throw new IllegalArgumentException("run cannot be null");
        }
    }
}
