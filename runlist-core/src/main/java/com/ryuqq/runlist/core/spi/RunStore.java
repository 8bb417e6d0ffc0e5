package com.ryuqq.runlist.core.spi;

import com.ryuqq.runlist.core.model.Run;

import java.util.List;

/**
 * Ordered run storage SPI.
 *
 * <p>A RunStore holds a sorted collection of {@link Run}s, unique by begin, and
 * knows nothing about inversion. Polarity is applied by
 * {@link com.ryuqq.runlist.core.list.RunList} on top of these operations.</p>
 *
 * <p><strong>Structural Invariant:</strong> for any two stored runs
 * {@code r1.begin < r2.begin}:</p>
 * <ul>
 *   <li>{@link MergePolicy#COALESCE_ADJACENT}: {@code r1.end < r2.begin} (no overlap, no touching)</li>
 *   <li>{@link MergePolicy#OVERLAP_ONLY}: {@code r1.end <= r2.begin} (no overlap)</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Every mutating method must leave the invariant intact</li>
 *   <li>{@link #floor(Comparable)} should be sub-linear (ordered map or equivalent)</li>
 *   <li>Not required to be thread-safe; callers serialize access per instance</li>
 * </ul>
 *
 * @param <C> domain value type
 * @author RunList Team
 * @since 1.0.0
 */
public interface RunStore<C extends Comparable<? super C>> {

    /**
     * Adds every value of {@code run} to the store.
     *
     * <p>All stored runs the new run overlaps (or touches, depending on the
     * {@link MergePolicy}) are removed and replaced by one merged run
     * {@code [min(begin), max(end))}.</p>
     *
     * <pre>
     * stored: [0,5) [10,15) [20,25)
     * insert: [3,12)
     * result: [0,15) [20,25)
     * </pre>
     *
     * @param run the run to add
     * @throws IllegalArgumentException if run is null
     */
    void insert(Run<C> run);

    /**
     * Removes every value of {@code run} from the store.
     *
     * <ul>
     *   <li>Stored runs fully covered by {@code run} are deleted</li>
     *   <li>Partially overlapping runs are trimmed</li>
     *   <li>A stored run strictly containing {@code run} is split in two</li>
     * </ul>
     *
     * <pre>
     * stored: [0,10) [20,30)
     * remove: [5,22)
     * result: [0,5) [22,30)
     * </pre>
     *
     * @param run the run to remove
     * @throws IllegalArgumentException if run is null
     */
    void remove(Run<C> run);

    /**
     * Returns the stored run with the greatest begin that is {@code <= key}.
     *
     * <p>The returned run does not necessarily contain {@code key}; callers test
     * {@link Run#contains(Comparable)} on the result.</p>
     *
     * @param key the domain value
     * @return the predecessor run, or null if every run begins after key (or the store is empty)
     * @throws IllegalArgumentException if key is null
     */
    Run<C> floor(C key);

    /**
     * Returns an immutable snapshot of the stored runs in ascending order.
     *
     * @return ordered runs (never null)
     */
    List<Run<C>> runs();

    /**
     * Returns the number of stored runs.
     *
     * @return run count
     */
    int size();

    /**
     * Returns true if no run is stored.
     *
     * @return emptiness
     */
    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Removes all stored runs.
     */
    void clear();

    /**
     * Creates an independent store of the same implementation and configuration
     * holding the same runs.
     *
     * @return a deep copy (runs are immutable, so sharing them is safe)
     */
    RunStore<C> copy();

    /**
     * Returns the store configuration.
     *
     * @return configuration
     */
    RunStoreConfig config();
}
