package com.ryuqq.runlist.adapter.inmemory.store;

import com.ryuqq.runlist.core.domain.DiscreteDomain;
import com.ryuqq.runlist.core.list.RunList;
import com.ryuqq.runlist.core.spi.RunStoreConfig;

/**
 * Factory for {@link RunList}s backed by a {@link TreeMapRunStore}.
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * RunList&lt;Long&gt; used = RunLists.treeMap(DiscreteDomains.longs());
 * used.addRun(0L, 128L);
 * used.invert();               // now tracks free blocks
 * boolean free = used.inRun(200L);
 * </pre>
 *
 * @author RunList Team
 * @since 1.0.0
 */
public final class RunLists {

    // Utility class - prevent instantiation
    private RunLists() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Creates an empty run list with the default store configuration.
     *
     * @param domain the discrete domain
     * @param <C> domain value type
     * @return an empty, non-inverted run list
     * @throws IllegalArgumentException if domain is null
     */
    public static <C extends Comparable<? super C>> RunList<C> treeMap(DiscreteDomain<C> domain) {
        return treeMap(domain, new RunStoreConfig());
    }

    /**
     * Creates an empty run list.
     *
     * @param domain the discrete domain
     * @param config store configuration
     * @param <C> domain value type
     * @return an empty, non-inverted run list
     * @throws IllegalArgumentException if domain or config is null
     */
    public static <C extends Comparable<? super C>> RunList<C> treeMap(DiscreteDomain<C> domain, RunStoreConfig config) {
        return new RunList<>(domain, new TreeMapRunStore<>(config));
    }
}
