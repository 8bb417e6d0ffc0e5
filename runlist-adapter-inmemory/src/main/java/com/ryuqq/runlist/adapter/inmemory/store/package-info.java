/**
 * In-memory {@link com.ryuqq.runlist.core.spi.RunStore} implementation.
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runlist.adapter.inmemory.store.TreeMapRunStore} - Ordered map with logarithmic predecessor lookup</li>
 *   <li>{@link com.ryuqq.runlist.adapter.inmemory.store.RunLists} - RunList factory</li>
 * </ul>
 *
 * @since 1.0.0
 * @author RunList Team
 */
package com.ryuqq.runlist.adapter.inmemory.store;
