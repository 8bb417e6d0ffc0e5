/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the run storage abstraction that adapters implement
 * to back a {@link com.ryuqq.runlist.core.list.RunList}.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runlist.core.spi.RunStore} - Ordered, polarity-agnostic run storage</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runlist.core.spi.RunStoreConfig} - Immutable store settings</li>
 *   <li>{@link com.ryuqq.runlist.core.spi.MergePolicy} - Whether touching runs are coalesced</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., runlist-adapter-inmemory) provide concrete implementations.
 * Every implementation should pass the contract suites in runlist-testkit.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Polarity-agnostic:</strong> Stores never see the inversion flag</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on any adapter</li>
 *   <li><strong>Pluggability:</strong> Linear reference store for tests, ordered map for production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author RunList Team
 */
package com.ryuqq.runlist.core.spi;
