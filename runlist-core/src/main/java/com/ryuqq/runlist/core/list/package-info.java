/**
 * The run list engine.
 *
 * <p>{@link com.ryuqq.runlist.core.list.RunList} combines a
 * {@link com.ryuqq.runlist.core.spi.RunStore} with an inversion flag. All storage
 * operations stay polarity-agnostic; inversion is applied only when mapping a
 * public set operation onto the store and when answering membership queries.</p>
 *
 * @since 1.0.0
 * @author RunList Team
 */
package com.ryuqq.runlist.core.list;
