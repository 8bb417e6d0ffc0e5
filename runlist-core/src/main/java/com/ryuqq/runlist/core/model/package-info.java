/**
 * Core value types.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runlist.core.model.Run} - Half-open interval {@code [begin, end)}</li>
 * </ul>
 *
 * <h2>Errors</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runlist.core.model.InvalidRunException} - Empty or reversed bounds</li>
 * </ul>
 *
 * @since 1.0.0
 * @author RunList Team
 */
package com.ryuqq.runlist.core.model;
