/**
 * Discrete domain abstraction (total order + successor) and built-in domains.
 *
 * @since 1.0.0
 * @author RunList Team
 */
package com.ryuqq.runlist.core.domain;
