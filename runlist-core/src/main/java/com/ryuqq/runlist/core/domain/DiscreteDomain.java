package com.ryuqq.runlist.core.domain;

/**
 * 이산(discrete) 도메인: 전순서 + 다음 값(successor) 연산.
 *
 * <p>run은 반개구간이므로 단일 값 {@code key}는 {@code [key, next(key))}로 표현됩니다.
 * 순서는 {@link Comparable}이 담당하고, 이 인터페이스는 다음 값 계산만 제공합니다.</p>
 *
 * <p><strong>요구사항:</strong></p>
 * <ul>
 *   <li>{@code compareTo}는 strict total order여야 함</li>
 *   <li>{@code next(v)}는 v보다 큰 값 중 가장 작은 값</li>
 *   <li>유한 도메인의 최댓값에는 다음 값이 없음 → IllegalArgumentException</li>
 * </ul>
 *
 * @param <C> 도메인 값 타입
 * @author RunList Team
 * @since 1.0.0
 */
public interface DiscreteDomain<C extends Comparable<? super C>> {

    /**
     * 다음 값 조회.
     *
     * @param value 기준 값
     * @return value 바로 다음 값
     * @throws IllegalArgumentException value가 null이거나 다음 값이 없는 경우
     */
    C next(C value);
}
