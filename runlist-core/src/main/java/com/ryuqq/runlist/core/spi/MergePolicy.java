package com.ryuqq.runlist.core.spi;

/**
 * run 삽입 시 병합 기준.
 *
 * <p><strong>정책별 저장 결과 ({@code [0,5)} 저장 후 {@code [5,8)} 삽입):</strong></p>
 * <pre>
 * COALESCE_ADJACENT → [0,8)           (최소 표현)
 * OVERLAP_ONLY      → [0,5), [5,8)    (겹침만 병합, 인접 run은 유지)
 * </pre>
 *
 * <p>두 정책 모두 저장된 run은 정렬되어 있고 서로 겹치지 않으며,
 * 멤버십 조회 결과는 동일합니다. 차이는 저장된 run 개수뿐입니다.</p>
 *
 * @author RunList Team
 * @since 1.0.0
 */
public enum MergePolicy {

    /**
     * 겹치거나 맞닿은({@code e1 == b2}) run을 모두 병합 (기본값).
     */
    COALESCE_ADJACENT,

    /**
     * 엄격한 반개구간 겹침({@code b2 < e1})일 때만 병합.
     */
    OVERLAP_ONLY;

    /**
     * 이 정책에서 정렬된 두 run을 병합해야 하는지 판단.
     *
     * @param earlierEnd 앞선 run의 end
     * @param laterBegin 뒤따르는 run의 begin
     * @param <C> 도메인 값 타입
     * @return 병합 여부
     */
    public <C extends Comparable<? super C>> boolean shouldMerge(C earlierEnd, C laterBegin) {
        int c = laterBegin.compareTo(earlierEnd);
        return this == COALESCE_ADJACENT ? c <= 0 : c < 0;
    }
}
