package com.ryuqq.runlist.core.spi;

/**
 * RunStore 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>mergePolicy: 삽입 시 병합 기준 (기본 COALESCE_ADJACENT)</li>
 * </ul>
 *
 * @author RunList Team
 * @since 1.0.0
 * @param mergePolicy 병합 정책 (null이 아니어야 함)
 */
public record RunStoreConfig(MergePolicy mergePolicy) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: mergePolicy=COALESCE_ADJACENT</p>
     */
    public RunStoreConfig() {
        this(MergePolicy.COALESCE_ADJACENT);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException mergePolicy가 null인 경우
     */
    public RunStoreConfig {
        if (mergePolicy == null) {
            throw new IllegalArgumentException("mergePolicy cannot be null");
        }
    }

    /**
     * mergePolicy만 변경한 새 인스턴스 생성.
     */
    public RunStoreConfig withMergePolicy(MergePolicy mergePolicy) {
        return new RunStoreConfig(mergePolicy);
    }
}
