package com.ryuqq.runlist.core.domain;

/**
 * 기본 제공 {@link DiscreteDomain} 구현.
 *
 * <p><strong>제공 도메인:</strong></p>
 * <ul>
 *   <li>{@link #longs()}: 블록 주소, 오프셋 등 64비트 인덱스</li>
 *   <li>{@link #integers()}: 배열 인덱스 등 32비트 인덱스</li>
 * </ul>
 *
 * @author RunList Team
 * @since 1.0.0
 */
public final class DiscreteDomains {

    // Utility class - prevent instantiation
    private DiscreteDomains() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Long 도메인.
     *
     * @return Long 도메인 (싱글톤)
     */
    public static DiscreteDomain<Long> longs() {
        return LongDomain.INSTANCE;
    }

    /**
     * Integer 도메인.
     *
     * @return Integer 도메인 (싱글톤)
     */
    public static DiscreteDomain<Integer> integers() {
        return IntegerDomain.INSTANCE;
    }

    private enum LongDomain implements DiscreteDomain<Long> {
        INSTANCE;

        @Override
        public Long next(Long value) {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
            if (value == Long.MAX_VALUE) {
                throw new IllegalArgumentException("Long.MAX_VALUE has no successor");
            }
            return value + 1;
        }

        @Override
        public String toString() {
            return "DiscreteDomains.longs()";
        }
    }

    private enum IntegerDomain implements DiscreteDomain<Integer> {
        INSTANCE;

        @Override
        public Integer next(Integer value) {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
            if (value == Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Integer.MAX_VALUE has no successor");
            }
            return value + 1;
        }

        @Override
        public String toString() {
            return "DiscreteDomains.integers()";
        }
    }
}
