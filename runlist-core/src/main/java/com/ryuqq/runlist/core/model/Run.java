package com.ryuqq.runlist.core.model;

/**
 * 순서가 있는 도메인 위의 반개구간(half-open interval) {@code [begin, end)}.
 *
 * <p>{@code begin}은 포함, {@code end}는 제외됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>{@code begin < end} (빈 run, 역전된 run 생성 불가)</li>
 *   <li>생성 후 값 변경 불가</li>
 * </ul>
 *
 * <p><strong>정렬:</strong> begin 오름차순, 같으면 end 오름차순.</p>
 *
 * @param <C> domain value type
 * @author RunList Team
 * @since 1.0.0
 */
public final class Run<C extends Comparable<? super C>> implements Comparable<Run<C>> {

    private final C begin;
    private final C end;

    private Run(C begin, C end) {
        if (begin == null) {
            throw new IllegalArgumentException("begin cannot be null");
        }
        if (end == null) {
            throw new IllegalArgumentException("end cannot be null");
        }
        if (begin.compareTo(end) >= 0) {
            throw new InvalidRunException(begin, end);
        }
        this.begin = begin;
        this.end = end;
    }

    /**
     * Run 생성.
     *
     * @param begin 시작 값 (inclusive)
     * @param end 종료 값 (exclusive)
     * @param <C> domain value type
     * @return Run 인스턴스
     * @throws InvalidRunException begin &gt;= end 인 경우
     * @throws IllegalArgumentException begin 또는 end가 null인 경우
     */
    public static <C extends Comparable<? super C>> Run<C> of(C begin, C end) {
        return new Run<>(begin, end);
    }

    public C begin() {
        return begin;
    }

    public C end() {
        return end;
    }

    /**
     * key가 {@code [begin, end)} 안에 있는지 확인.
     *
     * @param key 도메인 값
     * @return {@code begin <= key < end} 여부
     */
    public boolean contains(C key) {
        return begin.compareTo(key) <= 0 && key.compareTo(end) < 0;
    }

    /**
     * 반개구간 겹침 여부.
     *
     * <p>두 run 모두 상대의 end보다 앞에서 시작해야 겹침으로 판단합니다.
     * {@code [0,5)}와 {@code [5,8)}은 겹치지 않습니다.</p>
     *
     * @param other 비교 대상 run
     * @return 공유하는 도메인 값이 하나 이상이면 true
     */
    public boolean overlaps(Run<C> other) {
        return begin.compareTo(other.end) < 0 && other.begin.compareTo(end) < 0;
    }

    /**
     * 겹치거나 인접한지 확인 ({@code end == other.begin} 또는 그 반대).
     *
     * @param other 비교 대상 run
     * @return 두 run의 합집합이 하나의 연속 run이면 true
     */
    public boolean touches(Run<C> other) {
        return begin.compareTo(other.end) <= 0 && other.begin.compareTo(end) <= 0;
    }

    /**
     * 두 run을 모두 덮는 가장 작은 run.
     *
     * <p>{@link #touches(Run)}가 true일 때만 실제 합집합과 같습니다.</p>
     *
     * @param other 대상 run
     * @return {@code [min(begin), max(end))}
     */
    public Run<C> span(Run<C> other) {
        C b = begin.compareTo(other.begin) <= 0 ? begin : other.begin;
        C e = end.compareTo(other.end) >= 0 ? end : other.end;
        if (b == begin && e == end) {
            return this;
        }
        return new Run<>(b, e);
    }

    @Override
    public int compareTo(Run<C> o) {
        int c = begin.compareTo(o.begin);
        return c != 0 ? c : end.compareTo(o.end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Run<?> run = (Run<?>) o;
        return begin.equals(run.begin) && end.equals(run.end);
    }

    @Override
    public int hashCode() {
        return 31 * begin.hashCode() + end.hashCode();
    }

    @Override
    public String toString() {
        return "[" + begin + ", " + end + ")";
    }
}
