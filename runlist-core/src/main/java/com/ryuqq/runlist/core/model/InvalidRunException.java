package com.ryuqq.runlist.core.model;

/**
 * 빈 run 또는 역전된 run({@code begin >= end}) 생성 시도 시 발생하는 예외.
 *
 * <p>길이가 0이거나 음수인 run은 생성도 저장도 불가합니다. 원시 경계값으로
 * {@link Run}을 만드는 모든 연산은 상태를 변경하기 전에 이 예외로 실패합니다.</p>
 *
 * @author RunList Team
 * @since 1.0.0
 */
public class InvalidRunException extends IllegalArgumentException {

    private final transient Object begin;
    private final transient Object end;

    /**
     * 생성자.
     *
     * @param begin 시작 값 (inclusive)
     * @param end 종료 값 (exclusive)
     */
    public InvalidRunException(Object begin, Object end) {
        super("Run begin must be strictly less than end (begin: " + begin + ", end: " + end + ")");
        this.begin = begin;
        this.end = end;
    }

    public Object getBegin() {
        return begin;
    }

    public Object getEnd() {
        return end;
    }
}
