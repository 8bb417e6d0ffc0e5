package com.ryuqq.runlist.core.list;

import com.ryuqq.runlist.core.domain.DiscreteDomain;
import com.ryuqq.runlist.core.model.InvalidRunException;
import com.ryuqq.runlist.core.model.Run;
import com.ryuqq.runlist.core.spi.RunStore;

import java.util.List;

/**
 * 이산 도메인의 부분집합을 run 목록 + 반전 플래그로 표현하는 컨테이너.
 *
 * <p>저장된 run들은 {@link RunStore}가 관리하며, 반전 플래그는 저장된 run이
 * 집합 자체를 나타내는지(false) 여집합을 나타내는지(true)를 결정합니다.</p>
 *
 * <p><strong>표현 규칙:</strong></p>
 * <pre>
 * inverted = false → 표현 집합 = 저장된 run들의 합집합
 * inverted = true  → 표현 집합 = 전체 도메인 - 저장된 run들의 합집합
 * </pre>
 *
 * <p><strong>연산 매핑 (S = 저장된 run, O = 다른 RunList의 저장된 run):</strong></p>
 * <pre>
 * addRun(b, e)  normal → S.insert([b,e))     inverted → S.remove([b,e))
 * subRun(b, e)  normal → S.remove([b,e))     inverted → S.insert([b,e))
 *
 * add(other)    N+N → S ∪ O (N)   N+I → O - S (I)   I+N → S - O (I)   I+I → S ∩ O (I)
 * sub(other)    N-N → S - O (N)   N-I → S ∩ O (N)   I-N → S ∪ O (I)   I-I → O - S (N)
 * </pre>
 *
 * <p><strong>반전:</strong> {@link #invert()}는 플래그만 뒤집으며 저장소를 건드리지 않습니다 (O(1)).</p>
 *
 * <p><strong>동시성:</strong> thread-safe하지 않습니다. 여러 스레드에서 공유할 경우
 * 인스턴스당 하나의 배타 락으로 모든 호출을 보호해야 합니다.</p>
 *
 * @param <C> 도메인 값 타입
 * @author RunList Team
 * @since 1.0.0
 */
public final class RunList<C extends Comparable<? super C>> {

    private final DiscreteDomain<C> domain;
    private final RunStore<C> store;
    private boolean inverted;

    /**
     * 빈 RunList 생성 (빈 집합, 반전 없음).
     *
     * <p>전달된 store는 구현과 설정의 원본으로만 사용됩니다. RunList는
     * {@link RunStore#copy()}로 만든 자신만의 저장소를 소유하므로, 같은 store로 만든
     * 여러 RunList나 호출자가 원본 store를 변경해도 서로 영향을 주지 않습니다.</p>
     *
     * @param domain 이산 도메인
     * @param store 비어 있는 원본 저장소
     * @throws IllegalArgumentException domain 또는 store가 null이거나 store가 비어 있지 않은 경우
     */
    public RunList(DiscreteDomain<C> domain, RunStore<C> store) {
        this(domain, ownedCopy(store), false);
    }

    private RunList(DiscreteDomain<C> domain, RunStore<C> store, boolean inverted) {
        if (domain == null) {
            throw new IllegalArgumentException("domain cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.domain = domain;
        this.store = store;
        this.inverted = inverted;
    }

    /**
     * 표현 집합에 {@code [b, e)}를 합집합으로 추가.
     *
     * @param b 시작 값 (inclusive)
     * @param e 종료 값 (exclusive)
     * @throws InvalidRunException b &gt;= e 인 경우 (상태 변경 없음)
     * @throws IllegalArgumentException b 또는 e가 null인 경우
     */
    public void addRun(C b, C e) {
        Run<C> run = Run.of(b, e);
        if (inverted) {
            store.remove(run);
        } else {
            store.insert(run);
        }
    }

    /**
     * 표현 집합에서 {@code [b, e)}를 제거.
     *
     * @param b 시작 값 (inclusive)
     * @param e 종료 값 (exclusive)
     * @throws InvalidRunException b &gt;= e 인 경우 (상태 변경 없음)
     * @throws IllegalArgumentException b 또는 e가 null인 경우
     */
    public void subRun(C b, C e) {
        Run<C> run = Run.of(b, e);
        if (inverted) {
            store.insert(run);
        } else {
            store.remove(run);
        }
    }

    /**
     * 단일 값 추가 ({@code [key, next(key))}).
     *
     * @param key 도메인 값
     * @throws IllegalArgumentException key가 null이거나 다음 값이 없는 경우
     */
    public void addValue(C key) {
        requireKey(key);
        addRun(key, domain.next(key));
    }

    /**
     * 단일 값 제거 ({@code [key, next(key))}).
     *
     * @param key 도메인 값
     * @throws IllegalArgumentException key가 null이거나 다음 값이 없는 경우
     */
    public void subValue(C key) {
        requireKey(key);
        subRun(key, domain.next(key));
    }

    /**
     * 멤버십 조회 (반전 플래그 반영).
     *
     * <p>begin이 key 이하인 run 중 가장 큰 것을 찾아 {@code begin <= key < end}를 검사한 뒤,
     * 반전 상태이면 결과를 뒤집습니다.</p>
     *
     * @param key 도메인 값
     * @return key가 표현 집합에 속하는지 여부
     * @throws IllegalArgumentException key가 null인 경우
     */
    public boolean inRun(C key) {
        requireKey(key);
        Run<C> floor = store.floor(key);
        boolean stored = floor != null && floor.contains(key);
        return stored != inverted;
    }

    /**
     * 반전 플래그 전환 (O(1), 저장소 변경 없음).
     */
    public void invert() {
        inverted = !inverted;
    }

    /**
     * 다른 RunList와의 합집합. other는 변경되지 않습니다.
     *
     * @param other 합칠 RunList (자기 자신 허용)
     * @throws IllegalArgumentException other가 null인 경우
     */
    public void add(RunList<C> other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        if (other == this) {
            return;
        }
        List<Run<C>> theirs = other.store.runs();

        if (!inverted && !other.inverted) {
            insertAll(store, theirs);
        } else if (!inverted) {
            // S ∪ ¬O = ¬(O - S)
            replaceWith(difference(theirs, store.runs()));
            inverted = true;
        } else if (!other.inverted) {
            // ¬S ∪ O = ¬(S - O)
            removeAll(store, theirs);
        } else {
            // ¬S ∪ ¬O = ¬(S ∩ O)
            retainAll(theirs);
        }
    }

    /**
     * 다른 RunList와의 차집합. other는 변경되지 않습니다.
     *
     * @param other 뺄 RunList (자기 자신이면 빈 집합이 됨)
     * @throws IllegalArgumentException other가 null인 경우
     */
    public void sub(RunList<C> other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        if (other == this) {
            store.clear();
            inverted = false;
            return;
        }
        List<Run<C>> theirs = other.store.runs();

        if (!inverted && !other.inverted) {
            removeAll(store, theirs);
        } else if (!inverted) {
            // S - ¬O = S ∩ O
            retainAll(theirs);
        } else if (!other.inverted) {
            // ¬S - O = ¬(S ∪ O)
            insertAll(store, theirs);
        } else {
            // ¬S - ¬O = O - S
            replaceWith(difference(theirs, store.runs()));
            inverted = false;
        }
    }

    /**
     * 독립적인 복사본 생성 (저장소 복제, 반전 플래그 유지).
     *
     * @return 새 RunList
     */
    public RunList<C> copy() {
        return new RunList<>(domain, store.copy(), inverted);
    }

    public boolean isInverted() {
        return inverted;
    }

    /**
     * 저장된 run 개수 (반전 여부와 무관).
     *
     * @return run 개수
     */
    public int runCount() {
        return store.size();
    }

    /**
     * 저장된 run의 불변 스냅샷 (begin 오름차순, 반전 여부와 무관).
     *
     * @return 정렬된 run 목록
     */
    public List<Run<C>> runs() {
        return store.runs();
    }

    public DiscreteDomain<C> domain() {
        return domain;
    }

    @Override
    public String toString() {
        return "RunList{inverted=" + inverted + ", runs=" + store.runs() + '}';
    }

    private void retainAll(List<Run<C>> theirs) {
        // S ∩ O = S - (S - O)
        removeAll(store, difference(store.runs(), theirs));
    }

    private void replaceWith(List<Run<C>> runs) {
        store.clear();
        insertAll(store, runs);
    }

    private List<Run<C>> difference(List<Run<C>> minuend, List<Run<C>> subtrahend) {
        RunStore<C> scratch = store.copy();
        scratch.clear();
        insertAll(scratch, minuend);
        removeAll(scratch, subtrahend);
        return scratch.runs();
    }

    private static <C extends Comparable<? super C>> void insertAll(RunStore<C> target, List<Run<C>> runs) {
        for (Run<C> run : runs) {
            target.insert(run);
        }
    }

    private static <C extends Comparable<? super C>> void removeAll(RunStore<C> target, List<Run<C>> runs) {
        for (Run<C> run : runs) {
            target.remove(run);
        }
    }

    private static <C extends Comparable<? super C>> RunStore<C> ownedCopy(RunStore<C> store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (!store.isEmpty()) {
            throw new IllegalArgumentException("store must be empty (current size: " + store.size() + ")");
        }
        return store.copy();
    }

    private static void requireKey(Object key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }
}
