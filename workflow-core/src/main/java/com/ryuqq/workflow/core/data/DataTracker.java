package com.ryuqq.workflow.core.data;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * 공유 결과 저장소 접근자.
 *
 * <p>불변 설정값(config)과 가변 결과값(data)을 한 쌍으로 묶고,
 * 결과값에 대한 모든 읽기/쓰기를 하나의 Read-Write Lock 뒤로 직렬화합니다.</p>
 *
 * <p><strong>동시성 보장:</strong></p>
 * <ul>
 *   <li>{@link #update(Consumer)}: 배타적 접근, 동시 update는 직렬화됨</li>
 *   <li>{@link #getData()}, {@link #read(Function)}: 진행 중인 update의 중간 상태를 관찰하지 않음</li>
 *   <li>결과값 원본 참조는 외부로 반환되지 않음: {@link #getData()}는 스냅샷 함수가 만든 복사본을 반환</li>
 *   <li>잠금은 mutator가 예외를 던져도 항상 해제됨</li>
 *   <li>config는 setter가 없으며 동기화가 필요 없음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * tracker.update(data -> data.setParameter1(visual + text));
 *
 * boolean allDone = tracker.read(data -> data.getPages().stream().allMatch(Objects::nonNull));
 * }</pre>
 *
 * @param <C> 설정 타입
 * @param <D> 결과 타입
 * @author Workflow Team
 * @since 1.0.0
 */
public final class DataTracker<C, D> {

    private final C config;
    private final D data;
    private final UnaryOperator<D> snapshot;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * 생성자 (스냅샷 함수 없음).
     *
     * <p>{@link #getData()}를 사용할 수 없으며, 읽기는 {@link #read(Function)}로만 가능합니다.</p>
     *
     * @param config 설정값 (null 허용)
     * @param data 결과 저장소
     * @throws IllegalArgumentException data가 null인 경우
     */
    public DataTracker(C config, D data) {
        this(config, data, null);
    }

    /**
     * 생성자.
     *
     * @param config 설정값 (null 허용)
     * @param data 결과 저장소
     * @param snapshot 결과값 복사 함수 (null이면 {@link #getData()} 비활성)
     * @throws IllegalArgumentException data가 null인 경우
     */
    public DataTracker(C config, D data, UnaryOperator<D> snapshot) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        this.config = config;
        this.data = data;
        this.snapshot = snapshot;
    }

    /**
     * 설정값 조회 (읽기 전용).
     *
     * @return 설정값
     */
    public C getConfig() {
        return config;
    }

    /**
     * 결과값 스냅샷 조회.
     *
     * <p>Read lock 안에서 스냅샷 함수로 복사본을 만들어 반환합니다.
     * 복사본은 이후의 update를 반영하지 않으며, 복사본을 변경해도 결과값에는 영향이 없습니다.</p>
     *
     * @return 결과값 복사본
     * @throws IllegalStateException 스냅샷 함수 없이 생성된 경우
     */
    public D getData() {
        if (snapshot == null) {
            throw new IllegalStateException("getData() requires a snapshot function; use read(Function) instead");
        }
        lock.readLock().lock();
        try {
            return snapshot.apply(data);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Read lock 안에서 결과값 투영.
     *
     * @param reader 투영 함수
     * @param <R> 투영 결과 타입
     * @return 투영 결과
     * @throws IllegalArgumentException reader가 null인 경우
     */
    public <R> R read(Function<? super D, ? extends R> reader) {
        if (reader == null) {
            throw new IllegalArgumentException("reader cannot be null");
        }
        lock.readLock().lock();
        try {
            return reader.apply(data);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 결과값 변경.
     *
     * <p>Write lock을 획득한 뒤 mutator를 호출하고, 모든 종료 경로에서 잠금을 해제합니다.
     * mutator가 던진 예외는 그대로 호출자에게 전파됩니다.</p>
     *
     * @param mutator 변경 함수
     * @throws IllegalArgumentException mutator가 null인 경우
     */
    public void update(Consumer<? super D> mutator) {
        if (mutator == null) {
            throw new IllegalArgumentException("mutator cannot be null");
        }
        lock.writeLock().lock();
        try {
            mutator.accept(data);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "DataTracker{config=" + config + "}";
    }
}
