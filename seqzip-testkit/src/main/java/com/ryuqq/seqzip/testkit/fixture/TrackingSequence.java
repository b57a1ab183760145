package com.ryuqq.seqzip.testkit.fixture;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 순회를 계측하는 테스트용 시퀀스.
 *
 * <p>커서 획득 횟수, 요소 전진({@code next()}) 횟수, 커서 해제 횟수를 기록하여
 * 지연 실행과 자원 해제를 검증할 수 있게 합니다. 이 시퀀스가 반환하는 커서는
 * {@link AutoCloseable}을 구현하므로 zip 연산의 해제 대상이 됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TrackingSequence&lt;Integer&gt; numbers = TrackingSequence.of(1, 2, 3);
 * PairwiseCombiner.zip(numbers, letters, combiner).toList();
 *
 * assertThat(numbers.releases()).isEqualTo(1);
 * </pre>
 *
 * @param <T> 요소 타입
 * @author SeqZip Team
 * @since 1.0.0
 */
public final class TrackingSequence<T> implements Iterable<T> {

    private final List<T> elements;
    private final boolean failOnRelease;

    private int acquisitions;
    private int advances;
    private int releases;

    private TrackingSequence(List<T> elements, boolean failOnRelease) {
        this.elements = elements;
        this.failOnRelease = failOnRelease;
    }

    /**
     * 요소로 시퀀스 생성.
     *
     * @param elements 요소 (null 요소 허용)
     * @param <T> 요소 타입
     * @return TrackingSequence 인스턴스
     */
    @SafeVarargs
    public static <T> TrackingSequence<T> of(T... elements) {
        return new TrackingSequence<>(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(elements))), false);
    }

    /**
     * 리스트로 시퀀스 생성.
     *
     * @param elements 요소 리스트
     * @param <T> 요소 타입
     * @return TrackingSequence 인스턴스
     */
    public static <T> TrackingSequence<T> from(List<T> elements) {
        return new TrackingSequence<>(Collections.unmodifiableList(new ArrayList<>(elements)), false);
    }

    /**
     * 커서 해제 시 예외를 던지는 시퀀스 생성.
     *
     * @param elements 요소
     * @param <T> 요소 타입
     * @return TrackingSequence 인스턴스
     */
    @SafeVarargs
    public static <T> TrackingSequence<T> failingOnRelease(T... elements) {
        return new TrackingSequence<>(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(elements))), true);
    }

    @Override
    public Iterator<T> iterator() {
        acquisitions++;
        return new TrackingCursor();
    }

    /**
     * 커서 획득 횟수.
     *
     * @return {@code iterator()} 호출 횟수
     */
    public int acquisitions() {
        return acquisitions;
    }

    /**
     * 모든 커서에 걸친 전진 횟수.
     *
     * @return {@code next()} 호출 횟수
     */
    public int advances() {
        return advances;
    }

    /**
     * 커서 해제 횟수.
     *
     * @return {@code close()} 호출 횟수 (중복 호출 포함)
     */
    public int releases() {
        return releases;
    }

    /**
     * 해제되지 않은 커서 수.
     *
     * @return 획득 횟수 - 해제 횟수
     */
    public int openCursors() {
        return acquisitions - releases;
    }

    @Override
    public String toString() {
        return "TrackingSequence{elements=" + elements
            + ", acquisitions=" + acquisitions
            + ", advances=" + advances
            + ", releases=" + releases + '}';
    }

    private final class TrackingCursor implements Iterator<T>, AutoCloseable {

        private int position;
        private boolean closed;

        @Override
        public boolean hasNext() {
            if (closed) {
                throw new IllegalStateException("Cursor already released");
            }
            return position < elements.size();
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No element at position " + position);
            }
            advances++;
            return elements.get(position++);
        }

        @Override
        public void close() {
            closed = true;
            releases++;
            if (failOnRelease) {
                throw new IllegalStateException("Release failure (simulated)");
            }
        }
    }
}
