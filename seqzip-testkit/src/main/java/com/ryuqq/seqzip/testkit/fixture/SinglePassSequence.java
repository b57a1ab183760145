package com.ryuqq.seqzip.testkit.fixture;

import java.util.Iterator;
import java.util.List;

/**
 * 한 번만 순회할 수 있는 테스트용 시퀀스 (stream, 네트워크 커서 등을 모사).
 *
 * <p>두 번째 {@code iterator()} 호출은 {@link IllegalStateException}을 던집니다.</p>
 *
 * @param <T> 요소 타입
 * @author SeqZip Team
 * @since 1.0.0
 */
public final class SinglePassSequence<T> implements Iterable<T> {

    private final List<T> elements;
    private boolean consumed;

    /**
     * 생성자.
     *
     * @param elements 요소 리스트
     * @throws IllegalArgumentException elements가 null인 경우
     */
    public SinglePassSequence(List<T> elements) {
        if (elements == null) {
            throw new IllegalArgumentException("elements cannot be null");
        }
        this.elements = List.copyOf(elements);
    }

    @Override
    public Iterator<T> iterator() {
        if (consumed) {
            throw new IllegalStateException("Sequence can only be traversed once");
        }
        consumed = true;
        return elements.iterator();
    }

    /**
     * 이미 순회가 시작되었는지 확인.
     *
     * @return 순회 시작 여부
     */
    public boolean isConsumed() {
        return consumed;
    }
}
