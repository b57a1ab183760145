package com.ryuqq.seqzip.core.cursor;

import java.util.Iterator;

/**
 * 해제 가능한 전진 전용 커서.
 *
 * <p>{@link Iterator}에 {@link AutoCloseable}을 결합하여 소비자가 순회를 중간에 멈춘 경우에도
 * try-with-resources로 하위 자원을 해제할 수 있게 합니다.</p>
 *
 * <pre>
 * try (CloseableCursor&lt;String&gt; cursor = sequence.iterator()) {
 *     if (cursor.hasNext()) {
 *         first = cursor.next();
 *     }
 * }
 * </pre>
 *
 * @param <T> 요소 타입
 * @author SeqZip Team
 * @since 1.0.0
 */
public interface CloseableCursor<T> extends Iterator<T>, AutoCloseable {

    /**
     * 커서가 보유한 자원 해제.
     *
     * <p>여러 번 호출해도 안전해야 합니다 (두 번째 호출부터는 no-op).</p>
     *
     * @throws CursorReleaseException 하위 자원 해제에 실패한 경우
     */
    @Override
    void close();
}
