package com.ryuqq.seqzip.core.cursor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;

/**
 * 입력 커서 해제 유틸리티.
 *
 * <p>{@link AutoCloseable}을 구현한 커서만 해제 대상입니다. 일반 컬렉션 iterator처럼
 * 해제할 자원이 없는 커서는 그대로 무시합니다.</p>
 *
 * <p><strong>해제 규칙:</strong></p>
 * <ul>
 *   <li>앞선 커서의 해제가 실패해도 나머지 커서 해제를 계속 시도</li>
 *   <li>primary 예외가 있으면 해제 실패를 suppressed로 추가하고 던지지 않음</li>
 *   <li>primary 예외가 없으면 첫 실패를 {@link CursorReleaseException}으로 던짐</li>
 * </ul>
 *
 * @author SeqZip Team
 * @since 1.0.0
 */
public final class Cursors {

    private static final Logger log = LoggerFactory.getLogger(Cursors.class);

    private Cursors() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 커서 해제가 필요한지 확인.
     *
     * @param cursor 커서 (null 허용)
     * @return AutoCloseable을 구현한 경우 true
     */
    public static boolean isReleasable(Iterator<?> cursor) {
        return cursor instanceof AutoCloseable;
    }

    /**
     * 여러 커서를 순서대로 해제.
     *
     * @param primary 현재 전파 중인 예외 (없으면 null)
     * @param cursors 해제할 커서 (null 요소 허용)
     * @throws CursorReleaseException primary가 null이고 해제에 실패한 경우
     */
    public static void releaseAll(Throwable primary, Iterator<?>... cursors) {
        CursorReleaseException failure = null;

        for (Iterator<?> cursor : cursors) {
            if (!isReleasable(cursor)) {
                continue;
            }
            try {
                ((AutoCloseable) cursor).close();
            } catch (Exception e) {
                log.warn("Failed to release cursor {}", cursor, e);
                if (primary != null) {
                    primary.addSuppressed(e);
                } else if (failure == null) {
                    failure = new CursorReleaseException("Failed to release cursor: " + cursor, e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }

        if (failure != null) {
            throw failure;
        }
    }
}
