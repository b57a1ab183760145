package com.ryuqq.seqzip.core.cursor;

/**
 * 입력 커서 해제 실패.
 *
 * <p>다른 예외가 전파 중이 아닐 때만 발생합니다. 전파 중인 예외가 있으면
 * 해제 실패는 그 예외의 suppressed 예외로 추가됩니다.</p>
 *
 * @author SeqZip Team
 * @since 1.0.0
 */
public class CursorReleaseException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param cause 해제 중 발생한 원인 예외
     */
    public CursorReleaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
