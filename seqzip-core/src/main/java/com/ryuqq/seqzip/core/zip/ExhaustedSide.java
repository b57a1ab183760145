package com.ryuqq.seqzip.core.zip;

/**
 * 먼저 끝난 입력 시퀀스.
 *
 * @author SeqZip Team
 * @since 1.0.0
 */
public enum ExhaustedSide {

    /**
     * 첫 번째 시퀀스가 먼저 끝남 (두 번째 시퀀스에 요소가 남음).
     */
    FIRST("First sequence ran out before second"),

    /**
     * 두 번째 시퀀스가 먼저 끝남 (첫 번째 시퀀스에 요소가 남음).
     */
    SECOND("Second sequence ran out before first");

    private final String message;

    ExhaustedSide(String message) {
        this.message = message;
    }

    /**
     * 길이 불일치 메시지 조회.
     *
     * @return 메시지
     */
    public String message() {
        return message;
    }
}
