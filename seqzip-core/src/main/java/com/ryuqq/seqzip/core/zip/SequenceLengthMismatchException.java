package com.ryuqq.seqzip.core.zip;

/**
 * FAIL 정책에서 두 입력 시퀀스의 길이가 다를 때 발생.
 *
 * <p>불일치가 처음 감지되는 시점(짧은 쪽 길이만큼 요소를 생산한 직후)에 지연 발생하며,
 * 이후 해당 순회는 FAILED 상태로 종료되어 재개할 수 없습니다.</p>
 *
 * @author SeqZip Team
 * @since 1.0.0
 */
public class SequenceLengthMismatchException extends IllegalStateException {

    private final ExhaustedSide exhaustedSide;

    /**
     * 생성자.
     *
     * @param exhaustedSide 먼저 끝난 시퀀스
     * @throws IllegalArgumentException exhaustedSide가 null인 경우
     */
    public SequenceLengthMismatchException(ExhaustedSide exhaustedSide) {
        super(requireSide(exhaustedSide).message());
        this.exhaustedSide = exhaustedSide;
    }

    /**
     * 먼저 끝난 시퀀스 조회.
     *
     * @return FIRST 또는 SECOND
     */
    public ExhaustedSide exhaustedSide() {
        return exhaustedSide;
    }

    private static ExhaustedSide requireSide(ExhaustedSide exhaustedSide) {
        if (exhaustedSide == null) {
            throw new IllegalArgumentException("exhaustedSide cannot be null");
        }
        return exhaustedSide;
    }
}
