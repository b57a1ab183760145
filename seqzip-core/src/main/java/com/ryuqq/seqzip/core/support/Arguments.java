package com.ryuqq.seqzip.core.support;

/**
 * 인자 검증 헬퍼.
 *
 * <p>null 인자는 순회 시작 전에 즉시 {@link IllegalArgumentException}으로 거부하며,
 * 메시지에 파라미터 이름을 포함합니다 (예: {@code "first cannot be null"}).</p>
 *
 * @author SeqZip Team
 * @since 1.0.0
 */
public final class Arguments {

    private Arguments() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * null이 아닌지 검증.
     *
     * @param value 검증할 값
     * @param name 파라미터 이름
     * @param <T> 값 타입
     * @return value (그대로)
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static <T> T requireNonNull(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        return value;
    }
}
