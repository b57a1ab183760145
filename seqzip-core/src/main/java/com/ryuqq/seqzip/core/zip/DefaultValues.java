package com.ryuqq.seqzip.core.zip;

import com.ryuqq.seqzip.core.support.Arguments;

import java.util.Map;

/**
 * 타입별 기본값(zero value) 조회.
 *
 * <p>PAD 정책에서 짧은 쪽을 채울 값을 타입으로부터 얻을 때 사용합니다.</p>
 *
 * <ul>
 *   <li>숫자 wrapper 타입: 0</li>
 *   <li>Character: {@code '\0'}</li>
 *   <li>Boolean: false</li>
 *   <li>그 외 참조 타입: null</li>
 * </ul>
 *
 * <p>시퀀스 요소는 항상 참조 타입이므로 primitive 클래스({@code int.class} 등)는 받지 않습니다.</p>
 *
 * <pre>
 * zipLongest(numbers, letters, DefaultValues.of(Integer.class), DefaultValues.of(String.class), combiner);
 * </pre>
 *
 * @author SeqZip Team
 * @since 1.0.0
 */
public final class DefaultValues {

    private static final Map<Class<?>, Object> ZERO_VALUES = Map.of(
        Integer.class, 0,
        Long.class, 0L,
        Short.class, (short) 0,
        Byte.class, (byte) 0,
        Float.class, 0.0f,
        Double.class, 0.0d,
        Character.class, '\0',
        Boolean.class, false
    );

    private DefaultValues() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 타입의 기본값 조회.
     *
     * @param type 요소 타입
     * @param <T> 값 타입
     * @return 기본값 (wrapper가 아닌 참조 타입이면 null)
     * @throws IllegalArgumentException type이 null이거나 primitive 클래스인 경우
     */
    public static <T> T of(Class<T> type) {
        Arguments.requireNonNull(type, "type");
        if (type.isPrimitive()) {
            throw new IllegalArgumentException(
                "Primitive type " + type.getName() + " is not a sequence element type; use its wrapper class");
        }
        return type.cast(ZERO_VALUES.get(type));
    }
}
