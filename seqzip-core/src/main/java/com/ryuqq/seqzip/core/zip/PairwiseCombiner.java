package com.ryuqq.seqzip.core.zip;

import com.ryuqq.seqzip.core.policy.ImbalancedPolicy;
import com.ryuqq.seqzip.core.support.Arguments;

import java.util.function.BiFunction;

/**
 * 두 시퀀스를 위치별로 짝지어 결합하는 zip 연산 모음.
 *
 * <p><strong>진입점과 정책:</strong></p>
 * <ul>
 *   <li>{@link #zip(Iterable, Iterable, BiFunction)}: TRUNCATE (짧은 쪽 기준)</li>
 *   <li>{@link #equiZip(Iterable, Iterable, BiFunction)}: FAIL (길이가 같아야 함)</li>
 *   <li>{@link #zipLongest(Iterable, Iterable, BiFunction)}: PAD (긴 쪽 기준, null padding)</li>
 *   <li>{@link #zipLongest(Iterable, Iterable, Object, Object, BiFunction)}: PAD (지정 padding)</li>
 *   <li>{@link #zipLongestWithDefaults(Iterable, Iterable, Class, Class, BiFunction)}: PAD (타입 기본값 padding)</li>
 *   <li>{@link #zip(Iterable, Iterable, BiFunction, ZipConfig)}: 설정에 따름</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * List&lt;Integer&gt; numbers = List.of(1, 2, 3);
 * List&lt;String&gt; letters = List.of("A", "B", "C", "D");
 *
 * zip(numbers, letters, (n, l) -&gt; n + l);          // "1A", "2B", "3C"
 * equiZip(numbers, letters, (n, l) -&gt; n + l);      // "1A", "2B", "3C", 이후 SequenceLengthMismatchException
 * zipLongest(numbers, letters, 0, null, (n, l) -&gt; n + l);  // "1A", "2B", "3C", "0D"
 * zipLongestWithDefaults(numbers, letters, Integer.class, String.class, (n, l) -&gt; n + l);  // 동일
 * </pre>
 *
 * <p>모든 진입점은 순회 시작 전에 인자를 검증하며, 결과 시퀀스는 요청될 때만 계산됩니다.</p>
 *
 * @author SeqZip Team
 * @since 1.0.0
 */
public final class PairwiseCombiner {

    private PairwiseCombiner() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 짧은 시퀀스가 끝나면 종료하는 zip.
     *
     * @param first 첫 번째 시퀀스
     * @param second 두 번째 시퀀스
     * @param combiner 각 요소 쌍에 적용할 함수
     * @param <TFirst> 첫 번째 시퀀스 요소 타입
     * @param <TSecond> 두 번째 시퀀스 요소 타입
     * @param <TResult> 결과 요소 타입
     * @return 결과 시퀀스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <TFirst, TSecond, TResult> ZipSequence<TResult> zip(
        Iterable<? extends TFirst> first,
        Iterable<? extends TSecond> second,
        BiFunction<? super TFirst, ? super TSecond, ? extends TResult> combiner
    ) {
        ZipConfig<TFirst, TSecond> config = ZipConfig.truncate();
        return zip(first, second, combiner, config);
    }

    /**
     * 두 시퀀스의 길이가 같아야 하는 zip.
     *
     * <p>길이가 다르면 짧은 쪽 길이만큼 요소를 생산한 뒤
     * {@link SequenceLengthMismatchException}이 발생합니다.</p>
     *
     * @param first 첫 번째 시퀀스
     * @param second 두 번째 시퀀스
     * @param combiner 각 요소 쌍에 적용할 함수
     * @param <TFirst> 첫 번째 시퀀스 요소 타입
     * @param <TSecond> 두 번째 시퀀스 요소 타입
     * @param <TResult> 결과 요소 타입
     * @return 결과 시퀀스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <TFirst, TSecond, TResult> ZipSequence<TResult> equiZip(
        Iterable<? extends TFirst> first,
        Iterable<? extends TSecond> second,
        BiFunction<? super TFirst, ? super TSecond, ? extends TResult> combiner
    ) {
        ZipConfig<TFirst, TSecond> config = ZipConfig.fail();
        return zip(first, second, combiner, config);
    }

    /**
     * 긴 시퀀스가 끝날 때까지 이어지는 zip (짧은 쪽은 null로 채움).
     *
     * @param first 첫 번째 시퀀스
     * @param second 두 번째 시퀀스
     * @param combiner 각 요소 쌍에 적용할 함수 (padding 위치에서는 null 인자를 받음)
     * @param <TFirst> 첫 번째 시퀀스 요소 타입
     * @param <TSecond> 두 번째 시퀀스 요소 타입
     * @param <TResult> 결과 요소 타입
     * @return 결과 시퀀스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <TFirst, TSecond, TResult> ZipSequence<TResult> zipLongest(
        Iterable<? extends TFirst> first,
        Iterable<? extends TSecond> second,
        BiFunction<? super TFirst, ? super TSecond, ? extends TResult> combiner
    ) {
        ZipConfig<TFirst, TSecond> config = ZipConfig.pad();
        return zip(first, second, combiner, config);
    }

    /**
     * 긴 시퀀스가 끝날 때까지 이어지는 zip (짧은 쪽은 지정 값으로 채움).
     *
     * <p>타입 기본값으로 채우려면 {@link DefaultValues#of(Class)}를 사용합니다.</p>
     *
     * @param first 첫 번째 시퀀스
     * @param second 두 번째 시퀀스
     * @param firstPadding 첫 번째 시퀀스가 먼저 끝난 경우 사용할 값 (null 허용)
     * @param secondPadding 두 번째 시퀀스가 먼저 끝난 경우 사용할 값 (null 허용)
     * @param combiner 각 요소 쌍에 적용할 함수
     * @param <TFirst> 첫 번째 시퀀스 요소 타입
     * @param <TSecond> 두 번째 시퀀스 요소 타입
     * @param <TResult> 결과 요소 타입
     * @return 결과 시퀀스
     * @throws IllegalArgumentException first, second, combiner가 null인 경우
     */
    public static <TFirst, TSecond, TResult> ZipSequence<TResult> zipLongest(
        Iterable<? extends TFirst> first,
        Iterable<? extends TSecond> second,
        TFirst firstPadding,
        TSecond secondPadding,
        BiFunction<? super TFirst, ? super TSecond, ? extends TResult> combiner
    ) {
        ZipConfig<TFirst, TSecond> config = ZipConfig.pad(firstPadding, secondPadding);
        return zip(first, second, combiner, config);
    }

    /**
     * 긴 시퀀스가 끝날 때까지 이어지는 zip (짧은 쪽은 요소 타입의 기본값으로 채움).
     *
     * <p>padding 값은 {@link DefaultValues#of(Class)}로 정해집니다.
     * {@code Class} 값 자체를 padding으로 쓰는 호출과 섞이지 않도록 이름을 분리했습니다.</p>
     *
     * @param first 첫 번째 시퀀스
     * @param second 두 번째 시퀀스
     * @param firstType 첫 번째 시퀀스 요소 타입 (wrapper 또는 참조 타입)
     * @param secondType 두 번째 시퀀스 요소 타입 (wrapper 또는 참조 타입)
     * @param combiner 각 요소 쌍에 적용할 함수
     * @param <TFirst> 첫 번째 시퀀스 요소 타입
     * @param <TSecond> 두 번째 시퀀스 요소 타입
     * @param <TResult> 결과 요소 타입
     * @return 결과 시퀀스
     * @throws IllegalArgumentException 인자가 null이거나 타입이 primitive 클래스인 경우
     */
    public static <TFirst, TSecond, TResult> ZipSequence<TResult> zipLongestWithDefaults(
        Iterable<? extends TFirst> first,
        Iterable<? extends TSecond> second,
        Class<TFirst> firstType,
        Class<TSecond> secondType,
        BiFunction<? super TFirst, ? super TSecond, ? extends TResult> combiner
    ) {
        Arguments.requireNonNull(firstType, "firstType");
        Arguments.requireNonNull(secondType, "secondType");
        ZipConfig<TFirst, TSecond> config = ZipConfig.pad(DefaultValues.of(firstType), DefaultValues.of(secondType));
        return zip(first, second, combiner, config);
    }

    /**
     * 설정에 따라 동작하는 zip.
     *
     * @param first 첫 번째 시퀀스
     * @param second 두 번째 시퀀스
     * @param combiner 각 요소 쌍에 적용할 함수
     * @param config 정책 및 padding 설정
     * @param <TFirst> 첫 번째 시퀀스 요소 타입
     * @param <TSecond> 두 번째 시퀀스 요소 타입
     * @param <TResult> 결과 요소 타입
     * @return 결과 시퀀스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <TFirst, TSecond, TResult> ZipSequence<TResult> zip(
        Iterable<? extends TFirst> first,
        Iterable<? extends TSecond> second,
        BiFunction<? super TFirst, ? super TSecond, ? extends TResult> combiner,
        ZipConfig<TFirst, TSecond> config
    ) {
        Arguments.requireNonNull(first, "first");
        Arguments.requireNonNull(second, "second");
        Arguments.requireNonNull(combiner, "combiner");
        Arguments.requireNonNull(config, "config");

        ImbalancedPolicy policy = config.policy();
        return new ZipSequence<>(policy, () -> new ZipCursor<TFirst, TSecond, TResult>(first, second, combiner, config));
    }
}
