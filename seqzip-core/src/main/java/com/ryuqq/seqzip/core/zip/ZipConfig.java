package com.ryuqq.seqzip.core.zip;

import com.ryuqq.seqzip.core.policy.ImbalancedPolicy;

/**
 * Zip 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>policy: 길이 불일치 처리 정책 (필수)</li>
 *   <li>firstPadding: PAD 정책에서 첫 번째 시퀀스 대신 사용할 값 (null 허용)</li>
 *   <li>secondPadding: PAD 정책에서 두 번째 시퀀스 대신 사용할 값 (null 허용)</li>
 * </ul>
 *
 * <p>padding 값은 PAD 이외의 정책에서는 사용되지 않습니다.</p>
 *
 * @param policy 길이 불일치 처리 정책
 * @param firstPadding 첫 번째 시퀀스 padding 값
 * @param secondPadding 두 번째 시퀀스 padding 값
 * @param <TFirst> 첫 번째 시퀀스 요소 타입
 * @param <TSecond> 두 번째 시퀀스 요소 타입
 * @author SeqZip Team
 * @since 1.0.0
 */
public record ZipConfig<TFirst, TSecond>(
    ImbalancedPolicy policy,
    TFirst firstPadding,
    TSecond secondPadding
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException policy가 null인 경우
     */
    public ZipConfig {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        // padding은 null 허용
    }

    /**
     * TRUNCATE 설정 생성.
     *
     * @param <TFirst> 첫 번째 시퀀스 요소 타입
     * @param <TSecond> 두 번째 시퀀스 요소 타입
     * @return ZipConfig 인스턴스
     */
    public static <TFirst, TSecond> ZipConfig<TFirst, TSecond> truncate() {
        return new ZipConfig<>(ImbalancedPolicy.TRUNCATE, null, null);
    }

    /**
     * FAIL 설정 생성.
     *
     * @param <TFirst> 첫 번째 시퀀스 요소 타입
     * @param <TSecond> 두 번째 시퀀스 요소 타입
     * @return ZipConfig 인스턴스
     */
    public static <TFirst, TSecond> ZipConfig<TFirst, TSecond> fail() {
        return new ZipConfig<>(ImbalancedPolicy.FAIL, null, null);
    }

    /**
     * null padding을 사용하는 PAD 설정 생성.
     *
     * @param <TFirst> 첫 번째 시퀀스 요소 타입
     * @param <TSecond> 두 번째 시퀀스 요소 타입
     * @return ZipConfig 인스턴스
     */
    public static <TFirst, TSecond> ZipConfig<TFirst, TSecond> pad() {
        return new ZipConfig<>(ImbalancedPolicy.PAD, null, null);
    }

    /**
     * 지정한 padding 값을 사용하는 PAD 설정 생성.
     *
     * @param firstPadding 첫 번째 시퀀스 padding 값
     * @param secondPadding 두 번째 시퀀스 padding 값
     * @param <TFirst> 첫 번째 시퀀스 요소 타입
     * @param <TSecond> 두 번째 시퀀스 요소 타입
     * @return ZipConfig 인스턴스
     */
    public static <TFirst, TSecond> ZipConfig<TFirst, TSecond> pad(TFirst firstPadding, TSecond secondPadding) {
        return new ZipConfig<>(ImbalancedPolicy.PAD, firstPadding, secondPadding);
    }

    /**
     * policy만 변경한 새 인스턴스 생성.
     *
     * @param policy 새로운 정책
     * @return 새 ZipConfig 인스턴스
     */
    public ZipConfig<TFirst, TSecond> withPolicy(ImbalancedPolicy policy) {
        return new ZipConfig<>(policy, this.firstPadding, this.secondPadding);
    }

    /**
     * padding 값만 변경한 새 인스턴스 생성.
     *
     * @param firstPadding 새로운 첫 번째 시퀀스 padding 값
     * @param secondPadding 새로운 두 번째 시퀀스 padding 값
     * @return 새 ZipConfig 인스턴스
     */
    public ZipConfig<TFirst, TSecond> withPadding(TFirst firstPadding, TSecond secondPadding) {
        return new ZipConfig<>(this.policy, firstPadding, secondPadding);
    }
}
