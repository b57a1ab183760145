package com.ryuqq.seqzip.core.policy;

/**
 * 두 입력 시퀀스의 길이가 다를 때의 처리 정책.
 *
 * <p><strong>정책별 동작:</strong></p>
 * <ul>
 *   <li>TRUNCATE: 짧은 쪽이 끝나는 즉시 결과 시퀀스 종료 (오류 없음)</li>
 *   <li>PAD: 긴 쪽이 끝날 때까지 계속, 짧은 쪽은 padding 값으로 채움</li>
 *   <li>FAIL: 한쪽만 끝난 것이 감지되는 시점에 예외 발생</li>
 * </ul>
 *
 * <p>두 시퀀스가 동시에 끝나면 정책과 무관하게 정상 종료합니다.</p>
 *
 * @author SeqZip Team
 * @since 1.0.0
 */
public enum ImbalancedPolicy {

    /**
     * 짧은 시퀀스 기준으로 잘라냄.
     */
    TRUNCATE,

    /**
     * 긴 시퀀스 기준으로 padding.
     */
    PAD,

    /**
     * 길이 불일치 시 실패.
     */
    FAIL
}
