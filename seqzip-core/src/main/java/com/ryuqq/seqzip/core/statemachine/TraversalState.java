package com.ryuqq.seqzip.core.statemachine;

import com.ryuqq.seqzip.core.support.Arguments;

import java.util.Set;

/**
 * Zip 순회(traversal) 한 번의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * NOT_STARTED
 *    │
 *    ▼ (첫 요소 요청, 커서 획득)
 * RUNNING
 *    │
 *    ├─► EXHAUSTED (양쪽 동시 종료, TRUNCATE 종료, PAD 종료)
 *    │
 *    └─► FAILED (FAIL 정책에서 길이 불일치 감지)
 *
 * 금지된 전이:
 * - EXHAUSTED → * ❌
 * - FAILED → * ❌
 * - NOT_STARTED → EXHAUSTED / FAILED ❌
 * </pre>
 *
 * @author SeqZip Team
 * @since 1.0.0
 */
public enum TraversalState {

    /**
     * 아직 요소가 요청되지 않음 (입력 커서 미획득).
     */
    NOT_STARTED,

    /**
     * 순회 중 (입력 커서 보유).
     */
    RUNNING,

    /**
     * 정상 종료.
     */
    EXHAUSTED,

    /**
     * 길이 불일치로 실패 (재개 불가).
     */
    FAILED;

    /**
     * 이 상태에서 바로 이동할 수 있는 다음 상태들.
     *
     * @return 허용된 다음 상태 (종료 상태는 빈 집합)
     */
    public Set<TraversalState> successors() {
        return switch (this) {
            case NOT_STARTED -> Set.of(RUNNING);
            case RUNNING -> Set.of(EXHAUSTED, FAILED);
            case EXHAUSTED, FAILED -> Set.of();
        };
    }

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(EXHAUSTED, FAILED)에서는 입력 커서가 이미 해제되어 있으며
     * 더 이상 요소를 생산하지 않습니다.</p>
     *
     * @return 다음 상태가 없는 경우 true
     */
    public boolean isTerminal() {
        return successors().isEmpty();
    }

    /**
     * 다음 상태로 이동.
     *
     * @param next 이동할 상태
     * @return next
     * @throws IllegalArgumentException next가 null인 경우
     * @throws IllegalStateException next가 {@link #successors()}에 없는 경우
     */
    public TraversalState moveTo(TraversalState next) {
        Arguments.requireNonNull(next, "next");
        if (!successors().contains(next)) {
            throw new IllegalStateException(
                "Traversal cannot move from " + this + " to " + next + " (allowed: " + successors() + ")"
            );
        }
        return next;
    }
}
