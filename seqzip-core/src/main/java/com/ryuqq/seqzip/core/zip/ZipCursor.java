package com.ryuqq.seqzip.core.zip;

import com.ryuqq.seqzip.core.cursor.CloseableCursor;
import com.ryuqq.seqzip.core.cursor.Cursors;
import com.ryuqq.seqzip.core.statemachine.TraversalState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * 두 입력 시퀀스를 lockstep으로 순회하는 커서 (순회 1회당 1개).
 *
 * <p><strong>처리 흐름 (요소 1개당):</strong></p>
 * <pre>
 * 1. first 전진
 *    a. 요소 있음 → second 전진
 *       - 요소 있음 → combine(a, b)
 *       - 없음 → 정책 적용 (SECOND가 먼저 끝남)
 *    b. 요소 없음 → second에 남은 요소가 있는지 확인
 *       - 없음 → 정상 종료 (정책 무관)
 *       - 있음 → 정책 적용 (FIRST가 먼저 끝남)
 * 2. 정책 적용
 *    - TRUNCATE → 종료
 *    - FAIL → SequenceLengthMismatchException
 *    - PAD → 남은 쪽이 끝날 때까지 combine(값, padding)
 * </pre>
 *
 * <p><strong>지연 실행:</strong> 입력 커서는 첫 요청 시점에 획득하며,
 * {@link #hasNext()}는 최대 1개의 요소만 미리 계산해 보관합니다.</p>
 *
 * <p><strong>자원 해제:</strong> 종료 상태 도달, 예외 전파, {@link #close()} 중
 * 먼저 일어나는 시점에 두 입력 커서를 해제합니다.</p>
 *
 * @param <TFirst> 첫 번째 시퀀스 요소 타입
 * @param <TSecond> 두 번째 시퀀스 요소 타입
 * @param <TResult> 결과 요소 타입
 * @author SeqZip Team
 * @since 1.0.0
 */
final class ZipCursor<TFirst, TSecond, TResult> implements CloseableCursor<TResult> {

    private static final Logger log = LoggerFactory.getLogger(ZipCursor.class);

    private final Iterable<? extends TFirst> first;
    private final Iterable<? extends TSecond> second;
    private final BiFunction<? super TFirst, ? super TSecond, ? extends TResult> combiner;
    private final ZipConfig<TFirst, TSecond> config;

    private Iterator<? extends TFirst> firstCursor;
    private Iterator<? extends TSecond> secondCursor;
    private TraversalState state = TraversalState.NOT_STARTED;
    private ExhaustedSide paddedSide;
    private boolean closed;

    private boolean hasPending;
    private TResult pending;
    private long produced;

    ZipCursor(
        Iterable<? extends TFirst> first,
        Iterable<? extends TSecond> second,
        BiFunction<? super TFirst, ? super TSecond, ? extends TResult> combiner,
        ZipConfig<TFirst, TSecond> config
    ) {
        this.first = first;
        this.second = second;
        this.combiner = combiner;
        this.config = config;
    }

    @Override
    public boolean hasNext() {
        if (hasPending) {
            return true;
        }
        if (closed || state.isTerminal()) {
            return false;
        }

        try {
            if (state == TraversalState.NOT_STARTED) {
                start();
            }
            computeNext();
        } catch (RuntimeException | Error e) {
            closed = true;
            release(e);
            throw e;
        }
        return hasPending;
    }

    @Override
    public TResult next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more zipped elements (state: " + state + ")");
        }
        TResult result = pending;
        pending = null;
        hasPending = false;
        return result;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        pending = null;
        hasPending = false;

        if (state == TraversalState.RUNNING) {
            log.debug("Zip traversal closed by consumer after {} elements", produced);
        }
        release(null);
    }

    /**
     * 현재 순회 상태 조회.
     *
     * @return 순회 상태
     */
    TraversalState state() {
        return state;
    }

    private void start() {
        firstCursor = first.iterator();
        secondCursor = second.iterator();
        state = state.moveTo(TraversalState.RUNNING);
        log.debug("Zip traversal started (policy: {})", config.policy());
    }

    private void computeNext() {
        // 한쪽이 이미 끝난 PAD 구간: 남은 쪽만 전진
        if (paddedSide == ExhaustedSide.SECOND) {
            if (firstCursor.hasNext()) {
                emit(combiner.apply(firstCursor.next(), config.secondPadding()));
            } else {
                finish();
            }
            return;
        }
        if (paddedSide == ExhaustedSide.FIRST) {
            if (secondCursor.hasNext()) {
                emit(combiner.apply(config.firstPadding(), secondCursor.next()));
            } else {
                finish();
            }
            return;
        }

        if (firstCursor.hasNext()) {
            TFirst a = firstCursor.next();
            if (secondCursor.hasNext()) {
                emit(combiner.apply(a, secondCursor.next()));
            } else {
                onImbalance(ExhaustedSide.SECOND, () -> combiner.apply(a, config.secondPadding()));
            }
        } else if (secondCursor.hasNext()) {
            onImbalance(ExhaustedSide.FIRST, () -> combiner.apply(config.firstPadding(), secondCursor.next()));
        } else {
            finish();
        }
    }

    private void onImbalance(ExhaustedSide exhaustedSide, Supplier<? extends TResult> padded) {
        switch (config.policy()) {
            case TRUNCATE -> finish();
            case FAIL -> fail(exhaustedSide);
            case PAD -> {
                log.debug("{} sequence exhausted after {} elements, padding", exhaustedSide, produced);
                paddedSide = exhaustedSide;
                emit(padded.get());
            }
        }
    }

    private void emit(TResult result) {
        pending = result;
        hasPending = true;
        produced++;
    }

    private void finish() {
        state = state.moveTo(TraversalState.EXHAUSTED);
        log.debug("Zip traversal exhausted after {} elements (policy: {})", produced, config.policy());
        release(null);
    }

    private void fail(ExhaustedSide exhaustedSide) {
        state = state.moveTo(TraversalState.FAILED);
        log.debug("Zip traversal failed after {} elements: {}", produced, exhaustedSide.message());
        throw new SequenceLengthMismatchException(exhaustedSide);
    }

    private void release(Throwable primary) {
        Iterator<?> firstToRelease = firstCursor;
        Iterator<?> secondToRelease = secondCursor;
        firstCursor = null;
        secondCursor = null;

        // 획득의 역순으로 해제
        Cursors.releaseAll(primary, secondToRelease, firstToRelease);
    }
}
