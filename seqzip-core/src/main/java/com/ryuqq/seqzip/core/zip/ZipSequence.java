package com.ryuqq.seqzip.core.zip;

import com.ryuqq.seqzip.core.cursor.CloseableCursor;
import com.ryuqq.seqzip.core.policy.ImbalancedPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 두 입력 시퀀스를 결합한 지연(lazy) 결과 시퀀스.
 *
 * <p>{@link #iterator()}를 호출할 때마다 독립된 순회가 시작되며, 각 순회는 입력 시퀀스마다
 * 자신만의 커서를 가집니다. 따라서 여러 번 순회하려면 입력 시퀀스도 여러 번 순회 가능해야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ZipSequence&lt;String&gt; zipped = PairwiseCombiner.zip(numbers, letters, (n, l) -&gt; n + l);
 *
 * try (Stream&lt;String&gt; stream = zipped.stream()) {
 *     String first = stream.findFirst().orElseThrow();
 * }
 * </pre>
 *
 * @param <TResult> 결과 요소 타입
 * @author SeqZip Team
 * @since 1.0.0
 */
public final class ZipSequence<TResult> implements Iterable<TResult> {

    private final ImbalancedPolicy policy;
    private final Supplier<? extends CloseableCursor<TResult>> cursorFactory;

    ZipSequence(ImbalancedPolicy policy, Supplier<? extends CloseableCursor<TResult>> cursorFactory) {
        this.policy = policy;
        this.cursorFactory = cursorFactory;
    }

    /**
     * 새 순회 시작.
     *
     * <p>입력 커서는 반환된 커서에 첫 요소를 요청할 때 획득합니다.
     * 끝까지 소비하지 않는 경우 {@link CloseableCursor#close()}를 호출해야 합니다.</p>
     *
     * @return 새 커서
     */
    @Override
    public CloseableCursor<TResult> iterator() {
        return cursorFactory.get();
    }

    /**
     * 새 순회를 순차 Stream으로 노출.
     *
     * <p>Stream을 닫으면 입력 커서가 해제됩니다 (try-with-resources 권장).</p>
     *
     * @return 순차 Stream
     */
    public Stream<TResult> stream() {
        CloseableCursor<TResult> cursor = iterator();
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(cursor, Spliterator.ORDERED), false)
            .onClose(cursor::close);
    }

    /**
     * 전체 결과를 리스트로 수집.
     *
     * @return 수정 불가 리스트 (null 요소 허용)
     * @throws SequenceLengthMismatchException FAIL 정책에서 길이가 다른 경우
     */
    public List<TResult> toList() {
        List<TResult> results = new ArrayList<>();
        try (CloseableCursor<TResult> cursor = iterator()) {
            while (cursor.hasNext()) {
                results.add(cursor.next());
            }
        }
        return Collections.unmodifiableList(results);
    }

    /**
     * 길이 불일치 처리 정책 조회.
     *
     * @return 정책
     */
    public ImbalancedPolicy policy() {
        return policy;
    }

    @Override
    public String toString() {
        return "ZipSequence{policy=" + policy + '}';
    }
}
