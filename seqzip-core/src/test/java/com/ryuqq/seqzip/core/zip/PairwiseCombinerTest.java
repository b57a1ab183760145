package com.ryuqq.seqzip.core.zip;

import com.ryuqq.seqzip.core.policy.ImbalancedPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * PairwiseCombiner 유닛 테스트.
 *
 * <p>진입점별 정책, 인자 검증, combiner 호출 규칙을 검증합니다:</p>
 * <ul>
 *   <li>zip → TRUNCATE, equiZip → FAIL, zipLongest → PAD</li>
 *   <li>null 인자는 순회 전에 즉시 거부</li>
 *   <li>combiner는 생산되는 요소마다 정확히 한 번, (first, second) 순서로 호출</li>
 * </ul>
 *
 * @author SeqZip Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class PairwiseCombinerTest {

    private static final List<Integer> NUMBERS = List.of(1, 2, 3);
    private static final List<String> LETTERS = List.of("A", "B", "C", "D");

    @Mock
    private BiFunction<Integer, String, String> combiner;

    @Mock
    private Iterable<Integer> untouchedFirst;

    @Mock
    private Iterable<String> untouchedSecond;

    // ============================================================
    // 1. 대표 시나리오: [1,2,3] × ["A","B","C","D"]
    // ============================================================

    @Test
    void zip_짧은_쪽에서_잘림() {
        // when
        List<String> result = PairwiseCombiner.zip(NUMBERS, LETTERS, (n, l) -> n + l).toList();

        // then
        assertThat(result).containsExactly("1A", "2B", "3C");
    }

    @Test
    void equiZip_세_요소_후_FIRST_방향_불일치() {
        // given
        List<String> produced = new ArrayList<>();
        Iterator<String> cursor = PairwiseCombiner.equiZip(NUMBERS, LETTERS, (n, l) -> n + l).iterator();

        // when & then
        assertThatThrownBy(() -> {
            while (cursor.hasNext()) {
                produced.add(cursor.next());
            }
        })
            .isInstanceOf(SequenceLengthMismatchException.class)
            .hasMessage("First sequence ran out before second");
        assertThat(produced).containsExactly("1A", "2B", "3C");
    }

    @Test
    void zipLongest_Integer_기본값_0으로_채움() {
        // when
        List<String> result = PairwiseCombiner.zipLongest(
            NUMBERS, LETTERS, DefaultValues.of(Integer.class), DefaultValues.of(String.class), (n, l) -> n + l
        ).toList();

        // then
        assertThat(result).containsExactly("1A", "2B", "3C", "0D");
    }

    @Test
    void zipLongestWithDefaults_한_번의_호출로_0D() {
        // when
        List<String> result = PairwiseCombiner.zipLongestWithDefaults(
            NUMBERS, LETTERS, Integer.class, String.class, (n, l) -> n + l
        ).toList();

        // then
        assertThat(result).containsExactly("1A", "2B", "3C", "0D");
    }

    @Test
    void 빈_시퀀스_둘이면_모든_진입점이_빈_결과() {
        // given
        List<Integer> noNumbers = List.of();
        List<String> noLetters = List.of();

        // when & then
        assertThat(PairwiseCombiner.zip(noNumbers, noLetters, combiner).toList()).isEmpty();
        assertThat(PairwiseCombiner.equiZip(noNumbers, noLetters, combiner).toList()).isEmpty();
        assertThat(PairwiseCombiner.zipLongest(noNumbers, noLetters, combiner).toList()).isEmpty();
        verifyNoInteractions(combiner);
    }

    // ============================================================
    // 2. 진입점 → 정책
    // ============================================================

    @Test
    void 진입점별_정책() {
        assertThat(PairwiseCombiner.zip(NUMBERS, LETTERS, combiner).policy()).isEqualTo(ImbalancedPolicy.TRUNCATE);
        assertThat(PairwiseCombiner.equiZip(NUMBERS, LETTERS, combiner).policy()).isEqualTo(ImbalancedPolicy.FAIL);
        assertThat(PairwiseCombiner.zipLongest(NUMBERS, LETTERS, combiner).policy()).isEqualTo(ImbalancedPolicy.PAD);
        assertThat(PairwiseCombiner.zipLongest(NUMBERS, LETTERS, 0, "", combiner).policy()).isEqualTo(ImbalancedPolicy.PAD);
    }

    @Test
    void config_진입점은_설정의_정책과_padding을_사용() {
        // given
        ZipConfig<Integer, String> config = ZipConfig.<Integer, String>fail().withPolicy(ImbalancedPolicy.PAD).withPadding(-1, "?");

        // when
        List<String> result = PairwiseCombiner.zip(List.of(1), LETTERS.subList(0, 2), (n, l) -> n + l, config).toList();

        // then
        assertThat(result).containsExactly("1A", "-1B");
    }

    // ============================================================
    // 3. combiner 호출 규칙
    // ============================================================

    @Test
    void combiner_요소마다_한번씩_순서대로_호출() {
        // given
        when(combiner.apply(any(), any())).thenReturn("r");

        // when
        PairwiseCombiner.zip(NUMBERS, LETTERS, combiner).toList();

        // then
        InOrder inOrder = inOrder(combiner);
        inOrder.verify(combiner).apply(1, "A");
        inOrder.verify(combiner).apply(2, "B");
        inOrder.verify(combiner).apply(3, "C");
        verifyNoMoreInteractions(combiner);
    }

    @Test
    void combiner_padding_위치에서_padding_인자를_받음() {
        // given
        when(combiner.apply(any(), any())).thenReturn("r");

        // when
        PairwiseCombiner.zipLongest(List.of(1, 2), List.of("A"), 0, "pad", combiner).toList();

        // then
        verify(combiner).apply(1, "A");
        verify(combiner).apply(2, "pad");
        verifyNoMoreInteractions(combiner);
    }

    @Test
    void combiner_null_결과도_요소로_생산() {
        // given
        when(combiner.apply(any(), any())).thenReturn(null);

        // when
        List<String> result = PairwiseCombiner.zip(List.of(1, 2), List.of("A", "B"), combiner).toList();

        // then
        assertThat(result).hasSize(2).containsOnlyNulls();
    }

    // ============================================================
    // 4. 인자 검증 (순회 전 즉시)
    // ============================================================

    @Test
    void zip_null_first는_즉시_거부() {
        assertThatThrownBy(() -> PairwiseCombiner.zip(null, untouchedSecond, combiner))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("first cannot be null");
        verifyNoInteractions(untouchedSecond, combiner);
    }

    @Test
    void equiZip_null_second는_즉시_거부() {
        assertThatThrownBy(() -> PairwiseCombiner.equiZip(untouchedFirst, null, combiner))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("second cannot be null");
        verifyNoInteractions(untouchedFirst, combiner);
    }

    @Test
    void zipLongest_null_combiner는_즉시_거부() {
        assertThatThrownBy(() -> PairwiseCombiner.zipLongest(untouchedFirst, untouchedSecond, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("combiner cannot be null");
        verifyNoInteractions(untouchedFirst, untouchedSecond);
    }

    @Test
    void zipLongest_padding_버전도_null_인자_거부_단_padding은_null_허용() {
        assertThatThrownBy(() -> PairwiseCombiner.zipLongest(null, untouchedSecond, 0, "", combiner))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("first cannot be null");
        assertThat(PairwiseCombiner.zipLongest(untouchedFirst, untouchedSecond, null, null, combiner)).isNotNull();
        verifyNoInteractions(untouchedFirst, untouchedSecond, combiner);
    }

    @Test
    void zipLongestWithDefaults_null_타입은_즉시_거부() {
        assertThatThrownBy(() -> PairwiseCombiner.zipLongestWithDefaults(untouchedFirst, untouchedSecond, null, String.class, combiner))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("firstType cannot be null");
        assertThatThrownBy(() -> PairwiseCombiner.zipLongestWithDefaults(untouchedFirst, untouchedSecond, Integer.class, String.class, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("combiner cannot be null");
        verifyNoInteractions(untouchedFirst, untouchedSecond, combiner);
    }

    @Test
    void config_null은_즉시_거부() {
        assertThatThrownBy(() -> PairwiseCombiner.zip(untouchedFirst, untouchedSecond, combiner, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("config cannot be null");
        verifyNoInteractions(untouchedFirst, untouchedSecond);
    }

    @Test
    void 시퀀스_생성만으로는_입력을_순회하지_않음() {
        // when
        PairwiseCombiner.zip(untouchedFirst, untouchedSecond, combiner).iterator();

        // then
        verifyNoInteractions(untouchedFirst, untouchedSecond, combiner);
    }
}
