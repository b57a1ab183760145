package com.ryuqq.seqzip.testkit.contract;

import com.ryuqq.seqzip.core.cursor.CloseableCursor;
import com.ryuqq.seqzip.core.zip.ExhaustedSide;
import com.ryuqq.seqzip.core.zip.PairwiseCombiner;
import com.ryuqq.seqzip.core.zip.SequenceLengthMismatchException;
import com.ryuqq.seqzip.testkit.fixture.TrackingSequence;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: FAIL policy (equiZip).
 *
 * <p>For inputs of length m ≠ n exactly min(m, n) elements are produced, then a
 * {@link SequenceLengthMismatchException} names the sequence that ran out first.</p>
 *
 * @author SeqZip Team
 * @since 1.0.0
 */
class EquiZipContractTest extends AbstractZipContractTest {

    @Test
    void testEquiZip_FirstShorter_FailsAfterThreeWithFirstSide() {
        // Given
        List<String> produced = new ArrayList<>();

        // When
        RuntimeException failure = drainUntilFailure(
                PairwiseCombiner.equiZip(numbers, letters, concat).iterator(), produced);

        // Then
        assertEquals(List.of("1A", "2B", "3C"), produced);
        SequenceLengthMismatchException mismatch = assertInstanceOf(SequenceLengthMismatchException.class, failure);
        assertEquals(ExhaustedSide.FIRST, mismatch.exhaustedSide());
        assertEquals("First sequence ran out before second", mismatch.getMessage());
        assertAllReleased(numbers, letters);
    }

    @Test
    void testEquiZip_SecondShorter_FailsAfterTwoWithSecondSide() {
        // Given
        letters = TrackingSequence.of("A", "B");
        List<String> produced = new ArrayList<>();

        // When
        RuntimeException failure = drainUntilFailure(
                PairwiseCombiner.equiZip(numbers, letters, concat).iterator(), produced);

        // Then
        assertEquals(List.of("1A", "2B"), produced);
        SequenceLengthMismatchException mismatch = assertInstanceOf(SequenceLengthMismatchException.class, failure);
        assertEquals(ExhaustedSide.SECOND, mismatch.exhaustedSide());
        assertEquals("Second sequence ran out before first", mismatch.getMessage());
        assertAllReleased(numbers, letters);
    }

    @Test
    void testEquiZip_AfterFailure_CannotResume() {
        // Given
        CloseableCursor<String> cursor = PairwiseCombiner.equiZip(numbers, letters, concat).iterator();
        drainUntilFailure(cursor, new ArrayList<>());

        // When & Then
        assertFalse(cursor.hasNext());
        assertThrows(NoSuchElementException.class, cursor::next);
        assertEquals(3, combinerCalls.size());
    }

    @Test
    void testEquiZip_IsAnIllegalStateException() {
        // When & Then
        assertThrows(IllegalStateException.class,
                () -> PairwiseCombiner.equiZip(numbers, letters, concat).toList());
        assertAllReleased(numbers, letters);
    }
}
