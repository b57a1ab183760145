/**
 * Zip operations over two sequences.
 *
 * <p>{@link com.ryuqq.seqzip.core.zip.PairwiseCombiner} pairs elements of two
 * {@link java.lang.Iterable}s by position and combines each pair with a caller-supplied
 * {@link java.util.function.BiFunction}. The result is a lazy
 * {@link com.ryuqq.seqzip.core.zip.ZipSequence}; every traversal runs one
 * {@code ZipCursor} that owns a fresh cursor over each input.</p>
 *
 * <h2>Entry Points</h2>
 * <pre>
 * zip(first, second, combiner)          TRUNCATE
 * equiZip(first, second, combiner)      FAIL
 * zipLongest(first, second, combiner)   PAD (null padding)
 * zipLongest(first, second, p1, p2, combiner)   PAD (explicit padding)
 * zipLongestWithDefaults(first, second, Integer.class, String.class, combiner)   PAD (type defaults)
 * zip(first, second, combiner, config)  any policy
 * </pre>
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li><strong>Eager validation:</strong> null arguments fail before any cursor is acquired</li>
 *   <li><strong>Laziness:</strong> k requested elements advance each input at most k times</li>
 *   <li><strong>Release:</strong> input cursors implementing AutoCloseable are closed on exhaustion,
 *       failure, combiner exceptions and early close</li>
 *   <li><strong>Transparency:</strong> combiner and input exceptions propagate unchanged</li>
 * </ul>
 *
 * @since 1.0.0
 * @author SeqZip Team
 */
package com.ryuqq.seqzip.core.zip;
