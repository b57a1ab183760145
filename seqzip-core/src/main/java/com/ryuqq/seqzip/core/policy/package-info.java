/**
 * Imbalance policy package.
 *
 * <p>{@link com.ryuqq.seqzip.core.policy.ImbalancedPolicy} selects what a zip traversal does
 * when one input sequence ends before the other:</p>
 *
 * <pre>
 * TRUNCATE  stop at the shorter sequence
 * PAD       continue to the longer sequence, pad the missing side
 * FAIL      throw SequenceLengthMismatchException at the first imbalance
 * </pre>
 *
 * @since 1.0.0
 * @author SeqZip Team
 */
package com.ryuqq.seqzip.core.policy;
