/**
 * Contract test support for zip operations.
 *
 * <p>{@link com.ryuqq.seqzip.testkit.contract.AbstractZipContractTest} gives each contract test a
 * fresh pair of tracking sequences and fails any test that leaves an input cursor open.</p>
 *
 * <h2>Contract Scenarios</h2>
 * <ul>
 *   <li>Equal lengths: every policy yields the same elements</li>
 *   <li>TRUNCATE: output length is the shorter input length</li>
 *   <li>FAIL: shorter length elements, then a length mismatch naming the exhausted side</li>
 *   <li>PAD: output length is the longer input length, missing side padded</li>
 *   <li>Laziness and release on every exit path</li>
 * </ul>
 *
 * @since 1.0.0
 * @author SeqZip Team
 */
package com.ryuqq.seqzip.testkit.contract;
