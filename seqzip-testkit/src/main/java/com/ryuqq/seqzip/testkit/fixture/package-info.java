/**
 * Instrumented input sequences for zip tests.
 *
 * <ul>
 *   <li>{@link com.ryuqq.seqzip.testkit.fixture.TrackingSequence} - Counts cursor acquisition, advances and releases</li>
 *   <li>{@link com.ryuqq.seqzip.testkit.fixture.SinglePassSequence} - Refuses a second traversal</li>
 * </ul>
 *
 * @since 1.0.0
 * @author SeqZip Team
 */
package com.ryuqq.seqzip.testkit.fixture;
