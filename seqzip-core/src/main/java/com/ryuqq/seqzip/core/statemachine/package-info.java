/**
 * Traversal state machine package.
 *
 * <p>Every traversal of a zipped sequence owns one state value that only moves forward.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.seqzip.core.statemachine.TraversalState} - Traversal lifecycle states; each state
 *   knows its own successors and refuses any other move</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * NOT_STARTED → RUNNING (first element requested)
 * RUNNING → EXHAUSTED (natural end)
 * RUNNING → FAILED (length mismatch under FAIL policy)
 *
 * Forbidden:
 * - EXHAUSTED → * (terminal state)
 * - FAILED → * (terminal state)
 * </pre>
 *
 * @since 1.0.0
 * @author SeqZip Team
 */
package com.ryuqq.seqzip.core.statemachine;
