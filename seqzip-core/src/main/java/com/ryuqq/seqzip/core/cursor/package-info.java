/**
 * Cursor abstraction and release handling.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.seqzip.core.cursor.CloseableCursor} - Iterator that can be closed early</li>
 *   <li>{@link com.ryuqq.seqzip.core.cursor.Cursors} - Releases input cursors that implement AutoCloseable</li>
 *   <li>{@link com.ryuqq.seqzip.core.cursor.CursorReleaseException} - Release failure with no other error in flight</li>
 * </ul>
 *
 * @since 1.0.0
 * @author SeqZip Team
 */
package com.ryuqq.seqzip.core.cursor;
