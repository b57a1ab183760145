/**
 * Shared argument validation.
 *
 * @since 1.0.0
 * @author SeqZip Team
 */
package com.ryuqq.seqzip.core.support;
