/**
 * Structured error model.
 *
 * <p>{@link com.ryuqq.bulkwriter.core.error.ClassifiedError} is the typed interpretation of a remote
 * or local failure. Exceptions in this package are only used where the caller explicitly asks
 * for failures to be thrown.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
package com.ryuqq.bulkwriter.core.error;
