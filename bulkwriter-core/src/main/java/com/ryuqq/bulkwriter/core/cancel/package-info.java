/**
 * Cooperative cancellation shared by the throttler and the retry loops.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
package com.ryuqq.bulkwriter.core.cancel;
