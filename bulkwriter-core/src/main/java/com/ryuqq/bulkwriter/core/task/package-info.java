/**
 * Per-task bookkeeping records produced by the task throttler.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
package com.ryuqq.bulkwriter.core.task;
