/**
 * Runtime adapters: the task throttler, chunked write orchestration with partial-failure retry,
 * chunking helpers, backoff timing and atomic read-modify-write upserts.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
package com.ryuqq.bulkwriter.adapter.runner;
