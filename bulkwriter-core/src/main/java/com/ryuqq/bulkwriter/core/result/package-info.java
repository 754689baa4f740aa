/**
 * Result accumulation for chunked writes.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
package com.ryuqq.bulkwriter.core.result;
