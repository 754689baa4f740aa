/**
 * Batch Cleaner: removes the items implicated by a classified error so the rest can be retried.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
package com.ryuqq.bulkwriter.application.clean;
