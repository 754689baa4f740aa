/**
 * Local pre-flight validation and normalization of write items.
 *
 * <p>{@link com.ryuqq.bulkwriter.core.sanitation.RequestCleaner} applies a resource's
 * {@link com.ryuqq.bulkwriter.core.sanitation.Sanitizer} and
 * {@link com.ryuqq.bulkwriter.core.sanitation.DistinctRule}s under a
 * {@link com.ryuqq.bulkwriter.core.policy.SanitationMode}.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
package com.ryuqq.bulkwriter.core.sanitation;
