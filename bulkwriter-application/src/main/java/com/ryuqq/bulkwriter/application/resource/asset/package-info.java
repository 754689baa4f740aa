/**
 * Asset write model, field limits, unknown-parent completion and write binding.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
package com.ryuqq.bulkwriter.application.resource.asset;
