/**
 * Data-model instance write model, identifier limits and upsert binding.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
package com.ryuqq.bulkwriter.application.resource.instance;
