/**
 * Event write model, field limits and write binding.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
package com.ryuqq.bulkwriter.application.resource.event;
