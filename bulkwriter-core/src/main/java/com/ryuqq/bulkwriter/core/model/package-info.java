/**
 * Value types shared by every layer: identities, resource tags, error kinds and request types.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
package com.ryuqq.bulkwriter.core.model;
