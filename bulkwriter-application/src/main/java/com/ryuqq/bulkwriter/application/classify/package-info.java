/**
 * Error Classifier: maps raw remote failures to structured, resource-tagged errors.
 *
 * <p>{@link com.ryuqq.bulkwriter.application.classify.ErrorClassifier} dispatches on
 * {@link com.ryuqq.bulkwriter.core.model.RequestType} to one
 * {@link com.ryuqq.bulkwriter.application.classify.FailureParser} per request kind.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
package com.ryuqq.bulkwriter.application.classify;
