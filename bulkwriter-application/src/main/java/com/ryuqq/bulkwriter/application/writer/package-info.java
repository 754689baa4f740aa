/**
 * Application port for chunked, retrying bulk writes.
 *
 * <h2>Key types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.bulkwriter.application.writer.BulkWriter} - get-or-create / ensure-exists / upsert</li>
 *   <li>{@link com.ryuqq.bulkwriter.application.writer.ResourceBinding} - per-resource accessors, sanitation, completion</li>
 *   <li>{@link com.ryuqq.bulkwriter.application.writer.WriteOptions} - chunking, throttling and retry settings</li>
 * </ul>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
package com.ryuqq.bulkwriter.application.writer;
