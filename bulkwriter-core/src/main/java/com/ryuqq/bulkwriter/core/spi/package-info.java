/**
 * Service Provider Interface for the remote write boundary.
 *
 * <p>This package contains the interfaces the HTTP transport (or any other remote client)
 * implements so the retry engine can create, upsert and retrieve items.</p>
 *
 * <h2>Capabilities</h2>
 * <ul>
 *   <li>{@link com.ryuqq.bulkwriter.core.spi.Identifiable} - items exposing internal/external ids</li>
 *   <li>{@link com.ryuqq.bulkwriter.core.spi.RetrieveCapable} - lookup by identity</li>
 *   <li>{@link com.ryuqq.bulkwriter.core.spi.CreateCapable} - atomic batch create</li>
 *   <li>{@link com.ryuqq.bulkwriter.core.spi.UpsertCapable} - batch create-or-update</li>
 * </ul>
 *
 * <p>All calls are blocking. Failures surface as {@link com.ryuqq.bulkwriter.core.spi.RemoteFailure}.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
package com.ryuqq.bulkwriter.core.spi;
