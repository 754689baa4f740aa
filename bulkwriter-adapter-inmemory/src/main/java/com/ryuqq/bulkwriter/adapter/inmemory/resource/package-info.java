/**
 * In-memory remote resources (events, assets, time series, data-model instances) that reproduce
 * the remote API's failure payloads, with scripted failure injection for tests.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
package com.ryuqq.bulkwriter.adapter.inmemory.resource;
