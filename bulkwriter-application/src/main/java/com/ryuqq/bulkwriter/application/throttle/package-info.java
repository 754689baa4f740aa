/**
 * Application port for bounded-parallel, rate-limited task scheduling.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
package com.ryuqq.bulkwriter.application.throttle;
