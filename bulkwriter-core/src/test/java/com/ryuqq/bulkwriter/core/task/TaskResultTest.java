package com.ryuqq.bulkwriter.core.task;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TaskResult 테스트.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
class TaskResultTest {

    @Test
    void complete_Success_SetsCompletedAtWithoutException() {
        // Given
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        TaskResult result = new TaskResult(3, start, 0L);

        // When
        result.complete(start.plusMillis(250), null);

        // Then
        assertTrue(result.isCompleted());
        assertFalse(result.isFailed());
        assertEquals(Duration.ofMillis(250), result.getElapsed());
        assertEquals(3, result.getIndex());
    }

    @Test
    void complete_Failure_RecordsException() {
        // Given
        TaskResult result = new TaskResult(0, Instant.now(), System.nanoTime());
        IllegalStateException failure = new IllegalStateException("boom");

        // When
        result.complete(Instant.now(), failure);

        // Then
        assertTrue(result.isFailed());
        assertSame(failure, result.getException());
    }

    @Test
    void complete_Twice_ThrowsException() {
        // Given
        TaskResult result = new TaskResult(0, Instant.now(), System.nanoTime());
        result.complete(Instant.now(), null);

        // When & Then
        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> result.complete(Instant.now(), null));
        assertTrue(exception.getMessage().contains("already completed"));
    }

    @Test
    void elapsed_NotCompleted_IsNull() {
        TaskResult result = new TaskResult(0, Instant.now(), System.nanoTime());

        assertNull(result.getElapsed());
        assertNull(result.getCompletedAt());
    }
}
