package com.ryuqq.bulkwriter.testkit.contract;

import com.ryuqq.bulkwriter.application.resource.event.EventResources;
import com.ryuqq.bulkwriter.core.policy.RetryMode;
import com.ryuqq.bulkwriter.core.spi.RemoteFailure;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Scenario C: cancellation of a write that would otherwise retry forever.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>ON_FATAL with a remote that always answers 503: cancel after 200ms → CancellationException</li>
 *   <li>Token cancelled before the call → CancellationException, no remote call</li>
 *   <li>Cancel during a slow create → CancellationException</li>
 *   <li>Many writes on one token leave no cancel callbacks behind</li>
 * </ul>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
class CancellationContractTest extends AbstractContractTest {

    @Test
    void testEnsureExists_FatalRetryForever_CancelStopsLoop() {
        // Given: every create fails with 503
        events.createFailures().failAlways(() -> new RemoteFailure(503, "Service Unavailable"));
        Thread canceller = new Thread(() -> {
            sleep(200);
            token.cancel();
        });

        // When
        long startNanos = System.nanoTime();
        canceller.start();
        assertThrows(CancellationException.class, () -> writer.ensureExists(
            events(5, "evt"), EventResources.binding(), events, options().withRetryMode(RetryMode.ON_FATAL), token));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();

        // Then: retried the same batch several times, stopped promptly after cancel
        assertTrue(events.getCreateCalls() >= 2,
            "Expected several retries but got " + events.getCreateCalls());
        assertTrue(events.getCreateBatchSizes().stream().allMatch(size -> size == 5));
        assertTrue(elapsedMs < 5_000, "Cancellation took too long: " + elapsedMs + "ms");
        assertEquals(0, events.size());
    }

    @Test
    void testEnsureExists_AlreadyCancelled_NoRemoteCall() {
        // Given
        token.cancel();

        // When & Then
        assertThrows(CancellationException.class, () -> writer.ensureExists(
            events(5, "evt"), EventResources.binding(), events, options(), token));
        assertEquals(0, events.getCreateCalls());
    }

    @Test
    void testEnsureExists_CancelDuringSlowCreate_Propagates() {
        // Given: creates take far longer than the test
        events.setCreateLatency(Duration.ofSeconds(30));
        Thread canceller = new Thread(() -> {
            sleep(100);
            token.cancel();
        });

        // When
        canceller.start();
        assertThrows(CancellationException.class, () -> writer.ensureExists(
            events(30, "evt"), EventResources.binding(), events, options().withChunkSize(10), token));

        // Then
        assertEquals(0, events.size());
    }

    @Test
    void testGetOrCreate_AlreadyCancelled_NoRemoteCall() {
        // Given
        token.cancel();

        // When & Then
        assertThrows(CancellationException.class, () -> writer.getOrCreate(
            externalIds("a", "b"),
            missing -> { throw new AssertionError("builder must not run"); },
            EventResources.binding(), events, options(), token));
        assertEquals(0, events.getRetrieveCalls());
    }

    @Test
    void testEnsureExists_ManyCallsOnOneToken_NoCallbacksRetained() {
        // Given: one long-lived token shared by many writes
        int calls = 200;

        // When
        for (int i = 0; i < calls; i++) {
            writer.ensureExists(events(1, "evt" + i), EventResources.binding(), events, options(), token);
        }

        // Then
        assertEquals(calls, events.size());
        assertEquals(0, token.getCallbackCount());
    }
}
