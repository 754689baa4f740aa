package com.ryuqq.bulkwriter.testkit.contract;

import com.ryuqq.bulkwriter.application.resource.event.Event;
import com.ryuqq.bulkwriter.application.resource.event.EventResources;
import com.ryuqq.bulkwriter.application.resource.event.EventWrite;
import com.ryuqq.bulkwriter.core.result.BatchResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Scenario A: large input split into chunks.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>2500 items with chunk size 1000 → three create calls of 1000, 1000 and 500</li>
 *   <li>Every item is written exactly once</li>
 *   <li>Progress is reported once per chunk</li>
 *   <li>Concurrent chunk writes never exceed the throttle size</li>
 * </ul>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
class ChunkingContractTest extends AbstractContractTest {

    @Test
    void testEnsureExists_2500Items_ThreeChunks() {
        // Given
        List<EventWrite> input = events(2500, "evt");

        // When
        BatchResult<Event, EventWrite> result = writer.ensureExists(
            input, EventResources.binding(), events, options().withChunkSize(1000), token);

        // Then: three create calls, 1000 + 1000 + 500
        List<Integer> sizes = new ArrayList<>(events.getCreateBatchSizes());
        Collections.sort(sizes);
        assertEquals(List.of(500, 1000, 1000), sizes);

        // Then: every item written once
        assertNoErrors(result);
        assertEquals(2500, result.results().size());
        Set<String> written = result.results().stream().map(Event::externalId).collect(Collectors.toSet());
        assertEquals(2500, written.size());
        assertEquals(2500, events.size());
    }

    @Test
    void testEnsureExists_ResultsInChunkOrder() {
        // Given
        List<EventWrite> input = events(25, "ord");

        // When
        BatchResult<Event, EventWrite> result = writer.ensureExists(
            input, EventResources.binding(), events, options().withChunkSize(10).withThrottleSize(3), token);

        // Then: chunk results are merged in submission order
        List<String> expected = input.stream().map(EventWrite::externalId).toList();
        List<String> actual = result.results().stream().map(Event::externalId).toList();
        assertEquals(expected, actual);
    }

    @Test
    void testEnsureExists_ProgressReportedPerChunk() {
        // Given
        List<int[]> progress = new CopyOnWriteArrayList<>();

        // When
        writer.ensureExists(events(35, "prg"), EventResources.binding(), events,
            options().withChunkSize(10).withProgressListener((done, total) -> progress.add(new int[]{done, total})),
            token);

        // Then
        assertEquals(4, progress.size());
        assertTrue(progress.stream().allMatch(p -> p[1] == 4));
        Set<Integer> completedCounts = progress.stream().map(p -> p[0]).collect(Collectors.toSet());
        assertEquals(Set.of(1, 2, 3, 4), completedCounts);
    }

    @Test
    void testEnsureExists_ParallelismBoundedByThrottleSize() {
        // Given: slow creates so chunks overlap
        events.setCreateLatency(Duration.ofMillis(50));

        // When
        BatchResult<Event, EventWrite> result = writer.ensureExists(
            events(100, "par"), EventResources.binding(), events,
            options().withChunkSize(10).withThrottleSize(3), token);

        // Then
        assertNoErrors(result);
        assertEquals(100, result.results().size());
        assertTrue(events.getMaxConcurrentCreates() <= 3,
            "Concurrent creates should not exceed throttle size, was " + events.getMaxConcurrentCreates());
    }

    @Test
    void testEnsureExists_EmptyInput_NoCalls() {
        // When
        BatchResult<Event, EventWrite> result = writer.ensureExists(
            List.of(), EventResources.binding(), events, options(), token);

        // Then
        assertTrue(result.isAllGood());
        assertTrue(result.results().isEmpty());
        assertEquals(0, events.getCreateCalls());
    }
}
