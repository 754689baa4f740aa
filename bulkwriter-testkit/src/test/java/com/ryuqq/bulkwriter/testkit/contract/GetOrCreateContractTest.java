package com.ryuqq.bulkwriter.testkit.contract;

import com.ryuqq.bulkwriter.application.resource.event.Event;
import com.ryuqq.bulkwriter.application.resource.event.EventResources;
import com.ryuqq.bulkwriter.application.resource.event.EventWrite;
import com.ryuqq.bulkwriter.application.writer.ItemBuilder;
import com.ryuqq.bulkwriter.core.error.ClassifiedError;
import com.ryuqq.bulkwriter.core.model.ErrorKind;
import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.model.ResourceTag;
import com.ryuqq.bulkwriter.core.policy.RetryMode;
import com.ryuqq.bulkwriter.core.result.BatchResult;
import com.ryuqq.bulkwriter.core.spi.RemoteFailure;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Scenario D: get-or-create.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Existing ids are returned as found, the builder only sees missing ids</li>
 *   <li>KEEP_DUPLICATES: an item created concurrently is fetched in a later round</li>
 *   <li>Without KEEP_DUPLICATES the concurrently created item is only reported as an error</li>
 *   <li>Retrieve failure is reported without calling the builder</li>
 * </ul>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
class GetOrCreateContractTest extends AbstractContractTest {

    private static ItemBuilder<EventWrite> eventsFor(List<Identity> received) {
        return ItemBuilder.sync(missing -> {
            received.addAll(missing);
            return missing.stream().map(id -> EventWrite.of(id.getExternalId())).toList();
        });
    }

    @Test
    void testGetOrCreate_OneExisting_BuilderSeesOnlyMissing() {
        // Given
        events.seed(EventWrite.of("a"));
        List<Identity> received = new CopyOnWriteArrayList<>();

        // When
        BatchResult<Event, EventWrite> result = writer.getOrCreate(
            externalIds("a", "b", "c"), eventsFor(received), EventResources.binding(), events, options(), token);

        // Then
        assertEquals(externalIds("b", "c"), received);
        assertNoErrors(result);
        assertEquals(3, result.results().size());
        Set<String> externalIds = result.results().stream().map(Event::externalId).collect(Collectors.toSet());
        assertEquals(Set.of("a", "b", "c"), externalIds);
        assertEquals(List.of(2), events.getCreateBatchSizes());
    }

    @Test
    void testGetOrCreate_AllExisting_NoCreate() {
        // Given
        events.seed(EventWrite.of("a"), EventWrite.of("b"));

        // When
        BatchResult<Event, EventWrite> result = writer.getOrCreate(
            externalIds("a", "b"),
            missing -> { throw new AssertionError("builder must not run"); },
            EventResources.binding(), events, options(), token);

        // Then
        assertNoErrors(result);
        assertEquals(2, result.results().size());
        assertEquals(0, events.getCreateCalls());
    }

    @Test
    void testGetOrCreate_KeepDuplicates_ConcurrentCreateFetchedLater() {
        // Given: "b" is created by someone else between retrieve and create
        AtomicInteger builderCalls = new AtomicInteger();
        ItemBuilder<EventWrite> racingBuilder = ItemBuilder.sync(missing -> {
            if (builderCalls.incrementAndGet() == 1) {
                events.seed(EventWrite.of("b"));
            }
            return missing.stream().map(id -> EventWrite.of(id.getExternalId())).toList();
        });

        // When
        BatchResult<Event, EventWrite> result = writer.getOrCreate(
            externalIds("a", "b", "c"), racingBuilder, EventResources.binding(), events,
            options().withRetryMode(RetryMode.ON_ERROR_KEEP_DUPLICATES), token);

        // Then: all three items are in the result, "b" as found
        Set<String> externalIds = result.results().stream().map(Event::externalId).collect(Collectors.toSet());
        assertEquals(Set.of("a", "b", "c"), externalIds);
        assertEquals(3, result.results().size());
        assertEquals(1, builderCalls.get());
        assertEquals(2, events.getRetrieveCalls());

        // Then: the conflict stays in the errors
        ClassifiedError<EventWrite> error = assertSingleError(result, ErrorKind.ITEM_EXISTS, ResourceTag.EXTERNAL_ID);
        assertEquals(Set.of(Identity.of("b")), error.values());
    }

    @Test
    void testGetOrCreate_OnError_ConcurrentCreateOnlyReported() {
        // Given
        AtomicInteger builderCalls = new AtomicInteger();
        ItemBuilder<EventWrite> racingBuilder = ItemBuilder.sync(missing -> {
            if (builderCalls.incrementAndGet() == 1) {
                events.seed(EventWrite.of("b"));
            }
            return missing.stream().map(id -> EventWrite.of(id.getExternalId())).toList();
        });

        // When
        BatchResult<Event, EventWrite> result = writer.getOrCreate(
            externalIds("a", "b", "c"), racingBuilder, EventResources.binding(), events, options(), token);

        // Then
        Set<String> externalIds = result.results().stream().map(Event::externalId).collect(Collectors.toSet());
        assertEquals(Set.of("a", "c"), externalIds);
        assertSingleError(result, ErrorKind.ITEM_EXISTS, ResourceTag.EXTERNAL_ID);
        assertEquals(1, events.getRetrieveCalls());
    }

    @Test
    void testGetOrCreate_RetrieveFails_ErrorWithoutBuilder() {
        // Given
        events.retrieveFailures().failNext(new RemoteFailure(500, "Internal Server Error"));

        // When
        BatchResult<Event, EventWrite> result = writer.getOrCreate(
            externalIds("a", "b"),
            missing -> { throw new AssertionError("builder must not run"); },
            EventResources.binding(), events, options(), token);

        // Then
        assertTrue(result.results().isEmpty());
        ClassifiedError<EventWrite> error = assertSingleError(result, ErrorKind.FATAL_FAILURE, ResourceTag.NONE);
        assertEquals(500, error.status());
        assertEquals(0, events.getCreateCalls());
    }

    @Test
    void testGetOrCreate_ManyIds_ChunkedRetrieve() {
        // Given
        List<Identity> ids = new java.util.ArrayList<>();
        for (int i = 0; i < 25; i++) {
            ids.add(Identity.of("id-" + i));
        }
        List<Identity> received = new CopyOnWriteArrayList<>();

        // When
        BatchResult<Event, EventWrite> result = writer.getOrCreate(
            ids, eventsFor(received), EventResources.binding(), events, options().withChunkSize(10), token);

        // Then
        assertNoErrors(result);
        assertEquals(25, result.results().size());
        assertEquals(3, events.getRetrieveCalls());
        assertEquals(25, received.size());
    }
}
