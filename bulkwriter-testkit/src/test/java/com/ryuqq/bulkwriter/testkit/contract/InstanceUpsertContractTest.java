package com.ryuqq.bulkwriter.testkit.contract;

import com.ryuqq.bulkwriter.adapter.inmemory.resource.InMemoryInstanceResource;
import com.ryuqq.bulkwriter.adapter.runner.AtomicUpserter;
import com.ryuqq.bulkwriter.application.resource.instance.Instance;
import com.ryuqq.bulkwriter.application.resource.instance.InstanceResources;
import com.ryuqq.bulkwriter.application.resource.instance.InstanceWrite;
import com.ryuqq.bulkwriter.core.error.ClassifiedError;
import com.ryuqq.bulkwriter.core.model.ErrorKind;
import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.model.ResourceTag;
import com.ryuqq.bulkwriter.core.result.BatchResult;
import com.ryuqq.bulkwriter.core.spi.RemoteFailure;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for instance upsert and optimistic-concurrency updates.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Chunked upsert creates and updates instances</li>
 *   <li>Instances in unknown spaces are removed and the rest written</li>
 *   <li>Atomic update retries on a version conflict and applies on the latest state</li>
 *   <li>Atomic update gives up on other failures</li>
 * </ul>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
class InstanceUpsertContractTest extends AbstractContractTest {

    private static final String SPACE = "sp";

    private final AtomicUpserter upserter = new AtomicUpserter();

    private static List<InstanceWrite> instancesOf(int count) {
        List<InstanceWrite> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(InstanceWrite.of(SPACE, "node-" + i, Map.of("index", i)));
        }
        return result;
    }

    @Test
    void testUpsert_ChunkedInput_AllWritten() {
        // When
        BatchResult<Instance, InstanceWrite> result = writer.upsert(
            instancesOf(25), InstanceResources.binding(), instances, options().withChunkSize(10), token);

        // Then
        assertNoErrors(result);
        assertEquals(25, result.results().size());
        assertEquals(25, instances.size());
        assertEquals(3, instances.getUpsertCalls());
    }

    @Test
    void testUpsert_ExistingInstance_VersionIncremented() {
        // Given
        instances.put(InstanceWrite.of(SPACE, "node-0", Map.of("index", -1)));

        // When
        BatchResult<Instance, InstanceWrite> result = writer.upsert(
            instancesOf(2), InstanceResources.binding(), instances, options(), token);

        // Then
        assertNoErrors(result);
        Instance updated = instances.get(SPACE, "node-0");
        assertEquals(2, updated.version());
        assertEquals(0, updated.properties().get("index"));
    }

    @Test
    void testUpsert_UnknownSpace_InstanceRemoved() {
        // Given
        instances.requireSpaces(List.of(SPACE));
        List<InstanceWrite> input = new ArrayList<>(instancesOf(3));
        input.add(InstanceWrite.of("other", "node-x", Map.of()));

        // When
        BatchResult<Instance, InstanceWrite> result = writer.upsert(
            input, InstanceResources.binding(), instances, options(), token);

        // Then
        assertEquals(3, result.results().size());
        ClassifiedError<InstanceWrite> error = assertSingleError(result, ErrorKind.ITEM_MISSING, ResourceTag.INSTANCE_ID);
        assertEquals(Set.of(Identity.instance("other", "node-x")), error.values());
    }

    @Test
    void testUpsert_DuplicatedInput_ReportedLocally() {
        // Given
        List<InstanceWrite> input = List.of(
            InstanceWrite.of(SPACE, "a", Map.of()),
            InstanceWrite.of(SPACE, "a", Map.of("second", true)),
            InstanceWrite.of(SPACE, "b", Map.of()));

        // When
        BatchResult<Instance, InstanceWrite> result = writer.upsert(
            input, InstanceResources.binding(), instances, options(), token);

        // Then
        assertEquals(2, result.results().size());
        ClassifiedError<InstanceWrite> error = assertSingleError(result, ErrorKind.ITEM_DUPLICATED, ResourceTag.INSTANCE_ID);
        assertEquals(InstanceResources.DUPLICATED_MESSAGE, error.message());
    }

    @Test
    void testUpsertAtomic_ConcurrentWrite_RetriedOnLatestVersion() {
        // Given
        instances.put(InstanceWrite.of(SPACE, "counter", Map.of("count", 1)));
        AtomicInteger attempts = new AtomicInteger();

        // When: another writer bumps the counter during the first attempt
        List<Instance> written = upserter.upsertAtomic(
            List.of(Identity.instance(SPACE, "counter")), instances,
            current -> {
                if (attempts.incrementAndGet() == 1) {
                    instances.put(InstanceWrite.of(SPACE, "counter", Map.of("count", 10)));
                }
                return current.stream()
                    .map(instance -> InstanceWrite.of(SPACE, instance.externalId(),
                        Map.of("count", (Integer) instance.properties().get("count") + 1)))
                    .toList();
            },
            token);

        // Then
        assertEquals(2, attempts.get());
        assertEquals(1, written.size());
        assertEquals(11, written.get(0).properties().get("count"));
        assertEquals(3, instances.get(SPACE, "counter").version());
    }

    @Test
    void testUpsertAtomic_InjectedConflict_Retried() {
        // Given
        instances.put(InstanceWrite.of(SPACE, "a", Map.of()));
        instances.upsertFailures().failNext(new RemoteFailure(409, InMemoryInstanceResource.VERSION_CONFLICT));

        // When
        List<Instance> written = upserter.upsertAtomic(
            List.of(Identity.instance(SPACE, "a")), instances,
            current -> current.stream()
                .map(instance -> InstanceWrite.of(SPACE, instance.externalId(), Map.of("touched", true)))
                .toList(),
            token);

        // Then
        assertEquals(1, written.size());
        assertEquals(2, instances.getUpsertCalls());
        assertEquals(2, instances.getRetrieveCalls());
    }

    @Test
    void testUpsertAtomic_OtherFailure_Rethrown() {
        // Given
        instances.put(InstanceWrite.of(SPACE, "a", Map.of()));
        instances.upsertFailures().failNext(new RemoteFailure(409, "Some other conflict"));

        // When & Then
        RemoteFailure thrown = assertThrows(RemoteFailure.class, () -> upserter.upsertAtomic(
            List.of(Identity.instance(SPACE, "a")), instances,
            current -> current.stream()
                .map(instance -> InstanceWrite.of(SPACE, instance.externalId(), Map.of()))
                .toList(),
            token));
        assertEquals(409, thrown.getStatus());
        assertEquals(1, instances.getUpsertCalls());
    }
}
