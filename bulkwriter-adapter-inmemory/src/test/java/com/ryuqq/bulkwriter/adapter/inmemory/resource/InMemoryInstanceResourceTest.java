package com.ryuqq.bulkwriter.adapter.inmemory.resource;

import com.ryuqq.bulkwriter.application.resource.instance.Instance;
import com.ryuqq.bulkwriter.application.resource.instance.InstanceWrite;
import com.ryuqq.bulkwriter.core.cancel.CancellationToken;
import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.spi.RemoteFailure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for versioned upserts of {@link InMemoryInstanceResource}.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
class InMemoryInstanceResourceTest {

    private InMemoryInstanceResource resource;

    @BeforeEach
    void setUp() {
        resource = new InMemoryInstanceResource();
    }

    private static InstanceWrite node(String externalId, long value) {
        return InstanceWrite.of("space", externalId, Map.of("value", value));
    }

    @Test
    void testUpsert_NewAndExisting_BumpsVersion() {
        // Given
        resource.put(node("a", 1));

        // When
        List<Instance> written = resource.upsert(List.of(node("a", 2), node("b", 1)), CancellationToken.NONE);

        // Then
        assertEquals(2L, written.get(0).version());
        assertEquals(1L, written.get(1).version());
        assertEquals(2L, resource.get("space", "a").properties().get("value"));
        assertEquals(List.of(2), resource.getUpsertBatchSizes());
    }

    @Test
    void testUpsert_MatchingExistingVersion_Succeeds() {
        // Given
        resource.put(node("a", 1));

        // When
        List<Instance> written = resource.upsert(
            List.of(node("a", 2).withExistingVersion(1L)), CancellationToken.NONE);

        // Then
        assertEquals(2L, written.get(0).version());
    }

    @Test
    void testUpsert_StaleExistingVersion_RejectsWithVersionConflict() {
        // Given
        resource.put(node("a", 1));
        resource.put(node("a", 2));

        // When
        RemoteFailure failure = assertThrows(RemoteFailure.class, () -> resource.upsert(
            List.of(node("a", 3).withExistingVersion(1L)), CancellationToken.NONE));

        // Then
        assertEquals(409, failure.getStatus());
        assertEquals(InMemoryInstanceResource.VERSION_CONFLICT, failure.getMessage());
        assertEquals(2L, resource.get("space", "a").version());
    }

    @Test
    void testUpsert_DuplicateInRequest_RejectsWithDuplicatedList() {
        // When
        RemoteFailure failure = assertThrows(RemoteFailure.class, () -> resource.upsert(
            List.of(node("a", 1), node("a", 2)), CancellationToken.NONE));

        // Then
        assertEquals(400, failure.getStatus());
        assertEquals(List.of(Map.of("space", "space", "externalId", "a")), failure.getDuplicated());
        assertEquals(0, resource.size());
    }

    @Test
    void testUpsert_UnknownSpace_RejectsWithMissingList() {
        // Given
        resource.requireSpaces(List.of("space"));

        // When
        RemoteFailure failure = assertThrows(RemoteFailure.class, () -> resource.upsert(
            List.of(InstanceWrite.of("other", "a", Map.of())), CancellationToken.NONE));

        // Then
        assertEquals(InMemoryInstanceResource.SPACES_NOT_FOUND, failure.getMessage());
        assertEquals(List.of(Map.of("space", "other", "externalId", "a")), failure.getMissing());
    }

    @Test
    void testRetrieve_UnknownInstance_IgnoredOrRejected() {
        // Given
        resource.put(node("a", 1));
        List<Identity> ids = List.of(Identity.instance("space", "a"), Identity.instance("space", "b"));

        // When
        List<Instance> found = resource.retrieve(ids, true, CancellationToken.NONE);

        // Then
        assertEquals(1, found.size());
        assertThrows(RemoteFailure.class, () -> resource.retrieve(ids, false, CancellationToken.NONE));
        assertEquals(2, resource.getRetrieveCalls());
    }
}
