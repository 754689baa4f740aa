package com.ryuqq.bulkwriter.adapter.inmemory.resource;

import com.ryuqq.bulkwriter.application.resource.instance.Instance;
import com.ryuqq.bulkwriter.application.resource.instance.InstanceWrite;
import com.ryuqq.bulkwriter.core.cancel.CancellationToken;
import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.spi.RemoteFailure;
import com.ryuqq.bulkwriter.core.spi.RetrieveCapable;
import com.ryuqq.bulkwriter.core.spi.UpsertCapable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory data-model instances resource, for testing and reference purposes.
 *
 * <p>Instances are keyed by (space, externalId) and carry a version that starts at 1 and grows by
 * one on every write. A write with {@code existingVersion} set fails with the 409 version conflict
 * unless the stored version matches.</p>
 *
 * <p><strong>Failure payloads:</strong></p>
 * <ul>
 *   <li>same instance twice in one request: 400 with a {@code duplicated} list</li>
 *   <li>space not registered (after {@link #requireSpaces(Collection)}): 400 with a {@code missing} list</li>
 *   <li>version mismatch: 409 {@value #VERSION_CONFLICT}</li>
 * </ul>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class InMemoryInstanceResource implements RetrieveCapable<Instance>, UpsertCapable<InstanceWrite, Instance> {

    public static final String VERSION_CONFLICT = "A version conflict caused the ingest to fail.";
    public static final String DUPLICATED_INSTANCES = "Duplicate instances in request";
    public static final String SPACES_NOT_FOUND = "Spaces not found";

    private final Object writeLock = new Object();
    private final Map<Identity, Instance> instances = new ConcurrentHashMap<>();
    private final FailureInjection upsertFailures = new FailureInjection();
    private final List<Integer> upsertBatchSizes = new CopyOnWriteArrayList<>();
    private final AtomicInteger retrieveCalls = new AtomicInteger();
    private volatile Set<String> knownSpaces;

    @Override
    public List<Instance> retrieve(List<Identity> ids, boolean ignoreUnknownIds, CancellationToken token) {
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        retrieveCalls.incrementAndGet();
        token.throwIfCancellationRequested();

        Map<Identity, Instance> found = new LinkedHashMap<>();
        List<Map<String, Object>> missing = new ArrayList<>();
        for (Identity id : ids) {
            Instance instance = instances.get(id);
            if (instance != null) {
                found.putIfAbsent(id, instance);
            } else if (id.isInstanceId()) {
                missing.add(Map.of("space", id.getSpace(), "externalId", id.getExternalId()));
            }
        }
        if (!missing.isEmpty() && !ignoreUnknownIds) {
            throw RemoteFailure.missing(400, "Instances not found", missing);
        }
        return new ArrayList<>(found.values());
    }

    @Override
    public List<Instance> upsert(List<InstanceWrite> items, CancellationToken token) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        upsertBatchSizes.add(items.size());
        token.throwIfCancellationRequested();
        upsertFailures.throwIfScheduled();

        synchronized (writeLock) {
            Set<Identity> seen = new HashSet<>();
            List<Map<String, Object>> duplicated = new ArrayList<>();
            for (InstanceWrite item : items) {
                if (!seen.add(Identity.instance(item.space(), item.externalId()))) {
                    duplicated.add(Map.of("space", item.space(), "externalId", item.externalId()));
                }
            }
            if (!duplicated.isEmpty()) {
                throw RemoteFailure.duplicated(400, DUPLICATED_INSTANCES, duplicated);
            }

            Set<String> spaces = knownSpaces;
            if (spaces != null) {
                List<Map<String, Object>> missing = new ArrayList<>();
                for (InstanceWrite item : items) {
                    if (!spaces.contains(item.space())) {
                        missing.add(Map.of("space", item.space(), "externalId", item.externalId()));
                    }
                }
                if (!missing.isEmpty()) {
                    throw RemoteFailure.missing(400, SPACES_NOT_FOUND, missing);
                }
            }

            for (InstanceWrite item : items) {
                if (item.existingVersion() == null) {
                    continue;
                }
                Instance current = instances.get(Identity.instance(item.space(), item.externalId()));
                long currentVersion = current == null ? 0 : current.version();
                if (currentVersion != item.existingVersion()) {
                    throw new RemoteFailure(409, VERSION_CONFLICT);
                }
            }

            List<Instance> written = new ArrayList<>(items.size());
            for (InstanceWrite item : items) {
                written.add(write(item));
            }
            return written;
        }
    }

    /**
     * Writes one instance without checks, as a concurrent writer would.
     *
     * @return the stored instance with its new version
     */
    public Instance put(InstanceWrite item) {
        synchronized (writeLock) {
            return write(item);
        }
    }

    public void requireSpaces(Collection<String> spaces) {
        Set<String> known = ConcurrentHashMap.newKeySet();
        known.addAll(spaces);
        this.knownSpaces = known;
    }

    private Instance write(InstanceWrite item) {
        Identity key = Identity.instance(item.space(), item.externalId());
        Instance current = instances.get(key);
        long version = current == null ? 1 : current.version() + 1;
        Instance stored = new Instance(item.space(), item.externalId(), version, item.properties());
        instances.put(key, stored);
        return stored;
    }

    public FailureInjection upsertFailures() {
        return upsertFailures;
    }

    public Instance get(String space, String externalId) {
        return instances.get(Identity.instance(space, externalId));
    }

    public int size() {
        return instances.size();
    }

    public List<Integer> getUpsertBatchSizes() {
        return List.copyOf(upsertBatchSizes);
    }

    public int getUpsertCalls() {
        return upsertBatchSizes.size();
    }

    public int getRetrieveCalls() {
        return retrieveCalls.get();
    }

    public void clear() {
        synchronized (writeLock) {
            instances.clear();
        }
        upsertFailures.reset();
        upsertBatchSizes.clear();
        retrieveCalls.set(0);
        knownSpaces = null;
    }
}
