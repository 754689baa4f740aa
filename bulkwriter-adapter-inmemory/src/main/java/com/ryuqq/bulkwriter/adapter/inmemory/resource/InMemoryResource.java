package com.ryuqq.bulkwriter.adapter.inmemory.resource;

import com.ryuqq.bulkwriter.core.cancel.CancellationToken;
import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.spi.CreateCapable;
import com.ryuqq.bulkwriter.core.spi.Identifiable;
import com.ryuqq.bulkwriter.core.spi.RemoteFailure;
import com.ryuqq.bulkwriter.core.spi.RetrieveCapable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory remote resource keyed by internal id, with external id lookup, for testing and reference purposes.
 *
 * <p>Behaves like the remote create/retrieve API: internal ids are assigned from a sequence,
 * existing external ids are rejected with a 409 carrying a {@code duplicated} list, and unknown
 * ids are rejected with a 400 carrying a {@code missing} list unless ignored. Subclasses add the
 * reference checks of their resource type in {@link #validate(List)}.</p>
 *
 * <p><strong>Test hooks:</strong></p>
 * <ul>
 *   <li>{@link #createFailures()} / {@link #retrieveFailures()}: scripted failures</li>
 *   <li>{@link #setCreateLatency(Duration)}: cancellable delay before every create</li>
 *   <li>{@link #getCreateBatchSizes()}, {@link #getMaxConcurrentCreates()}, {@link #getRetrieveCalls()}: call records</li>
 * </ul>
 *
 * <p>Validation and insertion of one create call happen under a single lock, so a create is
 * all-or-nothing like the remote API.</p>
 *
 * @param <W> write item type
 * @param <R> stored item type
 * @author BulkWriter Team
 * @since 1.0.0
 */
public abstract class InMemoryResource<W, R extends Identifiable> implements RetrieveCapable<R>, CreateCapable<W, R> {

    public static final String IDS_NOT_FOUND = "Ids not found";
    public static final String DUPLICATED_EXTERNAL_IDS = "Duplicated external ids";

    private final Object writeLock = new Object();
    private final Map<Long, R> byId = new ConcurrentHashMap<>();
    private final Map<String, Long> idByExternalId = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(1);

    private final FailureInjection createFailures = new FailureInjection();
    private final FailureInjection retrieveFailures = new FailureInjection();
    private final List<Integer> createBatchSizes = new CopyOnWriteArrayList<>();
    private final AtomicInteger retrieveCalls = new AtomicInteger();
    private final AtomicInteger concurrentCreates = new AtomicInteger();
    private final AtomicInteger maxConcurrentCreates = new AtomicInteger();
    private volatile Duration createLatency = Duration.ZERO;

    /**
     * {@inheritDoc}
     *
     * <p>Duplicate ids in the request return the item once.</p>
     */
    @Override
    public List<R> retrieve(List<Identity> ids, boolean ignoreUnknownIds, CancellationToken token) {
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        retrieveCalls.incrementAndGet();
        token.throwIfCancellationRequested();
        retrieveFailures.throwIfScheduled();

        Map<Long, R> found = new LinkedHashMap<>();
        List<Map<String, Object>> missing = new ArrayList<>();
        for (Identity id : ids) {
            R item = lookup(id);
            if (item != null) {
                found.putIfAbsent(item.id(), item);
            } else {
                missing.add(id.isInternalId()
                    ? Map.<String, Object>of("id", id.getId())
                    : Map.<String, Object>of("externalId", id.getExternalId()));
            }
        }
        if (!missing.isEmpty() && !ignoreUnknownIds) {
            throw RemoteFailure.missing(400, IDS_NOT_FOUND, missing);
        }
        return new ArrayList<>(found.values());
    }

    @Override
    public List<R> create(List<W> items, CancellationToken token) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        createBatchSizes.add(items.size());
        int running = concurrentCreates.incrementAndGet();
        maxConcurrentCreates.accumulateAndGet(running, Math::max);
        try {
            token.sleep(createLatency);
            createFailures.throwIfScheduled();

            synchronized (writeLock) {
                List<Map<String, Object>> duplicated = new ArrayList<>();
                for (W item : items) {
                    String externalId = externalIdOf(item);
                    if (externalId != null && idByExternalId.containsKey(externalId)) {
                        duplicated.add(Map.of("externalId", externalId));
                    }
                }
                if (!duplicated.isEmpty()) {
                    throw RemoteFailure.duplicated(409, DUPLICATED_EXTERNAL_IDS, duplicated);
                }
                RemoteFailure failure = validate(items);
                if (failure != null) {
                    throw failure;
                }
                List<R> created = new ArrayList<>(items.size());
                for (W item : items) {
                    created.add(store(item));
                }
                return created;
            }
        } finally {
            concurrentCreates.decrementAndGet();
        }
    }

    /**
     * Stores items directly, skipping validation and failure injection.
     *
     * @param items items to store
     * @return stored items
     */
    @SafeVarargs
    public final List<R> seed(W... items) {
        synchronized (writeLock) {
            List<R> stored = new ArrayList<>(items.length);
            for (W item : items) {
                stored.add(store(item));
            }
            return stored;
        }
    }

    /**
     * Resource-specific reference checks, run under the write lock before anything is stored.
     *
     * @param items create request
     * @return the failure the remote API would return, or null if the request is valid
     */
    protected abstract RemoteFailure validate(List<W> items);

    protected abstract R toStored(long id, W item);

    protected abstract String externalIdOf(W item);

    protected final R lookup(Identity id) {
        if (id.isInstanceId()) {
            return null;
        }
        if (id.isInternalId()) {
            return byId.get(id.getId());
        }
        Long internal = idByExternalId.get(id.getExternalId());
        return internal == null ? null : byId.get(internal);
    }

    protected final Long idOfExternalId(String externalId) {
        return externalId == null ? null : idByExternalId.get(externalId);
    }

    protected final boolean containsId(long id) {
        return byId.containsKey(id);
    }

    protected final Collection<R> storedItems() {
        return byId.values();
    }

    protected static List<Long> unknownIds(Collection<Long> referenced, Collection<Long> known) {
        List<Long> unknown = new ArrayList<>();
        if (known == null) {
            return unknown;
        }
        for (Long id : referenced) {
            if (id != null && !known.contains(id) && !unknown.contains(id)) {
                unknown.add(id);
            }
        }
        return unknown;
    }

    private R store(W item) {
        long id = sequence.getAndIncrement();
        R stored = toStored(id, item);
        byId.put(id, stored);
        if (stored.externalId() != null) {
            idByExternalId.put(stored.externalId(), id);
        }
        return stored;
    }

    public FailureInjection createFailures() {
        return createFailures;
    }

    public FailureInjection retrieveFailures() {
        return retrieveFailures;
    }

    public void setCreateLatency(Duration createLatency) {
        this.createLatency = createLatency == null ? Duration.ZERO : createLatency;
    }

    public R get(Identity id) {
        return lookup(id);
    }

    public int size() {
        return byId.size();
    }

    /**
     * @return size of every create request received, including failed ones, in arrival order
     */
    public List<Integer> getCreateBatchSizes() {
        return List.copyOf(createBatchSizes);
    }

    public int getCreateCalls() {
        return createBatchSizes.size();
    }

    public int getRetrieveCalls() {
        return retrieveCalls.get();
    }

    public int getMaxConcurrentCreates() {
        return maxConcurrentCreates.get();
    }

    /**
     * Removes all stored items, call records and scripted failures.
     */
    public void clear() {
        synchronized (writeLock) {
            byId.clear();
            idByExternalId.clear();
            sequence.set(1);
        }
        createFailures.reset();
        retrieveFailures.reset();
        createBatchSizes.clear();
        retrieveCalls.set(0);
        maxConcurrentCreates.set(0);
        createLatency = Duration.ZERO;
    }
}
