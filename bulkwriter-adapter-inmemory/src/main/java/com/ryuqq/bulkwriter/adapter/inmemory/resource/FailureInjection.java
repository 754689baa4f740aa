package com.ryuqq.bulkwriter.adapter.inmemory.resource;

import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Scripted failures for one kind of in-memory call (retrieve, create or upsert).
 *
 * <p>Failures scheduled with {@link #failNext} are thrown once each, in order. A failure set with
 * {@link #failAlways} is thrown on every call after the scheduled ones are used up, until {@link #reset()}.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public final class FailureInjection {

    private final Deque<RuntimeException> scheduled = new ConcurrentLinkedDeque<>();
    private final AtomicInteger injected = new AtomicInteger();
    private volatile Supplier<? extends RuntimeException> persistent;

    /**
     * Throws the given failure on the next call.
     *
     * @param failure failure to throw
     */
    public void failNext(RuntimeException failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        scheduled.addLast(failure);
    }

    /**
     * Throws a fresh failure from the supplier on every call.
     *
     * @param failure failure factory
     */
    public void failAlways(Supplier<? extends RuntimeException> failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        this.persistent = failure;
    }

    public void reset() {
        scheduled.clear();
        persistent = null;
        injected.set(0);
    }

    /**
     * @return number of failures thrown so far
     */
    public int getInjectedCount() {
        return injected.get();
    }

    void throwIfScheduled() {
        RuntimeException next = scheduled.pollFirst();
        if (next != null) {
            injected.incrementAndGet();
            throw next;
        }
        Supplier<? extends RuntimeException> always = persistent;
        if (always != null) {
            injected.incrementAndGet();
            throw always.get();
        }
    }
}
