package com.ryuqq.bulkwriter.adapter.runner;

import com.ryuqq.bulkwriter.application.throttle.Throttler;
import com.ryuqq.bulkwriter.application.throttle.ThrottlerConfig;
import com.ryuqq.bulkwriter.core.cancel.CancellationToken;
import com.ryuqq.bulkwriter.core.error.ThrottlerException;
import com.ryuqq.bulkwriter.core.task.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * {@link Throttler} 구현체.
 *
 * <p>전용 스케줄러 스레드 하나가 작업 시작을 결정합니다. 큐, 실행 중 목록, 결과 목록,
 * index 카운터는 하나의 {@link ReentrantLock}으로 보호되며 상태가 바뀔 때마다
 * {@code stateChanged} 조건으로 스케줄러를 깨웁니다.</p>
 *
 * <p><strong>시작 허용 조건:</strong></p>
 * <ul>
 *   <li>실행 중인 작업 수 &lt; maxParallelism (설정된 경우)</li>
 *   <li>최근 unit 동안 시작한 작업 수 &lt; maxPerUnit (설정된 경우)</li>
 *   <li>마지막 시작 이후 unit / maxPerUnit 이상 경과 (설정된 경우)</li>
 * </ul>
 *
 * <p>생성기 호출과 작업 완료 콜백은 lock 밖에서 실행됩니다.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public final class TaskThrottler implements Throttler {

    private static final Logger log = LoggerFactory.getLogger(TaskThrottler.class);

    private static final long WAIT_FOR_SIGNAL = -1L;

    private final ThrottlerConfig config;
    private final CancellationToken token;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();
    private final Deque<QueuedTask> queue = new ArrayDeque<>();
    private final List<TaskResult> running = new ArrayList<>();
    private final List<TaskResult> results = new ArrayList<>();
    private final Deque<Long> recentStarts = new ArrayDeque<>();

    private long nextIndex;
    private boolean closed;
    private boolean stopped;
    private boolean failureObserved;

    private final ExecutorService scheduler;
    private final Runnable cancelRegistration;
    private final CompletableFuture<Void> runTask;

    public TaskThrottler(ThrottlerConfig config) {
        this(config, CancellationToken.NONE);
    }

    /**
     * @param config 설정
     * @param token 스케줄러 대기를 중단할 취소 토큰
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public TaskThrottler(ThrottlerConfig config, CancellationToken token) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        this.config = config;
        this.token = token;
        this.scheduler = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "task-throttler");
            thread.setDaemon(true);
            return thread;
        });
        this.cancelRegistration = token == CancellationToken.NONE ? () -> { } : token.onCancel(this::signal);
        this.runTask = CompletableFuture.runAsync(this::run, scheduler);
    }

    /**
     * 생성기 목록을 병렬 한도 안에서 실행하고 모두 끝날 때까지 대기합니다.
     *
     * <p>첫 실패 이후 새 작업은 시작하지 않으며, 실행 중이던 작업이 끝난 뒤
     * {@link ThrottlerException}을 던집니다. onCompleted는 성공한 작업마다 완료 스레드에서 호출됩니다.</p>
     *
     * @param generators 생성기 목록
     * @param parallelism 동시 실행 한도
     * @param onCompleted 작업 완료 콜백 (null 허용)
     * @param token 취소 토큰
     * @return 모든 작업 결과 (index 순)
     * @throws ThrottlerException 작업이 실패한 경우
     * @throws CancellationException 취소된 경우
     * @throws InterruptedException 대기 중 인터럽트
     */
    public static List<TaskResult> runThrottled(List<? extends Supplier<? extends CompletionStage<?>>> generators,
                                                int parallelism,
                                                Consumer<TaskResult> onCompleted,
                                                CancellationToken token) throws InterruptedException {
        if (generators == null) {
            throw new IllegalArgumentException("generators cannot be null");
        }
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        token.throwIfCancellationRequested();
        try (TaskThrottler throttler = new TaskThrottler(ThrottlerConfig.ofParallelism(parallelism, true), token)) {
            for (Supplier<? extends CompletionStage<?>> generator : generators) {
                CompletableFuture<TaskResult> waiter = throttler.enqueueAndWait(generator);
                if (onCompleted != null) {
                    waiter.thenAccept(onCompleted);
                }
            }
            return throttler.waitForCompletion();
        }
    }

    @Override
    public void enqueueTask(Supplier<? extends CompletionStage<?>> generator) {
        enqueue(generator);
    }

    @Override
    public CompletableFuture<TaskResult> enqueueAndWait(Supplier<? extends CompletionStage<?>> generator) {
        return enqueue(generator);
    }

    @Override
    public List<TaskResult> waitForCompletion() throws InterruptedException {
        lock.lock();
        try {
            closed = true;
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }

        try {
            runTask.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("TaskThrottler scheduler failed", cause);
        }
        token.throwIfCancellationRequested();

        List<TaskResult> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(results);
        } finally {
            lock.unlock();
        }
        snapshot.sort(Comparator.comparingLong(TaskResult::getIndex));

        if (config.quitOnFailure()) {
            List<Throwable> failures = snapshot.stream()
                .filter(TaskResult::isFailed)
                .map(TaskResult::getException)
                .toList();
            if (!failures.isEmpty()) {
                throw new ThrottlerException(failures);
            }
        }
        return snapshot;
    }

    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
            stopped = true;
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
        cancelRegistration.run();
        scheduler.shutdown();
    }

    /**
     * @return 지금 실행 중인 작업 수
     */
    public int getRunningCount() {
        lock.lock();
        try {
            return running.size();
        } finally {
            lock.unlock();
        }
    }

    private CompletableFuture<TaskResult> enqueue(Supplier<? extends CompletionStage<?>> generator) {
        if (generator == null) {
            throw new IllegalArgumentException("generator cannot be null");
        }
        CompletableFuture<TaskResult> waiter = new CompletableFuture<>();
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("TaskThrottler is closed");
            }
            long index = nextIndex++;
            if (stopped) {
                // scheduler already quit on failure or cancellation
                waiter.completeExceptionally(new CancellationException("Task " + index + " was not started"));
                return waiter;
            }
            queue.addLast(new QueuedTask(index, generator, waiter));
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
        return waiter;
    }

    private void run() {
        try {
            while (true) {
                QueuedTask next;
                TaskResult result;
                lock.lock();
                try {
                    if (stopped || token.isCancellationRequested()) {
                        return;
                    }
                    pruneResults();
                    if (config.quitOnFailure() && failureObserved) {
                        if (running.isEmpty()) {
                            return;
                        }
                        stateChanged.await();
                        continue;
                    }
                    if (queue.isEmpty()) {
                        if (closed && running.isEmpty()) {
                            return;
                        }
                        stateChanged.await();
                        continue;
                    }
                    long delay = admissionDelayNanos();
                    if (delay == WAIT_FOR_SIGNAL) {
                        stateChanged.await();
                        continue;
                    }
                    if (delay > 0) {
                        stateChanged.awaitNanos(delay);
                        continue;
                    }

                    next = queue.pollFirst();
                    long startNanos = System.nanoTime();
                    result = new TaskResult(next.index(), Instant.now(), startNanos);
                    results.add(result);
                    running.add(result);
                    if (config.isRateLimited()) {
                        recentStarts.addLast(startNanos);
                    }
                } finally {
                    lock.unlock();
                }
                launch(next, result);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancellation = new CancellationException("TaskThrottler interrupted");
            cancellation.initCause(e);
            throw cancellation;
        } finally {
            finish();
        }
    }

    /**
     * @return 0이면 즉시 시작, 양수면 그만큼 대기, WAIT_FOR_SIGNAL이면 완료 신호까지 대기
     */
    private long admissionDelayNanos() {
        if (config.isParallelismLimited() && running.size() >= config.maxParallelism()) {
            return WAIT_FOR_SIGNAL;
        }
        if (!config.isRateLimited()) {
            return 0;
        }

        long now = System.nanoTime();
        long unitNanos = config.unit().toNanos();
        while (!recentStarts.isEmpty() && now - recentStarts.peekFirst() >= unitNanos) {
            recentStarts.pollFirst();
        }
        if (recentStarts.isEmpty()) {
            return 0;
        }

        long delay = 0;
        if (recentStarts.size() >= config.maxPerUnit()) {
            delay = recentStarts.peekFirst() + unitNanos - now;
        }
        long sinceLast = now - recentStarts.peekLast();
        long subWindowNanos = config.subWindow().toNanos();
        if (sinceLast < subWindowNanos) {
            delay = Math.max(delay, subWindowNanos - sinceLast);
        }
        return delay;
    }

    private void pruneResults() {
        if (config.keepAllResults()) {
            return;
        }
        long now = System.nanoTime();
        long unitNanos = config.unit().toNanos();
        Iterator<TaskResult> iterator = results.iterator();
        while (iterator.hasNext()) {
            TaskResult result = iterator.next();
            if (result.isCompleted() && !result.isFailed() && now - result.getStartNanos() >= unitNanos) {
                iterator.remove();
            }
        }
    }

    private void launch(QueuedTask task, TaskResult result) {
        CompletionStage<?> operation;
        try {
            operation = task.generator().get();
            if (operation == null) {
                operation = CompletableFuture.failedFuture(
                    new IllegalStateException("Task " + task.index() + " generator returned null"));
            }
        } catch (RuntimeException e) {
            operation = CompletableFuture.failedFuture(e);
        }
        result.attach(operation);
        operation.whenComplete((value, error) -> onSettled(task, result, error));
    }

    private void onSettled(QueuedTask task, TaskResult result, Throwable error) {
        Throwable cause = unwrap(error);
        result.complete(Instant.now(), cause);

        if (cause instanceof CancellationException) {
            log.debug("Task {} was cancelled", task.index());
        } else if (cause != null) {
            log.error("Task {} failed", task.index(), cause);
        }

        if (cause != null && config.quitOnFailure()) {
            task.waiter().completeExceptionally(cause);
        } else {
            task.waiter().complete(result);
        }

        lock.lock();
        try {
            running.remove(result);
            if (cause != null) {
                failureObserved = true;
            }
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void finish() {
        List<QueuedTask> abandoned;
        lock.lock();
        try {
            stopped = true;
            abandoned = new ArrayList<>(queue);
            queue.clear();
        } finally {
            lock.unlock();
        }
        for (QueuedTask task : abandoned) {
            task.waiter().completeExceptionally(
                new CancellationException("Task " + task.index() + " was not started"));
        }
        if (!abandoned.isEmpty()) {
            log.debug("TaskThrottler stopped with {} tasks not started", abandoned.size());
        }
        cancelRegistration.run();
        scheduler.shutdown();
    }

    private void signal() {
        lock.lock();
        try {
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private record QueuedTask(long index,
                              Supplier<? extends CompletionStage<?>> generator,
                              CompletableFuture<TaskResult> waiter) {
    }
}
