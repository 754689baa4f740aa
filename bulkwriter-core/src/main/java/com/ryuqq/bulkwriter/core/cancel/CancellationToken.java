package com.ryuqq.bulkwriter.core.cancel;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 협력적 취소 신호.
 *
 * <p>하나의 토큰이 ChunkedRetryOrchestrator → TaskThrottler → 청크 재시도 루프까지 전달되며,
 * 각 계층은 원격 호출 전과 재시도 루프 반복 전에 {@link #throwIfCancellationRequested()}를 호출합니다.</p>
 *
 * <p><strong>특징:</strong></p>
 * <ul>
 *   <li>한 번 취소되면 되돌릴 수 없음</li>
 *   <li>{@link #sleep(Duration)}은 취소 즉시 깨어나 {@link CancellationException}을 던짐</li>
 *   <li>{@link #NONE}은 절대 취소되지 않는 공유 토큰</li>
 * </ul>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class CancellationToken {

    /**
     * 취소되지 않는 토큰.
     */
    public static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
    };

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * 취소 요청. 등록된 콜백은 호출한 스레드에서 한 번씩 실행됩니다.
     */
    public void cancel() {
        synchronized (cancelled) {
            if (cancelled.getCount() == 0) {
                return;
            }
            cancelled.countDown();
        }
        for (Runnable callback : callbacks) {
            callback.run();
        }
        callbacks.clear();
    }

    public boolean isCancellationRequested() {
        return cancelled.getCount() == 0;
    }

    /**
     * @throws CancellationException 취소가 요청된 경우
     */
    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("Operation was cancelled");
        }
    }

    /**
     * 취소 시 실행할 콜백 등록. 이미 취소되었으면 즉시 실행합니다.
     *
     * <p>토큰보다 먼저 끝나는 쪽은 반환된 해제 핸들을 호출해야 합니다.
     * 해제하지 않은 콜백은 취소되거나 토큰이 사라질 때까지 남습니다.</p>
     *
     * @param callback 콜백
     * @return 콜백 등록 해제 핸들 (여러 번 호출해도 안전)
     */
    public Runnable onCancel(Runnable callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        synchronized (cancelled) {
            if (!isCancellationRequested()) {
                Runnable registration = callback::run;
                callbacks.add(registration);
                return () -> callbacks.remove(registration);
            }
        }
        callback.run();
        return () -> { };
    }

    /**
     * @return 아직 실행되지 않은 등록 콜백 수
     */
    public int getCallbackCount() {
        return callbacks.size();
    }

    /**
     * 지정 시간 동안 대기하되 취소되면 즉시 중단합니다.
     *
     * @param duration 대기 시간
     * @throws CancellationException 대기 전 또는 대기 중 취소된 경우, 또는 인터럽트된 경우
     */
    public void sleep(Duration duration) {
        throwIfCancellationRequested();
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            if (cancelled.await(duration.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new CancellationException("Operation was cancelled");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancellation = new CancellationException("Sleep interrupted");
            cancellation.initCause(e);
            throw cancellation;
        }
    }

    /**
     * 취소될 때까지 최대 timeout만큼 대기합니다.
     *
     * @return 취소되었으면 true, 시간이 다 되었으면 false
     * @throws InterruptedException 대기 중 인터럽트
     */
    public boolean awaitCancellation(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
