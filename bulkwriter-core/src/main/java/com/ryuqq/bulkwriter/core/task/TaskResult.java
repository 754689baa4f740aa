package com.ryuqq.bulkwriter.core.task;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletionStage;

/**
 * 스로틀러가 실행한 작업 하나의 기록.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>index는 enqueue 시점에 부여되며 제출 순서대로 단조 증가</li>
 *   <li>completedAt은 작업이 끝난 뒤 정확히 한 번만 설정됨 (성공, 실패, 동기 예외 모두)</li>
 *   <li>exception은 성공 시 null</li>
 * </ul>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public final class TaskResult {

    private final long index;
    private final Instant startedAt;
    private final long startNanos;
    private volatile CompletionStage<?> operation;
    private volatile Instant completedAt;
    private volatile Throwable exception;

    public TaskResult(long index, Instant startedAt, long startNanos) {
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }
        this.index = index;
        this.startedAt = startedAt;
        this.startNanos = startNanos;
    }

    /**
     * 실행 중인 비동기 작업 연결. 생성기가 동기적으로 실패하면 호출되지 않습니다.
     *
     * @param operation 작업
     */
    public void attach(CompletionStage<?> operation) {
        this.operation = operation;
    }

    /**
     * 작업 종료 기록.
     *
     * @param completedAt 종료 시각
     * @param exception 실패 원인 (성공이면 null)
     * @throws IllegalStateException 이미 종료가 기록된 경우
     */
    public synchronized void complete(Instant completedAt, Throwable exception) {
        if (completedAt == null) {
            throw new IllegalArgumentException("completedAt cannot be null");
        }
        if (this.completedAt != null) {
            throw new IllegalStateException("Task " + index + " already completed");
        }
        this.exception = exception;
        this.completedAt = completedAt;
    }

    public long getIndex() {
        return index;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    /**
     * @return 시작 시점의 {@link System#nanoTime()} 값 (rate limit 계산용)
     */
    public long getStartNanos() {
        return startNanos;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Throwable getException() {
        return exception;
    }

    public CompletionStage<?> getOperation() {
        return operation;
    }

    public boolean isCompleted() {
        return completedAt != null;
    }

    public boolean isFailed() {
        return completedAt != null && exception != null;
    }

    /**
     * @return 실행 시간, 아직 끝나지 않았으면 null
     */
    public Duration getElapsed() {
        Instant done = completedAt;
        return done == null ? null : Duration.between(startedAt, done);
    }

    @Override
    public String toString() {
        return "TaskResult{index=" + index + ", startedAt=" + startedAt + ", completedAt=" + completedAt
            + ", failed=" + (exception != null) + '}';
    }
}
