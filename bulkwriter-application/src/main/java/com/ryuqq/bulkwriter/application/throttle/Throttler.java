package com.ryuqq.bulkwriter.application.throttle;

import com.ryuqq.bulkwriter.core.error.ThrottlerException;
import com.ryuqq.bulkwriter.core.task.TaskResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * 동시 실행 수와 시작 속도를 제한하는 비동기 작업 스케줄러.
 *
 * <p>작업은 "생성기"(호출되면 실행 중인 비동기 작업을 반환하는 함수)로 제출됩니다.
 * 생성기는 제출 즉시가 아니라 스케줄러가 허용할 때 호출됩니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * enqueueTask(generator)   → 큐에 추가, index 부여
 *   ↓
 * scheduler loop:
 *   1. 큐가 닫혔고 비었고 실행 중인 작업이 없으면 종료
 *   2. 허용되면 (병렬 한도, 속도 한도) 생성기 호출 → running 추가
 *   3. 아니면 다음 윈도우 경계 또는 완료 신호까지 대기
 *   4. 완료된 작업 정리
 *   ↓
 * waitForCompletion()      → 큐 닫기, 모두 끝날 때까지 대기, index 순 결과 반환
 * </pre>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>생성기의 동기 예외와 비동기 실패는 동일하게 기록됨</li>
 *   <li>quitOnFailure이면 실패를 본 즉시 새 작업 시작 중단, 실행 중인 작업은 끝까지 대기 후 집계 예외</li>
 * </ul>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public interface Throttler extends AutoCloseable {

    /**
     * 작업 제출. 즉시 반환합니다.
     *
     * @param generator 실행 중인 작업을 반환하는 함수
     * @throws IllegalStateException 큐가 이미 닫힌 경우
     */
    void enqueueTask(Supplier<? extends CompletionStage<?>> generator);

    /**
     * 작업 제출 후 그 작업이 끝나면 완료되는 future 반환.
     *
     * <p>quitOnFailure이고 작업이 실패했으면 future는 그 원인으로 예외 완료됩니다.
     * 실패나 취소로 스케줄러가 이미 멈췄으면 {@link java.util.concurrent.CancellationException}으로 완료됩니다.</p>
     *
     * @param generator 실행 중인 작업을 반환하는 함수
     * @return 작업 결과 future
     */
    CompletableFuture<TaskResult> enqueueAndWait(Supplier<? extends CompletionStage<?>> generator);

    /**
     * 큐를 닫고 모든 작업이 끝날 때까지 대기.
     *
     * @return 모든 작업 결과 (index 순)
     * @throws ThrottlerException quitOnFailure이고 실패한 작업이 있는 경우
     * @throws InterruptedException 대기 중 인터럽트
     */
    List<TaskResult> waitForCompletion() throws InterruptedException;

    /**
     * 스케줄러를 즉시 중단합니다. 실행 중인 작업은 기다리지 않습니다.
     */
    @Override
    void close();
}
