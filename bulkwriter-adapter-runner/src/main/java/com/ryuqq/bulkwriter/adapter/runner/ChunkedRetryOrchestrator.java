package com.ryuqq.bulkwriter.adapter.runner;

import com.ryuqq.bulkwriter.application.classify.ErrorClassifier;
import com.ryuqq.bulkwriter.application.writer.BulkWriter;
import com.ryuqq.bulkwriter.application.writer.ItemBuilder;
import com.ryuqq.bulkwriter.application.writer.ResourceBinding;
import com.ryuqq.bulkwriter.application.writer.WriteOptions;
import com.ryuqq.bulkwriter.core.cancel.CancellationToken;
import com.ryuqq.bulkwriter.core.error.ThrottlerException;
import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.result.BatchResult;
import com.ryuqq.bulkwriter.core.sanitation.SanitationResult;
import com.ryuqq.bulkwriter.core.spi.CreateCapable;
import com.ryuqq.bulkwriter.core.spi.Identifiable;
import com.ryuqq.bulkwriter.core.spi.RetrieveCapable;
import com.ryuqq.bulkwriter.core.spi.UpsertCapable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link BulkWriter} 구현체.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * (ensureExists / upsert) RequestCleaner로 전체 입력 정리
 *   ↓
 * Chunking.chunkBy(chunkSize)
 *   ↓
 * 청크마다 생성기 하나 → TaskThrottler.runThrottled(throttleSize, quitOnFailure)
 *   각 생성기는 호출마다 새로 만든 worker pool에서 ChunkRetryLoop 실행
 *   ↓
 * 청크 결과를 제출 순서대로 병합, 정리 오류는 마지막에 추가
 * </pre>
 *
 * <p>취소는 {@link CancellationException}으로 전파되며 재시도하지 않습니다.
 * 청크 작업이 예외로 끝나면 {@link ThrottlerException}을 던집니다.</p>
 *
 * <p>ProgressListener는 청크 작업이 끝난 스레드에서 호출됩니다.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class ChunkedRetryOrchestrator implements BulkWriter {

    private static final Logger log = LoggerFactory.getLogger(ChunkedRetryOrchestrator.class);

    private final ErrorClassifier classifier;
    private final BackoffCalculator backoff;

    public ChunkedRetryOrchestrator() {
        this(new ErrorClassifier(), new BackoffCalculator());
    }

    /**
     * @param classifier 오류 분류기
     * @param backoff 재시도 대기 시간 계산기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ChunkedRetryOrchestrator(ErrorClassifier classifier, BackoffCalculator backoff) {
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        this.classifier = classifier;
        this.backoff = backoff;
    }

    @Override
    public <T, R extends Identifiable, C extends RetrieveCapable<R> & CreateCapable<T, R>> BatchResult<R, T> getOrCreate(
        List<Identity> ids,
        ItemBuilder<T> builder,
        ResourceBinding<T> binding,
        C resource,
        WriteOptions options,
        CancellationToken token
    ) {
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        if (builder == null) {
            throw new IllegalArgumentException("builder cannot be null");
        }
        validate(binding, resource, options, token);

        List<List<Identity>> chunks = Chunking.chunkBy(ids, options.chunkSize());
        log.debug("Getting or creating items ({}). Number of ids: {}. Number of chunks: {}",
            binding.requestType(), ids.size(), chunks.size());

        ChunkRetryLoop<T> loop = new ChunkRetryLoop<>(binding, classifier, backoff, options, token);
        return runChunks("getOrCreate", chunks, chunk -> loop.getOrCreate(chunk, builder, resource),
            null, options, token);
    }

    @Override
    public <T, R> BatchResult<R, T> ensureExists(
        List<T> items,
        ResourceBinding<T> binding,
        CreateCapable<T, R> resource,
        WriteOptions options,
        CancellationToken token
    ) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        validate(binding, resource, options, token);

        SanitationResult<T> sanitized = binding.requestCleaner().clean(items, options.sanitationMode());
        List<List<T>> chunks = Chunking.chunkBy(sanitized.items(), options.chunkSize());
        log.debug("Ensuring items ({}). Number of items: {}. Number of chunks: {}",
            binding.requestType(), sanitized.items().size(), chunks.size());

        ChunkRetryLoop<T> loop = new ChunkRetryLoop<>(binding, classifier, backoff, options, token);
        return runChunks("ensureExists", chunks,
            chunk -> loop.writeWithRetry(chunk, batch -> resource.create(batch, token)),
            sanitationPart(sanitized), options, token);
    }

    @Override
    public <T, R> BatchResult<R, T> upsert(
        List<T> items,
        ResourceBinding<T> binding,
        UpsertCapable<T, R> resource,
        WriteOptions options,
        CancellationToken token
    ) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        validate(binding, resource, options, token);

        SanitationResult<T> sanitized = binding.requestCleaner().clean(items, options.sanitationMode());
        List<List<T>> chunks = Chunking.chunkBy(sanitized.items(), options.chunkSize());
        log.debug("Upserting items ({}). Number of items: {}. Number of chunks: {}",
            binding.requestType(), sanitized.items().size(), chunks.size());

        ChunkRetryLoop<T> loop = new ChunkRetryLoop<>(binding, classifier, backoff, options, token);
        return runChunks("upsert", chunks,
            chunk -> loop.writeWithRetry(chunk, batch -> resource.upsert(batch, token)),
            sanitationPart(sanitized), options, token);
    }

    /**
     * 식별자로 조회합니다. 없는 식별자는 무시합니다.
     *
     * @param ids 식별자 (중복 제거 후 청크 단위로 조회)
     * @param resource 조회 대상
     * @param options chunkSize, throttleSize 사용
     * @param token 취소 토큰
     * @return 찾은 항목 (청크 순서)
     * @throws ThrottlerException 조회가 실패한 경우
     */
    public <R> List<R> retrieveIgnoringUnknown(List<Identity> ids, RetrieveCapable<R> resource,
                                               WriteOptions options, CancellationToken token) {
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }

        List<List<Identity>> chunks = Chunking.chunkBy(ids.stream().distinct().toList(), options.chunkSize());
        BatchResult<R, Object> merged = runChunks("retrieveIgnoringUnknown", chunks,
            chunk -> BatchResult.ofResults(resource.retrieve(chunk, true, token)), null, options, token);
        return merged.results();
    }

    private <I, R, T> BatchResult<R, T> runChunks(String operation,
                                                  List<List<I>> chunks,
                                                  Function<List<I>, BatchResult<R, T>> chunkTask,
                                                  BatchResult<R, T> trailing,
                                                  WriteOptions options,
                                                  CancellationToken token) {
        if (chunks.isEmpty()) {
            return trailing == null ? BatchResult.empty() : trailing;
        }

        int total = chunks.size();
        AtomicReferenceArray<BatchResult<R, T>> results = new AtomicReferenceArray<>(total);
        AtomicInteger workerCount = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(Math.min(options.throttleSize(), total), runnable -> {
            Thread thread = new Thread(runnable, "bulkwriter-" + operation + "-" + workerCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        try {
            List<Supplier<CompletionStage<?>>> generators = new ArrayList<>(total);
            for (int i = 0; i < total; i++) {
                int index = i;
                List<I> chunk = chunks.get(i);
                generators.add(() -> CompletableFuture.runAsync(() -> results.set(index, chunkTask.apply(chunk)), workers));
            }

            AtomicInteger completed = new AtomicInteger();
            TaskThrottler.runThrottled(generators, options.throttleSize(), taskResult -> {
                int done = completed.incrementAndGet();
                if (total > 1) {
                    log.debug("{} completed {}/{} tasks", operation, done, total);
                }
                options.progressListener().onChunkCompleted(done, total);
            }, token);
        } catch (ThrottlerException e) {
            for (Throwable failure : e.getFailures()) {
                if (failure instanceof CancellationException cancellation) {
                    throw cancellation;
                }
            }
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancellation = new CancellationException(operation + " interrupted");
            cancellation.initCause(e);
            throw cancellation;
        } finally {
            workers.shutdownNow();
        }

        List<BatchResult<R, T>> parts = new ArrayList<>(total + 1);
        for (int i = 0; i < total; i++) {
            parts.add(results.get(i));
        }
        if (trailing != null) {
            parts.add(trailing);
        }
        BatchResult<R, T> merged = BatchResult.mergeAll(parts);
        log.info("{} finished: {} results, {} errors in {} chunks",
            operation, merged.results().size(), merged.errors().size(), total);
        return merged;
    }

    private static <R, T> BatchResult<R, T> sanitationPart(SanitationResult<T> sanitized) {
        if (sanitized.errors().isEmpty()) {
            return null;
        }
        return new BatchResult<>(List.of(), sanitized.errors());
    }

    private static void validate(ResourceBinding<?> binding, Object resource, WriteOptions options,
                                 CancellationToken token) {
        if (binding == null) {
            throw new IllegalArgumentException("binding cannot be null");
        }
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
    }
}
