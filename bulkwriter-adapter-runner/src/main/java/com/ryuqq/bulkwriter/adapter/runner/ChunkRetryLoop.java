package com.ryuqq.bulkwriter.adapter.runner;

import com.ryuqq.bulkwriter.application.classify.ErrorClassifier;
import com.ryuqq.bulkwriter.application.clean.BatchCleaner;
import com.ryuqq.bulkwriter.application.clean.CleanedBatch;
import com.ryuqq.bulkwriter.application.writer.ItemBuilder;
import com.ryuqq.bulkwriter.application.writer.ResourceBinding;
import com.ryuqq.bulkwriter.application.writer.WriteOptions;
import com.ryuqq.bulkwriter.core.cancel.CancellationToken;
import com.ryuqq.bulkwriter.core.error.ClassifiedError;
import com.ryuqq.bulkwriter.core.model.ErrorKind;
import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.model.ResourceTag;
import com.ryuqq.bulkwriter.core.policy.RetryMode;
import com.ryuqq.bulkwriter.core.result.BatchResult;
import com.ryuqq.bulkwriter.core.sanitation.SanitationResult;
import com.ryuqq.bulkwriter.core.spi.CreateCapable;
import com.ryuqq.bulkwriter.core.spi.Identifiable;
import com.ryuqq.bulkwriter.core.spi.RetrieveCapable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * 청크 하나의 쓰기와 재시도.
 *
 * <p><strong>쓰기 재시도 흐름:</strong></p>
 * <pre>
 * while (batch 비어있지 않음):
 *   취소 확인
 *   write(batch) 성공 → 결과 반환
 *   실패 → classify
 *     FATAL + ON_FATAL* → fatalDelay 대기 후 같은 batch
 *     NONE              → 오류 기록 후 중단
 *     그 외             → BatchCleaner로 문제 항목 제거, 오류 기록, 남은 batch로 반복
 * </pre>
 *
 * <p>불완전한 오류로 배치가 줄지 않는 라운드가 maxIncompleteStalls번 이어지면
 * 남은 배치를 skipped로 기록하고 멈춥니다.</p>
 *
 * @param <T> 쓰기 항목 타입
 * @author BulkWriter Team
 * @since 1.0.0
 */
class ChunkRetryLoop<T> {

    private static final Logger log = LoggerFactory.getLogger(ChunkRetryLoop.class);

    private final ResourceBinding<T> binding;
    private final BatchCleaner<T> cleaner;
    private final ErrorClassifier classifier;
    private final BackoffCalculator backoff;
    private final WriteOptions options;
    private final CancellationToken token;

    ChunkRetryLoop(ResourceBinding<T> binding, ErrorClassifier classifier, BackoffCalculator backoff,
                   WriteOptions options, CancellationToken token) {
        this.binding = binding;
        this.cleaner = binding.batchCleaner();
        this.classifier = classifier;
        this.backoff = backoff;
        this.options = options;
        this.token = token;
    }

    /**
     * 배치를 쓰고 실패하면 retryMode에 따라 재시도합니다.
     *
     * @param items 쓸 항목
     * @param write 원격 쓰기 호출
     * @return 쓰인 항목과 기록된 오류
     * @throws CancellationException 취소된 경우
     */
    <R> BatchResult<R, T> writeWithRetry(List<T> items, Function<List<T>, List<R>> write) {
        List<ClassifiedError<T>> errors = new ArrayList<>();
        List<T> batch = items;
        int stalls = 0;

        while (!batch.isEmpty()) {
            token.throwIfCancellationRequested();
            List<R> written;
            try {
                written = write.apply(batch);
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                ClassifiedError<T> error = classifier.classify(e, binding.requestType());
                log.debug("Failed to write {} items ({}): {}", batch.size(), binding.requestType(), error);

                if (error.isFatal() && options.retryMode().retriesFatal()) {
                    log.warn("Fatal failure writing {} items ({}), retrying in {} ms: {}",
                        batch.size(), binding.requestType(), backoff.getFatalDelayMs(), error.message());
                    token.sleep(backoff.fatalDelay());
                    continue;
                }
                if (options.retryMode() == RetryMode.NONE) {
                    errors.add(error);
                    break;
                }

                CleanedBatch<T> cleaned = cleaner.clean(error, batch, token);
                if (cleaned.items().size() < batch.size()) {
                    stalls = 0;
                    errors.add(cleaned.error());
                    batch = cleaned.items();
                    continue;
                }
                stalls++;
                if (stalls >= options.maxIncompleteStalls()) {
                    log.warn("Giving up on {} items after {} rounds without progress on {} error",
                        batch.size(), stalls, error.tag());
                    errors.add(cleaned.error().withSkipped(batch));
                    break;
                }
                continue;
            }
            log.debug("Wrote {} items ({})", written.size(), binding.requestType());
            return new BatchResult<>(written, errors);
        }
        return new BatchResult<>(List.of(), errors);
    }

    /**
     * 식별자로 조회하고 없는 것을 만들어 생성합니다.
     *
     * <p>KEEP_DUPLICATES 모드에서는 생성 중 "이미 존재" 충돌이 난 외부 ID를
     * 지수 백오프 후 다시 조회/생성합니다 (최대 maxDuplicateRounds회). 충돌 오류는 결과에 남습니다.</p>
     */
    <R extends Identifiable, C extends RetrieveCapable<R> & CreateCapable<T, R>> BatchResult<R, T> getOrCreate(
        List<Identity> ids, ItemBuilder<T> builder, C resource) {

        BatchResult<R, T> result = getOrCreateOnce(ids, builder, resource);
        if (!options.retryMode().keepsDuplicates()) {
            return result;
        }

        BatchResult<R, T> latest = result;
        for (int attempt = 0; attempt < options.maxDuplicateRounds(); attempt++) {
            Set<Identity> duplicated = duplicatedExternalIds(latest);
            if (duplicated.isEmpty()) {
                return result;
            }
            log.debug("Found {} duplicated items, retrying", duplicated.size());
            token.sleep(backoff.duplicateDelay(attempt));
            latest = getOrCreateOnce(List.copyOf(duplicated), builder, resource);
            result = result.merge(latest);
        }

        Set<Identity> remaining = duplicatedExternalIds(latest);
        if (!remaining.isEmpty()) {
            log.warn("Giving up on {} duplicated items after {} rounds", remaining.size(), options.maxDuplicateRounds());
        }
        return result;
    }

    private <R extends Identifiable, C extends RetrieveCapable<R> & CreateCapable<T, R>> BatchResult<R, T> getOrCreateOnce(
        List<Identity> ids, ItemBuilder<T> builder, C resource) {

        token.throwIfCancellationRequested();
        List<R> found;
        try {
            found = resource.retrieve(ids, true, token);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            ClassifiedError<T> error = classifier.classify(e, binding.requestType());
            log.warn("Failed to retrieve {} items ({}): {}", ids.size(), binding.requestType(), error);
            return BatchResult.ofError(error);
        }
        log.debug("Retrieved {} of {} items", found.size(), ids.size());

        Set<Identity> foundIds = new HashSet<>();
        for (R item : found) {
            foundIds.add(item.identity());
            if (item.id() != null) {
                foundIds.add(Identity.of(item.id()));
            }
            if (item.externalId() != null) {
                foundIds.add(Identity.of(item.externalId()));
            }
        }
        List<Identity> missing = ids.stream()
            .filter(id -> !foundIds.contains(id))
            .distinct()
            .toList();
        if (missing.isEmpty()) {
            return BatchResult.ofResults(found);
        }

        log.debug("Could not fetch {} out of {} items. Attempting to create the missing ones", missing.size(), ids.size());
        List<T> toCreate = build(builder, missing);
        SanitationResult<T> sanitized = binding.requestCleaner().clean(toCreate, options.sanitationMode());
        BatchResult<R, T> created = writeWithRetry(sanitized.items(), batch -> resource.create(batch, token));

        List<R> results = new ArrayList<>(created.results());
        results.addAll(found);
        List<ClassifiedError<T>> errors = new ArrayList<>(created.errors());
        errors.addAll(sanitized.errors());
        return new BatchResult<>(results, errors);
    }

    private List<T> build(ItemBuilder<T> builder, List<Identity> missing) {
        try {
            List<T> built = builder.build(missing).toCompletableFuture().join();
            return built == null ? List.of() : built;
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static Set<Identity> duplicatedExternalIds(BatchResult<?, ?> result) {
        Set<Identity> duplicated = new LinkedHashSet<>();
        for (ClassifiedError<?> error : result.errors()) {
            if (error.kind() == ErrorKind.ITEM_EXISTS && error.tag() == ResourceTag.EXTERNAL_ID) {
                for (Identity value : error.values()) {
                    if (value.getExternalId() != null && !value.isInstanceId()) {
                        duplicated.add(value);
                    }
                }
            }
        }
        return duplicated;
    }
}
