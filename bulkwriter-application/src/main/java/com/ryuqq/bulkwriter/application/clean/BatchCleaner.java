package com.ryuqq.bulkwriter.application.clean;

import com.ryuqq.bulkwriter.core.cancel.CancellationToken;
import com.ryuqq.bulkwriter.core.error.ClassifiedError;
import com.ryuqq.bulkwriter.core.model.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 분류된 오류에 해당하는 항목을 배치에서 제거합니다.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>오류가 null이면 배치 그대로</li>
 *   <li>불완전한 오류는 먼저 {@link ErrorCompleter}로 완성, 실패하면 배치 그대로</li>
 *   <li>식별자 집합이 비어있으면 전체 배치를 skipped로 기록하고 빈 배치 반환</li>
 *   <li>그 외에는 오류 태그의 필드 값이 식별자 집합에 있는 항목만 제거</li>
 *   <li>일치하는 항목이 하나도 없으면 전체 배치를 skipped로 기록하고 빈 배치 반환</li>
 * </ul>
 *
 * <p>결과 배치는 항상 입력의 부분집합이며, 비어있지 않은 배치에 대해 완성된 오류로 호출하면
 * 항상 입력보다 작아집니다. 재시도 루프의 종료는 이 성질에 기대고 있습니다.</p>
 *
 * @param <T> 쓰기 항목 타입
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class BatchCleaner<T> {

    private static final Logger log = LoggerFactory.getLogger(BatchCleaner.class);

    private final IdentityAccessors<T> accessors;
    private final ErrorCompleter<T> completer;

    public BatchCleaner(IdentityAccessors<T> accessors) {
        this(accessors, ErrorCompleter.none());
    }

    public BatchCleaner(IdentityAccessors<T> accessors, ErrorCompleter<T> completer) {
        if (accessors == null) {
            throw new IllegalArgumentException("accessors cannot be null");
        }
        if (completer == null) {
            throw new IllegalArgumentException("completer cannot be null");
        }
        this.accessors = accessors;
        this.completer = completer;
    }

    /**
     * 오류에 해당하는 항목 제거.
     *
     * @param error 분류된 오류 (null 허용)
     * @param batch 현재 배치
     * @param token 취소 토큰 (추가 조회에 사용)
     * @return 남은 배치와 갱신된 오류
     */
    public CleanedBatch<T> clean(ClassifiedError<T> error, List<T> batch, CancellationToken token) {
        if (batch == null) {
            throw new IllegalArgumentException("batch cannot be null");
        }
        if (error == null) {
            return new CleanedBatch<>(batch, null);
        }

        ClassifiedError<T> current = error;
        if (!current.complete()) {
            current = completer.complete(current, batch, token);
            if (!current.complete()) {
                log.warn("Could not complete {} error for {} items, batch left unchanged", current.tag(), batch.size());
                return new CleanedBatch<>(batch, current);
            }
        }

        if (current.values().isEmpty()) {
            List<Identity> all = new ArrayList<>(batch.size());
            for (T item : batch) {
                Identity identity = accessors.identityOf(item);
                if (identity != null) {
                    all.add(identity);
                }
            }
            return new CleanedBatch<>(List.of(), current.withValues(all).withSkipped(batch));
        }

        Set<Identity> bad = new HashSet<>(current.values());
        List<T> kept = new ArrayList<>(batch.size());
        List<T> skipped = new ArrayList<>();
        for (T item : batch) {
            if (isAffected(item, bad, current)) {
                skipped.add(item);
            } else {
                kept.add(item);
            }
        }

        if (skipped.isEmpty()) {
            log.debug("No item matched {} values of {} error, skipping the whole batch of {}",
                bad.size(), current.tag(), batch.size());
            return new CleanedBatch<>(List.of(), current.withSkipped(batch));
        }
        log.debug("Removed {} of {} items for {} {}", skipped.size(), batch.size(), current.kind(), current.tag());
        return new CleanedBatch<>(kept, current.withSkipped(skipped));
    }

    private boolean isAffected(T item, Set<Identity> bad, ClassifiedError<T> error) {
        Collection<Identity> values = accessors.valuesOf(error.tag(), item);
        for (Identity value : values) {
            if (bad.contains(value)) {
                return true;
            }
        }
        return false;
    }
}
