package com.ryuqq.bulkwriter.application.clean;

import com.ryuqq.bulkwriter.core.error.ClassifiedError;

import java.util.List;

/**
 * Batch Cleaner 결과: 재시도할 배치와 values/skipped가 채워진 오류.
 *
 * @param items 남은 항목
 * @param error 갱신된 오류 (입력 오류가 null이면 null)
 * @param <T> 쓰기 항목 타입
 * @author BulkWriter Team
 * @since 1.0.0
 */
public record CleanedBatch<T>(List<T> items, ClassifiedError<T> error) {

    public CleanedBatch {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
