package com.ryuqq.bulkwriter.core.sanitation;

import com.ryuqq.bulkwriter.core.error.ClassifiedError;

import java.util.List;

/**
 * 로컬 검증 결과: 요청에 남길 항목과 검증 오류.
 *
 * @param items 원격으로 보낼 항목
 * @param errors 중복/검증 실패 오류
 * @param <T> 쓰기 항목 타입
 * @author BulkWriter Team
 * @since 1.0.0
 */
public record SanitationResult<T>(List<T> items, List<ClassifiedError<T>> errors) {

    public SanitationResult {
        items = items == null ? List.of() : List.copyOf(items);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
