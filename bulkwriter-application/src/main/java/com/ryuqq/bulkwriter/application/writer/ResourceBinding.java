package com.ryuqq.bulkwriter.application.writer;

import com.ryuqq.bulkwriter.application.clean.BatchCleaner;
import com.ryuqq.bulkwriter.application.clean.ErrorCompleter;
import com.ryuqq.bulkwriter.application.clean.IdentityAccessors;
import com.ryuqq.bulkwriter.core.model.RequestType;
import com.ryuqq.bulkwriter.core.sanitation.RequestCleaner;

/**
 * 리소스 타입 하나를 재시도 엔진에 연결하는 설정 묶음.
 *
 * @param requestType 오류 분류에 사용할 요청 종류
 * @param accessors 태그별 필드 추출 테이블
 * @param requestCleaner 로컬 검증 규칙
 * @param completer 불완전 오류 보완 (없으면 {@link ErrorCompleter#none()})
 * @param <T> 쓰기 항목 타입
 * @author BulkWriter Team
 * @since 1.0.0
 */
public record ResourceBinding<T>(
    RequestType requestType,
    IdentityAccessors<T> accessors,
    RequestCleaner<T> requestCleaner,
    ErrorCompleter<T> completer
) {

    public ResourceBinding {
        if (requestType == null) {
            throw new IllegalArgumentException("requestType cannot be null");
        }
        if (accessors == null) {
            throw new IllegalArgumentException("accessors cannot be null");
        }
        if (requestCleaner == null) {
            throw new IllegalArgumentException("requestCleaner cannot be null");
        }
        if (completer == null) {
            completer = ErrorCompleter.none();
        }
    }

    public BatchCleaner<T> batchCleaner() {
        return new BatchCleaner<>(accessors, completer);
    }

    public ResourceBinding<T> withCompleter(ErrorCompleter<T> completer) {
        return new ResourceBinding<>(requestType, accessors, requestCleaner, completer);
    }
}
