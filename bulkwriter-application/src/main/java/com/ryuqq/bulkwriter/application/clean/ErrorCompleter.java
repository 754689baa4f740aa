package com.ryuqq.bulkwriter.application.clean;

import com.ryuqq.bulkwriter.core.cancel.CancellationToken;
import com.ryuqq.bulkwriter.core.error.ClassifiedError;

import java.util.List;

/**
 * 불완전한 오류(complete=false)의 식별자 집합을 추가 조회로 채웁니다.
 *
 * <p>조회에 실패하면 오류를 불완전한 상태 그대로 반환해야 합니다. 이 경우 호출자는 배치를 줄이지 못하며,
 * 재시도 루프의 정체(stall) 한도로 종료를 보장합니다.</p>
 *
 * @param <T> 쓰기 항목 타입
 * @author BulkWriter Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ErrorCompleter<T> {

    /**
     * @param error 불완전한 오류
     * @param batch 현재 배치
     * @param token 취소 토큰
     * @return 완성된 오류, 또는 완성하지 못했으면 입력 그대로
     */
    ClassifiedError<T> complete(ClassifiedError<T> error, List<T> batch, CancellationToken token);

    /**
     * 추가 조회를 하지 않는 completer.
     */
    static <T> ErrorCompleter<T> none() {
        return (error, batch, token) -> error;
    }
}
