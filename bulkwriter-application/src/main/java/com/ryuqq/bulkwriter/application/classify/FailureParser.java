package com.ryuqq.bulkwriter.application.classify;

import com.ryuqq.bulkwriter.core.spi.RemoteFailure;

import java.util.Optional;

/**
 * 특정 요청 종류의 원격 실패 해석기.
 *
 * <p>구조화된 missing/duplicated 목록을 우선 보고, 없으면 알려진 메시지 접두어로 판별합니다.
 * 인식하지 못한 실패는 빈 Optional을 반환하며, 이 경우 분류기는 FATAL_FAILURE로 처리합니다.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FailureParser {

    /**
     * @param failure 400/409/422 원격 실패
     * @return 인식한 경우 해석 결과
     */
    Optional<FailureMatch> parse(RemoteFailure failure);
}
