package com.ryuqq.bulkwriter.core.policy;

/**
 * 쓰기 실패 시 재시도 정책.
 *
 * <p><strong>동작 요약:</strong></p>
 * <ul>
 *   <li>NONE: 첫 실패에서 오류를 기록하고 중단 (나머지 항목은 쓰지 않음)</li>
 *   <li>ON_ERROR: 문제 항목을 제거하고 나머지를 재시도</li>
 *   <li>ON_ERROR_KEEP_DUPLICATES: ON_ERROR + 이미 존재하는 항목을 다시 조회해 결과에 포함</li>
 *   <li>ON_FATAL: ON_ERROR + 치명 오류 시 고정 간격으로 같은 배치 재시도</li>
 *   <li>ON_FATAL_KEEP_DUPLICATES: ON_FATAL + 중복 항목 재조회</li>
 * </ul>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public enum RetryMode {
    NONE,
    ON_ERROR,
    ON_ERROR_KEEP_DUPLICATES,
    ON_FATAL,
    ON_FATAL_KEEP_DUPLICATES;

    /**
     * @return 치명 오류에서도 같은 배치를 재시도하는지 여부
     */
    public boolean retriesFatal() {
        return this == ON_FATAL || this == ON_FATAL_KEEP_DUPLICATES;
    }

    /**
     * @return 이미 존재하는 항목을 다시 조회해 결과에 포함하는지 여부
     */
    public boolean keepsDuplicates() {
        return this == ON_ERROR_KEEP_DUPLICATES || this == ON_FATAL_KEEP_DUPLICATES;
    }

    /**
     * @return 실패 항목을 제거하고 재시도하는지 여부
     */
    public boolean cleansBatch() {
        return this != NONE;
    }
}
