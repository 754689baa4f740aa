package com.ryuqq.bulkwriter.application.writer;

import com.ryuqq.bulkwriter.core.policy.RetryMode;
import com.ryuqq.bulkwriter.core.policy.SanitationMode;

/**
 * 청크 단위 쓰기 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>chunkSize: 청크당 항목 수 (기본 1000)</li>
 *   <li>throttleSize: 동시에 실행할 청크 수 (기본 4)</li>
 *   <li>retryMode: 실패 시 재시도 정책 (기본 ON_ERROR)</li>
 *   <li>sanitationMode: 로컬 검증 방식 (기본 CLEAN)</li>
 *   <li>progressListener: 청크 완료 알림 (기본 없음)</li>
 *   <li>maxDuplicateRounds: 중복 항목 재조회 최대 횟수 (기본 8)</li>
 *   <li>maxIncompleteStalls: 불완전 오류로 배치가 줄지 않은 연속 횟수 한도 (기본 3)</li>
 * </ul>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public record WriteOptions(
    int chunkSize,
    int throttleSize,
    RetryMode retryMode,
    SanitationMode sanitationMode,
    ProgressListener progressListener,
    int maxDuplicateRounds,
    int maxIncompleteStalls
) {

    public WriteOptions() {
        this(1000, 4, RetryMode.ON_ERROR, SanitationMode.CLEAN, ProgressListener.NONE, 8, 3);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WriteOptions {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive (current: " + chunkSize + ")");
        }
        if (throttleSize <= 0) {
            throw new IllegalArgumentException("throttleSize must be positive (current: " + throttleSize + ")");
        }
        if (retryMode == null) {
            throw new IllegalArgumentException("retryMode cannot be null");
        }
        if (sanitationMode == null) {
            throw new IllegalArgumentException("sanitationMode cannot be null");
        }
        if (maxDuplicateRounds <= 0) {
            throw new IllegalArgumentException(
                "maxDuplicateRounds must be positive (current: " + maxDuplicateRounds + ")");
        }
        if (maxIncompleteStalls <= 0) {
            throw new IllegalArgumentException(
                "maxIncompleteStalls must be positive (current: " + maxIncompleteStalls + ")");
        }
        if (progressListener == null) {
            progressListener = ProgressListener.NONE;
        }
    }

    public WriteOptions withChunkSize(int chunkSize) {
        return new WriteOptions(chunkSize, throttleSize, retryMode, sanitationMode, progressListener,
            maxDuplicateRounds, maxIncompleteStalls);
    }

    public WriteOptions withThrottleSize(int throttleSize) {
        return new WriteOptions(chunkSize, throttleSize, retryMode, sanitationMode, progressListener,
            maxDuplicateRounds, maxIncompleteStalls);
    }

    public WriteOptions withRetryMode(RetryMode retryMode) {
        return new WriteOptions(chunkSize, throttleSize, retryMode, sanitationMode, progressListener,
            maxDuplicateRounds, maxIncompleteStalls);
    }

    public WriteOptions withSanitationMode(SanitationMode sanitationMode) {
        return new WriteOptions(chunkSize, throttleSize, retryMode, sanitationMode, progressListener,
            maxDuplicateRounds, maxIncompleteStalls);
    }

    public WriteOptions withProgressListener(ProgressListener progressListener) {
        return new WriteOptions(chunkSize, throttleSize, retryMode, sanitationMode, progressListener,
            maxDuplicateRounds, maxIncompleteStalls);
    }

    public WriteOptions withMaxDuplicateRounds(int maxDuplicateRounds) {
        return new WriteOptions(chunkSize, throttleSize, retryMode, sanitationMode, progressListener,
            maxDuplicateRounds, maxIncompleteStalls);
    }

    public WriteOptions withMaxIncompleteStalls(int maxIncompleteStalls) {
        return new WriteOptions(chunkSize, throttleSize, retryMode, sanitationMode, progressListener,
            maxDuplicateRounds, maxIncompleteStalls);
    }
}
