package com.ryuqq.bulkwriter.adapter.runner;

import java.time.Duration;

/**
 * 재시도 대기 시간 계산기.
 *
 * <p>두 종류의 재시도가 서로 다른 간격을 사용합니다:</p>
 * <ul>
 *   <li>중복 충돌 재조회: 지수 백오프, {@code duplicateBaseDelay * 2^attempt} (상한 없음, attempt는 0부터)</li>
 *   <li>치명 오류 재시도: 시도 횟수와 무관한 고정 간격</li>
 * </ul>
 *
 * <p><strong>예시 (기본값 duplicateBaseDelay=100ms, fatalDelay=1000ms):</strong></p>
 * <ul>
 *   <li>attempt=0: 100ms</li>
 *   <li>attempt=1: 200ms</li>
 *   <li>attempt=3: 800ms</li>
 *   <li>치명 오류: 항상 1000ms</li>
 * </ul>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long duplicateBaseDelayMs;
    private final long fatalDelayMs;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: duplicateBaseDelay=100ms, fatalDelay=1000ms</p>
     */
    public BackoffCalculator() {
        this(100, 1000);
    }

    /**
     * 커스텀 설정으로 생성. 테스트에서는 0을 넘겨 대기 없이 실행할 수 있습니다.
     *
     * @param duplicateBaseDelayMs 중복 재조회 기본 지연 (밀리초, 0 이상)
     * @param fatalDelayMs 치명 오류 재시도 지연 (밀리초, 0 이상)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long duplicateBaseDelayMs, long fatalDelayMs) {
        if (duplicateBaseDelayMs < 0) {
            throw new IllegalArgumentException(
                "duplicateBaseDelayMs must not be negative (current: " + duplicateBaseDelayMs + ")"
            );
        }
        if (fatalDelayMs < 0) {
            throw new IllegalArgumentException(
                "fatalDelayMs must not be negative (current: " + fatalDelayMs + ")"
            );
        }
        this.duplicateBaseDelayMs = duplicateBaseDelayMs;
        this.fatalDelayMs = fatalDelayMs;
    }

    /**
     * 중복 충돌 재조회 전 대기 시간.
     *
     * @param attempt 재조회 차수 (0부터 시작)
     * @return 대기 시간 (밀리초), 오버플로 시 Long.MAX_VALUE
     * @throws IllegalArgumentException attempt가 음수인 경우
     */
    public long calculate(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative (current: " + attempt + ")");
        }
        if (duplicateBaseDelayMs == 0) {
            return 0;
        }
        if (attempt >= 62 || duplicateBaseDelayMs > (Long.MAX_VALUE >> attempt)) {
            return Long.MAX_VALUE;
        }
        return duplicateBaseDelayMs << attempt;
    }

    public Duration duplicateDelay(int attempt) {
        return Duration.ofMillis(calculate(attempt));
    }

    public Duration fatalDelay() {
        return Duration.ofMillis(fatalDelayMs);
    }

    public long getDuplicateBaseDelayMs() {
        return duplicateBaseDelayMs;
    }

    public long getFatalDelayMs() {
        return fatalDelayMs;
    }
}
