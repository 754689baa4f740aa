package com.ryuqq.bulkwriter.application.throttle;

import java.time.Duration;

/**
 * Throttler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxParallelism: 동시 실행 작업 수 한도, 0 이하이면 무제한</li>
 *   <li>maxPerUnit: unit 동안 시작할 수 있는 작업 수, 0 이하이면 속도 제한 없음</li>
 *   <li>unit: 속도 제한 윈도우 (기본 1초)</li>
 *   <li>quitOnFailure: 첫 실패 후 새 작업 시작 중단 (기본 false)</li>
 *   <li>keepAllResults: 완료 기록을 정리하지 않고 모두 보관 (기본 true)</li>
 * </ul>
 *
 * <p>속도 제한이 있으면 unit / maxPerUnit 길이의 하위 윈도우마다 최대 한 작업만 시작해서
 * 윈도우 초반에 몰렸다가 쉬는 대신 고르게 시작합니다.</p>
 *
 * @param maxParallelism 동시 실행 한도
 * @param maxPerUnit 윈도우당 시작 한도
 * @param unit 윈도우 길이
 * @param quitOnFailure 실패 시 중단 여부
 * @param keepAllResults 모든 결과 보관 여부
 * @author BulkWriter Team
 * @since 1.0.0
 */
public record ThrottlerConfig(
    int maxParallelism,
    int maxPerUnit,
    Duration unit,
    boolean quitOnFailure,
    boolean keepAllResults
) {

    public ThrottlerConfig() {
        this(0, 0, Duration.ofSeconds(1), false, true);
    }

    public ThrottlerConfig {
        if (maxParallelism < 0) {
            throw new IllegalArgumentException("maxParallelism must not be negative (current: " + maxParallelism + ")");
        }
        if (maxPerUnit < 0) {
            throw new IllegalArgumentException("maxPerUnit must not be negative (current: " + maxPerUnit + ")");
        }
        if (unit == null) {
            unit = Duration.ofSeconds(1);
        }
        if (unit.isZero() || unit.isNegative()) {
            throw new IllegalArgumentException("unit must be positive (current: " + unit + ")");
        }
    }

    /**
     * 병렬 한도만 지정한 설정.
     */
    public static ThrottlerConfig ofParallelism(int maxParallelism, boolean quitOnFailure) {
        return new ThrottlerConfig(maxParallelism, 0, Duration.ofSeconds(1), quitOnFailure, true);
    }

    public boolean isRateLimited() {
        return maxPerUnit > 0;
    }

    public boolean isParallelismLimited() {
        return maxParallelism > 0;
    }

    /**
     * @return 하위 윈도우 길이 (속도 제한이 없으면 unit)
     */
    public Duration subWindow() {
        return isRateLimited() ? unit.dividedBy(maxPerUnit) : unit;
    }

    public ThrottlerConfig withMaxParallelism(int maxParallelism) {
        return new ThrottlerConfig(maxParallelism, maxPerUnit, unit, quitOnFailure, keepAllResults);
    }

    public ThrottlerConfig withRateLimit(int maxPerUnit, Duration unit) {
        return new ThrottlerConfig(maxParallelism, maxPerUnit, unit, quitOnFailure, keepAllResults);
    }

    public ThrottlerConfig withQuitOnFailure(boolean quitOnFailure) {
        return new ThrottlerConfig(maxParallelism, maxPerUnit, unit, quitOnFailure, keepAllResults);
    }

    public ThrottlerConfig withKeepAllResults(boolean keepAllResults) {
        return new ThrottlerConfig(maxParallelism, maxPerUnit, unit, quitOnFailure, keepAllResults);
    }
}
