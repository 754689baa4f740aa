package com.ryuqq.bulkwriter.core.error;

import java.util.List;

/**
 * TaskThrottler에서 하나 이상의 작업이 실패했음을 알리는 집계 예외.
 *
 * <p>각 실패 원인은 {@link #getSuppressed()}로 조회할 수 있으며,
 * 첫 번째 실패는 cause로도 연결됩니다.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class ThrottlerException extends RuntimeException {

    public static final String MESSAGE = "Failure in TaskThrottler";

    public ThrottlerException(List<? extends Throwable> failures) {
        super(MESSAGE, failures == null || failures.isEmpty() ? null : failures.get(0));
        if (failures != null) {
            failures.forEach(this::addSuppressed);
        }
    }

    /**
     * @return 집계된 실패 목록 (발생 순서가 아닌 제출 순서)
     */
    public List<Throwable> getFailures() {
        return List.of(getSuppressed());
    }
}
