package com.ryuqq.bulkwriter.core.spi;

import java.util.List;
import java.util.Map;

/**
 * 원격 경계가 반환한 구조화된 실패.
 *
 * <p>HTTP 전송 계층 구현체는 응답 오류를 이 예외로 변환해서 던집니다.
 * missing/duplicated는 필드명 → 값 맵의 목록입니다 (예: {@code {"externalId": "a"}}, {@code {"id": 42}}).</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class RemoteFailure extends RuntimeException {

    private final int status;
    private final String requestId;
    private final List<Map<String, Object>> missing;
    private final List<Map<String, Object>> duplicated;

    public RemoteFailure(int status, String message) {
        this(status, message, null, List.of(), List.of());
    }

    public RemoteFailure(int status, String message, String requestId,
                         List<Map<String, Object>> missing, List<Map<String, Object>> duplicated) {
        super(message);
        this.status = status;
        this.requestId = requestId;
        this.missing = missing == null ? List.of() : List.copyOf(missing);
        this.duplicated = duplicated == null ? List.of() : List.copyOf(duplicated);
    }

    public static RemoteFailure missing(int status, String message, List<Map<String, Object>> missing) {
        return new RemoteFailure(status, message, null, missing, List.of());
    }

    public static RemoteFailure duplicated(int status, String message, List<Map<String, Object>> duplicated) {
        return new RemoteFailure(status, message, null, List.of(), duplicated);
    }

    public int getStatus() {
        return status;
    }

    public String getRequestId() {
        return requestId;
    }

    public List<Map<String, Object>> getMissing() {
        return missing;
    }

    public List<Map<String, Object>> getDuplicated() {
        return duplicated;
    }

    @Override
    public String toString() {
        return "RemoteFailure{status=" + status + ", message='" + getMessage() + "', requestId=" + requestId
            + ", missing=" + missing.size() + ", duplicated=" + duplicated.size() + '}';
    }
}
