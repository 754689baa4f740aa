package com.ryuqq.bulkwriter.application.classify;

import com.ryuqq.bulkwriter.core.error.ClassifiedError;
import com.ryuqq.bulkwriter.core.model.RequestType;
import com.ryuqq.bulkwriter.core.spi.RemoteFailure;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 원격 실패를 {@link ClassifiedError}로 변환합니다.
 *
 * <p><strong>분류 순서:</strong></p>
 * <ol>
 *   <li>{@link RemoteFailure}가 아니면 (전송 오류 등) FATAL_FAILURE</li>
 *   <li>상태 코드가 500 이상이거나 400/409/422가 아니면 FATAL_FAILURE</li>
 *   <li>요청 종류별 {@link FailureParser}로 해석, 인식 못하면 FATAL_FAILURE</li>
 * </ol>
 *
 * <p>순수 함수이며 I/O나 부수 효과가 없습니다. 오류 메시지 파싱은 모두 이 클래스와 파서 안에 있습니다.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class ErrorClassifier {

    private static final Set<Integer> CLASSIFIABLE_STATUSES = Set.of(400, 409, 422);

    private final Map<RequestType, FailureParser> parsers;

    /**
     * 기본 파서 구성.
     */
    public ErrorClassifier() {
        this(defaultParsers());
    }

    public ErrorClassifier(Map<RequestType, FailureParser> parsers) {
        if (parsers == null) {
            throw new IllegalArgumentException("parsers cannot be null");
        }
        this.parsers = new EnumMap<>(RequestType.class);
        this.parsers.putAll(parsers);
    }

    public static Map<RequestType, FailureParser> defaultParsers() {
        Map<RequestType, FailureParser> defaults = new EnumMap<>(RequestType.class);
        defaults.put(RequestType.CREATE_ASSETS, new AssetFailureParser());
        defaults.put(RequestType.CREATE_EVENTS, new EventFailureParser());
        defaults.put(RequestType.CREATE_TIME_SERIES, new TimeSeriesFailureParser());
        defaults.put(RequestType.UPSERT_INSTANCES, new InstanceFailureParser());
        return defaults;
    }

    /**
     * 실패 분류.
     *
     * @param failure 원격 호출에서 발생한 예외
     * @param type 요청 종류
     * @param <T> 쓰기 항목 타입
     * @return 분류된 오류 (원본 예외가 cause로 포함됨)
     * @throws IllegalArgumentException failure 또는 type이 null인 경우
     */
    public <T> ClassifiedError<T> classify(Throwable failure, RequestType type) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        Throwable cause = unwrap(failure);
        if (!(cause instanceof RemoteFailure remote)) {
            return ClassifiedError.fatal(0, String.valueOf(cause.getMessage()), cause);
        }
        int status = remote.getStatus();
        if (status >= 500 || !CLASSIFIABLE_STATUSES.contains(status)) {
            return ClassifiedError.fatal(status, remote.getMessage(), remote);
        }
        FailureParser parser = parsers.get(type);
        Optional<FailureMatch> match = parser == null ? Optional.empty() : parser.parse(remote);
        if (match.isEmpty()) {
            return ClassifiedError.fatal(status, remote.getMessage(), remote);
        }
        FailureMatch found = match.get();
        return ClassifiedError.<T>of(found.kind(), found.tag(), found.values(), status, remote.getMessage(), remote)
            .withComplete(found.complete());
    }

    /**
     * 비동기 래퍼 예외를 벗깁니다.
     */
    public static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
