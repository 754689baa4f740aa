package com.ryuqq.bulkwriter.core.error;

/**
 * {@link ClassifiedError}를 예외로 전달할 때 사용.
 *
 * <p>{@code BatchResult.throwOnFatal()} / {@code throwAll()}에서 던져집니다.
 * 원본 예외가 있으면 cause로 연결됩니다.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class ClassifiedErrorException extends RuntimeException {

    private final transient ClassifiedError<?> error;

    public ClassifiedErrorException(ClassifiedError<?> error) {
        super(describe(error), error == null ? null : error.cause());
        this.error = error;
    }

    public ClassifiedError<?> getError() {
        return error;
    }

    private static String describe(ClassifiedError<?> error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return error.kind() + "/" + error.tag() + " (status " + error.status() + "): " + error.message();
    }
}
