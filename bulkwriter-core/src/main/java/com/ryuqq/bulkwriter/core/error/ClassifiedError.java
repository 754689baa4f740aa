package com.ryuqq.bulkwriter.core.error;

import com.ryuqq.bulkwriter.core.model.ErrorKind;
import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.model.ResourceTag;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * 원격 실패 또는 로컬 검증 실패를 구조화한 오류.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>complete == false이면 values는 부분 집합일 뿐이므로 배치 필터링에 사용하면 안 됨</li>
 *   <li>values, skipped는 방어적 복사되어 불변</li>
 * </ul>
 *
 * @param kind 오류 종류
 * @param tag 오류가 가리키는 필드
 * @param values 문제가 된 식별자 집합 (비어있을 수 있음)
 * @param complete 식별자 집합이 완전한지 여부
 * @param status 원격 상태 코드 (로컬 오류이면 합성 값, 알 수 없으면 0)
 * @param message 원본 메시지
 * @param cause 원본 예외 (없으면 null)
 * @param skipped 이 오류로 인해 쓰이지 않은 항목
 * @param <T> 쓰기 항목 타입
 * @author BulkWriter Team
 * @since 1.0.0
 */
public record ClassifiedError<T>(
    ErrorKind kind,
    ResourceTag tag,
    Set<Identity> values,
    boolean complete,
    int status,
    String message,
    Throwable cause,
    List<T> skipped
) {

    public ClassifiedError {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (tag == null) {
            throw new IllegalArgumentException("tag cannot be null");
        }
        values = values == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(values));
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    /**
     * 분류 불가 실패 생성.
     *
     * @param status 상태 코드 (없으면 0)
     * @param message 메시지
     * @param cause 원본 예외
     * @param <T> 쓰기 항목 타입
     * @return FATAL_FAILURE 오류
     */
    public static <T> ClassifiedError<T> fatal(int status, String message, Throwable cause) {
        return new ClassifiedError<>(ErrorKind.FATAL_FAILURE, ResourceTag.NONE, Set.of(), true,
            status, message, cause, List.of());
    }

    /**
     * 식별자 집합이 완전한 복구 가능 오류 생성.
     */
    public static <T> ClassifiedError<T> of(ErrorKind kind, ResourceTag tag, Collection<Identity> values,
                                            int status, String message, Throwable cause) {
        return new ClassifiedError<>(kind, tag, values == null ? Set.of() : new LinkedHashSet<>(values),
            true, status, message, cause, List.of());
    }

    public boolean isFatal() {
        return kind.isFatal();
    }

    public ClassifiedError<T> withValues(Collection<Identity> newValues) {
        return new ClassifiedError<>(kind, tag, newValues == null ? Set.of() : new LinkedHashSet<>(newValues),
            complete, status, message, cause, skipped);
    }

    public ClassifiedError<T> withComplete(boolean newComplete) {
        return new ClassifiedError<>(kind, tag, values, newComplete, status, message, cause, skipped);
    }

    public ClassifiedError<T> withSkipped(Collection<T> newSkipped) {
        return new ClassifiedError<>(kind, tag, values, complete, status, message, cause,
            newSkipped == null ? List.of() : new ArrayList<>(newSkipped));
    }

    public ClassifiedError<T> withMessage(String newMessage) {
        return new ClassifiedError<>(kind, tag, values, complete, status, newMessage, cause, skipped);
    }

    /**
     * skipped 항목의 타입을 변환합니다. 나머지 오류 정보는 그대로 유지됩니다.
     *
     * @param replace 항목 변환 함수
     * @param <U> 새 항목 타입
     * @return 변환된 오류
     */
    public <U> ClassifiedError<U> replaceSkipped(Function<? super T, ? extends U> replace) {
        if (replace == null) {
            throw new IllegalArgumentException("replace cannot be null");
        }
        List<U> replaced = new ArrayList<>(skipped.size());
        for (T item : skipped) {
            replaced.add(replace.apply(item));
        }
        return new ClassifiedError<>(kind, tag, values, complete, status, message, cause, replaced);
    }

    /**
     * 같은 종류/태그의 오류 여러 개를 하나로 합칩니다.
     *
     * <p>values와 skipped는 순서대로 이어붙이고, status/message/cause는 첫 번째 오류의 것을 사용합니다.
     * 하나라도 불완전하면 결과도 불완전합니다.</p>
     *
     * @param errors 합칠 오류 (최소 1개, 모두 같은 kind/tag)
     * @param <T> 쓰기 항목 타입
     * @return 합쳐진 오류
     * @throws IllegalArgumentException 비어있거나 kind/tag가 섞인 경우
     */
    public static <T> ClassifiedError<T> merge(List<ClassifiedError<T>> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("errors cannot be null or empty");
        }
        ClassifiedError<T> first = errors.get(0);
        Set<Identity> mergedValues = new LinkedHashSet<>();
        List<T> mergedSkipped = new ArrayList<>();
        boolean allComplete = true;
        for (ClassifiedError<T> error : errors) {
            if (error.kind() != first.kind() || error.tag() != first.tag()) {
                throw new IllegalArgumentException(
                    "Cannot merge " + error.kind() + "/" + error.tag() + " into " + first.kind() + "/" + first.tag()
                );
            }
            mergedValues.addAll(error.values());
            mergedSkipped.addAll(error.skipped());
            allComplete &= error.complete();
        }
        return new ClassifiedError<>(first.kind(), first.tag(), mergedValues, allComplete,
            first.status(), first.message(), first.cause(), mergedSkipped);
    }

    @Override
    public String toString() {
        return "ClassifiedError{kind=" + kind + ", tag=" + tag + ", status=" + status
            + ", values=" + values.size() + ", skipped=" + skipped.size()
            + ", complete=" + complete + ", message='" + message + "'}";
    }
}
