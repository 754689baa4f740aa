package com.ryuqq.bulkwriter.core.result;

import com.ryuqq.bulkwriter.core.error.ClassifiedError;
import com.ryuqq.bulkwriter.core.error.ClassifiedErrorException;
import com.ryuqq.bulkwriter.core.model.ErrorKind;
import com.ryuqq.bulkwriter.core.model.ResourceTag;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 배치 쓰기 결과 누적기.
 *
 * <p>성공적으로 처리된 결과 항목과 {@link ClassifiedError} 목록을 함께 보관합니다.</p>
 *
 * <p><strong>병합 규칙:</strong></p>
 * <ul>
 *   <li>{@link #merge(BatchResult)}는 results와 errors를 각각 이어붙임 (결합법칙 성립)</li>
 *   <li>청크를 제출 순서대로 병합하면 results 순서도 제출 순서를 따름</li>
 *   <li>같은 종류의 오류를 합치려면 {@link #mergeErrors()}를 명시적으로 호출</li>
 * </ul>
 *
 * @param results 처리된 결과 항목
 * @param errors 누적된 오류
 * @param <R> 결과 항목 타입
 * @param <T> 쓰기 항목 타입 (오류의 skipped 항목)
 * @author BulkWriter Team
 * @since 1.0.0
 */
public record BatchResult<R, T>(List<R> results, List<ClassifiedError<T>> errors) {

    public BatchResult {
        results = results == null ? List.of() : List.copyOf(results);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static <R, T> BatchResult<R, T> empty() {
        return new BatchResult<>(List.of(), List.of());
    }

    public static <R, T> BatchResult<R, T> ofResults(List<R> results) {
        return new BatchResult<>(results, List.of());
    }

    public static <R, T> BatchResult<R, T> ofError(ClassifiedError<T> error) {
        return new BatchResult<>(List.of(), error == null ? List.of() : List.of(error));
    }

    /**
     * 두 결과를 이어붙입니다. this가 앞, other가 뒤에 위치합니다.
     *
     * @param other 뒤에 붙일 결과 (null이면 this 반환)
     * @return 병합된 새 결과
     */
    public BatchResult<R, T> merge(BatchResult<R, T> other) {
        if (other == null) {
            return this;
        }
        List<R> mergedResults = new ArrayList<>(results.size() + other.results.size());
        mergedResults.addAll(results);
        mergedResults.addAll(other.results);
        List<ClassifiedError<T>> mergedErrors = new ArrayList<>(errors.size() + other.errors.size());
        mergedErrors.addAll(errors);
        mergedErrors.addAll(other.errors);
        return new BatchResult<>(mergedResults, mergedErrors);
    }

    /**
     * 여러 결과를 순서대로 병합합니다. null 요소는 무시됩니다.
     */
    public static <R, T> BatchResult<R, T> mergeAll(List<BatchResult<R, T>> parts) {
        BatchResult<R, T> merged = empty();
        if (parts == null) {
            return merged;
        }
        for (BatchResult<R, T> part : parts) {
            merged = merged.merge(part);
        }
        return merged;
    }

    public BatchResult<R, T> withError(ClassifiedError<T> error) {
        if (error == null) {
            return this;
        }
        return merge(ofError(error));
    }

    public boolean isAllGood() {
        return errors.isEmpty();
    }

    /**
     * (kind, tag)가 같은 비치명 오류를 하나로 합친 결과를 반환합니다.
     *
     * <p>FATAL_FAILURE는 서로 다른 원인일 수 있으므로 합치지 않습니다.
     * 그룹 순서는 각 그룹의 첫 오류가 나타난 순서를 따릅니다.</p>
     *
     * @return 오류가 정리된 새 결과
     */
    public BatchResult<R, T> mergeErrors() {
        if (errors.size() < 2) {
            return this;
        }
        Map<Object, List<ClassifiedError<T>>> groups = new LinkedHashMap<>();
        for (ClassifiedError<T> error : errors) {
            Object key = error.isFatal() ? new Object() : new GroupKey(error.kind(), error.tag());
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(error);
        }
        List<ClassifiedError<T>> merged = new ArrayList<>(groups.size());
        for (List<ClassifiedError<T>> group : groups.values()) {
            merged.add(group.size() == 1 ? group.get(0) : ClassifiedError.merge(group));
        }
        return new BatchResult<>(results, merged);
    }

    /**
     * 치명 오류가 있으면 던집니다.
     *
     * @throws ClassifiedErrorException 치명 오류가 하나 이상인 경우 (둘 이상이면 나머지는 suppressed)
     */
    public void throwOnFatal() {
        throwAllOf(errors.stream().filter(ClassifiedError::isFatal).toList());
    }

    /**
     * 오류가 하나라도 있으면 던집니다.
     *
     * @throws ClassifiedErrorException 오류가 하나 이상인 경우 (둘 이상이면 나머지는 suppressed)
     */
    public void throwAll() {
        throwAllOf(errors);
    }

    /**
     * skipped 항목별로 그 항목을 건너뛰게 만든 오류를 묶어서 반환합니다.
     *
     * @return 항목 → 오류 목록 (항목이 처음 나타난 순서)
     */
    public Map<T, List<ClassifiedError<T>>> errorsBySkipped() {
        Map<T, List<ClassifiedError<T>>> bySkipped = new LinkedHashMap<>();
        for (ClassifiedError<T> error : errors) {
            for (T item : error.skipped()) {
                bySkipped.computeIfAbsent(item, k -> new ArrayList<>()).add(error);
            }
        }
        return bySkipped;
    }

    /**
     * 결과와 오류의 skipped 항목을 다른 타입으로 변환합니다.
     */
    public <R2, T2> BatchResult<R2, T2> replace(Function<? super R, ? extends R2> resultMapper,
                                                Function<? super T, ? extends T2> skippedMapper) {
        if (resultMapper == null || skippedMapper == null) {
            throw new IllegalArgumentException("mappers cannot be null");
        }
        List<R2> mappedResults = new ArrayList<>(results.size());
        for (R result : results) {
            mappedResults.add(resultMapper.apply(result));
        }
        List<ClassifiedError<T2>> mappedErrors = new ArrayList<>(errors.size());
        for (ClassifiedError<T> error : errors) {
            mappedErrors.add(error.replaceSkipped(skippedMapper));
        }
        return new BatchResult<>(mappedResults, mappedErrors);
    }

    private static void throwAllOf(List<? extends ClassifiedError<?>> toThrow) {
        if (toThrow.isEmpty()) {
            return;
        }
        ClassifiedErrorException first = new ClassifiedErrorException(toThrow.get(0));
        for (int i = 1; i < toThrow.size(); i++) {
            first.addSuppressed(new ClassifiedErrorException(toThrow.get(i)));
        }
        throw first;
    }

    private record GroupKey(ErrorKind kind, ResourceTag tag) {
    }
}
