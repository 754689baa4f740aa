package com.ryuqq.bulkwriter.core.sanitation;

import com.ryuqq.bulkwriter.core.error.ClassifiedError;
import com.ryuqq.bulkwriter.core.model.ErrorKind;
import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.model.ResourceTag;
import com.ryuqq.bulkwriter.core.policy.SanitationMode;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 쓰기 요청을 원격으로 보내기 전에 정리합니다.
 *
 * <p><strong>처리 순서 (항목마다):</strong></p>
 * <ol>
 *   <li>REMOVE: {@link Sanitizer#verify}에 실패하면 제외하고 실패 필드별로 모음</li>
 *   <li>CLEAN: {@link Sanitizer#sanitize} 결과로 교체</li>
 *   <li>{@link DistinctRule}마다 중복 검사, 두 번째 이후 등장은 제외 (첫 항목 유지)</li>
 * </ol>
 *
 * <p>오류: 규칙별 중복은 409 ITEM_DUPLICATED 하나, 검증 실패는 필드별 400 SANITATION_FAILED 하나.
 * NONE 모드는 아무것도 검사하지 않습니다.</p>
 *
 * @param <T> 쓰기 항목 타입
 * @author BulkWriter Team
 * @since 1.0.0
 */
public final class RequestCleaner<T> {

    private final Sanitizer<T> sanitizer;
    private final List<DistinctRule<T>> distinctRules;

    public RequestCleaner(Sanitizer<T> sanitizer, List<DistinctRule<T>> distinctRules) {
        if (sanitizer == null) {
            throw new IllegalArgumentException("sanitizer cannot be null");
        }
        this.sanitizer = sanitizer;
        this.distinctRules = distinctRules == null ? List.of() : List.copyOf(distinctRules);
    }

    /**
     * 요청 정리.
     *
     * @param items 원본 항목
     * @param mode 검증 방식
     * @return 남은 항목과 오류
     */
    public SanitationResult<T> clean(List<T> items, SanitationMode mode) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        if (mode == null || mode == SanitationMode.NONE) {
            return new SanitationResult<>(items, List.of());
        }

        List<T> result = new ArrayList<>(items.size());
        Map<ResourceTag, List<T>> bad = new EnumMap<>(ResourceTag.class);
        List<Set<Identity>> seen = new ArrayList<>(distinctRules.size());
        List<Set<Identity>> duplicated = new ArrayList<>(distinctRules.size());
        for (int i = 0; i < distinctRules.size(); i++) {
            seen.add(new HashSet<>());
            duplicated.add(new LinkedHashSet<>());
        }

        for (T original : items) {
            T item = original;
            boolean keep = true;
            if (mode == SanitationMode.REMOVE) {
                ResourceTag failed = sanitizer.verify(item);
                if (failed != null) {
                    bad.computeIfAbsent(failed, k -> new ArrayList<>()).add(item);
                    keep = false;
                }
            } else {
                item = sanitizer.sanitize(item);
            }
            for (int i = 0; i < distinctRules.size(); i++) {
                Identity key = distinctRules.get(i).key().apply(item);
                if (key != null && !seen.get(i).add(key)) {
                    duplicated.get(i).add(key);
                    keep = false;
                }
            }
            if (keep) {
                result.add(item);
            }
        }

        List<ClassifiedError<T>> errors = new ArrayList<>();
        for (int i = 0; i < distinctRules.size(); i++) {
            if (!duplicated.get(i).isEmpty()) {
                DistinctRule<T> rule = distinctRules.get(i);
                errors.add(ClassifiedError.of(ErrorKind.ITEM_DUPLICATED, rule.tag(), duplicated.get(i),
                    409, rule.message(), null));
            }
        }
        for (Map.Entry<ResourceTag, List<T>> entry : bad.entrySet()) {
            ClassifiedError<T> error = ClassifiedError.<T>of(ErrorKind.SANITATION_FAILED, entry.getKey(), Set.of(),
                400, "Sanitation failed for " + entry.getKey(), null);
            errors.add(error.withSkipped(entry.getValue()));
        }
        return new SanitationResult<>(result, errors);
    }
}
