package com.ryuqq.bulkwriter.core.sanitation;

import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.model.ResourceTag;

import java.util.function.Function;

/**
 * 한 요청 안에서 유일해야 하는 필드.
 *
 * @param message 중복 발견 시 오류 메시지
 * @param tag 중복 오류의 태그
 * @param key 항목 → 식별자 (null이면 검사하지 않음)
 * @param <T> 쓰기 항목 타입
 * @author BulkWriter Team
 * @since 1.0.0
 */
public record DistinctRule<T>(String message, ResourceTag tag, Function<T, Identity> key) {

    public DistinctRule {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (tag == null) {
            throw new IllegalArgumentException("tag cannot be null");
        }
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }
}
