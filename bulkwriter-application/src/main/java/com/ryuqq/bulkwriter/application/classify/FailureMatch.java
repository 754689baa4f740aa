package com.ryuqq.bulkwriter.application.classify;

import com.ryuqq.bulkwriter.core.model.ErrorKind;
import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.model.ResourceTag;

import java.util.List;

/**
 * 요청 종류별 파서가 원격 실패에서 복원한 정보.
 *
 * @param kind 오류 종류
 * @param tag 문제 필드
 * @param values 문제 식별자
 * @param complete 식별자 목록이 완전한지 여부
 * @author BulkWriter Team
 * @since 1.0.0
 */
public record FailureMatch(ErrorKind kind, ResourceTag tag, List<Identity> values, boolean complete) {

    public FailureMatch {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (tag == null) {
            throw new IllegalArgumentException("tag cannot be null");
        }
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static FailureMatch of(ErrorKind kind, ResourceTag tag, List<Identity> values) {
        return new FailureMatch(kind, tag, values, true);
    }
}
