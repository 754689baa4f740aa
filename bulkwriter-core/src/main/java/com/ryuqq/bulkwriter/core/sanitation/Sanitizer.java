package com.ryuqq.bulkwriter.core.sanitation;

import com.ryuqq.bulkwriter.core.model.ResourceTag;

/**
 * 리소스 타입별 로컬 검증 규칙.
 *
 * @param <T> 쓰기 항목 타입
 * @author BulkWriter Team
 * @since 1.0.0
 */
public interface Sanitizer<T> {

    /**
     * 한도를 넘는 필드를 보정한 새 항목을 반환합니다. 원본은 변경하지 않습니다.
     *
     * @param item 원본 항목
     * @return 보정된 항목
     */
    T sanitize(T item);

    /**
     * 항목이 한도를 만족하는지 확인합니다.
     *
     * @param item 항목
     * @return 처음으로 실패한 필드, 모두 통과하면 null
     */
    ResourceTag verify(T item);
}
