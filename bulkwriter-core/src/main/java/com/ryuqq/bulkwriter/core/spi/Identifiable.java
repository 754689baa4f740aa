package com.ryuqq.bulkwriter.core.spi;

import com.ryuqq.bulkwriter.core.model.Identity;

/**
 * 내부 ID와 외부 ID를 노출하는 항목.
 *
 * <p>쓰기 요청 항목은 보통 내부 ID가 없으므로 {@link #id()}가 null을 반환합니다.
 * {@link #identity()}는 외부 ID를 우선하며, 인스턴스처럼 복합 식별자를 쓰는 타입은 재정의합니다.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public interface Identifiable {

    /**
     * @return 내부 ID (없으면 null)
     */
    Long id();

    /**
     * @return 외부 ID (없으면 null)
     */
    String externalId();

    /**
     * 대표 식별자.
     *
     * @return 외부 ID가 있으면 외부 ID, 없으면 내부 ID, 둘 다 없으면 null
     */
    default Identity identity() {
        if (externalId() != null) {
            return Identity.of(externalId());
        }
        if (id() != null) {
            return Identity.of(id());
        }
        return null;
    }
}
