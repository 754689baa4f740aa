package com.ryuqq.bulkwriter.core.model;

/**
 * 분류된 오류의 종류.
 *
 * <p><strong>복구 가능 여부:</strong></p>
 * <ul>
 *   <li>ITEM_EXISTS, ITEM_MISSING: 문제 항목을 제거한 뒤 나머지를 재시도</li>
 *   <li>ITEM_DUPLICATED, SANITATION_FAILED: 로컬에서 발견, 원격 호출 전에 제거됨</li>
 *   <li>FATAL_FAILURE: 항목 단위로 분해할 수 없는 실패</li>
 * </ul>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * 같은 식별자의 항목이 이미 원격에 존재.
     */
    ITEM_EXISTS,

    /**
     * 참조한 항목(부모, 데이터셋 등)이 원격에 없음.
     */
    ITEM_MISSING,

    /**
     * 같은 요청 안에서 식별자가 중복됨.
     */
    ITEM_DUPLICATED,

    /**
     * 로컬 검증(sanitation)에서 거부됨.
     */
    SANITATION_FAILED,

    /**
     * 분류 불가 실패 (5xx, 전송 오류, 알 수 없는 400).
     */
    FATAL_FAILURE;

    public boolean isFatal() {
        return this == FATAL_FAILURE;
    }
}
