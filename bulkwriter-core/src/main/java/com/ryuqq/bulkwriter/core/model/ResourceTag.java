package com.ryuqq.bulkwriter.core.model;

/**
 * 오류가 가리키는 항목 필드.
 *
 * <p>Error Classifier가 원격 실패를 해석할 때 어떤 식별 필드가 문제인지 표시하고,
 * Batch Cleaner는 같은 태그로 배치 항목에서 값을 읽어 제거 대상을 결정합니다.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public enum ResourceTag {

    ID,
    EXTERNAL_ID,
    ASSET_ID,
    PARENT_ID,
    PARENT_EXTERNAL_ID,
    DATA_SET_ID,
    LEGACY_NAME,
    INSTANCE_ID,
    SPACE_ID,
    LABELS,
    NAME,
    TYPE,
    SUB_TYPE,
    SOURCE,
    METADATA,
    DESCRIPTION,
    TIME_RANGE,
    UNIT,

    /**
     * 특정 필드와 무관한 오류 (전송 실패 등).
     */
    NONE
}
