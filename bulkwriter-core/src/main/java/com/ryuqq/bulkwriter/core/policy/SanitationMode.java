package com.ryuqq.bulkwriter.core.policy;

/**
 * 원격 호출 전 로컬 검증 방식.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public enum SanitationMode {

    /**
     * 검증하지 않음.
     */
    NONE,

    /**
     * 한도를 넘는 필드를 잘라내거나 보정.
     */
    CLEAN,

    /**
     * 한도를 넘는 항목을 요청에서 제외하고 오류로 보고.
     */
    REMOVE
}
