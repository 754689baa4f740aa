package com.ryuqq.bulkwriter.core.model;

/**
 * 원격 쓰기 요청의 종류. Error Classifier가 파서를 선택하는 기준입니다.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public enum RequestType {
    CREATE_ASSETS,
    CREATE_EVENTS,
    CREATE_TIME_SERIES,
    UPSERT_INSTANCES
}
