package com.ryuqq.bulkwriter.core.spi;

import com.ryuqq.bulkwriter.core.cancel.CancellationToken;

import java.util.List;

/**
 * 항목을 생성하거나 갱신(upsert)할 수 있는 원격 리소스.
 *
 * @param <T> 쓰기 항목 타입
 * @param <R> 결과 항목 타입
 * @author BulkWriter Team
 * @since 1.0.0
 */
public interface UpsertCapable<T, R> {

    /**
     * @param items upsert할 항목 (비어있지 않음)
     * @param token 취소 토큰
     * @return 생성 또는 갱신된 항목
     * @throws RemoteFailure 원격 호출 실패 (버전 충돌 포함)
     */
    List<R> upsert(List<T> items, CancellationToken token);
}
