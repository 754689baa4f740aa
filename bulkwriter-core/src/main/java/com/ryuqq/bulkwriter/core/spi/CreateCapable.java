package com.ryuqq.bulkwriter.core.spi;

import com.ryuqq.bulkwriter.core.cancel.CancellationToken;

import java.util.List;

/**
 * 항목을 생성할 수 있는 원격 리소스.
 *
 * <p>요청은 원자적입니다: 하나라도 거부되면 아무것도 생성되지 않고 {@link RemoteFailure}가 던져집니다.</p>
 *
 * @param <T> 쓰기 항목 타입
 * @param <R> 생성 결과 항목 타입
 * @author BulkWriter Team
 * @since 1.0.0
 */
public interface CreateCapable<T, R> {

    /**
     * @param items 생성할 항목 (비어있지 않음)
     * @param token 취소 토큰
     * @return 생성된 항목
     * @throws RemoteFailure 원격 호출 실패
     */
    List<R> create(List<T> items, CancellationToken token);
}
