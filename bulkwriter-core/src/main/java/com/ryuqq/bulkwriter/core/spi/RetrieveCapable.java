package com.ryuqq.bulkwriter.core.spi;

import com.ryuqq.bulkwriter.core.cancel.CancellationToken;
import com.ryuqq.bulkwriter.core.model.Identity;

import java.util.List;

/**
 * 식별자로 항목을 조회할 수 있는 원격 리소스.
 *
 * @param <R> 조회 결과 항목 타입
 * @author BulkWriter Team
 * @since 1.0.0
 */
public interface RetrieveCapable<R> {

    /**
     * 식별자로 항목 조회.
     *
     * @param ids 조회할 식별자
     * @param ignoreUnknownIds true이면 없는 식별자는 무시, false이면 하나라도 없을 때 실패
     * @param token 취소 토큰
     * @return 찾은 항목 (순서 보장 없음)
     * @throws RemoteFailure 원격 호출 실패
     */
    List<R> retrieve(List<Identity> ids, boolean ignoreUnknownIds, CancellationToken token);
}
