package com.ryuqq.bulkwriter.application.writer;

import com.ryuqq.bulkwriter.core.cancel.CancellationToken;
import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.result.BatchResult;
import com.ryuqq.bulkwriter.core.spi.CreateCapable;
import com.ryuqq.bulkwriter.core.spi.Identifiable;
import com.ryuqq.bulkwriter.core.spi.RetrieveCapable;
import com.ryuqq.bulkwriter.core.spi.UpsertCapable;

import java.util.List;

/**
 * Chunked-Retry 쓰기 진입점.
 *
 * <p>입력을 청크로 나누고, 청크마다 하나의 작업을 스로틀러에 넣어 병렬로 실행합니다.
 * 각 작업은 원격 호출 → 실패 분류 → 문제 항목 제거 → 재시도를 반복합니다.</p>
 *
 * <p><strong>반환 규칙:</strong></p>
 * <ul>
 *   <li>결과는 청크 제출 순서대로 병합</li>
 *   <li>일반적인 복구 가능 실패는 예외가 아니라 결과의 errors로 보고</li>
 *   <li>취소는 {@link java.util.concurrent.CancellationException}으로 전파되며 재시도하지 않음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * BatchResult<Event, EventWrite> result = writer.ensureExists(
 *     events, EventResources.binding(), eventsApi, new WriteOptions(), token);
 * result.throwOnFatal();
 * }</pre>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public interface BulkWriter {

    /**
     * 식별자로 조회하고, 없는 항목은 builder로 만들어 생성합니다.
     *
     * @param ids 조회/생성할 식별자
     * @param builder 없는 식별자의 쓰기 항목 생성 함수
     * @param binding 리소스 설정
     * @param resource 조회와 생성을 모두 지원하는 원격 리소스
     * @param options 쓰기 설정
     * @param token 취소 토큰
     * @return 찾은 항목 + 생성된 항목, 그리고 오류
     */
    <T, R extends Identifiable, C extends RetrieveCapable<R> & CreateCapable<T, R>> BatchResult<R, T> getOrCreate(
        List<Identity> ids,
        ItemBuilder<T> builder,
        ResourceBinding<T> binding,
        C resource,
        WriteOptions options,
        CancellationToken token
    );

    /**
     * 항목을 생성합니다. 로컬 검증 오류는 마지막 결과 조각으로 붙습니다.
     */
    <T, R> BatchResult<R, T> ensureExists(
        List<T> items,
        ResourceBinding<T> binding,
        CreateCapable<T, R> resource,
        WriteOptions options,
        CancellationToken token
    );

    /**
     * 항목을 생성하거나 갱신합니다. 로컬 검증 오류는 마지막 결과 조각으로 붙습니다.
     */
    <T, R> BatchResult<R, T> upsert(
        List<T> items,
        ResourceBinding<T> binding,
        UpsertCapable<T, R> resource,
        WriteOptions options,
        CancellationToken token
    );
}
