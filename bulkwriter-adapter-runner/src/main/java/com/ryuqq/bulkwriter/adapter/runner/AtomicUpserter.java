package com.ryuqq.bulkwriter.adapter.runner;

import com.ryuqq.bulkwriter.application.resource.instance.Instance;
import com.ryuqq.bulkwriter.application.resource.instance.InstanceWrite;
import com.ryuqq.bulkwriter.core.cancel.CancellationToken;
import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.spi.RemoteFailure;
import com.ryuqq.bulkwriter.core.spi.RetrieveCapable;
import com.ryuqq.bulkwriter.core.spi.UpsertCapable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.function.Function;

/**
 * 읽고-고치고-쓰기를 버전 조건으로 원자적으로 수행합니다.
 *
 * <p>현재 인스턴스를 읽고, updateAction으로 쓰기 항목을 만든 뒤, 읽은 버전을 existingVersion으로
 * 붙여 upsert합니다. 그 사이 다른 쓰기가 끼어들어 버전 충돌(409)이 나면 대기 없이 처음부터 다시 시도합니다.
 * 그 외 실패는 그대로 던집니다.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class AtomicUpserter {

    private static final Logger log = LoggerFactory.getLogger(AtomicUpserter.class);

    public static final String VERSION_CONFLICT_MESSAGE = "A version conflict caused the ingest to fail.";
    public static final int MAX_IDS = 1000;

    /**
     * @param ids 대상 인스턴스 식별자 (1개 이상 1000개 이하)
     * @param resource 조회와 upsert를 지원하는 인스턴스 리소스
     * @param updateAction 현재 인스턴스 → 쓸 항목 (없는 인스턴스는 목록에 포함되지 않음)
     * @param token 취소 토큰
     * @return upsert 결과, updateAction이 빈 목록을 반환하면 빈 목록
     * @throws IllegalArgumentException ids 개수가 범위를 벗어난 경우
     * @throws CancellationException 취소된 경우
     * @throws RemoteFailure 버전 충돌 외의 원격 실패
     */
    public <C extends RetrieveCapable<Instance> & UpsertCapable<InstanceWrite, Instance>> List<Instance> upsertAtomic(
        List<Identity> ids,
        C resource,
        Function<List<Instance>, List<InstanceWrite>> updateAction,
        CancellationToken token
    ) {
        if (updateAction == null) {
            throw new IllegalArgumentException("updateAction cannot be null");
        }
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        if (ids == null || ids.isEmpty() || ids.size() > MAX_IDS) {
            throw new IllegalArgumentException("Number of ids must be between 1 and " + MAX_IDS
                + " (current: " + (ids == null ? 0 : ids.size()) + ")");
        }

        int attempt = 0;
        while (!token.isCancellationRequested()) {
            attempt++;
            List<Instance> current = resource.retrieve(ids, true, token);
            List<InstanceWrite> writes = updateAction.apply(current);
            if (writes == null || writes.isEmpty()) {
                return List.of();
            }

            Map<Identity, Long> versions = new HashMap<>();
            for (Instance instance : current) {
                versions.put(instance.identity(), instance.version());
            }
            List<InstanceWrite> versioned = writes.stream()
                .map(write -> write.withExistingVersion(
                    versions.get(Identity.instance(write.space(), write.externalId()))))
                .toList();

            try {
                return resource.upsert(versioned, token);
            } catch (RemoteFailure e) {
                if (e.getStatus() == 409 && VERSION_CONFLICT_MESSAGE.equals(e.getMessage())) {
                    log.debug("Version conflict on attempt {}, retrying {} instances", attempt, versioned.size());
                    continue;
                }
                throw e;
            }
        }
        throw new CancellationException("Atomic upsert was cancelled");
    }
}
