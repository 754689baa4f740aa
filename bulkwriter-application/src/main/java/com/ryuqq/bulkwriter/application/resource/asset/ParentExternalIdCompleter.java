package com.ryuqq.bulkwriter.application.resource.asset;

import com.ryuqq.bulkwriter.application.clean.ErrorCompleter;
import com.ryuqq.bulkwriter.core.cancel.CancellationToken;
import com.ryuqq.bulkwriter.core.error.ClassifiedError;
import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.model.ResourceTag;
import com.ryuqq.bulkwriter.core.spi.Identifiable;
import com.ryuqq.bulkwriter.core.spi.RetrieveCapable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * "unknown parent" 오류의 누락 부모 목록 채우기.
 *
 * <p>원격은 없는 부모 하나만 알려주므로 배치의 나머지 parentExternalId를 조회해서 없는 것을 모두 찾습니다.
 * 같은 배치 안에서 생성되는 부모는 조회하지 않습니다.</p>
 *
 * <p>조회가 실패하면 오류를 그대로(불완전 상태로) 반환합니다.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class ParentExternalIdCompleter implements ErrorCompleter<AssetWrite> {

    private static final Logger log = LoggerFactory.getLogger(ParentExternalIdCompleter.class);

    private final RetrieveCapable<? extends Identifiable> assets;

    public ParentExternalIdCompleter(RetrieveCapable<? extends Identifiable> assets) {
        if (assets == null) {
            throw new IllegalArgumentException("assets cannot be null");
        }
        this.assets = assets;
    }

    @Override
    public ClassifiedError<AssetWrite> complete(ClassifiedError<AssetWrite> error, List<AssetWrite> batch,
                                                CancellationToken token) {
        if (error.complete() || error.tag() != ResourceTag.PARENT_EXTERNAL_ID) {
            return error;
        }

        Set<String> ownIds = new HashSet<>();
        for (AssetWrite asset : batch) {
            if (asset.externalId() != null) {
                ownIds.add(asset.externalId());
            }
        }
        Set<Identity> candidates = new LinkedHashSet<>();
        for (AssetWrite asset : batch) {
            String parent = asset.parentExternalId();
            if (parent == null || ownIds.contains(parent)) {
                continue;
            }
            Identity identity = Identity.of(parent);
            if (!error.values().contains(identity)) {
                candidates.add(identity);
            }
        }
        if (candidates.isEmpty()) {
            return error.withComplete(true);
        }

        List<? extends Identifiable> found;
        try {
            found = assets.retrieve(List.copyOf(candidates), true, token);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Failed to look up {} parent assets: {}", candidates.size(), e.getMessage());
            return error;
        }

        Set<Identity> foundIds = new HashSet<>();
        for (Identifiable item : found) {
            if (item.externalId() != null) {
                foundIds.add(Identity.of(item.externalId()));
            }
        }
        Set<Identity> values = new LinkedHashSet<>(error.values());
        candidates.stream()
            .filter(candidate -> !foundIds.contains(candidate))
            .forEach(values::add);
        log.debug("Completed unknown parent error: {} missing parents", values.size());
        return error.withValues(values).withComplete(true);
    }
}
