package com.ryuqq.bulkwriter.application.classify;

import com.ryuqq.bulkwriter.core.model.ErrorKind;
import com.ryuqq.bulkwriter.core.model.ResourceTag;
import com.ryuqq.bulkwriter.core.spi.RemoteFailure;

import java.util.Optional;

/**
 * 데이터 모델 인스턴스 upsert 실패 해석.
 *
 * <ul>
 *   <li>duplicated (space, externalId) → ITEM_DUPLICATED / INSTANCE_ID</li>
 *   <li>missing (space, externalId) → ITEM_MISSING / INSTANCE_ID</li>
 * </ul>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class InstanceFailureParser implements FailureParser {

    @Override
    public Optional<FailureMatch> parse(RemoteFailure failure) {
        if (!failure.getDuplicated().isEmpty()) {
            return Optional.of(FailureMatch.of(ErrorKind.ITEM_DUPLICATED, ResourceTag.INSTANCE_ID,
                FailureValues.instanceIds(failure.getDuplicated())));
        }
        if (!failure.getMissing().isEmpty()) {
            return Optional.of(FailureMatch.of(ErrorKind.ITEM_MISSING, ResourceTag.INSTANCE_ID,
                FailureValues.instanceIds(failure.getMissing())));
        }
        return Optional.empty();
    }
}
