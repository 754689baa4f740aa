package com.ryuqq.bulkwriter.application.classify;

import com.ryuqq.bulkwriter.core.model.ErrorKind;
import com.ryuqq.bulkwriter.core.model.ResourceTag;
import com.ryuqq.bulkwriter.core.spi.RemoteFailure;

import java.util.Optional;

/**
 * 이벤트 생성 실패 해석.
 *
 * <ul>
 *   <li>missing + "Asset ids not found" → ITEM_MISSING / ASSET_ID</li>
 *   <li>duplicated → ITEM_EXISTS / EXTERNAL_ID</li>
 *   <li>400 "Invalid dataSetIds: ..." → ITEM_MISSING / DATA_SET_ID</li>
 * </ul>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class EventFailureParser implements FailureParser {

    static final String ASSET_IDS_NOT_FOUND = "Asset ids not found";
    static final String INVALID_DATA_SET_IDS = "Invalid dataSetIds";

    @Override
    public Optional<FailureMatch> parse(RemoteFailure failure) {
        String message = failure.getMessage() == null ? "" : failure.getMessage();
        if (!failure.getMissing().isEmpty()) {
            if (message.startsWith(ASSET_IDS_NOT_FOUND)) {
                return Optional.of(FailureMatch.of(ErrorKind.ITEM_MISSING, ResourceTag.ASSET_ID,
                    FailureValues.internalIds(failure.getMissing(), "id")));
            }
            return Optional.empty();
        }
        if (!failure.getDuplicated().isEmpty()) {
            return Optional.of(FailureMatch.of(ErrorKind.ITEM_EXISTS, ResourceTag.EXTERNAL_ID,
                FailureValues.stringIds(failure.getDuplicated(), "externalId")));
        }
        if (failure.getStatus() == 400 && message.startsWith(INVALID_DATA_SET_IDS)) {
            return Optional.of(FailureMatch.of(ErrorKind.ITEM_MISSING, ResourceTag.DATA_SET_ID,
                FailureValues.parseIdString(FailureValues.after(message, INVALID_DATA_SET_IDS))));
        }
        return Optional.empty();
    }
}
