package com.ryuqq.bulkwriter.application.classify;

import com.ryuqq.bulkwriter.core.model.ErrorKind;
import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.model.ResourceTag;
import com.ryuqq.bulkwriter.core.spi.RemoteFailure;

import java.util.List;
import java.util.Optional;

/**
 * 에셋 생성 실패 해석.
 *
 * <p>부모 외부 ID 누락 메시지는 첫 번째 누락 ID 하나만 알려주므로 결과가 불완전(complete=false)합니다.
 * 나머지 누락 부모는 Batch Cleaner가 추가 조회로 채웁니다.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class AssetFailureParser implements FailureParser {

    static final String UNKNOWN_PARENT = "Reference to unknown parent with externalId";
    static final String PARENT_IDS_MISSING = "The given parent ids do not exist";

    @Override
    public Optional<FailureMatch> parse(RemoteFailure failure) {
        String message = failure.getMessage() == null ? "" : failure.getMessage();
        if (!failure.getMissing().isEmpty()) {
            // only labels can be reported missing on asset create
            return Optional.of(FailureMatch.of(ErrorKind.ITEM_MISSING, ResourceTag.LABELS,
                FailureValues.stringIds(failure.getMissing(), "externalId")));
        }
        if (!failure.getDuplicated().isEmpty()) {
            return Optional.of(FailureMatch.of(ErrorKind.ITEM_EXISTS, ResourceTag.EXTERNAL_ID,
                FailureValues.stringIds(failure.getDuplicated(), "externalId")));
        }
        if (failure.getStatus() != 400) {
            return Optional.empty();
        }
        if (message.startsWith(UNKNOWN_PARENT)) {
            String missingId = FailureValues.after(message, UNKNOWN_PARENT);
            return Optional.of(new FailureMatch(ErrorKind.ITEM_MISSING, ResourceTag.PARENT_EXTERNAL_ID,
                List.of(Identity.of(missingId)), false));
        }
        if (message.startsWith(PARENT_IDS_MISSING)) {
            return Optional.of(FailureMatch.of(ErrorKind.ITEM_MISSING, ResourceTag.PARENT_ID,
                FailureValues.parseIdString(FailureValues.after(message, PARENT_IDS_MISSING))));
        }
        if (message.startsWith(EventFailureParser.INVALID_DATA_SET_IDS)) {
            return Optional.of(FailureMatch.of(ErrorKind.ITEM_MISSING, ResourceTag.DATA_SET_ID,
                FailureValues.parseIdString(FailureValues.after(message, EventFailureParser.INVALID_DATA_SET_IDS))));
        }
        return Optional.empty();
    }
}
