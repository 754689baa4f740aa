package com.ryuqq.bulkwriter.application.classify;

import com.ryuqq.bulkwriter.core.model.ErrorKind;
import com.ryuqq.bulkwriter.core.model.ResourceTag;
import com.ryuqq.bulkwriter.core.spi.RemoteFailure;

import java.util.Map;
import java.util.Optional;

/**
 * 시계열 생성 실패 해석.
 *
 * <p>메시지 접두어 비교는 대소문자를 구분하지 않습니다.
 * 중복 목록은 첫 항목의 키로 legacyName / externalId 중 어느 필드인지 판단합니다.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class TimeSeriesFailureParser implements FailureParser {

    @Override
    public Optional<FailureMatch> parse(RemoteFailure failure) {
        String message = failure.getMessage() == null ? "" : failure.getMessage();
        if (!failure.getMissing().isEmpty()) {
            if (FailureValues.startsWithIgnoreCase(message, EventFailureParser.ASSET_IDS_NOT_FOUND)) {
                return Optional.of(FailureMatch.of(ErrorKind.ITEM_MISSING, ResourceTag.ASSET_ID,
                    FailureValues.internalIds(failure.getMissing(), "id")));
            }
            if (FailureValues.startsWithIgnoreCase(message, "Datasets ids not found")
                || FailureValues.startsWithIgnoreCase(message, "Data set ids not found")) {
                return Optional.of(FailureMatch.of(ErrorKind.ITEM_MISSING, ResourceTag.DATA_SET_ID,
                    FailureValues.internalIds(failure.getMissing(), "id")));
            }
            return Optional.empty();
        }
        if (!failure.getDuplicated().isEmpty()) {
            Map<String, Object> first = failure.getDuplicated().get(0);
            if (first.containsKey("legacyName")) {
                return Optional.of(FailureMatch.of(ErrorKind.ITEM_EXISTS, ResourceTag.LEGACY_NAME,
                    FailureValues.stringIds(failure.getDuplicated(), "legacyName")));
            }
            if (first.containsKey("externalId")) {
                return Optional.of(FailureMatch.of(ErrorKind.ITEM_EXISTS, ResourceTag.EXTERNAL_ID,
                    FailureValues.stringIds(failure.getDuplicated(), "externalId")));
            }
        }
        return Optional.empty();
    }
}
