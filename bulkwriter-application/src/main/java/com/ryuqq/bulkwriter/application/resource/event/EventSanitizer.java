package com.ryuqq.bulkwriter.application.resource.event;

import com.ryuqq.bulkwriter.core.model.ResourceTag;
import com.ryuqq.bulkwriter.core.sanitation.Sanitizer;
import com.ryuqq.bulkwriter.core.sanitation.StringLimits;

import java.util.List;

/**
 * 이벤트 필드 한도.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class EventSanitizer implements Sanitizer<EventWrite> {

    public static final int TYPE_MAX = 64;
    public static final int DESCRIPTION_MAX = 500;
    public static final int SOURCE_MAX = 128;
    public static final int METADATA_MAX_PER_KEY = 128;
    public static final int METADATA_MAX_PER_VALUE = 128_000;
    public static final int METADATA_MAX_PAIRS = 256;
    public static final int METADATA_MAX_BYTES = 200_000;
    public static final int ASSET_IDS_MAX = 10_000;

    /**
     * 문자열 필드를 자르고, 0 이하 asset ID를 버리고, 음수 시각을 0으로,
     * endTime이 startTime보다 앞서면 startTime으로 맞추고, 0 이하 dataSetId는 제거합니다.
     */
    @Override
    public EventWrite sanitize(EventWrite event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        Long startTime = event.startTime() != null && event.startTime() < 0 ? Long.valueOf(0L) : event.startTime();
        Long endTime = event.endTime() != null && event.endTime() < 0 ? Long.valueOf(0L) : event.endTime();
        if (startTime != null && endTime != null && startTime > endTime) {
            endTime = startTime;
        }
        List<Long> assetIds = event.assetIds() == null ? null : event.assetIds().stream()
            .filter(id -> id != null && id > 0)
            .limit(ASSET_IDS_MAX)
            .toList();
        Long dataSetId = event.dataSetId() != null && event.dataSetId() < 1 ? null : event.dataSetId();

        return new EventWrite(
            StringLimits.truncate(event.externalId(), StringLimits.EXTERNAL_ID_MAX),
            startTime,
            endTime,
            StringLimits.truncate(event.type(), TYPE_MAX),
            StringLimits.truncate(event.subtype(), TYPE_MAX),
            StringLimits.truncate(event.description(), DESCRIPTION_MAX),
            StringLimits.sanitizeMetadata(event.metadata(), METADATA_MAX_PER_KEY, METADATA_MAX_PAIRS,
                METADATA_MAX_PER_VALUE, METADATA_MAX_BYTES),
            assetIds,
            StringLimits.truncate(event.source(), SOURCE_MAX),
            dataSetId
        );
    }

    @Override
    public ResourceTag verify(EventWrite event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (!StringLimits.checkLength(event.externalId(), StringLimits.EXTERNAL_ID_MAX)) return ResourceTag.EXTERNAL_ID;
        if (!StringLimits.checkLength(event.type(), TYPE_MAX)) return ResourceTag.TYPE;
        if (!StringLimits.checkLength(event.subtype(), TYPE_MAX)) return ResourceTag.SUB_TYPE;
        if (!StringLimits.checkLength(event.source(), SOURCE_MAX)) return ResourceTag.SOURCE;
        if (event.assetIds() != null && (event.assetIds().size() > ASSET_IDS_MAX
            || event.assetIds().stream().anyMatch(id -> id == null || id < 1))) {
            return ResourceTag.ASSET_ID;
        }
        Long start = event.startTime();
        Long end = event.endTime();
        if (start != null && start < 1 || end != null && end < 1 || start != null && end != null && start > end) {
            return ResourceTag.TIME_RANGE;
        }
        if (event.dataSetId() != null && event.dataSetId() < 1) return ResourceTag.DATA_SET_ID;
        if (!StringLimits.verifyMetadata(event.metadata(), METADATA_MAX_PER_KEY, METADATA_MAX_PAIRS,
            METADATA_MAX_PER_VALUE, METADATA_MAX_BYTES)) {
            return ResourceTag.METADATA;
        }
        return null;
    }
}
