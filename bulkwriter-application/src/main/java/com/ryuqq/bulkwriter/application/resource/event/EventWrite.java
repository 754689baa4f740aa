package com.ryuqq.bulkwriter.application.resource.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 이벤트 생성 요청 항목.
 *
 * <p>null 필드는 원격으로 보내지 않습니다. startTime/endTime은 epoch 밀리초입니다.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public record EventWrite(
    String externalId,
    Long startTime,
    Long endTime,
    String type,
    String subtype,
    String description,
    Map<String, String> metadata,
    List<Long> assetIds,
    String source,
    Long dataSetId
) {

    public EventWrite {
        metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        assetIds = assetIds == null ? null : Collections.unmodifiableList(new ArrayList<>(assetIds));
    }

    public static EventWrite of(String externalId) {
        return new EventWrite(externalId, null, null, null, null, null, null, null, null, null);
    }

    public EventWrite withTimeRange(Long startTime, Long endTime) {
        return new EventWrite(externalId, startTime, endTime, type, subtype, description, metadata, assetIds,
            source, dataSetId);
    }

    public EventWrite withType(String type, String subtype) {
        return new EventWrite(externalId, startTime, endTime, type, subtype, description, metadata, assetIds,
            source, dataSetId);
    }

    public EventWrite withDescription(String description) {
        return new EventWrite(externalId, startTime, endTime, type, subtype, description, metadata, assetIds,
            source, dataSetId);
    }

    public EventWrite withMetadata(Map<String, String> metadata) {
        return new EventWrite(externalId, startTime, endTime, type, subtype, description, metadata, assetIds,
            source, dataSetId);
    }

    public EventWrite withAssetIds(List<Long> assetIds) {
        return new EventWrite(externalId, startTime, endTime, type, subtype, description, metadata, assetIds,
            source, dataSetId);
    }

    public EventWrite withSource(String source) {
        return new EventWrite(externalId, startTime, endTime, type, subtype, description, metadata, assetIds,
            source, dataSetId);
    }

    public EventWrite withDataSetId(Long dataSetId) {
        return new EventWrite(externalId, startTime, endTime, type, subtype, description, metadata, assetIds,
            source, dataSetId);
    }
}
