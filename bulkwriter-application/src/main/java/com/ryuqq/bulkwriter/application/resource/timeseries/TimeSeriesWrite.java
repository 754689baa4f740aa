package com.ryuqq.bulkwriter.application.resource.timeseries;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 시계열 생성 요청 항목.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public record TimeSeriesWrite(
    String externalId,
    String name,
    String legacyName,
    Map<String, String> metadata,
    String unit,
    Long assetId,
    String description,
    Long dataSetId
) {

    public TimeSeriesWrite {
        metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static TimeSeriesWrite of(String externalId, String name) {
        return new TimeSeriesWrite(externalId, name, null, null, null, null, null, null);
    }

    public TimeSeriesWrite withLegacyName(String legacyName) {
        return new TimeSeriesWrite(externalId, name, legacyName, metadata, unit, assetId, description, dataSetId);
    }

    public TimeSeriesWrite withMetadata(Map<String, String> metadata) {
        return new TimeSeriesWrite(externalId, name, legacyName, metadata, unit, assetId, description, dataSetId);
    }

    public TimeSeriesWrite withUnit(String unit) {
        return new TimeSeriesWrite(externalId, name, legacyName, metadata, unit, assetId, description, dataSetId);
    }

    public TimeSeriesWrite withAssetId(Long assetId) {
        return new TimeSeriesWrite(externalId, name, legacyName, metadata, unit, assetId, description, dataSetId);
    }

    public TimeSeriesWrite withDescription(String description) {
        return new TimeSeriesWrite(externalId, name, legacyName, metadata, unit, assetId, description, dataSetId);
    }

    public TimeSeriesWrite withDataSetId(Long dataSetId) {
        return new TimeSeriesWrite(externalId, name, legacyName, metadata, unit, assetId, description, dataSetId);
    }
}
