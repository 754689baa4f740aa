package com.ryuqq.bulkwriter.application.resource.asset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 에셋 생성 요청 항목.
 *
 * <p>부모는 parentId 또는 parentExternalId 중 하나로 지정합니다. labels는 라벨 외부 ID 목록입니다.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public record AssetWrite(
    String externalId,
    String name,
    Long parentId,
    String parentExternalId,
    String description,
    Long dataSetId,
    Map<String, String> metadata,
    String source,
    List<String> labels
) {

    public AssetWrite {
        metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        labels = labels == null ? null : Collections.unmodifiableList(new ArrayList<>(labels));
    }

    public static AssetWrite of(String externalId, String name) {
        return new AssetWrite(externalId, name, null, null, null, null, null, null, null);
    }

    public AssetWrite withParentId(Long parentId) {
        return new AssetWrite(externalId, name, parentId, parentExternalId, description, dataSetId, metadata,
            source, labels);
    }

    public AssetWrite withParentExternalId(String parentExternalId) {
        return new AssetWrite(externalId, name, parentId, parentExternalId, description, dataSetId, metadata,
            source, labels);
    }

    public AssetWrite withDescription(String description) {
        return new AssetWrite(externalId, name, parentId, parentExternalId, description, dataSetId, metadata,
            source, labels);
    }

    public AssetWrite withDataSetId(Long dataSetId) {
        return new AssetWrite(externalId, name, parentId, parentExternalId, description, dataSetId, metadata,
            source, labels);
    }

    public AssetWrite withMetadata(Map<String, String> metadata) {
        return new AssetWrite(externalId, name, parentId, parentExternalId, description, dataSetId, metadata,
            source, labels);
    }

    public AssetWrite withLabels(List<String> labels) {
        return new AssetWrite(externalId, name, parentId, parentExternalId, description, dataSetId, metadata,
            source, labels);
    }
}
