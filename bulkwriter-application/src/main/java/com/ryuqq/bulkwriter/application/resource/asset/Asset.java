package com.ryuqq.bulkwriter.application.resource.asset;

import com.ryuqq.bulkwriter.core.spi.Identifiable;

/**
 * 원격에 저장된 에셋.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public record Asset(
    Long id,
    String externalId,
    String name,
    Long parentId,
    String parentExternalId,
    Long dataSetId
) implements Identifiable {

    public Asset {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
    }

    public static Asset from(long id, Long parentId, AssetWrite write) {
        return new Asset(id, write.externalId(), write.name(), parentId, write.parentExternalId(), write.dataSetId());
    }
}
