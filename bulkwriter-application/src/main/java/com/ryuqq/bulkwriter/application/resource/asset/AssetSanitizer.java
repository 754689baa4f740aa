package com.ryuqq.bulkwriter.application.resource.asset;

import com.ryuqq.bulkwriter.core.model.ResourceTag;
import com.ryuqq.bulkwriter.core.sanitation.Sanitizer;
import com.ryuqq.bulkwriter.core.sanitation.StringLimits;

import java.util.List;
import java.util.Objects;

/**
 * 에셋 필드 한도.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class AssetSanitizer implements Sanitizer<AssetWrite> {

    public static final int NAME_MAX = 140;
    public static final int DESCRIPTION_MAX = 500;
    public static final int METADATA_MAX_PER_KEY = 128;
    public static final int METADATA_MAX_PER_VALUE = 10240;
    public static final int METADATA_MAX_PAIRS = 256;
    public static final int METADATA_MAX_BYTES = 10240;
    public static final int SOURCE_MAX = 128;
    public static final int LABELS_MAX = 10;

    @Override
    public AssetWrite sanitize(AssetWrite asset) {
        if (asset == null) {
            throw new IllegalArgumentException("asset cannot be null");
        }
        List<String> labels = asset.labels() == null ? null : asset.labels().stream()
            .filter(Objects::nonNull)
            .map(label -> StringLimits.truncate(label, StringLimits.EXTERNAL_ID_MAX))
            .limit(LABELS_MAX)
            .toList();

        return new AssetWrite(
            StringLimits.truncate(asset.externalId(), StringLimits.EXTERNAL_ID_MAX),
            StringLimits.truncate(asset.name(), NAME_MAX),
            asset.parentId() != null && asset.parentId() < 1 ? null : asset.parentId(),
            StringLimits.truncate(asset.parentExternalId(), StringLimits.EXTERNAL_ID_MAX),
            StringLimits.truncate(asset.description(), DESCRIPTION_MAX),
            asset.dataSetId() != null && asset.dataSetId() < 1 ? null : asset.dataSetId(),
            StringLimits.sanitizeMetadata(asset.metadata(), METADATA_MAX_PER_KEY, METADATA_MAX_PAIRS,
                METADATA_MAX_PER_VALUE, METADATA_MAX_BYTES),
            StringLimits.truncate(asset.source(), SOURCE_MAX),
            labels
        );
    }

    /**
     * name은 필수입니다.
     */
    @Override
    public ResourceTag verify(AssetWrite asset) {
        if (asset == null) {
            throw new IllegalArgumentException("asset cannot be null");
        }
        if (!StringLimits.checkLength(asset.externalId(), StringLimits.EXTERNAL_ID_MAX)) return ResourceTag.EXTERNAL_ID;
        if (asset.name() == null || !StringLimits.checkLength(asset.name(), NAME_MAX)) return ResourceTag.NAME;
        if (asset.parentId() != null && asset.parentId() < 1) return ResourceTag.PARENT_ID;
        if (!StringLimits.checkLength(asset.parentExternalId(), StringLimits.EXTERNAL_ID_MAX)) {
            return ResourceTag.PARENT_EXTERNAL_ID;
        }
        if (!StringLimits.checkLength(asset.description(), DESCRIPTION_MAX)) return ResourceTag.DESCRIPTION;
        if (asset.dataSetId() != null && asset.dataSetId() < 1) return ResourceTag.DATA_SET_ID;
        if (!StringLimits.verifyMetadata(asset.metadata(), METADATA_MAX_PER_KEY, METADATA_MAX_PAIRS,
            METADATA_MAX_PER_VALUE, METADATA_MAX_BYTES)) {
            return ResourceTag.METADATA;
        }
        if (!StringLimits.checkLength(asset.source(), SOURCE_MAX)) return ResourceTag.SOURCE;
        if (asset.labels() != null && (asset.labels().size() > LABELS_MAX
            || asset.labels().stream().anyMatch(label -> !StringLimits.checkLength(label, StringLimits.EXTERNAL_ID_MAX)))) {
            return ResourceTag.LABELS;
        }
        return null;
    }
}
