package com.ryuqq.bulkwriter.application.resource.timeseries;

import com.ryuqq.bulkwriter.core.model.ResourceTag;
import com.ryuqq.bulkwriter.core.sanitation.Sanitizer;
import com.ryuqq.bulkwriter.core.sanitation.StringLimits;

/**
 * 시계열 필드 한도. legacyName은 외부 ID와 같은 한도를 씁니다.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class TimeSeriesSanitizer implements Sanitizer<TimeSeriesWrite> {

    public static final int NAME_MAX = 255;
    public static final int DESCRIPTION_MAX = 1000;
    public static final int UNIT_MAX = 32;
    public static final int METADATA_MAX_PER_KEY = 128;
    public static final int METADATA_MAX_PER_VALUE = 10000;
    public static final int METADATA_MAX_PAIRS = 256;
    public static final int METADATA_MAX_BYTES = 10000;

    @Override
    public TimeSeriesWrite sanitize(TimeSeriesWrite ts) {
        if (ts == null) {
            throw new IllegalArgumentException("timeSeries cannot be null");
        }
        return new TimeSeriesWrite(
            StringLimits.truncate(ts.externalId(), StringLimits.EXTERNAL_ID_MAX),
            StringLimits.truncate(ts.name(), NAME_MAX),
            StringLimits.truncate(ts.legacyName(), StringLimits.EXTERNAL_ID_MAX),
            StringLimits.sanitizeMetadata(ts.metadata(), METADATA_MAX_PER_KEY, METADATA_MAX_PAIRS,
                METADATA_MAX_PER_VALUE, METADATA_MAX_BYTES),
            StringLimits.truncate(ts.unit(), UNIT_MAX),
            ts.assetId() != null && ts.assetId() < 1 ? null : ts.assetId(),
            StringLimits.truncate(ts.description(), DESCRIPTION_MAX),
            ts.dataSetId() != null && ts.dataSetId() < 1 ? null : ts.dataSetId()
        );
    }

    @Override
    public ResourceTag verify(TimeSeriesWrite ts) {
        if (ts == null) {
            throw new IllegalArgumentException("timeSeries cannot be null");
        }
        if (!StringLimits.checkLength(ts.externalId(), StringLimits.EXTERNAL_ID_MAX)) return ResourceTag.EXTERNAL_ID;
        if (!StringLimits.checkLength(ts.name(), NAME_MAX)) return ResourceTag.NAME;
        if (ts.assetId() != null && ts.assetId() < 1) return ResourceTag.ASSET_ID;
        if (!StringLimits.checkLength(ts.description(), DESCRIPTION_MAX)) return ResourceTag.DESCRIPTION;
        if (ts.dataSetId() != null && ts.dataSetId() < 1) return ResourceTag.DATA_SET_ID;
        if (!StringLimits.verifyMetadata(ts.metadata(), METADATA_MAX_PER_KEY, METADATA_MAX_PAIRS,
            METADATA_MAX_PER_VALUE, METADATA_MAX_BYTES)) {
            return ResourceTag.METADATA;
        }
        if (!StringLimits.checkLength(ts.unit(), UNIT_MAX)) return ResourceTag.UNIT;
        if (!StringLimits.checkLength(ts.legacyName(), StringLimits.EXTERNAL_ID_MAX)) return ResourceTag.LEGACY_NAME;
        return null;
    }
}
