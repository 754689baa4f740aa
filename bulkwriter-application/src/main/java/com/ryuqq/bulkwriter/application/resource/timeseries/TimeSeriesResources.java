package com.ryuqq.bulkwriter.application.resource.timeseries;

import com.ryuqq.bulkwriter.application.clean.IdentityAccessors;
import com.ryuqq.bulkwriter.application.writer.ResourceBinding;
import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.model.RequestType;
import com.ryuqq.bulkwriter.core.model.ResourceTag;
import com.ryuqq.bulkwriter.core.sanitation.DistinctRule;
import com.ryuqq.bulkwriter.core.sanitation.RequestCleaner;

import java.util.List;

/**
 * 시계열 쓰기 설정.
 *
 * <p>legacyName 중복은 외부 ID 형태의 식별자로 표현합니다.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public final class TimeSeriesResources {

    public static final String DUPLICATED_IDS_MESSAGE = "Conflicting identifiers";
    public static final String DUPLICATED_NAMES_MESSAGE = "Duplicated metric names in request";

    private TimeSeriesResources() {
    }

    public static ResourceBinding<TimeSeriesWrite> binding() {
        return new ResourceBinding<>(RequestType.CREATE_TIME_SERIES, accessors(), requestCleaner(), null);
    }

    public static IdentityAccessors<TimeSeriesWrite> accessors() {
        return IdentityAccessors.<TimeSeriesWrite>builder(TimeSeriesResources::externalIdOf)
            .single(ResourceTag.EXTERNAL_ID, TimeSeriesResources::externalIdOf)
            .single(ResourceTag.LEGACY_NAME, TimeSeriesResources::legacyNameOf)
            .single(ResourceTag.ASSET_ID, ts -> ts.assetId() == null ? null : Identity.of(ts.assetId()))
            .single(ResourceTag.DATA_SET_ID, ts -> ts.dataSetId() == null ? null : Identity.of(ts.dataSetId()))
            .build();
    }

    public static RequestCleaner<TimeSeriesWrite> requestCleaner() {
        return new RequestCleaner<>(new TimeSeriesSanitizer(), List.of(
            new DistinctRule<>(DUPLICATED_IDS_MESSAGE, ResourceTag.EXTERNAL_ID, TimeSeriesResources::externalIdOf),
            new DistinctRule<>(DUPLICATED_NAMES_MESSAGE, ResourceTag.LEGACY_NAME, TimeSeriesResources::legacyNameOf)
        ));
    }

    private static Identity externalIdOf(TimeSeriesWrite ts) {
        return ts.externalId() == null ? null : Identity.of(ts.externalId());
    }

    private static Identity legacyNameOf(TimeSeriesWrite ts) {
        return ts.legacyName() == null ? null : Identity.of(ts.legacyName());
    }
}
