package com.ryuqq.bulkwriter.application.resource.timeseries;

import com.ryuqq.bulkwriter.core.spi.Identifiable;

/**
 * 원격에 저장된 시계열.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public record TimeSeries(
    Long id,
    String externalId,
    String name,
    String legacyName,
    String unit,
    Long assetId,
    Long dataSetId
) implements Identifiable {

    public TimeSeries {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
    }

    public static TimeSeries from(long id, TimeSeriesWrite write) {
        return new TimeSeries(id, write.externalId(), write.name(), write.legacyName(), write.unit(),
            write.assetId(), write.dataSetId());
    }
}
