package com.ryuqq.bulkwriter.adapter.inmemory.resource;

import com.ryuqq.bulkwriter.application.resource.timeseries.TimeSeries;
import com.ryuqq.bulkwriter.application.resource.timeseries.TimeSeriesWrite;
import com.ryuqq.bulkwriter.core.spi.RemoteFailure;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory time series resource. Legacy names are unique across the resource.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class InMemoryTimeSeriesResource extends InMemoryResource<TimeSeriesWrite, TimeSeries> {

    public static final String ASSET_IDS_NOT_FOUND = "Asset ids not found";
    public static final String DATA_SET_IDS_NOT_FOUND = "Data set ids not found";
    public static final String DUPLICATED_LEGACY_NAMES = "Duplicated legacy names";

    private volatile Set<Long> knownAssetIds;
    private volatile Set<Long> knownDataSetIds;

    public void requireAssetIds(Collection<Long> assetIds) {
        Set<Long> known = ConcurrentHashMap.newKeySet();
        known.addAll(assetIds);
        this.knownAssetIds = known;
    }

    public void requireDataSetIds(Collection<Long> dataSetIds) {
        Set<Long> known = ConcurrentHashMap.newKeySet();
        known.addAll(dataSetIds);
        this.knownDataSetIds = known;
    }

    @Override
    protected RemoteFailure validate(List<TimeSeriesWrite> items) {
        Set<String> storedNames = new HashSet<>();
        for (TimeSeries stored : storedItems()) {
            if (stored.legacyName() != null) {
                storedNames.add(stored.legacyName());
            }
        }
        List<Map<String, Object>> duplicatedNames = new ArrayList<>();
        for (TimeSeriesWrite ts : items) {
            if (ts.legacyName() != null && storedNames.contains(ts.legacyName())) {
                duplicatedNames.add(Map.of("legacyName", ts.legacyName()));
            }
        }
        if (!duplicatedNames.isEmpty()) {
            return RemoteFailure.duplicated(409, DUPLICATED_LEGACY_NAMES, duplicatedNames);
        }

        List<Long> referencedAssets = new ArrayList<>();
        List<Long> referencedDataSets = new ArrayList<>();
        for (TimeSeriesWrite ts : items) {
            if (ts.assetId() != null) {
                referencedAssets.add(ts.assetId());
            }
            if (ts.dataSetId() != null) {
                referencedDataSets.add(ts.dataSetId());
            }
        }
        List<Long> unknownAssets = unknownIds(referencedAssets, knownAssetIds);
        if (!unknownAssets.isEmpty()) {
            return RemoteFailure.missing(400, ASSET_IDS_NOT_FOUND,
                unknownAssets.stream().map(id -> Map.<String, Object>of("id", id)).toList());
        }
        List<Long> unknownDataSets = unknownIds(referencedDataSets, knownDataSetIds);
        if (!unknownDataSets.isEmpty()) {
            return RemoteFailure.missing(400, DATA_SET_IDS_NOT_FOUND,
                unknownDataSets.stream().map(id -> Map.<String, Object>of("id", id)).toList());
        }
        return null;
    }

    @Override
    protected TimeSeries toStored(long id, TimeSeriesWrite item) {
        return TimeSeries.from(id, item);
    }

    @Override
    protected String externalIdOf(TimeSeriesWrite item) {
        return item.externalId();
    }

    @Override
    public void clear() {
        super.clear();
        knownAssetIds = null;
        knownDataSetIds = null;
    }
}
