package com.ryuqq.bulkwriter.adapter.inmemory.resource;

import com.ryuqq.bulkwriter.application.resource.event.Event;
import com.ryuqq.bulkwriter.application.resource.event.EventWrite;
import com.ryuqq.bulkwriter.core.spi.RemoteFailure;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory events resource.
 *
 * <p>Asset and data set references are only checked once known ids are registered with
 * {@link #requireAssetIds(Collection)} / {@link #requireDataSetIds(Collection)}.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class InMemoryEventResource extends InMemoryResource<EventWrite, Event> {

    public static final String ASSET_IDS_NOT_FOUND = "Asset ids not found";
    public static final String INVALID_DATA_SET_IDS = "Invalid dataSetIds";

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
    protected RemoteFailure validate(List<EventWrite> items) {
        List<Long> referencedAssets = new ArrayList<>();
        List<Long> referencedDataSets = new ArrayList<>();
        for (EventWrite event : items) {
            if (event.assetIds() != null) {
                referencedAssets.addAll(event.assetIds());
            }
            if (event.dataSetId() != null) {
                referencedDataSets.add(event.dataSetId());
            }
        }

        List<Long> unknownAssets = unknownIds(referencedAssets, knownAssetIds);
        if (!unknownAssets.isEmpty()) {
            List<Map<String, Object>> missing = unknownAssets.stream()
                .map(id -> Map.<String, Object>of("id", id))
                .toList();
            return RemoteFailure.missing(400, ASSET_IDS_NOT_FOUND, missing);
        }
        List<Long> unknownDataSets = unknownIds(referencedDataSets, knownDataSetIds);
        if (!unknownDataSets.isEmpty()) {
            return new RemoteFailure(400, INVALID_DATA_SET_IDS + ": "
                + unknownDataSets.stream().map(String::valueOf).collect(Collectors.joining(", ")));
        }
        return null;
    }

    @Override
    protected Event toStored(long id, EventWrite item) {
        return Event.from(id, item);
    }

    @Override
    protected String externalIdOf(EventWrite item) {
        return item.externalId();
    }

    @Override
    public void clear() {
        super.clear();
        knownAssetIds = null;
        knownDataSetIds = null;
    }
}
