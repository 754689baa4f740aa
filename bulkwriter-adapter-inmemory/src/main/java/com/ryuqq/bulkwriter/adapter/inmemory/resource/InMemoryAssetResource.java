package com.ryuqq.bulkwriter.adapter.inmemory.resource;

import com.ryuqq.bulkwriter.application.resource.asset.Asset;
import com.ryuqq.bulkwriter.application.resource.asset.AssetWrite;
import com.ryuqq.bulkwriter.core.spi.RemoteFailure;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory assets resource with parent checks.
 *
 * <p>A parent given by external id may be created in the same request. When several parents are
 * unknown, only the first one is reported, which is why the resulting error needs completion.</p>
 *
 * <p>Check order: parent external id, parent id, labels, data set.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class InMemoryAssetResource extends InMemoryResource<AssetWrite, Asset> {

    public static final String UNKNOWN_PARENT = "Reference to unknown parent with externalId";
    public static final String PARENT_IDS_MISSING = "The given parent ids do not exist";
    public static final String LABELS_NOT_FOUND = "Labels not found";
    public static final String INVALID_DATA_SET_IDS = "Invalid dataSetIds";

    private volatile Set<String> knownLabels;
    private volatile Set<Long> knownDataSetIds;

    public void requireLabels(Collection<String> labels) {
        Set<String> known = ConcurrentHashMap.newKeySet();
        known.addAll(labels);
        this.knownLabels = known;
    }

    public void requireDataSetIds(Collection<Long> dataSetIds) {
        Set<Long> known = ConcurrentHashMap.newKeySet();
        known.addAll(dataSetIds);
        this.knownDataSetIds = known;
    }

    @Override
    protected RemoteFailure validate(List<AssetWrite> items) {
        Set<String> requestIds = new HashSet<>();
        for (AssetWrite asset : items) {
            if (asset.externalId() != null) {
                requestIds.add(asset.externalId());
            }
        }

        for (AssetWrite asset : items) {
            String parent = asset.parentExternalId();
            if (parent != null && !requestIds.contains(parent) && idOfExternalId(parent) == null) {
                return new RemoteFailure(400, UNKNOWN_PARENT + " " + parent);
            }
        }

        Set<Long> missingParents = new LinkedHashSet<>();
        for (AssetWrite asset : items) {
            if (asset.parentId() != null && !containsId(asset.parentId())) {
                missingParents.add(asset.parentId());
            }
        }
        if (!missingParents.isEmpty()) {
            return new RemoteFailure(400, PARENT_IDS_MISSING + ": "
                + missingParents.stream().map(String::valueOf).collect(Collectors.joining(", ")));
        }

        Set<String> labels = knownLabels;
        if (labels != null) {
            Set<String> missingLabels = new LinkedHashSet<>();
            for (AssetWrite asset : items) {
                if (asset.labels() != null) {
                    asset.labels().stream().filter(label -> !labels.contains(label)).forEach(missingLabels::add);
                }
            }
            if (!missingLabels.isEmpty()) {
                List<Map<String, Object>> missing = missingLabels.stream()
                    .map(label -> Map.<String, Object>of("externalId", label))
                    .toList();
                return RemoteFailure.missing(400, LABELS_NOT_FOUND, missing);
            }
        }

        List<Long> referencedDataSets = new ArrayList<>();
        for (AssetWrite asset : items) {
            if (asset.dataSetId() != null) {
                referencedDataSets.add(asset.dataSetId());
            }
        }
        List<Long> unknownDataSets = unknownIds(referencedDataSets, knownDataSetIds);
        if (!unknownDataSets.isEmpty()) {
            return new RemoteFailure(400, INVALID_DATA_SET_IDS + ": "
                + unknownDataSets.stream().map(String::valueOf).collect(Collectors.joining(", ")));
        }
        return null;
    }

    @Override
    protected Asset toStored(long id, AssetWrite item) {
        Long parentId = item.parentId() != null ? item.parentId() : idOfExternalId(item.parentExternalId());
        return Asset.from(id, parentId, item);
    }

    @Override
    protected String externalIdOf(AssetWrite item) {
        return item.externalId();
    }

    @Override
    public void clear() {
        super.clear();
        knownLabels = null;
        knownDataSetIds = null;
    }
}
