package com.ryuqq.bulkwriter.application.resource.asset;

import com.ryuqq.bulkwriter.application.clean.IdentityAccessors;
import com.ryuqq.bulkwriter.application.writer.ResourceBinding;
import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.model.RequestType;
import com.ryuqq.bulkwriter.core.model.ResourceTag;
import com.ryuqq.bulkwriter.core.sanitation.DistinctRule;
import com.ryuqq.bulkwriter.core.sanitation.RequestCleaner;
import com.ryuqq.bulkwriter.core.spi.RetrieveCapable;

import java.util.List;

/**
 * 에셋 쓰기 설정.
 *
 * <p>LABELS 오류는 labels 중 하나라도 없는 라벨이면 항목을 제거합니다.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public final class AssetResources {

    public static final String DUPLICATED_MESSAGE = "Duplicate external ids";

    private AssetResources() {
    }

    /**
     * unknown parent 오류를 완성할 수 없는 설정. 해당 오류가 나면 배치가 줄지 않아 정체 한도에서 멈춥니다.
     */
    public static ResourceBinding<AssetWrite> binding() {
        return new ResourceBinding<>(RequestType.CREATE_ASSETS, accessors(), requestCleaner(), null);
    }

    /**
     * @param assets 부모 조회에 사용할 에셋 리소스
     */
    public static ResourceBinding<AssetWrite> binding(RetrieveCapable<Asset> assets) {
        return binding().withCompleter(new ParentExternalIdCompleter(assets));
    }

    public static IdentityAccessors<AssetWrite> accessors() {
        return IdentityAccessors.<AssetWrite>builder(AssetResources::externalIdOf)
            .single(ResourceTag.EXTERNAL_ID, AssetResources::externalIdOf)
            .single(ResourceTag.PARENT_ID, asset -> asset.parentId() == null ? null : Identity.of(asset.parentId()))
            .single(ResourceTag.PARENT_EXTERNAL_ID,
                asset -> asset.parentExternalId() == null ? null : Identity.of(asset.parentExternalId()))
            .single(ResourceTag.DATA_SET_ID, asset -> asset.dataSetId() == null ? null : Identity.of(asset.dataSetId()))
            .multi(ResourceTag.LABELS, asset -> asset.labels() == null ? List.of()
                : asset.labels().stream().filter(label -> label != null).map(Identity::of).toList())
            .build();
    }

    public static RequestCleaner<AssetWrite> requestCleaner() {
        return new RequestCleaner<>(new AssetSanitizer(), List.of(
            new DistinctRule<>(DUPLICATED_MESSAGE, ResourceTag.EXTERNAL_ID, AssetResources::externalIdOf)
        ));
    }

    private static Identity externalIdOf(AssetWrite asset) {
        return asset.externalId() == null ? null : Identity.of(asset.externalId());
    }
}
