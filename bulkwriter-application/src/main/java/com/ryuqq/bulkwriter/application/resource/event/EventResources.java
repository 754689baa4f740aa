package com.ryuqq.bulkwriter.application.resource.event;

import com.ryuqq.bulkwriter.application.clean.IdentityAccessors;
import com.ryuqq.bulkwriter.application.writer.ResourceBinding;
import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.model.RequestType;
import com.ryuqq.bulkwriter.core.model.ResourceTag;
import com.ryuqq.bulkwriter.core.sanitation.DistinctRule;
import com.ryuqq.bulkwriter.core.sanitation.RequestCleaner;

import java.util.List;

/**
 * 이벤트 쓰기 설정.
 *
 * <p>제거 대상 필드: EXTERNAL_ID, ASSET_ID (하나라도 없는 asset을 참조하면 제거), DATA_SET_ID.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public final class EventResources {

    public static final String DUPLICATED_MESSAGE = "ExternalIds duplicated";

    private EventResources() {
    }

    public static ResourceBinding<EventWrite> binding() {
        return new ResourceBinding<>(RequestType.CREATE_EVENTS, accessors(), requestCleaner(), null);
    }

    public static IdentityAccessors<EventWrite> accessors() {
        return IdentityAccessors.<EventWrite>builder(EventResources::externalIdOf)
            .single(ResourceTag.EXTERNAL_ID, EventResources::externalIdOf)
            .multi(ResourceTag.ASSET_ID, event -> event.assetIds() == null ? List.of()
                : event.assetIds().stream().filter(id -> id != null).map(Identity::of).toList())
            .single(ResourceTag.DATA_SET_ID, event -> event.dataSetId() == null ? null : Identity.of(event.dataSetId()))
            .build();
    }

    public static RequestCleaner<EventWrite> requestCleaner() {
        return new RequestCleaner<>(new EventSanitizer(), List.of(
            new DistinctRule<>(DUPLICATED_MESSAGE, ResourceTag.EXTERNAL_ID, EventResources::externalIdOf)
        ));
    }

    private static Identity externalIdOf(EventWrite event) {
        return event.externalId() == null ? null : Identity.of(event.externalId());
    }
}
