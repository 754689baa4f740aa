package com.ryuqq.bulkwriter.application.resource.instance;

import com.ryuqq.bulkwriter.application.clean.IdentityAccessors;
import com.ryuqq.bulkwriter.application.writer.ResourceBinding;
import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.model.RequestType;
import com.ryuqq.bulkwriter.core.model.ResourceTag;
import com.ryuqq.bulkwriter.core.sanitation.DistinctRule;
import com.ryuqq.bulkwriter.core.sanitation.RequestCleaner;

import java.util.List;

/**
 * 인스턴스 upsert 설정.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public final class InstanceResources {

    public static final String DUPLICATED_MESSAGE = "Duplicated instance ids";

    private InstanceResources() {
    }

    public static ResourceBinding<InstanceWrite> binding() {
        return new ResourceBinding<>(RequestType.UPSERT_INSTANCES, accessors(), requestCleaner(), null);
    }

    public static IdentityAccessors<InstanceWrite> accessors() {
        return IdentityAccessors.<InstanceWrite>builder(InstanceResources::instanceIdOf)
            .single(ResourceTag.INSTANCE_ID, InstanceResources::instanceIdOf)
            .build();
    }

    public static RequestCleaner<InstanceWrite> requestCleaner() {
        return new RequestCleaner<>(new InstanceSanitizer(), List.of(
            new DistinctRule<>(DUPLICATED_MESSAGE, ResourceTag.INSTANCE_ID, InstanceResources::instanceIdOf)
        ));
    }

    private static Identity instanceIdOf(InstanceWrite instance) {
        if (instance.space() == null || instance.externalId() == null) {
            return null;
        }
        return Identity.instance(instance.space(), instance.externalId());
    }
}
