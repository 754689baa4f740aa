package com.ryuqq.bulkwriter.application.resource.instance;

import com.ryuqq.bulkwriter.core.model.ResourceTag;
import com.ryuqq.bulkwriter.core.sanitation.Sanitizer;
import com.ryuqq.bulkwriter.core.sanitation.StringLimits;

/**
 * 인스턴스 식별자 한도.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public class InstanceSanitizer implements Sanitizer<InstanceWrite> {

    public static final int SPACE_MAX = 43;

    @Override
    public InstanceWrite sanitize(InstanceWrite instance) {
        if (instance == null) {
            throw new IllegalArgumentException("instance cannot be null");
        }
        return new InstanceWrite(
            StringLimits.truncate(instance.space(), SPACE_MAX),
            StringLimits.limitUtf8ByteCount(instance.externalId(), StringLimits.EXTERNAL_ID_MAX),
            instance.properties(),
            instance.existingVersion()
        );
    }

    @Override
    public ResourceTag verify(InstanceWrite instance) {
        if (instance == null) {
            throw new IllegalArgumentException("instance cannot be null");
        }
        if (instance.space() == null || !StringLimits.checkLength(instance.space(), SPACE_MAX)) {
            return ResourceTag.SPACE_ID;
        }
        if (instance.externalId() == null || !StringLimits.checkLength(instance.externalId(), StringLimits.EXTERNAL_ID_MAX)) {
            return ResourceTag.EXTERNAL_ID;
        }
        if (StringLimits.utf8Length(instance.externalId()) > StringLimits.EXTERNAL_ID_MAX) {
            return ResourceTag.INSTANCE_ID;
        }
        return null;
    }
}
