package com.ryuqq.bulkwriter.application.resource.instance;

import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.spi.Identifiable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 원격에 저장된 인스턴스. 내부 ID 없이 (space, externalId)로 식별됩니다.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public record Instance(
    String space,
    String externalId,
    long version,
    Map<String, Object> properties
) implements Identifiable {

    public Instance {
        if (space == null) {
            throw new IllegalArgumentException("space cannot be null");
        }
        if (externalId == null) {
            throw new IllegalArgumentException("externalId cannot be null");
        }
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    @Override
    public Long id() {
        return null;
    }

    @Override
    public Identity identity() {
        return Identity.instance(space, externalId);
    }
}
