package com.ryuqq.bulkwriter.application.resource.instance;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 데이터 모델 인스턴스 upsert 요청 항목.
 *
 * <p>existingVersion이 있으면 원격의 현재 버전과 같을 때만 쓰기가 성공합니다.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public record InstanceWrite(
    String space,
    String externalId,
    Map<String, Object> properties,
    Long existingVersion
) {

    public InstanceWrite {
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static InstanceWrite of(String space, String externalId, Map<String, Object> properties) {
        return new InstanceWrite(space, externalId, properties, null);
    }

    public InstanceWrite withProperties(Map<String, Object> properties) {
        return new InstanceWrite(space, externalId, properties, existingVersion);
    }

    public InstanceWrite withExistingVersion(Long existingVersion) {
        return new InstanceWrite(space, externalId, properties, existingVersion);
    }
}
