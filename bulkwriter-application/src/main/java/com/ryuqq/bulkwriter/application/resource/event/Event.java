package com.ryuqq.bulkwriter.application.resource.event;

import com.ryuqq.bulkwriter.core.spi.Identifiable;

import java.util.List;

/**
 * 원격에 저장된 이벤트.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public record Event(
    Long id,
    String externalId,
    Long startTime,
    Long endTime,
    String type,
    String subtype,
    List<Long> assetIds,
    Long dataSetId
) implements Identifiable {

    public Event {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        assetIds = assetIds == null ? List.of() : List.copyOf(assetIds);
    }

    /**
     * 생성 요청과 부여된 ID로 이벤트를 만듭니다.
     */
    public static Event from(long id, EventWrite write) {
        return new Event(id, write.externalId(), write.startTime(), write.endTime(), write.type(),
            write.subtype(), write.assetIds(), write.dataSetId());
    }
}
