package com.ryuqq.bulkwriter.application.clean;

import com.ryuqq.bulkwriter.core.model.Identity;
import com.ryuqq.bulkwriter.core.model.ResourceTag;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * 리소스 태그 → 항목 필드 값 추출 함수 테이블.
 *
 * <p>Batch Cleaner는 오류의 {@link ResourceTag}로 이 테이블을 조회해 각 항목에서 비교할 식별자를 꺼냅니다.
 * 리소스 타입마다 하나씩 만들어지며, 등록되지 않은 태그는 빈 값으로 취급합니다.</p>
 *
 * <pre>{@code
 * IdentityAccessors<EventWrite> accessors = IdentityAccessors.<EventWrite>builder(EventWrite::identity)
 *     .single(ResourceTag.EXTERNAL_ID, e -> e.externalId() == null ? null : Identity.of(e.externalId()))
 *     .multi(ResourceTag.ASSET_ID, e -> ...)
 *     .build();
 * }</pre>
 *
 * @param <T> 쓰기 항목 타입
 * @author BulkWriter Team
 * @since 1.0.0
 */
public final class IdentityAccessors<T> {

    private final Function<T, Identity> identityOf;
    private final Map<ResourceTag, Function<T, Collection<Identity>>> accessors;

    private IdentityAccessors(Function<T, Identity> identityOf,
                              Map<ResourceTag, Function<T, Collection<Identity>>> accessors) {
        this.identityOf = identityOf;
        this.accessors = accessors;
    }

    public static <T> Builder<T> builder(Function<T, Identity> identityOf) {
        return new Builder<>(identityOf);
    }

    /**
     * 항목의 대표 식별자.
     *
     * @return 식별자, 없으면 null
     */
    public Identity identityOf(T item) {
        return identityOf.apply(item);
    }

    /**
     * 태그에 해당하는 필드 값.
     *
     * @return 식별자 목록 (null 요소 제외), 태그가 등록되지 않았거나 값이 없으면 빈 목록
     */
    public Collection<Identity> valuesOf(ResourceTag tag, T item) {
        Function<T, Collection<Identity>> accessor = accessors.get(tag);
        if (accessor == null) {
            return List.of();
        }
        Collection<Identity> values = accessor.apply(item);
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }

    public boolean supports(ResourceTag tag) {
        return accessors.containsKey(tag);
    }

    /**
     * IdentityAccessors 빌더.
     */
    public static final class Builder<T> {

        private final Function<T, Identity> identityOf;
        private final Map<ResourceTag, Function<T, Collection<Identity>>> accessors = new EnumMap<>(ResourceTag.class);

        private Builder(Function<T, Identity> identityOf) {
            if (identityOf == null) {
                throw new IllegalArgumentException("identityOf cannot be null");
            }
            this.identityOf = identityOf;
        }

        /**
         * 단일 값 필드 등록.
         */
        public Builder<T> single(ResourceTag tag, Function<T, Identity> accessor) {
            if (accessor == null) {
                throw new IllegalArgumentException("accessor cannot be null");
            }
            return multi(tag, item -> {
                Identity value = accessor.apply(item);
                return value == null ? List.of() : List.of(value);
            });
        }

        /**
         * 다중 값 필드 등록 (예: 이벤트의 assetIds). 값 중 하나라도 오류 집합에 있으면 항목이 제거됩니다.
         */
        public Builder<T> multi(ResourceTag tag, Function<T, Collection<Identity>> accessor) {
            if (tag == null) {
                throw new IllegalArgumentException("tag cannot be null");
            }
            if (accessor == null) {
                throw new IllegalArgumentException("accessor cannot be null");
            }
            accessors.put(tag, accessor);
            return this;
        }

        public IdentityAccessors<T> build() {
            return new IdentityAccessors<>(identityOf, new EnumMap<>(accessors));
        }
    }
}
