package com.ryuqq.bulkwriter.core.model;

import java.util.Objects;

/**
 * 원격 리소스 항목의 식별자.
 *
 * <p>세 가지 형태 중 정확히 하나를 가집니다:</p>
 * <ul>
 *   <li>내부 ID (서버가 부여한 {@code long})</li>
 *   <li>외부 ID (클라이언트가 부여한 문자열)</li>
 *   <li>인스턴스 ID (space + externalId 쌍, 데이터 모델 인스턴스용)</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가. equals/hashCode는 형태와 값 모두를 비교합니다.</p>
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
public final class Identity {

    private final Long id;
    private final String externalId;
    private final String space;

    private Identity(Long id, String externalId, String space) {
        this.id = id;
        this.externalId = externalId;
        this.space = space;
    }

    /**
     * 내부 ID로 Identity 생성.
     *
     * @param id 내부 ID
     * @return Identity 인스턴스
     */
    public static Identity of(long id) {
        return new Identity(id, null, null);
    }

    /**
     * 외부 ID로 Identity 생성.
     *
     * @param externalId 외부 ID
     * @return Identity 인스턴스
     * @throws IllegalArgumentException externalId가 null인 경우
     */
    public static Identity of(String externalId) {
        if (externalId == null) {
            throw new IllegalArgumentException("externalId cannot be null");
        }
        return new Identity(null, externalId, null);
    }

    /**
     * 인스턴스 ID로 Identity 생성.
     *
     * @param space 인스턴스가 속한 space
     * @param externalId space 내 외부 ID
     * @return Identity 인스턴스
     * @throws IllegalArgumentException space 또는 externalId가 null인 경우
     */
    public static Identity instance(String space, String externalId) {
        if (space == null) {
            throw new IllegalArgumentException("space cannot be null");
        }
        if (externalId == null) {
            throw new IllegalArgumentException("externalId cannot be null");
        }
        return new Identity(null, externalId, space);
    }

    public boolean isInternalId() {
        return id != null;
    }

    public boolean isInstanceId() {
        return space != null;
    }

    /**
     * @return 내부 ID, 내부 ID 형태가 아니면 null
     */
    public Long getId() {
        return id;
    }

    /**
     * @return 외부 ID, 내부 ID 형태이면 null
     */
    public String getExternalId() {
        return externalId;
    }

    /**
     * @return space, 인스턴스 ID 형태가 아니면 null
     */
    public String getSpace() {
        return space;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Identity other = (Identity) o;
        return Objects.equals(id, other.id)
            && Objects.equals(externalId, other.externalId)
            && Objects.equals(space, other.space);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, externalId, space);
    }

    @Override
    public String toString() {
        if (id != null) {
            return "Identity{id=" + id + '}';
        }
        if (space != null) {
            return "Identity{" + space + ':' + externalId + '}';
        }
        return "Identity{externalId=" + externalId + '}';
    }
}
