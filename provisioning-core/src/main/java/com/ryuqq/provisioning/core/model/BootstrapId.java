package com.ryuqq.provisioning.core.model;

import java.util.UUID;

/**
 * Organization Bootstrap Saga의 전역 고유 식별자.
 *
 * <p>BootstrapId는 saga 상태 조회 키이자 bootstrap 이벤트 스트림의 stream_id로 사용되며,
 * 모든 이벤트 metadata의 correlation_id 값이 됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class BootstrapId {

    private final UUID value;

    private BootstrapId(UUID value) {
        if (value == null) {
            throw new IllegalArgumentException("BootstrapId cannot be null");
        }
        this.value = value;
    }

    /**
     * 새 BootstrapId 생성 (무작위 UUID).
     *
     * @return BootstrapId 인스턴스
     */
    public static BootstrapId newId() {
        return new BootstrapId(UUID.randomUUID());
    }

    /**
     * UUID로부터 BootstrapId 생성.
     *
     * @param value UUID 값
     * @return BootstrapId 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static BootstrapId of(UUID value) {
        return new BootstrapId(value);
    }

    /**
     * 문자열로부터 BootstrapId 생성.
     *
     * @param value UUID 문자열
     * @return BootstrapId 인스턴스
     * @throws IllegalArgumentException UUID 형식이 아닌 경우
     */
    public static BootstrapId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("BootstrapId cannot be null or blank");
        }
        return new BootstrapId(UUID.fromString(value));
    }

    /**
     * BootstrapId 값 조회.
     *
     * @return UUID 값
     */
    public UUID getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BootstrapId that = (BootstrapId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
