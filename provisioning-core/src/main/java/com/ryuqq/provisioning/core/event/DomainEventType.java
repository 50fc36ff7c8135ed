package com.ryuqq.provisioning.core.event;

/**
 * 스트림 유형별 이벤트 타입 enum이 구현하는 공통 계약.
 *
 * <p>각 {@link StreamType}은 자신이 소유한 이벤트 타입을 하나의 enum으로 선언합니다.
 * handler는 해당 enum에 대한 switch 식으로 모든 이벤트 타입을 처리합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface DomainEventType {

    /**
     * 저장/전송에 사용하는 이벤트 타입 이름 (예: "organization.created").
     *
     * @return wire 이름
     */
    String wireName();

    /**
     * 이 이벤트 타입을 소유한 스트림 유형.
     *
     * @return 스트림 유형
     */
    StreamType streamType();
}
