package com.ryuqq.provisioning.core.event;

import java.util.Optional;

/**
 * 이벤트 스트림 유형 (aggregate 종류).
 *
 * <p>닫힌 집합이며 projection router는 이 enum에 대한 exhaustive switch로
 * 정확히 하나의 handler를 선택합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum StreamType {

    ORGANIZATION("organization"),
    INVITATION("invitation"),
    CONTACT("contact"),
    ADDRESS("address"),
    PHONE("phone"),
    JUNCTION("junction"),
    BOOTSTRAP("bootstrap");

    private final String wireName;

    StreamType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 저장/전송에 사용하는 이름 (예: "organization").
     *
     * @return wire 이름
     */
    public String wireName() {
        return wireName;
    }

    /**
     * wire 이름으로 StreamType 조회.
     *
     * @param wireName wire 이름
     * @return 일치하는 StreamType, 없으면 empty
     */
    public static Optional<StreamType> fromWireName(String wireName) {
        for (StreamType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
