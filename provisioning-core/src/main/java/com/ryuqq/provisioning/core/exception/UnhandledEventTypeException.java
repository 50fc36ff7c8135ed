package com.ryuqq.provisioning.core.exception;

/**
 * stream_type에 속하지 않는 event_type.
 *
 * <p>스키마 drift 또는 프로그래머 오류입니다. 조용히 건너뛰면 projection이
 * 보이지 않게 손상되므로 dispatch를 중단하고 호출자에게 전파합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class UnhandledEventTypeException extends ProvisioningException {

    private final String streamType;
    private final String eventType;

    public UnhandledEventTypeException(String streamType, String eventType) {
        super("Unhandled event type '" + eventType + "' for stream type '" + streamType + "'");
        this.streamType = streamType;
        this.eventType = eventType;
    }

    public String getStreamType() {
        return streamType;
    }

    public String getEventType() {
        return eventType;
    }

    @Override
    public String errorCode() {
        return "ROUTER-UNHANDLED";
    }
}
