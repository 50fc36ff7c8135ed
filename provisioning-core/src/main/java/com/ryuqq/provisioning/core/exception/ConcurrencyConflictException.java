package com.ryuqq.provisioning.core.exception;

/**
 * 낙관적 동시성 충돌.
 *
 * <p>이벤트 append 시 (stream_id, stream_type, stream_version)이 이미 존재하거나,
 * saga 상태 저장 시 version이 일치하지 않는 경우 발생합니다.
 * 호출자는 버전을 다시 계산하여 논리적 작업 전체를 재시도해야 합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class ConcurrencyConflictException extends ProvisioningException {

    public ConcurrencyConflictException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "STORE-409";
    }
}
