package com.ryuqq.provisioning.core.exception;

/**
 * 재시도해도 성공할 수 없는 검증 실패 (예: 잘못된 subdomain).
 *
 * <p>saga를 즉시 실패시키고 보상을 시작합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class PermanentValidationException extends ProvisioningException {

    public PermanentValidationException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "VALIDATION-400";
    }
}
