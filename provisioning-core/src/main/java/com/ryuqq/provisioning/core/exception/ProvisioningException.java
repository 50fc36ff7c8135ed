package com.ryuqq.provisioning.core.exception;

/**
 * Provisioning 오류 계층의 최상위 예외.
 *
 * <p>모든 하위 예외는 unchecked이며, saga runner가 종류에 따라
 * 재시도({@code Retry}) 또는 영구 실패({@code Fail})로 분류합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public abstract class ProvisioningException extends RuntimeException {

    protected ProvisioningException(String message) {
        super(message);
    }

    protected ProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (예: DNS-001)
     */
    public abstract String errorCode();
}
