package com.ryuqq.provisioning.core.exception;

/**
 * 외부 provider(DNS, Email)의 일시적 실패.
 *
 * <p>타임아웃, 5xx, rate limit 등 재시도하면 성공할 수 있는 오류입니다.
 * provider가 재시도 시점을 알려 주면 {@link #getRetryAfterMillis()}로 전달합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class TransientProviderException extends ProvisioningException {

    private final long retryAfterMillis;

    public TransientProviderException(String message) {
        super(message);
        this.retryAfterMillis = 0L;
    }

    public TransientProviderException(String message, Throwable cause) {
        super(message, cause);
        this.retryAfterMillis = 0L;
    }

    /**
     * @param message 오류 메시지
     * @param retryAfterMillis provider가 요청한 최소 대기 시간 (밀리초, 0 이상)
     */
    public TransientProviderException(String message, long retryAfterMillis) {
        super(message);
        if (retryAfterMillis < 0) {
            throw new IllegalArgumentException("retryAfterMillis must be non-negative (current: " + retryAfterMillis + ")");
        }
        this.retryAfterMillis = retryAfterMillis;
    }

    public long getRetryAfterMillis() {
        return retryAfterMillis;
    }

    @Override
    public String errorCode() {
        return "PROVIDER-503";
    }
}
