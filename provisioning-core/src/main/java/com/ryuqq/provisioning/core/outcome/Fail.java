package com.ryuqq.provisioning.core.outcome;

import com.ryuqq.provisioning.core.exception.ProvisioningException;
import com.ryuqq.provisioning.core.statemachine.SagaStep;

/**
 * 영구적 실패 (재시도 불가).
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>잘못된 subdomain 형식</li>
 *   <li>DNS zone 없음</li>
 *   <li>재시도 정책 소진 (DNS 전파 시간 예산 초과 등)</li>
 * </ul>
 *
 * @param step 실패한 step
 * @param errorCode 오류 코드 (예: VALIDATION-400)
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record Fail(
    SagaStep step,
    String errorCode,
    String message,
    String cause
) implements Outcome {

    public Fail {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    public static Fail of(SagaStep step, String errorCode, String message) {
        return new Fail(step, errorCode, message, null);
    }

    /**
     * Provisioning 예외로부터 Fail 생성.
     *
     * @param step 실패한 step
     * @param e 원인 예외
     * @return Fail 인스턴스
     */
    public static Fail from(SagaStep step, ProvisioningException e) {
        return new Fail(step, e.errorCode(), e.getMessage(), e.getClass().getSimpleName());
    }
}
