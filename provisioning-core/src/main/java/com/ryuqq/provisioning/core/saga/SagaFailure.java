package com.ryuqq.provisioning.core.saga;

/**
 * saga 실패 기록.
 *
 * @param stage 실패한 step 표시 이름 (예: "VerifyDNS")
 * @param message 실패 사유
 * @param cleanupRequired 보상이 필요한 완료 단계가 있었는지 여부
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record SagaFailure(String stage, String message, boolean cleanupRequired) {

    public SagaFailure {
        if (stage == null || stage.isBlank()) {
            throw new IllegalArgumentException("stage cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }
}
