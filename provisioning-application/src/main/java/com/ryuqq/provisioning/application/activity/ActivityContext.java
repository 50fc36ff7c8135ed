package com.ryuqq.provisioning.application.activity;

import com.ryuqq.provisioning.core.event.EventMetadata;
import com.ryuqq.provisioning.core.model.BootstrapId;
import com.ryuqq.provisioning.core.statemachine.SagaStep;

/**
 * activity 실행 컨텍스트. 이벤트 metadata 구성에 사용됩니다.
 *
 * <ul>
 *   <li>correlation_id: bootstrap id</li>
 *   <li>causation_id: {bootstrapId}:{source}#{attempt}</li>
 *   <li>source: activity 이름</li>
 * </ul>
 *
 * @param bootstrapId saga id
 * @param userId 요청자
 * @param source activity 이름
 * @param attempt 시도 번호 (1부터)
 * @author Provisioning Team
 * @since 1.0.0
 */
public record ActivityContext(BootstrapId bootstrapId, String userId, String source, int attempt) {

    public ActivityContext {
        if (bootstrapId == null) {
            throw new IllegalArgumentException("bootstrapId cannot be null");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source cannot be null or blank");
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
    }

    public static ActivityContext forStep(BootstrapId bootstrapId, String userId, SagaStep step, int attempt) {
        return new ActivityContext(bootstrapId, userId, step.displayName(), attempt);
    }

    public static ActivityContext forCompensation(BootstrapId bootstrapId, String userId, String compensation) {
        return new ActivityContext(bootstrapId, userId, compensation, 1);
    }

    public EventMetadata metadata(String reason) {
        return new EventMetadata(userId, reason, bootstrapId.toString(),
            bootstrapId + ":" + source + "#" + attempt, source);
    }
}
