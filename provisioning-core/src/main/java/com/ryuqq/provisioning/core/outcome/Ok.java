package com.ryuqq.provisioning.core.outcome;

import com.ryuqq.provisioning.core.statemachine.SagaStep;

/**
 * 성공 결과.
 *
 * @param step 완료된 step
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record Ok(SagaStep step) implements Outcome {

    public Ok {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
    }

    /**
     * 성공 결과 생성.
     *
     * @param step 완료된 step
     * @return Ok 인스턴스
     */
    public static Ok of(SagaStep step) {
        return new Ok(step);
    }
}
