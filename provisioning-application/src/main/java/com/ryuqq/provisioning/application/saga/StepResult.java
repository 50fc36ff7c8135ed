package com.ryuqq.provisioning.application.saga;

import com.ryuqq.provisioning.core.outcome.Outcome;
import com.ryuqq.provisioning.core.saga.BootstrapSagaState;

/**
 * step 실행 결과: 판정과 activity 결과가 반영된 saga 상태.
 *
 * @param outcome Ok / Retry / Fail
 * @param state activity 결과를 반영한 상태 (단계 전이는 아직 적용 전)
 * @author Provisioning Team
 * @since 1.0.0
 */
public record StepResult(Outcome outcome, BootstrapSagaState state) {

    public StepResult {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }
}
