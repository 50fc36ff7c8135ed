package com.ryuqq.provisioning.core.outcome;

import com.ryuqq.provisioning.core.statemachine.SagaStep;

/**
 * Saga step 실행 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: step 완료, 다음 단계로 진행</li>
 *   <li>{@link Retry}: 일시적 실패, 단계별 재시도 정책에 따라 재시도</li>
 *   <li>{@link Fail}: 영구적 실패, saga 실패 및 보상 시작</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 구현체가 세 가지로 고정됩니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Retry, Fail {

    /**
     * 결과를 만든 step.
     *
     * @return saga step
     */
    SagaStep step();

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isRetry() {
        return this instanceof Retry;
    }

    default boolean isFail() {
        return this instanceof Fail;
    }
}
