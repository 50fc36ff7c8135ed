package com.ryuqq.provisioning.application.orchestrator;

import com.ryuqq.provisioning.core.model.BootstrapId;
import com.ryuqq.provisioning.core.saga.BootstrapSagaState;
import com.ryuqq.provisioning.core.saga.SagaFailure;
import com.ryuqq.provisioning.core.statemachine.BootstrapStage;

import java.util.List;

/**
 * saga 상태 조회 결과.
 *
 * @param bootstrapId saga id
 * @param stage 현재 단계
 * @param completedStages 완료 단계 (완료 순서)
 * @param failure 실패 기록 (없으면 null)
 * @param cancelRequested 취소 요청 여부
 * @param result 종료 상태일 때의 결과 (진행 중이면 null)
 * @author Provisioning Team
 * @since 1.0.0
 */
public record BootstrapStatus(
    BootstrapId bootstrapId,
    BootstrapStage stage,
    List<BootstrapStage> completedStages,
    SagaFailure failure,
    boolean cancelRequested,
    BootstrapResult result
) {

    public BootstrapStatus {
        completedStages = completedStages == null ? List.of() : List.copyOf(completedStages);
    }

    public static BootstrapStatus from(BootstrapSagaState state) {
        return new BootstrapStatus(
            state.bootstrapId(),
            state.currentStage(),
            state.completedStages(),
            state.failure(),
            state.cancelRequested(),
            state.isTerminal() ? BootstrapResult.from(state) : null);
    }

    public boolean isTerminal() {
        return stage.isTerminal();
    }
}
