package com.ryuqq.provisioning.application.orchestrator;

import com.ryuqq.provisioning.core.exception.SagaNotFoundException;
import com.ryuqq.provisioning.core.model.BootstrapId;
import com.ryuqq.provisioning.core.model.BootstrapRequest;

/**
 * Organization Bootstrap saga 진입점.
 *
 * <p>{@link #start}는 saga를 영속화하고 즉시 반환합니다. 실제 단계 진행은 runtime이 비동기로 수행합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface BootstrapOrchestrator {

    /**
     * 새 bootstrap saga 시작.
     *
     * @param request 요청
     * @return saga id
     */
    BootstrapId start(BootstrapRequest request);

    /**
     * saga 상태 조회 (saga 상태 저장소만 읽음).
     *
     * @param bootstrapId saga id
     * @return 현재 상태
     * @throws SagaNotFoundException 존재하지 않는 saga
     */
    BootstrapStatus getStatus(BootstrapId bootstrapId);

    /**
     * 취소 요청. 다음 진행 시점에 보상 후 CANCELLED로 종료됩니다.
     *
     * @param bootstrapId saga id
     * @param reason 취소 사유
     * @return 요청이 받아들여졌으면 true, 이미 종료/실패 중이면 false
     * @throws SagaNotFoundException 존재하지 않는 saga
     */
    boolean cancel(BootstrapId bootstrapId, String reason);
}
