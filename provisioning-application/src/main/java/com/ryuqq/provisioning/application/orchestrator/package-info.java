/**
 * 부트스트랩 진입점.
 *
 * <p>{@link com.ryuqq.provisioning.application.orchestrator.BootstrapOrchestrator}는 saga 시작,
 * 상태 조회, 취소 요청을 제공합니다. 구현체는 adapter-runner 모듈에 있습니다.</p>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (BootstrapSagaRunner)
 *   ↓ implements
 * application (BootstrapOrchestrator, Runtime)
 *   ↓ depends on
 * application/saga (BootstrapStepExecutor, StageRetryPolicies)
 *   ↓ depends on
 * core (BootstrapSagaState, Outcome, SPI)
 * </pre>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
package com.ryuqq.provisioning.application.orchestrator;
