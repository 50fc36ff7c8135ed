/**
 * Runner Adapter Layer - saga와 projection 백그라운드 실행기.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioning.adapter.runner.BootstrapSagaRunner} - 만기 saga를 lease로 선점해 한 step씩 진행</li>
 *   <li>{@link com.ryuqq.provisioning.adapter.runner.ProjectionCatchUpDispatcher} - 미처리 이벤트를 스트림 순서대로 반영</li>
 *   <li>{@link com.ryuqq.provisioning.adapter.runner.BackoffCalculator} - 재시도 지연 계산</li>
 * </ul>
 *
 * <p>두 실행기 모두 {@link com.ryuqq.provisioning.application.runtime.Runtime#pump()} 한 번에 한 배치만
 * 처리합니다. 호출 주기는 호스트 애플리케이션의 스케줄러가 정합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
package com.ryuqq.provisioning.adapter.runner;
