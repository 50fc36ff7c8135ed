/**
 * Step 실행 판정.
 *
 * <ul>
 *   <li>{@link com.ryuqq.provisioning.core.outcome.Ok} - 완료, 다음 단계로 진행</li>
 *   <li>{@link com.ryuqq.provisioning.core.outcome.Retry} - 일시적 실패, 재시도 정책에 따라 재실행</li>
 *   <li>{@link com.ryuqq.provisioning.core.outcome.Fail} - 영구 실패, 보상 시작</li>
 * </ul>
 *
 * <pre>
 * if (outcome instanceof Retry retry) {
 *     scheduleRetry(retry);
 * } else if (outcome instanceof Fail fail) {
 *     compensate(fail.message());
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author Provisioning Team
 */
package com.ryuqq.provisioning.core.outcome;
