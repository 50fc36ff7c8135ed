/**
 * 부트스트랩 단계 상태 머신.
 *
 * <pre>
 * CREATED → ORG_CREATED → DNS_CONFIGURED → DNS_VERIFIED
 *         → INVITATIONS_GENERATED → EMAILS_SENT → ACTIVATED
 *
 * (any non-terminal) → FAILED → COMPENSATED | CANCELLED
 * </pre>
 *
 * <p>ACTIVATED, COMPENSATED, CANCELLED만 종료 단계입니다. FAILED는 보상이 끝날 때까지
 * 머무는 중간 단계입니다.</p>
 *
 * @since 1.0.0
 * @author Provisioning Team
 */
package com.ryuqq.provisioning.core.statemachine;
