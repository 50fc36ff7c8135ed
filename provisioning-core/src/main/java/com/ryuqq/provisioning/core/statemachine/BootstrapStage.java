package com.ryuqq.provisioning.core.statemachine;

/**
 * Organization Bootstrap Saga의 단계.
 *
 * <p><strong>정상 경로 (선형):</strong></p>
 * <pre>
 * CREATED
 *    │  CreateOrganization
 *    ▼
 * ORG_CREATED
 *    │  ConfigureDNS
 *    ▼
 * DNS_CONFIGURED
 *    │  VerifyDNS
 *    ▼
 * DNS_VERIFIED
 *    │  GenerateInvitations
 *    ▼
 * INVITATIONS_GENERATED
 *    │  SendInvitationEmails
 *    ▼
 * EMAILS_SENT
 *    │  ActivateOrganization
 *    ▼
 * ACTIVATED (종료)
 * </pre>
 *
 * <p><strong>실패 경로:</strong></p>
 * <pre>
 * (비종료 단계) ─► FAILED ─► COMPENSATED (종료)
 *                        └─► CANCELLED   (종료, 취소 요청인 경우)
 * </pre>
 *
 * <p>FAILED는 보상이 아직 끝나지 않은 상태이므로 종료 상태가 아닙니다.
 * 보상 도중 크래시가 나면 다른 runner가 FAILED 상태의 saga를 이어받아 보상을 마칩니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum BootstrapStage {

    CREATED,
    ORG_CREATED,
    DNS_CONFIGURED,
    DNS_VERIFIED,
    INVITATIONS_GENERATED,
    EMAILS_SENT,
    ACTIVATED,

    /**
     * 실패 (보상 대기 또는 진행 중).
     */
    FAILED,

    /**
     * 실패 후 보상 완료.
     */
    COMPENSATED,

    /**
     * 취소 요청 후 보상 완료.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return ACTIVATED, COMPENSATED, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == ACTIVATED || this == COMPENSATED || this == CANCELLED;
    }

    /**
     * 정상 경로 단계인지 확인.
     *
     * @return CREATED ~ ACTIVATED인 경우 true
     */
    public boolean isHappyPath() {
        return ordinal() <= ACTIVATED.ordinal();
    }

    /**
     * 이 단계에서 다음에 실행할 step 조회.
     *
     * @return 다음 step
     * @throws IllegalStateException 정상 경로의 비종료 단계가 아닌 경우
     */
    public SagaStep pendingStep() {
        return switch (this) {
            case CREATED -> SagaStep.CREATE_ORGANIZATION;
            case ORG_CREATED -> SagaStep.CONFIGURE_DNS;
            case DNS_CONFIGURED -> SagaStep.VERIFY_DNS;
            case DNS_VERIFIED -> SagaStep.GENERATE_INVITATIONS;
            case INVITATIONS_GENERATED -> SagaStep.SEND_INVITATION_EMAILS;
            case EMAILS_SENT -> SagaStep.ACTIVATE_ORGANIZATION;
            case ACTIVATED, FAILED, COMPENSATED, CANCELLED ->
                throw new IllegalStateException("No pending step for stage: " + this);
        };
    }
}
