package com.ryuqq.provisioning.core.statemachine;

/**
 * Saga를 구성하는 activity 실행 단위.
 *
 * <p>각 step은 성공 시 도달하는 {@link BootstrapStage}와,
 * 실패 기록에 사용하는 표시 이름을 가집니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum SagaStep {

    CREATE_ORGANIZATION("CreateOrganization", BootstrapStage.ORG_CREATED),
    CONFIGURE_DNS("ConfigureDNS", BootstrapStage.DNS_CONFIGURED),
    VERIFY_DNS("VerifyDNS", BootstrapStage.DNS_VERIFIED),
    GENERATE_INVITATIONS("GenerateInvitations", BootstrapStage.INVITATIONS_GENERATED),
    SEND_INVITATION_EMAILS("SendInvitationEmails", BootstrapStage.EMAILS_SENT),
    ACTIVATE_ORGANIZATION("ActivateOrganization", BootstrapStage.ACTIVATED);

    private final String displayName;
    private final BootstrapStage completesStage;

    SagaStep(String displayName, BootstrapStage completesStage) {
        this.displayName = displayName;
        this.completesStage = completesStage;
    }

    /**
     * 실패 기록용 이름 (예: "VerifyDNS").
     *
     * @return 표시 이름
     */
    public String displayName() {
        return displayName;
    }

    /**
     * 성공 시 도달하는 단계.
     *
     * @return 완료 단계
     */
    public BootstrapStage completesStage() {
        return completesStage;
    }
}
