package com.ryuqq.provisioning.application.orchestrator;

import com.ryuqq.provisioning.core.saga.BootstrapSagaState;
import com.ryuqq.provisioning.core.statemachine.BootstrapStage;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * saga 최종 결과.
 *
 * @param orgId 조직 id
 * @param domain 구성된 FQDN (없으면 null)
 * @param dnsConfigured 활성화 시점에 DNS가 구성되어 있는지 여부
 * @param invitationsSent 발송된 초대 메일 수
 * @param errors 실패 사유와 경고
 * @author Provisioning Team
 * @since 1.0.0
 */
public record BootstrapResult(UUID orgId, String domain, boolean dnsConfigured, int invitationsSent, List<String> errors) {

    public BootstrapResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static BootstrapResult from(BootstrapSagaState state) {
        List<String> errors = new ArrayList<>();
        if (state.failure() != null) {
            errors.add(state.failure().stage() + ": " + state.failure().message());
        }
        errors.addAll(state.warnings());
        String domain = state.dnsRecord() != null ? state.dnsRecord().fqdn() : null;
        boolean dnsConfigured = state.dnsRecord() != null && state.currentStage() == BootstrapStage.ACTIVATED;
        return new BootstrapResult(state.orgId(), domain, dnsConfigured, state.invitationsSent(), errors);
    }
}
