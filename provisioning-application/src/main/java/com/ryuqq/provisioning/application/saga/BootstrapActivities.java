package com.ryuqq.provisioning.application.saga;

import com.ryuqq.provisioning.application.activity.ActivateOrganizationActivity;
import com.ryuqq.provisioning.application.activity.ConfigureDnsActivity;
import com.ryuqq.provisioning.application.activity.CreateOrganizationActivity;
import com.ryuqq.provisioning.application.activity.EventHistory;
import com.ryuqq.provisioning.application.activity.GenerateInvitationsActivity;
import com.ryuqq.provisioning.application.activity.InvitationTokenGenerator;
import com.ryuqq.provisioning.application.activity.SendInvitationEmailsActivity;
import com.ryuqq.provisioning.application.activity.VerifyDnsActivity;
import com.ryuqq.provisioning.application.activity.compensation.DeactivateOrganizationActivity;
import com.ryuqq.provisioning.application.activity.compensation.DeleteContactInfoActivity;
import com.ryuqq.provisioning.application.activity.compensation.RemoveDnsActivity;
import com.ryuqq.provisioning.application.activity.compensation.RevokeInvitationsActivity;
import com.ryuqq.provisioning.application.config.ProvisioningConfig;
import com.ryuqq.provisioning.application.dns.QuorumDnsVerifier;
import com.ryuqq.provisioning.application.event.EventAppender;
import com.ryuqq.provisioning.core.projection.LinkKind;
import com.ryuqq.provisioning.core.spi.DnsProvider;
import com.ryuqq.provisioning.core.spi.EmailSender;
import com.ryuqq.provisioning.core.spi.EventQueryStore;
import com.ryuqq.provisioning.core.spi.EventStore;

import java.time.Clock;
import java.util.List;

/**
 * bootstrap saga가 사용하는 activity와 보상 계획 묶음.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record BootstrapActivities(
    CreateOrganizationActivity createOrganization,
    ConfigureDnsActivity configureDns,
    VerifyDnsActivity verifyDns,
    GenerateInvitationsActivity generateInvitations,
    SendInvitationEmailsActivity sendInvitationEmails,
    ActivateOrganizationActivity activateOrganization,
    CompensationPlan compensationPlan
) {

    public BootstrapActivities {
        if (createOrganization == null) {
            throw new IllegalArgumentException("createOrganization cannot be null");
        }
        if (configureDns == null) {
            throw new IllegalArgumentException("configureDns cannot be null");
        }
        if (verifyDns == null) {
            throw new IllegalArgumentException("verifyDns cannot be null");
        }
        if (generateInvitations == null) {
            throw new IllegalArgumentException("generateInvitations cannot be null");
        }
        if (sendInvitationEmails == null) {
            throw new IllegalArgumentException("sendInvitationEmails cannot be null");
        }
        if (activateOrganization == null) {
            throw new IllegalArgumentException("activateOrganization cannot be null");
        }
        if (compensationPlan == null) {
            throw new IllegalArgumentException("compensationPlan cannot be null");
        }
    }

    /**
     * 기본 구성으로 전체 activity 생성.
     */
    public static BootstrapActivities create(EventStore eventStore, EventQueryStore queryStore, EventAppender appender,
                                             DnsProvider dnsProvider, QuorumDnsVerifier verifier,
                                             EmailSender emailSender, ProvisioningConfig config, Clock clock) {
        EventHistory history = new EventHistory(eventStore);
        CompensationPlan plan = new CompensationPlan(
            List.of(
                new DeleteContactInfoActivity(LinkKind.PHONE, history, appender, clock),
                new DeleteContactInfoActivity(LinkKind.ADDRESS, history, appender, clock),
                new DeleteContactInfoActivity(LinkKind.CONTACT, history, appender, clock),
                new DeactivateOrganizationActivity(history, appender, clock)),
            new RemoveDnsActivity(dnsProvider, history, appender),
            new RevokeInvitationsActivity(history, queryStore, appender, clock));

        return new BootstrapActivities(
            new CreateOrganizationActivity(eventStore, appender),
            new ConfigureDnsActivity(dnsProvider, history, appender, config),
            new VerifyDnsActivity(verifier, history, appender, clock),
            new GenerateInvitationsActivity(queryStore, appender, new InvitationTokenGenerator(), config, clock),
            new SendInvitationEmailsActivity(emailSender, history, appender, config, clock),
            new ActivateOrganizationActivity(history, appender, clock),
            plan);
    }
}
