package com.ryuqq.provisioning.application.activity;

import com.ryuqq.provisioning.core.email.EmailTemplate;

/**
 * 초대 메일 템플릿.
 *
 * <p>치환 키: org_name, invitee_name, invitation_url, expires_at, sender</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
final class InvitationEmailTemplate {

    static final EmailTemplate TEMPLATE = new EmailTemplate(
        "organization-invitation",
        "Invitation to join {{org_name}}",
        """
            Hello {{invitee_name}},

            You have been invited to join {{org_name}}.

            Accept the invitation here:
            {{invitation_url}}

            This invitation expires at {{expires_at}}.
            """,
        """
            <html>
              <body>
                <p>Hello {{invitee_name}},</p>
                <p>You have been invited to join <strong>{{org_name}}</strong>.</p>
                <p><a href="{{invitation_url}}">Accept invitation</a></p>
                <p>This invitation expires at {{expires_at}}.</p>
              </body>
            </html>
            """);

    private InvitationEmailTemplate() {
    }
}
