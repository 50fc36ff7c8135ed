package com.ryuqq.provisioning.application.activity;

import com.ryuqq.provisioning.application.config.ProvisioningConfig;
import com.ryuqq.provisioning.application.event.EventAppender;
import com.ryuqq.provisioning.core.email.SendResult;
import com.ryuqq.provisioning.core.event.DomainEvent;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.event.InvitationEventType;
import com.ryuqq.provisioning.core.saga.IssuedInvitation;
import com.ryuqq.provisioning.core.spi.EmailSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 초대 메일 발송 activity (수신자별 best-effort).
 *
 * <p>수신자 한 명의 발송 실패는 saga를 실패시키지 않습니다. 실패는 결과에 모아 반환되고
 * 최종 결과의 경고로 노출됩니다. 이미 발송 기록이 있는 초대는 다시 보내지 않습니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class SendInvitationEmailsActivity {

    private static final Logger log = LoggerFactory.getLogger(SendInvitationEmailsActivity.class);

    private final EmailSender emailSender;
    private final EventHistory history;
    private final EventAppender appender;
    private final ProvisioningConfig config;
    private final Clock clock;

    public SendInvitationEmailsActivity(EmailSender emailSender, EventHistory history, EventAppender appender,
                                        ProvisioningConfig config, Clock clock) {
        if (emailSender == null) {
            throw new IllegalArgumentException("emailSender cannot be null");
        }
        if (history == null) {
            throw new IllegalArgumentException("history cannot be null");
        }
        if (appender == null) {
            throw new IllegalArgumentException("appender cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.emailSender = emailSender;
        this.history = history;
        this.appender = appender;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 초대 메일 발송.
     *
     * @param orgId 조직 id
     * @param orgName 조직 이름
     * @param invitations 발급된 초대
     * @param context 실행 컨텍스트
     * @return 발송 결과
     */
    public Result execute(UUID orgId, String orgName, List<IssuedInvitation> invitations, ActivityContext context) {
        int sent = 0;
        List<Failure> failures = new ArrayList<>();

        for (IssuedInvitation invitation : invitations) {
            if (history.contains(invitation.invitationId(), InvitationEventType.EMAIL_SENT)) {
                log.debug("Invitation email to {} already sent, skipping", invitation.email());
                sent++;
                continue;
            }
            try {
                SendResult result = emailSender.send(invitation.email(), InvitationEmailTemplate.TEMPLATE,
                    templateData(orgName, invitation));
                if (!result.isAccepted(invitation.email())) {
                    log.warn("Invitation email to {} was rejected by the provider", invitation.email());
                    failures.add(new Failure(invitation.email(), "rejected by email provider"));
                    continue;
                }
                EventData data = EventData.builder()
                    .put("org_id", orgId)
                    .put("invitation_id", invitation.invitationId())
                    .put("email", invitation.email())
                    .put("message_id", result.messageId())
                    .put("sent_at", clock.instant())
                    .build();
                appender.append(invitation.invitationId(), InvitationEventType.EMAIL_SENT, data,
                    context.metadata("Invitation email sent"));
                sent++;
            } catch (RuntimeException e) {
                log.warn("Failed to send invitation email to {}", invitation.email(), e);
                failures.add(new Failure(invitation.email(), e.getMessage()));
            }
        }

        log.info("Invitation emails for organization {}: {} sent, {} failed", orgId, sent, failures.size());
        return new Result(sent, failures);
    }

    private Map<String, String> templateData(String orgName, IssuedInvitation invitation) {
        Optional<DomainEvent> invited = history.latest(invitation.invitationId(), InvitationEventType.USER_INVITED);
        String inviteeName = invited.flatMap(event -> event.data().optionalText("first_name")).orElse(null);
        return Map.of(
            "org_name", orgName,
            "invitee_name", inviteeName != null ? inviteeName : invitation.email(),
            "invitation_url", config.invitationUrl(invitation.token()),
            "expires_at", invitation.expiresAt().toString(),
            "sender", config.senderAddress());
    }

    /**
     * @param sentCount 발송 성공 수 (이전 발송 포함)
     * @param failures 수신자별 실패
     */
    public record Result(int sentCount, List<Failure> failures) {

        public Result {
            failures = failures == null ? List.of() : List.copyOf(failures);
        }
    }

    public record Failure(String email, String reason) {
    }
}
