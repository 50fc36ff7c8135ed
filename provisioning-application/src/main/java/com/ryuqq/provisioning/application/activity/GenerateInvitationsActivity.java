package com.ryuqq.provisioning.application.activity;

import com.ryuqq.provisioning.application.config.ProvisioningConfig;
import com.ryuqq.provisioning.application.event.EventAppender;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.event.InvitationEventType;
import com.ryuqq.provisioning.core.model.InvitationRecipient;
import com.ryuqq.provisioning.core.projection.InvitationView;
import com.ryuqq.provisioning.core.saga.IssuedInvitation;
import com.ryuqq.provisioning.core.spi.EventQueryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 초대 생성 activity.
 *
 * <p>(org_id, email)에 대해 대기 중인 초대가 이미 있으면 그 초대를 재사용합니다.
 * 새 초대는 invitation 스트림에 {@code user.invited}로 기록됩니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class GenerateInvitationsActivity {

    private static final Logger log = LoggerFactory.getLogger(GenerateInvitationsActivity.class);

    private final EventQueryStore queryStore;
    private final EventAppender appender;
    private final InvitationTokenGenerator tokenGenerator;
    private final ProvisioningConfig config;
    private final Clock clock;

    public GenerateInvitationsActivity(EventQueryStore queryStore, EventAppender appender,
                                       InvitationTokenGenerator tokenGenerator, ProvisioningConfig config, Clock clock) {
        if (queryStore == null) {
            throw new IllegalArgumentException("queryStore cannot be null");
        }
        if (appender == null) {
            throw new IllegalArgumentException("appender cannot be null");
        }
        if (tokenGenerator == null) {
            throw new IllegalArgumentException("tokenGenerator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.queryStore = queryStore;
        this.appender = appender;
        this.tokenGenerator = tokenGenerator;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 초대 생성.
     *
     * @param orgId 조직 id
     * @param recipients 초대 대상
     * @param context 실행 컨텍스트
     * @return 발급된 초대 (재사용 포함, 입력 순서)
     */
    public List<IssuedInvitation> execute(UUID orgId, List<InvitationRecipient> recipients, ActivityContext context) {
        List<IssuedInvitation> issued = new ArrayList<>(recipients.size());
        for (InvitationRecipient recipient : recipients) {
            Optional<InvitationView> existing = queryStore.findLiveInvitation(orgId, recipient.email());
            if (existing.isPresent()) {
                InvitationView view = existing.get();
                log.info("Reusing pending invitation {} for {}", view.invitationId(), recipient.email());
                issued.add(new IssuedInvitation(view.invitationId(), view.email(), view.token(), view.expiresAt()));
                continue;
            }

            UUID invitationId = UUID.randomUUID();
            String token = tokenGenerator.newToken();
            Instant expiresAt = clock.instant().plus(config.invitationTtl());
            EventData data = EventData.builder()
                .put("org_id", orgId)
                .put("invitation_id", invitationId)
                .put("email", recipient.email())
                .put("first_name", recipient.firstName())
                .put("last_name", recipient.lastName())
                .putList("roles", recipient.roles())
                .put("token", token)
                .put("expires_at", expiresAt)
                .build();
            appender.append(invitationId, InvitationEventType.USER_INVITED, data,
                context.metadata("Invitation generated via bootstrap"));
            issued.add(new IssuedInvitation(invitationId, recipient.email(), token, expiresAt));
        }
        log.info("Generated {} invitation(s) for organization {}", issued.size(), orgId);
        return issued;
    }
}
