package com.ryuqq.provisioning.application.activity.compensation;

import com.ryuqq.provisioning.application.activity.EventHistory;
import com.ryuqq.provisioning.application.event.EventAppender;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.event.InvitationEventType;
import com.ryuqq.provisioning.core.projection.InvitationView;
import com.ryuqq.provisioning.core.saga.IssuedInvitation;
import com.ryuqq.provisioning.core.spi.EventQueryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 대기 중인 초대를 모두 철회하는 보상.
 *
 * <p>대상은 saga에 기록된 초대와 projection이 알고 있는 조직 초대의 합집합입니다.
 * 철회 여부는 초대 스트림으로 판단하므로 projection이 뒤처져 있어도 saga 초대는 빠짐없이 철회됩니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class RevokeInvitationsActivity implements Compensation {

    private static final Logger log = LoggerFactory.getLogger(RevokeInvitationsActivity.class);

    static final String NAME = "RevokeInvitations";

    private final EventHistory history;
    private final EventQueryStore queryStore;
    private final EventAppender appender;
    private final Clock clock;

    public RevokeInvitationsActivity(EventHistory history, EventQueryStore queryStore, EventAppender appender,
                                     Clock clock) {
        if (history == null) {
            throw new IllegalArgumentException("history cannot be null");
        }
        if (queryStore == null) {
            throw new IllegalArgumentException("queryStore cannot be null");
        }
        if (appender == null) {
            throw new IllegalArgumentException("appender cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.history = history;
        this.queryStore = queryStore;
        this.appender = appender;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CompensationResult compensate(CompensationContext context) {
        List<String> actions = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Map<UUID, String> targets = new LinkedHashMap<>();
        for (IssuedInvitation invitation : context.invitations()) {
            targets.put(invitation.invitationId(), invitation.email());
        }
        try {
            for (InvitationView view : queryStore.findInvitations(context.orgId())) {
                targets.putIfAbsent(view.invitationId(), view.email());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to load invitation projection for organization {}", context.orgId(), e);
        }

        for (Map.Entry<UUID, String> target : targets.entrySet()) {
            UUID invitationId = target.getKey();
            String email = target.getValue();
            try {
                if (!history.isInvitationPending(invitationId)) {
                    continue;
                }
                EventData data = EventData.builder()
                    .put("org_id", context.orgId())
                    .put("invitation_id", invitationId)
                    .put("reason", context.reason())
                    .put("revoked_at", clock.instant())
                    .build();
                appender.append(invitationId, InvitationEventType.REVOKED, data,
                    context.activityContext(NAME).metadata(context.reason()));
                actions.add("revoked invitation for " + email);
            } catch (RuntimeException e) {
                log.warn("Failed to revoke invitation {}", invitationId, e);
                warnings.add("Failed to revoke invitation for " + email + ": " + e.getMessage());
            }
        }
        return new CompensationResult(NAME, actions, warnings);
    }
}
