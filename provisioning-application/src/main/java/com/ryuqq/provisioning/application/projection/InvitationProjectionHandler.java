package com.ryuqq.provisioning.application.projection;

import com.ryuqq.provisioning.core.event.DomainEvent;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.event.InvitationEventType;
import com.ryuqq.provisioning.core.projection.InvitationStatus;
import com.ryuqq.provisioning.core.projection.InvitationView;
import com.ryuqq.provisioning.core.spi.ProjectionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * invitation 스트림 핸들러 (stream_id = invitation_id).
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class InvitationProjectionHandler implements ProjectionHandler<InvitationEventType> {

    private static final Logger log = LoggerFactory.getLogger(InvitationProjectionHandler.class);

    private final ProjectionStore store;

    public InvitationProjectionHandler(ProjectionStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public void apply(DomainEvent event, InvitationEventType type) {
        Optional<InvitationView> existing = store.findInvitation(event.streamId());
        if (existing.isPresent() && existing.get().version() >= event.streamVersion()) {
            log.debug("Invitation {} already at v{}, skipping {}", event.streamId(), existing.get().version(), type.wireName());
            return;
        }
        if (existing.isEmpty() && type != InvitationEventType.USER_INVITED) {
            throw new IllegalStateException(
                "Invitation projection missing for " + event.streamId() + " while applying " + type.wireName());
        }

        InvitationView current = existing.orElse(null);
        EventData data = event.data();
        long version = event.streamVersion();

        InvitationView next = switch (type) {
            case USER_INVITED -> new InvitationView(
                event.streamId(),
                data.uuid("org_id"),
                data.text("email"),
                data.optionalText("first_name").orElse(null),
                data.optionalText("last_name").orElse(null),
                data.textList("roles"),
                data.text("token"),
                data.instant("expires_at"),
                InvitationStatus.PENDING,
                null, null, null, null,
                event.createdAt(),
                version);
            case EMAIL_SENT -> current.withEmailSent(data.instant("sent_at"), version);
            case REVOKED -> current.withStatus(InvitationStatus.REVOKED, data.instant("revoked_at"),
                data.optionalText("reason").orElse(null), version);
            case ACCEPTED -> current.withStatus(InvitationStatus.ACCEPTED, data.instant("accepted_at"), null, version);
            case EXPIRED -> current.withStatus(InvitationStatus.EXPIRED, data.instant("expired_at"), null, version);
        };
        store.saveInvitation(next);
    }
}
