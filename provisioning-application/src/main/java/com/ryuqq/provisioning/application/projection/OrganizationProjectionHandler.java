package com.ryuqq.provisioning.application.projection;

import com.ryuqq.provisioning.core.event.DomainEvent;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.event.OrganizationEventType;
import com.ryuqq.provisioning.core.projection.OrganizationView;
import com.ryuqq.provisioning.core.spi.ProjectionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * organization 스트림 핸들러.
 *
 * <p>뷰의 version이 이벤트의 stream_version 이상이면 이미 반영된 것으로 보고 건너뜁니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class OrganizationProjectionHandler implements ProjectionHandler<OrganizationEventType> {

    private static final Logger log = LoggerFactory.getLogger(OrganizationProjectionHandler.class);

    private final ProjectionStore store;

    public OrganizationProjectionHandler(ProjectionStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public void apply(DomainEvent event, OrganizationEventType type) {
        Optional<OrganizationView> existing = store.findOrganization(event.streamId());
        if (existing.isPresent() && existing.get().version() >= event.streamVersion()) {
            log.debug("Organization {} already at v{}, skipping {} v{}",
                event.streamId(), existing.get().version(), type.wireName(), event.streamVersion());
            return;
        }
        if (existing.isEmpty() && type != OrganizationEventType.CREATED) {
            throw new IllegalStateException(
                "Organization projection missing for " + event.streamId() + " while applying " + type.wireName());
        }

        OrganizationView current = existing.orElse(null);
        EventData data = event.data();
        long version = event.streamVersion();

        OrganizationView next = switch (type) {
            case CREATED -> OrganizationView.created(
                event.streamId(),
                data.text("name"),
                data.text("slug"),
                data.text("type"),
                data.text("path"),
                data.optionalUuid("bootstrap_id").orElse(null),
                data.optionalText("subdomain").orElse(null),
                event.createdAt(),
                version);
            case SUBDOMAIN_DNS_CREATED -> current.withDnsCreated(
                data.text("fqdn"), data.text("dns_record_id"), data.text("dns_zone_id"), version);
            case SUBDOMAIN_VERIFIED -> current.withVerified(
                data.text("verification_method"), data.intValue("verification_attempts"),
                data.instant("verified_at"), version);
            case SUBDOMAIN_VERIFICATION_FAILED -> current.withVerificationFailed(
                data.text("failure_reason"), data.intValue("retry_count"), version);
            case DNS_REMOVED -> current.withDnsRemoved(version);
            case ACTIVATED -> current.withActivated(data.instant("activated_at"), version);
            case DEACTIVATED -> current.withDeactivated(
                data.instant("deactivated_at"), data.optionalText("reason").orElse(null), version);
        };
        store.saveOrganization(next);
    }
}
