package com.ryuqq.provisioning.application.projection;

import com.ryuqq.provisioning.core.event.ContactEventType;
import com.ryuqq.provisioning.core.event.DomainEvent;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.projection.ContactView;
import com.ryuqq.provisioning.core.spi.ProjectionStore;

import java.util.Optional;

/**
 * contact 스트림 핸들러.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class ContactProjectionHandler implements ProjectionHandler<ContactEventType> {

    private final ProjectionStore store;

    public ContactProjectionHandler(ProjectionStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public void apply(DomainEvent event, ContactEventType type) {
        Optional<ContactView> existing = store.findContact(event.streamId());
        EventData data = event.data();
        switch (type) {
            case CREATED -> {
                if (existing.isEmpty()) {
                    store.saveContact(new ContactView(
                        event.streamId(),
                        data.uuid("organization_id"),
                        data.optionalText("label").orElse(null),
                        data.optionalText("first_name").orElse(null),
                        data.optionalText("last_name").orElse(null),
                        data.text("email"),
                        data.optionalText("title").orElse(null),
                        event.createdAt(),
                        null));
                }
            }
            case DELETED -> {
                ContactView current = existing.orElseThrow(() -> new IllegalStateException(
                    "Contact projection missing for " + event.streamId() + " while applying " + type.wireName()));
                if (!current.isDeleted()) {
                    store.saveContact(current.deleted(event.createdAt()));
                }
            }
        }
    }
}
