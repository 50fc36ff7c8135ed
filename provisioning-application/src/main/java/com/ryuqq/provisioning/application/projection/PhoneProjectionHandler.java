package com.ryuqq.provisioning.application.projection;

import com.ryuqq.provisioning.core.event.DomainEvent;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.event.PhoneEventType;
import com.ryuqq.provisioning.core.projection.PhoneView;
import com.ryuqq.provisioning.core.spi.ProjectionStore;

import java.util.Optional;

public final class PhoneProjectionHandler implements ProjectionHandler<PhoneEventType> {

    private final ProjectionStore store;

    public PhoneProjectionHandler(ProjectionStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public void apply(DomainEvent event, PhoneEventType type) {
        Optional<PhoneView> existing = store.findPhone(event.streamId());
        EventData data = event.data();
        switch (type) {
            case CREATED -> {
                if (existing.isEmpty()) {
                    store.savePhone(new PhoneView(
                        event.streamId(),
                        data.uuid("organization_id"),
                        data.optionalText("label").orElse(null),
                        data.text("number"),
                        data.optionalText("type").orElse(null),
                        event.createdAt(),
                        null));
                }
            }
            case DELETED -> {
                PhoneView current = existing.orElseThrow(() -> new IllegalStateException(
                    "Phone projection missing for " + event.streamId() + " while applying " + type.wireName()));
                if (!current.isDeleted()) {
                    store.savePhone(current.deleted(event.createdAt()));
                }
            }
        }
    }
}
