package com.ryuqq.provisioning.application.projection;

import com.ryuqq.provisioning.core.event.AddressEventType;
import com.ryuqq.provisioning.core.event.DomainEvent;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.projection.AddressView;
import com.ryuqq.provisioning.core.spi.ProjectionStore;

import java.util.Optional;

public final class AddressProjectionHandler implements ProjectionHandler<AddressEventType> {

    private final ProjectionStore store;

    public AddressProjectionHandler(ProjectionStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public void apply(DomainEvent event, AddressEventType type) {
        Optional<AddressView> existing = store.findAddress(event.streamId());
        EventData data = event.data();
        switch (type) {
            case CREATED -> {
                if (existing.isEmpty()) {
                    store.saveAddress(new AddressView(
                        event.streamId(),
                        data.uuid("organization_id"),
                        data.optionalText("label").orElse(null),
                        data.text("street1"),
                        data.optionalText("street2").orElse(null),
                        data.text("city"),
                        data.optionalText("state").orElse(null),
                        data.optionalText("zip_code").orElse(null),
                        data.optionalText("country").orElse(null),
                        event.createdAt(),
                        null));
                }
            }
            case DELETED -> {
                AddressView current = existing.orElseThrow(() -> new IllegalStateException(
                    "Address projection missing for " + event.streamId() + " while applying " + type.wireName()));
                if (!current.isDeleted()) {
                    store.saveAddress(current.deleted(event.createdAt()));
                }
            }
        }
    }
}
