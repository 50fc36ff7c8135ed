package com.ryuqq.provisioning.application.projection;

import com.ryuqq.provisioning.core.event.BootstrapEventType;
import com.ryuqq.provisioning.core.event.DomainEvent;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.projection.BootstrapView;
import com.ryuqq.provisioning.core.spi.ProjectionStore;

import java.util.Optional;

/**
 * bootstrap 스트림 핸들러 (감사/조회용 saga 요약).
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class BootstrapProjectionHandler implements ProjectionHandler<BootstrapEventType> {

    private final ProjectionStore store;

    public BootstrapProjectionHandler(ProjectionStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public void apply(DomainEvent event, BootstrapEventType type) {
        Optional<BootstrapView> existing = store.findBootstrap(event.streamId());
        if (existing.isEmpty() && type != BootstrapEventType.INITIATED) {
            throw new IllegalStateException(
                "Bootstrap projection missing for " + event.streamId() + " while applying " + type.wireName());
        }
        EventData data = event.data();

        BootstrapView next = switch (type) {
            case INITIATED -> existing.orElseGet(() -> new BootstrapView(
                event.streamId(), data.uuid("org_id"), BootstrapView.Status.INITIATED,
                null, null, false, event.createdAt(), null));
            case COMPLETED -> existing.get().withStatus(BootstrapView.Status.COMPLETED, event.createdAt());
            case FAILED -> existing.get().withFailure(
                data.text("stage"), data.text("error"), data.bool("partial_cleanup_required"), event.createdAt());
            case CANCELLED -> existing.get().withStatus(BootstrapView.Status.CANCELLED, event.createdAt());
        };
        store.saveBootstrap(next);
    }
}
