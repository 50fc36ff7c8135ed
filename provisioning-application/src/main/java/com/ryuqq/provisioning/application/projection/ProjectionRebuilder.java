package com.ryuqq.provisioning.application.projection;

import com.ryuqq.provisioning.core.event.DomainEvent;
import com.ryuqq.provisioning.core.spi.EventStore;
import com.ryuqq.provisioning.core.spi.ProjectionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 이벤트 로그 전체를 sequence 순으로 재생하여 projection을 다시 만듭니다.
 *
 * <p>projection은 이벤트 로그에서 파생된 데이터이므로 언제든 버리고 재구성할 수 있습니다.
 * 재생은 처리 상태를 건드리지 않습니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class ProjectionRebuilder {

    private static final Logger log = LoggerFactory.getLogger(ProjectionRebuilder.class);

    private final EventStore eventStore;
    private final ProjectionStore projectionStore;
    private final ProjectionRouter router;
    private final int pageSize;

    public ProjectionRebuilder(EventStore eventStore, ProjectionStore projectionStore, ProjectionRouter router, int pageSize) {
        if (eventStore == null) {
            throw new IllegalArgumentException("eventStore cannot be null");
        }
        if (projectionStore == null) {
            throw new IllegalArgumentException("projectionStore cannot be null");
        }
        if (router == null) {
            throw new IllegalArgumentException("router cannot be null");
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive (current: " + pageSize + ")");
        }
        this.eventStore = eventStore;
        this.projectionStore = projectionStore;
        this.router = router;
        this.pageSize = pageSize;
    }

    /**
     * projection 초기화 후 전체 재생.
     *
     * <p>개별 이벤트 반영 실패는 건너뛰고 집계합니다.</p>
     *
     * @return 재생 결과
     */
    public RebuildReport rebuild() {
        log.info("Projection rebuild started");
        projectionStore.clear();

        long afterSequence = 0L;
        int replayed = 0;
        int failed = 0;
        while (true) {
            List<DomainEvent> page = eventStore.readAll(afterSequence, pageSize);
            if (page.isEmpty()) {
                break;
            }
            for (DomainEvent event : page) {
                try {
                    router.dispatch(event);
                    replayed++;
                } catch (RuntimeException e) {
                    failed++;
                    log.error("Failed to replay event {} ({} seq {})", event.id(), event.eventType(), event.sequence(), e);
                }
                afterSequence = event.sequence();
            }
        }

        log.info("Projection rebuild completed: {} replayed, {} failed", replayed, failed);
        return new RebuildReport(replayed, failed, afterSequence);
    }

    /**
     * @param replayed 반영된 이벤트 수
     * @param failed 반영 실패 이벤트 수
     * @param lastSequence 마지막으로 읽은 sequence
     */
    public record RebuildReport(int replayed, int failed, long lastSequence) {
    }
}
