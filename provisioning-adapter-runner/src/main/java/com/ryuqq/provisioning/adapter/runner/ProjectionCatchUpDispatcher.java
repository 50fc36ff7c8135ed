package com.ryuqq.provisioning.adapter.runner;

import com.ryuqq.provisioning.application.projection.ProjectionRouter;
import com.ryuqq.provisioning.core.event.DomainEvent;
import com.ryuqq.provisioning.core.event.ProcessingState;
import com.ryuqq.provisioning.core.exception.UnhandledEventTypeException;
import com.ryuqq.provisioning.core.spi.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 미처리 이벤트를 projection에 반영하는 catch-up 컴포넌트.
 *
 * <p>ASYNCHRONOUS dispatch 모드의 기본 경로이며, SYNCHRONOUS 모드에서는 실패했던 이벤트의 재시도 경로입니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. scanUnprocessed(cursor, batchSize) → sequence 오름차순, cursor는 마지막으로 본 sequence
 * 2. For each event:
 *    a. 같은 스트림의 앞선 이벤트가 이번 pump에서 막혔으면 건너뜀 (스트림 순서 유지)
 *    b. retry_count >= maxRetries → dead로 보고 건너뜀 (운영자 개입 대상)
 *    c. router.route(event) → Processed가 아니면 해당 스트림을 막음
 * 3. route 시도가 batchSize에 닿거나 더 이상 미처리 이벤트가 없을 때까지 1-2 반복
 * 4. 처리/실패/dead 카운트 로깅
 * </pre>
 *
 * <p>건너뛴 이벤트는 route 시도 수에 포함되지 않으므로, dead 이벤트나 막힌 스트림이 batchSize보다
 * 많이 쌓여도 그 뒤의 정상 이벤트는 계속 반영됩니다.</p>
 *
 * <p>pump()는 주기적으로 호출되어야 합니다. 여러 인스턴스가 동시에 실행되어도
 * router가 이미 처리된 이벤트를 건너뛰므로 안전합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class ProjectionCatchUpDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ProjectionCatchUpDispatcher.class);

    private final EventStore eventStore;
    private final ProjectionRouter router;
    private final CatchUpConfig config;

    /**
     * 생성자.
     *
     * @param eventStore 이벤트 로그
     * @param router projection router
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ProjectionCatchUpDispatcher(EventStore eventStore, ProjectionRouter router, CatchUpConfig config) {
        if (eventStore == null) {
            throw new IllegalArgumentException("eventStore cannot be null");
        }
        if (router == null) {
            throw new IllegalArgumentException("router cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.eventStore = eventStore;
        this.router = router;
        this.config = config;
    }

    /**
     * 미처리 이벤트 한 배치 반영.
     *
     * @return 이번 호출에서 processed로 기록된 이벤트 수
     */
    public int pump() {
        Set<String> blockedStreams = new HashSet<>();
        long cursor = 0L;
        int attempted = 0;
        int scanned = 0;
        int processed = 0;
        int failed = 0;
        int dead = 0;

        while (attempted < config.batchSize()) {
            // 1. 커서 이후 미처리 이벤트 스캔
            List<DomainEvent> page = eventStore.scanUnprocessed(cursor, config.batchSize());
            if (page.isEmpty()) {
                break;
            }

            // 2. 스트림 순서대로 반영
            for (DomainEvent event : page) {
                if (attempted >= config.batchSize()) {
                    break;
                }
                cursor = event.sequence();
                scanned++;
                String stream = event.streamType().wireName() + ":" + event.streamId();
                if (blockedStreams.contains(stream)) {
                    continue;
                }
                if (event.processingState().retryCount() >= config.maxRetries()) {
                    log.error("Event {} ({} v{} on {}) exceeded {} projection attempts, needs operator attention: {}",
                        event.id(), event.eventType(), event.streamVersion(), stream, config.maxRetries(),
                        errorOf(event.processingState()));
                    blockedStreams.add(stream);
                    dead++;
                    continue;
                }
                attempted++;
                if (tryRoute(event)) {
                    processed++;
                } else {
                    blockedStreams.add(stream);
                    failed++;
                }
            }
        }

        // 3. 결과 로깅
        if (scanned > 0) {
            log.info("Projection catch-up completed: {} processed, {} failed, {} dead out of {} scanned",
                processed, failed, dead, scanned);
        }
        return processed;
    }

    /**
     * 개별 이벤트 반영 시도. 예외가 나도 다른 스트림 처리를 막지 않습니다.
     */
    private boolean tryRoute(DomainEvent event) {
        try {
            return router.route(event).isProcessed();
        } catch (UnhandledEventTypeException e) {
            // router가 이미 ERROR로 기록함
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to route event {} during catch-up", event.id(), e);
            return false;
        }
    }

    private static String errorOf(ProcessingState state) {
        return state instanceof ProcessingState.Failed failed ? failed.error() : "unknown";
    }
}
