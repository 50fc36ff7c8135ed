package com.ryuqq.provisioning.application.event;

import com.ryuqq.provisioning.application.projection.ProjectionRouter;
import com.ryuqq.provisioning.core.event.DomainEvent;
import com.ryuqq.provisioning.core.event.DomainEventType;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.event.EventMetadata;
import com.ryuqq.provisioning.core.event.EventTypes;
import com.ryuqq.provisioning.core.event.NewEvent;
import com.ryuqq.provisioning.core.event.ProcessingState;
import com.ryuqq.provisioning.core.exception.UnhandledEventTypeException;
import com.ryuqq.provisioning.core.spi.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;

/**
 * 이벤트 발행 공통 경로.
 *
 * <p>activity와 orchestrator는 이벤트 로그에 직접 쓰지 않고 항상 이 클래스를 통해 append합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. (stream_type, event_type)이 닫힌 카탈로그에 속하는지 검증
 * 2. currentVersion + 1로 다음 버전 계산
 * 3. append (버전 충돌 시 ConcurrencyConflictException 전파)
 * 4. SYNCHRONOUS 모드면 같은 스트림의 앞선 미처리 이벤트부터 순서대로 route
 * </pre>
 *
 * <p>projection 실패는 append 실패가 아닙니다. route 중 발생한 오류는 로그만 남기고,
 * 이벤트는 미처리 상태로 남아 catch-up dispatcher가 재시도합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class EventAppender {

    private static final Logger log = LoggerFactory.getLogger(EventAppender.class);

    private final EventStore eventStore;
    private final ProjectionRouter router;
    private final DispatchMode dispatchMode;

    /**
     * 생성자.
     *
     * @param eventStore 이벤트 로그
     * @param router projection router
     * @param dispatchMode projection 반영 방식
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public EventAppender(EventStore eventStore, ProjectionRouter router, DispatchMode dispatchMode) {
        if (eventStore == null) {
            throw new IllegalArgumentException("eventStore cannot be null");
        }
        if (router == null) {
            throw new IllegalArgumentException("router cannot be null");
        }
        if (dispatchMode == null) {
            throw new IllegalArgumentException("dispatchMode cannot be null");
        }
        this.eventStore = eventStore;
        this.router = router;
        this.dispatchMode = dispatchMode;
    }

    /**
     * 이벤트 append.
     *
     * @param streamId 스트림 id
     * @param type 이벤트 타입 (스트림 유형 포함)
     * @param data event_data
     * @param metadata event_metadata
     * @return 저장된 이벤트
     * @throws UnhandledEventTypeException 카탈로그에 없는 이벤트 타입인 경우
     * @throws com.ryuqq.provisioning.core.exception.ConcurrencyConflictException 버전 충돌 시
     */
    public DomainEvent append(UUID streamId, DomainEventType type, EventData data, EventMetadata metadata) {
        // 1. 카탈로그 검증
        if (!EventTypes.isClaimed(type.streamType(), type.wireName())) {
            throw new UnhandledEventTypeException(type.streamType().wireName(), type.wireName());
        }

        // 2. 다음 버전 계산
        long nextVersion = eventStore.currentVersion(streamId, type.streamType()) + 1;

        // 3. append
        DomainEvent event = eventStore.append(NewEvent.of(streamId, nextVersion, type, data, metadata));
        log.debug("Appended {} to {}:{} v{} (seq {})",
            event.eventType(), event.streamType().wireName(), streamId, nextVersion, event.sequence());

        // 4. projection
        if (dispatchMode == DispatchMode.SYNCHRONOUS) {
            routeInStreamOrder(event);
        }
        return event;
    }

    public DispatchMode getDispatchMode() {
        return dispatchMode;
    }

    /**
     * 같은 스트림에 앞선 미처리 이벤트가 있으면 먼저 반영하고,
     * 그중 하나라도 실패하면 새 이벤트는 미처리로 남겨 스트림 순서를 지킵니다.
     */
    private void routeInStreamOrder(DomainEvent event) {
        try {
            List<DomainEvent> stream = eventStore.readStream(event.streamId(), event.streamType());
            for (DomainEvent earlier : stream) {
                if (earlier.streamVersion() >= event.streamVersion() || earlier.processingState().isProcessed()) {
                    continue;
                }
                ProcessingState state = router.route(earlier);
                if (!state.isProcessed()) {
                    log.warn("Deferring projection of {} (v{}): earlier event v{} on {}:{} is still unprocessed",
                        event.eventType(), event.streamVersion(), earlier.streamVersion(),
                        event.streamType().wireName(), event.streamId());
                    return;
                }
            }
            router.route(event);
        } catch (RuntimeException e) {
            log.error("Synchronous projection of event {} failed; left for catch-up", event.id(), e);
        }
    }
}
