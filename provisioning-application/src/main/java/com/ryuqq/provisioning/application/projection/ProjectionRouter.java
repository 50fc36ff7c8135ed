package com.ryuqq.provisioning.application.projection;

import com.ryuqq.provisioning.core.event.AddressEventType;
import com.ryuqq.provisioning.core.event.BootstrapEventType;
import com.ryuqq.provisioning.core.event.ContactEventType;
import com.ryuqq.provisioning.core.event.DomainEvent;
import com.ryuqq.provisioning.core.event.DomainEventType;
import com.ryuqq.provisioning.core.event.InvitationEventType;
import com.ryuqq.provisioning.core.event.JunctionEventType;
import com.ryuqq.provisioning.core.event.OrganizationEventType;
import com.ryuqq.provisioning.core.event.PhoneEventType;
import com.ryuqq.provisioning.core.event.ProcessingState;
import com.ryuqq.provisioning.core.exception.UnhandledEventTypeException;
import com.ryuqq.provisioning.core.spi.EventStore;
import com.ryuqq.provisioning.core.spi.ProjectionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * 이벤트를 (stream_type, event_type)에 따라 projection 핸들러로 라우팅.
 *
 * <p><strong>라우팅 규칙:</strong></p>
 * <ol>
 *   <li>{@code organization.<kind>.linked|unlinked} 이름 규칙 → junction 핸들러 (스트림 유형 무관)</li>
 *   <li>그 외에는 stream_type별 핸들러</li>
 *   <li>카탈로그에 없는 조합 → {@link UnhandledEventTypeException} (조용히 무시하지 않음)</li>
 * </ol>
 *
 * <p><strong>처리 상태 기록 ({@link #route}):</strong></p>
 * <ul>
 *   <li>성공: processed_at 기록</li>
 *   <li>핸들러 실패: processing_error = "메시지 | Detail: 예외 클래스", retry_count 증가. 예외는 전파하지 않음</li>
 *   <li>미등록 타입: 실패 기록 후 ERROR 로그와 함께 예외 전파</li>
 * </ul>
 *
 * <p>핸들러 매핑은 닫혀 있습니다. 새 이벤트 타입은 카탈로그 enum과 이 클래스를 함께 고쳐야 합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class ProjectionRouter {

    private static final Logger log = LoggerFactory.getLogger(ProjectionRouter.class);

    private final EventStore eventStore;
    private final RouterConfig config;
    private final Clock clock;

    private final OrganizationProjectionHandler organizationHandler;
    private final InvitationProjectionHandler invitationHandler;
    private final ContactProjectionHandler contactHandler;
    private final AddressProjectionHandler addressHandler;
    private final PhoneProjectionHandler phoneHandler;
    private final JunctionProjectionHandler junctionHandler;
    private final BootstrapProjectionHandler bootstrapHandler;

    /**
     * 생성자.
     *
     * @param eventStore 처리 상태를 기록할 이벤트 로그
     * @param projectionStore 읽기 모델 저장소
     * @param config router 설정
     * @param clock processed_at 기록용 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ProjectionRouter(EventStore eventStore, ProjectionStore projectionStore, RouterConfig config, Clock clock) {
        if (eventStore == null) {
            throw new IllegalArgumentException("eventStore cannot be null");
        }
        if (projectionStore == null) {
            throw new IllegalArgumentException("projectionStore cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.eventStore = eventStore;
        this.config = config;
        this.clock = clock;
        this.organizationHandler = new OrganizationProjectionHandler(projectionStore);
        this.invitationHandler = new InvitationProjectionHandler(projectionStore);
        this.contactHandler = new ContactProjectionHandler(projectionStore);
        this.addressHandler = new AddressProjectionHandler(projectionStore);
        this.phoneHandler = new PhoneProjectionHandler(projectionStore);
        this.junctionHandler = new JunctionProjectionHandler(projectionStore);
        this.bootstrapHandler = new BootstrapProjectionHandler(projectionStore);
    }

    /**
     * 이벤트를 반영하고 처리 상태를 기록.
     *
     * <p>이미 processed로 기록된 이벤트는 다시 적용하지 않습니다.</p>
     *
     * @param event 저장된 이벤트
     * @return 기록된 처리 상태
     * @throws UnhandledEventTypeException 라우팅할 핸들러가 없는 경우
     * @throws IllegalArgumentException 이벤트 로그에 없는 이벤트인 경우
     */
    public ProcessingState route(DomainEvent event) {
        // 1. 최신 처리 상태 확인
        DomainEvent current = eventStore.findById(event.id())
            .orElseThrow(() -> new IllegalArgumentException("Event not found in log: " + event.id()));
        if (current.processingState().isProcessed()) {
            log.debug("Event {} already processed, skipping", current.id());
            return current.processingState();
        }

        // 2. 핸들러 실행
        long startNanos = System.nanoTime();
        try {
            dispatch(current);
            Instant processedAt = clock.instant();
            eventStore.markProcessed(current.id(), processedAt);
            return new ProcessingState.Processed(processedAt);

        } catch (UnhandledEventTypeException e) {
            eventStore.markFailed(current.id(), describe(e));
            log.error("No projection handler for event_type={} on stream_type={} (event {})",
                e.getEventType(), e.getStreamType(), current.id());
            throw e;

        } catch (RuntimeException e) {
            // 3. 실패 기록 (이벤트 자체는 유효, 이후 재시도)
            ProcessingState.Failed failed = eventStore.markFailed(current.id(), describe(e));
            log.warn("Projection failed for {} on {}:{} v{} (retry_count={}): {}",
                current.eventType(), current.streamType().wireName(), current.streamId(),
                current.streamVersion(), failed.retryCount(), e.getMessage(), e);
            return failed;

        } finally {
            long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000L;
            if (elapsedMs > config.slowHandlerThresholdMs()) {
                log.warn("Slow projection handler: {} on {} took {}ms (threshold {}ms)",
                    current.eventType(), current.streamId(), elapsedMs, config.slowHandlerThresholdMs());
            }
        }
    }

    /**
     * 처리 상태 기록 없이 핸들러만 실행 (rebuild 재생용).
     *
     * @param event 적용할 이벤트
     * @throws UnhandledEventTypeException 라우팅할 핸들러가 없는 경우
     */
    public void dispatch(DomainEvent event) {
        if (JunctionEventType.matchesNamingConvention(event.eventType())) {
            junctionHandler.apply(event, resolve(JunctionEventType.fromWireName(event.eventType()), event));
            return;
        }

        Runnable application = switch (event.streamType()) {
            case ORGANIZATION -> {
                OrganizationEventType type = resolve(OrganizationEventType.fromWireName(event.eventType()), event);
                yield () -> organizationHandler.apply(event, type);
            }
            case INVITATION -> {
                InvitationEventType type = resolve(InvitationEventType.fromWireName(event.eventType()), event);
                yield () -> invitationHandler.apply(event, type);
            }
            case CONTACT -> {
                ContactEventType type = resolve(ContactEventType.fromWireName(event.eventType()), event);
                yield () -> contactHandler.apply(event, type);
            }
            case ADDRESS -> {
                AddressEventType type = resolve(AddressEventType.fromWireName(event.eventType()), event);
                yield () -> addressHandler.apply(event, type);
            }
            case PHONE -> {
                PhoneEventType type = resolve(PhoneEventType.fromWireName(event.eventType()), event);
                yield () -> phoneHandler.apply(event, type);
            }
            case JUNCTION -> throw unhandled(event);
            case BOOTSTRAP -> {
                BootstrapEventType type = resolve(BootstrapEventType.fromWireName(event.eventType()), event);
                yield () -> bootstrapHandler.apply(event, type);
            }
        };
        application.run();
    }

    private String describe(RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        if (!config.detailedErrors()) {
            return message;
        }
        return message + " | Detail: " + e.getClass().getName();
    }

    private static <T extends DomainEventType> T resolve(Optional<T> type, DomainEvent event) {
        return type.orElseThrow(() -> unhandled(event));
    }

    private static UnhandledEventTypeException unhandled(DomainEvent event) {
        return new UnhandledEventTypeException(event.streamType().wireName(), event.eventType());
    }
}
