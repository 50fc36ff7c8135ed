package com.ryuqq.provisioning.application.activity;

import com.ryuqq.provisioning.core.event.DomainEvent;
import com.ryuqq.provisioning.core.event.DomainEventType;
import com.ryuqq.provisioning.core.event.InvitationEventType;
import com.ryuqq.provisioning.core.event.JunctionEventType;
import com.ryuqq.provisioning.core.event.StreamType;
import com.ryuqq.provisioning.core.spi.EventStore;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * 이벤트 로그 기반 멱등성 판단.
 *
 * <p>activity와 보상은 "이미 했는가"를 projection이 아닌 이 클래스로 판단합니다.
 * projection은 비동기 dispatch나 handler 실패로 뒤처질 수 있지만 이벤트 로그는 append 즉시 읽힙니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class EventHistory {

    private final EventStore eventStore;

    public EventHistory(EventStore eventStore) {
        if (eventStore == null) {
            throw new IllegalArgumentException("eventStore cannot be null");
        }
        this.eventStore = eventStore;
    }

    public boolean exists(UUID streamId, StreamType streamType) {
        return eventStore.currentVersion(streamId, streamType) > 0;
    }

    public boolean contains(UUID streamId, DomainEventType type) {
        return latest(streamId, type).isPresent();
    }

    /**
     * 스트림에서 해당 타입의 마지막 이벤트 조회.
     *
     * @param streamId 스트림 id
     * @param type 이벤트 타입 (스트림 유형 포함)
     * @return 마지막 이벤트, 없으면 empty
     */
    public Optional<DomainEvent> latest(UUID streamId, DomainEventType type) {
        List<DomainEvent> events = eventStore.readStream(streamId, type.streamType());
        for (int i = events.size() - 1; i >= 0; i--) {
            if (events.get(i).is(type)) {
                return Optional.of(events.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * {@code type}이 스트림에 기록되어 있고 그 뒤로 {@code undone}이 기록되지 않았는지 확인.
     *
     * @param streamId 스트림 id
     * @param type 확인할 이벤트 타입
     * @param undone 효과를 되돌리는 이벤트 타입 (같은 스트림)
     * @return 마지막 {@code type}이 유효하면 그 이벤트
     */
    public Optional<DomainEvent> effective(UUID streamId, DomainEventType type, DomainEventType undone) {
        Optional<DomainEvent> done = latest(streamId, type);
        if (done.isEmpty()) {
            return Optional.empty();
        }
        Optional<DomainEvent> reverted = latest(streamId, undone);
        if (reverted.isPresent() && reverted.get().streamVersion() > done.get().streamVersion()) {
            return Optional.empty();
        }
        return done;
    }

    /**
     * 조직 junction 스트림에서 한 번이라도 연결된 대상 id (연결 순서).
     *
     * @param orgId 조직 id
     * @param linked linked 이벤트 타입
     * @param field 대상 id 필드 이름
     * @return 대상 id 목록
     */
    public List<UUID> linkedTargets(UUID orgId, JunctionEventType linked, String field) {
        Set<UUID> targets = new LinkedHashSet<>();
        for (DomainEvent event : eventStore.readStream(orgId, StreamType.JUNCTION)) {
            if (event.is(linked)) {
                event.data().optionalUuid(field).ifPresent(targets::add);
            }
        }
        return new ArrayList<>(targets);
    }

    /**
     * 대상이 현재 연결 상태인지 확인 (마지막 linked가 마지막 unlinked보다 뒤).
     */
    public boolean isLinked(UUID orgId, JunctionEventType linked, JunctionEventType unlinked, String field, UUID target) {
        long lastLinked = 0;
        long lastUnlinked = 0;
        String targetId = target.toString();
        for (DomainEvent event : eventStore.readStream(orgId, StreamType.JUNCTION)) {
            if (!targetId.equals(event.data().optionalText(field).orElse(null))) {
                continue;
            }
            if (event.is(linked)) {
                lastLinked = event.streamVersion();
            } else if (event.is(unlinked)) {
                lastUnlinked = event.streamVersion();
            }
        }
        return lastLinked > lastUnlinked;
    }

    /**
     * 초대가 발급되었고 아직 수락, 철회, 만료되지 않았는지 확인.
     *
     * @param invitationId 초대 id
     * @return 대기 중이면 true
     */
    public boolean isInvitationPending(UUID invitationId) {
        List<DomainEvent> events = eventStore.readStream(invitationId, StreamType.INVITATION);
        boolean invited = false;
        for (DomainEvent event : events) {
            if (event.is(InvitationEventType.USER_INVITED)) {
                invited = true;
            } else if (event.is(InvitationEventType.ACCEPTED) || event.is(InvitationEventType.REVOKED)
                || event.is(InvitationEventType.EXPIRED)) {
                return false;
            }
        }
        return invited;
    }
}
