package com.ryuqq.provisioning.application.activity.compensation;

import com.ryuqq.provisioning.application.activity.EventHistory;
import com.ryuqq.provisioning.application.event.EventAppender;
import com.ryuqq.provisioning.core.event.AddressEventType;
import com.ryuqq.provisioning.core.event.ContactEventType;
import com.ryuqq.provisioning.core.event.DomainEventType;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.event.JunctionEventType;
import com.ryuqq.provisioning.core.event.PhoneEventType;
import com.ryuqq.provisioning.core.event.StreamType;
import com.ryuqq.provisioning.core.projection.LinkKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 조직의 연락처 정보(전화번호, 주소, 연락처 중 한 종류)를 삭제하는 보상.
 *
 * <p>대상은 조직 junction 스트림에 linked로 기록된 id입니다. 대상마다 아직 연결 상태면
 * unlinked 이벤트를, 아직 삭제되지 않았으면 *.deleted를 기록합니다. 두 기록 사이에서 중단되어도
 * 재실행 시 남은 쪽만 기록됩니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class DeleteContactInfoActivity implements Compensation {

    private static final Logger log = LoggerFactory.getLogger(DeleteContactInfoActivity.class);

    private final LinkKind kind;
    private final EventHistory history;
    private final EventAppender appender;
    private final Clock clock;

    public DeleteContactInfoActivity(LinkKind kind, EventHistory history, EventAppender appender, Clock clock) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (history == null) {
            throw new IllegalArgumentException("history cannot be null");
        }
        if (appender == null) {
            throw new IllegalArgumentException("appender cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.kind = kind;
        this.history = history;
        this.appender = appender;
        this.clock = clock;
    }

    @Override
    public String name() {
        return switch (kind) {
            case PHONE -> "DeletePhones";
            case ADDRESS -> "DeleteAddresses";
            case CONTACT -> "DeleteContacts";
        };
    }

    @Override
    public CompensationResult compensate(CompensationContext context) {
        List<String> actions = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        List<UUID> targets;
        try {
            targets = history.linkedTargets(context.orgId(), linkType(), idField());
        } catch (RuntimeException e) {
            log.warn("Failed to load {} targets for organization {}", kind, context.orgId(), e);
            return CompensationResult.failed(name(), "Failed to load " + label() + "s: " + e.getMessage());
        }

        for (UUID targetId : targets) {
            try {
                boolean changed = false;
                if (history.isLinked(context.orgId(), linkType(), unlinkType(), idField(), targetId)) {
                    appender.append(context.orgId(), unlinkType(),
                        EventData.builder()
                            .put("organization_id", context.orgId())
                            .put(idField(), targetId)
                            .build(),
                        context.activityContext(name()).metadata(context.reason()));
                    changed = true;
                }
                if (history.exists(targetId, streamType()) && !history.contains(targetId, deletedType())) {
                    appender.append(targetId, deletedType(),
                        EventData.builder()
                            .put("organization_id", context.orgId())
                            .put("reason", context.reason())
                            .put("deleted_at", clock.instant())
                            .build(),
                        context.activityContext(name()).metadata(context.reason()));
                    changed = true;
                }
                if (changed) {
                    actions.add("deleted " + label() + " " + targetId);
                }
            } catch (RuntimeException e) {
                log.warn("Failed to delete {} {}", label(), targetId, e);
                warnings.add("Failed to delete " + label() + " " + targetId + ": " + e.getMessage());
            }
        }
        return new CompensationResult(name(), actions, warnings);
    }

    private DomainEventType deletedType() {
        return switch (kind) {
            case PHONE -> PhoneEventType.DELETED;
            case ADDRESS -> AddressEventType.DELETED;
            case CONTACT -> ContactEventType.DELETED;
        };
    }

    private StreamType streamType() {
        return switch (kind) {
            case PHONE -> StreamType.PHONE;
            case ADDRESS -> StreamType.ADDRESS;
            case CONTACT -> StreamType.CONTACT;
        };
    }

    private JunctionEventType linkType() {
        return switch (kind) {
            case PHONE -> JunctionEventType.ORGANIZATION_PHONE_LINKED;
            case ADDRESS -> JunctionEventType.ORGANIZATION_ADDRESS_LINKED;
            case CONTACT -> JunctionEventType.ORGANIZATION_CONTACT_LINKED;
        };
    }

    private JunctionEventType unlinkType() {
        return switch (kind) {
            case PHONE -> JunctionEventType.ORGANIZATION_PHONE_UNLINKED;
            case ADDRESS -> JunctionEventType.ORGANIZATION_ADDRESS_UNLINKED;
            case CONTACT -> JunctionEventType.ORGANIZATION_CONTACT_UNLINKED;
        };
    }

    private String idField() {
        return label() + "_id";
    }

    private String label() {
        return switch (kind) {
            case PHONE -> "phone";
            case ADDRESS -> "address";
            case CONTACT -> "contact";
        };
    }
}
