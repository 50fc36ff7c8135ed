package com.ryuqq.provisioning.application.activity.compensation;

import com.ryuqq.provisioning.application.activity.EventHistory;
import com.ryuqq.provisioning.application.event.EventAppender;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.event.OrganizationEventType;
import com.ryuqq.provisioning.core.event.StreamType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * 조직 비활성화 보상 (soft delete).
 *
 * <p>조직 스트림에 마지막 activated 이후 deactivated가 이미 있으면 건너뜁니다.
 * 생성되지 않은 조직은 경고로 남깁니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class DeactivateOrganizationActivity implements Compensation {

    private static final Logger log = LoggerFactory.getLogger(DeactivateOrganizationActivity.class);

    static final String NAME = "DeactivateOrganization";

    private final EventHistory history;
    private final EventAppender appender;
    private final Clock clock;

    public DeactivateOrganizationActivity(EventHistory history, EventAppender appender, Clock clock) {
        if (history == null) {
            throw new IllegalArgumentException("history cannot be null");
        }
        if (appender == null) {
            throw new IllegalArgumentException("appender cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.history = history;
        this.appender = appender;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CompensationResult compensate(CompensationContext context) {
        try {
            if (!history.exists(context.orgId(), StreamType.ORGANIZATION)) {
                return CompensationResult.failed(NAME, "Organization " + context.orgId() + " not found; nothing to deactivate");
            }
            if (history.effective(context.orgId(), OrganizationEventType.DEACTIVATED, OrganizationEventType.ACTIVATED)
                .isPresent()) {
                log.info("Organization {} already deactivated, skipping", context.orgId());
                return new CompensationResult(NAME, List.of(), List.of());
            }
            EventData data = EventData.builder()
                .put("deactivation_type", context.cancelled() ? "bootstrap_cancelled" : "bootstrap_failure")
                .put("reason", context.reason())
                .put("deactivated_at", clock.instant())
                .build();
            appender.append(context.orgId(), OrganizationEventType.DEACTIVATED, data,
                context.activityContext(NAME).metadata(context.reason()));
            return new CompensationResult(NAME, List.of("deactivated organization " + context.orgId()), List.of());
        } catch (RuntimeException e) {
            log.warn("Failed to deactivate organization {}", context.orgId(), e);
            return CompensationResult.failed(NAME, "Failed to deactivate organization: " + e.getMessage());
        }
    }
}
