package com.ryuqq.provisioning.application.activity;

import com.ryuqq.provisioning.application.event.EventAppender;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.event.OrganizationEventType;
import com.ryuqq.provisioning.core.event.StreamType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.UUID;

/**
 * 조직 활성화 activity. 조직 스트림상 이미 활성 상태면 아무것도 하지 않습니다.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class ActivateOrganizationActivity {

    private static final Logger log = LoggerFactory.getLogger(ActivateOrganizationActivity.class);

    private final EventHistory history;
    private final EventAppender appender;
    private final Clock clock;

    public ActivateOrganizationActivity(EventHistory history, EventAppender appender, Clock clock) {
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

    /**
     * @return 이번 호출에서 활성화했으면 true
     * @throws IllegalStateException 조직 스트림이 없는 경우 (재시도 대상)
     */
    public boolean execute(UUID orgId, ActivityContext context) {
        if (!history.exists(orgId, StreamType.ORGANIZATION)) {
            throw new IllegalStateException("Organization not found: " + orgId);
        }
        if (history.effective(orgId, OrganizationEventType.ACTIVATED, OrganizationEventType.DEACTIVATED).isPresent()) {
            log.info("Organization {} already active, skipping", orgId);
            return false;
        }
        EventData data = EventData.builder()
            .put("activated_at", clock.instant())
            .put("bootstrap_id", context.bootstrapId().getValue())
            .build();
        appender.append(orgId, OrganizationEventType.ACTIVATED, data, context.metadata("Bootstrap completed"));
        log.info("Organization {} activated", orgId);
        return true;
    }
}
