package com.ryuqq.provisioning.application.activity.compensation;

import com.ryuqq.provisioning.application.activity.EventHistory;
import com.ryuqq.provisioning.application.event.EventAppender;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.event.OrganizationEventType;
import com.ryuqq.provisioning.core.saga.DnsRecordRef;
import com.ryuqq.provisioning.core.spi.DnsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 생성한 DNS 레코드를 삭제하는 보상.
 *
 * <p>provider의 삭제는 대상이 없으면 no-op이므로 재실행해도 안전합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class RemoveDnsActivity implements Compensation {

    private static final Logger log = LoggerFactory.getLogger(RemoveDnsActivity.class);

    static final String NAME = "RemoveDNS";

    private final DnsProvider dnsProvider;
    private final EventHistory history;
    private final EventAppender appender;

    public RemoveDnsActivity(DnsProvider dnsProvider, EventHistory history, EventAppender appender) {
        if (dnsProvider == null) {
            throw new IllegalArgumentException("dnsProvider cannot be null");
        }
        if (history == null) {
            throw new IllegalArgumentException("history cannot be null");
        }
        if (appender == null) {
            throw new IllegalArgumentException("appender cannot be null");
        }
        this.dnsProvider = dnsProvider;
        this.history = history;
        this.appender = appender;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CompensationResult compensate(CompensationContext context) {
        DnsRecordRef record = context.dnsRecord();
        if (record == null) {
            return new CompensationResult(NAME, List.of(), List.of());
        }
        try {
            dnsProvider.deleteRecord(record.zoneId(), record.recordId());

            boolean alreadyRecorded = history.effective(context.orgId(), OrganizationEventType.DNS_REMOVED,
                OrganizationEventType.SUBDOMAIN_DNS_CREATED).isPresent();
            if (!alreadyRecorded) {
                EventData data = EventData.builder()
                    .put("fqdn", record.fqdn())
                    .put("dns_record_id", record.recordId())
                    .put("dns_zone_id", record.zoneId())
                    .put("reason", context.reason())
                    .build();
                appender.append(context.orgId(), OrganizationEventType.DNS_REMOVED, data,
                    context.activityContext(NAME).metadata(context.reason()));
            }
            log.info("Removed DNS record {} for {}", record.recordId(), record.fqdn());
            return new CompensationResult(NAME, List.of("removed DNS record for " + record.fqdn()), List.of());
        } catch (RuntimeException e) {
            log.warn("Failed to remove DNS record {} for {}", record.recordId(), record.fqdn(), e);
            return CompensationResult.failed(NAME,
                "Failed to remove DNS record for " + record.fqdn() + ": " + e.getMessage());
        }
    }
}
