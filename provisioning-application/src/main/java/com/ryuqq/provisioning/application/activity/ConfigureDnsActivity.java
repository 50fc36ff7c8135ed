package com.ryuqq.provisioning.application.activity;

import com.ryuqq.provisioning.application.config.ProvisioningConfig;
import com.ryuqq.provisioning.application.event.EventAppender;
import com.ryuqq.provisioning.core.dns.DnsRecord;
import com.ryuqq.provisioning.core.dns.DnsRecordFilter;
import com.ryuqq.provisioning.core.dns.DnsRecordSpec;
import com.ryuqq.provisioning.core.dns.DnsZone;
import com.ryuqq.provisioning.core.event.DomainEvent;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.event.OrganizationEventType;
import com.ryuqq.provisioning.core.exception.PermanentValidationException;
import com.ryuqq.provisioning.core.saga.DnsRecordRef;
import com.ryuqq.provisioning.core.spi.DnsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 조직 서브도메인 CNAME 레코드 생성 activity.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 서브도메인 형식 검증 (DNS label, 소문자)
 * 2. 이미 dns_created가 기록되어 있으면 그대로 반환
 * 3. 상위 도메인 zone 조회 (없으면 영구 실패)
 * 4. 같은 이름의 CNAME이 있으면 재사용, 없으면 생성
 * 5. organization.subdomain.dns_created 발행
 * </pre>
 *
 * <p>provider 오류는 {@link com.ryuqq.provisioning.core.exception.TransientProviderException}으로 전파됩니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class ConfigureDnsActivity {

    private static final Logger log = LoggerFactory.getLogger(ConfigureDnsActivity.class);

    static final Pattern SUBDOMAIN_PATTERN = Pattern.compile("^[a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?$");
    static final String RECORD_TYPE = "CNAME";

    private final DnsProvider dnsProvider;
    private final EventHistory history;
    private final EventAppender appender;
    private final ProvisioningConfig config;

    public ConfigureDnsActivity(DnsProvider dnsProvider, EventHistory history, EventAppender appender,
                                ProvisioningConfig config) {
        if (dnsProvider == null) {
            throw new IllegalArgumentException("dnsProvider cannot be null");
        }
        if (history == null) {
            throw new IllegalArgumentException("history cannot be null");
        }
        if (appender == null) {
            throw new IllegalArgumentException("appender cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.dnsProvider = dnsProvider;
        this.history = history;
        this.appender = appender;
        this.config = config;
    }

    /**
     * DNS 레코드 구성.
     *
     * @param orgId 조직 id
     * @param subdomain 요청 서브도메인
     * @param context 실행 컨텍스트
     * @return 레코드 참조
     * @throws PermanentValidationException 서브도메인 형식 오류, zone 없음, 다른 대상을 가리키는 기존 레코드
     */
    public DnsRecordRef execute(UUID orgId, String subdomain, ActivityContext context) {
        // 1. 형식 검증
        if (!isValidSubdomain(subdomain)) {
            throw new PermanentValidationException("Invalid subdomain '" + subdomain
                + "': must be a lowercase DNS label of 1-63 letters, digits or hyphens");
        }
        String fqdn = config.fqdnFor(subdomain);

        // 2. 이미 기록된 경우
        Optional<DomainEvent> recorded = history.effective(orgId, OrganizationEventType.SUBDOMAIN_DNS_CREATED,
            OrganizationEventType.DNS_REMOVED);
        if (recorded.isPresent() && fqdn.equals(recorded.get().data().optionalText("fqdn").orElse(null))) {
            String recordId = recorded.get().data().text("dns_record_id");
            log.info("DNS record for {} already recorded ({}), skipping", fqdn, recordId);
            return new DnsRecordRef(recordId, recorded.get().data().text("dns_zone_id"), fqdn);
        }

        // 3. zone 조회
        List<DnsZone> zones = dnsProvider.listZones(config.platformBaseDomain());
        if (zones.isEmpty()) {
            throw new PermanentValidationException("No DNS zone found for " + config.platformBaseDomain());
        }
        DnsZone zone = zones.get(0);

        // 4. 기존 레코드 확인 후 생성
        List<DnsRecord> existing = dnsProvider.listRecords(zone.id(), new DnsRecordFilter(fqdn, RECORD_TYPE));
        DnsRecord record;
        boolean reused;
        if (!existing.isEmpty()) {
            record = existing.get(0);
            if (!record.content().equalsIgnoreCase(config.targetDomain())) {
                throw new PermanentValidationException("Subdomain " + fqdn + " is already in use (points to "
                    + record.content() + ")");
            }
            reused = true;
            log.info("Reusing existing {} record {} for {}", RECORD_TYPE, record.id(), fqdn);
        } else {
            record = dnsProvider.createRecord(zone.id(),
                DnsRecordSpec.cname(fqdn, config.targetDomain(), config.dnsRecordTtl()));
            reused = false;
            log.info("Created {} record {} for {} -> {}", RECORD_TYPE, record.id(), fqdn, config.targetDomain());
        }

        // 5. 이벤트
        EventData data = EventData.builder()
            .put("fqdn", fqdn)
            .put("dns_record_id", record.id())
            .put("dns_zone_id", zone.id())
            .put("dns_record_type", RECORD_TYPE)
            .put("dns_record_value", record.content())
            .put("reused", reused)
            .build();
        appender.append(orgId, OrganizationEventType.SUBDOMAIN_DNS_CREATED, data,
            context.metadata("DNS record configured for " + fqdn));

        return new DnsRecordRef(record.id(), zone.id(), fqdn);
    }

    public static boolean isValidSubdomain(String subdomain) {
        return subdomain != null && SUBDOMAIN_PATTERN.matcher(subdomain).matches();
    }
}
