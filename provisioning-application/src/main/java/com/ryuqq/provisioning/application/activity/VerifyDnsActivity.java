package com.ryuqq.provisioning.application.activity;

import com.ryuqq.provisioning.application.dns.PropagationResult;
import com.ryuqq.provisioning.application.dns.QuorumDnsVerifier;
import com.ryuqq.provisioning.application.event.EventAppender;
import com.ryuqq.provisioning.core.event.DomainEvent;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.event.OrganizationEventType;
import com.ryuqq.provisioning.core.exception.QuorumNotReachedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * 서브도메인 전파 검증 activity.
 *
 * <p>한 번의 호출은 quorum 질의 한 번입니다. 미전파 시 {@link QuorumNotReachedException}을 던지고,
 * 재시도 간격과 시간 예산은 saga가 관리합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class VerifyDnsActivity {

    private static final Logger log = LoggerFactory.getLogger(VerifyDnsActivity.class);

    private final QuorumDnsVerifier verifier;
    private final EventHistory history;
    private final EventAppender appender;
    private final Clock clock;

    public VerifyDnsActivity(QuorumDnsVerifier verifier, EventHistory history, EventAppender appender, Clock clock) {
        if (verifier == null) {
            throw new IllegalArgumentException("verifier cannot be null");
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
        this.verifier = verifier;
        this.history = history;
        this.appender = appender;
        this.clock = clock;
    }

    /**
     * 전파 검증.
     *
     * @param orgId 조직 id
     * @param fqdn 검증할 도메인
     * @param attempt 누적 시도 번호
     * @param context 실행 컨텍스트
     * @return 검증 방식 ("dns_quorum" 또는 "bypass")
     * @throws QuorumNotReachedException quorum 미달
     */
    public String execute(UUID orgId, String fqdn, int attempt, ActivityContext context) {
        // 1. 이미 검증 기록이 있으면 건너뜀
        Optional<DomainEvent> verifiedBefore = history.effective(orgId, OrganizationEventType.SUBDOMAIN_VERIFIED,
            OrganizationEventType.DNS_REMOVED);
        if (verifiedBefore.isPresent() && fqdn.equals(verifiedBefore.get().data().optionalText("fqdn").orElse(null))) {
            log.info("Subdomain {} already verified, skipping", fqdn);
            return verifiedBefore.get().data().text("verification_method");
        }

        // 2. quorum 질의
        PropagationResult result = verifier.verifyPropagation(fqdn);
        if (result instanceof PropagationResult.NotYetPropagated pending) {
            throw new QuorumNotReachedException(fqdn, pending.successCount(), pending.requiredCount());
        }
        PropagationResult.Verified verified = (PropagationResult.Verified) result;

        // 3. 이벤트
        EventData data = EventData.builder()
            .put("fqdn", fqdn)
            .put("verification_method", verified.method())
            .put("verification_attempts", attempt)
            .put("resolvers_agreeing", verified.successCount())
            .put("verified_at", clock.instant())
            .build();
        appender.append(orgId, OrganizationEventType.SUBDOMAIN_VERIFIED, data,
            context.metadata("DNS propagation verified for " + fqdn));
        return verified.method();
    }

    /**
     * 재시도 예산 소진 시 검증 실패 기록.
     *
     * @param orgId 조직 id
     * @param fqdn 도메인
     * @param reason 실패 사유
     * @param attempts 누적 시도 횟수
     * @param context 실행 컨텍스트
     */
    public void recordFailure(UUID orgId, String fqdn, String reason, int attempts, ActivityContext context) {
        EventData data = EventData.builder()
            .put("fqdn", fqdn)
            .put("failure_reason", reason)
            .put("retry_count", attempts)
            .put("will_retry", false)
            .build();
        appender.append(orgId, OrganizationEventType.SUBDOMAIN_VERIFICATION_FAILED, data,
            context.metadata("DNS verification failed for " + fqdn));
    }
}
