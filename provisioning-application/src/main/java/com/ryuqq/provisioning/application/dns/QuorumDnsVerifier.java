package com.ryuqq.provisioning.application.dns;

import com.ryuqq.provisioning.core.spi.DnsResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 여러 독립 resolver에 병렬 질의하여 DNS 전파를 판정합니다.
 *
 * <p>resolver 하나가 캐시했거나 다운된 경우를 배제하기 위해 quorum(기본 3개 중 2개) 이상이
 * 비어있지 않은 A 레코드를 반환해야 전파된 것으로 봅니다. 오류와 타임아웃은 "응답 없음"으로 계산합니다.</p>
 *
 * <p>호출 간 상태를 갖지 않으며 재시도는 호출자(saga)의 몫입니다.</p>
 *
 * <p>bypass 모드에서는 질의 없이 항상 {@link PropagationResult.Verified}(method = "bypass")를 반환합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class QuorumDnsVerifier {

    private static final Logger log = LoggerFactory.getLogger(QuorumDnsVerifier.class);

    private final List<DnsResolver> resolvers;
    private final DnsVerificationConfig config;
    private final ExecutorService queryExecutor;

    /**
     * 생성자.
     *
     * @param resolvers 질의할 resolver 목록
     * @param config 검증 설정
     * @throws IllegalArgumentException resolver 수가 quorum보다 적은 경우 (bypass 제외)
     */
    public QuorumDnsVerifier(List<DnsResolver> resolvers, DnsVerificationConfig config) {
        if (resolvers == null) {
            throw new IllegalArgumentException("resolvers cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (!config.bypass() && resolvers.size() < config.quorum()) {
            throw new IllegalArgumentException(
                "resolvers (" + resolvers.size() + ") must be at least quorum (" + config.quorum() + ")");
        }
        this.resolvers = List.copyOf(resolvers);
        this.config = config;
        this.queryExecutor = Executors.newCachedThreadPool(daemonThreadFactory());

        if (config.bypass()) {
            log.warn("DNS propagation verification is BYPASSED: every domain will be reported as verified. "
                + "Never enable this outside local development.");
        }
    }

    /**
     * 도메인 전파 여부 판정.
     *
     * @param domain FQDN
     * @return Verified 또는 NotYetPropagated
     */
    public PropagationResult verifyPropagation(String domain) {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("domain cannot be null or blank");
        }
        if (config.bypass()) {
            log.warn("Skipping DNS verification for {} (bypass mode)", domain);
            return new PropagationResult.Verified(domain, PropagationResult.METHOD_BYPASS, 0, List.of());
        }

        // 1. 모든 resolver에 병렬 질의 (resolver별 타임아웃)
        Duration timeout = config.queryTimeout();
        List<CompletableFuture<ResolverAnswer>> futures = resolvers.stream()
            .map(resolver -> CompletableFuture
                .supplyAsync(() -> query(resolver, domain, timeout), queryExecutor)
                .completeOnTimeout(ResolverAnswer.timedOut(resolver.name()), timeout.toMillis(), TimeUnit.MILLISECONDS))
            .toList();

        // 2. 결과 수집
        List<ResolverAnswer> answers = futures.stream()
            .map(CompletableFuture::join)
            .toList();
        int successCount = (int) answers.stream().filter(ResolverAnswer::isResolved).count();

        // 3. quorum 판정
        if (successCount >= config.quorum()) {
            log.info("DNS propagation verified for {} ({}/{} resolvers)", domain, successCount, resolvers.size());
            return new PropagationResult.Verified(domain, PropagationResult.METHOD_QUORUM, successCount, answers);
        }
        log.info("DNS not yet propagated for {} ({}/{} resolvers, quorum {})",
            domain, successCount, resolvers.size(), config.quorum());
        return new PropagationResult.NotYetPropagated(domain, successCount, config.quorum(), answers);
    }

    public DnsVerificationConfig getConfig() {
        return config;
    }

    /**
     * 질의 스레드 정리.
     */
    public void shutdown() {
        queryExecutor.shutdownNow();
    }

    private static ResolverAnswer query(DnsResolver resolver, String domain, Duration timeout) {
        try {
            List<String> addresses = resolver.resolveA(domain, timeout);
            if (addresses == null || addresses.isEmpty()) {
                return ResolverAnswer.empty(resolver.name());
            }
            return ResolverAnswer.resolved(resolver.name(), addresses);
        } catch (RuntimeException e) {
            log.debug("Resolver {} failed for {}: {}", resolver.name(), domain, e.getMessage());
            return ResolverAnswer.failed(resolver.name(), e.getMessage());
        }
    }

    private static ThreadFactory daemonThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "dns-quorum-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
