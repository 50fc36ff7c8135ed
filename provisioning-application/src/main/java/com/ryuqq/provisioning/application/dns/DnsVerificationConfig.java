package com.ryuqq.provisioning.application.dns;

import java.time.Duration;
import java.util.List;

/**
 * DNS 전파 검증 설정.
 *
 * @param resolverAddresses 질의할 공용 resolver 주소 (기본: 8.8.8.8, 1.1.1.1, 9.9.9.9)
 * @param quorum 성공으로 판정할 최소 resolver 수 (기본: 2)
 * @param queryTimeoutMs resolver별 질의 타임아웃 (기본: 5000ms)
 * @param bypass 검증 생략 여부. 개발 환경 전용 (기본: false)
 * @author Provisioning Team
 * @since 1.0.0
 */
public record DnsVerificationConfig(
    List<String> resolverAddresses,
    int quorum,
    long queryTimeoutMs,
    boolean bypass
) {

    public static final List<String> DEFAULT_RESOLVERS = List.of("8.8.8.8", "1.1.1.1", "9.9.9.9");

    public DnsVerificationConfig {
        if (resolverAddresses == null || resolverAddresses.isEmpty()) {
            throw new IllegalArgumentException("resolverAddresses cannot be null or empty");
        }
        if (quorum <= 0) {
            throw new IllegalArgumentException("quorum must be positive (current: " + quorum + ")");
        }
        if (queryTimeoutMs <= 0) {
            throw new IllegalArgumentException("queryTimeoutMs must be positive (current: " + queryTimeoutMs + ")");
        }
        resolverAddresses = List.copyOf(resolverAddresses);
    }

    public DnsVerificationConfig() {
        this(DEFAULT_RESOLVERS, 2, 5000L, false);
    }

    public Duration queryTimeout() {
        return Duration.ofMillis(queryTimeoutMs);
    }

    public DnsVerificationConfig withResolverAddresses(List<String> resolverAddresses) {
        return new DnsVerificationConfig(resolverAddresses, this.quorum, this.queryTimeoutMs, this.bypass);
    }

    public DnsVerificationConfig withQuorum(int quorum) {
        return new DnsVerificationConfig(this.resolverAddresses, quorum, this.queryTimeoutMs, this.bypass);
    }

    public DnsVerificationConfig withQueryTimeoutMs(long queryTimeoutMs) {
        return new DnsVerificationConfig(this.resolverAddresses, this.quorum, queryTimeoutMs, this.bypass);
    }

    public DnsVerificationConfig withBypass(boolean bypass) {
        return new DnsVerificationConfig(this.resolverAddresses, this.quorum, this.queryTimeoutMs, bypass);
    }
}
