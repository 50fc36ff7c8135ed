package com.ryuqq.provisioning.application.config;

import com.ryuqq.provisioning.application.dns.DnsVerificationConfig;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * 프로비저닝 전역 설정.
 *
 * <p><strong>환경 변수 ({@link #fromEnvironment(Map)}):</strong></p>
 * <ul>
 *   <li>PLATFORM_BASE_DOMAIN: 서브도메인이 생성될 상위 도메인 (기본: firstovertheline.com)</li>
 *   <li>TARGET_DOMAIN: CNAME 대상 (기본: a4c.{base})</li>
 *   <li>FRONTEND_URL: 초대 수락 링크의 기준 URL (기본: https://a4c.{base})</li>
 *   <li>INVITATION_TTL_DAYS: 초대 유효 기간 (기본: 7)</li>
 *   <li>DNS_VERIFICATION_MODE: quorum | bypass (기본: quorum)</li>
 *   <li>DNS_PROPAGATION_TIMEOUT_MINUTES: DNS 단계 재시도 시간 예산 (기본: 30)</li>
 * </ul>
 *
 * @param platformBaseDomain 상위 도메인
 * @param targetDomain CNAME 대상 도메인
 * @param frontendUrl 프런트엔드 기준 URL
 * @param invitationTtl 초대 유효 기간
 * @param dnsRecordTtl 생성할 DNS 레코드 TTL (초)
 * @param dnsVerification DNS 전파 검증 설정
 * @param dnsPropagationTimeout DNS 단계 시간 예산
 * @author Provisioning Team
 * @since 1.0.0
 */
public record ProvisioningConfig(
    String platformBaseDomain,
    String targetDomain,
    String frontendUrl,
    Duration invitationTtl,
    int dnsRecordTtl,
    DnsVerificationConfig dnsVerification,
    Duration dnsPropagationTimeout
) {

    public static final String DEFAULT_BASE_DOMAIN = "firstovertheline.com";

    public ProvisioningConfig {
        if (platformBaseDomain == null || platformBaseDomain.isBlank()) {
            throw new IllegalArgumentException("platformBaseDomain cannot be null or blank");
        }
        if (targetDomain == null || targetDomain.isBlank()) {
            throw new IllegalArgumentException("targetDomain cannot be null or blank");
        }
        if (frontendUrl == null || frontendUrl.isBlank()) {
            throw new IllegalArgumentException("frontendUrl cannot be null or blank");
        }
        if (invitationTtl == null || invitationTtl.isNegative() || invitationTtl.isZero()) {
            throw new IllegalArgumentException("invitationTtl must be positive (current: " + invitationTtl + ")");
        }
        if (dnsRecordTtl <= 0) {
            throw new IllegalArgumentException("dnsRecordTtl must be positive (current: " + dnsRecordTtl + ")");
        }
        if (dnsVerification == null) {
            throw new IllegalArgumentException("dnsVerification cannot be null");
        }
        if (dnsPropagationTimeout == null || dnsPropagationTimeout.isNegative() || dnsPropagationTimeout.isZero()) {
            throw new IllegalArgumentException(
                "dnsPropagationTimeout must be positive (current: " + dnsPropagationTimeout + ")");
        }
        if (frontendUrl.endsWith("/")) {
            frontendUrl = frontendUrl.substring(0, frontendUrl.length() - 1);
        }
    }

    public ProvisioningConfig() {
        this(DEFAULT_BASE_DOMAIN, "a4c." + DEFAULT_BASE_DOMAIN, "https://a4c." + DEFAULT_BASE_DOMAIN,
            Duration.ofDays(7), 3600, new DnsVerificationConfig(), Duration.ofMinutes(30));
    }

    /**
     * 환경 변수 맵에서 설정 생성. 없는 키는 기본값을 사용합니다.
     *
     * @param env 환경 변수 (보통 {@code System.getenv()})
     * @return 설정
     * @throws IllegalArgumentException 값 형식이 잘못된 경우
     */
    public static ProvisioningConfig fromEnvironment(Map<String, String> env) {
        if (env == null) {
            throw new IllegalArgumentException("env cannot be null");
        }
        String base = value(env, "PLATFORM_BASE_DOMAIN", DEFAULT_BASE_DOMAIN);
        String target = value(env, "TARGET_DOMAIN", "a4c." + base);
        String frontend = value(env, "FRONTEND_URL", "https://a4c." + base);
        long ttlDays = number(env, "INVITATION_TTL_DAYS", 7);
        long timeoutMinutes = number(env, "DNS_PROPAGATION_TIMEOUT_MINUTES", 30);

        String mode = value(env, "DNS_VERIFICATION_MODE", "quorum").toLowerCase(Locale.ROOT);
        if (!mode.equals("quorum") && !mode.equals("bypass")) {
            throw new IllegalArgumentException("DNS_VERIFICATION_MODE must be 'quorum' or 'bypass' (current: " + mode + ")");
        }
        DnsVerificationConfig verification = new DnsVerificationConfig().withBypass(mode.equals("bypass"));

        return new ProvisioningConfig(base, target, frontend, Duration.ofDays(ttlDays), 3600, verification,
            Duration.ofMinutes(timeoutMinutes));
    }

    /**
     * 초대 메일 발신 주소 (noreply@{base}).
     */
    public String senderAddress() {
        return "noreply@" + platformBaseDomain;
    }

    public String fqdnFor(String subdomain) {
        return subdomain + "." + platformBaseDomain;
    }

    public String invitationUrl(String token) {
        return frontendUrl + "/accept-invitation?token=" + token;
    }

    public ProvisioningConfig withPlatformBaseDomain(String platformBaseDomain) {
        return new ProvisioningConfig(platformBaseDomain, targetDomain, frontendUrl, invitationTtl, dnsRecordTtl,
            dnsVerification, dnsPropagationTimeout);
    }

    public ProvisioningConfig withInvitationTtl(Duration invitationTtl) {
        return new ProvisioningConfig(platformBaseDomain, targetDomain, frontendUrl, invitationTtl, dnsRecordTtl,
            dnsVerification, dnsPropagationTimeout);
    }

    public ProvisioningConfig withDnsVerification(DnsVerificationConfig dnsVerification) {
        return new ProvisioningConfig(platformBaseDomain, targetDomain, frontendUrl, invitationTtl, dnsRecordTtl,
            dnsVerification, dnsPropagationTimeout);
    }

    public ProvisioningConfig withDnsPropagationTimeout(Duration dnsPropagationTimeout) {
        return new ProvisioningConfig(platformBaseDomain, targetDomain, frontendUrl, invitationTtl, dnsRecordTtl,
            dnsVerification, dnsPropagationTimeout);
    }

    private static String value(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private static long number(Map<String, String> env, String key, long defaultValue) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number (current: " + value + ")", e);
        }
    }
}
