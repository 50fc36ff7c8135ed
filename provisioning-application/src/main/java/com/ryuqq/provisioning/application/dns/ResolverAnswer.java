package com.ryuqq.provisioning.application.dns;

import java.util.List;

/**
 * resolver 하나의 질의 결과.
 *
 * @param resolver resolver 이름
 * @param status 결과 구분
 * @param addresses A 레코드 주소 (RESOLVED일 때만 비어있지 않음)
 * @param error 실패 사유 (FAILED일 때)
 * @author Provisioning Team
 * @since 1.0.0
 */
public record ResolverAnswer(String resolver, Status status, List<String> addresses, String error) {

    public enum Status {
        RESOLVED,
        EMPTY,
        FAILED,
        TIMED_OUT
    }

    public ResolverAnswer {
        if (resolver == null) {
            throw new IllegalArgumentException("resolver cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        addresses = addresses == null ? List.of() : List.copyOf(addresses);
    }

    public static ResolverAnswer resolved(String resolver, List<String> addresses) {
        return new ResolverAnswer(resolver, Status.RESOLVED, addresses, null);
    }

    public static ResolverAnswer empty(String resolver) {
        return new ResolverAnswer(resolver, Status.EMPTY, List.of(), null);
    }

    public static ResolverAnswer failed(String resolver, String error) {
        return new ResolverAnswer(resolver, Status.FAILED, List.of(), error);
    }

    public static ResolverAnswer timedOut(String resolver) {
        return new ResolverAnswer(resolver, Status.TIMED_OUT, List.of(), "timed out");
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }
}
