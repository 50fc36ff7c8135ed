package com.ryuqq.provisioning.application.projection;

/**
 * Projection router 설정.
 *
 * @param slowHandlerThresholdMs 이 시간을 넘긴 핸들러 실행은 WARN 로그 (기본: 100ms)
 * @param detailedErrors 처리 실패 기록에 예외 클래스명을 상세로 덧붙일지 여부 (기본: true)
 * @author Provisioning Team
 * @since 1.0.0
 */
public record RouterConfig(
    long slowHandlerThresholdMs,
    boolean detailedErrors
) {

    public RouterConfig {
        if (slowHandlerThresholdMs <= 0) {
            throw new IllegalArgumentException("slowHandlerThresholdMs must be positive (current: " + slowHandlerThresholdMs + ")");
        }
    }

    public RouterConfig() {
        this(100L, true);
    }

    public RouterConfig withSlowHandlerThresholdMs(long slowHandlerThresholdMs) {
        return new RouterConfig(slowHandlerThresholdMs, this.detailedErrors);
    }

    public RouterConfig withDetailedErrors(boolean detailedErrors) {
        return new RouterConfig(this.slowHandlerThresholdMs, detailedErrors);
    }
}
