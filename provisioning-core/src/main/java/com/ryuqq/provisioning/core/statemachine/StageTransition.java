package com.ryuqq.provisioning.core.statemachine;

/**
 * Bootstrap 단계 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>정상 경로 단계 → 바로 다음 정상 경로 단계</li>
 *   <li>비종료 정상 경로 단계 → FAILED</li>
 *   <li>FAILED → COMPENSATED 또는 CANCELLED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(ACTIVATED, COMPENSATED, CANCELLED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>단계 건너뛰기 및 역방향 전이 불가</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class StageTransition {

    private StageTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단계 전이가 유효한지 검증.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(BootstrapStage from, BootstrapStage to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Stages cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal stage: %s → %s", from, to)
            );
        }

        boolean valid;
        if (from == BootstrapStage.FAILED) {
            valid = to == BootstrapStage.COMPENSATED || to == BootstrapStage.CANCELLED;
        } else if (to == BootstrapStage.FAILED) {
            valid = true;
        } else {
            valid = to == from.pendingStep().completesStage();
        }

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid stage transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 단계 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return 전이된 단계 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static BootstrapStage transition(BootstrapStage current, BootstrapStage next) {
        validate(current, next);
        return next;
    }
}
