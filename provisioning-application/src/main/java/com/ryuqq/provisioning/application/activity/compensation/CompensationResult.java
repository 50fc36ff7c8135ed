package com.ryuqq.provisioning.application.activity.compensation;

import java.util.List;

/**
 * 보상 실행 결과.
 *
 * @param compensation 보상 이름
 * @param actions 수행한 작업
 * @param warnings 실패하거나 건너뛴 작업
 * @author Provisioning Team
 * @since 1.0.0
 */
public record CompensationResult(String compensation, List<String> actions, List<String> warnings) {

    public CompensationResult {
        if (compensation == null || compensation.isBlank()) {
            throw new IllegalArgumentException("compensation cannot be null or blank");
        }
        actions = actions == null ? List.of() : List.copyOf(actions);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static CompensationResult failed(String compensation, String warning) {
        return new CompensationResult(compensation, List.of(), List.of(warning));
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
