package com.ryuqq.provisioning.application.activity.compensation;

/**
 * 완료된 saga 단계의 효과를 되돌리는 보상 activity.
 *
 * <p>구현체는 예외를 던지지 않습니다. 대상별 실패는 {@link CompensationResult#warnings()}로 돌려주고
 * 가능한 나머지 작업을 계속합니다. 같은 컨텍스트로 여러 번 호출되어도 안전해야 합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface Compensation {

    /**
     * 보상 이름 (로그, 결과 표시용).
     *
     * @return 이름
     */
    String name();

    /**
     * 보상 실행.
     *
     * @param context 보상 컨텍스트
     * @return 수행한 작업과 경고
     */
    CompensationResult compensate(CompensationContext context);
}
