package com.ryuqq.provisioning.adapter.runner;

import com.ryuqq.provisioning.application.saga.StageRetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 유닛 테스트.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    private final StageRetryPolicy dnsPolicy = StageRetryPolicy.durationBudget(Duration.ofMinutes(30), 10_000L, 300_000L);

    @Test
    void jitter가_없으면_지수적으로_증가한다() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(0.0);

        // when & then
        assertThat(calculator.calculate(dnsPolicy, 1)).isEqualTo(10_000L);
        assertThat(calculator.calculate(dnsPolicy, 2)).isEqualTo(20_000L);
        assertThat(calculator.calculate(dnsPolicy, 3)).isEqualTo(40_000L);
        assertThat(calculator.calculate(dnsPolicy, 5)).isEqualTo(160_000L);
    }

    @Test
    void 최대_지연을_넘지_않는다() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(0.0);

        // when & then
        assertThat(calculator.calculate(dnsPolicy, 6)).isEqualTo(300_000L);
        assertThat(calculator.calculate(dnsPolicy, 40)).isEqualTo(300_000L);
    }

    @Test
    void jitter는_지연에_더해지고_최대값으로_잘린다() {
        // given: random이 항상 1.0에 가까운 값을 반환
        BackoffCalculator calculator = new BackoffCalculator(0.1, () -> 0.999);

        // when
        long first = calculator.calculate(dnsPolicy, 1);
        long capped = calculator.calculate(dnsPolicy, 10);

        // then
        assertThat(first).isBetween(10_000L, 11_000L);
        assertThat(capped).isEqualTo(300_000L);
    }

    @Test
    void 기본_지연이_0인_정책은_즉시_재시도() {
        // given
        BackoffCalculator calculator = new BackoffCalculator();

        // when & then
        assertThat(calculator.calculate(StageRetryPolicy.noRetry(), 1)).isZero();
    }

    @Test
    void 잘못된_jitter_비율은_거부된다() {
        assertThatThrownBy(() -> new BackoffCalculator(1.5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(-0.1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
