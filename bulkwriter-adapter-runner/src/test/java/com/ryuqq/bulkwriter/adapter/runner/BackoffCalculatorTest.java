package com.ryuqq.bulkwriter.adapter.runner;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 유닛 테스트.
 *
 * @author BulkWriter Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    void 기본값은_100ms_기준_지수_증가와_1초_치명_대기() {
        // given
        BackoffCalculator calculator = new BackoffCalculator();

        // then
        assertThat(calculator.calculate(0)).isEqualTo(100);
        assertThat(calculator.calculate(1)).isEqualTo(200);
        assertThat(calculator.calculate(3)).isEqualTo(800);
        assertThat(calculator.duplicateDelay(2)).isEqualTo(Duration.ofMillis(400));
        assertThat(calculator.fatalDelay()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void 오버플로는_최대값() {
        // given
        BackoffCalculator calculator = new BackoffCalculator();

        // then
        assertThat(calculator.calculate(62)).isEqualTo(Long.MAX_VALUE);
        assertThat(calculator.calculate(60)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void 기준값이_0이면_항상_0() {
        assertThat(new BackoffCalculator(0, 0).calculate(10)).isZero();
    }

    @Test
    void 잘못된_인자는_거부() {
        assertThatThrownBy(() -> new BackoffCalculator(-1, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must not be negative (current: -1)");
        assertThatThrownBy(() -> new BackoffCalculator().calculate(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
