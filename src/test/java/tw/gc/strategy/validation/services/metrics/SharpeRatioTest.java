package tw.gc.strategy.validation.services.metrics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class SharpeRatioTest {

    @Test
    @DisplayName("should annualize mean over sample std with sqrt(252)")
    void shouldAnnualize() {
        double[] returns = {0.01, 0.03, 0.02, 0.00};
        double perPeriod = ReturnStatistics.mean(returns) / ReturnStatistics.sampleStdDev(returns);

        assertThat(SharpeRatio.perPeriodMetric().compute(returns)).isCloseTo(perPeriod, within(1e-12));
        assertThat(SharpeRatio.annualized().compute(returns)).isCloseTo(perPeriod * Math.sqrt(252), within(1e-9));
    }

    @Test
    @DisplayName("should be NaN for zero variance or fewer than two points")
    void shouldBeNaNWhenUndefined() {
        assertThat(SharpeRatio.annualized().compute(new double[]{0.0, 0.0, 0.0})).isNaN();
        assertThat(SharpeRatio.annualized().compute(new double[]{0.01})).isNaN();
        assertThat(SharpeRatio.annualized().compute(new double[0])).isNaN();
    }

    @Test
    @DisplayName("should be NaN for a constant non-zero return series")
    void shouldBeNaNForConstantReturns() {
        double[] returns = new double[250];
        Arrays.fill(returns, 0.001);

        assertThat(SharpeRatio.annualized().compute(returns)).isNaN();
        assertThat(SharpeRatio.perPeriodMetric().compute(returns)).isNaN();
    }

    @Test
    @DisplayName("should be NaN when the spread is only rounding noise around the mean")
    void shouldBeNaNForNearConstantReturns() {
        double[] returns = new double[100];
        Arrays.fill(returns, 0.001);
        returns[50] = Math.nextUp(0.001);

        assertThat(SharpeRatio.annualized().compute(returns)).isNaN();
    }
}
