package tw.gc.strategy.validation.services.metrics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class ReturnStatisticsTest {

    @Nested
    @DisplayName("Moments")
    class MomentTests {

        @Test
        @DisplayName("should use Bessel's correction for the standard deviation")
        void shouldUseSampleStdDev() {
            double[] values = {1.0, 2.0, 3.0, 4.0};

            assertThat(ReturnStatistics.mean(values)).isEqualTo(2.5);
            assertThat(ReturnStatistics.sampleStdDev(values)).isCloseTo(Math.sqrt(5.0 / 3.0), within(1e-12));
        }

        @Test
        @DisplayName("should return NaN when undefined")
        void shouldReturnNaNWhenUndefined() {
            assertThat(ReturnStatistics.mean(new double[0])).isNaN();
            assertThat(ReturnStatistics.sampleStdDev(new double[]{1.0})).isNaN();
            assertThat(ReturnStatistics.min(new double[0])).isNaN();
        }

        @Test
        @DisplayName("should return exactly zero spread for a constant non-zero series")
        void shouldReturnZeroForConstantSeries() {
            double[] values = new double[250];
            Arrays.fill(values, 0.001);

            assertThat(ReturnStatistics.sampleStdDev(values)).isZero();
            assertThat(ReturnStatistics.sampleStdDev(new double[]{1.4, 1.4, 1.4})).isZero();
        }

        @Test
        @DisplayName("should treat rounding-level spread as zero relative to the mean")
        void shouldDetectZeroSpread() {
            assertThat(ReturnStatistics.isZeroSpread(0.0, 0.0)).isTrue();
            assertThat(ReturnStatistics.isZeroSpread(6.5e-19, 0.001)).isTrue();
            assertThat(ReturnStatistics.isZeroSpread(2.7e-16, 1.4)).isTrue();
            assertThat(ReturnStatistics.isZeroSpread(1e-6, 0.001)).isFalse();
            assertThat(ReturnStatistics.isZeroSpread(0.01, 0.0)).isFalse();
            assertThat(ReturnStatistics.isZeroSpread(Double.NaN, 0.001)).isFalse();
        }
    }

    @Nested
    @DisplayName("Percentile")
    class PercentileTests {

        @Test
        @DisplayName("should interpolate linearly between ranks")
        void shouldInterpolate() {
            double[] values = {4.0, 1.0, 3.0, 2.0};

            assertThat(ReturnStatistics.percentile(values, 0)).isEqualTo(1.0);
            assertThat(ReturnStatistics.percentile(values, 100)).isEqualTo(4.0);
            assertThat(ReturnStatistics.percentile(values, 50)).isEqualTo(2.5);
            assertThat(ReturnStatistics.percentile(values, 2.5)).isCloseTo(1.075, within(1e-12));
        }

        @Test
        @DisplayName("should not modify its input")
        void shouldNotSortInput() {
            double[] values = {3.0, 1.0, 2.0};

            ReturnStatistics.percentile(values, 50);

            assertThat(values).containsExactly(3.0, 1.0, 2.0);
        }

        @Test
        @DisplayName("should reject percentiles outside [0, 100]")
        void shouldRejectOutOfRange() {
            assertThatThrownBy(() -> ReturnStatistics.percentile(new double[]{1.0}, 101))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("should measure drawdown on the compounded equity curve")
    void shouldComputeMaxDrawdown() {
        double[] returns = {0.10, -0.50, 0.20};

        assertThat(ReturnStatistics.maxDrawdown(returns)).isCloseTo(-0.5, within(1e-12));
        assertThat(ReturnStatistics.maxDrawdown(new double[]{0.01, 0.02})).isZero();
    }

    @Test
    @DisplayName("should annualize the mean period return geometrically")
    void shouldAnnualizeReturn() {
        assertThat(ReturnStatistics.annualizedReturn(new double[]{0.001, 0.001}))
            .isCloseTo(Math.pow(1.001, 252) - 1, within(1e-12));
    }

    @ParameterizedTest
    @CsvSource({
        "0.5, 0.0",
        "0.975, 1.959963985",
        "0.025, -1.959963985",
        "0.99995, 3.890591886",
        "0.001, -3.090232306"
    })
    @DisplayName("should invert the standard normal CDF")
    void shouldInvertNormalCdf(double p, double expected) {
        assertThat(ReturnStatistics.inverseNormalCdf(p)).isCloseTo(expected, within(1e-6));
    }

    @Test
    @DisplayName("should reject probabilities outside (0, 1)")
    void shouldRejectInvalidProbability() {
        assertThatThrownBy(() -> ReturnStatistics.inverseNormalCdf(0.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReturnStatistics.inverseNormalCdf(1.0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
