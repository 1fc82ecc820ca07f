package tw.gc.strategy.validation.services.significance;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import tw.gc.strategy.validation.config.ValidationProperties;
import tw.gc.strategy.validation.enums.ThresholdMode;
import tw.gc.strategy.validation.enums.ValidationStatus;
import tw.gc.strategy.validation.services.bootstrap.BootstrapResult;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BonferroniCorrector")
class BonferroniCorrectorTest {

    private BonferroniCorrector corrector;

    @BeforeEach
    void setUp() {
        corrector = new BonferroniCorrector(new ValidationProperties());
    }

    @Nested
    @DisplayName("Parametric threshold")
    class ParametricTests {

        @Test
        @DisplayName("should reject a 0.4 Sharpe when 500 strategies were screened over 252 days")
        void shouldRejectMarginalMetricAmongManyStrategies() {
            CorrectionContext context = corrector.createContext(500, 252);

            SignificanceResult result = corrector.evaluate(0.4, context);

            assertThat(context.adjustedAlpha()).isCloseTo(1e-4, within(1e-15));
            assertThat(context.parametricThreshold()).isCloseTo(0.2451, within(1e-3));
            assertThat(context.threshold()).isEqualTo(0.5);
            assertThat(result.status()).isEqualTo(ValidationStatus.FAILED);
            assertThat(result.significant()).isFalse();
            assertThat(result.strategyCount()).isEqualTo(500);
            assertThat(result.observations()).isEqualTo(252);
        }

        @Test
        @DisplayName("should accept a metric above the floored threshold")
        void shouldAcceptStrongMetric() {
            SignificanceResult result = corrector.evaluate(1.8, corrector.createContext(500, 252));

            assertThat(result.status()).isEqualTo(ValidationStatus.PASSED);
            assertThat(result.metricValue()).isEqualTo(1.8);
        }

        @Test
        @DisplayName("should require the metric to be strictly above the threshold")
        void shouldBeStrict() {
            CorrectionContext context = corrector.createContext(10, 252);

            assertThat(corrector.isSignificant(0.5, context)).isFalse();
            assertThat(corrector.isSignificant(0.5000001, context)).isTrue();
        }

        @Test
        @DisplayName("should never call a negative metric significant")
        void shouldRejectNegativeMetric() {
            assertThat(corrector.isSignificant(-3.0, corrector.createContext(1, 252))).isFalse();
        }

        @Test
        @DisplayName("should raise the threshold as the number of strategies grows")
        void shouldBeMonotoneInStrategyCount() {
            double previous = 0.0;
            for (int n : new int[]{1, 10, 100, 1000, 10000}) {
                double threshold = BonferroniCorrector.parametricThreshold(
                    BonferroniCorrector.adjustedAlpha(0.05, n), 252);
                assertThat(threshold).isGreaterThan(previous);
                previous = threshold;
            }
        }

        @Test
        @DisplayName("should keep the family-wise error rate at or below alpha")
        void shouldBoundFamilyWiseErrorRate() {
            CorrectionContext context = corrector.createContext(500, 252);

            assertThat(context.familyWiseErrorRate()).isCloseTo(0.04877, within(1e-5)).isLessThanOrEqualTo(0.05);
            assertThat(context.expectedFalseDiscoveries()).isCloseTo(0.05, within(1e-12));
        }

        @Test
        @DisplayName("should report a non-finite metric as DEGENERATE_INPUT")
        void shouldRejectNonFiniteMetric() {
            SignificanceResult result = corrector.evaluate(Double.NaN, corrector.createContext(5, 252));

            assertThat(result.status()).isEqualTo(ValidationStatus.DEGENERATE_INPUT);
            assertThat(result.metric()).isNull();
        }

        @Test
        @DisplayName("should reject invalid arguments")
        void shouldRejectInvalidArguments() {
            assertThatThrownBy(() -> BonferroniCorrector.adjustedAlpha(0.05, 0))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BonferroniCorrector.adjustedAlpha(1.5, 10))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BonferroniCorrector.parametricThreshold(0.01, 0))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Bootstrap threshold")
    class BootstrapThresholdTests {

        private final MultipleComparisonConfig config = MultipleComparisonConfig.defaults()
            .withThresholdMode(ThresholdMode.BOOTSTRAP)
            .withSeed(42L);

        @Test
        @DisplayName("should build a context on the floored bootstrap threshold")
        void shouldCreateBootstrapContext() {
            CorrectionContext context = corrector.createContext(10, 252, config);

            assertThat(context.thresholdMode()).isEqualTo(ThresholdMode.BOOTSTRAP);
            assertThat(context.bootstrapThreshold()).isNotNull();
            assertThat(context.bootstrapThreshold().validSamples()).isEqualTo(1000);
            assertThat(context.bootstrapThreshold().threshold()).isPositive().isLessThan(0.5);
            assertThat(context.threshold()).isEqualTo(0.5);
        }

        @Test
        @DisplayName("should reproduce the threshold for the same seed")
        void shouldBeReproducible() {
            BootstrapThreshold first = corrector.bootstrapThreshold(0.005, 252, config, new Random(7));
            BootstrapThreshold second = corrector.bootstrapThreshold(0.005, 252, config, new Random(7));

            assertThat(second.threshold()).isEqualTo(first.threshold());
            assertThat(first.parametricThreshold())
                .isCloseTo(BonferroniCorrector.parametricThreshold(0.005, 252), within(1e-12));
            assertThat(first.difference())
                .isCloseTo(first.threshold() - first.parametricThreshold(), within(1e-12));
        }

        @Test
        @DisplayName("should require at least two observations")
        void shouldRejectTooFewObservations() {
            assertThatThrownBy(() -> corrector.bootstrapThreshold(0.005, 1, config, new Random(1)))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should not allow a BOOTSTRAP context without a bootstrap threshold")
        void shouldRequireBootstrapThreshold() {
            assertThatThrownBy(() -> new CorrectionContext(10, 0.05, 0.005, 252, 0.18, null, 0.5,
                ThresholdMode.BOOTSTRAP))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Strategy set screening")
    class StrategySetTests {

        @Test
        @DisplayName("should pass a set with significant strategies and a low estimated FDR")
        void shouldScreenStrategySet() {
            Map<String, Double> metrics = new LinkedHashMap<>();
            metrics.put("a", 1.8);
            metrics.put("b", 0.3);
            metrics.put("c", 2.1);

            StrategySetSignificance result = corrector.screenStrategySet(metrics, corrector.createContext(3, 252));

            assertThat(result.passed()).isTrue();
            assertThat(result.totalStrategies()).isEqualTo(3);
            assertThat(result.significantCount()).isEqualTo(2);
            assertThat(result.significantStrategies()).containsExactly("a", "c");
            assertThat(result.expectedFalseDiscoveries()).isCloseTo(0.05, within(1e-12));
            assertThat(result.estimatedFdr()).isCloseTo(0.025, within(1e-12));
        }

        @Test
        @DisplayName("should fail when nothing is significant")
        void shouldFailWithoutDiscoveries() {
            StrategySetSignificance result = corrector.screenStrategySet(
                Map.of("a", 0.1, "b", -0.4), corrector.createContext(2, 252));

            assertThat(result.passed()).isFalse();
            assertThat(result.estimatedFdr()).isZero();
        }

        @Test
        @DisplayName("should fail an empty set")
        void shouldFailEmptySet() {
            StrategySetSignificance result = corrector.screenStrategySet(Map.of(), corrector.createContext(1, 252));

            assertThat(result.passed()).isFalse();
            assertThat(result.totalStrategies()).isZero();
        }
    }

    @Nested
    @DisplayName("Combined check")
    class CombinedTests {

        private BootstrapResult interval(double lower, double upper) {
            return new BootstrapResult(ValidationStatus.PASSED, "", 1.5, lower, upper, 0.95, 1000, 1000, 21, 500);
        }

        @Test
        @DisplayName("should be significant when point and lower bound both clear the threshold")
        void shouldCombinePointAndLowerBound() {
            CombinedSignificance result = corrector.combinedCheck(1.5, interval(0.8, 2.2),
                corrector.createContext(10, 252));

            assertThat(result.pointSignificant()).isTrue();
            assertThat(result.lowerBoundSignificant()).isTrue();
            assertThat(result.significant()).isTrue();
        }

        @Test
        @DisplayName("should not be significant when the lower bound is below the threshold")
        void shouldRejectWeakLowerBound() {
            CombinedSignificance result = corrector.combinedCheck(1.5, interval(0.2, 2.2),
                corrector.createContext(10, 252));

            assertThat(result.pointSignificant()).isTrue();
            assertThat(result.significant()).isFalse();
        }

        @Test
        @DisplayName("should not be significant without an interval")
        void shouldRejectMissingInterval() {
            CombinedSignificance result = corrector.combinedCheck(1.5, interval(Double.NaN, Double.NaN),
                corrector.createContext(10, 252));

            assertThat(result.lowerBoundSignificant()).isFalse();
        }
    }
}
