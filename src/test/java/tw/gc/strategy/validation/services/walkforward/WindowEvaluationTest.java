package tw.gc.strategy.validation.services.walkforward;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tw.gc.strategy.validation.enums.ValidationStatus;
import tw.gc.strategy.validation.model.PeriodBounds;

import static org.assertj.core.api.Assertions.*;

class WindowEvaluationTest {

    private final WalkForwardWindow window = new WalkForwardWindow(0, 0, 252, 252, 315,
        PeriodBounds.of("2018-01-01", "2018-09-09"), PeriodBounds.of("2018-09-10", "2018-11-11"));

    @Nested
    @DisplayName("Robustness score")
    class RobustnessTests {

        @Test
        @DisplayName("should be the OOS/IS percentage capped at 100")
        void shouldScaleByInSample() {
            assertThat(WindowEvaluation.success(window, 0.8, 1.0).robustnessScore()).isCloseTo(80.0, within(1e-9));
            assertThat(WindowEvaluation.success(window, 2.0, 1.0).robustnessScore()).isEqualTo(100.0);
            assertThat(WindowEvaluation.success(window, -1.0, 1.0).robustnessScore()).isZero();
        }

        @Test
        @DisplayName("should score 50 when only the out-of-sample metric is positive")
        void shouldHandleNonPositiveInSample() {
            assertThat(WindowEvaluation.success(window, 0.5, -0.2).robustnessScore()).isEqualTo(50.0);
            assertThat(WindowEvaluation.success(window, -0.5, -0.2).robustnessScore()).isZero();
        }

        @Test
        @DisplayName("should be NaN without an in-sample metric")
        void shouldBeNaNWithoutInSample() {
            assertThat(WindowEvaluation.success(window, 0.5, null).robustnessScore()).isNaN();
            assertThat(WindowEvaluation.success(window, 0.5, null).isOosRatio()).isNaN();
        }
    }

    @Test
    @DisplayName("should flag an infinite IS/OOS ratio for non-positive out-of-sample metrics")
    void shouldComputeIsOosRatio() {
        assertThat(WindowEvaluation.success(window, 0.5, 1.5).isOosRatio()).isCloseTo(3.0, within(1e-12));
        assertThat(WindowEvaluation.success(window, 0.0, 1.5).isOosRatio()).isInfinite();
    }

    @Test
    @DisplayName("should require an error status for failed windows")
    void shouldRequireErrorStatus() {
        WindowEvaluation failed = WindowEvaluation.failure(window, ValidationStatus.UNAVAILABLE, "timeout");

        assertThat(failed.succeeded()).isFalse();
        assertThatThrownBy(() -> new WindowEvaluation(window, null, null, null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should reject a window whose training range runs into its test range")
    void shouldRejectOverlappingWindow() {
        assertThatThrownBy(() -> new WalkForwardWindow(0, 0, 260, 252, 315,
            PeriodBounds.of("2018-01-01", "2018-09-09"), PeriodBounds.of("2018-09-10", "2018-11-11")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("after test start");
    }
}
