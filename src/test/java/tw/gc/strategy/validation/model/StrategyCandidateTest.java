package tw.gc.strategy.validation.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class StrategyCandidateTest {

    @Test
    @DisplayName("should require id and returns")
    void shouldRequireIdAndReturns() {
        assertThatThrownBy(() -> StrategyCandidate.of(" ", ReturnSeries.empty()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StrategyCandidate.of("momentum", null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should keep optional collaborators when copying")
    void shouldCopyWithOptionalFields() {
        StrategyCandidate candidate = StrategyCandidate.of("momentum", ReturnSeries.empty())
            .withEvaluator((start, end) -> 1.0)
            .withReportedMetric(1.25);

        assertThat(candidate.evaluator()).isNotNull();
        assertThat(candidate.reportedMetric()).isEqualTo(1.25);
        assertThat(candidate.id()).isEqualTo("momentum");
    }
}
