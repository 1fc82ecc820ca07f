package tw.gc.strategy.validation.services.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import tw.gc.strategy.validation.enums.ValidationStatus;
import tw.gc.strategy.validation.enums.ValidatorType;
import tw.gc.strategy.validation.model.ValidationOutcome;
import tw.gc.strategy.validation.services.datasplit.DataSplitResult;
import tw.gc.strategy.validation.services.datasplit.SplitPeriod;
import tw.gc.strategy.validation.services.significance.StrategySetSignificance;

import static org.assertj.core.api.Assertions.*;

class ValidationReportSerializerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ValidationReportSerializer serializer = new ValidationReportSerializer(objectMapper);

    @Nested
    @DisplayName("Candidate report")
    class CandidateTests {

        @Test
        @DisplayName("should write one snake_case section per validator")
        void shouldWriteSections() throws Exception {
            JsonNode json = objectMapper.readTree(serializer.toJson(ReportFixtures.passingReport("momentum", 1.8)));

            assertThat(json.get("strategy_id").asText()).isEqualTo("momentum");
            assertThat(json.get("pass").asBoolean()).isTrue();
            assertThat(json.get("data_split").get("val").asDouble()).isEqualTo(1.3);
            assertThat(json.get("data_split").get("periods_tested")).hasSize(3);
            assertThat(json.get("walk_forward").get("n_windows").asInt()).isEqualTo(4);
            assertThat(json.get("bonferroni").get("threshold_mode").asText()).isEqualTo("PARAMETRIC");
            assertThat(json.get("bootstrap").get("ci_lower").asDouble()).isCloseTo(1.2, within(1e-12));
            assertThat(json.get("baseline").get("best_baseline").asText()).isEqualTo("buy_and_hold");
            assertThat(json.get("combined_significance").get("significant").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("should write non-finite numbers as null")
        void shouldWriteNullForNaN() throws Exception {
            JsonNode json = objectMapper.readTree(serializer.toJson(ReportFixtures.passingReport("momentum", 1.8)));

            assertThat(json.get("walk_forward").get("avg_robustness_score").isNull()).isTrue();
            assertThat(json.get("bonferroni").get("bootstrap_threshold").isNull()).isTrue();
            JsonNode parity = json.get("baseline").get("baselines").get("risk_parity");
            assertThat(parity.get("available").asBoolean()).isFalse();
            assertThat(parity.get("sharpe").isNull()).isTrue();
            assertThat(parity.get("reason").asText()).isEqualTo("no panel");
            assertThat(json.get("baseline").get("unavailable").get(0).asText()).isEqualTo("risk_parity");
        }

        @Test
        @DisplayName("should carry status and reason for validators without their own result")
        void shouldWriteValidatorFailure() {
            Map<String, Object> tree = serializer.toTree(ReportFixtures.failingReport("broken"));

            assertThat(tree).containsEntry("pass", false)
                .containsEntry("failing_validators", List.of("walk_forward", "bonferroni"))
                .containsEntry("not_evaluated_count", 1L)
                .doesNotContainKey("combined_significance");
            @SuppressWarnings("unchecked")
            Map<String, Object> walkForward = (Map<String, Object>) tree.get("walk_forward");
            assertThat(walkForward).containsOnlyKeys("pass", "status", "reason")
                .containsEntry("status", "UNAVAILABLE");
        }

        @Test
        @DisplayName("should write a skipped period whose failure carried no message")
        void shouldWriteSkippedPeriodWithoutReason() throws Exception {
            Map<ValidatorType, ValidationOutcome> outcomes = new EnumMap<>(ValidatorType.class);
            outcomes.put(ValidatorType.DATA_SPLIT, new DataSplitResult(ValidationStatus.UNAVAILABLE, "test unavailable",
                Map.of(SplitPeriod.TRAIN, 1.4, SplitPeriod.VALIDATION, 1.3), 0.0, 0.0,
                List.of(new DataSplitResult.SkippedPeriod(SplitPeriod.TEST, ValidationStatus.UNAVAILABLE, null))));
            CandidateValidationReport report = new CandidateValidationReport("silent", 1.4, outcomes, null, 3);

            JsonNode skipped = objectMapper.readTree(serializer.toJson(report)).get("data_split").get("periods_skipped");

            assertThat(skipped).hasSize(1);
            assertThat(skipped.get(0).get("period").asText()).isEqualTo("test");
            assertThat(skipped.get(0).get("status").asText()).isEqualTo("UNAVAILABLE");
            assertThat(skipped.get(0).get("reason").isNull()).isTrue();
        }
    }

    @Test
    @DisplayName("should summarize a batch")
    void shouldWriteBatch() throws Exception {
        StrategySetSignificance set = new StrategySetSignificance(2, 1, 0.5, 0.025, 0.05, 0.05, 0.0494,
            List.of("momentum"), true);
        BatchValidationReport batch = new BatchValidationReport("a1b2c3d4", 2,
            List.of(ReportFixtures.passingReport("momentum", 1.8), ReportFixtures.failingReport("broken")),
            set, 42);

        JsonNode json = objectMapper.readTree(serializer.toJson(batch));

        assertThat(json.get("run_id").asText()).isEqualTo("a1b2c3d4");
        assertThat(json.get("summary").get("passed").asInt()).isEqualTo(1);
        assertThat(json.get("summary").get("pass_rate").asDouble()).isEqualTo(0.5);
        assertThat(json.get("summary").get("validator_pass_counts").get("bonferroni").asInt()).isEqualTo(1);
        assertThat(json.get("strategy_set").get("significant_strategies").get(0).asText()).isEqualTo("momentum");
        assertThat(json.get("candidates")).hasSize(2);
    }
}
