package tw.gc.strategy.validation.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import tw.gc.strategy.validation.enums.BaselinePortfolio;
import tw.gc.strategy.validation.enums.ThresholdMode;
import tw.gc.strategy.validation.enums.ValidationStatus;
import tw.gc.strategy.validation.enums.ValidatorType;
import tw.gc.strategy.validation.model.StrategyCandidate;
import tw.gc.strategy.validation.services.StrategyValidationService;
import tw.gc.strategy.validation.services.baseline.BaselineConfig;
import tw.gc.strategy.validation.services.report.CandidateValidationReport;
import tw.gc.strategy.validation.services.report.ValidationReportSerializer;
import tw.gc.strategy.validation.testutil.ReturnFixtures;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class ValidationPropertiesIntegrationTest {

    @Autowired
    private ValidationProperties properties;

    @Autowired
    private StrategyValidationService validationService;

    @Autowired
    private ValidationReportSerializer serializer;

    @Test
    void properties_shouldBindDefaultsAndProfileOverrides() {
        assertThat(properties.getDataSplit().getTrainStart()).isEqualTo("2018-01-01");
        assertThat(properties.getWalkForward().getTestWindow()).isEqualTo(63);
        assertThat(properties.getMultipleComparison().getThresholdMode()).isEqualTo(ThresholdMode.PARAMETRIC);
        assertThat(properties.getMultipleComparison().getStrategyCount()).isEqualTo(20);
        assertThat(properties.getBootstrap().getSeed()).isEqualTo(7L);
        assertThat(properties.getOrchestrator().getValidators()).hasSize(5);
        assertThat(BaselineConfig.from(properties.getBaseline()).portfolios())
            .containsExactly(BaselinePortfolio.BUY_AND_HOLD_INDEX, BaselinePortfolio.RISK_PARITY);
    }

    @Test
    void validate_shouldRunWholePipelineInContext() {
        StrategyCandidate candidate = StrategyCandidate.of("context-check",
            ReturnFixtures.fullHistory(0.003, 0.01, 5L));

        CandidateValidationReport report = validationService.validate(candidate);

        assertThat(report.outcomes()).hasSize(ValidatorType.values().length);
        assertThat(report.bonferroni()).get().extracting(r -> r.strategyCount()).isEqualTo(20);
        assertThat(report.walkForward()).get().extracting(w -> w.totalWindows()).isEqualTo(8);
        assertThat(report.outcome(ValidatorType.BASELINE)).get()
            .extracting(o -> o.status()).isEqualTo(ValidationStatus.UNAVAILABLE);
        assertThat(serializer.toJson(report)).contains("\"strategy_id\" : \"context-check\"");
    }
}
