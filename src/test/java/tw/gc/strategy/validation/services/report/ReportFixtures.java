package tw.gc.strategy.validation.services.report;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import tw.gc.strategy.validation.enums.BaselinePortfolio;
import tw.gc.strategy.validation.enums.ThresholdMode;
import tw.gc.strategy.validation.enums.ValidationStatus;
import tw.gc.strategy.validation.enums.ValidatorType;
import tw.gc.strategy.validation.model.PeriodBounds;
import tw.gc.strategy.validation.model.ValidationOutcome;
import tw.gc.strategy.validation.services.baseline.BaselineComparisonResult;
import tw.gc.strategy.validation.services.baseline.BaselineRecord;
import tw.gc.strategy.validation.services.bootstrap.BootstrapResult;
import tw.gc.strategy.validation.services.datasplit.DataSplitResult;
import tw.gc.strategy.validation.services.datasplit.SplitPeriod;
import tw.gc.strategy.validation.services.significance.CombinedSignificance;
import tw.gc.strategy.validation.services.significance.SignificanceResult;
import tw.gc.strategy.validation.services.walkforward.WalkForwardAnalysis;

/**
 * Hand-built validator outcomes for report tests.
 */
final class ReportFixtures {

    static final PeriodBounds RANGE = PeriodBounds.of("2018-01-01", "2024-12-31");

    private ReportFixtures() {
    }

    static CandidateValidationReport passingReport(String id, double metric) {
        Map<ValidatorType, ValidationOutcome> outcomes = new EnumMap<>(ValidatorType.class);
        outcomes.put(ValidatorType.DATA_SPLIT, new DataSplitResult(ValidationStatus.PASSED, "ok",
            Map.of(SplitPeriod.TRAIN, 1.4, SplitPeriod.VALIDATION, 1.3, SplitPeriod.TEST, 1.2), 0.92, 0.857,
            List.of()));
        outcomes.put(ValidatorType.WALK_FORWARD, new WalkForwardAnalysis(ValidationStatus.PASSED, "ok", List.of(),
            63, 4, 0.71, 0.3, 0.75, 0.2, 1.1, Double.NaN));
        outcomes.put(ValidatorType.BONFERRONI, new SignificanceResult(ValidationStatus.PASSED, "ok", metric, 5, 2557,
            0.01, 0.5, 0.0509, null, ThresholdMode.PARAMETRIC));
        outcomes.put(ValidatorType.BOOTSTRAP, new BootstrapResult(ValidationStatus.PASSED, "ok", metric,
            metric - 0.6, metric + 0.6, 0.95, 1000, 1000, 21, 2557));
        BaselineRecord index = BaselineRecord.available(BaselinePortfolio.BUY_AND_HOLD_INDEX, RANGE,
            0.4, 0.08, -0.3, 2557);
        BaselineRecord parity = BaselineRecord.unavailable(BaselinePortfolio.RISK_PARITY, RANGE, "no panel");
        outcomes.put(ValidatorType.BASELINE, new BaselineComparisonResult(ValidationStatus.PASSED, "ok", metric,
            List.of(index, parity), Map.of(BaselinePortfolio.BUY_AND_HOLD_INDEX, metric - 0.4),
            metric - 0.4, BaselinePortfolio.BUY_AND_HOLD_INDEX, metric - 0.4, BaselinePortfolio.BUY_AND_HOLD_INDEX,
            List.of(BaselinePortfolio.RISK_PARITY)));
        CombinedSignificance combined = new CombinedSignificance(metric, metric - 0.6, 0.5, true, true, true);
        return new CandidateValidationReport(id, metric, outcomes, combined, 12);
    }

    static CandidateValidationReport failingReport(String id) {
        Map<ValidatorType, ValidationOutcome> outcomes = new EnumMap<>(ValidatorType.class);
        outcomes.put(ValidatorType.BONFERRONI, new SignificanceResult(ValidationStatus.FAILED, "below", 0.3, 5, 2557,
            0.01, 0.5, 0.0509, null, ThresholdMode.PARAMETRIC));
        outcomes.put(ValidatorType.WALK_FORWARD, new ValidatorFailure(ValidatorType.WALK_FORWARD,
            ValidationStatus.UNAVAILABLE, "engine down"));
        return new CandidateValidationReport(id, 0.3, outcomes, null, 3);
    }
}
