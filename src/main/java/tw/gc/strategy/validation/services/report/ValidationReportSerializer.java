package tw.gc.strategy.validation.services.report;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.validation.enums.BaselinePortfolio;
import tw.gc.strategy.validation.enums.ValidatorType;
import tw.gc.strategy.validation.model.ValidationOutcome;
import tw.gc.strategy.validation.services.baseline.BaselineComparisonResult;
import tw.gc.strategy.validation.services.baseline.BaselineRecord;
import tw.gc.strategy.validation.services.bootstrap.BootstrapResult;
import tw.gc.strategy.validation.services.datasplit.DataSplitResult;
import tw.gc.strategy.validation.services.significance.CombinedSignificance;
import tw.gc.strategy.validation.services.significance.SignificanceResult;
import tw.gc.strategy.validation.services.significance.StrategySetSignificance;
import tw.gc.strategy.validation.services.walkforward.WalkForwardAnalysis;

/**
 * Renders validation reports as JSON with snake_case keys, one section per validator:
 * <pre>
 * {
 *   "data_split":   {"pass": true, "consistency": 0.82, "train": 1.4, "val": 1.3, "test": 1.1},
 *   "walk_forward": {"pass": true, "mean_sharpe": 0.71, "win_rate": 0.75, "n_windows": 4},
 *   "bonferroni":   {"adjusted_alpha": 0.0025, "threshold": 0.58, "significant": true},
 *   "bootstrap":    {"ci_lower": 0.58, "ci_upper": 0.86, "pass": true},
 *   "baseline":     {"best_alpha": 0.34, "pass": true}
 * }
 * </pre>
 * Non-finite numbers are written as {@code null}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ValidationReportSerializer {

    private final ObjectMapper objectMapper;

    public String toJson(CandidateValidationReport report) {
        return write(toTree(report));
    }

    public String toJson(BatchValidationReport report) {
        return write(toTree(report));
    }

    public Map<String, Object> toTree(BatchValidationReport report) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total", report.totalCandidates());
        summary.put("passed", report.passedCandidates());
        summary.put("pass_rate", number(report.passRate()));
        summary.put("mean_metric", report.meanMetric());
        Map<String, Object> passCounts = new LinkedHashMap<>();
        report.validatorPassCounts().forEach((validator, count) -> passCounts.put(validator.getCode(), count));
        summary.put("validator_pass_counts", passCounts);

        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("run_id", report.runId());
        tree.put("n_strategies", report.strategyCount());
        tree.put("duration_ms", report.durationMs());
        tree.put("summary", summary);
        if (report.strategySet() != null) {
            tree.put("strategy_set", strategySet(report.strategySet()));
        }
        tree.put("candidates", report.candidates().stream().map(this::toTree).toList());
        return tree;
    }

    public Map<String, Object> toTree(CandidateValidationReport report) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("strategy_id", report.strategyId());
        tree.put("metric", report.metric() == null ? null : number(report.metric()));
        tree.put("pass", report.passed());
        tree.put("failing_validators", report.failingValidators().stream().map(ValidatorType::getCode).toList());
        tree.put("passed_count", report.passedCount());
        tree.put("failed_count", report.failedCount());
        tree.put("not_evaluated_count", report.notEvaluatedCount());
        tree.put("duration_ms", report.durationMs());
        report.outcomes().forEach((validator, outcome) -> tree.put(validator.getCode(), section(outcome)));
        if (report.combined() != null) {
            tree.put("combined_significance", combined(report.combined()));
        }
        return tree;
    }

    private Map<String, Object> section(ValidationOutcome outcome) {
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("pass", outcome.passed());
        section.put("status", outcome.status().name());
        section.put("reason", outcome.reason());

        if (outcome instanceof DataSplitResult split) {
            section.put("consistency", number(split.consistency()));
            section.put("degradation_ratio", number(split.degradationRatio()));
            section.put("train", split.trainMetric());
            section.put("val", split.validationMetric());
            section.put("test", split.testMetric());
            section.put("periods_tested", split.periodsTested());
            section.put("periods_skipped", split.skippedPeriods().stream()
                .map(this::skippedPeriod)
                .toList());
        } else if (outcome instanceof WalkForwardAnalysis walkForward) {
            section.put("mean_sharpe", number(walkForward.meanMetric()));
            section.put("std_sharpe", number(walkForward.stdMetric()));
            section.put("win_rate", number(walkForward.winRate()));
            section.put("worst_sharpe", number(walkForward.worstMetric()));
            section.put("best_sharpe", number(walkForward.bestMetric()));
            section.put("n_windows", walkForward.successfulWindows());
            section.put("n_windows_generated", walkForward.totalWindows());
            section.put("step_size", walkForward.stepSize());
            section.put("avg_robustness_score", number(walkForward.avgRobustnessScore()));
        } else if (outcome instanceof SignificanceResult significance) {
            section.put("significant", significance.significant());
            section.put("metric", significance.metric());
            section.put("n_strategies", significance.strategyCount());
            section.put("n_periods", significance.observations());
            section.put("adjusted_alpha", significance.adjustedAlpha());
            section.put("threshold", number(significance.threshold()));
            section.put("parametric_threshold", number(significance.parametricThreshold()));
            section.put("bootstrap_threshold", significance.bootstrapThreshold());
            section.put("threshold_mode", significance.thresholdMode().name());
        } else if (outcome instanceof BootstrapResult bootstrap) {
            section.put("point_estimate", bootstrap.pointEstimate());
            section.put("ci_lower", number(bootstrap.ciLower()));
            section.put("ci_upper", number(bootstrap.ciUpper()));
            section.put("confidence_level", bootstrap.confidenceLevel());
            section.put("n_iterations", bootstrap.iterations());
            section.put("n_valid_iterations", bootstrap.validIterations());
            section.put("block_size", bootstrap.blockSize());
            section.put("n_observations", bootstrap.observations());
        } else if (outcome instanceof BaselineComparisonResult baseline) {
            section.put("best_alpha", baseline.bestAlpha());
            section.put("best_baseline", baseline.bestBaseline() == null ? null : baseline.bestBaseline().getCode());
            section.put("worst_improvement", baseline.worstImprovement());
            section.put("worst_baseline", baseline.worstBaseline() == null ? null : baseline.worstBaseline().getCode());
            Map<String, Object> improvements = new LinkedHashMap<>();
            for (BaselinePortfolio portfolio : BaselinePortfolio.values()) {
                if (baseline.improvements().containsKey(portfolio)) {
                    improvements.put(portfolio.getCode(), baseline.improvements().get(portfolio));
                }
            }
            section.put("improvements", improvements);
            Map<String, Object> baselines = new LinkedHashMap<>();
            for (BaselineRecord record : baseline.baselines()) {
                baselines.put(record.baseline().getCode(), baselineRecord(record));
            }
            section.put("baselines", baselines);
            section.put("unavailable", baseline.unavailable().stream().map(BaselinePortfolio::getCode).toList());
        }
        return section;
    }

    private Map<String, Object> skippedPeriod(DataSplitResult.SkippedPeriod skipped) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("period", skipped.period().getLabel());
        tree.put("status", skipped.status().name());
        tree.put("reason", skipped.reason());
        return tree;
    }

    private Map<String, Object> baselineRecord(BaselineRecord record) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("available", record.available());
        tree.put("sharpe", number(record.sharpe()));
        tree.put("annual_return", number(record.annualReturn()));
        tree.put("max_drawdown", number(record.maxDrawdown()));
        tree.put("n_observations", record.observations());
        tree.put("start", record.bounds().start().toString());
        tree.put("end", record.bounds().end().toString());
        tree.put("cache_key", record.cacheKey());
        if (!record.available()) {
            tree.put("reason", record.failureReason());
        }
        return tree;
    }

    private Map<String, Object> combined(CombinedSignificance combined) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("point_estimate", number(combined.pointEstimate()));
        tree.put("ci_lower", number(combined.ciLower()));
        tree.put("threshold", number(combined.threshold()));
        tree.put("point_significant", combined.pointSignificant());
        tree.put("ci_lower_significant", combined.lowerBoundSignificant());
        tree.put("significant", combined.significant());
        return tree;
    }

    private Map<String, Object> strategySet(StrategySetSignificance set) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("pass", set.passed());
        tree.put("total_strategies", set.totalStrategies());
        tree.put("significant_count", set.significantCount());
        tree.put("significance_threshold", number(set.threshold()));
        tree.put("adjusted_alpha", set.adjustedAlpha());
        tree.put("expected_false_discoveries", set.expectedFalseDiscoveries());
        tree.put("estimated_fdr", set.estimatedFdr());
        tree.put("family_wise_error_rate", set.familyWiseErrorRate());
        tree.put("significant_strategies", List.copyOf(set.significantStrategies()));
        return tree;
    }

    private static Double number(double value) {
        return Double.isFinite(value) ? value : null;
    }

    private String write(Map<String, Object> tree) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            log.error("❌ Failed to serialize validation report", e);
            throw new IllegalStateException("Failed to serialize validation report", e);
        }
    }
}
