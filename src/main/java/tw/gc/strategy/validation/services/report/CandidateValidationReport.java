package tw.gc.strategy.validation.services.report;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import tw.gc.strategy.validation.enums.ValidationStatus;
import tw.gc.strategy.validation.enums.ValidatorType;
import tw.gc.strategy.validation.model.ValidationOutcome;
import tw.gc.strategy.validation.services.baseline.BaselineComparisonResult;
import tw.gc.strategy.validation.services.bootstrap.BootstrapResult;
import tw.gc.strategy.validation.services.datasplit.DataSplitResult;
import tw.gc.strategy.validation.services.significance.CombinedSignificance;
import tw.gc.strategy.validation.services.significance.SignificanceResult;
import tw.gc.strategy.validation.services.walkforward.WalkForwardAnalysis;

/**
 * All validator outcomes of one candidate and the overall verdict.
 *
 * @param metric candidate metric the significance and baseline checks ran on, {@code null} if undefined
 * @param outcomes outcome per enabled validator, in pipeline order
 * @param combined point estimate and CI lower bound against the significance threshold,
 *        {@code null} when either was not computed
 */
public record CandidateValidationReport(
    String strategyId,
    Double metric,
    Map<ValidatorType, ValidationOutcome> outcomes,
    CombinedSignificance combined,
    long durationMs
) {
    public CandidateValidationReport {
        if (strategyId == null) {
            throw new IllegalArgumentException("strategyId cannot be null");
        }
        EnumMap<ValidatorType, ValidationOutcome> ordered = new EnumMap<>(ValidatorType.class);
        ordered.putAll(outcomes);
        outcomes = Collections.unmodifiableMap(ordered);
    }

    /**
     * True when every enabled validator passed. A report without validators never passes.
     */
    public boolean passed() {
        return !outcomes.isEmpty() && outcomes.values().stream().allMatch(ValidationOutcome::passed);
    }

    public List<ValidatorType> failingValidators() {
        return outcomes.entrySet().stream()
            .filter(e -> !e.getValue().passed())
            .map(Map.Entry::getKey)
            .toList();
    }

    public long passedCount() {
        return outcomes.values().stream().filter(ValidationOutcome::passed).count();
    }

    public long failedCount() {
        return outcomes.values().stream().filter(o -> o.status() == ValidationStatus.FAILED).count();
    }

    /**
     * Validators that produced no verdict: unavailable, insufficient or degenerate input.
     */
    public long notEvaluatedCount() {
        return outcomes.values().stream().filter(o -> !o.status().isEvaluated()).count();
    }

    public Optional<DataSplitResult> dataSplit() {
        return typed(ValidatorType.DATA_SPLIT, DataSplitResult.class);
    }

    public Optional<WalkForwardAnalysis> walkForward() {
        return typed(ValidatorType.WALK_FORWARD, WalkForwardAnalysis.class);
    }

    public Optional<SignificanceResult> bonferroni() {
        return typed(ValidatorType.BONFERRONI, SignificanceResult.class);
    }

    public Optional<BootstrapResult> bootstrap() {
        return typed(ValidatorType.BOOTSTRAP, BootstrapResult.class);
    }

    public Optional<BaselineComparisonResult> baseline() {
        return typed(ValidatorType.BASELINE, BaselineComparisonResult.class);
    }

    public Optional<ValidationOutcome> outcome(ValidatorType validator) {
        return Optional.ofNullable(outcomes.get(validator));
    }

    private <T extends ValidationOutcome> Optional<T> typed(ValidatorType validator, Class<T> type) {
        ValidationOutcome outcome = outcomes.get(validator);
        return type.isInstance(outcome) ? Optional.of(type.cast(outcome)) : Optional.empty();
    }

    public String summarize() {
        var sb = new StringBuilder();
        sb.append("Validation [%s] %s (metric %s, %dms)%n".formatted(
            strategyId, passed() ? "✅ PASSED" : "❌ FAILED",
            metric == null ? "n/a" : "%.3f".formatted(metric), durationMs));
        outcomes.forEach((validator, outcome) -> sb.append("  • %-12s %-17s %s%n"
            .formatted(validator.getCode(), outcome.status(), outcome.reason())));
        return sb.toString();
    }
}
