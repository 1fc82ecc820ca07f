package tw.gc.strategy.validation.services.datasplit;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.validation.config.ValidationProperties;
import tw.gc.strategy.validation.enums.ValidationStatus;
import tw.gc.strategy.validation.exceptions.ValidationException;
import tw.gc.strategy.validation.model.PeriodBounds;
import tw.gc.strategy.validation.model.ReturnSeries;
import tw.gc.strategy.validation.services.datasplit.DataSplitResult.SkippedPeriod;
import tw.gc.strategy.validation.services.metrics.MetricFunction;
import tw.gc.strategy.validation.services.metrics.PeriodEvaluator;
import tw.gc.strategy.validation.services.metrics.ReturnSeriesPeriodEvaluator;
import tw.gc.strategy.validation.services.metrics.ReturnStatistics;

/**
 * Temporal Train/Validation/Test Split Validator
 *
 * <p>Evaluates the strategy on three chronologically ordered, non-overlapping periods:
 * <pre>
 * ┌──────────────────┬──────────────┬──────────────┐
 * │      Train       │  Validation  │     Test     │
 * │   2018 - 2020    │ 2021 - 2022  │ 2023 - 2024  │
 * └──────────────────┴──────────────┴──────────────┘
 * </pre>
 *
 * <p>A strategy passes when all of the following hold:
 * <ul>
 *   <li>test metric &gt; 1.0</li>
 *   <li>consistency (1 - std/mean across periods) &gt; 0.6</li>
 *   <li>test/train degradation ratio &gt; 0.7</li>
 * </ul>
 *
 * <p>A period that cannot be evaluated never lets the strategy pass: the result
 * carries INSUFFICIENT_DATA, DEGENERATE_INPUT or UNAVAILABLE and names the period.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DataSplitValidator {

    private final ValidationProperties properties;

    public DataSplitResult validate(PeriodEvaluator evaluator) {
        return validate(evaluator, DataSplitConfig.from(properties.getDataSplit()));
    }

    /**
     * Validates a precomputed return series, requiring the configured minimum
     * number of observations in every period.
     */
    public DataSplitResult validate(ReturnSeries returns, MetricFunction metric) {
        DataSplitConfig config = DataSplitConfig.from(properties.getDataSplit());
        return validate(new ReturnSeriesPeriodEvaluator(returns, metric, config.minObservations()), config);
    }

    public DataSplitResult validate(PeriodEvaluator evaluator, DataSplitConfig config) {
        Map<SplitPeriod, Double> metrics = new EnumMap<>(SplitPeriod.class);
        List<SkippedPeriod> skipped = new ArrayList<>();

        for (SplitPeriod period : SplitPeriod.values()) {
            PeriodBounds bounds = config.bounds(period);
            try {
                double metric = evaluator.evaluate(bounds);
                if (!Double.isFinite(metric)) {
                    skipped.add(new SkippedPeriod(period, ValidationStatus.DEGENERATE_INPUT,
                        "metric is not finite (%s)".formatted(metric)));
                    continue;
                }
                metrics.put(period, metric);
                log.debug("   {} {}: metric={}", period.getLabel(), bounds, String.format("%.3f", metric));
            } catch (ValidationException e) {
                log.warn("⚠️ Skipping {} period {}: {}", period.getLabel(), bounds, e.getMessage());
                skipped.add(new SkippedPeriod(period, e.status(), e.getMessage()));
            } catch (RuntimeException e) {
                log.error("❌ Backtest callback failed for {} period {}: {}", period.getLabel(), bounds, e.getMessage());
                skipped.add(new SkippedPeriod(period, ValidationStatus.UNAVAILABLE,
                    "evaluation failed: " + e.getMessage()));
            }
        }

        if (!skipped.isEmpty()) {
            ValidationStatus status = dominantStatus(skipped);
            String reason = "Could not evaluate %s".formatted(skipped.stream()
                .map(s -> "%s (%s)".formatted(s.period().getLabel(), s.reason()))
                .toList());
            return new DataSplitResult(status, reason, metrics, 0.0, 0.0, skipped);
        }

        double train = metrics.get(SplitPeriod.TRAIN);
        double test = metrics.get(SplitPeriod.TEST);
        double[] values = {train, metrics.get(SplitPeriod.VALIDATION), test};

        double consistency = consistencyScore(values, config.consistencyEpsilon());
        double degradation = train > 0 ? test / train : 0.0;

        List<String> failures = new ArrayList<>();
        if (!(test > config.minTestMetric())) {
            failures.add("test metric %.3f <= %.2f".formatted(test, config.minTestMetric()));
        }
        if (!(consistency > config.minConsistency())) {
            failures.add("consistency %.3f <= %.2f".formatted(consistency, config.minConsistency()));
        }
        if (!(degradation > config.minDegradationRatio())) {
            failures.add("degradation ratio %.3f <= %.2f".formatted(degradation, config.minDegradationRatio()));
        }

        boolean passed = failures.isEmpty();
        String reason = passed
            ? "test=%.3f, consistency=%.3f, degradation=%.3f".formatted(test, consistency, degradation)
            : String.join("; ", failures);

        log.info("{} Data split: train={} val={} test={} consistency={}",
            passed ? "✅" : "❌",
            String.format("%.3f", train), String.format("%.3f", values[1]), String.format("%.3f", test),
            String.format("%.3f", consistency));

        return new DataSplitResult(passed ? ValidationStatus.PASSED : ValidationStatus.FAILED,
            reason, metrics, consistency, degradation, List.of());
    }

    /**
     * 1 - (sample std / mean) of the period metrics, clamped to [0, 1].
     *
     * <p>A mean below {@code epsilon} yields exactly 0, so losing or flat
     * strategies are never rated consistent. Fewer than two metrics yield 0.
     */
    public static double consistencyScore(double[] metrics, double epsilon) {
        if (metrics.length < 2) {
            return 0.0;
        }
        double mean = ReturnStatistics.mean(metrics);
        if (!(mean >= epsilon)) {
            return 0.0;
        }
        double score = 1.0 - ReturnStatistics.sampleStdDev(metrics) / mean;
        return Math.max(0.0, Math.min(1.0, score));
    }

    // Upstream failures win over data shortage, which wins over degenerate metrics
    private static ValidationStatus dominantStatus(List<SkippedPeriod> skipped) {
        for (ValidationStatus candidate : List.of(ValidationStatus.UNAVAILABLE,
                ValidationStatus.INSUFFICIENT_DATA, ValidationStatus.DEGENERATE_INPUT)) {
            if (skipped.stream().anyMatch(s -> s.status() == candidate)) {
                return candidate;
            }
        }
        return ValidationStatus.UNAVAILABLE;
    }
}
