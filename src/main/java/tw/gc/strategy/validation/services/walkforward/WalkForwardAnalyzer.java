package tw.gc.strategy.validation.services.walkforward;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.validation.config.ValidationProperties;
import tw.gc.strategy.validation.enums.ValidationStatus;
import tw.gc.strategy.validation.exceptions.ValidationException;
import tw.gc.strategy.validation.model.ReturnSeries;
import tw.gc.strategy.validation.services.metrics.MetricFunction;
import tw.gc.strategy.validation.services.metrics.PeriodEvaluator;
import tw.gc.strategy.validation.services.metrics.ReturnSeriesPeriodEvaluator;
import tw.gc.strategy.validation.services.metrics.ReturnStatistics;

/**
 * Walk-Forward Analysis Service
 *
 * <p>Rolls non-overlapping train/test windows over the strategy's history and
 * evaluates each test period out-of-sample. The strategy passes when all hold:
 * <ul>
 *   <li>mean test metric &gt; 0.5</li>
 *   <li>win rate (test metric &gt; 0) &gt; 60%</li>
 *   <li>worst test metric &gt; -0.5</li>
 *   <li>standard deviation of test metrics &lt; 1.0</li>
 * </ul>
 *
 * <p>Too little history or too few successful windows is reported as not
 * evaluable, never as a pass.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WalkForwardAnalyzer {

    private final ValidationProperties properties;

    /**
     * Generates the walk-forward windows over a timeline.
     *
     * <p>The next window's training range starts at the previous window's test end,
     * whatever the step size; the step only enters the minimum-span check. When
     * {@code maxWindows} is set, only the most recent windows are kept.
     *
     * @return generated windows, empty when the timeline is shorter than
     *         {@link WalkForwardConfig#minimumRequiredPeriods()}
     */
    public List<WalkForwardWindow> generateWindows(ReturnSeries timeline, WalkForwardConfig config) {
        List<WalkForwardWindow> windows = new ArrayList<>();
        int totalPeriods = timeline.size();
        int required = config.minimumRequiredPeriods();

        if (totalPeriods < required) {
            log.warn("Insufficient data: {} periods available, {} required for {} windows",
                totalPeriods, required, config.minWindows());
            return windows;
        }

        int windowIndex = 0;
        int trainFrom = 0;
        while (trainFrom + config.trainingWindow() + config.testWindow() <= totalPeriods) {
            int trainTo = trainFrom + config.trainingWindow();
            int testTo = trainTo + config.testWindow();
            windows.add(new WalkForwardWindow(
                windowIndex++,
                trainFrom, trainTo,
                trainTo, testTo,
                timeline.boundsOf(trainFrom, trainTo),
                timeline.boundsOf(trainTo, testTo)
            ));
            trainFrom = testTo;
        }

        if (config.maxWindows() > 0 && windows.size() > config.maxWindows()) {
            log.info("   Capping {} windows to the most recent {}", windows.size(), config.maxWindows());
            return List.copyOf(windows.subList(windows.size() - config.maxWindows(), windows.size()));
        }
        return windows;
    }

    public WalkForwardAnalysis analyze(ReturnSeries returns, MetricFunction metric) {
        return analyze(returns, metric, WalkForwardConfig.from(properties.getWalkForward()));
    }

    /**
     * Analyzes a precomputed return series; a window needs at least half its
     * length in finite observations.
     */
    public WalkForwardAnalysis analyze(ReturnSeries returns, MetricFunction metric, WalkForwardConfig config) {
        int minObservations = Math.max(2, config.testWindow() / 2);
        return analyze(returns, new ReturnSeriesPeriodEvaluator(returns, metric, minObservations), config);
    }

    public WalkForwardAnalysis analyze(ReturnSeries timeline, PeriodEvaluator evaluator) {
        return analyze(timeline, evaluator, WalkForwardConfig.from(properties.getWalkForward()));
    }

    /**
     * Runs the analysis, calling {@code evaluator} once per window test period
     * (twice per window when training periods are evaluated too).
     *
     * @param timeline dated periods the windows are laid over
     */
    public WalkForwardAnalysis analyze(ReturnSeries timeline, PeriodEvaluator evaluator, WalkForwardConfig config) {
        List<WalkForwardWindow> windows = generateWindows(timeline, config);
        log.info("🚀 Walk-forward: {} periods, {} windows (train={}, test={}, step={})",
            timeline.size(), windows.size(), config.trainingWindow(), config.testWindow(), config.stepSize());

        if (windows.size() < config.minWindows()) {
            String reason = "Only %d windows from %d periods; %d windows required (train=%d, test=%d, step=%d)"
                .formatted(windows.size(), timeline.size(), config.minWindows(),
                    config.trainingWindow(), config.testWindow(), config.stepSize());
            log.warn("⚠️ {}", reason);
            return WalkForwardAnalysis.notEvaluable(ValidationStatus.INSUFFICIENT_DATA, reason,
                List.of(), config.stepSize());
        }

        List<WindowEvaluation> evaluations = new ArrayList<>(windows.size());
        for (WalkForwardWindow window : windows) {
            log.debug("📊 Processing {}", window.describe());
            evaluations.add(evaluateWindow(window, evaluator, config));
        }

        double[] metrics = evaluations.stream()
            .filter(WindowEvaluation::succeeded)
            .mapToDouble(WindowEvaluation::testMetric)
            .toArray();

        if (metrics.length < config.minWindows()) {
            boolean upstream = evaluations.stream()
                .anyMatch(e -> e.errorStatus() == ValidationStatus.UNAVAILABLE);
            String reason = "Insufficient successful windows: %d of %d, %d required"
                .formatted(metrics.length, evaluations.size(), config.minWindows());
            log.warn("⚠️ {}", reason);
            return WalkForwardAnalysis.notEvaluable(
                upstream ? ValidationStatus.UNAVAILABLE : ValidationStatus.INSUFFICIENT_DATA,
                reason, evaluations, config.stepSize());
        }

        double mean = ReturnStatistics.mean(metrics);
        double std = ReturnStatistics.sampleStdDev(metrics);
        double winRate = (double) Arrays.stream(metrics).filter(m -> m > 0).count() / metrics.length;
        double worst = ReturnStatistics.min(metrics);
        double best = ReturnStatistics.max(metrics);
        double avgRobustness = evaluations.stream()
            .mapToDouble(WindowEvaluation::robustnessScore)
            .filter(Double::isFinite)
            .average().orElse(Double.NaN);

        List<String> failures = new ArrayList<>();
        if (!(mean > config.minMeanMetric())) {
            failures.add("mean %.3f <= %.2f".formatted(mean, config.minMeanMetric()));
        }
        if (!(winRate > config.minWinRate())) {
            failures.add("win rate %.1f%% <= %.1f%%".formatted(winRate * 100, config.minWinRate() * 100));
        }
        if (!(worst > config.minWorstMetric())) {
            failures.add("worst window %.3f <= %.2f".formatted(worst, config.minWorstMetric()));
        }
        if (!(std < config.maxMetricStd())) {
            failures.add("std %.3f >= %.2f".formatted(std, config.maxMetricStd()));
        }

        boolean passed = failures.isEmpty();
        String reason = passed
            ? "mean=%.3f, win rate=%.1f%%, worst=%.3f over %d windows"
                .formatted(mean, winRate * 100, worst, metrics.length)
            : String.join("; ", failures);

        log.info("{} Walk-forward: mean={} std={} winRate={}% worst={} ({} windows)",
            passed ? "✅" : "❌",
            String.format("%.3f", mean), String.format("%.3f", std),
            String.format("%.1f", winRate * 100), String.format("%.3f", worst), metrics.length);

        return new WalkForwardAnalysis(
            passed ? ValidationStatus.PASSED : ValidationStatus.FAILED,
            reason,
            evaluations,
            config.stepSize(),
            metrics.length,
            mean, std, winRate, worst, best, avgRobustness);
    }

    private WindowEvaluation evaluateWindow(WalkForwardWindow window, PeriodEvaluator evaluator,
                                            WalkForwardConfig config) {
        double testMetric;
        try {
            testMetric = evaluator.evaluate(window.test());
        } catch (ValidationException e) {
            log.warn("   ⚠️ Window {} skipped: {}", window.windowIndex(), e.getMessage());
            return WindowEvaluation.failure(window, e.status(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("   ❌ Window {} evaluation failed: {}", window.windowIndex(), e.getMessage());
            return WindowEvaluation.failure(window, ValidationStatus.UNAVAILABLE,
                "evaluation failed: " + e.getMessage());
        }
        if (!Double.isFinite(testMetric)) {
            return WindowEvaluation.failure(window, ValidationStatus.DEGENERATE_INPUT,
                "metric is not finite (%s)".formatted(testMetric));
        }

        Double trainMetric = null;
        if (config.evaluateTrainingWindows()) {
            try {
                double inSample = evaluator.evaluate(window.train());
                trainMetric = Double.isFinite(inSample) ? inSample : null;
            } catch (RuntimeException e) {
                log.warn("   ⚠️ In-sample evaluation of window {} failed: {}", window.windowIndex(), e.getMessage());
            }
        }
        return WindowEvaluation.success(window, testMetric, trainMetric);
    }
}
