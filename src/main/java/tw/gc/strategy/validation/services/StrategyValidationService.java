package tw.gc.strategy.validation.services;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.validation.config.ValidationProperties;
import tw.gc.strategy.validation.enums.ValidationStatus;
import tw.gc.strategy.validation.enums.ValidatorType;
import tw.gc.strategy.validation.exceptions.ValidationException;
import tw.gc.strategy.validation.model.StrategyCandidate;
import tw.gc.strategy.validation.model.ValidationOutcome;
import tw.gc.strategy.validation.services.baseline.BaselineComparator;
import tw.gc.strategy.validation.services.baseline.BaselineSimulator;
import tw.gc.strategy.validation.services.bootstrap.BlockBootstrapEngine;
import tw.gc.strategy.validation.services.bootstrap.BootstrapResult;
import tw.gc.strategy.validation.services.datasplit.DataSplitValidator;
import tw.gc.strategy.validation.services.metrics.MetricFunction;
import tw.gc.strategy.validation.services.metrics.SharpeRatio;
import tw.gc.strategy.validation.services.report.BatchValidationReport;
import tw.gc.strategy.validation.services.report.CandidateValidationReport;
import tw.gc.strategy.validation.services.report.ValidatorFailure;
import tw.gc.strategy.validation.services.significance.BonferroniCorrector;
import tw.gc.strategy.validation.services.significance.CombinedSignificance;
import tw.gc.strategy.validation.services.significance.CorrectionContext;
import tw.gc.strategy.validation.services.significance.MultipleComparisonConfig;
import tw.gc.strategy.validation.services.significance.SignificanceResult;
import tw.gc.strategy.validation.services.significance.StrategySetSignificance;
import tw.gc.strategy.validation.services.walkforward.WalkForwardAnalyzer;
import tw.gc.strategy.validation.services.walkforward.WalkForwardConfig;

/**
 * Strategy Validation Orchestrator
 *
 * <p>Runs every enabled validator on each candidate and aggregates the verdicts:
 * <pre>
 *   data split → walk-forward → Bonferroni → bootstrap CI → baseline
 * </pre>
 * A validator that fails still reports, and one that throws is recorded as
 * UNAVAILABLE without stopping the others. A candidate passes only when every
 * enabled validator passed.
 *
 * <p>Candidates of a batch share one {@link ValidationRun}: the Bonferroni N is the
 * batch size (or the configured screening universe) and baselines are simulated
 * once per date range. In parallel mode candidates, or the validators of a single
 * candidate, run on a bounded pool owned by this service.
 */
@Service
@Slf4j
public class StrategyValidationService {

    /** Evaluator calls of the data split: train, validation, test. */
    static final int DATA_SPLIT_EVALUATIONS = 3;

    private final ValidationProperties properties;
    private final DataSplitValidator dataSplitValidator;
    private final WalkForwardAnalyzer walkForwardAnalyzer;
    private final BonferroniCorrector bonferroniCorrector;
    private final BlockBootstrapEngine bootstrapEngine;
    private final BaselineComparator baselineComparator;
    private final ObjectProvider<BaselineSimulator> baselineSimulatorProvider;

    private volatile ExecutorService executor;

    public StrategyValidationService(ValidationProperties properties,
                                     DataSplitValidator dataSplitValidator,
                                     WalkForwardAnalyzer walkForwardAnalyzer,
                                     BonferroniCorrector bonferroniCorrector,
                                     BlockBootstrapEngine bootstrapEngine,
                                     BaselineComparator baselineComparator,
                                     ObjectProvider<BaselineSimulator> baselineSimulatorProvider) {
        this.properties = properties;
        this.dataSplitValidator = dataSplitValidator;
        this.walkForwardAnalyzer = walkForwardAnalyzer;
        this.bonferroniCorrector = bonferroniCorrector;
        this.bootstrapEngine = bootstrapEngine;
        this.baselineComparator = baselineComparator;
        this.baselineSimulatorProvider = baselineSimulatorProvider;
    }

    /**
     * Opens a run for {@code candidateCount} candidates, using the baseline simulator
     * bean when one is registered.
     */
    public ValidationRun newRun(int candidateCount) {
        return newRun(candidateCount, baselineSimulatorProvider.getIfAvailable());
    }

    public ValidationRun newRun(int candidateCount, BaselineSimulator baselineSimulator) {
        MultipleComparisonConfig config = MultipleComparisonConfig.from(properties.getMultipleComparison());
        ValidationRun run = ValidationRun.create(config.effectiveStrategyCount(candidateCount), baselineSimulator);
        log.info("🚀 Opened {} for {} candidates", run, candidateCount);
        return run;
    }

    /**
     * Validates a single candidate in its own run with N = max(1, configured universe).
     */
    public CandidateValidationReport validate(StrategyCandidate candidate) {
        return validate(newRun(1), candidate);
    }

    public CandidateValidationReport validate(ValidationRun run, StrategyCandidate candidate) {
        return validateCandidate(run, candidate, properties.getOrchestrator().isParallel());
    }

    public BatchValidationReport validateBatch(List<StrategyCandidate> candidates) {
        return validateBatch(candidates, baselineSimulatorProvider.getIfAvailable());
    }

    /**
     * Validates candidates independently in one run. A candidate that cannot be
     * validated at all is reported with every validator UNAVAILABLE; the batch
     * always completes.
     */
    public BatchValidationReport validateBatch(List<StrategyCandidate> candidates, BaselineSimulator simulator) {
        long start = System.currentTimeMillis();
        ValidationRun run = newRun(candidates.size(), simulator);
        log.info("📊 Validating batch of {} candidates ({})", candidates.size(),
            properties.getOrchestrator().isParallel() ? "parallel" : "sequential");

        List<CandidateValidationReport> reports = properties.getOrchestrator().isParallel()
            ? validateInParallel(run, candidates)
            : candidates.stream().map(c -> validateIsolated(run, c)).toList();

        StrategySetSignificance strategySet = screenBatch(run, reports, candidates);
        BatchValidationReport batch = new BatchValidationReport(run.getId(), run.getStrategyCount(), reports,
            strategySet, System.currentTimeMillis() - start);

        log.info("✅ Batch {} complete: {}/{} passed ({}%)", run.getId(), batch.passedCandidates(),
            batch.totalCandidates(), String.format("%.1f", batch.passRate() * 100));
        return batch;
    }

    private List<CandidateValidationReport> validateInParallel(ValidationRun run, List<StrategyCandidate> candidates) {
        ExecutorService pool = executor();
        List<Future<CandidateValidationReport>> futures = new ArrayList<>(candidates.size());
        for (StrategyCandidate candidate : candidates) {
            futures.add(pool.submit(() -> validateIsolated(run, candidate)));
        }
        List<CandidateValidationReport> reports = new ArrayList<>(candidates.size());
        for (int i = 0; i < futures.size(); i++) {
            reports.add(awaitCandidate(futures.get(i), candidates.get(i)));
        }
        return reports;
    }

    private CandidateValidationReport awaitCandidate(Future<CandidateValidationReport> future,
                                                     StrategyCandidate candidate) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return unavailableReport(candidate, "interrupted");
        } catch (ExecutionException e) {
            return unavailableReport(candidate, String.valueOf(e.getCause()));
        }
    }

    // Validators of a batch candidate run sequentially; the pool is busy with candidates
    private CandidateValidationReport validateIsolated(ValidationRun run, StrategyCandidate candidate) {
        try {
            return validateCandidate(run, candidate, false);
        } catch (RuntimeException e) {
            log.error("❌ Candidate {} could not be validated: {}", candidate.id(), e.getMessage(), e);
            return unavailableReport(candidate, e.getMessage());
        }
    }

    private CandidateValidationReport validateCandidate(ValidationRun run, StrategyCandidate candidate,
                                                        boolean parallelValidators) {
        long start = System.currentTimeMillis();
        MetricFunction metric = SharpeRatio.annualized();
        double candidateMetric = candidate.reportedMetric() != null
            ? candidate.reportedMetric()
            : metric.compute(candidate.returns().finiteValues());
        log.info("🚀 Validating {} ({}, metric {})", candidate.id(), candidate.returns(),
            String.format("%.3f", candidateMetric));

        Map<ValidatorType, Supplier<ValidationOutcome>> steps = new LinkedHashMap<>();
        Set<ValidatorType> enabled = enabledValidators();
        if (enabled.contains(ValidatorType.DATA_SPLIT)) {
            steps.put(ValidatorType.DATA_SPLIT, () -> candidate.evaluator() != null
                ? dataSplitValidator.validate(candidate.evaluator())
                : dataSplitValidator.validate(candidate.returns(), metric));
        }
        if (enabled.contains(ValidatorType.WALK_FORWARD)) {
            WalkForwardConfig config = budgetedWalkForwardConfig();
            steps.put(ValidatorType.WALK_FORWARD, () -> candidate.evaluator() != null
                ? walkForwardAnalyzer.analyze(candidate.returns(), candidate.evaluator(), config)
                : walkForwardAnalyzer.analyze(candidate.returns(), metric, config));
        }
        if (enabled.contains(ValidatorType.BONFERRONI)) {
            steps.put(ValidatorType.BONFERRONI, () -> significance(run, candidate, candidateMetric));
        }
        if (enabled.contains(ValidatorType.BOOTSTRAP)) {
            steps.put(ValidatorType.BOOTSTRAP, () -> bootstrapEngine.estimate(candidate.returns(), metric));
        }
        if (enabled.contains(ValidatorType.BASELINE)) {
            steps.put(ValidatorType.BASELINE, () -> baseline(run, candidate, candidateMetric));
        }

        Map<ValidatorType, ValidationOutcome> outcomes = parallelValidators
            ? runInParallel(candidate, steps)
            : runSequentially(candidate, steps);

        CombinedSignificance combined = combinedSignificance(run, candidate, candidateMetric, outcomes);
        CandidateValidationReport report = new CandidateValidationReport(candidate.id(),
            Double.isFinite(candidateMetric) ? candidateMetric : null, outcomes, combined,
            System.currentTimeMillis() - start);

        log.info("{} {}: {} passed, {} failed, {} not evaluated", report.passed() ? "✅" : "❌",
            candidate.id(), report.passedCount(), report.failedCount(), report.notEvaluatedCount());
        return report;
    }

    private Map<ValidatorType, ValidationOutcome> runSequentially(StrategyCandidate candidate,
                                                                  Map<ValidatorType, Supplier<ValidationOutcome>> steps) {
        Map<ValidatorType, ValidationOutcome> outcomes = new EnumMap<>(ValidatorType.class);
        steps.forEach((validator, step) -> outcomes.put(validator, runGuarded(candidate, validator, step)));
        return outcomes;
    }

    private Map<ValidatorType, ValidationOutcome> runInParallel(StrategyCandidate candidate,
                                                                Map<ValidatorType, Supplier<ValidationOutcome>> steps) {
        ExecutorService pool = executor();
        Map<ValidatorType, Future<ValidationOutcome>> futures = new EnumMap<>(ValidatorType.class);
        steps.forEach((validator, step) ->
            futures.put(validator, pool.submit(() -> runGuarded(candidate, validator, step))));

        Map<ValidatorType, ValidationOutcome> outcomes = new EnumMap<>(ValidatorType.class);
        futures.forEach((validator, future) -> {
            try {
                outcomes.put(validator, future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcomes.put(validator, new ValidatorFailure(validator, ValidationStatus.UNAVAILABLE, "interrupted"));
            } catch (ExecutionException e) {
                outcomes.put(validator, new ValidatorFailure(validator, ValidationStatus.UNAVAILABLE,
                    String.valueOf(e.getCause())));
            }
        });
        return outcomes;
    }

    private ValidationOutcome runGuarded(StrategyCandidate candidate, ValidatorType validator,
                                         Supplier<ValidationOutcome> step) {
        try {
            return step.get();
        } catch (ValidationException e) {
            log.warn("⚠️ {} {} not evaluable: {}", candidate.id(), validator.getCode(), e.getMessage());
            return new ValidatorFailure(validator, e.status(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("❌ {} {} failed: {}", candidate.id(), validator.getCode(), e.getMessage(), e);
            return new ValidatorFailure(validator, ValidationStatus.UNAVAILABLE,
                "%s: %s".formatted(e.getClass().getSimpleName(), e.getMessage()));
        }
    }

    private ValidationOutcome significance(ValidationRun run, StrategyCandidate candidate, double candidateMetric) {
        int observations = candidate.returns().finiteValues().length;
        if (observations < 2) {
            return new ValidatorFailure(ValidatorType.BONFERRONI, ValidationStatus.INSUFFICIENT_DATA,
                "Insufficient data: %d observations, 2 required".formatted(observations));
        }
        return bonferroniCorrector.evaluate(candidateMetric, correctionContext(run, observations));
    }

    private ValidationOutcome baseline(ValidationRun run, StrategyCandidate candidate, double candidateMetric) {
        if (run.getBaselineSimulator() == null) {
            return new ValidatorFailure(ValidatorType.BASELINE, ValidationStatus.UNAVAILABLE,
                "No baseline simulator configured");
        }
        return baselineComparator.compare(candidateMetric, candidate.returns(),
            run.getBaselineSimulator(), run.getBaselineCache());
    }

    private CombinedSignificance combinedSignificance(ValidationRun run, StrategyCandidate candidate,
                                                      double candidateMetric,
                                                      Map<ValidatorType, ValidationOutcome> outcomes) {
        if (!(outcomes.get(ValidatorType.BONFERRONI) instanceof SignificanceResult significance)
                || !(outcomes.get(ValidatorType.BOOTSTRAP) instanceof BootstrapResult bootstrap)
                || !Double.isFinite(bootstrap.ciLower())) {
            return null;
        }
        CorrectionContext context = correctionContext(run, significance.observations());
        return bonferroniCorrector.combinedCheck(candidateMetric, bootstrap, context);
    }

    private CorrectionContext correctionContext(ValidationRun run, int observations) {
        return run.correctionContext(observations,
            t -> bonferroniCorrector.createContext(run.getStrategyCount(), t));
    }

    private StrategySetSignificance screenBatch(ValidationRun run, List<CandidateValidationReport> reports,
                                                List<StrategyCandidate> candidates) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        int observations = Integer.MAX_VALUE;
        for (int i = 0; i < reports.size(); i++) {
            CandidateValidationReport report = reports.get(i);
            int finite = candidates.get(i).returns().finiteValues().length;
            if (report.metric() != null && finite >= 2) {
                metrics.put(report.strategyId(), report.metric());
                observations = Math.min(observations, finite);
            }
        }
        if (metrics.isEmpty()) {
            return null;
        }
        try {
            return bonferroniCorrector.screenStrategySet(metrics, correctionContext(run, observations));
        } catch (RuntimeException e) {
            log.error("❌ Strategy set screening failed: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Walk-forward settings with the window cap derived from the per-candidate
     * evaluation budget, never below the minimum window count.
     */
    WalkForwardConfig budgetedWalkForwardConfig() {
        WalkForwardConfig config = WalkForwardConfig.from(properties.getWalkForward());
        int budget = properties.getOrchestrator().getMaxEvaluationsPerCandidate();
        if (budget <= 0) {
            return config;
        }
        int affordable = Math.max(config.minWindows(),
            (budget - DATA_SPLIT_EVALUATIONS) / config.evaluationsPerWindow());
        int cap = config.maxWindows() > 0 ? Math.min(config.maxWindows(), affordable) : affordable;
        return config.withMaxWindows(cap);
    }

    Set<ValidatorType> enabledValidators() {
        Set<ValidatorType> enabled = EnumSet.noneOf(ValidatorType.class);
        properties.getOrchestrator().getValidators().forEach(code -> enabled.add(ValidatorType.fromCode(code)));
        return enabled;
    }

    private CandidateValidationReport unavailableReport(StrategyCandidate candidate, String reason) {
        Map<ValidatorType, ValidationOutcome> outcomes = new EnumMap<>(ValidatorType.class);
        enabledValidators().forEach(v -> outcomes.put(v,
            new ValidatorFailure(v, ValidationStatus.UNAVAILABLE, reason)));
        return new CandidateValidationReport(candidate.id(), null, outcomes, null, 0);
    }

    private ExecutorService executor() {
        ExecutorService current = executor;
        if (current == null) {
            synchronized (this) {
                current = executor;
                if (current == null) {
                    int threads = Math.max(1, properties.getOrchestrator().getParallelism());
                    current = Executors.newFixedThreadPool(threads);
                    executor = current;
                    log.info("Started validation pool with {} threads", threads);
                }
            }
        }
        return current;
    }

    /**
     * Shutdown the validation pool on application shutdown
     */
    @PreDestroy
    public void shutdown() {
        ExecutorService current = executor;
        if (current == null) {
            return;
        }
        log.info("🛑 Shutting down validation pool");
        current.shutdown();
        try {
            if (!current.awaitTermination(30, TimeUnit.SECONDS)) {
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            current.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
