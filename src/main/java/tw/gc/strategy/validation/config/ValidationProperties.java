package tw.gc.strategy.validation.config;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import tw.gc.strategy.validation.enums.ThresholdMode;

/**
 * Tunables of the validation pipeline. Every value is optional; the defaults
 * below are the production settings.
 */
@Data
@Component
@ConfigurationProperties(prefix = "validation")
public class ValidationProperties {

    private DataSplit dataSplit = new DataSplit();
    private WalkForward walkForward = new WalkForward();
    private MultipleComparison multipleComparison = new MultipleComparison();
    private Bootstrap bootstrap = new Bootstrap();
    private Baseline baseline = new Baseline();
    private Orchestrator orchestrator = new Orchestrator();

    @Data
    public static class DataSplit {
        // ISO-8601 dates, inclusive
        private String trainStart = "2018-01-01";
        private String trainEnd = "2020-12-31";
        private String validationStart = "2021-01-01";
        private String validationEnd = "2022-12-31";
        private String testStart = "2023-01-01";
        private String testEnd = "2024-12-31";

        /** Minimum observations per period when validating a return series directly. */
        private int minObservations = 252;

        /** Mean metric below which consistency is forced to 0. */
        private double consistencyEpsilon = 0.1;

        private double minTestMetric = 1.0;
        private double minConsistency = 0.6;
        private double minDegradationRatio = 0.7;
    }

    @Data
    public static class WalkForward {
        private int trainingWindow = 252;
        private int testWindow = 63;
        private int stepSize = 63;
        private int minWindows = 3;

        /** Upper bound on evaluated windows; the most recent ones are kept. 0 disables the cap. */
        private int maxWindows = 40;

        /** Also evaluate the training range of each window (doubles the callback count). */
        private boolean evaluateTrainingWindows = false;

        private double minMeanMetric = 0.5;
        private double minWinRate = 0.6;
        private double minWorstMetric = -0.5;
        private double maxMetricStd = 1.0;
    }

    @Data
    public static class MultipleComparison {
        private double alpha = 0.05;

        /** Size of the screened universe; 0 means the number of candidates in the run. */
        private int strategyCount = 0;

        private double conservativeFloor = 0.5;
        private ThresholdMode thresholdMode = ThresholdMode.PARAMETRIC;

        /** Annualized volatility used to calibrate null returns for the bootstrap threshold. */
        private double marketVolatility = 0.22;

        private int bootstrapIterations = 1000;
        private int blockSize = 21;

        /** Percentage gap between bootstrap and parametric thresholds that is flagged. */
        private double divergenceWarningPercent = 20.0;

        /** Maximum estimated false discovery rate accepted when screening a strategy set. */
        private double maxFalseDiscoveryRate = 0.2;

        private Long seed;
    }

    @Data
    public static class Bootstrap {
        private int blockSize = 21;
        private int iterations = 1000;
        private double confidenceLevel = 0.95;
        private int minObservations = 100;
        private double minLowerBound = 0.5;
        private double maxFailedIterationRatio = 0.10;
        private Long seed;
    }

    @Data
    public static class Baseline {
        private List<String> portfolios = new ArrayList<>(List.of("buy_and_hold", "equal_weight", "risk_parity"));
        private double minImprovement = 0.5;
        private double maxUnderperformance = -1.0;

        /** Trailing observations of the candidate used as comparison horizon; 0 means the full series. */
        private int lookbackPeriods = 0;

        /** Basket size of the equal-weight baseline. */
        private int topN = 50;

        /** Trailing window of the risk-parity volatility estimate. */
        private int volatilityWindow = 60;

        /** Column of the return panel used as index proxy. */
        private String indexSymbol = "0050.TW";
    }

    @Data
    public static class Orchestrator {
        /** Validators a candidate must pass; the others are skipped. */
        private List<String> validators = new ArrayList<>(
            List.of("data_split", "walk_forward", "bonferroni", "bootstrap", "baseline"));

        private boolean parallel = false;
        private int parallelism = 4;

        /** Cap on backtest callback invocations per candidate (data split + walk-forward). */
        private int maxEvaluationsPerCandidate = 64;
    }
}
