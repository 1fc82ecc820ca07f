package tw.gc.strategy.validation.services.baseline;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.validation.config.ValidationProperties;
import tw.gc.strategy.validation.enums.BaselinePortfolio;
import tw.gc.strategy.validation.model.PeriodBounds;
import tw.gc.strategy.validation.model.ReturnPoint;
import tw.gc.strategy.validation.model.ReturnSeries;
import tw.gc.strategy.validation.services.metrics.ReturnStatistics;

/**
 * Simulates the reference portfolios on a panel of asset returns.
 *
 * <p>Weights decided on one period are applied to the next period's returns, so no
 * baseline trades on information it could not have had. A missing asset return
 * contributes nothing.
 */
@Slf4j
public class ReturnPanelBaselineSimulator implements BaselineSimulator {

    private final ReturnPanel panel;
    private final String indexSymbol;
    private final int topN;
    private final int volatilityWindow;

    public ReturnPanelBaselineSimulator(ReturnPanel panel, String indexSymbol, int topN, int volatilityWindow) {
        if (panel == null) {
            throw new IllegalArgumentException("panel cannot be null");
        }
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be >= 1, got: " + topN);
        }
        if (volatilityWindow < 2) {
            throw new IllegalArgumentException("volatilityWindow must be >= 2, got: " + volatilityWindow);
        }
        this.panel = panel;
        this.indexSymbol = indexSymbol;
        this.topN = topN;
        this.volatilityWindow = volatilityWindow;
    }

    public ReturnPanelBaselineSimulator(ReturnPanel panel, ValidationProperties.Baseline properties) {
        this(panel, properties.getIndexSymbol(), properties.getTopN(), properties.getVolatilityWindow());
    }

    @Override
    public ReturnSeries simulate(BaselinePortfolio portfolio, PeriodBounds bounds) {
        ReturnSeries full = switch (portfolio) {
            case BUY_AND_HOLD_INDEX -> buyAndHoldIndex();
            case EQUAL_WEIGHT_TOP_N -> equalWeightTopN();
            case RISK_PARITY -> riskParity();
        };
        return full.slice(bounds);
    }

    ReturnSeries buyAndHoldIndex() {
        List<ReturnPoint> points = new ArrayList<>();
        boolean proxy = indexSymbol == null || !panel.hasSymbol(indexSymbol);
        if (proxy) {
            log.warn("⚠️ {} not in panel, using the cross-sectional average as index proxy", indexSymbol);
        }
        for (int t = 0; t < panel.size(); t++) {
            double value = proxy ? crossSectionalMean(t) : panel.returnAt(indexSymbol, t);
            if (Double.isFinite(value)) {
                points.add(new ReturnPoint(panel.dateAt(t), value));
            }
        }
        return ReturnSeries.of(points);
    }

    /**
     * Holds the top N assets by the previous period's score at 1/N each. Without
     * scores every asset with a return on the previous period qualifies.
     */
    ReturnSeries equalWeightTopN() {
        List<ReturnPoint> points = new ArrayList<>();
        for (int t = 1; t < panel.size(); t++) {
            int decision = t - 1;
            List<String> basket = selectBasket(decision);
            if (basket.isEmpty()) {
                continue;
            }
            double weight = 1.0 / (panel.hasScores() ? topN : basket.size());
            double portfolio = 0.0;
            for (String symbol : basket) {
                double r = panel.returnAt(symbol, t);
                if (Double.isFinite(r)) {
                    portfolio += weight * r;
                }
            }
            points.add(new ReturnPoint(panel.dateAt(t), portfolio));
        }
        return ReturnSeries.of(points);
    }

    /**
     * Weights each asset by the inverse of its trailing sample volatility.
     */
    ReturnSeries riskParity() {
        List<ReturnPoint> points = new ArrayList<>();
        for (int t = volatilityWindow; t < panel.size(); t++) {
            Map<String, Double> weights = inverseVolatilityWeights(t - 1);
            if (weights.isEmpty()) {
                continue;
            }
            double portfolio = 0.0;
            for (Map.Entry<String, Double> entry : weights.entrySet()) {
                double r = panel.returnAt(entry.getKey(), t);
                if (Double.isFinite(r)) {
                    portfolio += entry.getValue() * r;
                }
            }
            points.add(new ReturnPoint(panel.dateAt(t), portfolio));
        }
        return ReturnSeries.of(points);
    }

    private List<String> selectBasket(int index) {
        if (!panel.hasScores()) {
            return panel.symbols().stream()
                .filter(symbol -> Double.isFinite(panel.returnAt(symbol, index)))
                .limit(topN)
                .toList();
        }
        return panel.symbols().stream()
            .filter(symbol -> Double.isFinite(panel.scoreAt(symbol, index)))
            .sorted(Comparator.comparingDouble((String symbol) -> panel.scoreAt(symbol, index)).reversed())
            .limit(topN)
            .toList();
    }

    // Window ends at and includes the decision index
    private Map<String, Double> inverseVolatilityWeights(int index) {
        Map<String, Double> inverse = new HashMap<>();
        double total = 0.0;
        for (String symbol : panel.symbols()) {
            double[] window = new double[volatilityWindow];
            int count = 0;
            for (int i = index - volatilityWindow + 1; i <= index; i++) {
                double r = panel.returnAt(symbol, i);
                if (Double.isFinite(r)) {
                    window[count++] = r;
                }
            }
            if (count < volatilityWindow) {
                continue;
            }
            double vol = ReturnStatistics.sampleStdDev(window);
            if (vol > 0 && Double.isFinite(vol)) {
                inverse.put(symbol, 1.0 / vol);
                total += 1.0 / vol;
            }
        }
        if (total > 0) {
            final double sum = total;
            inverse.replaceAll((symbol, w) -> w / sum);
        }
        return inverse;
    }

    private double crossSectionalMean(int index) {
        double sum = 0.0;
        int count = 0;
        for (String symbol : panel.symbols()) {
            double r = panel.returnAt(symbol, index);
            if (Double.isFinite(r)) {
                sum += r;
                count++;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }
}
