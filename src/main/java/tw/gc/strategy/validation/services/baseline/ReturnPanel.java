package tw.gc.strategy.validation.services.baseline;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import tw.gc.strategy.validation.model.ReturnSeries;

/**
 * Asset returns aligned on the union of their dates; missing observations are NaN.
 *
 * <p>Optional ranking scores (e.g. market capitalization) share the same calendar
 * and drive the selection of the equal-weight basket.
 */
public final class ReturnPanel {

    private final LocalDate[] dates;
    private final Map<String, double[]> returns;
    private final Map<String, double[]> scores;

    private ReturnPanel(LocalDate[] dates, Map<String, double[]> returns, Map<String, double[]> scores) {
        this.dates = dates;
        this.returns = returns;
        this.scores = scores;
    }

    public static ReturnPanel of(Map<String, ReturnSeries> assetReturns) {
        return of(assetReturns, Map.of());
    }

    public static ReturnPanel of(Map<String, ReturnSeries> assetReturns, Map<String, ReturnSeries> rankingScores) {
        if (assetReturns.isEmpty()) {
            throw new IllegalArgumentException("panel needs at least one asset");
        }
        Set<LocalDate> calendar = new TreeSet<>();
        assetReturns.values().forEach(series -> series.points().forEach(p -> calendar.add(p.date())));
        LocalDate[] dates = calendar.toArray(new LocalDate[0]);
        return new ReturnPanel(dates, align(dates, assetReturns), align(dates, rankingScores));
    }

    private static Map<String, double[]> align(LocalDate[] dates, Map<String, ReturnSeries> columns) {
        Map<String, double[]> aligned = new LinkedHashMap<>();
        columns.forEach((symbol, series) -> {
            double[] values = new double[dates.length];
            Arrays.fill(values, Double.NaN);
            series.points().forEach(p -> {
                int idx = Arrays.binarySearch(dates, p.date());
                if (idx >= 0) {
                    values[idx] = p.value();
                }
            });
            aligned.put(symbol, values);
        });
        return aligned;
    }

    public int size() {
        return dates.length;
    }

    public LocalDate dateAt(int index) {
        return dates[index];
    }

    public Set<String> symbols() {
        return returns.keySet();
    }

    public boolean hasSymbol(String symbol) {
        return returns.containsKey(symbol);
    }

    public boolean hasScores() {
        return !scores.isEmpty();
    }

    public double returnAt(String symbol, int index) {
        return returns.get(symbol)[index];
    }

    public double scoreAt(String symbol, int index) {
        double[] column = scores.get(symbol);
        return column == null ? Double.NaN : column[index];
    }
}
