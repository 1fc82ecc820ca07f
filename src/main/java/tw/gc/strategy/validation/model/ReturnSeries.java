package tw.gc.strategy.validation.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable, chronologically ordered sequence of period returns.
 *
 * <p>Dates are strictly increasing. Gaps between dates (holidays, missing sessions)
 * are tolerated; every consumer works on observation counts, not calendar days.
 */
public final class ReturnSeries {

    private final LocalDate[] dates;
    private final double[] values;

    private ReturnSeries(LocalDate[] dates, double[] values) {
        this.dates = dates;
        this.values = values;
    }

    /**
     * Creates a series from points that must already be in strictly increasing date order.
     */
    public static ReturnSeries of(List<ReturnPoint> points) {
        LocalDate[] dates = new LocalDate[points.size()];
        double[] values = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            ReturnPoint point = points.get(i);
            if (i > 0 && !point.date().isAfter(dates[i - 1])) {
                throw new IllegalArgumentException("Dates must be strictly increasing: %s follows %s"
                    .formatted(point.date(), dates[i - 1]));
            }
            dates[i] = point.date();
            values[i] = point.value();
        }
        return new ReturnSeries(dates, values);
    }

    /**
     * Creates a series from a date-keyed map; ordering comes from the keys.
     */
    public static ReturnSeries of(Map<LocalDate, Double> returnsByDate) {
        SortedMap<LocalDate, Double> sorted = new TreeMap<>(returnsByDate);
        List<ReturnPoint> points = new ArrayList<>(sorted.size());
        sorted.forEach((date, value) -> points.add(new ReturnPoint(date, value == null ? Double.NaN : value)));
        return of(points);
    }

    /**
     * Creates a series on consecutive calendar days starting at {@code start}.
     */
    public static ReturnSeries daily(LocalDate start, double[] returns) {
        LocalDate[] dates = new LocalDate[returns.length];
        for (int i = 0; i < returns.length; i++) {
            dates[i] = start.plusDays(i);
        }
        return new ReturnSeries(dates, returns.clone());
    }

    public static ReturnSeries empty() {
        return new ReturnSeries(new LocalDate[0], new double[0]);
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public LocalDate dateAt(int index) {
        return dates[index];
    }

    public double valueAt(int index) {
        return values[index];
    }

    public LocalDate firstDate() {
        if (isEmpty()) {
            throw new IllegalStateException("Empty return series has no first date");
        }
        return dates[0];
    }

    public LocalDate lastDate() {
        if (isEmpty()) {
            throw new IllegalStateException("Empty return series has no last date");
        }
        return dates[dates.length - 1];
    }

    /**
     * Returns a copy of the raw values.
     */
    public double[] values() {
        return values.clone();
    }

    /**
     * Returns a copy of the values with NaN and infinite entries removed.
     */
    public double[] finiteValues() {
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }

    /**
     * Sub-series over the half-open index range {@code [fromIndex, toIndex)}.
     */
    public ReturnSeries slice(int fromIndex, int toIndex) {
        if (fromIndex < 0 || toIndex > values.length || fromIndex > toIndex) {
            throw new IndexOutOfBoundsException("Invalid slice [%d, %d) of series with %d points"
                .formatted(fromIndex, toIndex, values.length));
        }
        return new ReturnSeries(
            Arrays.copyOfRange(dates, fromIndex, toIndex),
            Arrays.copyOfRange(values, fromIndex, toIndex));
    }

    /**
     * Sub-series of the points whose dates fall inside {@code bounds} (inclusive).
     */
    public ReturnSeries slice(PeriodBounds bounds) {
        int from = lowerIndex(bounds.start());
        int to = lowerIndex(bounds.end().plusDays(1));
        return slice(from, to);
    }

    /**
     * Number of observations inside {@code bounds}.
     */
    public int countWithin(PeriodBounds bounds) {
        return lowerIndex(bounds.end().plusDays(1)) - lowerIndex(bounds.start());
    }

    /**
     * Bounds spanning the observations {@code [fromIndex, toIndex)}.
     */
    public PeriodBounds boundsOf(int fromIndex, int toIndex) {
        if (toIndex - fromIndex < 2) {
            throw new IllegalArgumentException("A period needs at least two observations, got [%d, %d)"
                .formatted(fromIndex, toIndex));
        }
        return new PeriodBounds(dates[fromIndex], dates[toIndex - 1]);
    }

    public List<ReturnPoint> points() {
        List<ReturnPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(new ReturnPoint(dates[i], values[i]));
        }
        return List.copyOf(points);
    }

    // First index whose date is on or after the given date
    private int lowerIndex(LocalDate date) {
        int idx = Arrays.binarySearch(dates, date);
        return idx >= 0 ? idx : -idx - 1;
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "ReturnSeries[empty]";
        }
        return "ReturnSeries[%d points, %s → %s]".formatted(values.length, firstDate(), lastDate());
    }
}
