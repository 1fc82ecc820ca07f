package tw.gc.strategy.validation.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * A contiguous date range, inclusive on both ends.
 *
 * @param start first date of the range
 * @param end last date of the range, strictly after {@code start}
 */
public record PeriodBounds(LocalDate start, LocalDate end) {

    public PeriodBounds {
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end must be non-null");
        }
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("start (%s) must be before end (%s)".formatted(start, end));
        }
    }

    public static PeriodBounds of(String start, String end) {
        return new PeriodBounds(LocalDate.parse(start), LocalDate.parse(end));
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    /**
     * True when the two ranges share at least one date.
     */
    public boolean overlaps(PeriodBounds other) {
        return !end.isBefore(other.start) && !other.end.isBefore(start);
    }

    public long calendarDays() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    @Override
    public String toString() {
        return "[%s → %s]".formatted(start, end);
    }
}
