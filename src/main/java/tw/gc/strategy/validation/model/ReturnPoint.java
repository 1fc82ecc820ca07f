package tw.gc.strategy.validation.model;

import java.time.LocalDate;

/**
 * One dated period return.
 */
public record ReturnPoint(LocalDate date, double value) {

    public ReturnPoint {
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
    }
}
