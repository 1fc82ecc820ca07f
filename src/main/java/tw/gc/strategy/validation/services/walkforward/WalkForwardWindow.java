package tw.gc.strategy.validation.services.walkforward;

import tw.gc.strategy.validation.model.PeriodBounds;

/**
 * A single walk-forward window with a training and a test period.
 *
 * <p>Windows roll forward without overlap: the training period of the next window
 * starts where the test period of this one ends.
 * <pre>
 * ┌──────────────┬──────────┬──────────────┬──────────┐
 * │  Training 1  │  Test 1  │  Training 2  │  Test 2  │
 * └──────────────┴──────────┴──────────────┴──────────┘
 *    252 periods   63 periods
 * </pre>
 *
 * @param windowIndex zero-based position of the window in the generated sequence
 * @param trainFrom first period index of the training range, inclusive
 * @param trainTo end of the training range, exclusive
 * @param testFrom first period index of the test range, inclusive
 * @param testTo end of the test range, exclusive
 * @param train dates spanned by the training range
 * @param test dates spanned by the test range
 */
public record WalkForwardWindow(
    int windowIndex,
    int trainFrom,
    int trainTo,
    int testFrom,
    int testTo,
    PeriodBounds train,
    PeriodBounds test
) {
    public WalkForwardWindow {
        if (windowIndex < 0) {
            throw new IllegalArgumentException("windowIndex must be non-negative, got: %d".formatted(windowIndex));
        }
        if (train == null || test == null) {
            throw new IllegalArgumentException("train and test bounds must be non-null");
        }
        if (trainFrom < 0 || trainFrom >= trainTo) {
            throw new IllegalArgumentException("invalid training range [%d, %d)".formatted(trainFrom, trainTo));
        }
        if (testFrom >= testTo) {
            throw new IllegalArgumentException("invalid test range [%d, %d)".formatted(testFrom, testTo));
        }
        if (trainTo > testFrom) {
            throw new IllegalArgumentException("training range ends at %d after test start %d"
                .formatted(trainTo, testFrom));
        }
        if (!train.end().isBefore(test.start())) {
            throw new IllegalArgumentException("train %s must end before test %s starts".formatted(train, test));
        }
    }

    public int trainLength() {
        return trainTo - trainFrom;
    }

    public int testLength() {
        return testTo - testFrom;
    }

    public String describe() {
        return "Window %d: Train %s (%d periods) | Test %s (%d periods)"
            .formatted(windowIndex, train, trainLength(), test, testLength());
    }
}
