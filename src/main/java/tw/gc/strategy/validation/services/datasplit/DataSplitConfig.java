package tw.gc.strategy.validation.services.datasplit;

import tw.gc.strategy.validation.config.ValidationProperties;
import tw.gc.strategy.validation.model.PeriodBounds;

/**
 * Partitions and pass criteria of the temporal split validation.
 *
 * <p>The three partitions must be chronologically ordered and must not share a date.
 */
public record DataSplitConfig(
    PeriodBounds train,
    PeriodBounds validation,
    PeriodBounds test,
    int minObservations,
    double consistencyEpsilon,
    double minTestMetric,
    double minConsistency,
    double minDegradationRatio
) {
    public DataSplitConfig {
        if (train == null || validation == null || test == null) {
            throw new IllegalArgumentException("train, validation and test bounds must be non-null");
        }
        if (!train.end().isBefore(validation.start())) {
            throw new IllegalArgumentException("train %s must end before validation %s starts"
                .formatted(train, validation));
        }
        if (!validation.end().isBefore(test.start())) {
            throw new IllegalArgumentException("validation %s must end before test %s starts"
                .formatted(validation, test));
        }
        if (minObservations < 2) {
            throw new IllegalArgumentException("minObservations must be >= 2, got: " + minObservations);
        }
        if (consistencyEpsilon <= 0) {
            throw new IllegalArgumentException("consistencyEpsilon must be positive, got: " + consistencyEpsilon);
        }
    }

    public static DataSplitConfig defaults() {
        return from(new ValidationProperties.DataSplit());
    }

    public static DataSplitConfig from(ValidationProperties.DataSplit properties) {
        return new DataSplitConfig(
            PeriodBounds.of(properties.getTrainStart(), properties.getTrainEnd()),
            PeriodBounds.of(properties.getValidationStart(), properties.getValidationEnd()),
            PeriodBounds.of(properties.getTestStart(), properties.getTestEnd()),
            properties.getMinObservations(),
            properties.getConsistencyEpsilon(),
            properties.getMinTestMetric(),
            properties.getMinConsistency(),
            properties.getMinDegradationRatio()
        );
    }

    public PeriodBounds bounds(SplitPeriod period) {
        return switch (period) {
            case TRAIN -> train;
            case VALIDATION -> validation;
            case TEST -> test;
        };
    }

    public DataSplitConfig withBounds(PeriodBounds newTrain, PeriodBounds newValidation, PeriodBounds newTest) {
        return new DataSplitConfig(newTrain, newValidation, newTest, minObservations, consistencyEpsilon,
            minTestMetric, minConsistency, minDegradationRatio);
    }

    public DataSplitConfig withMinObservations(int newMinObservations) {
        return new DataSplitConfig(train, validation, test, newMinObservations, consistencyEpsilon,
            minTestMetric, minConsistency, minDegradationRatio);
    }
}
