package tw.gc.strategy.validation.services.datasplit;

/**
 * The three chronologically ordered partitions of a temporal split.
 */
public enum SplitPeriod {
    TRAIN("train"),
    VALIDATION("val"),
    TEST("test");

    private final String label;

    SplitPeriod(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
