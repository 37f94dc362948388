package trellis.core.event;

public enum EventType {
    SUITE_STARTING,
    SUITE_COMPLETED,
    SUITE_ABORTED,
    SCOPE_OPENED,
    SCOPE_CLOSED,
    TEST_STARTING,
    TEST_SUCCEEDED,
    TEST_FAILED,
    TEST_PENDING,
    TEST_CANCELED,
    TEST_IGNORED,
    INFO_PROVIDED,
    MARKUP_PROVIDED;

    /**
     * Returns true iff this type reports the final outcome of a single test.
     */
    public boolean isTestOutcome() {
        switch (this) {
            case TEST_SUCCEEDED:
            case TEST_FAILED:
            case TEST_PENDING:
            case TEST_CANCELED:
            case TEST_IGNORED:
                return true;
            default:
                return false;
        }
    }
}
