package trellis.core;

/**
 * What a {@link Filter} decided for one test: whether it is left out of the run entirely and, if not, whether it is
 * reported as ignored instead of being run.
 */
public final class FilterDecision {
    public final String testName;
    public final boolean excluded;
    public final boolean ignored;

    FilterDecision(String testName, boolean excluded, boolean ignored) {
        this.testName = testName;
        this.excluded = excluded;
        this.ignored = ignored;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { test: " + this.testName + (this.excluded ? ", [excluded]" : (this.ignored ? ", [ignored]" : ", [run]")) + " }";
    }
}
