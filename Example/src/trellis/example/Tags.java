package trellis.example;

/**
 * The tag names the example suites use.
 */
public final class Tags {
    public static final String SLOW = "trellis.example.Slow";

    private Tags() {}
}
