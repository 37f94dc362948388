package trellis.example;

import trellis.core.style.FixtureFunSuite;
import trellis.core.style.OneArgTest;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

/**
 * Hands each test a stack prefilled with "a" and "b". The capacity comes from the {@code capacity} entry of the
 * config map, 4 when absent.
 */
public final class StackFixtureSuite extends FixtureFunSuite<BoundedStack<String>> {
    public static final String CAPACITY_KEY = "capacity";
    private static final long DEFAULT_CAPACITY = 4;

    public StackFixtureSuite() {
        test("the fixture holds two elements", stack -> assertThat(stack.size(), is(2)));
        test("the last prefilled element is on top", stack -> assertThat(stack.pop(), is("b")));
        test("changes are not seen by other tests", stack -> {
            stack.pop();
            stack.pop();
            assertThat(stack.isEmpty(), is(true));
        });
    }

    @Override
    protected void withFixture(OneArgTest<BoundedStack<String>> test) throws Throwable {
        Object configured = test.configMap.get(CAPACITY_KEY);
        long capacity = (configured instanceof Number) ? ((Number) configured).longValue() : DEFAULT_CAPACITY;

        BoundedStack<String> stack = new BoundedStack<>((int) capacity);
        stack.push("a");
        stack.push("b");
        test.apply(stack);
    }
}
