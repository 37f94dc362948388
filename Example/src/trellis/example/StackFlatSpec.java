package trellis.example;

import trellis.core.style.FlatSpec;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public final class StackFlatSpec extends FlatSpec {

    public StackFlatSpec() {
        behaviorOf("An empty stack");
        it("should have size 0", () -> assertThat(new BoundedStack<String>(2).size(), is(0)));
        it("should not be full", () -> assertThat(new BoundedStack<String>(2).isFull(), is(false)));

        behaviorOf("A stack of capacity 1");
        it("should be full after one push", () -> {
            BoundedStack<String> stack = new BoundedStack<>(1);
            stack.push("a");
            assertThat(stack.isFull(), is(true));
        });
        it("should report its capacity", () -> assertThat(new BoundedStack<String>(1).capacity(), is(1)));
    }
}
