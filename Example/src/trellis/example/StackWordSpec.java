package trellis.example;

import trellis.core.style.WordSpec;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public final class StackWordSpec extends WordSpec {

    public StackWordSpec() {
        when("A bounded stack", () -> {
            should("with one element", () -> {
                in("report size 1", () -> assertThat(withOne().size(), is(1)));
                in("be empty after a pop", () -> {
                    BoundedStack<String> stack = withOne();
                    stack.pop();
                    assertThat(stack.isEmpty(), is(true));
                });
            });
            must("with no room", () -> in("refuse a push", () -> {
                BoundedStack<String> stack = withOne();
                try {
                    stack.push("two");
                    throw new AssertionError("expected IllegalStateException");
                } catch (IllegalStateException e) {
                    assertThat(stack.size(), is(1));
                }
            }));
        });
    }

    private static BoundedStack<String> withOne() {
        BoundedStack<String> stack = new BoundedStack<>(1);
        stack.push("one");
        return stack;
    }
}
