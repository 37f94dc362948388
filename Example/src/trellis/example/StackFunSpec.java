package trellis.example;

import trellis.core.style.FunSpec;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public final class StackFunSpec extends FunSpec {

    public StackFunSpec() {
        describe("A bounded stack", () -> {
            describe("when empty", () -> {
                it("has size 0", () -> assertThat(new BoundedStack<String>(3).size(), is(0)));
                it("is not full", () -> assertThat(new BoundedStack<String>(3).isFull(), is(false)));
            });

            describe("when full", () -> {
                it("is full", () -> {
                    BoundedStack<String> stack = new BoundedStack<>(1);
                    stack.push("only");
                    assertThat(stack.isFull(), is(true));
                });
                it("peeks without removing", () -> {
                    BoundedStack<String> stack = new BoundedStack<>(1);
                    stack.push("only");
                    assertThat(stack.peek(), is("only"));
                    assertThat(stack.size(), is(1));
                });
            });

            it("rejects a capacity of 0", () -> {
                try {
                    new BoundedStack<String>(0);
                    throw new AssertionError("expected IllegalArgumentException");
                } catch (IllegalArgumentException e) {
                    markup("*capacity* must be positive");
                }
            });
        });
    }
}
