package trellis.example;

import trellis.core.style.PathFunSpec;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

/**
 * Shares one stack field between all its scopes. Each test still sees only what its enclosing scopes pushed, since
 * every test runs in its own instance.
 */
public final class StackPathSpec extends PathFunSpec {
    private final BoundedStack<Integer> stack = new BoundedStack<>(3);

    @Override
    protected void define() {
        describe("A stack", () -> {
            this.stack.push(1);
            it("holds the first push", () -> assertThat(this.stack.size(), is(1)));

            describe("after a second push", () -> {
                this.stack.push(2);
                it("holds both", () -> assertThat(this.stack.size(), is(2)));
                it("pops the second", () -> assertThat(this.stack.pop(), is(2)));
            });

            it("still holds only the first push", () -> assertThat(this.stack.peek(), is(1)));
        });
    }
}
