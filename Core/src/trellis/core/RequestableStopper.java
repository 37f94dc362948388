package trellis.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A stopper that starts out not requesting a stop and can be tripped, from any thread, exactly once.
 */
public final class RequestableStopper implements Stopper {
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public void requestStop() {
        this.stopRequested.set(true);
    }

    @Override
    public boolean stopRequested() {
        return this.stopRequested.get();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + (this.stopRequested.get() ? " { [stop requested] }" : " { [running] }");
    }
}
