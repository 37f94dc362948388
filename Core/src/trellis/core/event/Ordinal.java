package trellis.core.event;

import java.util.Arrays;

/**
 * An immutable ordering token attached to every event so that events fired from several threads can be put back in
 * the order they were produced.
 *
 * An ordinal is a sequence of stamps. The first stamp identifies the run, every later stamp counts events at one level
 * of forking: {@link #next()} bumps the last stamp, {@link #nextNewOldPair()} forks a new sub-sequence for work that
 * is handed to another thread. Ordinals compare stamp by stamp, a shorter sequence sorting before any longer one that
 * it prefixes.
 */
public final class Ordinal implements Comparable<Ordinal> {
    private final int[] stamps;

    private Ordinal(int[] stamps) {
        this.stamps = stamps;
    }

    /**
     * Returns the first ordinal of the run identified by the given stamp.
     *
     * @param runStamp The stamp of the run.
     * @return the first ordinal.
     */
    public static Ordinal forRun(int runStamp) {
        return new Ordinal(new int[]{ runStamp, 0 });
    }

    /**
     * Returns the ordinal that follows this one at the same level.
     *
     * @return the next ordinal.
     */
    public Ordinal next() {
        int[] nextStamps = Arrays.copyOf(this.stamps, this.stamps.length);
        nextStamps[nextStamps.length - 1]++;
        return new Ordinal(nextStamps);
    }

    /**
     * Returns a pair of ordinals: index 0 starts a new nested sequence to be handed to another thread, index 1 is the
     * ordinal that this sequence continues with.
     *
     * @return the new and the old ordinal.
     */
    public Ordinal[] nextNewOldPair() {
        int[] newStamps = Arrays.copyOf(this.stamps, this.stamps.length + 1);
        newStamps[newStamps.length - 1] = 0;
        return new Ordinal[]{ new Ordinal(newStamps), next() };
    }

    public int runStamp() {
        return this.stamps[0];
    }

    public int[] toArray() {
        return Arrays.copyOf(this.stamps, this.stamps.length);
    }

    @Override
    public int compareTo(Ordinal other) {
        int shared = Math.min(this.stamps.length, other.stamps.length);
        for (int i = 0; i < shared; i++) {
            if (this.stamps[i] != other.stamps[i]) {
                return Integer.compare(this.stamps[i], other.stamps[i]);
            }
        }
        return Integer.compare(this.stamps.length, other.stamps.length);
    }

    @Override
    public boolean equals(Object other) {
        return (other instanceof Ordinal) && Arrays.equals(this.stamps, ((Ordinal) other).stamps);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(this.stamps);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " " + Arrays.toString(this.stamps);
    }
}
