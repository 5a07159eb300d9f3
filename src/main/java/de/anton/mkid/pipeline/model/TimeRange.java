package de.anton.mkid.pipeline.model;

/**
 * A half-open interval of wall-clock time, in whole UNIX seconds.
 * This class is intended to be immutable.
 */
public record TimeRange(long start, long stop) implements Comparable<TimeRange> {

    public TimeRange {
        if (stop < start) {
            throw new IllegalArgumentException(String.format(
                "Time range stop (%d) must not be before start (%d)", stop, start));
        }
    }

    public long duration() { return stop - start; }

    /** True if {@code other} lies completely inside this range. */
    public boolean contains(TimeRange other) {
        return other != null && start <= other.start && other.stop <= stop;
    }

    /** True if the two ranges share at least one second or touch end to end. */
    public boolean touches(TimeRange other) {
        return other != null && other.start <= stop && start <= other.stop;
    }

    @Override
    public int compareTo(TimeRange o) {
        int c = Long.compare(start, o.start);
        return c != 0 ? c : Long.compare(stop, o.stop);
    }

    @Override
    public String toString() {
        return start + "-" + stop;
    }
}
