package de.anton.mkid.pipeline.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Identifies the observation a reduction request is about: one or more time
 * segments recorded by one instrument, plus where the raw data lives.
 * <p>
 * The name is for humans and logs only. Cache identity is derived from
 * {@link #coverage()} and {@link #instrumentId()}, so two differently named
 * datasets spanning the same seconds resolve to the same solution.
 */
public record DatasetSpec(String name, String instrumentId, List<TimeRange> segments, String dataLocation) {

    public DatasetSpec {
        Objects.requireNonNull(name, "Dataset name cannot be null");
        Objects.requireNonNull(instrumentId, "Instrument id cannot be null for " + name);
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("Dataset " + name + " needs at least one time segment");
        }
        segments = List.copyOf(segments);
        dataLocation = dataLocation == null ? "" : dataLocation;
    }

    /** Single-segment convenience factory. */
    public static DatasetSpec of(String name, String instrumentId, long start, long stop, String dataLocation) {
        return new DatasetSpec(name, instrumentId, List.of(new TimeRange(start, stop)), dataLocation);
    }

    public long start() {
        return segments.stream().mapToLong(TimeRange::start).min().orElseThrow();
    }

    public long stop() {
        return segments.stream().mapToLong(TimeRange::stop).max().orElseThrow();
    }

    /** Total exposure covered by the segments, overlaps counted once. */
    public long exposureSeconds() {
        return coverage().stream().mapToLong(TimeRange::duration).sum();
    }

    /**
     * The segments sorted and with overlapping or adjacent ranges merged.
     * Two datasets with equal coverage describe the same seconds of data.
     */
    public List<TimeRange> coverage() {
        return normalize(segments);
    }

    static List<TimeRange> normalize(List<TimeRange> ranges) {
        List<TimeRange> sorted = new ArrayList<>(ranges);
        Collections.sort(sorted);
        List<TimeRange> merged = new ArrayList<>();
        TimeRange current = null;
        for (TimeRange r : sorted) {
            if (current == null) {
                current = r;
            } else if (current.touches(r)) {
                current = new TimeRange(current.start(), Math.max(current.stop(), r.stop()));
            } else {
                merged.add(current);
                current = r;
            }
        }
        if (current != null) merged.add(current);
        return Collections.unmodifiableList(merged);
    }

    @Override
    public String toString() {
        return String.format("%s[%s %s]", name, instrumentId, segments);
    }
}
