package de.anton.mkid.pipeline.model;

import java.util.Objects;

/**
 * Raw photons one pixel recorded under one reference line: arrival times
 * (microseconds) and phase heights, index aligned.
 */
public record PhaseSamples(long[] timesMicros, double[] phases) {

    public PhaseSamples {
        Objects.requireNonNull(timesMicros, "timesMicros");
        Objects.requireNonNull(phases, "phases");
        if (timesMicros.length != phases.length) {
            throw new IllegalArgumentException(String.format(
                "times (%d) and phases (%d) must have the same length", timesMicros.length, phases.length));
        }
    }

    public static PhaseSamples empty() {
        return new PhaseSamples(new long[0], new double[0]);
    }

    public int size() {
        return phases.length;
    }
}
