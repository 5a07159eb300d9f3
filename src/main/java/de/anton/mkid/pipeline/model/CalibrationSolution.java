package de.anton.mkid.pipeline.model;

import java.util.Objects;

/**
 * A persisted calibration artifact: fingerprint, provenance and a per-pixel
 * body. Instances are immutable; a different fingerprint always means a new
 * artifact.
 */
public abstract class CalibrationSolution {

    private final String solutionId;
    private final Fingerprint fingerprint;
    private final Provenance provenance;

    protected CalibrationSolution(Fingerprint fingerprint, Provenance provenance) {
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
        this.provenance = Objects.requireNonNull(provenance, "provenance");
        this.solutionId = fingerprint.key();
    }

    public String getSolutionId() { return solutionId; }
    public Fingerprint getFingerprint() { return fingerprint; }
    public Provenance getProvenance() { return provenance; }

    public CalibrationKind getKind() {
        return fingerprint.kind();
    }

    /** Snapshot of the configuration the solution was fitted with. */
    public abstract CalibrationConfig getConfig();

    /** Number of pixels the body describes; pixel ids are {@code 0..pixelCount-1}. */
    public abstract int getPixelCount();

    public abstract boolean isUsable(int pixel);

    public int getUsablePixelCount() {
        int n = 0;
        for (int p = 0; p < getPixelCount(); p++) {
            if (isUsable(p)) n++;
        }
        return n;
    }

    public int getBadPixelCount() {
        return getPixelCount() - getUsablePixelCount();
    }

    @Override
    public String toString() {
        return String.format("%s[%s, %d/%d usable]", getClass().getSimpleName(), solutionId,
            getUsablePixelCount(), getPixelCount());
    }
}
