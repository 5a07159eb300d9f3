package de.anton.mkid.pipeline.model;

import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable configuration for the wavelength calibration step.
 *
 * @param version              configuration/algorithm version, part of the fingerprint
 * @param histogramBinWidth    initial phase histogram bin width (phase units)
 * @param minimumPeakCounts    bin width is doubled until the tallest bin holds this many photons
 * @param histogramAttempts    how many bin widths to try, 1..{@value #MAX_HISTOGRAM_ATTEMPTS}
 * @param deadTimeMicros       photons closer than this to their predecessor are dropped
 * @param hotPixelRateCutoff   a laser line with a higher count rate (cps) is ignored, &lt;= 0 disables
 * @param modelOrder           polynomial order of the phase to energy model
 * @param maxReducedChiSquared fits with a worse reduced chi-squared are rejected
 * @param maxIterations        iteration limit of the peak fit
 * @param parallel             fit pixels on the common pool (not fit relevant)
 * @param summaryExport        write an xlsx summary next to the solution (not fit relevant)
 */
public record WavecalConfig(
    int version,
    double histogramBinWidth,
    int minimumPeakCounts,
    int histogramAttempts,
    long deadTimeMicros,
    double hotPixelRateCutoff,
    int modelOrder,
    double maxReducedChiSquared,
    int maxIterations,
    boolean parallel,
    boolean summaryExport
) implements CalibrationConfig {

    public static final int CURRENT_VERSION = 1;
    /** Each attempt doubles the bin width. */
    public static final int MAX_HISTOGRAM_ATTEMPTS = 16;

    public WavecalConfig {
        if (version < 1) throw new IllegalArgumentException("version must be >= 1, was " + version);
        if (!(histogramBinWidth > 0)) throw new IllegalArgumentException("histogramBinWidth must be positive, was " + histogramBinWidth);
        if (minimumPeakCounts < 1) throw new IllegalArgumentException("minimumPeakCounts must be >= 1, was " + minimumPeakCounts);
        if (histogramAttempts < 1 || histogramAttempts > MAX_HISTOGRAM_ATTEMPTS) {
            throw new IllegalArgumentException("histogramAttempts must be 1.." + MAX_HISTOGRAM_ATTEMPTS + ", was " + histogramAttempts);
        }
        if (deadTimeMicros < 0) throw new IllegalArgumentException("deadTimeMicros must not be negative, was " + deadTimeMicros);
        if (modelOrder < 1 || modelOrder > 3) throw new IllegalArgumentException("modelOrder must be 1..3, was " + modelOrder);
        if (!(maxReducedChiSquared > 0)) throw new IllegalArgumentException("maxReducedChiSquared must be positive, was " + maxReducedChiSquared);
        if (maxIterations < 10) throw new IllegalArgumentException("maxIterations must be >= 10, was " + maxIterations);
    }

    public static WavecalConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .version(version).histogramBinWidth(histogramBinWidth).minimumPeakCounts(minimumPeakCounts)
            .histogramAttempts(histogramAttempts).deadTimeMicros(deadTimeMicros)
            .hotPixelRateCutoff(hotPixelRateCutoff).modelOrder(modelOrder)
            .maxReducedChiSquared(maxReducedChiSquared).maxIterations(maxIterations)
            .parallel(parallel).summaryExport(summaryExport);
    }

    @Override
    public CalibrationKind kind() {
        return CalibrationKind.WAVECAL;
    }

    @Override
    public SortedMap<String, Object> fingerprintFields() {
        SortedMap<String, Object> fields = new TreeMap<>();
        fields.put("version", version);
        fields.put("histogramBinWidth", histogramBinWidth);
        fields.put("minimumPeakCounts", minimumPeakCounts);
        fields.put("histogramAttempts", histogramAttempts);
        fields.put("deadTimeMicros", deadTimeMicros);
        fields.put("hotPixelRateCutoff", hotPixelRateCutoff);
        fields.put("modelOrder", modelOrder);
        fields.put("maxReducedChiSquared", maxReducedChiSquared);
        fields.put("maxIterations", maxIterations);
        return fields;
    }

    public static final class Builder {
        private int version = CURRENT_VERSION;
        private double histogramBinWidth = 0.002;
        private int minimumPeakCounts = 400;
        private int histogramAttempts = 3;
        private long deadTimeMicros = 500;
        private double hotPixelRateCutoff = 2000;
        private int modelOrder = 2;
        private double maxReducedChiSquared = 25;
        private int maxIterations = 1000;
        private boolean parallel = true;
        private boolean summaryExport = false;

        private Builder() { }

        public Builder version(int v) { this.version = v; return this; }
        public Builder histogramBinWidth(double v) { this.histogramBinWidth = v; return this; }
        public Builder minimumPeakCounts(int v) { this.minimumPeakCounts = v; return this; }
        public Builder histogramAttempts(int v) { this.histogramAttempts = v; return this; }
        public Builder deadTimeMicros(long v) { this.deadTimeMicros = v; return this; }
        public Builder hotPixelRateCutoff(double v) { this.hotPixelRateCutoff = v; return this; }
        public Builder modelOrder(int v) { this.modelOrder = v; return this; }
        public Builder maxReducedChiSquared(double v) { this.maxReducedChiSquared = v; return this; }
        public Builder maxIterations(int v) { this.maxIterations = v; return this; }
        public Builder parallel(boolean v) { this.parallel = v; return this; }
        public Builder summaryExport(boolean v) { this.summaryExport = v; return this; }

        public WavecalConfig build() {
            return new WavecalConfig(version, histogramBinWidth, minimumPeakCounts, histogramAttempts,
                deadTimeMicros, hotPixelRateCutoff, modelOrder, maxReducedChiSquared, maxIterations,
                parallel, summaryExport);
        }
    }
}
