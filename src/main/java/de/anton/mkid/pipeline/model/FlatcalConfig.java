package de.anton.mkid.pipeline.model;

import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable configuration for the flat-field calibration step.
 *
 * @param version              configuration/algorithm version, part of the fingerprint
 * @param chunkTimeSeconds     length of one time chunk
 * @param maxChunks            at most this many chunks are taken from the exposure
 * @param wavelengthStartNm    lower edge of the first wavelength bin
 * @param wavelengthStopNm     upper edge of the last wavelength bin
 * @param wavelengthBinWidthNm width of a wavelength bin
 * @param rateCutoff           pixels with a higher overall count rate (counts/s) are bad, &lt;= 0 disables
 * @param trimFraction         fraction of chunk rates dropped at each end before averaging, in [0, 0.5)
 * @param parallel             fit pixels on the common pool (not fit relevant)
 * @param summaryExport        write an xlsx summary next to the solution (not fit relevant)
 */
public record FlatcalConfig(
    int version,
    double chunkTimeSeconds,
    int maxChunks,
    double wavelengthStartNm,
    double wavelengthStopNm,
    double wavelengthBinWidthNm,
    double rateCutoff,
    double trimFraction,
    boolean parallel,
    boolean summaryExport
) implements CalibrationConfig {

    public static final int CURRENT_VERSION = 1;

    public FlatcalConfig {
        if (version < 1) throw new IllegalArgumentException("version must be >= 1, was " + version);
        if (!(chunkTimeSeconds > 0)) throw new IllegalArgumentException("chunkTimeSeconds must be positive, was " + chunkTimeSeconds);
        if (maxChunks < 1) throw new IllegalArgumentException("maxChunks must be >= 1, was " + maxChunks);
        if (!(wavelengthBinWidthNm > 0)) throw new IllegalArgumentException("wavelengthBinWidthNm must be positive, was " + wavelengthBinWidthNm);
        if (!(wavelengthStopNm > wavelengthStartNm) || wavelengthStartNm < 0) {
            throw new IllegalArgumentException(String.format(
                "Wavelength range [%.1f, %.1f] nm is invalid", wavelengthStartNm, wavelengthStopNm));
        }
        if (trimFraction < 0 || trimFraction >= 0.5) {
            throw new IllegalArgumentException("trimFraction must be in [0, 0.5), was " + trimFraction);
        }
    }

    public static FlatcalConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .version(version).chunkTimeSeconds(chunkTimeSeconds).maxChunks(maxChunks)
            .wavelengthStartNm(wavelengthStartNm).wavelengthStopNm(wavelengthStopNm)
            .wavelengthBinWidthNm(wavelengthBinWidthNm).rateCutoff(rateCutoff)
            .trimFraction(trimFraction).parallel(parallel).summaryExport(summaryExport);
    }

    /** Number of wavelength bins between start and stop. A partial last bin counts. */
    public int wavelengthBinCount() {
        return (int) Math.ceil((wavelengthStopNm - wavelengthStartNm) / wavelengthBinWidthNm - 1e-9);
    }

    /** Bin edges, ascending, {@code wavelengthBinCount() + 1} values, last edge clipped to stop. */
    public double[] wavelengthBinEdges() {
        int n = wavelengthBinCount();
        double[] edges = new double[n + 1];
        for (int i = 0; i <= n; i++) {
            edges[i] = Math.min(wavelengthStartNm + i * wavelengthBinWidthNm, wavelengthStopNm);
        }
        return edges;
    }

    @Override
    public CalibrationKind kind() {
        return CalibrationKind.FLATCAL;
    }

    @Override
    public SortedMap<String, Object> fingerprintFields() {
        SortedMap<String, Object> fields = new TreeMap<>();
        fields.put("version", version);
        fields.put("chunkTimeSeconds", chunkTimeSeconds);
        fields.put("maxChunks", maxChunks);
        fields.put("wavelengthStartNm", wavelengthStartNm);
        fields.put("wavelengthStopNm", wavelengthStopNm);
        fields.put("wavelengthBinWidthNm", wavelengthBinWidthNm);
        fields.put("rateCutoff", rateCutoff);
        fields.put("trimFraction", trimFraction);
        return fields;
    }

    public static final class Builder {
        private int version = CURRENT_VERSION;
        private double chunkTimeSeconds = 10;
        private int maxChunks = 6;
        private double wavelengthStartNm = 700;
        private double wavelengthStopNm = 1500;
        private double wavelengthBinWidthNm = 50;
        private double rateCutoff = 0;
        private double trimFraction = 0.2;
        private boolean parallel = true;
        private boolean summaryExport = false;

        private Builder() { }

        public Builder version(int v) { this.version = v; return this; }
        public Builder chunkTimeSeconds(double v) { this.chunkTimeSeconds = v; return this; }
        public Builder maxChunks(int v) { this.maxChunks = v; return this; }
        public Builder wavelengthStartNm(double v) { this.wavelengthStartNm = v; return this; }
        public Builder wavelengthStopNm(double v) { this.wavelengthStopNm = v; return this; }
        public Builder wavelengthBinWidthNm(double v) { this.wavelengthBinWidthNm = v; return this; }
        public Builder rateCutoff(double v) { this.rateCutoff = v; return this; }
        public Builder trimFraction(double v) { this.trimFraction = v; return this; }
        public Builder parallel(boolean v) { this.parallel = v; return this; }
        public Builder summaryExport(boolean v) { this.summaryExport = v; return this; }

        public FlatcalConfig build() {
            return new FlatcalConfig(version, chunkTimeSeconds, maxChunks, wavelengthStartNm,
                wavelengthStopNm, wavelengthBinWidthNm, rateCutoff, trimFraction, parallel, summaryExport);
        }
    }
}
