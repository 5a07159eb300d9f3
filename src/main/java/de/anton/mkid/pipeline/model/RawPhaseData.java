package de.anton.mkid.pipeline.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Raw phase samples of a wavelength calibration dataset, grouped by pixel and
 * reference (laser) line. Reference wavelengths are kept in ascending order.
 */
public class RawPhaseData {

    private final double[] referenceWavelengthsNm;
    private final PixelRange pixels;
    private final PhaseSamples[][] samples; // [pixel - first][line]

    private RawPhaseData(double[] referenceWavelengthsNm, PixelRange pixels, PhaseSamples[][] samples) {
        this.referenceWavelengthsNm = referenceWavelengthsNm;
        this.pixels = pixels;
        this.samples = samples;
    }

    public double[] getReferenceWavelengthsNm() { return referenceWavelengthsNm.clone(); }
    public int getLineCount() { return referenceWavelengthsNm.length; }
    public PixelRange getPixels() { return pixels; }

    /** Samples of one pixel under one line; never null. */
    public PhaseSamples samples(int pixel, int line) {
        if (!pixels.contains(pixel) || line < 0 || line >= referenceWavelengthsNm.length) {
            return PhaseSamples.empty();
        }
        PhaseSamples s = samples[pixel - pixels.first()][line];
        return s == null ? PhaseSamples.empty() : s;
    }

    /** Restricts the data to a sub-range of pixels. */
    public RawPhaseData slice(PixelRange range) {
        int first = Math.max(range.first(), pixels.first());
        int end = Math.min(range.endExclusive(), pixels.endExclusive());
        PixelRange clipped = new PixelRange(first, Math.max(first, end));
        PhaseSamples[][] sliced = new PhaseSamples[clipped.size()][];
        for (int p = clipped.first(); p < clipped.endExclusive(); p++) {
            sliced[p - clipped.first()] = samples[p - pixels.first()];
        }
        return new RawPhaseData(referenceWavelengthsNm, clipped, sliced);
    }

    public static Builder builder(int pixelCount, double... referenceWavelengthsNm) {
        return new Builder(pixelCount, referenceWavelengthsNm);
    }

    /**
     * Collects photons one at a time. Lines may be given in any order; they are
     * sorted by wavelength on {@link #build()}.
     */
    public static final class Builder {
        private final int pixelCount;
        private final double[] wavelengths;
        private final List<List<List<Long>>> times;
        private final List<List<List<Double>>> phases;

        private Builder(int pixelCount, double[] referenceWavelengthsNm) {
            if (pixelCount < 0) throw new IllegalArgumentException("pixelCount must not be negative");
            Objects.requireNonNull(referenceWavelengthsNm, "referenceWavelengthsNm");
            this.pixelCount = pixelCount;
            this.wavelengths = referenceWavelengthsNm.clone();
            this.times = new ArrayList<>(pixelCount);
            this.phases = new ArrayList<>(pixelCount);
            for (int p = 0; p < pixelCount; p++) {
                List<List<Long>> t = new ArrayList<>();
                List<List<Double>> ph = new ArrayList<>();
                for (int l = 0; l < wavelengths.length; l++) {
                    t.add(new ArrayList<>());
                    ph.add(new ArrayList<>());
                }
                times.add(t);
                phases.add(ph);
            }
        }

        public Builder add(int pixel, double wavelengthNm, long timeMicros, double phase) {
            int line = lineIndex(wavelengthNm);
            if (pixel < 0 || pixel >= pixelCount) {
                throw new IllegalArgumentException("Pixel " + pixel + " outside [0, " + pixelCount + ")");
            }
            times.get(pixel).get(line).add(timeMicros);
            phases.get(pixel).get(line).add(phase);
            return this;
        }

        private int lineIndex(double wavelengthNm) {
            for (int i = 0; i < wavelengths.length; i++) {
                if (Double.compare(wavelengths[i], wavelengthNm) == 0) return i;
            }
            throw new IllegalArgumentException("Unknown reference wavelength " + wavelengthNm + " nm");
        }

        public RawPhaseData build() {
            Integer[] order = new Integer[wavelengths.length];
            for (int i = 0; i < order.length; i++) order[i] = i;
            Arrays.sort(order, (a, b) -> Double.compare(wavelengths[a], wavelengths[b]));
            double[] sortedWavelengths = new double[wavelengths.length];
            for (int i = 0; i < order.length; i++) sortedWavelengths[i] = wavelengths[order[i]];

            PhaseSamples[][] samples = new PhaseSamples[pixelCount][wavelengths.length];
            for (int p = 0; p < pixelCount; p++) {
                for (int i = 0; i < order.length; i++) {
                    List<Long> t = times.get(p).get(order[i]);
                    List<Double> ph = phases.get(p).get(order[i]);
                    long[] tArr = new long[t.size()];
                    double[] phArr = new double[ph.size()];
                    for (int k = 0; k < tArr.length; k++) {
                        tArr[k] = t.get(k);
                        phArr[k] = ph.get(k);
                    }
                    samples[p][i] = new PhaseSamples(tArr, phArr);
                }
            }
            return new RawPhaseData(sortedWavelengths, PixelRange.all(pixelCount), samples);
        }
    }
}
