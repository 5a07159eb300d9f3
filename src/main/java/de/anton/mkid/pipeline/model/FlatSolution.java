package de.anton.mkid.pipeline.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Flat-field solution: per-pixel, per-wavelength-bin weights.
 */
public final class FlatSolution extends CalibrationSolution {

    /** Returned by {@link #binOf(double)} below the first edge. */
    public static final int BELOW_RANGE = -1;
    /** Returned by {@link #binOf(double)} above the last edge. */
    public static final int ABOVE_RANGE = -2;

    private final FlatcalConfig config;
    private final double[] binEdgesNm;
    private final List<FlatPixel> pixels;

    public FlatSolution(Fingerprint fingerprint, Provenance provenance, FlatcalConfig config,
                        double[] binEdgesNm, List<FlatPixel> pixels) {
        super(fingerprint, provenance);
        this.config = Objects.requireNonNull(config, "config");
        this.binEdgesNm = Objects.requireNonNull(binEdgesNm, "binEdgesNm").clone();
        if (this.binEdgesNm.length < 2) {
            throw new IllegalArgumentException("A flat solution needs at least one wavelength bin");
        }
        this.pixels = List.copyOf(Objects.requireNonNull(pixels, "pixels"));
        for (int i = 0; i < this.pixels.size(); i++) {
            if (this.pixels.get(i).pixel() != i) {
                throw new IllegalArgumentException("Pixel results must be indexed by pixel id, found "
                    + this.pixels.get(i).pixel() + " at position " + i);
            }
        }
    }

    @Override
    public FlatcalConfig getConfig() { return config; }

    public double[] getBinEdgesNm() { return binEdgesNm.clone(); }

    public int getBinCount() { return binEdgesNm.length - 1; }

    public List<FlatPixel> getPixels() { return pixels; }

    public FlatPixel pixel(int pixel) {
        return pixel >= 0 && pixel < pixels.size() ? pixels.get(pixel) : null;
    }

    /**
     * Bin index of a wavelength. The last bin includes its upper edge.
     *
     * @return the bin, {@link #BELOW_RANGE} or {@link #ABOVE_RANGE}
     */
    public int binOf(double wavelengthNm) {
        return binOf(binEdgesNm, wavelengthNm);
    }

    public static int binOf(double[] edges, double wavelengthNm) {
        if (Double.isNaN(wavelengthNm) || wavelengthNm < edges[0]) {
            return BELOW_RANGE;
        }
        int last = edges.length - 1;
        if (wavelengthNm > edges[last]) {
            return ABOVE_RANGE;
        }
        if (wavelengthNm == edges[last]) {
            return last - 1;
        }
        int idx = Arrays.binarySearch(edges, wavelengthNm);
        return idx >= 0 ? idx : -idx - 2;
    }

    /** Weight for a pixel and wavelength, NaN if undefined. */
    public double weight(int pixel, double wavelengthNm) {
        FlatPixel p = pixel(pixel);
        int bin = binOf(wavelengthNm);
        return p == null || bin < 0 ? Double.NaN : p.weight(bin);
    }

    @Override
    public int getPixelCount() { return pixels.size(); }

    @Override
    public boolean isUsable(int pixel) {
        FlatPixel p = pixel(pixel);
        return p != null && p.isUsable();
    }
}
