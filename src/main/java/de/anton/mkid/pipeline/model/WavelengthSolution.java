package de.anton.mkid.pipeline.model;

import java.util.List;
import java.util.Objects;

/**
 * Wavelength calibration solution: one {@link WavecalPixel} per pixel id.
 */
public final class WavelengthSolution extends CalibrationSolution {

    private final WavecalConfig config;
    private final double[] referenceWavelengthsNm;
    private final List<WavecalPixel> pixels;

    public WavelengthSolution(Fingerprint fingerprint, Provenance provenance, WavecalConfig config,
                              double[] referenceWavelengthsNm, List<WavecalPixel> pixels) {
        super(fingerprint, provenance);
        this.config = Objects.requireNonNull(config, "config");
        this.referenceWavelengthsNm = referenceWavelengthsNm == null ? new double[0] : referenceWavelengthsNm.clone();
        this.pixels = List.copyOf(Objects.requireNonNull(pixels, "pixels"));
        for (int i = 0; i < this.pixels.size(); i++) {
            if (this.pixels.get(i).pixel() != i) {
                throw new IllegalArgumentException("Pixel results must be indexed by pixel id, found "
                    + this.pixels.get(i).pixel() + " at position " + i);
            }
        }
    }

    @Override
    public WavecalConfig getConfig() { return config; }

    public double[] getReferenceWavelengthsNm() { return referenceWavelengthsNm.clone(); }

    public List<WavecalPixel> getPixels() { return pixels; }

    /** Result for a pixel, or null if the id is outside the solution. */
    public WavecalPixel pixel(int pixel) {
        return pixel >= 0 && pixel < pixels.size() ? pixels.get(pixel) : null;
    }

    @Override
    public int getPixelCount() { return pixels.size(); }

    @Override
    public boolean isUsable(int pixel) {
        WavecalPixel p = pixel(pixel);
        return p != null && p.isUsable();
    }
}
