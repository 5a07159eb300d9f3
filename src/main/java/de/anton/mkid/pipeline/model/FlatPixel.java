package de.anton.mkid.pipeline.model;

import java.util.Objects;

/**
 * Per-pixel flat-field result: relative weights per wavelength bin, or a bad
 * pixel with a reason. An individual bin weight is {@code NaN} when undefined.
 */
public record FlatPixel(
    int pixel,
    PixelStatus status,
    FitFailure failure,
    double[] weights,
    double[] weightErrors,
    double countRate
) {

    public FlatPixel {
        Objects.requireNonNull(status, "status");
        weights = weights == null ? new double[0] : weights.clone();
        weightErrors = weightErrors == null ? new double[0] : weightErrors.clone();
    }

    public static FlatPixel fit(int pixel, double[] weights, double[] weightErrors, double countRate) {
        return new FlatPixel(pixel, PixelStatus.FIT, null, weights, weightErrors, countRate);
    }

    public static FlatPixel bad(int pixel, FitFailure failure, double countRate) {
        return new FlatPixel(pixel, PixelStatus.BAD, Objects.requireNonNull(failure, "failure"),
            new double[0], new double[0], countRate);
    }

    public boolean isUsable() {
        return status == PixelStatus.FIT;
    }

    /** Weight of a bin, or NaN if the pixel is bad or the bin has no defined weight. */
    public double weight(int bin) {
        if (!isUsable() || bin < 0 || bin >= weights.length) {
            return Double.NaN;
        }
        return weights[bin];
    }

    @Override
    public double[] weights() {
        return weights.clone();
    }

    @Override
    public double[] weightErrors() {
        return weightErrors.clone();
    }
}
