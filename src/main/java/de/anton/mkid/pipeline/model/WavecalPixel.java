package de.anton.mkid.pipeline.model;

import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;

import java.util.Objects;

/**
 * Per-pixel wavelength calibration result: either a fitted phase to energy
 * polynomial or a bad pixel with a reason.
 *
 * @param pixel             pixel id
 * @param status            {@link PixelStatus#FIT} or {@link PixelStatus#BAD}
 * @param failure           reason when bad, null when fit
 * @param coefficients      phase to energy (eV) polynomial, ascending powers; empty when bad
 * @param minPhase          lower end of the usable phase range
 * @param maxPhase          upper end of the usable phase range
 * @param reducedChiSquared goodness of the model fit
 * @param referencePoints   number of peaks the model went through
 * @param resolvingPowers   energy resolving power E/dE (FWHM) per reference line, NaN for lines
 *                          without a peak; empty when bad
 */
public record WavecalPixel(
    int pixel,
    PixelStatus status,
    FitFailure failure,
    double[] coefficients,
    double minPhase,
    double maxPhase,
    double reducedChiSquared,
    int referencePoints,
    double[] resolvingPowers
) {

    public WavecalPixel {
        Objects.requireNonNull(status, "status");
        coefficients = coefficients == null ? new double[0] : coefficients.clone();
        resolvingPowers = resolvingPowers == null ? new double[0] : resolvingPowers.clone();
    }

    public static WavecalPixel fit(int pixel, double[] coefficients, double minPhase, double maxPhase,
                                   double reducedChiSquared, int referencePoints) {
        return fit(pixel, coefficients, minPhase, maxPhase, reducedChiSquared, referencePoints, null);
    }

    public static WavecalPixel fit(int pixel, double[] coefficients, double minPhase, double maxPhase,
                                   double reducedChiSquared, int referencePoints, double[] resolvingPowers) {
        return new WavecalPixel(pixel, PixelStatus.FIT, null, coefficients, minPhase, maxPhase,
            reducedChiSquared, referencePoints, resolvingPowers);
    }

    public static WavecalPixel bad(int pixel, FitFailure failure, int referencePoints) {
        return new WavecalPixel(pixel, PixelStatus.BAD, Objects.requireNonNull(failure, "failure"),
            new double[0], Double.NaN, Double.NaN, Double.NaN, referencePoints, new double[0]);
    }

    public boolean isUsable() {
        return status == PixelStatus.FIT && coefficients.length > 0;
    }

    /** Photon energy in eV for a raw phase height. Only meaningful for usable pixels. */
    public double energyAt(double phase) {
        return new PolynomialFunction(coefficients).value(phase);
    }

    @Override
    public double[] coefficients() {
        return coefficients.clone();
    }

    @Override
    public double[] resolvingPowers() {
        return resolvingPowers.clone();
    }

    /**
     * Resolving power under one reference line.
     *
     * @return NaN if the line had no peak or is outside the stored lines
     */
    public double resolvingPower(int line) {
        return line >= 0 && line < resolvingPowers.length ? resolvingPowers[line] : Double.NaN;
    }
}
