package de.anton.mkid.pipeline.algorithms;

import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;

/**
 * Weighted least squares polynomial through (peak phase, line energy) points.
 * <p>
 * Points are weighted by the inverse variance of the fitted peak phase. The
 * goodness of fit is the reduced chi-squared of the residuals expressed in
 * phase units (energy residual divided by the model slope).
 */
public final class PhaseEnergyFitter {

    /** Number of points at which monotonicity is checked across the usable range. */
    static final int MONOTONIC_SAMPLES = 200;
    private static final double MIN_PHASE_VARIANCE = 1e-16;
    private static final double SINGULARITY_THRESHOLD = 1e-12;

    private PhaseEnergyFitter() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }

    /**
     * @param coefficients      ascending powers of phase, energy in eV
     * @param reducedChiSquared 0 for an exactly determined fit
     */
    public record PolynomialFit(double[] coefficients, double reducedChiSquared) {

        public PolynomialFunction function() {
            return new PolynomialFunction(coefficients);
        }
    }

    /**
     * Fits an energy(phase) polynomial of the given order.
     *
     * @throws SingularMatrixException if the points cannot determine the polynomial
     *         (e.g. two peaks at the same phase)
     * @throws IllegalArgumentException if there are fewer points than coefficients
     */
    public static PolynomialFit fit(double[] phases, double[] phaseVariances, double[] energies, int order) {
        int n = phases.length;
        int terms = order + 1;
        if (n < terms) {
            throw new IllegalArgumentException(String.format(
                "Order %d needs at least %d points, got %d", order, terms, n));
        }
        if (phaseVariances.length != n || energies.length != n) {
            throw new IllegalArgumentException("phases, variances and energies must have equal length");
        }

        RealMatrix design = new Array2DRowRealMatrix(n, terms);
        RealVector target = new ArrayRealVector(n);
        for (int i = 0; i < n; i++) {
            double w = Math.sqrt(1.0 / Math.max(MIN_PHASE_VARIANCE, phaseVariances[i]));
            double power = 1.0;
            for (int j = 0; j < terms; j++) {
                design.setEntry(i, j, w * power);
                power *= phases[i];
            }
            target.setEntry(i, w * energies[i]);
        }
        DecompositionSolver solver = new QRDecomposition(design, SINGULARITY_THRESHOLD).getSolver();
        if (!solver.isNonSingular()) {
            throw new SingularMatrixException();
        }
        double[] coefficients = solver.solve(target).toArray();

        int dof = n - terms;
        double chi2 = 0;
        if (dof > 0) {
            PolynomialFunction f = new PolynomialFunction(coefficients);
            PolynomialFunction slope = f.polynomialDerivative();
            for (int i = 0; i < n; i++) {
                double phaseResidual = (energies[i] - f.value(phases[i])) / slope.value(phases[i]);
                chi2 += phaseResidual * phaseResidual / Math.max(MIN_PHASE_VARIANCE, phaseVariances[i]);
            }
            chi2 /= dof;
        }
        return new PolynomialFit(coefficients, chi2);
    }

    /**
     * True if the polynomial's slope keeps one strict sign over [lo, hi].
     */
    public static boolean isMonotonic(double[] coefficients, double lo, double hi) {
        if (!(hi >= lo)) {
            return false;
        }
        PolynomialFunction slope = new PolynomialFunction(coefficients).polynomialDerivative();
        int sign = 0;
        for (int i = 0; i <= MONOTONIC_SAMPLES; i++) {
            double x = lo + (hi - lo) * i / MONOTONIC_SAMPLES;
            double s = Math.signum(slope.value(x));
            if (s == 0 || Double.isNaN(s)) {
                return false;
            }
            if (sign == 0) {
                sign = (int) s;
            } else if (sign != (int) s) {
                return false;
            }
        }
        return true;
    }
}
