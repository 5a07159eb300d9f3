package de.anton.mkid.pipeline.algorithms;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Fits {@code a * exp(-(x - mu)^2 / (2 s^2))} to a phase histogram with a
 * weighted Levenberg-Marquardt least squares fit.
 * <p>
 * The default start point is derived from the histogram only, so the same
 * histogram always gives the same result. Callers that know where the peak
 * should be can pass their own start point.
 */
public class GaussianPeakFitter {

    private static final Logger logger = LoggerFactory.getLogger(GaussianPeakFitter.class);

    /** Parameters of the Gaussian. */
    static final int AMPLITUDE = 0;
    static final int CENTER = 1;
    static final int SIGMA = 2;
    /** Number of free parameters; a histogram needs twice as many bins. */
    public static final int PARAMETER_COUNT = 3;

    private static final double COVARIANCE_SINGULARITY_THRESHOLD = 1e-14;

    /**
     * A converged peak.
     *
     * @param amplitude   peak height in counts
     * @param center      peak phase
     * @param centerError one sigma uncertainty of the center
     * @param sigma       peak width
     * @param iterations  optimizer iterations used
     */
    public record PeakFit(double amplitude, double center, double centerError, double sigma, int iterations) { }

    private final int maxIterations;

    public GaussianPeakFitter(int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive, was " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    /**
     * Fits the peak of a histogram.
     *
     * @return the fit, or empty if the optimizer failed or the result is not a
     *         plausible peak inside the histogram
     */
    public Optional<PeakFit> fit(PhaseHistogram histogram) {
        if (histogram.size() < 2 * PARAMETER_COUNT) {
            logger.trace("Peak fit skipped: only {} bins.", histogram.size());
            return Optional.empty();
        }
        return fit(histogram, initialGuess(histogram.centers(), histogram.counts(), histogram.binWidth()));
    }

    /**
     * Fits the peak of a histogram from the given start point.
     *
     * @param start {amplitude, center, sigma}
     */
    public Optional<PeakFit> fit(PhaseHistogram histogram, double[] start) {
        if (start == null || start.length != PARAMETER_COUNT) {
            throw new IllegalArgumentException("Start point needs " + PARAMETER_COUNT + " parameters");
        }
        if (histogram.size() < 2 * PARAMETER_COUNT) {
            logger.trace("Peak fit skipped: only {} bins.", histogram.size());
            return Optional.empty();
        }
        final double[] x = histogram.centers();
        double[] y = histogram.counts();
        double[] variances = histogram.variances();
        double[] weights = new double[variances.length];
        for (int i = 0; i < variances.length; i++) {
            weights[i] = 1.0 / variances[i];
        }

        MultivariateJacobianFunction gaussian = point -> {
            double a = point.getEntry(AMPLITUDE);
            double mu = point.getEntry(CENTER);
            double s = point.getEntry(SIGMA);
            RealVector value = new ArrayRealVector(x.length);
            RealMatrix jacobian = new Array2DRowRealMatrix(x.length, PARAMETER_COUNT);
            for (int i = 0; i < x.length; i++) {
                double d = x[i] - mu;
                double e = Math.exp(-d * d / (2 * s * s));
                value.setEntry(i, a * e);
                jacobian.setEntry(i, AMPLITUDE, e);
                jacobian.setEntry(i, CENTER, a * e * d / (s * s));
                jacobian.setEntry(i, SIGMA, a * e * d * d / (s * s * s));
            }
            return new Pair<>(value, jacobian);
        };

        final double minSigma = histogram.binWidth() * 1e-3;
        LeastSquaresProblem problem = new LeastSquaresBuilder()
            .start(start.clone())
            .model(gaussian)
            .target(y)
            .weight(new DiagonalMatrix(weights))
            .maxEvaluations(maxIterations)
            .maxIterations(maxIterations)
            .parameterValidator(p -> {
                RealVector v = p.copy();
                v.setEntry(SIGMA, Math.max(minSigma, Math.abs(p.getEntry(SIGMA))));
                return v;
            })
            .build();

        try {
            LeastSquaresOptimizer.Optimum optimum = new LevenbergMarquardtOptimizer().optimize(problem);
            RealVector p = optimum.getPoint();
            RealVector errors = optimum.getSigma(COVARIANCE_SINGULARITY_THRESHOLD);
            PeakFit fit = new PeakFit(p.getEntry(AMPLITUDE), p.getEntry(CENTER), errors.getEntry(CENTER),
                Math.abs(p.getEntry(SIGMA)), optimum.getIterations());
            if (!isPlausible(fit, x, histogram.binWidth())) {
                logger.trace("Peak fit rejected: {}", fit);
                return Optional.empty();
            }
            return Optional.of(fit);
        } catch (MathIllegalStateException | MathIllegalArgumentException e) {
            // TooManyEvaluations, Convergence and SingularMatrix all end up here
            logger.trace("Peak fit did not converge: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static double[] initialGuess(double[] x, double[] y, double binWidth) {
        int peak = 0;
        double total = 0;
        for (int i = 0; i < y.length; i++) {
            if (y[i] > y[peak]) peak = i;
            total += y[i];
        }
        double center = x[peak];
        double spread = 0;
        if (total > 0) {
            for (int i = 0; i < y.length; i++) {
                double d = x[i] - center;
                spread += y[i] * d * d;
            }
            spread = Math.sqrt(spread / total);
        }
        return new double[] {y[peak], center, Math.max(binWidth, spread)};
    }

    private static boolean isPlausible(PeakFit fit, double[] x, double binWidth) {
        double lo = x[0] - binWidth / 2;
        double hi = x[x.length - 1] + binWidth / 2;
        return fit.amplitude() > 0
            && fit.center() >= lo && fit.center() <= hi
            && fit.sigma() > 0 && fit.sigma() < (hi - lo)
            && Double.isFinite(fit.centerError());
    }
}
