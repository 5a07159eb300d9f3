package de.anton.mkid.pipeline.algorithms;

import de.anton.mkid.pipeline.model.FitFailure;
import de.anton.mkid.pipeline.model.PhaseSamples;
import de.anton.mkid.pipeline.model.RawPhaseData;
import de.anton.mkid.pipeline.model.WavecalConfig;
import de.anton.mkid.pipeline.model.WavecalPixel;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Turns raw laser phase samples into a per-pixel phase to energy model.
 * <p>
 * Per pixel and reference line: drop lines with too few or too hot photons,
 * cut tail-riding photons, keep negative phases, histogram, fit a Gaussian
 * peak. A peak that does not converge is refitted once from a start point
 * derived from the pixel's converged peaks. Then a weighted polynomial goes
 * through the peak centers and must be monotonic over the usable phase range
 * and fit well enough. The resolving power of every peak is kept. Pixels are
 * independent; a failure marks the pixel bad and never stops the run.
 */
public class WavelengthCalibrationFitter {

    private static final Logger logger = LoggerFactory.getLogger(WavelengthCalibrationFitter.class);

    /** Planck constant times speed of light in eV nm. */
    public static final double HC_EV_NM = 1239.8419843320026;
    private static final int PARALLEL_THRESHOLD = 64;
    private static final double RANGE_SIGMAS = 3.0;
    /** 2 sqrt(2 ln 2) */
    static final double FWHM_PER_SIGMA = 2.0 * Math.sqrt(2.0 * Math.log(2.0));

    private final WavecalConfig config;
    private final GaussianPeakFitter peakFitter;

    public WavelengthCalibrationFitter(WavecalConfig config) {
        this(config, new GaussianPeakFitter(config.maxIterations()));
    }

    WavelengthCalibrationFitter(WavecalConfig config, GaussianPeakFitter peakFitter) {
        this.config = Objects.requireNonNull(config, "config");
        this.peakFitter = Objects.requireNonNull(peakFitter, "peakFitter");
    }

    public static double wavelengthToEnergy(double wavelengthNm) {
        return HC_EV_NM / wavelengthNm;
    }

    public static double energyToWavelength(double energyEv) {
        return HC_EV_NM / energyEv;
    }

    /**
     * Fits every pixel {@code 0..data.getPixels().endExclusive()-1}.
     *
     * @return one result per pixel, indexed by pixel id
     */
    public List<WavecalPixel> fit(RawPhaseData data) {
        Objects.requireNonNull(data, "data");
        int pixelCount = data.getPixels().endExclusive();
        logger.info("Fitting wavelength calibration for {} pixels over {} reference lines {} nm.",
            pixelCount, data.getLineCount(), Arrays.toString(data.getReferenceWavelengthsNm()));
        long start = System.nanoTime();

        WavecalPixel[] results = new WavecalPixel[pixelCount];
        IntStream pixels = IntStream.range(0, pixelCount);
        if (config.parallel() && pixelCount > PARALLEL_THRESHOLD) {
            pixels = pixels.parallel();
        }
        pixels.forEach(p -> results[p] = fitPixelSafely(data, p));

        long good = Arrays.stream(results).filter(WavecalPixel::isUsable).count();
        logger.info("Wavelength calibration fitted in {} ms: {} good, {} bad pixels.",
            (System.nanoTime() - start) / 1_000_000, good, pixelCount - good);
        return Collections.unmodifiableList(Arrays.asList(results));
    }

    private WavecalPixel fitPixelSafely(RawPhaseData data, int pixel) {
        try {
            return fitPixel(data, pixel);
        } catch (RuntimeException e) {
            logger.warn("Pixel {}: unexpected error during wavelength fit, flagged bad.", pixel, e);
            return WavecalPixel.bad(pixel, FitFailure.NUMERICAL_ERROR, 0);
        }
    }

    /** Fits one pixel. Package visible for tests. */
    WavecalPixel fitPixel(RawPhaseData data, int pixel) {
        double[] wavelengths = data.getReferenceWavelengthsNm();
        List<LinePeak> peaks = new ArrayList<>();
        List<Integer> failedLines = new ArrayList<>();
        PhaseHistogram[] histograms = new PhaseHistogram[wavelengths.length];
        int linesWithData = 0;

        for (int line = 0; line < wavelengths.length; line++) {
            double[] phases = selectPhases(data.samples(pixel, line), pixel, wavelengths[line]);
            if (phases.length == 0) {
                continue;
            }
            linesWithData++;
            histograms[line] = PhaseHistogram.build(phases, config.histogramBinWidth(),
                config.minimumPeakCounts(), config.histogramAttempts());
            Optional<GaussianPeakFitter.PeakFit> peak = peakFitter.fit(histograms[line]);
            if (peak.isEmpty()) {
                failedLines.add(line);
                logger.debug("Pixel {}: {} nm peak fit failed ({} bins).", pixel, wavelengths[line], histograms[line].size());
                continue;
            }
            peaks.add(new LinePeak(line, wavelengthToEnergy(wavelengths[line]), peak.get()));
        }

        int failedPeaks = 0;
        if (!peaks.isEmpty()) {
            List<LinePeak> converged = new ArrayList<>(peaks);
            for (int line : failedLines) {
                double energy = wavelengthToEnergy(wavelengths[line]);
                double[] guess = guessFromNeighbours(converged, energy, histograms[line].maxCount());
                Optional<GaussianPeakFitter.PeakFit> retry = peakFitter.fit(histograms[line], guess);
                if (retry.isPresent()) {
                    logger.debug("Pixel {}: {} nm peak recovered from a start at phase {}.", pixel, wavelengths[line],
                        guess[GaussianPeakFitter.CENTER]);
                    peaks.add(new LinePeak(line, energy, retry.get()));
                } else {
                    failedPeaks++;
                }
            }
        } else {
            failedPeaks = failedLines.size();
        }

        if (linesWithData == 0) {
            logger.debug("Pixel {}: no photons for any line.", pixel);
            return WavecalPixel.bad(pixel, FitFailure.NO_DATA, 0);
        }
        if (peaks.size() < 2) {
            FitFailure reason = linesWithData >= 2 && failedPeaks > 0
                ? FitFailure.PEAK_NOT_CONVERGED : FitFailure.INSUFFICIENT_REFERENCE_POINTS;
            logger.debug("Pixel {}: {} usable peaks is not enough for a calibration.", pixel, peaks.size());
            return WavecalPixel.bad(pixel, reason, peaks.size());
        }

        int n = peaks.size();
        double[] centers = new double[n];
        double[] variances = new double[n];
        double[] energies = new double[n];
        int lowest = 0;
        int highest = 0;
        for (int i = 0; i < n; i++) {
            LinePeak pk = peaks.get(i);
            centers[i] = pk.fit().center();
            variances[i] = pk.fit().centerError() * pk.fit().centerError();
            energies[i] = pk.energy();
            if (centers[i] < centers[lowest]) lowest = i;
            if (centers[i] > centers[highest]) highest = i;
        }
        double minPhase = centers[lowest] - RANGE_SIGMAS * peaks.get(lowest).fit().sigma();
        double maxPhase = centers[highest] + RANGE_SIGMAS * peaks.get(highest).fit().sigma();

        int order = Math.min(config.modelOrder(), n - 1);
        PhaseEnergyFitter.PolynomialFit model;
        try {
            model = PhaseEnergyFitter.fit(centers, variances, energies, order);
        } catch (SingularMatrixException e) {
            logger.debug("Pixel {}: phase to energy model is singular.", pixel);
            return WavecalPixel.bad(pixel, FitFailure.SINGULAR_MODEL, n);
        }
        if (!PhaseEnergyFitter.isMonotonic(model.coefficients(), minPhase, maxPhase)) {
            logger.debug("Pixel {}: model not monotonic over [{}, {}].", pixel, minPhase, maxPhase);
            return WavecalPixel.bad(pixel, FitFailure.NON_MONOTONIC, n);
        }
        if (!(model.reducedChiSquared() <= config.maxReducedChiSquared())) {
            logger.debug("Pixel {}: reduced chi2 {} above {}.", pixel, model.reducedChiSquared(),
                config.maxReducedChiSquared());
            return WavecalPixel.bad(pixel, FitFailure.POOR_FIT, n);
        }
        double[] resolvingPowers = resolvingPowers(peaks, model, wavelengths.length);
        logger.debug("Pixel {}: order {} model through {} peaks, reduced chi2 {}, R {}.",
            pixel, order, n, model.reducedChiSquared(), Arrays.toString(resolvingPowers));
        return WavecalPixel.fit(pixel, model.coefficients(), minPhase, maxPhase, model.reducedChiSquared(), n,
            resolvingPowers);
    }

    /** A converged peak under one reference line. */
    record LinePeak(int line, double energy, GaussianPeakFitter.PeakFit fit) { }

    /**
     * Start point for refitting a line from the converged peaks of the same
     * pixel: the center is interpolated in energy between the two nearest
     * peaks, or scaled from a single peak with phase proportional to energy.
     * The width is taken from the nearest peak.
     *
     * @return {amplitude, center, sigma}
     */
    static double[] guessFromNeighbours(List<LinePeak> converged, double energy, double amplitude) {
        List<LinePeak> byDistance = new ArrayList<>(converged);
        byDistance.sort(Comparator.comparingDouble((LinePeak pk) -> Math.abs(pk.energy() - energy))
            .thenComparingInt(LinePeak::line));
        LinePeak nearest = byDistance.get(0);
        double center;
        if (byDistance.size() >= 2 && byDistance.get(1).energy() != nearest.energy()) {
            LinePeak second = byDistance.get(1);
            double slope = (second.fit().center() - nearest.fit().center()) / (second.energy() - nearest.energy());
            center = nearest.fit().center() + (energy - nearest.energy()) * slope;
        } else {
            center = nearest.fit().center() * energy / nearest.energy();
        }
        return new double[] {Math.max(1.0, amplitude), center, nearest.fit().sigma()};
    }

    /**
     * Energy resolving power {@code E / dE} per line, with dE the FWHM of the
     * peak converted to energy through the model slope at the peak center.
     */
    private static double[] resolvingPowers(List<LinePeak> peaks, PhaseEnergyFitter.PolynomialFit model, int lines) {
        double[] r = new double[lines];
        Arrays.fill(r, Double.NaN);
        PolynomialFunction slope = model.function().polynomialDerivative();
        for (LinePeak pk : peaks) {
            double fwhmEnergy = FWHM_PER_SIGMA * pk.fit().sigma() * Math.abs(slope.value(pk.fit().center()));
            r[pk.line()] = fwhmEnergy > 0 ? pk.energy() / fwhmEnergy : Double.NaN;
        }
        return r;
    }

    /**
     * Photon selection for one line: at least two photons, line not hot,
     * tail-riding photons removed, negative phases only.
     */
    double[] selectPhases(PhaseSamples samples, int pixel, double wavelengthNm) {
        int n = samples.size();
        if (n < 2) {
            return new double[0];
        }
        long[] times = samples.timesMicros();
        double[] phases = samples.phases();
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) order[i] = i;
        Arrays.sort(order, (a, b) -> Long.compare(times[a], times[b]));

        long span = times[order[n - 1]] - times[order[0]];
        if (config.hotPixelRateCutoff() > 0 && span > 0) {
            double rate = n * 1e6 / span;
            if (rate > config.hotPixelRateCutoff()) {
                logger.debug("Pixel {}: {} nm removed for being too hot ({} > {} cps).",
                    pixel, wavelengthNm, rate, config.hotPixelRateCutoff());
                return new double[0];
            }
        }

        double[] kept = new double[n];
        int k = 0;
        long previous = Long.MIN_VALUE;
        for (int i = 0; i < n; i++) {
            int idx = order[i];
            boolean first = i == 0;
            boolean separated = first || times[idx] - previous > config.deadTimeMicros();
            previous = times[idx];
            if (separated && phases[idx] < 0) {
                kept[k++] = phases[idx];
            }
        }
        return Arrays.copyOf(kept, k);
    }
}
