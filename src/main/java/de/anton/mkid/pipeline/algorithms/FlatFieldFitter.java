package de.anton.mkid.pipeline.algorithms;

import de.anton.mkid.pipeline.model.FitFailure;
import de.anton.mkid.pipeline.model.FlatPixel;
import de.anton.mkid.pipeline.model.FlatSolution;
import de.anton.mkid.pipeline.model.FlatcalConfig;
import de.anton.mkid.pipeline.model.PhotonFlags;
import de.anton.mkid.pipeline.model.PhotonRecord;
import de.anton.mkid.pipeline.model.PhotonTable;
import de.anton.mkid.pipeline.model.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Computes relative per-pixel, per-wavelength-bin response weights from a
 * wavelength calibrated flat exposure.
 * <p>
 * Each exposure segment is cut into time chunks. Per pixel and bin the chunk count
 * rates are trimmed at both ends and averaged; the weight is the median rate
 * over all good pixels divided by the pixel's own rate. A pixel with
 * twice the average response therefore gets weight 0.5.
 */
public class FlatFieldFitter {

    private static final Logger logger = LoggerFactory.getLogger(FlatFieldFitter.class);

    private static final int PARALLEL_THRESHOLD = 64;
    private static final double MICROS_PER_SECOND = 1e6;

    /**
     * Output of one flat fit.
     *
     * @param binEdgesNm wavelength bin edges the weights refer to
     * @param pixels     one result per pixel id
     */
    public record FlatFit(double[] binEdgesNm, List<FlatPixel> pixels) { }

    private final FlatcalConfig config;

    public FlatFieldFitter(FlatcalConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Fits weights for every pixel of a single-segment table.
     *
     * @param flat            wavelength calibrated flat photon table
     * @param exposureSeconds exposure covered by the table, starting at photon time zero
     */
    public FlatFit fit(PhotonTable flat, double exposureSeconds) {
        if (!(exposureSeconds > 0)) {
            throw new IllegalArgumentException("Flat exposure must be positive, was " + exposureSeconds);
        }
        return fitSegments(flat, List.of(new double[] {0, exposureSeconds}));
    }

    /**
     * Fits weights for every pixel of the table. Photon times count from the
     * start of the first segment; photons in gaps between segments are ignored.
     *
     * @param flat     wavelength calibrated flat photon table
     * @param coverage time segments of the flat exposure, UNIX seconds
     */
    public FlatFit fit(PhotonTable flat, Collection<TimeRange> coverage) {
        if (coverage == null || coverage.isEmpty()) {
            throw new IllegalArgumentException("Flat coverage cannot be empty");
        }
        List<TimeRange> sorted = new ArrayList<>(coverage);
        Collections.sort(sorted);
        long origin = sorted.get(0).start();
        List<double[]> segments = new ArrayList<>();
        for (TimeRange r : sorted) {
            if (r.duration() > 0) {
                segments.add(new double[] {r.start() - origin, r.stop() - origin});
            }
        }
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Flat exposure must be positive, coverage was " + coverage);
        }
        return fitSegments(flat, segments);
    }

    private FlatFit fitSegments(PhotonTable flat, List<double[]> segments) {
        Objects.requireNonNull(flat, "flat");
        double[] edges = config.wavelengthBinEdges();
        int bins = edges.length - 1;
        int pixelCount = flat.getPixelCount();

        List<double[]> windows = chunkWindows(segments);
        int nChunks = windows.size();
        double[] chunkSeconds = new double[nChunks];
        double usedSeconds = 0;
        for (int c = 0; c < nChunks; c++) {
            chunkSeconds[c] = windows.get(c)[1] - windows.get(c)[0];
            usedSeconds += chunkSeconds[c];
        }
        logger.info("Fitting flat field for {} pixels: {} chunks over {} s in {} segment(s), {} wavelength bins {}-{} nm.",
            pixelCount, nChunks, usedSeconds, segments.size(), bins, edges[0], edges[bins]);
        long start = System.nanoTime();

        long[][][] counts = countPhotons(flat, edges, windows);

        // Per-pixel trimmed mean rate per bin; pixels that are bad already get a result here.
        double[][] rates = new double[pixelCount][];
        double[][] keptCounts = new double[pixelCount][];
        FlatPixel[] results = new FlatPixel[pixelCount];
        final double totalSeconds = usedSeconds;
        pixelStream(pixelCount).forEach(p -> {
            long total = 0;
            for (int c = 0; c < nChunks; c++) {
                for (int b = 0; b < bins; b++) total += counts[p][c][b];
            }
            double countRate = total / totalSeconds;
            if (total == 0) {
                results[p] = FlatPixel.bad(p, FitFailure.NO_COUNTS, 0);
                return;
            }
            if (config.rateCutoff() > 0 && countRate > config.rateCutoff()) {
                logger.debug("Pixel {}: count rate {} above cutoff {}.", p, countRate, config.rateCutoff());
                results[p] = FlatPixel.bad(p, FitFailure.RATE_ABOVE_CUTOFF, countRate);
                return;
            }
            int trimEach = RobustStatistics.trimCount(nChunks, config.trimFraction());
            if (nChunks - 2 * trimEach <= 0) {
                results[p] = FlatPixel.bad(p, FitFailure.NO_VALID_CHUNKS, countRate);
                return;
            }
            double[] binRates = new double[bins];
            double[] binCounts = new double[bins];
            double[] chunkRates = new double[nChunks];
            double[] chunkCounts = new double[nChunks];
            for (int b = 0; b < bins; b++) {
                for (int c = 0; c < nChunks; c++) {
                    chunkCounts[c] = counts[p][c][b];
                    chunkRates[c] = chunkCounts[c] / chunkSeconds[c];
                }
                binRates[b] = RobustStatistics.trimmedMean(chunkRates, trimEach);
                binCounts[b] = RobustStatistics.trimmedSum(chunkCounts, trimEach);
            }
            rates[p] = binRates;
            keptCounts[p] = binCounts;
        });

        double[] reference = new double[bins];
        for (int b = 0; b < bins; b++) {
            double[] column = new double[pixelCount];
            for (int p = 0; p < pixelCount; p++) {
                column[p] = rates[p] != null && rates[p][b] > 0 ? rates[p][b] : Double.NaN;
            }
            reference[b] = RobustStatistics.median(column);
        }
        logger.debug("Flat reference rates per bin: {}", Arrays.toString(reference));

        pixelStream(pixelCount).filter(p -> results[p] == null)
            .forEach(p -> results[p] = weigh(p, rates[p], keptCounts[p], reference, totalSeconds));

        long good = Arrays.stream(results).filter(FlatPixel::isUsable).count();
        logger.info("Flat field fitted in {} ms: {} good, {} bad pixels.",
            (System.nanoTime() - start) / 1_000_000, good, pixelCount - good);
        return new FlatFit(edges, Collections.unmodifiableList(Arrays.asList(results)));
    }

    /**
     * Cuts each segment into whole chunks, earliest first, at most
     * {@code maxChunks} in total. If no segment holds a whole chunk, every
     * segment becomes one chunk.
     *
     * @return {start, stop} second offsets per chunk, sorted
     */
    List<double[]> chunkWindows(List<double[]> segments) {
        double chunk = config.chunkTimeSeconds();
        List<double[]> windows = new ArrayList<>();
        for (double[] segment : segments) {
            int n = (int) Math.floor((segment[1] - segment[0]) / chunk + 1e-9);
            for (int i = 0; i < n && windows.size() < config.maxChunks(); i++) {
                windows.add(new double[] {segment[0] + i * chunk, segment[0] + (i + 1) * chunk});
            }
        }
        if (windows.isEmpty()) {
            logger.warn("Flat exposure has no segment as long as one {} s chunk, using each segment as a single chunk.",
                chunk);
            for (double[] segment : segments) {
                if (windows.size() < config.maxChunks()) {
                    windows.add(segment.clone());
                }
            }
        }
        return windows;
    }

    private FlatPixel weigh(int pixel, double[] rates, double[] keptCounts, double[] reference, double usedSeconds) {
        int bins = rates.length;
        double[] weights = new double[bins];
        double[] errors = new double[bins];
        boolean any = false;
        double total = 0;
        for (int b = 0; b < bins; b++) {
            total += keptCounts[b];
            double w = rates[b] > 0 && reference[b] > 0 ? reference[b] / rates[b] : Double.NaN;
            if (Double.isNaN(w)) {
                weights[b] = Double.NaN;
                errors[b] = Double.NaN;
                continue;
            }
            weights[b] = Math.max(0, w);
            errors[b] = weights[b] / Math.sqrt(keptCounts[b]);
            any = true;
        }
        double countRate = total / usedSeconds;
        if (!any) {
            logger.debug("Pixel {}: no wavelength bin with a defined weight.", pixel);
            return FlatPixel.bad(pixel, FitFailure.NO_COUNTS, countRate);
        }
        return FlatPixel.fit(pixel, weights, errors, countRate);
    }

    /** Counts per [pixel][chunk][bin], skipping uncalibrated, out-of-range and out-of-chunk photons. */
    private long[][][] countPhotons(PhotonTable flat, double[] edges, List<double[]> windows) {
        int pixelCount = flat.getPixelCount();
        int bins = edges.length - 1;
        int chunks = windows.size();
        long[][][] counts = new long[pixelCount][chunks][bins];
        long[] startMicros = new long[chunks];
        long[] stopMicros = new long[chunks];
        for (int c = 0; c < chunks; c++) {
            startMicros[c] = Math.round(windows.get(c)[0] * MICROS_PER_SECOND);
            stopMicros[c] = Math.round(windows.get(c)[1] * MICROS_PER_SECOND);
        }
        long skippedUncalibrated = 0;
        long skippedRange = 0;
        long skippedTime = 0;
        for (PhotonRecord r : flat.getRecords()) {
            if (r.getPixel() < 0 || r.getPixel() >= pixelCount) {
                continue;
            }
            if (r.hasFlag(PhotonFlags.WAVECAL_UNCALIBRATED) || Double.isNaN(r.getWavelength())) {
                skippedUncalibrated++;
                continue;
            }
            int chunk = chunkOf(startMicros, stopMicros, r.getTimeMicros());
            if (chunk < 0) {
                skippedTime++;
                continue;
            }
            int bin = FlatSolution.binOf(edges, r.getWavelength());
            if (bin < 0) {
                skippedRange++;
                continue;
            }
            counts[r.getPixel()][chunk][bin]++;
        }
        logger.debug("Flat photons skipped: {} uncalibrated, {} outside wavelength range, {} outside chunks.",
            skippedUncalibrated, skippedRange, skippedTime);
        return counts;
    }

    /** Index of the chunk holding {@code t}, or -1. Chunks are sorted and do not overlap. */
    private static int chunkOf(long[] startMicros, long[] stopMicros, long t) {
        int i = Arrays.binarySearch(startMicros, t);
        if (i < 0) {
            i = -i - 2; // last chunk starting before t
        }
        return i >= 0 && t < stopMicros[i] ? i : -1;
    }

    private IntStream pixelStream(int pixelCount) {
        IntStream s = IntStream.range(0, pixelCount);
        return config.parallel() && pixelCount > PARALLEL_THRESHOLD ? s.parallel() : s;
    }
}
