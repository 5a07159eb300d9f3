package de.anton.mkid.pipeline.algorithms;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Phase height histogram of one pixel under one reference line.
 * <p>
 * Bin edges are laid out downwards from the largest phase so the first edge
 * sits on the detection threshold side of the data. The bin width is doubled
 * until the tallest bin holds the requested number of counts or the attempts
 * run out.
 */
public final class PhaseHistogram {

    private static final Logger logger = LoggerFactory.getLogger(PhaseHistogram.class);

    private final double[] centers;
    private final double[] counts;
    private final double binWidth;

    private PhaseHistogram(double[] centers, double[] counts, double binWidth) {
        this.centers = centers;
        this.counts = counts;
        this.binWidth = binWidth;
    }

    public static PhaseHistogram build(double[] phases, double initialBinWidth, int minimumPeakCounts, int attempts) {
        if (phases == null || phases.length == 0) {
            return new PhaseHistogram(new double[0], new double[0], initialBinWidth);
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double p : phases) {
            min = Math.min(min, p);
            max = Math.max(max, p);
        }

        PhaseHistogram h = null;
        for (int attempt = 0; attempt < Math.max(1, attempts); attempt++) {
            double width = initialBinWidth * (1L << attempt);
            h = histogram(phases, min, max, width);
            if (h.maxCount() >= minimumPeakCounts) {
                break;
            }
        }
        logger.trace("Histogram of {} phases: {} bins of width {}", phases.length, h.size(), h.binWidth);
        return h;
    }

    private static PhaseHistogram histogram(double[] phases, double min, double max, double width) {
        int bins = Math.max(1, (int) Math.ceil((max - min) / width));
        double firstEdge = max - bins * width;
        double[] counts = new double[bins];
        for (double p : phases) {
            int idx = (int) Math.floor((p - firstEdge) / width);
            // every phase lies in [firstEdge, max]; clamp rounding at both ends
            counts[Math.min(bins - 1, Math.max(0, idx))]++;
        }
        double[] centers = new double[bins];
        for (int i = 0; i < bins; i++) {
            centers[i] = firstEdge + (i + 0.5) * width;
        }
        return new PhaseHistogram(centers, counts, width);
    }

    public int size() { return centers.length; }
    public double binWidth() { return binWidth; }
    public double[] centers() { return centers.clone(); }
    public double[] counts() { return counts.clone(); }

    public double maxCount() {
        double m = 0;
        for (double c : counts) m = Math.max(m, c);
        return m;
    }

    public double totalCount() {
        double s = 0;
        for (double c : counts) s += c;
        return s;
    }

    /**
     * Per-bin variance from the Poisson maximum likelihood estimate
     * {@code sqrt(n^2 + 1/4) - 1/2}, floored at 1 so empty bins keep a finite weight.
     */
    public double[] variances() {
        double[] v = new double[counts.length];
        for (int i = 0; i < counts.length; i++) {
            v[i] = Math.max(1.0, Math.sqrt(counts[i] * counts[i] + 0.25) - 0.5);
        }
        return v;
    }
}
