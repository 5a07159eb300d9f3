package de.anton.mkid.pipeline;

import de.anton.mkid.pipeline.model.DatasetSpec;
import de.anton.mkid.pipeline.model.PhotonRecord;
import de.anton.mkid.pipeline.model.PhotonTable;
import de.anton.mkid.pipeline.model.RawPhaseData;
import org.apache.commons.math3.distribution.NormalDistribution;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic photon data for tests. Gaussian samples are normal quantiles,
 * not random draws, so every run sees the same numbers.
 */
public final class SyntheticPhotons {

    public static final String INSTRUMENT = "MEC";
    /** 10:00 on the test day, UNIX seconds. */
    public static final long T0 = 1_700_000_000L;
    public static final long PHOTON_SPACING_MICROS = 1_000;
    public static final double PEAK_SIGMA = 0.02;

    private SyntheticPhotons() {
        throw new IllegalStateException("Test fixture should not be instantiated.");
    }

    /** {@code n} quantiles of N(mean, sigma). */
    public static double[] gaussian(double mean, double sigma, int n) {
        NormalDistribution normal = new NormalDistribution(mean, sigma);
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = normal.inverseCumulativeProbability((i + 0.5) / n);
        }
        return values;
    }

    /** Adds one Gaussian laser peak for a pixel, photons spaced {@link #PHOTON_SPACING_MICROS} apart. */
    public static RawPhaseData.Builder addPeak(RawPhaseData.Builder builder, int pixel, double wavelengthNm,
                                               double centerPhase, int photons) {
        double[] phases = gaussian(centerPhase, PEAK_SIGMA, photons);
        for (int i = 0; i < photons; i++) {
            builder.add(pixel, wavelengthNm, i * PHOTON_SPACING_MICROS, phases[i]);
        }
        return builder;
    }

    public static DatasetSpec dataset(String name, long start, long stop) {
        return DatasetSpec.of(name, INSTRUMENT, start, stop, "memory:" + name);
    }

    /**
     * A wavelength calibrated flat table: each pixel sees {@code baseCounts * gain[p]}
     * photons per chunk in every wavelength bin, photons at the bin centers.
     */
    public static PhotonTable flatTable(DatasetSpec dataset, double[] gains, double[] binCentersNm,
                                        int chunks, double chunkSeconds, int baseCounts) {
        List<PhotonRecord> records = new ArrayList<>();
        long chunkMicros = (long) (chunkSeconds * 1e6);
        for (int c = 0; c < chunks; c++) {
            for (int p = 0; p < gains.length; p++) {
                for (double wvl : binCentersNm) {
                    addFlatPhotons(records, p, wvl, c * chunkMicros, chunkMicros, (int) Math.round(baseCounts * gains[p]));
                }
            }
        }
        PhotonTable table = new PhotonTable(dataset, gains.length, records);
        table.putHeader(PhotonTable.HEADER_WAVECAL, "synthetic");
        return table;
    }

    /** Spreads {@code count} photons evenly over one chunk. */
    public static void addFlatPhotons(List<PhotonRecord> records, int pixel, double wavelengthNm,
                                      long chunkStartMicros, long chunkMicros, int count) {
        for (int i = 0; i < count; i++) {
            long t = chunkStartMicros + (long) ((i + 0.5) * chunkMicros / count);
            records.add(new PhotonRecord(t, pixel, wavelengthNm));
        }
    }
}
