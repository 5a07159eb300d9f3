package de.anton.mkid.pipeline.service;

import de.anton.mkid.pipeline.algorithms.WavelengthCalibrationFitter;
import de.anton.mkid.pipeline.model.ApplyReport;
import de.anton.mkid.pipeline.model.CalibrationSolution;
import de.anton.mkid.pipeline.model.FlatPixel;
import de.anton.mkid.pipeline.model.FlatSolution;
import de.anton.mkid.pipeline.model.PhotonFlags;
import de.anton.mkid.pipeline.model.PhotonRecord;
import de.anton.mkid.pipeline.model.PhotonTable;
import de.anton.mkid.pipeline.model.WavecalPixel;
import de.anton.mkid.pipeline.model.WavelengthSolution;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.BitSet;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Applies a calibration solution to a photon table in place.
 * <p>
 * Application is destructive: the previous wavelength and weight values are
 * not kept. Applying a solution to a table that was already calibrated
 * compounds the correction; this class neither detects nor prevents it.
 * Callers that need the raw values must copy the table first.
 */
public class SolutionApplier {

    private static final Logger logger = LoggerFactory.getLogger(SolutionApplier.class);

    /**
     * Applies the solution to every record of the table.
     *
     * @throws IllegalStateException if another thread is writing the table
     */
    public ApplyReport apply(CalibrationSolution solution, PhotonTable table) {
        Objects.requireNonNull(solution, "solution");
        Objects.requireNonNull(table, "table");
        ReentrantLock lock = table.writeLock();
        if (!lock.tryLock()) {
            throw new IllegalStateException("Photon table " + table.getName() + " is being written by another caller");
        }
        try {
            ApplyReport report;
            if (solution instanceof WavelengthSolution) {
                report = applyWavecal((WavelengthSolution) solution, table);
            } else if (solution instanceof FlatSolution) {
                report = applyFlatcal((FlatSolution) solution, table);
            } else {
                throw new IllegalArgumentException("Unsupported solution type " + solution.getClass().getName());
            }
            table.putHeader(solution.getKind().stepName(), solution.getSolutionId());
            logger.info("{}", report);
            return report;
        } finally {
            lock.unlock();
        }
    }

    private ApplyReport applyWavecal(WavelengthSolution solution, PhotonTable table) {
        int pixelCount = Math.max(table.getPixelCount(), solution.getPixelCount());
        PolynomialFunction[] models = new PolynomialFunction[pixelCount];
        for (WavecalPixel p : solution.getPixels()) {
            if (p.isUsable()) {
                models[p.pixel()] = new PolynomialFunction(p.coefficients());
            }
        }
        BitSet calibratedPixels = new BitSet();
        BitSet flaggedPixels = new BitSet();
        long calibrated = 0;
        long flagged = 0;
        for (PhotonRecord r : table.getRecords()) {
            int pixel = r.getPixel();
            PolynomialFunction model = pixel >= 0 && pixel < models.length ? models[pixel] : null;
            double energy = model == null ? Double.NaN : model.value(r.getWavelength());
            if (energy > 0 && Double.isFinite(energy)) {
                r.setWavelength(WavelengthCalibrationFitter.energyToWavelength(energy));
                calibrated++;
                calibratedPixels.set(pixel);
            } else {
                r.addFlags(PhotonFlags.WAVECAL_UNCALIBRATED);
                flagged++;
                if (pixel >= 0) flaggedPixels.set(pixel);
            }
        }
        flaggedPixels.andNot(calibratedPixels);
        return new ApplyReport(solution.getKind(), solution.getSolutionId(), table.getName(),
            calibrated, flagged, calibratedPixels.cardinality(), flaggedPixels.cardinality());
    }

    private ApplyReport applyFlatcal(FlatSolution solution, PhotonTable table) {
        BitSet calibratedPixels = new BitSet();
        BitSet flaggedPixels = new BitSet();
        long calibrated = 0;
        long flagged = 0;
        for (PhotonRecord r : table.getRecords()) {
            int pixel = r.getPixel();
            int bin = solution.binOf(r.getWavelength());
            FlatPixel flat = solution.pixel(pixel);
            boolean noWavelength = r.hasFlag(PhotonFlags.WAVECAL_UNCALIBRATED) || Double.isNaN(r.getWavelength());
            double weight = flat == null || noWavelength ? Double.NaN : flat.weight(bin);
            if (!Double.isNaN(weight)) {
                r.setWeight(r.getWeight() * Math.max(0, weight));
                calibrated++;
                calibratedPixels.set(pixel);
                continue;
            }
            int bits = PhotonFlags.FLATCAL_UNCALIBRATED;
            if (!noWavelength && bin == FlatSolution.BELOW_RANGE) {
                bits |= PhotonFlags.FLAT_BELOW_RANGE;
            } else if (!noWavelength && bin == FlatSolution.ABOVE_RANGE) {
                bits |= PhotonFlags.FLAT_ABOVE_RANGE;
            }
            r.addFlags(bits);
            flagged++;
            if (pixel >= 0) flaggedPixels.set(pixel);
        }
        flaggedPixels.andNot(calibratedPixels);
        return new ApplyReport(solution.getKind(), solution.getSolutionId(), table.getName(),
            calibrated, flagged, calibratedPixels.cardinality(), flaggedPixels.cardinality());
    }
}
