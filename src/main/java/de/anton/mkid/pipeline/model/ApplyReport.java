package de.anton.mkid.pipeline.model;

/**
 * Summary of one application of a solution to a photon table.
 *
 * @param kind                calibration step applied
 * @param solutionId          id of the applied solution
 * @param table               name of the mutated table
 * @param recordsCalibrated   records whose value was changed
 * @param recordsFlagged      records left unchanged and flagged uncalibrated
 * @param pixelsCalibrated    pixels with at least one record calibrated
 * @param pixelsUncalibrated  pixels with records but no usable solution
 */
public record ApplyReport(
    CalibrationKind kind,
    String solutionId,
    String table,
    long recordsCalibrated,
    long recordsFlagged,
    int pixelsCalibrated,
    int pixelsUncalibrated
) {

    public long recordsTotal() {
        return recordsCalibrated + recordsFlagged;
    }

    @Override
    public String toString() {
        return String.format("%s applied to %s with %s: %d records calibrated, %d flagged; %d pixels calibrated, %d uncalibrated",
            kind, table, solutionId, recordsCalibrated, recordsFlagged, pixelsCalibrated, pixelsUncalibrated);
    }
}
