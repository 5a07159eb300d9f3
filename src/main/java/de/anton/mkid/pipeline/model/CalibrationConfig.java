package de.anton.mkid.pipeline.model;

import java.util.SortedMap;

/**
 * Snapshot of the configuration of one calibration step.
 * <p>
 * Implementations are immutable. {@link #fingerprintFields()} is the declared
 * set of fields that change the output of the fitter; anything left out of it
 * (threading, report switches) can change freely without invalidating stored
 * solutions.
 */
public interface CalibrationConfig {

    CalibrationKind kind();

    /** Schema/algorithm version of this step configuration. */
    int version();

    /**
     * The fit-relevant fields, keyed by a stable name. Values must render
     * deterministically through {@link String#valueOf(Object)}.
     */
    SortedMap<String, Object> fingerprintFields();
}
