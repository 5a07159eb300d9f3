package de.anton.mkid.pipeline.service;

import java.io.IOException;

/**
 * Thrown when the photon-table provider cannot supply the data a calibration
 * step needs (missing files, corrupt archive, uncalibrated flat table).
 * No solution is written when this surfaces from a fetch.
 */
public class DataUnavailableException extends IOException {

    public DataUnavailableException(String message) {
        super(message);
    }

    public DataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
