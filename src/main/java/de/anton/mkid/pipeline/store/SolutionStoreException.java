package de.anton.mkid.pipeline.store;

import java.io.IOException;

/**
 * Thrown when the solution store cannot be read or written.
 */
public class SolutionStoreException extends IOException {

    public SolutionStoreException(String message) {
        super(message);
    }

    public SolutionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
