package de.anton.mkid.pipeline.service;

/**
 * A stored solution failed the provenance re-check against the current
 * request. The resolver treats it as a cache miss.
 */
public class CacheInconsistencyException extends Exception {

    public CacheInconsistencyException(String message) {
        super(message);
    }
}
