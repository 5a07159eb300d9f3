package de.anton.mkid.pipeline.store;

import de.anton.mkid.pipeline.model.CalibrationSolution;
import de.anton.mkid.pipeline.model.Fingerprint;

import java.util.Optional;

/**
 * Persistent mapping from fingerprints to calibration solutions.
 */
public interface SolutionStore {

    /**
     * Compatibility lookup: a stored solution qualifies if step, instrument
     * and configuration digest equal the query's and its time coverage
     * contains the query's.
     *
     * @return the exact match if stored, else the most recently created
     *         qualifying solution, else empty
     */
    Optional<CalibrationSolution> find(Fingerprint query) throws SolutionStoreException;

    /**
     * Persists a solution, all or nothing. Solutions with different
     * fingerprints never replace each other; concurrent writers of the same
     * fingerprint converge on one artifact.
     */
    void put(CalibrationSolution solution) throws SolutionStoreException;
}
