package de.anton.mkid.pipeline.service;

import de.anton.mkid.pipeline.model.CalibrationConfig;
import de.anton.mkid.pipeline.model.CalibrationSolution;
import de.anton.mkid.pipeline.model.DatasetSpec;
import de.anton.mkid.pipeline.model.Fingerprint;
import de.anton.mkid.pipeline.model.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes fingerprints of calibration requests. Pure, no I/O.
 * <p>
 * The configuration digest is a SHA-256 over the step name and the
 * configuration's declared fingerprint fields in key order. The dataset
 * contributes its instrument and time coverage, never its name.
 */
public class FingerprintService {

    private static final Logger logger = LoggerFactory.getLogger(FingerprintService.class);

    private static final String DIGEST_ALGORITHM = "SHA-256";

    public Fingerprint fingerprint(CalibrationConfig config, DatasetSpec dataset) {
        Objects.requireNonNull(dataset, "dataset");
        return fingerprint(config, dataset.instrumentId(), dataset.coverage());
    }

    public Fingerprint fingerprint(CalibrationConfig config, String instrumentId, List<TimeRange> coverage) {
        Objects.requireNonNull(config, "config");
        Fingerprint fp = new Fingerprint(config.kind(), instrumentId, configDigest(config), coverage);
        logger.trace("Fingerprint {} for {}", fp, config);
        return fp;
    }

    /** Hex SHA-256 of the fit-relevant fields of a configuration. */
    public String configDigest(CalibrationConfig config) {
        StringBuilder canonical = new StringBuilder("step=").append(config.kind().stepName());
        for (Map.Entry<String, Object> e : config.fingerprintFields().entrySet()) {
            canonical.append(';').append(e.getKey()).append('=').append(e.getValue());
        }
        try {
            MessageDigest md = MessageDigest.getInstance(DIGEST_ALGORITHM);
            return HexFormat.of().formatHex(md.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(DIGEST_ALGORITHM + " not available", e);
        }
    }

    /**
     * Re-derives a stored solution's fingerprint from its provenance and
     * configuration snapshot and checks it can serve {@code query}.
     *
     * @throws CacheInconsistencyException if the provenance does not reproduce
     *         the stored fingerprint or the solution is not compatible with the query
     */
    public void verifyProvenance(CalibrationSolution solution, Fingerprint query) throws CacheInconsistencyException {
        Fingerprint stored = solution.getFingerprint();
        if (solution.getConfig() == null || solution.getConfig().kind() != stored.kind()) {
            throw new CacheInconsistencyException("Solution " + solution.getSolutionId()
                + " has no configuration snapshot for step " + stored.kind());
        }
        if (solution.getProvenance().coverage().isEmpty()) {
            throw new CacheInconsistencyException("Solution " + solution.getSolutionId() + " has no time coverage in its provenance");
        }
        Fingerprint rebuilt = fingerprint(solution.getConfig(), solution.getProvenance().instrumentId(),
            solution.getProvenance().coverage());
        if (!rebuilt.equals(stored)) {
            throw new CacheInconsistencyException(String.format(
                "Provenance of %s reproduces fingerprint %s", solution.getSolutionId(), rebuilt));
        }
        if (!stored.isCompatibleWith(query)) {
            throw new CacheInconsistencyException(String.format(
                "Solution %s cannot serve %s", solution.getSolutionId(), query));
        }
    }
}
