package de.anton.mkid.pipeline.model;

import java.util.List;
import java.util.Objects;

/**
 * Identity of a calibration request: which step, which instrument, which
 * fit-relevant configuration (as a digest) and which seconds of data.
 * <p>
 * Equal fingerprints are a cache hit. A stored fingerprint is also compatible
 * with a query whose coverage it contains, see {@link #isCompatibleWith(Fingerprint)}.
 */
public record Fingerprint(CalibrationKind kind, String instrumentId, String configDigest, List<TimeRange> coverage) {

    private static final int DIGEST_CHARS_IN_KEY = 16;

    public Fingerprint {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(instrumentId, "instrumentId");
        Objects.requireNonNull(configDigest, "configDigest");
        if (coverage == null || coverage.isEmpty()) {
            throw new IllegalArgumentException("Fingerprint coverage cannot be empty");
        }
        coverage = DatasetSpec.normalize(coverage);
    }

    public long start() {
        return coverage.get(0).start();
    }

    public long stop() {
        return coverage.get(coverage.size() - 1).stop();
    }

    /** True if kind, instrument and configuration digest are identical. */
    public boolean hasSameFields(Fingerprint other) {
        return other != null
            && kind == other.kind
            && instrumentId.equals(other.instrumentId)
            && configDigest.equals(other.configDigest);
    }

    /** True if every segment of {@code query} lies inside one segment of this coverage. */
    public boolean coversTimeOf(Fingerprint query) {
        for (TimeRange wanted : query.coverage) {
            boolean inside = coverage.stream().anyMatch(have -> have.contains(wanted));
            if (!inside) {
                return false;
            }
        }
        return true;
    }

    /**
     * Compatibility predicate of the solution store: this fingerprint (of a
     * stored solution) can serve {@code query} if all fields match and its
     * time coverage contains the query's.
     */
    public boolean isCompatibleWith(Fingerprint query) {
        return hasSameFields(query) && coversTimeOf(query);
    }

    /**
     * File-name safe key, unique per fingerprint:
     * {@code <step>_<instrument>_<digest>_<start>-<stop>[_<segments hash>]}.
     */
    public String key() {
        StringBuilder sb = new StringBuilder()
            .append(keyPrefix())
            .append(start()).append('-').append(stop());
        if (coverage.size() > 1) {
            sb.append('_').append(String.format("%08x", segmentsHash()));
        }
        return sb.toString();
    }

    private int segmentsHash() {
        int h = 1;
        for (TimeRange r : coverage) {
            h = 31 * h + Long.hashCode(r.start());
            h = 31 * h + Long.hashCode(r.stop());
        }
        return h;
    }

    /** Prefix of {@link #key()} shared by all fingerprints with the same fields. */
    public String keyPrefix() {
        return fieldsPrefix(kind, instrumentId, configDigest);
    }

    public static String fieldsPrefix(CalibrationKind kind, String instrumentId, String configDigest) {
        String digest = configDigest.length() > DIGEST_CHARS_IN_KEY
            ? configDigest.substring(0, DIGEST_CHARS_IN_KEY) : configDigest;
        return kind.stepName() + "_" + sanitize(instrumentId) + "_" + digest + "_";
    }

    static String sanitize(String s) {
        String cleaned = s.replaceAll("[^A-Za-z0-9-]", "-");
        return cleaned.isEmpty() ? "unknown" : cleaned;
    }

    @Override
    public String toString() {
        return key();
    }
}
