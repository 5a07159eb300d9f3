package de.anton.mkid.pipeline.model;

import java.util.List;
import java.util.Objects;

/**
 * Where a solution came from. Together with the configuration snapshot held by
 * the solution this is enough to recompute its fingerprint.
 *
 * @param instrumentId    instrument the raw data was recorded with
 * @param dataset         name of the dataset the fit ran on (informational)
 * @param coverage        seconds of data the fit consumed
 * @param createdAtMillis creation time, epoch milliseconds
 */
public record Provenance(String instrumentId, String dataset, List<TimeRange> coverage, long createdAtMillis) {

    public Provenance {
        Objects.requireNonNull(instrumentId, "instrumentId");
        dataset = dataset == null ? "" : dataset;
        coverage = coverage == null ? List.of() : List.copyOf(coverage);
    }
}
