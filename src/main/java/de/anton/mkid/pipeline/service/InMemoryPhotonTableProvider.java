package de.anton.mkid.pipeline.service;

import de.anton.mkid.pipeline.model.DatasetSpec;
import de.anton.mkid.pipeline.model.PhotonTable;
import de.anton.mkid.pipeline.model.PixelRange;
import de.anton.mkid.pipeline.model.RawPhaseData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provider holding raw samples and photon tables in memory, keyed by dataset
 * name. Used for embedding the pipeline in another process and in tests.
 */
public class InMemoryPhotonTableProvider implements PhotonTableProvider {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryPhotonTableProvider.class);

    private final Map<String, RawPhaseData> rawPhases = new ConcurrentHashMap<>();
    private final Map<String, PhotonTable> tables = new ConcurrentHashMap<>();

    public InMemoryPhotonTableProvider putRawPhases(DatasetSpec dataset, RawPhaseData data) {
        rawPhases.put(dataset.name(), Objects.requireNonNull(data, "data"));
        return this;
    }

    public InMemoryPhotonTableProvider putTable(PhotonTable table) {
        tables.put(table.getName(), table);
        return this;
    }

    @Override
    public PixelRange pixels(DatasetSpec dataset) throws DataUnavailableException {
        RawPhaseData raw = rawPhases.get(dataset.name());
        if (raw != null) {
            return raw.getPixels();
        }
        PhotonTable table = tables.get(dataset.name());
        if (table != null) {
            return PixelRange.all(table.getPixelCount());
        }
        throw new DataUnavailableException("No data registered for dataset " + dataset.name());
    }

    @Override
    public RawPhaseData readRawPhases(DatasetSpec dataset, PixelRange pixels) throws DataUnavailableException {
        RawPhaseData raw = rawPhases.get(dataset.name());
        if (raw == null) {
            throw new DataUnavailableException("No raw phase samples for dataset " + dataset);
        }
        logger.debug("Serving raw phases of {} for pixels {}.", dataset.name(), pixels);
        return raw.slice(pixels);
    }

    @Override
    public PhotonTable readTable(DatasetSpec dataset) throws DataUnavailableException {
        PhotonTable table = tables.get(dataset.name());
        if (table == null) {
            throw new DataUnavailableException("No photon table for dataset " + dataset);
        }
        return table;
    }

    @Override
    public void writeTable(PhotonTable table) {
        tables.put(table.getName(), table);
        logger.debug("Table {} written ({} records, header {}).", table.getName(), table.size(), table.getHeader());
    }
}
