package de.anton.mkid.pipeline.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A photon table of one dataset: records plus header metadata.
 * <p>
 * Records are never removed or reordered. Calibration takes the table's
 * write lock for its whole duration; a second writer fails instead of waiting.
 */
public class PhotonTable {

    public static final String HEADER_WAVECAL = CalibrationKind.WAVECAL.stepName();
    public static final String HEADER_FLATCAL = CalibrationKind.FLATCAL.stepName();

    private final DatasetSpec dataset;
    private final int pixelCount;
    private final List<PhotonRecord> records;
    private final Map<String, String> header = new LinkedHashMap<>();
    private final ReentrantLock writeLock = new ReentrantLock();

    public PhotonTable(DatasetSpec dataset, int pixelCount, List<PhotonRecord> records) {
        this.dataset = Objects.requireNonNull(dataset, "dataset");
        if (pixelCount < 0) {
            throw new IllegalArgumentException("pixelCount must not be negative, was " + pixelCount);
        }
        this.pixelCount = pixelCount;
        this.records = new ArrayList<>(Objects.requireNonNull(records, "records"));
    }

    public DatasetSpec getDataset() { return dataset; }
    public String getName() { return dataset.name(); }
    public int getPixelCount() { return pixelCount; }
    public int size() { return records.size(); }

    /** Live, unmodifiable view; the records themselves are mutable. */
    public List<PhotonRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public Optional<String> header(String key) {
        return Optional.ofNullable(header.get(key));
    }

    public void putHeader(String key, String value) {
        header.put(Objects.requireNonNull(key), Objects.requireNonNull(value));
    }

    public Map<String, String> getHeader() {
        return Collections.unmodifiableMap(header);
    }

    /** True once a wavelength solution has been applied to this table. */
    public boolean isWavelengthCalibrated() {
        return header.containsKey(HEADER_WAVECAL);
    }

    public ReentrantLock writeLock() {
        return writeLock;
    }

    @Override
    public String toString() {
        return String.format("PhotonTable[%s, %d records, %d pixels]", getName(), records.size(), pixelCount);
    }
}
