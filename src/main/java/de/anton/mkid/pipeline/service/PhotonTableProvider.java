package de.anton.mkid.pipeline.service;

import de.anton.mkid.pipeline.model.DatasetSpec;
import de.anton.mkid.pipeline.model.PhotonTable;
import de.anton.mkid.pipeline.model.PixelRange;
import de.anton.mkid.pipeline.model.RawPhaseData;

import java.io.IOException;

/**
 * Access to raw calibration samples and photon tables. The on-disk layout
 * behind it is up to the implementation.
 */
public interface PhotonTableProvider {

    /** Pixel ids of the array that recorded the dataset. */
    PixelRange pixels(DatasetSpec dataset) throws DataUnavailableException;

    /**
     * Raw phase samples of a wavelength calibration dataset, restricted to
     * exactly the dataset's time coverage and the given pixels.
     */
    RawPhaseData readRawPhases(DatasetSpec dataset, PixelRange pixels) throws DataUnavailableException;

    /** Photon table of a dataset. Record times are relative to the dataset start. */
    PhotonTable readTable(DatasetSpec dataset) throws DataUnavailableException;

    /** Persists the (mutated) records and header of a table. */
    void writeTable(PhotonTable table) throws IOException;
}
