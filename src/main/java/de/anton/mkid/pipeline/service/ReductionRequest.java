package de.anton.mkid.pipeline.service;

import de.anton.mkid.pipeline.model.DatasetSpec;
import de.anton.mkid.pipeline.model.FlatcalConfig;
import de.anton.mkid.pipeline.model.WavecalConfig;

import java.util.Objects;

/**
 * One science output to calibrate.
 *
 * @param science        dataset whose photon table is calibrated
 * @param wavecalDataset laser exposure the wavelength solution is fitted on
 * @param wavecalConfig  wavelength calibration settings
 * @param flatDataset    flat exposure, or null to skip the flat step
 * @param flatcalConfig  flat calibration settings, ignored without a flat dataset
 * @param force          regenerate solutions even if stored ones are compatible
 */
public record ReductionRequest(
    DatasetSpec science,
    DatasetSpec wavecalDataset,
    WavecalConfig wavecalConfig,
    DatasetSpec flatDataset,
    FlatcalConfig flatcalConfig,
    boolean force
) {

    public ReductionRequest {
        Objects.requireNonNull(science, "Science dataset cannot be null.");
        Objects.requireNonNull(wavecalDataset, "Wavecal dataset cannot be null.");
        wavecalConfig = wavecalConfig == null ? WavecalConfig.defaults() : wavecalConfig;
        flatcalConfig = flatcalConfig == null ? FlatcalConfig.defaults() : flatcalConfig;
    }

    public boolean hasFlat() {
        return flatDataset != null;
    }
}
