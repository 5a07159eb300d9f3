package de.anton.mkid.pipeline.service;

import de.anton.mkid.pipeline.algorithms.FlatFieldFitter;
import de.anton.mkid.pipeline.algorithms.WavelengthCalibrationFitter;
import de.anton.mkid.pipeline.model.CalibrationConfig;
import de.anton.mkid.pipeline.model.CalibrationSolution;
import de.anton.mkid.pipeline.model.DatasetSpec;
import de.anton.mkid.pipeline.model.Fingerprint;
import de.anton.mkid.pipeline.model.FlatSolution;
import de.anton.mkid.pipeline.model.FlatcalConfig;
import de.anton.mkid.pipeline.model.PhotonTable;
import de.anton.mkid.pipeline.model.Provenance;
import de.anton.mkid.pipeline.model.RawPhaseData;
import de.anton.mkid.pipeline.model.SolutionSummaryExporter;
import de.anton.mkid.pipeline.model.WavecalConfig;
import de.anton.mkid.pipeline.model.WavecalPixel;
import de.anton.mkid.pipeline.model.WavelengthSolution;
import de.anton.mkid.pipeline.store.SolutionStore;
import de.anton.mkid.pipeline.store.SolutionStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Returns a valid calibration solution for a dataset and configuration,
 * generating and storing one when the store has nothing compatible.
 * <p>
 * Concurrent fetches of the same fingerprint may both fit; the store makes
 * them converge on one artifact.
 */
public class CalibrationResolver {

    private static final Logger logger = LoggerFactory.getLogger(CalibrationResolver.class);

    private final FingerprintService fingerprints;
    private final SolutionStore store;
    private final PhotonTableProvider provider;
    private final Clock clock;
    private final SolutionSummaryExporter exporter;
    private final Path summaryDirectory;

    public CalibrationResolver(FingerprintService fingerprints, SolutionStore store, PhotonTableProvider provider) {
        this(fingerprints, store, provider, Clock.systemUTC(), null);
    }

    /**
     * @param summaryDirectory where xlsx summaries go for configurations that
     *                         request them; null disables summaries
     */
    public CalibrationResolver(FingerprintService fingerprints, SolutionStore store, PhotonTableProvider provider,
                               Clock clock, Path summaryDirectory) {
        this.fingerprints = Objects.requireNonNull(fingerprints, "fingerprints");
        this.store = Objects.requireNonNull(store, "store");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.summaryDirectory = summaryDirectory;
        this.exporter = new SolutionSummaryExporter();
    }

    public CalibrationSolution fetch(DatasetSpec dataset, CalibrationConfig config)
            throws DataUnavailableException, SolutionStoreException {
        return fetch(dataset, config, false);
    }

    /**
     * Resolves a solution. The step is given by the configuration's kind.
     *
     * @param force regenerate even if the store holds a compatible solution
     * @throws DataUnavailableException if a fit is needed and its input cannot
     *         be read; nothing is stored in that case
     */
    public CalibrationSolution fetch(DatasetSpec dataset, CalibrationConfig config, boolean force)
            throws DataUnavailableException, SolutionStoreException {
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(config, "config");
        Fingerprint fingerprint = fingerprints.fingerprint(config, dataset);

        if (!force) {
            Optional<CalibrationSolution> cached = lookup(fingerprint);
            if (cached.isPresent()) {
                logger.info("Using stored {} solution {} for {}.", config.kind(), cached.get().getSolutionId(), dataset.name());
                return cached.get();
            }
            logger.info("No stored {} solution for {} ({}), generating.", config.kind(), dataset.name(), fingerprint);
        } else {
            logger.info("Regenerating {} solution for {} ({}) on request.", config.kind(), dataset.name(), fingerprint);
        }

        CalibrationSolution solution = generate(fingerprint, dataset, config);
        store.put(solution);
        exportSummary(solution, config);
        return solution;
    }

    public WavelengthSolution fetchWavecal(DatasetSpec dataset, WavecalConfig config, boolean force)
            throws DataUnavailableException, SolutionStoreException {
        return (WavelengthSolution) fetch(dataset, config, force);
    }

    public FlatSolution fetchFlatcal(DatasetSpec dataset, FlatcalConfig config, boolean force)
            throws DataUnavailableException, SolutionStoreException {
        return (FlatSolution) fetch(dataset, config, force);
    }

    private Optional<CalibrationSolution> lookup(Fingerprint fingerprint) throws SolutionStoreException {
        Optional<CalibrationSolution> found = store.find(fingerprint);
        if (found.isEmpty()) {
            return found;
        }
        try {
            fingerprints.verifyProvenance(found.get(), fingerprint);
            return found;
        } catch (CacheInconsistencyException e) {
            logger.warn("Stored solution rejected, regenerating: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private CalibrationSolution generate(Fingerprint fingerprint, DatasetSpec dataset, CalibrationConfig config)
            throws DataUnavailableException {
        Provenance provenance = new Provenance(dataset.instrumentId(), dataset.name(), dataset.coverage(), clock.millis());
        switch (config.kind()) {
            case WAVECAL: {
                WavecalConfig wavecal = (WavecalConfig) config;
                RawPhaseData raw = provider.readRawPhases(dataset, provider.pixels(dataset));
                List<WavecalPixel> pixels = new WavelengthCalibrationFitter(wavecal).fit(raw);
                return new WavelengthSolution(fingerprint, provenance, wavecal, raw.getReferenceWavelengthsNm(), pixels);
            }
            case FLATCAL: {
                FlatcalConfig flatcal = (FlatcalConfig) config;
                PhotonTable flat = provider.readTable(dataset);
                if (!flat.isWavelengthCalibrated()) {
                    throw new DataUnavailableException("Flat table " + flat.getName()
                        + " has no wavelength calibration applied");
                }
                FlatFieldFitter.FlatFit fit = new FlatFieldFitter(flatcal).fit(flat, dataset.coverage());
                return new FlatSolution(fingerprint, provenance, flatcal, fit.binEdgesNm(), fit.pixels());
            }
            default:
                throw new IllegalArgumentException("Unsupported calibration step " + config.kind());
        }
    }

    private void exportSummary(CalibrationSolution solution, CalibrationConfig config) {
        boolean requested = config instanceof WavecalConfig
            ? ((WavecalConfig) config).summaryExport()
            : config instanceof FlatcalConfig && ((FlatcalConfig) config).summaryExport();
        if (!requested || summaryDirectory == null) {
            return;
        }
        try {
            exporter.export(solution, summaryDirectory);
        } catch (IOException e) {
            // solution is already stored
            logger.warn("Summary export of {} failed: {}", solution.getSolutionId(), e.getMessage(), e);
        }
    }
}
