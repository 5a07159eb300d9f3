package de.anton.mkid.pipeline.service;

import de.anton.mkid.pipeline.model.ApplyReport;
import de.anton.mkid.pipeline.model.CalibrationSolution;
import de.anton.mkid.pipeline.model.FlatSolution;
import de.anton.mkid.pipeline.model.PhotonTable;
import de.anton.mkid.pipeline.model.WavelengthSolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Drives one reduction: fetch and apply the wavelength solution, then (if a
 * flat is requested) fetch and apply the flat solution, and write the science
 * table back.
 * <p>
 * The flat table itself is wavelength calibrated with the same solution first
 * if it has not been yet.
 */
public class CalibrationPipeline {

    private static final Logger logger = LoggerFactory.getLogger(CalibrationPipeline.class);

    private final CalibrationResolver resolver;
    private final SolutionApplier applier;
    private final PhotonTableProvider provider;

    /**
     * Reports of one reduction, in application order.
     */
    public record Result(WavelengthSolution wavecal, FlatSolution flatcal, List<ApplyReport> reports) {

        public Result {
            reports = Collections.unmodifiableList(new ArrayList<>(reports));
        }

        public Optional<FlatSolution> flat() {
            return Optional.ofNullable(flatcal);
        }
    }

    public CalibrationPipeline(CalibrationResolver resolver, SolutionApplier applier, PhotonTableProvider provider) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.applier = Objects.requireNonNull(applier, "applier");
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    public Result reduce(ReductionRequest request) throws IOException {
        Objects.requireNonNull(request, "request");
        logger.info("Reducing {} (wavecal {}, flat {}).", request.science().name(), request.wavecalDataset().name(),
            request.hasFlat() ? request.flatDataset().name() : "none");
        List<ApplyReport> reports = new ArrayList<>();

        WavelengthSolution wavecal = resolver.fetchWavecal(request.wavecalDataset(), request.wavecalConfig(), request.force());
        PhotonTable science = provider.readTable(request.science());
        reports.add(applyWarningTwice(wavecal, science));

        FlatSolution flatcal = null;
        if (request.hasFlat()) {
            PhotonTable flatTable = provider.readTable(request.flatDataset());
            if (!flatTable.isWavelengthCalibrated()) {
                logger.info("Flat table {} is not wavelength calibrated yet, applying {}.", flatTable.getName(),
                    wavecal.getSolutionId());
                reports.add(applyWarningTwice(wavecal, flatTable));
                provider.writeTable(flatTable);
            }
            flatcal = resolver.fetchFlatcal(request.flatDataset(), request.flatcalConfig(), request.force());
            reports.add(applyWarningTwice(flatcal, science));
        }

        provider.writeTable(science);
        logger.info("Reduction of {} finished: {}", request.science().name(), science.getHeader());
        return new Result(wavecal, flatcal, reports);
    }

    /**
     * Applies a solution. A table that already names a solution for the step
     * gets a warning but is calibrated again.
     */
    private ApplyReport applyWarningTwice(CalibrationSolution solution, PhotonTable table) {
        String step = solution.getKind().stepName();
        table.header(step).ifPresent(previous -> logger.warn(
            "Table {} already has {} solution {} applied; applying {} compounds the calibration.",
            table.getName(), step, previous, solution.getSolutionId()));
        return applier.apply(solution, table);
    }
}
