package de.anton.mkid.pipeline.service;

import de.anton.mkid.pipeline.SyntheticPhotons;
import de.anton.mkid.pipeline.model.CalibrationSolution;
import de.anton.mkid.pipeline.model.DatasetSpec;
import de.anton.mkid.pipeline.model.FitFailure;
import de.anton.mkid.pipeline.model.Fingerprint;
import de.anton.mkid.pipeline.model.FlatcalConfig;
import de.anton.mkid.pipeline.model.PhotonTable;
import de.anton.mkid.pipeline.model.PixelRange;
import de.anton.mkid.pipeline.model.Provenance;
import de.anton.mkid.pipeline.model.RawPhaseData;
import de.anton.mkid.pipeline.model.SolutionSummaryExporter;
import de.anton.mkid.pipeline.model.WavecalConfig;
import de.anton.mkid.pipeline.model.WavecalPixel;
import de.anton.mkid.pipeline.model.WavelengthSolution;
import de.anton.mkid.pipeline.store.FileSolutionStore;
import de.anton.mkid.pipeline.store.SolutionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CalibrationResolverTest {

    private static final long T0 = SyntheticPhotons.T0;
    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(1_700_000_300_000L), ZoneOffset.UTC);

    @TempDir
    Path tmp;

    @Mock
    private PhotonTableProvider provider;

    private final FingerprintService fingerprints = new FingerprintService();
    private FileSolutionStore store;
    private CalibrationResolver resolver;

    /** Stored solution covering 10:00-10:05. */
    private WavelengthSolution stored;

    @BeforeEach
    void setUp() throws Exception {
        store = new FileSolutionStore(tmp.resolve("store"));
        resolver = new CalibrationResolver(fingerprints, store, provider, CLOCK, null);

        DatasetSpec fiveMinutes = SyntheticPhotons.dataset("laser", T0, T0 + 300);
        Fingerprint fp = fingerprints.fingerprint(WavecalConfig.defaults(), fiveMinutes);
        stored = new WavelengthSolution(fp, new Provenance(fiveMinutes.instrumentId(), "laser", fiveMinutes.coverage(), 1),
            WavecalConfig.defaults(), new double[] {950, 1100},
            List.of(WavecalPixel.fit(0, new double[] {0.86, -0.89}, -0.56, -0.24, 0, 2)));
        store.put(stored);
    }

    private static RawPhaseData twoLineData() {
        RawPhaseData.Builder b = RawPhaseData.builder(2, 950, 1100);
        SyntheticPhotons.addPeak(b, 0, 950, -0.5, 2000);
        SyntheticPhotons.addPeak(b, 0, 1100, -0.3, 2000);
        SyntheticPhotons.addPeak(b, 1, 950, -0.5, 2000);
        return b.build();
    }

    private void stubRawData(DatasetSpec dataset) throws DataUnavailableException {
        RawPhaseData data = twoLineData();
        when(provider.pixels(dataset)).thenReturn(data.getPixels());
        when(provider.readRawPhases(eq(dataset), any(PixelRange.class))).thenReturn(data);
    }

    @Test
    void fetch_insideStoredRange_shouldReturnStoredSolutionWithoutReadingData() throws Exception {
        DatasetSpec inside = SyntheticPhotons.dataset("laser_subset", T0 + 60, T0 + 120);

        CalibrationSolution solution = resolver.fetch(inside, WavecalConfig.defaults());

        assertEquals(stored.getSolutionId(), solution.getSolutionId());
        verifyNoInteractions(provider);
    }

    @Test
    void fetch_outsideStoredRange_shouldRegenerateAndStore() throws Exception {
        DatasetSpec later = SyntheticPhotons.dataset("laser_late", T0 + 200, T0 + 400);
        stubRawData(later);

        WavelengthSolution solution = resolver.fetchWavecal(later, WavecalConfig.defaults(), false);

        assertNotEquals(stored.getSolutionId(), solution.getSolutionId());
        assertEquals(CLOCK.millis(), solution.getProvenance().createdAtMillis());
        assertTrue(solution.isUsable(0));
        assertEquals(FitFailure.INSUFFICIENT_REFERENCE_POINTS, solution.pixel(1).failure());
        assertTrue(Files.exists(store.pathOf(solution.getFingerprint())));
        verify(provider).readRawPhases(eq(later), eq(PixelRange.all(2)));
    }

    @Test
    void fetch_withDifferentFitConfig_shouldRegenerate() throws Exception {
        DatasetSpec inside = SyntheticPhotons.dataset("laser_subset", T0 + 60, T0 + 120);
        stubRawData(inside);
        WavecalConfig linear = WavecalConfig.defaults().toBuilder().modelOrder(1).build();

        CalibrationSolution solution = resolver.fetch(inside, linear);

        assertNotEquals(stored.getSolutionId(), solution.getSolutionId());
        assertEquals(linear, solution.getConfig());
    }

    @Test
    void fetch_withIrrelevantConfigChange_shouldStillHit() throws Exception {
        DatasetSpec inside = SyntheticPhotons.dataset("laser_subset", T0 + 60, T0 + 120);

        CalibrationSolution solution = resolver.fetch(inside,
            WavecalConfig.defaults().toBuilder().parallel(false).build());

        assertEquals(stored.getSolutionId(), solution.getSolutionId());
        verifyNoInteractions(provider);
    }

    @Test
    void fetch_forced_shouldRegenerateDespiteStoredSolution() throws Exception {
        DatasetSpec same = SyntheticPhotons.dataset("laser", T0, T0 + 300);
        stubRawData(same);

        CalibrationSolution solution = resolver.fetch(same, WavecalConfig.defaults(), true);

        assertEquals(stored.getSolutionId(), solution.getSolutionId(), "same fingerprint, same artifact");
        assertEquals(CLOCK.millis(), solution.getProvenance().createdAtMillis());
        assertEquals(CLOCK.millis(), store.find(solution.getFingerprint()).orElseThrow().getProvenance().createdAtMillis());
    }

    @Test
    void fetch_dataUnavailable_shouldFailWithoutWriting() throws Exception {
        SolutionStore mockStore = mock(SolutionStore.class);
        CalibrationResolver isolated = new CalibrationResolver(fingerprints, mockStore, provider, CLOCK, null);
        DatasetSpec missing = SyntheticPhotons.dataset("laser_missing", T0 + 1000, T0 + 1300);
        when(mockStore.find(any())).thenReturn(Optional.empty());
        when(provider.pixels(missing)).thenThrow(new DataUnavailableException("archive corrupt"));

        assertThrows(DataUnavailableException.class, () -> isolated.fetch(missing, WavecalConfig.defaults()));
        verify(mockStore, never()).put(any());
    }

    @Test
    void fetch_inconsistentStoredSolution_shouldBeTreatedAsMiss() throws Exception {
        SolutionStore mockStore = mock(SolutionStore.class);
        CalibrationResolver isolated = new CalibrationResolver(fingerprints, mockStore, provider, CLOCK, null);
        DatasetSpec same = SyntheticPhotons.dataset("laser", T0, T0 + 300);
        WavelengthSolution tampered = new WavelengthSolution(stored.getFingerprint(), stored.getProvenance(),
            WavecalConfig.defaults().toBuilder().maxReducedChiSquared(1).build(), new double[] {950, 1100},
            stored.getPixels());
        when(mockStore.find(any())).thenReturn(Optional.of(tampered));
        stubRawData(same);

        CalibrationSolution solution = isolated.fetch(same, WavecalConfig.defaults());

        assertEquals(WavecalConfig.defaults(), solution.getConfig());
        verify(mockStore).put(solution);
    }

    @Test
    void fetch_flatFromUncalibratedTable_shouldBeDataUnavailable() throws Exception {
        DatasetSpec flat = SyntheticPhotons.dataset("flat", T0, T0 + 60);
        when(provider.readTable(flat)).thenReturn(new PhotonTable(flat, 1, List.of()));

        assertThrows(DataUnavailableException.class, () -> resolver.fetch(flat, FlatcalConfig.defaults()));
    }

    @Test
    void fetch_withSummaryExport_shouldWriteWorkbook() throws Exception {
        Path summaries = tmp.resolve("summaries");
        CalibrationResolver exporting = new CalibrationResolver(fingerprints, store, provider, CLOCK, summaries);
        DatasetSpec later = SyntheticPhotons.dataset("laser_late", T0 + 200, T0 + 400);
        stubRawData(later);

        CalibrationSolution solution = exporting.fetch(later,
            WavecalConfig.defaults().toBuilder().summaryExport(true).build());

        assertTrue(Files.exists(summaries.resolve(SolutionSummaryExporter.fileNameOf(solution))));
    }
}
