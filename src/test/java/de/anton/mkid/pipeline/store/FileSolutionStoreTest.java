package de.anton.mkid.pipeline.store;

import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import de.anton.mkid.pipeline.model.CalibrationKind;
import de.anton.mkid.pipeline.model.CalibrationSolution;
import de.anton.mkid.pipeline.model.FitFailure;
import de.anton.mkid.pipeline.model.Fingerprint;
import de.anton.mkid.pipeline.model.FlatPixel;
import de.anton.mkid.pipeline.model.FlatSolution;
import de.anton.mkid.pipeline.model.FlatcalConfig;
import de.anton.mkid.pipeline.model.Provenance;
import de.anton.mkid.pipeline.model.TimeRange;
import de.anton.mkid.pipeline.model.WavecalConfig;
import de.anton.mkid.pipeline.model.WavecalPixel;
import de.anton.mkid.pipeline.model.WavelengthSolution;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileSolutionStoreTest {

    @TempDir
    Path tmp;

    private FileSolutionStore store;

    @BeforeEach
    void setUp() {
        store = new FileSolutionStore(tmp.resolve("solutions"));
    }

    private static Fingerprint wavecalFp(String digest, long start, long stop) {
        return new Fingerprint(CalibrationKind.WAVECAL, "MEC", digest, List.of(new TimeRange(start, stop)));
    }

    private static WavelengthSolution wavecal(Fingerprint fp, long createdAt) {
        return new WavelengthSolution(fp, new Provenance("MEC", "laser", fp.coverage(), createdAt),
            WavecalConfig.defaults(), new double[] {950, 1100}, List.of(
                WavecalPixel.fit(0, new double[] {0.86, -0.89}, -0.56, -0.24, 0.0, 2, new double[] {12.5, Double.NaN}),
                WavecalPixel.bad(1, FitFailure.PEAK_NOT_CONVERGED, 0)));
    }

    @Test
    void find_emptyStore_shouldGiveEmpty() throws SolutionStoreException {
        assertTrue(store.find(wavecalFp("abc", 0, 300)).isEmpty());
    }

    @Test
    void putThenFind_shouldReturnEqualSolution() throws SolutionStoreException {
        Fingerprint fp = wavecalFp("abc", 0, 300);
        store.put(wavecal(fp, 1000));

        Optional<CalibrationSolution> found = store.find(fp);

        assertTrue(found.isPresent());
        WavelengthSolution w = (WavelengthSolution) found.get();
        assertEquals(fp, w.getFingerprint());
        assertEquals(fp.key(), w.getSolutionId());
        assertEquals(1000, w.getProvenance().createdAtMillis());
        assertArrayEquals(new double[] {0.86, -0.89}, w.pixel(0).coefficients(), 0.0);
        assertEquals(FitFailure.PEAK_NOT_CONVERGED, w.pixel(1).failure());
        assertTrue(Double.isNaN(w.pixel(1).minPhase()));
        assertEquals(12.5, w.pixel(0).resolvingPower(0));
        assertTrue(Double.isNaN(w.pixel(0).resolvingPower(1)));
        assertEquals(WavecalConfig.defaults(), w.getConfig());
    }

    @Test
    void find_shouldMatchContainedRangeOnly() throws SolutionStoreException {
        store.put(wavecal(wavecalFp("abc", 0, 300), 1000));

        assertTrue(store.find(wavecalFp("abc", 60, 120)).isPresent());
        assertTrue(store.find(wavecalFp("abc", 200, 400)).isEmpty());
        assertTrue(store.find(wavecalFp("other", 60, 120)).isEmpty());
    }

    @Test
    void find_severalCompatible_shouldPreferNewest() throws SolutionStoreException {
        store.put(wavecal(wavecalFp("abc", 0, 300), 1000));
        store.put(wavecal(wavecalFp("abc", 0, 600), 2000));

        CalibrationSolution found = store.find(wavecalFp("abc", 60, 120)).orElseThrow();

        assertEquals(600, found.getFingerprint().stop());
        assertEquals(300, store.find(wavecalFp("abc", 0, 300)).orElseThrow().getFingerprint().stop(),
            "an exact match wins over a newer superset");
    }

    @Test
    void put_differentFingerprints_shouldNotReplaceEachOther() throws IOException {
        store.put(wavecal(wavecalFp("abc", 0, 300), 1000));
        store.put(wavecal(wavecalFp("def", 0, 300), 1000));

        try (Stream<Path> files = Files.list(store.getDirectory())) {
            assertEquals(2, files.filter(p -> p.toString().endsWith(".json")).count());
        }
    }

    @Test
    void put_sameFingerprintConcurrently_shouldConvergeOnOneArtifact() throws Exception {
        Fingerprint fp = wavecalFp("abc", 0, 300);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Void>> writers = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                final long createdAt = i;
                writers.add(pool.submit(() -> {
                    start.await();
                    store.put(wavecal(fp, createdAt));
                    return null;
                }));
            }
            start.countDown();
            for (Future<Void> w : writers) {
                w.get();
            }
        } finally {
            pool.shutdownNow();
        }

        try (Stream<Path> files = Files.list(store.getDirectory())) {
            assertEquals(List.of(store.pathOf(fp)), files.collect(Collectors.toList()), "no temporary files left behind");
        }
        assertTrue(store.find(fp).isPresent());
    }

    @Test
    void find_shouldSkipCorruptArtifact() throws IOException {
        Fingerprint good = wavecalFp("abc", 0, 300);
        store.put(wavecal(good, 1000));
        Fingerprint broken = wavecalFp("abc", 0, 600);
        Files.writeString(store.pathOf(broken), "{ \"solutionId\": ", StandardCharsets.UTF_8);

        CalibrationSolution found = store.find(wavecalFp("abc", 10, 20)).orElseThrow();

        assertEquals(good, found.getFingerprint());
    }

    @Test
    void find_shouldSkipArtifactsWithMissingOrInvalidMembers() throws IOException {
        Fingerprint good = wavecalFp("abc", 0, 300);
        store.put(wavecal(good, 1000));
        String json = Files.readString(store.pathOf(good), StandardCharsets.UTF_8);

        JsonObject withoutFingerprint = JsonParser.parseString(json).getAsJsonObject();
        withoutFingerprint.remove("fingerprint");
        Files.writeString(store.pathOf(wavecalFp("abc", 0, 600)), withoutFingerprint.toString(), StandardCharsets.UTF_8);

        JsonObject emptyCoverage = JsonParser.parseString(json).getAsJsonObject();
        emptyCoverage.getAsJsonObject("fingerprint").add("coverage", new JsonArray());
        Files.writeString(store.pathOf(wavecalFp("abc", 0, 900)), emptyCoverage.toString(), StandardCharsets.UTF_8);

        JsonObject nullPixel = JsonParser.parseString(json).getAsJsonObject();
        nullPixel.getAsJsonArray("pixels").set(0, JsonNull.INSTANCE);
        Files.writeString(store.pathOf(wavecalFp("abc", 0, 1200)), nullPixel.toString(), StandardCharsets.UTF_8);

        CalibrationSolution found = store.find(wavecalFp("abc", 10, 20)).orElseThrow();

        assertEquals(good, found.getFingerprint());
        assertTrue(store.read(store.pathOf(wavecalFp("abc", 0, 600)), CalibrationKind.WAVECAL).isEmpty());
        assertTrue(store.read(store.pathOf(wavecalFp("abc", 0, 900)), CalibrationKind.WAVECAL).isEmpty());
        assertTrue(store.read(store.pathOf(wavecalFp("abc", 0, 1200)), CalibrationKind.WAVECAL).isEmpty());
    }

    @Test
    void putThenFind_flatSolution_shouldKeepUndefinedWeights() throws SolutionStoreException {
        Fingerprint fp = new Fingerprint(CalibrationKind.FLATCAL, "MEC", "abc", List.of(new TimeRange(0, 60)));
        store.put(new FlatSolution(fp, new Provenance("MEC", "flat", fp.coverage(), 5), FlatcalConfig.defaults(),
            new double[] {700, 800, 900}, List.of(
                FlatPixel.fit(0, new double[] {1.2, Double.NaN}, new double[] {0.1, Double.NaN}, 40),
                FlatPixel.bad(1, FitFailure.RATE_ABOVE_CUTOFF, 9000))));

        FlatSolution found = (FlatSolution) store.find(fp).orElseThrow();

        assertEquals(1.2, found.weight(0, 750));
        assertTrue(Double.isNaN(found.weight(0, 850)));
        assertEquals(FitFailure.RATE_ABOVE_CUTOFF, found.pixel(1).failure());
        assertTrue(store.find(new Fingerprint(CalibrationKind.WAVECAL, "MEC", "abc",
            List.of(new TimeRange(0, 60)))).isEmpty(), "steps never mix");
    }
}
