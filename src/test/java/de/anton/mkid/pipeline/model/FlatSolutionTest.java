package de.anton.mkid.pipeline.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FlatSolutionTest {

    private static final double[] EDGES = {700, 750, 800, 850};

    @Test
    void binOf_shouldMapEdgesAndOutOfRange() {
        assertEquals(FlatSolution.BELOW_RANGE, FlatSolution.binOf(EDGES, 699.9));
        assertEquals(0, FlatSolution.binOf(EDGES, 700));
        assertEquals(0, FlatSolution.binOf(EDGES, 749.99));
        assertEquals(1, FlatSolution.binOf(EDGES, 750));
        assertEquals(2, FlatSolution.binOf(EDGES, 850), "last edge belongs to the last bin");
        assertEquals(FlatSolution.ABOVE_RANGE, FlatSolution.binOf(EDGES, 850.1));
        assertEquals(FlatSolution.BELOW_RANGE, FlatSolution.binOf(EDGES, Double.NaN));
    }

    @Test
    void weight_shouldBeNaNForBadPixelsAndUndefinedBins() {
        Fingerprint fp = new Fingerprint(CalibrationKind.FLATCAL, "MEC", "d", List.of(new TimeRange(0, 60)));
        Provenance prov = new Provenance("MEC", "flat", fp.coverage(), 0);
        FlatSolution solution = new FlatSolution(fp, prov, FlatcalConfig.defaults(), EDGES, List.of(
            FlatPixel.fit(0, new double[] {1.0, Double.NaN, 0.5}, new double[] {0.1, Double.NaN, 0.05}, 10),
            FlatPixel.bad(1, FitFailure.NO_COUNTS, 0)));

        assertEquals(1.0, solution.weight(0, 720));
        assertTrue(Double.isNaN(solution.weight(0, 780)));
        assertEquals(0.5, solution.weight(0, 850));
        assertTrue(Double.isNaN(solution.weight(0, 900)));
        assertTrue(Double.isNaN(solution.weight(1, 720)));
        assertTrue(Double.isNaN(solution.weight(7, 720)));
        assertEquals(1, solution.getUsablePixelCount());
        assertEquals(fp.key(), solution.getSolutionId());
    }

    @Test
    void constructor_shouldRejectPixelsOutOfOrder() {
        Fingerprint fp = new Fingerprint(CalibrationKind.FLATCAL, "MEC", "d", List.of(new TimeRange(0, 60)));
        Provenance prov = new Provenance("MEC", "flat", fp.coverage(), 0);

        assertThrows(IllegalArgumentException.class, () -> new FlatSolution(fp, prov, FlatcalConfig.defaults(), EDGES,
            List.of(FlatPixel.bad(1, FitFailure.NO_COUNTS, 0))));
    }

    @Test
    void flatcalConfig_shouldBuildBinEdgesOverRange() {
        FlatcalConfig config = FlatcalConfig.builder().wavelengthStartNm(700).wavelengthStopNm(1500)
            .wavelengthBinWidthNm(300).build();

        assertArrayEquals(new double[] {700, 1000, 1300, 1500}, config.wavelengthBinEdges(), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> config.toBuilder().trimFraction(0.5).build());
    }
}
