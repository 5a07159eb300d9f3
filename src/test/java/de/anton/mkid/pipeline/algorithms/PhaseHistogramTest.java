package de.anton.mkid.pipeline.algorithms;

import de.anton.mkid.pipeline.SyntheticPhotons;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PhaseHistogramTest {

    @Test
    void build_shouldDoubleBinWidthUntilPeakIsTallEnough() {
        double[] phases = SyntheticPhotons.gaussian(-0.5, 0.02, 4000);

        PhaseHistogram h = PhaseHistogram.build(phases, 0.002, 400, 3);

        assertEquals(0.008, h.binWidth(), 1e-12);
        assertTrue(h.maxCount() >= 400, "peak holds " + h.maxCount());
        assertEquals(phases.length, h.totalCount(), 1e-9, "every phase lands in a bin");
    }

    @Test
    void build_shouldStopAfterConfiguredAttempts() {
        double[] phases = SyntheticPhotons.gaussian(-0.5, 0.02, 200);

        PhaseHistogram h = PhaseHistogram.build(phases, 0.002, 400, 2);

        assertEquals(0.004, h.binWidth(), 1e-12);
        assertTrue(h.maxCount() < 400);
    }

    @Test
    void build_edgesShouldEndAtLargestPhase() {
        double[] phases = {-0.30, -0.29, -0.25, -0.21, -0.20};

        PhaseHistogram h = PhaseHistogram.build(phases, 0.02, 1, 1);

        double[] centers = h.centers();
        assertEquals(-0.20 - 0.01, centers[centers.length - 1], 1e-12);
        assertEquals(5, h.totalCount(), 1e-9);
    }

    @Test
    void variances_shouldFollowPoissonEstimateWithFloor() {
        PhaseHistogram h = PhaseHistogram.build(new double[] {-0.1, -0.1, -0.1, -0.5}, 0.1, 1, 1);

        for (double v : h.variances()) {
            assertTrue(v >= 1.0);
        }
        assertEquals(Math.sqrt(9.25) - 0.5, h.variances()[h.size() - 1], 1e-12);
    }

    @Test
    void build_withoutPhases_shouldBeEmpty() {
        assertEquals(0, PhaseHistogram.build(new double[0], 0.002, 400, 3).size());
    }
}
