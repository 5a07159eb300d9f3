package de.anton.mkid.pipeline.algorithms;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RobustStatisticsTest {

    @Test
    void median_shouldIgnoreNaN() {
        assertEquals(2.0, RobustStatistics.median(new double[] {3, Double.NaN, 1, 2}));
        assertEquals(2.5, RobustStatistics.median(new double[] {4, 1, 3, 2}));
        assertTrue(Double.isNaN(RobustStatistics.median(new double[] {Double.NaN})));
    }

    @Test
    void trimmedMean_shouldDropExtremesAtBothEnds() {
        double[] rates = {10, 10, 100, 10, 0};

        assertEquals(1, RobustStatistics.trimCount(rates.length, 0.2));
        assertEquals(10.0, RobustStatistics.trimmedMean(rates, 1));
        assertEquals(30.0, RobustStatistics.trimmedSum(rates, 1));
        assertEquals(26.0, RobustStatistics.trimmedMean(rates, 0));
    }

    @Test
    void trimmedMean_withNothingLeft_shouldBeNaN() {
        assertTrue(Double.isNaN(RobustStatistics.trimmedMean(new double[] {1, 2}, 1)));
        assertThrows(IllegalArgumentException.class, () -> RobustStatistics.trimmedMean(new double[] {1}, -1));
    }
}
