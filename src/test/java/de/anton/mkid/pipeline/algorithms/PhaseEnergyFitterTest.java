package de.anton.mkid.pipeline.algorithms;

import org.apache.commons.math3.linear.SingularMatrixException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PhaseEnergyFitterTest {

    @Test
    void fit_twoPointsLinear_shouldPassThroughBoth() {
        double[] phases = {-0.5, -0.3};
        double[] energies = {1.305, 1.127};

        PhaseEnergyFitter.PolynomialFit fit = PhaseEnergyFitter.fit(phases, new double[] {1e-6, 1e-6}, energies, 1);

        assertEquals(1.305, fit.function().value(-0.5), 1e-9);
        assertEquals(1.127, fit.function().value(-0.3), 1e-9);
        assertEquals(0.0, fit.reducedChiSquared());
    }

    @Test
    void fit_overdetermined_shouldReportReducedChiSquared() {
        double[] phases = {-0.6, -0.5, -0.4, -0.3};
        double[] energies = new double[phases.length];
        for (int i = 0; i < phases.length; i++) {
            energies[i] = 0.2 - 2.0 * phases[i] + 0.5 * phases[i] * phases[i];
        }
        double[] variances = {1e-6, 1e-6, 1e-6, 1e-6};

        PhaseEnergyFitter.PolynomialFit exact = PhaseEnergyFitter.fit(phases, variances, energies, 2);
        energies[1] += 0.01;
        PhaseEnergyFitter.PolynomialFit perturbed = PhaseEnergyFitter.fit(phases, variances, energies, 2);

        assertArrayEquals(new double[] {0.2, -2.0, 0.5}, exact.coefficients(), 1e-8);
        assertTrue(exact.reducedChiSquared() < 1e-6);
        assertTrue(perturbed.reducedChiSquared() > 1.0);
    }

    @Test
    void fit_samePhaseTwice_shouldBeSingular() {
        assertThrows(SingularMatrixException.class, () -> PhaseEnergyFitter.fit(
            new double[] {-0.4, -0.4}, new double[] {1e-6, 1e-6}, new double[] {1.2, 1.3}, 1));
        assertThrows(IllegalArgumentException.class, () -> PhaseEnergyFitter.fit(
            new double[] {-0.4}, new double[] {1e-6}, new double[] {1.2}, 1));
    }

    @Test
    void isMonotonic_shouldDetectTurningPointInRange() {
        double[] parabola = {0, 0, 1}; // minimum at 0

        assertTrue(PhaseEnergyFitter.isMonotonic(parabola, -0.6, -0.1));
        assertFalse(PhaseEnergyFitter.isMonotonic(parabola, -0.3, 0.3));
        assertFalse(PhaseEnergyFitter.isMonotonic(new double[] {1.0}, -0.5, -0.3), "constant model");
    }
}
