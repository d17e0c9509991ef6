/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.metrics;

import ai.evacortex.attopulse.core.exceptions.NumericPreconditionException;
import ai.evacortex.attopulse.core.exceptions.SubBandOutOfRangeException;
import ai.evacortex.attopulse.core.math.Complex;
import ai.evacortex.attopulse.core.spectrum.DrivingField;
import ai.evacortex.attopulse.core.spectrum.FrequencyGrid;
import ai.evacortex.attopulse.core.spectrum.SpectralAmplitude;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

class SpectralMetricsTest {

    private static final FrequencyGrid GRID = FrequencyGrid.harmonic(new DrivingField(800.0), 1.0, 3.0, 0.5);

    private static SpectralAmplitude amplitude(UnaryOperator<Complex> dyFromDx) {
        double[] w = GRID.omega();
        Complex[] dx = new Complex[w.length];
        Complex[] dy = new Complex[w.length];
        for (int i = 0; i < w.length; i++) {
            dx[i] = new Complex(0.6 / w[i], 0.8 / w[i]);
            dy[i] = dyFromDx.apply(dx[i]);
        }
        return new SpectralAmplitude(GRID, dx, dy);
    }

    @Test
    void testYieldIntegratesLinearSpectrum() {
        SpectralAmplitude d = amplitude(x -> new Complex(0.0, 0.0));
        HarmonicYield yield = SpectralMetrics.yield(d, 1.0, 3.0);

        assertEquals(2.0, yield.x(), 1e-12);
        assertEquals(2.0 * 1e-16, yield.y(), 1e-28);
        assertEquals(yield.x(), yield.total(), 1e-12);

        assertEquals(1.0, SpectralMetrics.yield(d, 1.5, 2.5).x(), 1e-12);
    }

    @Test
    void testEllipticityOfCircularAndLinearStates() {
        EllipticitySpectrum right = SpectralMetrics.ellipticity(amplitude(x -> new Complex(x.imag, -x.real)), 1.0, 3.0);
        EllipticitySpectrum left = SpectralMetrics.ellipticity(amplitude(Complex::timesI), 1.0, 3.0);
        EllipticitySpectrum linear = SpectralMetrics.ellipticity(amplitude(x -> x), 1.0, 3.0);

        assertEquals(5, right.size());
        for (int i = 0; i < right.size(); i++) {
            assertEquals(1.0, right.ellipticity()[i], 1e-12);
            assertEquals(-1.0, left.ellipticity()[i], 1e-12);
            assertEquals(0.0, linear.ellipticity()[i], 1e-12);
        }
    }

    @Test
    void testEllipticityOfVanishingBinIsZero() {
        Complex[] zeros = new Complex[GRID.size()];
        Arrays.fill(zeros, new Complex(0.0, 0.0));
        EllipticitySpectrum eps = SpectralMetrics.ellipticity(new SpectralAmplitude(GRID, zeros, zeros), 1.0, 3.0);
        for (double e : eps.ellipticity()) {
            assertEquals(0.0, e);
        }
    }

    @Test
    void testPhaseOfEachComponent() {
        PhaseSpectrum phase = SpectralMetrics.phase(amplitude(Complex::timesI), 2.0, 3.0);

        assertEquals(3, phase.size());
        assertArrayEquals(new double[]{2.0, 2.5, 3.0}, phase.harmonicOrders(), 1e-12);
        double expectedX = Math.atan2(0.8, 0.6);
        for (int i = 0; i < phase.size(); i++) {
            assertEquals(expectedX, phase.phaseX()[i], 1e-12);
            assertEquals(expectedX + Math.PI / 2, phase.phaseY()[i], 1e-12);
            assertEquals(Math.toDegrees(expectedX), phase.phaseXDegrees()[i], 1e-9);
        }
    }

    @Test
    void testRejectsSubBandOutsideGrid() {
        SpectralAmplitude d = amplitude(x -> x);
        assertThrows(SubBandOutOfRangeException.class, () -> SpectralMetrics.yield(d, 0.5, 2.0));
        assertThrows(SubBandOutOfRangeException.class, () -> SpectralMetrics.phase(d, 2.0, 4.0));
        assertThrows(NumericPreconditionException.class, () -> SpectralMetrics.ellipticity(d, 2.0, 2.0));
    }

    @Test
    void testSubBandSelectsInclusiveRange() {
        int[] range = SpectralMetrics.subBand(amplitude(x -> x), 1.5, 2.5);
        assertArrayEquals(new int[]{1, 3}, range);
    }
}
