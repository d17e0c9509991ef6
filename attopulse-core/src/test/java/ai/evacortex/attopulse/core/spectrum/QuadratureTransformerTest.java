/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.spectrum;

import ai.evacortex.attopulse.core.TimeSeries;
import ai.evacortex.attopulse.core.TimeSeriesTestUtils;
import ai.evacortex.attopulse.core.exceptions.OptimizationCancelledException;
import ai.evacortex.attopulse.core.math.Complex;
import ai.evacortex.attopulse.core.math.NumericUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QuadratureTransformerTest {

    private final SpectralTransformer transformer = new QuadratureTransformer();

    @Test
    @DisplayName("Near-DC band over a constant signal gives the plain integral")
    void testNearDcAmplitudeEqualsIntegral() {
        TimeSeries series = TimeSeriesTestUtils.constant(1001, 0.01, 1.0);
        FrequencyGrid grid = FrequencyGrid.absolute(new DrivingField(10_000.0), 0.01, 0.0101, 1e-7);

        SpectralAmplitude d = transformer.transform(series.t(), series.jx(), series.jy(), grid,
                TransformOptions.spectrum(false));

        assertEquals(grid.size(), d.dx().length);
        for (int i = 0; i < d.size(); i++) {
            assertEquals(10.0, d.dx()[i].abs(), 1e-3);
            assertEquals(10.0, d.dy()[i].abs(), 1e-3);
        }
    }

    @Test
    void testDerivativeModeDifferentiatesFirst() {
        int n = 1001;
        double[] t = new double[n];
        double[] ramp = new double[n];
        for (int i = 0; i < n; i++) {
            t[i] = i * 0.01;
            ramp[i] = 3.0 * t[i];
        }
        Complex[] d = transformer.transform(t, ramp, new double[]{1e-5}, TransformOptions.spectrum(true));
        assertEquals(30.0, d[0].abs(), 1e-3);
    }

    @Test
    void testSignConventionsAreConjugate() {
        TimeSeries series = TimeSeriesTestUtils.sineWithDecay(0.3);
        double[] omega = {0.1, 0.4, 1.3};
        Complex[] plus = transformer.transform(series.t(), series.jx(), omega, TransformOptions.spectrum(false));
        Complex[] minus = transformer.transform(series.t(), series.jx(), omega, TransformOptions.pulse(false));
        for (int i = 0; i < omega.length; i++) {
            assertEquals(plus[i].real, minus[i].real, 1e-12);
            assertEquals(plus[i].imag, -minus[i].imag, 1e-12);
        }
    }

    @Test
    void testOmegaWeightingScalesEachBin() {
        TimeSeries series = TimeSeriesTestUtils.sineWithDecay(0.3);
        double[] omega = {0.5, 2.0};
        Complex[] raw = transformer.transform(series.t(), series.jx(), omega, TransformOptions.pulse(false));
        Complex[] weighted = transformer.transform(series.t(), series.jx(), omega, TransformOptions.pulse(true));
        for (int i = 0; i < omega.length; i++) {
            assertEquals(omega[i] * raw[i].abs(), weighted[i].abs(), 1e-12);
        }
    }

    @Test
    void testSpectrumPeaksAtDrivingHarmonic() {
        DrivingField field = new DrivingField(800.0);
        double w0 = field.omega0();
        TimeSeries series = TimeSeriesTestUtils.gaussianPulse(w0, 2.0 * field.period(), 1000.0, 2000.0, 1.0);
        FrequencyGrid grid = FrequencyGrid.absolute(field, 0.5, 3.0, 0.001);

        SpectralAmplitude d = transformer.transform(series.t(), series.jx(), series.jy(), grid,
                TransformOptions.spectrum(false));

        double peakOrder = d.harmonicOrders()[NumericUtils.argmax(d.linearSpectrumX())];
        assertEquals(1.0, peakOrder, 0.1);
        for (double s : d.logSpectrumY()) {
            assertEquals(-16.0, s, 1e-12);
        }
    }

    @Test
    void testInverseOfSingleToneIsFlatMagnitude() {
        double[] omega = NumericUtils.arange(0.9, 1.1005, 0.001);
        Complex[] a = new Complex[omega.length];
        for (int k = 0; k < a.length; k++) {
            a[k] = new Complex(1.0, 0.0);
        }
        Complex[] f = transformer.inverse(omega, a, new double[]{0.0});
        assertEquals(omega[omega.length - 1] - omega[0], f[0].real, 1e-9);
        assertEquals(0.0, f[0].imag, 1e-12);
    }

    @Test
    void testAbortsWhenInterrupted() {
        TimeSeries series = TimeSeriesTestUtils.sineWithDecay(0.3);
        Thread.currentThread().interrupt();
        try {
            assertThrows(OptimizationCancelledException.class,
                    () -> transformer.transform(series.t(), series.jx(), new double[]{1.0}, TransformOptions.spectrum(false)));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testRejectsMismatchedLengths() {
        assertThrows(IllegalArgumentException.class,
                () -> transformer.transform(new double[]{0, 1, 2}, new double[]{1, 2}, new double[]{1.0},
                        TransformOptions.spectrum(false)));
    }
}
