/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.filter;

import ai.evacortex.attopulse.core.TimeSeries;
import ai.evacortex.attopulse.core.TimeSeriesTestUtils;
import ai.evacortex.attopulse.core.exceptions.InputValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SignalConditionerTest {

    private final SignalConditioner conditioner = new SignalConditioner();

    private static List<FilterConfig> everyMethod(double eop) {
        return List.of(
                FilterConfig.cosine(eop, 2.0),
                FilterConfig.gaussian(eop, 3.0),
                FilterConfig.exponentialDecay(eop, 0.2),
                FilterConfig.hanning(eop),
                FilterConfig.welch(eop),
                FilterConfig.bartlett(eop));
    }

    @Test
    @DisplayName("100 ones, EoP 0.5, cosine exponent 2")
    void testCosineTaperOnSecondHalf() {
        TimeSeries series = TimeSeriesTestUtils.constant(100, 1.0, 1.0);
        ConditionedSignal h = conditioner.apply(series, FilterConfig.cosine(0.5, 2.0));

        for (int i = 0; i < 50; i++) {
            assertEquals(1.0, h.hx()[i], 0.0, "sample " + i + " must be untouched");
        }
        for (int k = 0; k < 50; k++) {
            double expected = Math.pow(Math.cos(0.5 * Math.PI * k / 49.0), 2);
            assertEquals(expected, h.hx()[50 + k], 1e-12, "tail sample " + k);
            assertEquals(expected, h.hy()[50 + k], 1e-12, "tail sample " + k);
        }
        assertFalse(h.hasDerivative());
    }

    @Test
    void testEndOfPulseOneIsNoOp() {
        TimeSeries series = TimeSeriesTestUtils.constant(64, 0.5, 2.0);
        for (FilterConfig cfg : everyMethod(1.0)) {
            ConditionedSignal h = conditioner.apply(series, cfg);
            assertArrayEquals(series.jx(), h.hx(), 0.0, cfg.method().name());
            assertArrayEquals(series.jy(), h.hy(), 0.0, cfg.method().name());
        }
        assertArrayEquals(series.jx(), conditioner.apply(series, FilterConfig.none()).hx(), 0.0);
    }

    @Test
    void testMultipliersNeverExceedOne() {
        double[] t = TimeSeriesTestUtils.constant(200, 0.1, 1.0).t();
        for (double eop : new double[]{0.0, 0.3, 0.75}) {
            for (FilterConfig cfg : everyMethod(eop)) {
                for (double w : conditioner.window(t, cfg)) {
                    assertTrue(w <= 1.0 + 1e-12, cfg + " produced " + w);
                }
            }
        }
    }

    @Test
    void testZeroEndOfPulseWindowsWholeSeries() {
        double[] w = conditioner.window(TimeSeriesTestUtils.constant(10, 1.0, 1.0).t(), FilterConfig.hanning(0.0));
        assertEquals(0.0, w[0], 1e-15);
        assertEquals(0.5 * (1.0 - Math.cos(2.0 * Math.PI * 3 / 10)), w[3], 1e-15);
    }

    @Test
    void testWelchAndBartlettShapes() {
        double[] t = TimeSeriesTestUtils.constant(11, 1.0, 1.0).t();
        double[] welch = conditioner.window(t, FilterConfig.welch(0.0));
        assertEquals(0.0, welch[0], 1e-15);
        assertEquals(1.0, welch[5], 1e-15);
        assertEquals(0.0, welch[10], 1e-15);

        double[] bartlett = conditioner.window(t, FilterConfig.bartlett(0.0));
        assertEquals(0.0, bartlett[0], 1e-15);
        assertEquals(1.0 - Math.abs((5 - 5.5) / 5.5), bartlett[5], 1e-15);
    }

    @Test
    void testDerivativeReceivesSameMultiplier() {
        TimeSeries series = TimeSeriesTestUtils.constant(40, 1.0, 1.0);
        double[] djx = new double[40];
        double[] djy = new double[40];
        for (int i = 0; i < 40; i++) {
            djx[i] = i;
            djy[i] = -2.0 * i;
        }
        FilterConfig cfg = FilterConfig.gaussian(0.25, 5.0);
        ConditionedSignal h = conditioner.apply(series, djx, djy, cfg);
        double[] w = conditioner.window(series.t(), cfg);

        assertTrue(h.hasDerivative());
        for (int i = 0; i < 40; i++) {
            assertEquals(djx[i] * w[i], h.dhx()[i], 1e-15);
            assertEquals(djy[i] * w[i], h.dhy()[i], 1e-15);
        }
    }

    @Test
    void testRejectsDerivativeOfWrongLength() {
        TimeSeries series = TimeSeriesTestUtils.constant(10, 1.0, 1.0);
        assertThrows(InputValidationException.class,
                () -> conditioner.apply(series, new double[9], new double[10], FilterConfig.none()));
    }
}
