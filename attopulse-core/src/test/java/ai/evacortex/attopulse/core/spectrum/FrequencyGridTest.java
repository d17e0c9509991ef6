/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.spectrum;

import ai.evacortex.attopulse.core.exceptions.NumericPreconditionException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FrequencyGridTest {

    private static final DrivingField FIELD = new DrivingField(800.0);

    @Test
    void testDrivingFieldConversions() {
        assertEquals(45.5633 / 800.0, FIELD.omega0(), 1e-15);
        assertEquals(2.0 * Math.PI / FIELD.omega0(), FIELD.period(), 1e-12);
        assertEquals(2.0, FIELD.toOpticalCycles(2.0 * FIELD.period()), 1e-12);
        assertThrows(NumericPreconditionException.class, () -> new DrivingField(0.0));
        assertThrows(NumericPreconditionException.class, () -> new DrivingField(10_000.5));
        assertDoesNotThrow(() -> new DrivingField(10_000.0));
    }

    @Test
    void testHarmonicGridIncludesUpperOrder() {
        FrequencyGrid grid = FrequencyGrid.harmonic(FIELD, 1.0, 5.0, 0.5);
        assertArrayEquals(new double[]{1, 1.5, 2, 2.5, 3, 3.5, 4, 4.5, 5}, grid.harmonicOrders(), 1e-12);
        assertEquals(0.5, grid.orderStep(), 1e-12);
        assertEquals(1.0, grid.firstOrder(), 1e-12);
        assertEquals(5.0, grid.lastOrder(), 1e-12);
    }

    @Test
    void testAbsoluteGridIsMonotonicWithFixedStep() {
        FrequencyGrid grid = FrequencyGrid.absolute(FIELD, 1.0, 5.0, 0.001);
        double[] w = grid.omega();
        assertEquals(FIELD.omega0(), w[0], 1e-15);
        assertTrue(w[w.length - 1] >= 5.0 * FIELD.omega0() - 1e-12);
        assertTrue(w[w.length - 1] < 5.0 * FIELD.omega0() + 0.001);
        for (int i = 1; i < w.length; i++) {
            assertEquals(0.001, w[i] - w[i - 1], 1e-12);
        }
    }

    @Test
    void testRejectsInvalidBands() {
        assertThrows(NumericPreconditionException.class, () -> FrequencyGrid.harmonic(FIELD, 0.0, 5.0, 0.1));
        assertThrows(NumericPreconditionException.class, () -> FrequencyGrid.harmonic(FIELD, 5.0, 5.0, 0.1));
        assertThrows(NumericPreconditionException.class, () -> FrequencyGrid.absolute(FIELD, 3.0, 2.0, 0.001));
        assertThrows(NumericPreconditionException.class, () -> FrequencyGrid.absolute(FIELD, 1.0, 2.0, 0.0));
    }
}
