/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.math;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComplexTest {

    @Test
    void testArithmetic() {
        Complex a = new Complex(1, 2);
        Complex b = new Complex(3, -1);
        assertEquals(new Complex(4, 1), a.add(b));
        assertEquals(new Complex(-2, 3), a.subtract(b));
        assertEquals(new Complex(-2, 1), a.timesI());
        assertEquals(new Complex(2, 4), a.scale(2.0));
        assertEquals(5.0, a.absSquared(), 1e-15);
    }

    @Test
    void testModulusAndPhase() {
        Complex c = new Complex(0.5, 0.5 * Math.sqrt(3.0));
        assertEquals(1.0, c.abs(), 1e-15);
        assertEquals(Math.PI / 3, c.phase(), 1e-15);
    }
}
