/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core;

import ai.evacortex.attopulse.core.exceptions.NumericPreconditionException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AttoPulseSettingsTest {

    @Test
    void testDefaults() {
        AttoPulseSettings settings = AttoPulseSettings.defaults();
        assertEquals(0.001, settings.spectrumStep());
        assertEquals(0.01, settings.pulseOrderStep());
        assertEquals(0.1, settings.mpwOrderStep());
        assertEquals(4, settings.mpwWorkers());
        assertEquals(15.0, settings.gaborUnstableFactor());
    }

    @Test
    void testReadsSystemProperties() {
        System.setProperty(AttoPulseSettings.MPW_WORKERS, "7");
        System.setProperty(AttoPulseSettings.SPECTRUM_STEP, "0.005");
        try {
            AttoPulseSettings settings = AttoPulseSettings.fromSystemProperties();
            assertEquals(7, settings.mpwWorkers());
            assertEquals(0.005, settings.spectrumStep());
            assertEquals(0.01, settings.pulseOrderStep());
        } finally {
            System.clearProperty(AttoPulseSettings.MPW_WORKERS);
            System.clearProperty(AttoPulseSettings.SPECTRUM_STEP);
        }
    }

    @Test
    void testRejectsInvalidValues() {
        assertThrows(NumericPreconditionException.class, () -> new AttoPulseSettings(0.001, 0.01, 0.1, 0, 15.0));
        assertThrows(NumericPreconditionException.class, () -> new AttoPulseSettings(0.0, 0.01, 0.1, 4, 15.0));
        assertThrows(NumericPreconditionException.class, () -> new AttoPulseSettings(0.001, 0.01, Double.NaN, 4, 15.0));
    }
}
