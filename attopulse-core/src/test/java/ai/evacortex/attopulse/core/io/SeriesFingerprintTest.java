/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.io;

import ai.evacortex.attopulse.core.TimeSeries;
import ai.evacortex.attopulse.core.TimeSeriesTestUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SeriesFingerprintTest {

    @Test
    void testFingerprintIsDeterministicAndContentSensitive() {
        TimeSeries a = TimeSeriesTestUtils.constant(32, 0.1, 1.0);
        TimeSeries b = TimeSeriesTestUtils.constant(32, 0.1, 1.0);

        assertEquals(SeriesFingerprint.compute(a), SeriesFingerprint.compute(b),
                "Fingerprint must be deterministic for identical series");
        assertEquals(16, SeriesFingerprint.hex(a).length(), "xxHash64 hex string must be 16 chars long");

        double[] jx = a.jx().clone();
        jx[31] = Math.nextUp(jx[31]);
        TimeSeries changed = new TimeSeries(a.t(), jx, a.jy());
        assertNotEquals(SeriesFingerprint.compute(a), SeriesFingerprint.compute(changed),
                "Fingerprints must differ for different series");
    }
}
