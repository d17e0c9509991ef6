/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.pulse;

import ai.evacortex.attopulse.core.math.NumericUtils;
import ai.evacortex.attopulse.core.math.PhysicalConstants;

/**
 * Half-maximum crossing search. A side without a crossing is clamped to the sequence boundary.
 */
public final class FwhmExtractor {

    private FwhmExtractor() {}

    /**
     * @param intensity  profile samples
     * @param timeOc     sample times in optical cycles
     * @param periodAu   optical period in atomic units
     */
    public static PulseWidth extract(double[] intensity, double[] timeOc, double periodAu) {
        if (intensity.length == 0 || intensity.length != timeOc.length) {
            throw new IllegalArgumentException("intensity and time must be non-empty and aligned");
        }
        int peak = NumericUtils.argmax(intensity);
        double max = intensity[peak];
        double half = max / 2.0;

        int left = 0;
        for (int i = peak - 1; i >= 0; i--) {
            if (intensity[i] <= half) {
                left = i;
                break;
            }
        }

        int right = intensity.length - 1;
        for (int i = peak; i < intensity.length; i++) {
            if (intensity[i] <= half) {
                right = i;
                break;
            }
        }

        double widthOc = timeOc[right] - timeOc[left];
        double widthAs = PhysicalConstants.atomicTimeToAttoseconds(widthOc * periodAu);
        return new PulseWidth(peak, left, right, timeOc[peak], max, widthOc, widthAs);
    }
}
