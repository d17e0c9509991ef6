/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.pulse;

/**
 * Full width at half maximum of a reconstructed intensity profile.
 *
 * @param peakIndex          sample index of the global maximum
 * @param leftIndex          last sample at/below half maximum before the peak, or 0
 * @param rightIndex         first sample at/below half maximum from the peak on, or the last index
 * @param peakTimeOc         time of the maximum in optical cycles
 * @param maximum            peak intensity
 * @param fwhmOpticalCycles  width in optical cycles
 * @param fwhmAttoseconds    width in attoseconds
 */
public record PulseWidth(int peakIndex,
                         int leftIndex,
                         int rightIndex,
                         double peakTimeOc,
                         double maximum,
                         double fwhmOpticalCycles,
                         double fwhmAttoseconds) {

    public double halfMaximum() {
        return maximum / 2.0;
    }
}
