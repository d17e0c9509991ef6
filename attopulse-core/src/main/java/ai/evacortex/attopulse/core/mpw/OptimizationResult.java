/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.mpw;

/**
 * Winning sub-band of a minimum-pulse-width search.
 *
 * @param qStart            lower harmonic order of the narrowest pulse
 * @param qMax              upper harmonic order of the narrowest pulse
 * @param fwhmAttoseconds   its FWHM in attoseconds
 * @param peakTimeOc        time of its intensity maximum in optical cycles
 * @param lastOpticalCycle  start of the last full optical cycle of the input window
 * @param maxOpticalCycle   length of the input window in optical cycles
 */
public record OptimizationResult(int qStart,
                                 int qMax,
                                 double fwhmAttoseconds,
                                 double peakTimeOc,
                                 double lastOpticalCycle,
                                 double maxOpticalCycle) {
}
