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
 * Scalar outcome of reconstructing a single integer sub-band {@code [qStart, qEnd]}.
 */
public record SubBandEvaluation(int qStart, int qEnd, double fwhmAttoseconds, double peakTimeOc) {
}
