/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.metrics;

/**
 * Per-harmonic ellipticity in [-1, 1]; +1 is purely right-circular, -1 purely left-circular.
 */
public record EllipticitySpectrum(double[] harmonicOrders, double[] ellipticity) {

    public int size() {
        return harmonicOrders.length;
    }
}
