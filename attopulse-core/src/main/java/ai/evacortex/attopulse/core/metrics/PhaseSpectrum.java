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
 * Harmonic phases in radians and the combined intensity {@code |Dx + Dy|} used to weight them.
 */
public record PhaseSpectrum(double[] harmonicOrders,
                            double[] phaseX,
                            double[] phaseY,
                            double[] phaseTotal,
                            double[] intensity) {

    public int size() {
        return harmonicOrders.length;
    }

    public double[] phaseXDegrees() {
        return toDegrees(phaseX);
    }

    public double[] phaseYDegrees() {
        return toDegrees(phaseY);
    }

    public double[] phaseTotalDegrees() {
        return toDegrees(phaseTotal);
    }

    private static double[] toDegrees(double[] radians) {
        double[] out = new double[radians.length];
        for (int i = 0; i < radians.length; i++) {
            out[i] = Math.toDegrees(radians[i]);
        }
        return out;
    }
}
