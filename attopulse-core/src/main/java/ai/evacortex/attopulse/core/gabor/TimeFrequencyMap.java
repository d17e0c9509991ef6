/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.gabor;

import ai.evacortex.attopulse.core.math.PhysicalConstants;
import ai.evacortex.attopulse.core.spectrum.DrivingField;

/**
 * Gabor magnitudes indexed {@code [time sample][frequency bin]}, stored as {@code log10} of the
 * floored magnitude.
 *
 * @param field           driving field the frequency axis is expressed against
 * @param t               time samples (a.u.)
 * @param omega           frequency bins (a.u.)
 * @param photonEnergyEv  frequency bins converted to photon energy in eV
 * @param logX            {@code log10|Ax|}
 * @param logY            {@code log10|Ay|}
 * @param logTotal        {@code log10 sqrt(|Ax|² + |Ay|²)}
 * @param sigma           Gaussian window width {@code T/g} in a.u.
 * @param gFactor         requested {@code g} factor
 * @param unstable        true when {@code g} is at or above the configured stability threshold
 */
public record TimeFrequencyMap(DrivingField field,
                               double[] t,
                               double[] omega,
                               double[] photonEnergyEv,
                               double[][] logX,
                               double[][] logY,
                               double[][] logTotal,
                               double sigma,
                               double gFactor,
                               boolean unstable) {

    public int timeSamples() {
        return t.length;
    }

    public int frequencyBins() {
        return omega.length;
    }

    public double[] harmonicOrders() {
        double w0 = field.omega0();
        double[] out = new double[omega.length];
        for (int i = 0; i < omega.length; i++) {
            out[i] = omega[i] / w0;
        }
        return out;
    }

    public double[] timeOpticalCycles() {
        return field.toOpticalCycles(t);
    }

    /** Window width in seconds. */
    public double sigmaSeconds() {
        return sigma * PhysicalConstants.ATOMIC_TIME_SECONDS;
    }

    /**
     * Index of the strongest frequency bin of the combined map at time sample {@code timeIndex}.
     */
    public int ridgeBin(int timeIndex) {
        double[] row = logTotal[timeIndex];
        int best = 0;
        for (int k = 1; k < row.length; k++) {
            if (row[k] > row[best]) best = k;
        }
        return best;
    }
}
