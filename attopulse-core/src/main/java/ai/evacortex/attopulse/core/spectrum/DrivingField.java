/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.spectrum;

import ai.evacortex.attopulse.core.exceptions.NumericPreconditionException;
import ai.evacortex.attopulse.core.math.PhysicalConstants;

/**
 * Driving laser described by its central wavelength in nanometres.
 */
public record DrivingField(double lambdaNm) {

    public static final double MAX_WAVELENGTH_NM = 10_000.0;

    public DrivingField {
        if (!(lambdaNm > 0.0 && lambdaNm <= MAX_WAVELENGTH_NM)) {
            throw new NumericPreconditionException(
                    "driving wavelength must be within (0, " + MAX_WAVELENGTH_NM + "] nm, got " + lambdaNm);
        }
    }

    /** Fundamental angular frequency in atomic units. */
    public double omega0() {
        return PhysicalConstants.omega0(lambdaNm);
    }

    /** Optical period in atomic units. */
    public double period() {
        return 2.0 * Math.PI / omega0();
    }

    public double periodSeconds() {
        return period() * PhysicalConstants.ATOMIC_TIME_SECONDS;
    }

    public double toOpticalCycles(double atomicTime) {
        return atomicTime / period();
    }

    public double[] toOpticalCycles(double[] atomicTimes) {
        double period = period();
        double[] out = new double[atomicTimes.length];
        for (int i = 0; i < atomicTimes.length; i++) {
            out[i] = atomicTimes[i] / period;
        }
        return out;
    }
}
