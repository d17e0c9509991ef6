/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.math;

/**
 * Physical constants and atomic-unit conversions shared by every transform.
 */
public final class PhysicalConstants {

    /** {@code ω0 [a.u.] = WAVELENGTH_NM_TO_OMEGA / λ0 [nm]}. */
    public static final double WAVELENGTH_NM_TO_OMEGA = 45.5633;

    public static final double INVERSE_FINE_STRUCTURE = 137.035999139;
    public static final double FINE_STRUCTURE = 1.0 / INVERSE_FINE_STRUCTURE;

    public static final double HBAR = 1.0545718e-34;
    public static final double SPEED_OF_LIGHT = 299792458.0;
    public static final double ELECTRON_MASS = 9.10938356e-31;
    public static final double ELEMENTARY_CHARGE = 1.602176565e-19;

    /** Bohr radius in metres. */
    public static final double BOHR_RADIUS = HBAR * INVERSE_FINE_STRUCTURE / (SPEED_OF_LIGHT * ELECTRON_MASS);

    /** One atomic unit of time in seconds. */
    public static final double ATOMIC_TIME_SECONDS = 2.4188843265857e-17;

    /** One hartree in electron-volts. */
    public static final double HARTREE_EV = 27.21138602;

    public static final double SECONDS_TO_ATTOSECONDS = 1e18;

    /** Floor applied to linear spectra and magnitudes before {@code log10}. */
    public static final double LOG_FLOOR = 1e-16;

    private PhysicalConstants() {}

    public static double omega0(double lambdaNm) {
        return WAVELENGTH_NM_TO_OMEGA / lambdaNm;
    }

    public static double atomicTimeToAttoseconds(double atomicTime) {
        return atomicTime * ATOMIC_TIME_SECONDS * SECONDS_TO_ATTOSECONDS;
    }
}
