/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core;

import ai.evacortex.attopulse.core.exceptions.NumericPreconditionException;

/**
 * Engine tunables.
 *
 * @param spectrumStep         absolute {@code dω} (a.u.) of the spectrum, yield, phase and ellipticity grids
 * @param pulseOrderStep       harmonic-order step of pulse reconstruction
 * @param mpwOrderStep         harmonic-order step of the minimum-pulse-width evaluator
 * @param mpwWorkers           worker-pool width of the minimum-pulse-width search
 * @param gaborUnstableFactor  {@code g} at or above which a time-frequency map is flagged unstable
 */
public record AttoPulseSettings(double spectrumStep,
                                double pulseOrderStep,
                                double mpwOrderStep,
                                int mpwWorkers,
                                double gaborUnstableFactor) {

    public static final String SPECTRUM_STEP = "attopulse.spectrum.step";
    public static final String PULSE_ORDER_STEP = "attopulse.pulse.orderStep";
    public static final String MPW_ORDER_STEP = "attopulse.mpw.orderStep";
    public static final String MPW_WORKERS = "attopulse.mpw.workers";
    public static final String GABOR_UNSTABLE_FACTOR = "attopulse.gabor.unstableFactor";

    public AttoPulseSettings {
        requirePositive(SPECTRUM_STEP, spectrumStep);
        requirePositive(PULSE_ORDER_STEP, pulseOrderStep);
        requirePositive(MPW_ORDER_STEP, mpwOrderStep);
        requirePositive(GABOR_UNSTABLE_FACTOR, gaborUnstableFactor);
        if (mpwWorkers < 1) {
            throw new NumericPreconditionException(MPW_WORKERS + " must be >= 1, got " + mpwWorkers);
        }
    }

    public static AttoPulseSettings defaults() {
        return new AttoPulseSettings(0.001, 0.01, 0.1, 4, 15.0);
    }

    public static AttoPulseSettings fromSystemProperties() {
        AttoPulseSettings d = defaults();
        return new AttoPulseSettings(
                Double.parseDouble(System.getProperty(SPECTRUM_STEP, Double.toString(d.spectrumStep()))),
                Double.parseDouble(System.getProperty(PULSE_ORDER_STEP, Double.toString(d.pulseOrderStep()))),
                Double.parseDouble(System.getProperty(MPW_ORDER_STEP, Double.toString(d.mpwOrderStep()))),
                Integer.getInteger(MPW_WORKERS, d.mpwWorkers()),
                Double.parseDouble(System.getProperty(GABOR_UNSTABLE_FACTOR, Double.toString(d.gaborUnstableFactor()))));
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0.0) || !Double.isFinite(value)) {
            throw new NumericPreconditionException(name + " must be positive, got " + value);
        }
    }
}
