/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core;

import ai.evacortex.attopulse.core.spectrum.DrivingField;

/**
 * Driving-field figures reported alongside every analysis.
 *
 * @param lambdaNm         central wavelength in nm
 * @param omega0           fundamental angular frequency (a.u.)
 * @param periodAu         optical period (a.u.)
 * @param periodSeconds    optical period (s)
 * @param maxOpticalCycle  end of the time window in optical cycles
 */
public record DriveSummary(double lambdaNm,
                           double omega0,
                           double periodAu,
                           double periodSeconds,
                           double maxOpticalCycle) {

    public static DriveSummary of(DrivingField field, TimeSeries series) {
        return new DriveSummary(field.lambdaNm(), field.omega0(), field.period(), field.periodSeconds(),
                field.toOpticalCycles(series.endTime()));
    }
}
