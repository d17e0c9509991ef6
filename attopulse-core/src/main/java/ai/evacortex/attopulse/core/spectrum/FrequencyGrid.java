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
import ai.evacortex.attopulse.core.math.NumericUtils;

import java.util.Objects;

/**
 * Angular frequencies spanning {@code [qStart·ω0, qEnd·ω0]}, built with half-open {@code arange}
 * semantics so that the last point may sit up to one step beyond {@code qEnd·ω0}.
 */
public record FrequencyGrid(DrivingField field, double qStart, double qEnd, double[] omega) {

    public FrequencyGrid {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(omega, "omega must not be null");
        if (omega.length == 0) {
            throw new NumericPreconditionException("frequency grid is empty");
        }
    }

    /**
     * Grid with an absolute step {@code dOmega} in atomic units.
     */
    public static FrequencyGrid absolute(DrivingField field, double qStart, double qEnd, double dOmega) {
        checkBand(qStart, qEnd);
        checkStep(dOmega);
        double w0 = field.omega0();
        return new FrequencyGrid(field, qStart, qEnd, NumericUtils.arange(qStart * w0, qEnd * w0 + dOmega, dOmega));
    }

    /**
     * Grid stepped in harmonic order: {@code ω = ω0·arange(qStart, qEnd + dq, dq)}.
     */
    public static FrequencyGrid harmonic(DrivingField field, double qStart, double qEnd, double dq) {
        checkBand(qStart, qEnd);
        checkStep(dq);
        double w0 = field.omega0();
        double[] orders = NumericUtils.arange(qStart, qEnd + dq, dq);
        double[] omega = new double[orders.length];
        for (int i = 0; i < orders.length; i++) {
            omega[i] = w0 * orders[i];
        }
        return new FrequencyGrid(field, qStart, qEnd, omega);
    }

    public static void checkBand(double qStart, double qEnd) {
        if (!(qStart > 0.0)) {
            throw new NumericPreconditionException("qstart must be positive, got " + qStart);
        }
        if (!(qEnd > qStart)) {
            throw new NumericPreconditionException("qend must be greater than qstart, got [" + qStart + ", " + qEnd + "]");
        }
    }

    private static void checkStep(double step) {
        if (!(step > 0.0) || !Double.isFinite(step)) {
            throw new NumericPreconditionException("frequency step must be positive, got " + step);
        }
    }

    public int size() {
        return omega.length;
    }

    public double omega0() {
        return field.omega0();
    }

    public double[] harmonicOrders() {
        double w0 = omega0();
        double[] out = new double[omega.length];
        for (int i = 0; i < omega.length; i++) {
            out[i] = omega[i] / w0;
        }
        return out;
    }

    public double firstOrder() {
        return omega[0] / omega0();
    }

    public double lastOrder() {
        return omega[omega.length - 1] / omega0();
    }

    /** Spacing between grid points in harmonic order; 0 for a single-point grid. */
    public double orderStep() {
        return omega.length > 1 ? (omega[1] - omega[0]) / omega0() : 0.0;
    }
}
