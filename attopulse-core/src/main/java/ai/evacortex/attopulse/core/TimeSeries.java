/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core;

import ai.evacortex.attopulse.core.exceptions.InputValidationException;
import ai.evacortex.attopulse.core.exceptions.NumericPreconditionException;
import ai.evacortex.attopulse.core.math.NumericUtils;

import java.util.Objects;

/**
 * Uniformly sampled two-component current {@code (t_i, jx_i, jy_i)} in atomic units.
 *
 * <p>Arrays are copied on construction. Accessors return the internal arrays so that the
 * quadrature loops avoid per-call copies; callers must treat them as read-only. Under that
 * contract instances are safe for concurrent reads.</p>
 */
public record TimeSeries(double[] t, double[] jx, double[] jy) {

    public TimeSeries {
        Objects.requireNonNull(t, "t must not be null");
        Objects.requireNonNull(jx, "jx must not be null");
        Objects.requireNonNull(jy, "jy must not be null");
        if (t.length != jx.length || t.length != jy.length) {
            throw new InputValidationException("column length mismatch: t=" + t.length
                    + ", jx=" + jx.length + ", jy=" + jy.length);
        }
        if (t.length < 2) {
            throw new InputValidationException("at least 2 samples required, got " + t.length);
        }
        double dt = t[1] - t[0];
        if (!(dt > 0.0)) {
            throw new NumericPreconditionException("time step must be positive, got dt=" + dt);
        }
        if (isAllZero(jx) && isAllZero(jy)) {
            throw new InputValidationException("both jx and jy are identically zero");
        }
        t = t.clone();
        jx = jx.clone();
        jy = jy.clone();
    }

    public int size() {
        return t.length;
    }

    public double dt() {
        return t[1] - t[0];
    }

    public double startTime() {
        return t[0];
    }

    public double endTime() {
        return t[t.length - 1];
    }

    public double duration() {
        return endTime() - startTime();
    }

    /**
     * Shifts both components so that their first samples are zero.
     */
    public TimeSeries withOffsetRemoved() {
        return new TimeSeries(t, NumericUtils.subtractFirst(jx), NumericUtils.subtractFirst(jy));
    }

    /**
     * Keeps every {@code stride}-th sample starting from the first.
     */
    public TimeSeries downsample(int stride) {
        if (stride < 1) {
            throw new NumericPreconditionException("stride must be >= 1, got " + stride);
        }
        if (stride == 1) return this;
        int n = (t.length + stride - 1) / stride;
        double[] ts = new double[n];
        double[] xs = new double[n];
        double[] ys = new double[n];
        for (int i = 0, k = 0; k < n; i += stride, k++) {
            ts[k] = t[i];
            xs[k] = jx[i];
            ys[k] = jy[i];
        }
        return new TimeSeries(ts, xs, ys);
    }

    public double[] derivativeX() {
        return NumericUtils.gradient(jx, dt());
    }

    public double[] derivativeY() {
        return NumericUtils.gradient(jy, dt());
    }

    private static boolean isAllZero(double[] values) {
        for (double v : values) {
            if (v != 0.0) return false;
        }
        return true;
    }
}
