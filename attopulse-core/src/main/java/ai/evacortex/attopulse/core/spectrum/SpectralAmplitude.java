/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.spectrum;

import ai.evacortex.attopulse.core.math.Complex;
import ai.evacortex.attopulse.core.math.NumericUtils;
import ai.evacortex.attopulse.core.math.PhysicalConstants;

import java.util.Objects;

/**
 * Complex spectral amplitudes {@code Dx(ω), Dy(ω)} aligned one-to-one with a {@link FrequencyGrid}.
 */
public record SpectralAmplitude(FrequencyGrid grid, Complex[] dx, Complex[] dy) {

    public SpectralAmplitude {
        Objects.requireNonNull(grid, "grid must not be null");
        if (dx.length != grid.size() || dy.length != grid.size()) {
            throw new IllegalArgumentException("Amplitude length must match grid size " + grid.size()
                    + ", got " + dx.length + "/" + dy.length);
        }
    }

    public int size() {
        return grid.size();
    }

    public double[] omega() {
        return grid.omega();
    }

    public double[] harmonicOrders() {
        return grid.harmonicOrders();
    }

    public Complex total(int i) {
        return dx[i].add(dy[i]);
    }

    /** {@code max(ω²|Dx|², 1e-16)} */
    public double[] linearSpectrumX() {
        return linear(dx, null);
    }

    public double[] linearSpectrumY() {
        return linear(dy, null);
    }

    /** {@code max(ω²|Dx + Dy|², 1e-16)} */
    public double[] linearSpectrumTotal() {
        return linear(dx, dy);
    }

    public double[] logSpectrumX() {
        return log10(linearSpectrumX());
    }

    public double[] logSpectrumY() {
        return log10(linearSpectrumY());
    }

    public double[] logSpectrumTotal() {
        return log10(linearSpectrumTotal());
    }

    private double[] linear(Complex[] a, Complex[] b) {
        double[] w = grid.omega();
        double[] out = new double[w.length];
        for (int i = 0; i < w.length; i++) {
            Complex d = b == null ? a[i] : a[i].add(b[i]);
            out[i] = Math.max(w[i] * w[i] * d.absSquared(), PhysicalConstants.LOG_FLOOR);
        }
        return out;
    }

    private static double[] log10(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = NumericUtils.floorLog10(values[i]);
        }
        return out;
    }
}
