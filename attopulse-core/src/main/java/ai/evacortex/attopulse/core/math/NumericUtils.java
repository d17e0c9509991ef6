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
 * Array-level numerics: quadrature, finite differences and grid construction.
 */
public final class NumericUtils {

    private NumericUtils() {}

    /**
     * Trapezoidal integral of {@code y} over the sample points {@code x}.
     */
    public static double trapezoid(double[] y, double[] x) {
        if (y.length != x.length) {
            throw new IllegalArgumentException("Mismatched lengths: " + y.length + " vs " + x.length);
        }
        double sum = 0.0;
        for (int i = 0; i < y.length - 1; i++) {
            sum += (x[i + 1] - x[i]) * (y[i + 1] + y[i]) / 2.0;
        }
        return sum;
    }

    /**
     * Trapezoidal integral of {@code y} restricted to the index range {@code [from, to]} inclusive.
     */
    public static double trapezoid(double[] y, double[] x, int from, int to) {
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += (x[i + 1] - x[i]) * (y[i + 1] + y[i]) / 2.0;
        }
        return sum;
    }

    /**
     * Centered finite difference with one-sided first-order differences at both ends,
     * divided by the uniform step {@code dt}.
     */
    public static double[] gradient(double[] values, double dt) {
        int n = values.length;
        if (n < 2) {
            throw new IllegalArgumentException("gradient requires at least 2 samples");
        }
        double[] out = new double[n];
        out[0] = (values[1] - values[0]) / dt;
        out[n - 1] = (values[n - 1] - values[n - 2]) / dt;
        for (int i = 1; i < n - 1; i++) {
            out[i] = (values[i + 1] - values[i - 1]) / (2.0 * dt);
        }
        return out;
    }

    /**
     * Evenly spaced values {@code start + i·step} in the half-open interval {@code [start, stop)}.
     * The element count is {@code ceil((stop - start) / step)}.
     */
    public static double[] arange(double start, double stop, double step) {
        if (!(step > 0.0)) {
            throw new IllegalArgumentException("step must be positive: " + step);
        }
        int n = (int) Math.ceil((stop - start) / step);
        if (n <= 0) return new double[0];
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = start + i * step;
        }
        return out;
    }

    public static double floorLog10(double value) {
        return Math.log10(Math.max(value, PhysicalConstants.LOG_FLOOR));
    }

    /**
     * Index of the first occurrence of the maximum value.
     */
    public static int argmax(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) best = i;
        }
        return best;
    }

    public static double max(double[] values) {
        return values[argmax(values)];
    }

    public static double[] subtractFirst(double[] values) {
        double[] out = new double[values.length];
        double first = values[0];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] - first;
        }
        return out;
    }
}
