/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.metrics;

import ai.evacortex.attopulse.core.exceptions.NumericPreconditionException;
import ai.evacortex.attopulse.core.exceptions.SubBandOutOfRangeException;
import ai.evacortex.attopulse.core.math.Complex;
import ai.evacortex.attopulse.core.math.NumericUtils;
import ai.evacortex.attopulse.core.spectrum.SpectralAmplitude;

import java.util.Arrays;
import java.util.Objects;

/**
 * Yield, ellipticity and phase derived from a computed {@link SpectralAmplitude}.
 *
 * <p>Every metric is restricted to a sub-band {@code [qFrom, qTo]} in harmonic order which must lie
 * inside the computed grid, with a tolerance of half a grid step at either end.</p>
 */
public final class SpectralMetrics {

    private static final double SQRT_HALF = Math.sqrt(0.5);

    private SpectralMetrics() {}

    /**
     * Trapezoidal integral of the linear spectrum {@code max(ω²|D|², 1e-16)} across harmonic order.
     */
    public static HarmonicYield yield(SpectralAmplitude amplitude, double qFrom, double qTo) {
        int[] range = subBand(amplitude, qFrom, qTo);
        double[] orders = amplitude.harmonicOrders();
        double x = NumericUtils.trapezoid(amplitude.linearSpectrumX(), orders, range[0], range[1]);
        double y = NumericUtils.trapezoid(amplitude.linearSpectrumY(), orders, range[0], range[1]);
        double total = NumericUtils.trapezoid(amplitude.linearSpectrumTotal(), orders, range[0], range[1]);
        return new HarmonicYield(qFrom, qTo, x, y, total);
    }

    /**
     * {@code ε = (|D_R| - |D_L|) / (|D_R| + |D_L|)} with {@code D_R = (Dx + i·Dy)/√2} and
     * {@code D_L = (Dx - i·Dy)/√2}. Bins where both vanish report 0.
     */
    public static EllipticitySpectrum ellipticity(SpectralAmplitude amplitude, double qFrom, double qTo) {
        int[] range = subBand(amplitude, qFrom, qTo);
        double[] orders = amplitude.harmonicOrders();
        int n = range[1] - range[0] + 1;
        double[] eps = new double[n];
        for (int k = 0; k < n; k++) {
            int i = range[0] + k;
            Complex iDy = amplitude.dy()[i].timesI();
            double right = amplitude.dx()[i].add(iDy).scale(SQRT_HALF).abs();
            double left = amplitude.dx()[i].subtract(iDy).scale(SQRT_HALF).abs();
            double sum = right + left;
            eps[k] = sum > 0.0 ? (right - left) / sum : 0.0;
        }
        return new EllipticitySpectrum(Arrays.copyOfRange(orders, range[0], range[1] + 1), eps);
    }

    public static PhaseSpectrum phase(SpectralAmplitude amplitude, double qFrom, double qTo) {
        int[] range = subBand(amplitude, qFrom, qTo);
        double[] orders = amplitude.harmonicOrders();
        int n = range[1] - range[0] + 1;
        double[] px = new double[n];
        double[] py = new double[n];
        double[] pt = new double[n];
        double[] intensity = new double[n];
        for (int k = 0; k < n; k++) {
            int i = range[0] + k;
            Complex total = amplitude.total(i);
            px[k] = amplitude.dx()[i].phase();
            py[k] = amplitude.dy()[i].phase();
            pt[k] = total.phase();
            intensity[k] = total.abs();
        }
        return new PhaseSpectrum(Arrays.copyOfRange(orders, range[0], range[1] + 1), px, py, pt, intensity);
    }

    /**
     * Checks that {@code [qFrom, qTo]} is a non-empty interval inside {@code [bandFrom, bandTo]},
     * widened by {@code tolerance} at either end. Needs no computed spectrum.
     */
    public static void requireSubBand(double qFrom, double qTo, double bandFrom, double bandTo, double tolerance) {
        if (!(qTo > qFrom)) {
            throw new NumericPreconditionException("sub-band upper bound must exceed lower bound, got ["
                    + qFrom + ", " + qTo + "]");
        }
        if (qFrom < bandFrom - tolerance || qTo > bandTo + tolerance) {
            throw new SubBandOutOfRangeException(qFrom, qTo, bandFrom, bandTo);
        }
    }

    /**
     * Inclusive index range {@code [from, to]} of the grid points inside {@code [qFrom, qTo]}.
     */
    static int[] subBand(SpectralAmplitude amplitude, double qFrom, double qTo) {
        Objects.requireNonNull(amplitude, "amplitude must not be null");
        double[] orders = amplitude.harmonicOrders();
        double tol = Math.max(amplitude.grid().orderStep() / 2.0, 1e-9);
        requireSubBand(qFrom, qTo, orders[0], orders[orders.length - 1], tol);

        int from = 0;
        while (from < orders.length - 1 && orders[from] < qFrom - tol) from++;
        int to = orders.length - 1;
        while (to > from && orders[to] > qTo + tol) to--;
        return new int[]{from, to};
    }
}
