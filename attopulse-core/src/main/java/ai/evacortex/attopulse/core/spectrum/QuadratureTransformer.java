/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.spectrum;

import ai.evacortex.attopulse.core.exceptions.OptimizationCancelledException;
import ai.evacortex.attopulse.core.math.Complex;
import ai.evacortex.attopulse.core.math.NumericUtils;

import java.util.Objects;

public final class QuadratureTransformer implements SpectralTransformer {

    @Override
    public SpectralAmplitude transform(double[] t, double[] sx, double[] sy, FrequencyGrid grid,
                                       TransformOptions options) {
        Objects.requireNonNull(grid, "grid must not be null");
        Complex[] dx = transform(t, sx, grid.omega(), options);
        Complex[] dy = transform(t, sy, grid.omega(), options);
        return new SpectralAmplitude(grid, dx, dy);
    }

    @Override
    public Complex[] transform(double[] t, double[] signal, double[] omega, TransformOptions options) {
        if (t == null || signal == null || omega == null || options == null) {
            throw new NullPointerException("t, signal, omega and options must not be null");
        }
        if (t.length != signal.length) {
            throw new IllegalArgumentException("Mismatched lengths: " + t.length + " vs " + signal.length);
        }

        double[] s = options.derivative() ? NumericUtils.gradient(signal, t[1] - t[0]) : signal;
        double sign = options.sign().factor();
        int nt = t.length;
        Complex[] out = new Complex[omega.length];

        for (int m = 0; m < omega.length; m++) {
            checkInterrupted();
            double w = omega[m];
            double prevRe = s[0] * Math.cos(sign * w * t[0]);
            double prevIm = s[0] * Math.sin(sign * w * t[0]);
            double re = 0.0;
            double im = 0.0;
            for (int i = 1; i < nt; i++) {
                double phase = sign * w * t[i];
                double curRe = s[i] * Math.cos(phase);
                double curIm = s[i] * Math.sin(phase);
                double h = (t[i] - t[i - 1]) / 2.0;
                re += h * (curRe + prevRe);
                im += h * (curIm + prevIm);
                prevRe = curRe;
                prevIm = curIm;
            }
            out[m] = options.weightByOmega() ? new Complex(w * re, w * im) : new Complex(re, im);
        }
        return out;
    }

    @Override
    public Complex[] inverse(double[] omega, Complex[] amplitude, double[] t) {
        if (omega == null || amplitude == null || t == null) {
            throw new NullPointerException("omega, amplitude and t must not be null");
        }
        if (omega.length != amplitude.length) {
            throw new IllegalArgumentException("Mismatched lengths: " + omega.length + " vs " + amplitude.length);
        }

        int nw = omega.length;
        double[] ar = new double[nw];
        double[] ai = new double[nw];
        for (int k = 0; k < nw; k++) {
            ar[k] = amplitude[k].real;
            ai[k] = amplitude[k].imag;
        }

        Complex[] out = new Complex[t.length];
        for (int j = 0; j < t.length; j++) {
            checkInterrupted();
            double tj = t[j];
            double c0 = Math.cos(omega[0] * tj);
            double s0 = Math.sin(omega[0] * tj);
            double prevRe = ar[0] * c0 - ai[0] * s0;
            double prevIm = ar[0] * s0 + ai[0] * c0;
            double re = 0.0;
            double im = 0.0;
            for (int k = 1; k < nw; k++) {
                double c = Math.cos(omega[k] * tj);
                double s = Math.sin(omega[k] * tj);
                double curRe = ar[k] * c - ai[k] * s;
                double curIm = ar[k] * s + ai[k] * c;
                double h = (omega[k] - omega[k - 1]) / 2.0;
                re += h * (curRe + prevRe);
                im += h * (curIm + prevIm);
                prevRe = curRe;
                prevIm = curIm;
            }
            out[j] = new Complex(re, im);
        }
        return out;
    }

    private static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new OptimizationCancelledException("quadrature interrupted");
        }
    }
}
