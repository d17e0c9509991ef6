/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.gabor;

import ai.evacortex.attopulse.core.TimeSeries;
import ai.evacortex.attopulse.core.exceptions.NumericPreconditionException;
import ai.evacortex.attopulse.core.filter.ConditionedSignal;
import ai.evacortex.attopulse.core.filter.FilterConfig;
import ai.evacortex.attopulse.core.filter.SignalConditioner;
import ai.evacortex.attopulse.core.math.FftConvolver;
import ai.evacortex.attopulse.core.math.NumericUtils;
import ai.evacortex.attopulse.core.math.PhysicalConstants;
import ai.evacortex.attopulse.core.spectrum.DrivingField;
import ai.evacortex.attopulse.core.spectrum.FrequencyGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Gabor transform of the windowed current.
 *
 * <p>For every bin {@code ω_i} of {@code arange(qStart·ω0, qEnd·ω0 + ω0/2, ω0/2)} the signal is
 * modulated by {@code e^{-iω_i t}} and convolved ("same" mode) with the Gaussian
 * {@code exp(-τ²/2σ²)}, {@code σ = T/g}, sampled on {@code |τ| ≤ ceil(6σ/dt)·dt}. The convolution
 * is scaled by {@code dt}.</p>
 */
public final class TimeFrequencyAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TimeFrequencyAnalyzer.class);

    public static final double DEFAULT_UNSTABLE_FACTOR = 15.0;
    private static final double KERNEL_HALF_WIDTH_SIGMAS = 6.0;

    private final SignalConditioner conditioner;
    private final double unstableFactor;

    public TimeFrequencyAnalyzer() {
        this(new SignalConditioner(), DEFAULT_UNSTABLE_FACTOR);
    }

    public TimeFrequencyAnalyzer(SignalConditioner conditioner, double unstableFactor) {
        this.conditioner = Objects.requireNonNull(conditioner, "conditioner must not be null");
        if (!(unstableFactor > 0.0)) {
            throw new NumericPreconditionException("unstable factor threshold must be positive, got " + unstableFactor);
        }
        this.unstableFactor = unstableFactor;
    }

    public TimeFrequencyMap analyze(TimeSeries series, DrivingField field, double qStart, double qEnd,
                                    double gFactor, FilterConfig filter) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(filter, "filter must not be null");
        if (!(gFactor > 0.0) || !Double.isFinite(gFactor)) {
            throw new NumericPreconditionException("g factor must be positive, got " + gFactor);
        }
        FrequencyGrid.checkBand(qStart, qEnd);

        boolean unstable = gFactor >= unstableFactor;
        if (unstable) {
            log.warn("g factor {} is at or above {}; the time-frequency map is likely unstable", gFactor, unstableFactor);
        }

        ConditionedSignal h = conditioner.apply(series, filter);
        double[] t = h.t();
        double dt = series.dt();
        double w0 = field.omega0();
        double dw = w0 / 2.0;
        double[] omega = NumericUtils.arange(qStart * w0, qEnd * w0 + dw, dw);
        double sigma = field.period() / gFactor;

        FftConvolver convolver = new FftConvolver(gaussianKernel(sigma, dt), t.length);
        log.debug("Gabor transform: {} samples x {} bins, sigma={} a.u.", t.length, omega.length, sigma);

        int nt = t.length;
        int nw = omega.length;
        double[][] logX = new double[nt][nw];
        double[][] logY = new double[nt][nw];
        double[][] logTotal = new double[nt][nw];

        double[] modRe = new double[nt];
        double[] modIm = new double[nt];
        for (int k = 0; k < nw; k++) {
            double[][] ax = modulateAndConvolve(convolver, h.hx(), t, omega[k], dt, modRe, modIm);
            double[][] ay = modulateAndConvolve(convolver, h.hy(), t, omega[k], dt, modRe, modIm);
            for (int j = 0; j < nt; j++) {
                double mx2 = ax[0][j] * ax[0][j] + ax[1][j] * ax[1][j];
                double my2 = ay[0][j] * ay[0][j] + ay[1][j] * ay[1][j];
                logX[j][k] = NumericUtils.floorLog10(Math.sqrt(mx2));
                logY[j][k] = NumericUtils.floorLog10(Math.sqrt(my2));
                logTotal[j][k] = NumericUtils.floorLog10(Math.sqrt(mx2 + my2));
            }
        }

        double[] energy = new double[nw];
        for (int k = 0; k < nw; k++) {
            energy[k] = omega[k] * PhysicalConstants.HARTREE_EV;
        }
        return new TimeFrequencyMap(field, t, omega, energy, logX, logY, logTotal, sigma, gFactor, unstable);
    }

    /**
     * Samples {@code exp(-τ²/2σ²)} at {@code τ = k·dt}, {@code |k| ≤ ceil(6σ/dt)}.
     */
    static double[] gaussianKernel(double sigma, double dt) {
        int half = (int) Math.ceil(KERNEL_HALF_WIDTH_SIGMAS * sigma / dt);
        double[] kernel = new double[2 * half + 1];
        for (int k = -half; k <= half; k++) {
            double tau = k * dt;
            kernel[k + half] = Math.exp(-0.5 * tau * tau / (sigma * sigma));
        }
        return kernel;
    }

    private static double[][] modulateAndConvolve(FftConvolver convolver, double[] signal, double[] t, double w,
                                                  double dt, double[] re, double[] im) {
        for (int j = 0; j < t.length; j++) {
            double phase = -w * t[j];
            re[j] = signal[j] * Math.cos(phase);
            im[j] = signal[j] * Math.sin(phase);
        }
        return convolver.convolveSame(re, im, dt);
    }

    public double unstableFactor() {
        return unstableFactor;
    }
}
