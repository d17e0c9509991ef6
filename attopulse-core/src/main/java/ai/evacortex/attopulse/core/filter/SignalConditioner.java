/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.filter;

import ai.evacortex.attopulse.core.TimeSeries;
import ai.evacortex.attopulse.core.exceptions.InputValidationException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Applies an end-of-pulse taper to a current and, optionally, to its precomputed derivative.
 *
 * <p>Samples before {@code ii = floor(EoP·N)} are left untouched. The derivative arrays receive the
 * same multiplier as the signal; they are not re-derived from the windowed signal.</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
public final class SignalConditioner {

    public ConditionedSignal apply(TimeSeries series, FilterConfig config) {
        Objects.requireNonNull(series, "series must not be null");
        double[] w = window(series.t(), config);
        return new ConditionedSignal(series.t(), multiply(series.jx(), w), multiply(series.jy(), w), null, null);
    }

    public ConditionedSignal apply(TimeSeries series, double[] djx, double[] djy, FilterConfig config) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(djx, "djx must not be null");
        Objects.requireNonNull(djy, "djy must not be null");
        if (djx.length != series.size() || djy.length != series.size()) {
            throw new InputValidationException("derivative length mismatch: expected " + series.size());
        }
        double[] w = window(series.t(), config);
        return new ConditionedSignal(series.t(),
                multiply(series.jx(), w), multiply(series.jy(), w),
                multiply(djx, w), multiply(djy, w));
    }

    /**
     * Per-sample multiplier for the given time axis; 1 everywhere before the taper start.
     */
    public double[] window(double[] t, FilterConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        int n = t.length;
        double[] w = new double[n];
        Arrays.fill(w, 1.0);

        int ii = config.taperStart(n);
        if (ii >= n || config.method() == WindowMethod.NONE) {
            return w;
        }

        int tail = n - ii;
        double t0 = t[ii];
        double span = t[n - 1] - t0;
        double p = config.param();

        for (int j = 0; j < tail; j++) {
            int i = ii + j;
            w[i] = switch (config.method()) {
                case COSINE -> span > 0.0
                        ? Math.pow(Math.cos(0.5 * Math.PI * (t[i] - t0) / span), p)
                        : 1.0;
                case GAUSSIAN -> Math.exp(-((t[i] - t0) * (t[i] - t0)) / (2.0 * p * p));
                case EXPONENTIAL_DECAY -> Math.exp(-p * (t[i] - t0));
                case HANNING -> 0.5 * (1.0 - Math.cos((2.0 * Math.PI * j) / tail));
                case WELCH -> {
                    if (tail == 1) yield 1.0;
                    double half = (tail - 1) / 2.0;
                    double x = (j - half) / half;
                    yield 1.0 - x * x;
                }
                case BARTLETT -> 1.0 - Math.abs((j - 0.5 * tail) / (0.5 * tail));
                case NONE -> 1.0;
            };
        }
        return w;
    }

    private static double[] multiply(double[] values, double[] w) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] * w[i];
        }
        return out;
    }
}
