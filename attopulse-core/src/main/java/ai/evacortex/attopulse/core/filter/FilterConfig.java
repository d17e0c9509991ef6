/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.filter;

import ai.evacortex.attopulse.core.exceptions.NumericPreconditionException;

import java.util.Objects;

/**
 * Window selection for {@link SignalConditioner}.
 *
 * @param method window method
 * @param endOfPulse fraction of the time window left untouched, in [0, 1]
 * @param param exponent (cosine), sigma (Gaussian) or decay rate (exponential decay); ignored otherwise
 */
public record FilterConfig(WindowMethod method, double endOfPulse, double param) {

    public FilterConfig {
        Objects.requireNonNull(method, "method must not be null");
        if (!(endOfPulse >= 0.0 && endOfPulse <= 1.0)) {
            throw new NumericPreconditionException("EoP must be within [0, 1], got " + endOfPulse);
        }
        if (method.isParameterized() && !Double.isFinite(param)) {
            throw new NumericPreconditionException(method + " parameter must be finite, got " + param);
        }
        switch (method) {
            case COSINE -> {
                if (param < 0.0) throw new NumericPreconditionException("cosine exponent must be >= 0, got " + param);
            }
            case GAUSSIAN -> {
                if (param <= 0.0) throw new NumericPreconditionException("Gaussian sigma must be > 0, got " + param);
            }
            case EXPONENTIAL_DECAY -> {
                if (param < 0.0) throw new NumericPreconditionException("decay rate must be >= 0, got " + param);
            }
            default -> {
            }
        }
    }

    public static FilterConfig none() {
        return new FilterConfig(WindowMethod.NONE, 1.0, 0.0);
    }

    public static FilterConfig cosine(double endOfPulse, double exponent) {
        return new FilterConfig(WindowMethod.COSINE, endOfPulse, exponent);
    }

    public static FilterConfig gaussian(double endOfPulse, double sigma) {
        return new FilterConfig(WindowMethod.GAUSSIAN, endOfPulse, sigma);
    }

    public static FilterConfig exponentialDecay(double endOfPulse, double decayRate) {
        return new FilterConfig(WindowMethod.EXPONENTIAL_DECAY, endOfPulse, decayRate);
    }

    public static FilterConfig hanning(double endOfPulse) {
        return new FilterConfig(WindowMethod.HANNING, endOfPulse, 0.0);
    }

    public static FilterConfig welch(double endOfPulse) {
        return new FilterConfig(WindowMethod.WELCH, endOfPulse, 0.0);
    }

    public static FilterConfig bartlett(double endOfPulse) {
        return new FilterConfig(WindowMethod.BARTLETT, endOfPulse, 0.0);
    }

    /**
     * Builds a config from the "filtering percent" input, where {@code EoP = 1 - percent/100}.
     */
    public static FilterConfig fromFilteringPercent(WindowMethod method, double percent, double param) {
        if (!(percent >= 0.0 && percent <= 100.0)) {
            throw new NumericPreconditionException("filtering percent must be within [0, 100], got " + percent);
        }
        return new FilterConfig(method, 1.0 - percent / 100.0, param);
    }

    /**
     * Index of the first tapered sample for a series of {@code n} samples.
     */
    public int taperStart(int n) {
        return (int) Math.floor(endOfPulse * n);
    }
}
