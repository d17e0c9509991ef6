/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core;

import ai.evacortex.attopulse.core.exceptions.NumericPreconditionException;
import ai.evacortex.attopulse.core.filter.FilterConfig;
import ai.evacortex.attopulse.core.pulse.ReconstructionMethod;
import ai.evacortex.attopulse.core.spectrum.DrivingField;
import ai.evacortex.attopulse.core.spectrum.FrequencyGrid;

import java.util.Objects;

/**
 * Per-call analysis configuration. Validated on construction.
 *
 * @param filter      end-of-pulse window
 * @param lambdaNm    driving wavelength in nm, within (0, 10000]
 * @param qStart      lower harmonic order, positive
 * @param qEnd        upper harmonic order, greater than {@code qStart}
 * @param derivative  analyse the time derivative of the current (acceleration form)
 * @param gFactor     Gabor window factor, {@code σ = T/g}
 * @param method      pulse reconstruction method
 */
public record AnalysisRequest(FilterConfig filter,
                              double lambdaNm,
                              double qStart,
                              double qEnd,
                              boolean derivative,
                              double gFactor,
                              ReconstructionMethod method) {

    public static final double DEFAULT_G_FACTOR = 1.0;

    public AnalysisRequest {
        Objects.requireNonNull(filter, "filter must not be null");
        Objects.requireNonNull(method, "method must not be null");
        new DrivingField(lambdaNm);
        FrequencyGrid.checkBand(qStart, qEnd);
        if (!(gFactor > 0.0) || !Double.isFinite(gFactor)) {
            throw new NumericPreconditionException("g factor must be positive, got " + gFactor);
        }
    }

    /**
     * Unfiltered request in acceleration form, reconstructed with method 2.
     */
    public static AnalysisRequest of(double lambdaNm, double qStart, double qEnd) {
        return new AnalysisRequest(FilterConfig.none(), lambdaNm, qStart, qEnd, true, DEFAULT_G_FACTOR,
                ReconstructionMethod.METHOD_2);
    }

    public DrivingField field() {
        return new DrivingField(lambdaNm);
    }

    public AnalysisRequest withFilter(FilterConfig filter) {
        return new AnalysisRequest(filter, lambdaNm, qStart, qEnd, derivative, gFactor, method);
    }

    public AnalysisRequest withBand(double qStart, double qEnd) {
        return new AnalysisRequest(filter, lambdaNm, qStart, qEnd, derivative, gFactor, method);
    }

    public AnalysisRequest withDerivative(boolean derivative) {
        return new AnalysisRequest(filter, lambdaNm, qStart, qEnd, derivative, gFactor, method);
    }

    public AnalysisRequest withGFactor(double gFactor) {
        return new AnalysisRequest(filter, lambdaNm, qStart, qEnd, derivative, gFactor, method);
    }

    public AnalysisRequest withMethod(ReconstructionMethod method) {
        return new AnalysisRequest(filter, lambdaNm, qStart, qEnd, derivative, gFactor, method);
    }
}
