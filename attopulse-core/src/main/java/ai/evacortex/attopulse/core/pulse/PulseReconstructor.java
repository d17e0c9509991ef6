/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.pulse;

import ai.evacortex.attopulse.core.TimeSeries;
import ai.evacortex.attopulse.core.exceptions.NumericPreconditionException;
import ai.evacortex.attopulse.core.filter.ConditionedSignal;
import ai.evacortex.attopulse.core.filter.FilterConfig;
import ai.evacortex.attopulse.core.filter.SignalConditioner;
import ai.evacortex.attopulse.core.math.Complex;
import ai.evacortex.attopulse.core.math.NumericUtils;
import ai.evacortex.attopulse.core.spectrum.DrivingField;
import ai.evacortex.attopulse.core.spectrum.FrequencyGrid;
import ai.evacortex.attopulse.core.spectrum.QuadratureTransformer;
import ai.evacortex.attopulse.core.spectrum.SpectralTransformer;
import ai.evacortex.attopulse.core.spectrum.TransformOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Reconstructs attosecond pulse intensity profiles by a forward quadrature transform over a harmonic
 * band followed by an inverse quadrature back onto the original time samples.
 *
 * <p>Stateless apart from its collaborators; safe to share between threads.</p>
 */
public final class PulseReconstructor {

    private static final Logger log = LoggerFactory.getLogger(PulseReconstructor.class);

    public static final double DEFAULT_ORDER_STEP = 0.01;
    public static final double DEFAULT_SUB_BAND_ORDER_STEP = 0.1;

    private final SpectralTransformer transformer;
    private final SignalConditioner conditioner;
    private final double orderStep;
    private final double subBandOrderStep;

    public PulseReconstructor() {
        this(new QuadratureTransformer(), new SignalConditioner(), DEFAULT_ORDER_STEP, DEFAULT_SUB_BAND_ORDER_STEP);
    }

    public PulseReconstructor(SpectralTransformer transformer, SignalConditioner conditioner,
                              double orderStep, double subBandOrderStep) {
        this.transformer = Objects.requireNonNull(transformer, "transformer must not be null");
        this.conditioner = Objects.requireNonNull(conditioner, "conditioner must not be null");
        if (!(orderStep > 0.0) || !(subBandOrderStep > 0.0)) {
            throw new NumericPreconditionException("order steps must be positive, got "
                    + orderStep + " / " + subBandOrderStep);
        }
        this.orderStep = orderStep;
        this.subBandOrderStep = subBandOrderStep;
    }

    /**
     * Reconstructs the pulse emitted in {@code [qStart, qEnd]}.
     *
     * @param series offset-removed current
     */
    public PulseProfile reconstruct(TimeSeries series, DrivingField field, double qStart, double qEnd,
                                    FilterConfig filter, ReconstructionMethod method) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(filter, "filter must not be null");
        Objects.requireNonNull(method, "method must not be null");
        FrequencyGrid grid = FrequencyGrid.harmonic(field, qStart, qEnd, orderStep);

        double[] djx = NumericUtils.subtractFirst(series.derivativeX());
        double[] djy = NumericUtils.subtractFirst(series.derivativeY());
        ConditionedSignal h = conditioner.apply(series, djx, djy, filter);

        log.debug("Reconstructing {} over [{}, {}]: {} frequencies x {} samples",
                method, qStart, qEnd, grid.size(), series.size());

        return switch (method) {
            case METHOD_1 -> invert(field, qStart, qEnd, series.t(), grid,
                    h.hx(), h.hy(), TransformOptions.pulse(false));
            case METHOD_2 -> invert(field, qStart, qEnd, series.t(), grid,
                    h.dhx(), h.dhy(), TransformOptions.pulse(true));
        };
    }

    /**
     * Reconstruction used as the scalar evaluator of the minimum-pulse-width search: the unwindowed
     * current, {@code ω}-weighted, on an integer sub-band at the coarse order step.
     */
    public PulseProfile reconstructSubBand(TimeSeries series, DrivingField field, double qStart, double qEnd) {
        Objects.requireNonNull(series, "series must not be null");
        FrequencyGrid grid = FrequencyGrid.harmonic(field, qStart, qEnd, subBandOrderStep);
        return invert(field, qStart, qEnd, series.t(), grid, series.jx(), series.jy(), TransformOptions.pulse(true));
    }

    private PulseProfile invert(DrivingField field, double qStart, double qEnd, double[] t, FrequencyGrid grid,
                                double[] sx, double[] sy, TransformOptions options) {
        double[] omega = grid.omega();
        Complex[] ax = transformer.transform(t, sx, omega, options);
        Complex[] ay = transformer.transform(t, sy, omega, options);

        Complex[] fx = transformer.inverse(omega, ax, t);
        Complex[] fy = transformer.inverse(omega, ay, t);

        int n = t.length;
        double[] ix = new double[n];
        double[] iy = new double[n];
        double[] total = new double[n];
        for (int j = 0; j < n; j++) {
            ix[j] = fx[j].absSquared();
            iy[j] = fy[j].absSquared();
            double sum = ix[j] + iy[j];
            total[j] = sum * sum;
        }
        return new PulseProfile(field, qStart, qEnd, t, ix, iy, total);
    }

    public double orderStep() {
        return orderStep;
    }

    public double subBandOrderStep() {
        return subBandOrderStep;
    }
}
