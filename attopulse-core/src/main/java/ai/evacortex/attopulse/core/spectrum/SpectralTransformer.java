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

/**
 * {@code SpectralTransformer} maps a sampled current onto an arbitrary angular-frequency grid by direct
 * numerical quadrature:
 *
 * <pre>
 *     D(ω_i) = ∫ s(t) · e^{±iω_i t} dt
 * </pre>
 *
 * <p>The integral runs over the entire captured time window with the trapezoidal rule, so the grid may be
 * fractional in harmonic order and independent of the sample count. The cost is {@code O(N_t · N_ω)}.</p>
 *
 * <p>The inverse maps amplitudes on a frequency grid back onto arbitrary time samples:</p>
 *
 * <pre>
 *     I(t_j) = ∫ A(ω) · e^{+iωt_j} dω
 * </pre>
 *
 * <p>Implementations must be deterministic and free of side effects. They check the calling thread's
 * interrupt flag once per outer iteration and abort with
 * {@link ai.evacortex.attopulse.core.exceptions.OptimizationCancelledException} when it is set.</p>
 *
 * @see QuadratureTransformer
 */
public interface SpectralTransformer {

    /**
     * Transforms both current components onto {@code grid}.
     *
     * @param t  uniformly spaced sample times
     * @param sx x component
     * @param sy y component
     * @return amplitudes aligned with {@code grid}
     * @throws IllegalArgumentException if the array lengths differ
     */
    SpectralAmplitude transform(double[] t, double[] sx, double[] sy, FrequencyGrid grid, TransformOptions options);

    /**
     * Transforms a single component onto the angular frequencies {@code omega}.
     */
    Complex[] transform(double[] t, double[] signal, double[] omega, TransformOptions options);

    /**
     * Inverse quadrature of {@code amplitude} over {@code omega}, evaluated at every time in {@code t}.
     */
    Complex[] inverse(double[] omega, Complex[] amplitude, double[] t);
}
