/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.spectrum;

import java.util.Objects;

/**
 * Options for a forward quadrature transform.
 */
public record TransformOptions(
        boolean derivative,     // centered finite difference of the signal before transforming
        TransformSign sign,     // sign of the exponent
        boolean weightByOmega   // multiply every D(ω) by ω
) {
    public TransformOptions {
        Objects.requireNonNull(sign, "sign must not be null");
    }

    public static TransformOptions spectrum(boolean derivative) {
        return new TransformOptions(derivative, TransformSign.POSITIVE, false);
    }

    public static TransformOptions pulse(boolean weightByOmega) {
        return new TransformOptions(false, TransformSign.NEGATIVE, weightByOmega);
    }
}
