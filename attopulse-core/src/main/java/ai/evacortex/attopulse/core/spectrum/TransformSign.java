/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.spectrum;

/**
 * Sign of the exponent in {@code D(ω) = ∫ s(t)·e^{±iωt} dt}.
 */
public enum TransformSign {
    /** {@code e^{+iωt}}: harmonic spectra, yield, phase and ellipticity. */
    POSITIVE(1.0),
    /** {@code e^{-iωt}}: forward half of the pulse reconstruction. */
    NEGATIVE(-1.0);

    private final double factor;

    TransformSign(double factor) {
        this.factor = factor;
    }

    public double factor() {
        return factor;
    }
}
