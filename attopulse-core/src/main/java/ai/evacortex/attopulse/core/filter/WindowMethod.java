/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.filter;

/**
 * End-of-pulse tapers applied to the tail of a current before transforming it.
 */
public enum WindowMethod {
    NONE,
    /** {@code cos(0.5π·(t - t_ii)/(t_end - t_ii))^exponent} */
    COSINE,
    /** {@code exp(-(t - t_ii)²/(2σ²))} */
    GAUSSIAN,
    /** {@code exp(-rate·(t - t_ii))} */
    EXPONENTIAL_DECAY,
    HANNING,
    WELCH,
    BARTLETT;

    /**
     * Whether the method reads {@link FilterConfig#param()}.
     */
    public boolean isParameterized() {
        return this == COSINE || this == GAUSSIAN || this == EXPONENTIAL_DECAY;
    }
}
