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
 * Windowed current components and, when supplied, their windowed derivatives.
 * {@code dhx}/{@code dhy} are {@code null} if no derivative was passed in.
 */
public record ConditionedSignal(double[] t, double[] hx, double[] hy, double[] dhx, double[] dhy) {

    public boolean hasDerivative() {
        return dhx != null && dhy != null;
    }
}
