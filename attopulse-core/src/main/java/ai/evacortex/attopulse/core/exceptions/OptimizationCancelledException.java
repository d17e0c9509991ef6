/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.exceptions;

public class OptimizationCancelledException extends RuntimeException {
    public OptimizationCancelledException(String message) {
        super("Optimization cancelled: " + message);
    }
}
