/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.exceptions;

public class InputValidationException extends RuntimeException {
    public InputValidationException(String message) {
        super("Invalid input: " + message);
    }

    public InputValidationException(String message, Throwable cause) {
        super("Invalid input: " + message, cause);
    }
}
