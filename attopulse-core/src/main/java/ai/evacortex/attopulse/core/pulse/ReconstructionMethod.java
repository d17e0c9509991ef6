/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.pulse;

import ai.evacortex.attopulse.core.exceptions.NumericPreconditionException;

/**
 * Attosecond pulse reconstruction conventions. Both end with
 * {@code Ix = |Ix|², Iy = |Iy|², I = |Ix + Iy|²}; they differ only in what is forward-transformed.
 */
public enum ReconstructionMethod {
    /** Forward transform of the windowed current itself. */
    METHOD_1(1),
    /** Forward transform of the windowed current derivative, each component weighted by its own ω. */
    METHOD_2(2);

    private final int number;

    ReconstructionMethod(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }

    public static ReconstructionMethod fromNumber(int number) {
        for (ReconstructionMethod m : values()) {
            if (m.number == number) return m;
        }
        throw new NumericPreconditionException("reconstruction method must be 1 or 2, got " + number);
    }
}
