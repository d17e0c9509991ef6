/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.exceptions;

/**
 * Unexpected failure inside a parallel sub-band evaluation.
 */
public class ComputationException extends RuntimeException {

    private final int subBandStart;
    private final int subBandEnd;

    public ComputationException(String message, Throwable cause) {
        this(message, -1, -1, cause);
    }

    public ComputationException(String message, int subBandStart, int subBandEnd, Throwable cause) {
        super("Computation failed: " + message, cause);
        this.subBandStart = subBandStart;
        this.subBandEnd = subBandEnd;
    }

    /** First harmonic order of the failing sub-band, or -1 if unknown. */
    public int subBandStart() {
        return subBandStart;
    }

    public int subBandEnd() {
        return subBandEnd;
    }
}
