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
 * Raised when a metric is requested over harmonic orders the computed grid does not cover.
 */
public class SubBandOutOfRangeException extends NumericPreconditionException {

    private final double requestedFrom;
    private final double requestedTo;

    public SubBandOutOfRangeException(double requestedFrom, double requestedTo, double gridFrom, double gridTo) {
        super(String.format("sub-band [%.4f, %.4f] exceeds computed grid [%.4f, %.4f]",
                requestedFrom, requestedTo, gridFrom, gridTo));
        this.requestedFrom = requestedFrom;
        this.requestedTo = requestedTo;
    }

    public double requestedFrom() {
        return requestedFrom;
    }

    public double requestedTo() {
        return requestedTo;
    }
}
