/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.metrics;

/**
 * Integrated linear harmonic spectrum over {@code [qFrom, qTo]}, per axis and for {@code Dx + Dy}.
 */
public record HarmonicYield(double qFrom, double qTo, double x, double y, double total) {}
