/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.mpw;

import ai.evacortex.attopulse.core.TimeSeries;
import ai.evacortex.attopulse.core.spectrum.DrivingField;

/**
 * Pure scalar evaluator invoked once per candidate sub-band of a minimum-pulse-width search.
 *
 * <p>Implementations are called concurrently from several worker threads and must not keep
 * mutable state. Long-running implementations should poll {@link Thread#isInterrupted()} and
 * abort with {@link ai.evacortex.attopulse.core.exceptions.OptimizationCancelledException}.</p>
 */
@FunctionalInterface
public interface SubBandEvaluator {

    SubBandEvaluation evaluate(TimeSeries series, DrivingField field, int qStart, int qEnd);
}
