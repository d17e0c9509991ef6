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
import ai.evacortex.attopulse.core.pulse.PulseReconstructor;
import ai.evacortex.attopulse.core.pulse.PulseWidth;
import ai.evacortex.attopulse.core.spectrum.DrivingField;

import java.util.Objects;

/**
 * Evaluates a sub-band by reconstructing its pulse and measuring the FWHM of the total intensity.
 */
public final class ReconstructionSubBandEvaluator implements SubBandEvaluator {

    private final PulseReconstructor reconstructor;

    public ReconstructionSubBandEvaluator(PulseReconstructor reconstructor) {
        this.reconstructor = Objects.requireNonNull(reconstructor, "reconstructor must not be null");
    }

    @Override
    public SubBandEvaluation evaluate(TimeSeries series, DrivingField field, int qStart, int qEnd) {
        PulseWidth width = reconstructor.reconstructSubBand(series, field, qStart, qEnd).width();
        return new SubBandEvaluation(qStart, qEnd, width.fwhmAttoseconds(), width.peakTimeOc());
    }
}
