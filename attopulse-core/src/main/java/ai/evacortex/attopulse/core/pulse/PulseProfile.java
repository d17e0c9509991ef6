/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.pulse;

import ai.evacortex.attopulse.core.math.NumericUtils;
import ai.evacortex.attopulse.core.spectrum.DrivingField;

/**
 * Reconstructed intensities over the original time samples.
 */
public record PulseProfile(DrivingField field,
                           double qStart,
                           double qEnd,
                           double[] t,
                           double[] intensityX,
                           double[] intensityY,
                           double[] intensity) {

    public double[] timeOpticalCycles() {
        return field.toOpticalCycles(t);
    }

    public double maxX() {
        return NumericUtils.max(intensityX);
    }

    public double maxY() {
        return NumericUtils.max(intensityY);
    }

    public double max() {
        return NumericUtils.max(intensity);
    }

    public int peakIndex() {
        return NumericUtils.argmax(intensity);
    }

    public double peakTime() {
        return t[peakIndex()];
    }

    public PulseWidth width() {
        return FwhmExtractor.extract(intensity, timeOpticalCycles(), field.period());
    }

    public PulseWidth widthX() {
        return FwhmExtractor.extract(intensityX, timeOpticalCycles(), field.period());
    }

    public PulseWidth widthY() {
        return FwhmExtractor.extract(intensityY, timeOpticalCycles(), field.period());
    }
}
