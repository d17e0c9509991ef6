/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.io;

import ai.evacortex.attopulse.core.DriveSummary;
import ai.evacortex.attopulse.core.mpw.OptimizationResult;
import ai.evacortex.attopulse.core.pulse.PulseWidth;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON run summary. Sections that were not computed are left out of the file.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisSummary(String inputFingerprint,
                              DriveSummary drive,
                              PulseWidth pulseWidth,
                              OptimizationResult minimumPulseWidth) {
}
