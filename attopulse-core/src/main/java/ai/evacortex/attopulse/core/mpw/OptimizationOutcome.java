/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core.mpw;

import ai.evacortex.attopulse.core.exceptions.ComputationException;

import java.util.Objects;

/**
 * Terminal event of an {@link MpwRun}. Exactly one outcome is delivered per run.
 */
public sealed interface OptimizationOutcome
        permits OptimizationOutcome.Completed, OptimizationOutcome.Failed, OptimizationOutcome.Cancelled {

    OptimizerState state();

    record Completed(OptimizationResult result) implements OptimizationOutcome {
        public Completed {
            Objects.requireNonNull(result, "result must not be null");
        }

        @Override
        public OptimizerState state() {
            return OptimizerState.COMPLETED;
        }
    }

    record Failed(ComputationException error) implements OptimizationOutcome {
        public Failed {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public OptimizerState state() {
            return OptimizerState.FAILED;
        }
    }

    /** Stopped on request; no partial result is reported. */
    record Cancelled() implements OptimizationOutcome {
        @Override
        public OptimizerState state() {
            return OptimizerState.CANCELLED;
        }
    }
}
