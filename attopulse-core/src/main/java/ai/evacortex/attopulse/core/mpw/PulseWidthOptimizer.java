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
import ai.evacortex.attopulse.core.exceptions.NumericPreconditionException;
import ai.evacortex.attopulse.core.spectrum.DrivingField;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Brute-force search for the integer harmonic sub-band producing the narrowest attosecond pulse.
 *
 * <p>Every pair {@code qStart ≤ a < b ≤ qMax} is evaluated once. The result is the pair with the
 * smallest FWHM; equal widths resolve to the lexicographically smallest {@code (a, b)}, so the
 * outcome does not depend on the pool width or on completion order.</p>
 *
 * <p>Each {@link #start} call creates an independent {@link MpwRun}; nothing is shared between runs.</p>
 */
public final class PulseWidthOptimizer {

    public static final int DEFAULT_WORKERS = 4;

    private final SubBandEvaluator evaluator;
    private final int workers;

    public PulseWidthOptimizer(SubBandEvaluator evaluator) {
        this(evaluator, DEFAULT_WORKERS);
    }

    public PulseWidthOptimizer(SubBandEvaluator evaluator, int workers) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        if (workers < 1) {
            throw new NumericPreconditionException("worker count must be >= 1, got " + workers);
        }
        this.workers = workers;
    }

    /**
     * Validates the request and launches the search in the background.
     *
     * @return the running search; never blocks on the evaluation itself
     * @throws NumericPreconditionException if the wavelength or order bounds are invalid
     */
    public MpwRun start(TimeSeries series, double lambdaNm, int qStart, int qMax) {
        Objects.requireNonNull(series, "series must not be null");
        DrivingField field = new DrivingField(lambdaNm);
        if (qStart <= 0) {
            throw new NumericPreconditionException("qstart must be positive, got " + qStart);
        }
        if (qMax <= qStart) {
            throw new NumericPreconditionException("qmax must be greater than qstart, got [" + qStart + ", " + qMax + "]");
        }

        MpwRun run = new MpwRun(evaluator, series, field, candidates(qStart, qMax), workers);
        run.start();
        return run;
    }

    /**
     * All pairs {@code (a, b)} with {@code qStart ≤ a < b ≤ qMax} in lexicographic order.
     */
    static List<int[]> candidates(int qStart, int qMax) {
        List<int[]> out = new ArrayList<>();
        for (int a = qStart; a < qMax; a++) {
            for (int b = a + 1; b <= qMax; b++) {
                out.add(new int[]{a, b});
            }
        }
        return out;
    }

    public int workers() {
        return workers;
    }
}
