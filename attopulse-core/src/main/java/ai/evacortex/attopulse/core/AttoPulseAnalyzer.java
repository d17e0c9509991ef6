/*
 * AttoPulse — Attosecond Spectral Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.attopulse.core;

import ai.evacortex.attopulse.core.filter.ConditionedSignal;
import ai.evacortex.attopulse.core.filter.SignalConditioner;
import ai.evacortex.attopulse.core.gabor.TimeFrequencyAnalyzer;
import ai.evacortex.attopulse.core.gabor.TimeFrequencyMap;
import ai.evacortex.attopulse.core.metrics.EllipticitySpectrum;
import ai.evacortex.attopulse.core.metrics.HarmonicYield;
import ai.evacortex.attopulse.core.metrics.PhaseSpectrum;
import ai.evacortex.attopulse.core.metrics.SpectralMetrics;
import ai.evacortex.attopulse.core.mpw.MpwRun;
import ai.evacortex.attopulse.core.mpw.PulseWidthOptimizer;
import ai.evacortex.attopulse.core.mpw.ReconstructionSubBandEvaluator;
import ai.evacortex.attopulse.core.pulse.PulseProfile;
import ai.evacortex.attopulse.core.pulse.PulseReconstructor;
import ai.evacortex.attopulse.core.spectrum.DrivingField;
import ai.evacortex.attopulse.core.spectrum.FrequencyGrid;
import ai.evacortex.attopulse.core.spectrum.QuadratureTransformer;
import ai.evacortex.attopulse.core.spectrum.SpectralAmplitude;
import ai.evacortex.attopulse.core.spectrum.SpectralTransformer;
import ai.evacortex.attopulse.core.spectrum.TransformOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point of the analysis pipeline. Every operation is synchronous except
 * {@link #findMinimumPulseWidth}, which returns a running search.
 *
 * <p>Holds no per-request state; a single instance may serve concurrent callers.</p>
 */
public final class AttoPulseAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(AttoPulseAnalyzer.class);

    private final AttoPulseSettings settings;
    private final SpectralTransformer transformer;
    private final SignalConditioner conditioner;
    private final PulseReconstructor reconstructor;
    private final TimeFrequencyAnalyzer timeFrequency;
    private final PulseWidthOptimizer optimizer;

    public AttoPulseAnalyzer() {
        this(AttoPulseSettings.fromSystemProperties());
    }

    public AttoPulseAnalyzer(AttoPulseSettings settings) {
        this(settings, new QuadratureTransformer());
    }

    public AttoPulseAnalyzer(AttoPulseSettings settings, SpectralTransformer transformer) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.transformer = Objects.requireNonNull(transformer, "transformer must not be null");
        this.conditioner = new SignalConditioner();
        this.reconstructor = new PulseReconstructor(transformer, conditioner,
                settings.pulseOrderStep(), settings.mpwOrderStep());
        this.timeFrequency = new TimeFrequencyAnalyzer(conditioner, settings.gaborUnstableFactor());
        this.optimizer = new PulseWidthOptimizer(new ReconstructionSubBandEvaluator(reconstructor),
                settings.mpwWorkers());
    }

    /**
     * Complex spectral amplitudes of the windowed current on {@code [qStart·ω0, qEnd·ω0]} at the
     * configured absolute step.
     */
    public SpectralAmplitude spectrum(TimeSeries series, AnalysisRequest request) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(request, "request must not be null");
        FrequencyGrid grid = FrequencyGrid.absolute(request.field(), request.qStart(), request.qEnd(),
                settings.spectrumStep());
        ConditionedSignal h = conditioner.apply(series, request.filter());
        log.debug("Spectrum over [{}, {}]: {} frequencies x {} samples, derivative={}",
                request.qStart(), request.qEnd(), grid.size(), series.size(), request.derivative());
        return transformer.transform(h.t(), h.hx(), h.hy(), grid, TransformOptions.spectrum(request.derivative()));
    }

    public HarmonicYield harmonicYield(TimeSeries series, AnalysisRequest request) {
        return harmonicYield(series, request, request.qStart(), request.qEnd());
    }

    /**
     * Yield over {@code [qFrom, qTo]}, which must lie inside the request band.
     */
    public HarmonicYield harmonicYield(TimeSeries series, AnalysisRequest request, double qFrom, double qTo) {
        Objects.requireNonNull(request, "request must not be null");
        double tol = Math.max(settings.spectrumStep() / request.field().omega0() / 2.0, 1e-9);
        SpectralMetrics.requireSubBand(qFrom, qTo, request.qStart(), request.qEnd(), tol);
        return SpectralMetrics.yield(spectrum(series, request), qFrom, qTo);
    }

    public EllipticitySpectrum ellipticity(TimeSeries series, AnalysisRequest request) {
        return SpectralMetrics.ellipticity(spectrum(series, request), request.qStart(), request.qEnd());
    }

    public PhaseSpectrum phase(TimeSeries series, AnalysisRequest request) {
        return SpectralMetrics.phase(spectrum(series, request), request.qStart(), request.qEnd());
    }

    public PulseProfile attosecondPulse(TimeSeries series, AnalysisRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        return reconstructor.reconstruct(series, request.field(), request.qStart(), request.qEnd(),
                request.filter(), request.method());
    }

    public TimeFrequencyMap timeFrequency(TimeSeries series, AnalysisRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        return timeFrequency.analyze(series, request.field(), request.qStart(), request.qEnd(),
                request.gFactor(), request.filter());
    }

    /**
     * Starts the minimum-pulse-width search over every integer sub-band of {@code [qStart, qMax]}.
     */
    public MpwRun findMinimumPulseWidth(TimeSeries series, double lambdaNm, int qStart, int qMax) {
        return optimizer.start(series, lambdaNm, qStart, qMax);
    }

    public DriveSummary summary(TimeSeries series, double lambdaNm) {
        Objects.requireNonNull(series, "series must not be null");
        return DriveSummary.of(new DrivingField(lambdaNm), series);
    }

    public AttoPulseSettings settings() {
        return settings;
    }
}
