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
import ai.evacortex.attopulse.core.exceptions.ComputationException;
import ai.evacortex.attopulse.core.exceptions.OptimizationCancelledException;
import ai.evacortex.attopulse.core.spectrum.DrivingField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A single minimum-pulse-width search.
 *
 * <p>The run owns a dedicated orchestration thread and a fixed worker pool, both created when the
 * run starts and torn down when it ends. State moves {@code IDLE → RUNNING} once and then to exactly
 * one terminal state; the matching {@link OptimizationOutcome} completes {@link #outcome()}.</p>
 */
public final class MpwRun {

    private static final Logger log = LoggerFactory.getLogger(MpwRun.class);
    private static final AtomicInteger RUN_IDS = new AtomicInteger();

    static final Comparator<SubBandEvaluation> NARROWEST_FIRST = Comparator
            .comparingDouble(SubBandEvaluation::fwhmAttoseconds)
            .thenComparingInt(SubBandEvaluation::qStart)
            .thenComparingInt(SubBandEvaluation::qEnd);

    private final int id = RUN_IDS.incrementAndGet();
    private final SubBandEvaluator evaluator;
    private final TimeSeries series;
    private final DrivingField field;
    private final List<int[]> candidates;
    private final int workers;

    private final AtomicReference<OptimizerState> state = new AtomicReference<>(OptimizerState.IDLE);
    private final CompletableFuture<OptimizationOutcome> outcome = new CompletableFuture<>();
    private final AtomicInteger completed = new AtomicInteger();

    private volatile ExecutorService pool;
    private volatile Thread orchestrator;

    MpwRun(SubBandEvaluator evaluator, TimeSeries series, DrivingField field, List<int[]> candidates, int workers) {
        this.evaluator = evaluator;
        this.series = series;
        this.field = field;
        this.candidates = List.copyOf(candidates);
        this.workers = workers;
    }

    void start() {
        if (!state.compareAndSet(OptimizerState.IDLE, OptimizerState.RUNNING)) {
            throw new IllegalStateException("MPW run #" + id + " already started");
        }
        AtomicInteger workerIds = new AtomicInteger();
        pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "attopulse-mpw-" + id + "-worker-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        Thread thread = new Thread(this::orchestrate, "attopulse-mpw-" + id);
        thread.setDaemon(true);
        orchestrator = thread;
        log.info("MPW run #{} started: {} sub-bands on {} workers", id, candidates.size(), workers);
        thread.start();
    }

    private void orchestrate() {
        ExecutorCompletionService<SubBandEvaluation> completion = new ExecutorCompletionService<>(pool);
        List<Future<SubBandEvaluation>> futures = new ArrayList<>(candidates.size());
        try {
            for (int[] band : candidates) {
                futures.add(completion.submit(() -> evaluate(band[0], band[1])));
            }

            SubBandEvaluation best = null;
            for (int i = 0; i < futures.size(); i++) {
                SubBandEvaluation eval = completion.take().get();
                if (best == null || NARROWEST_FIRST.compare(eval, best) < 0) {
                    best = eval;
                }
            }
            complete(best);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            markCancelled();
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof OptimizationCancelledException || state.get() == OptimizerState.CANCELLED) {
                markCancelled();
            } else if (cause instanceof ComputationException ce) {
                fail(ce);
            } else {
                fail(new ComputationException("sub-band evaluation raised " + cause, cause));
            }
        } catch (RejectedExecutionException | CancellationException e) {
            markCancelled();
        } catch (RuntimeException e) {
            futures.forEach(f -> f.cancel(true));
            fail(new ComputationException("orchestration of MPW run #" + id, e));
        } finally {
            shutdownPool();
        }
    }

    private SubBandEvaluation evaluate(int a, int b) {
        SubBandEvaluation eval;
        try {
            eval = evaluator.evaluate(series, field, a, b);
        } catch (OptimizationCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ComputationException("sub-band [" + a + ", " + b + "]", a, b, e);
        }
        if (eval == null) {
            throw new ComputationException("evaluator returned no result for sub-band [" + a + ", " + b + "]", a, b, null);
        }
        completed.incrementAndGet();
        return eval;
    }

    private void complete(SubBandEvaluation best) {
        double maxOc = field.toOpticalCycles(series.endTime());
        OptimizationResult result = new OptimizationResult(best.qStart(), best.qEnd(), best.fwhmAttoseconds(),
                best.peakTimeOc(), maxOc - 1.0, maxOc);
        if (state.compareAndSet(OptimizerState.RUNNING, OptimizerState.COMPLETED)) {
            log.info("MPW run #{} completed: narrowest pulse {} as in [{}, {}]",
                    id, result.fwhmAttoseconds(), result.qStart(), result.qMax());
            outcome.complete(new OptimizationOutcome.Completed(result));
        }
    }

    private void fail(ComputationException error) {
        if (state.compareAndSet(OptimizerState.RUNNING, OptimizerState.FAILED)) {
            log.warn("MPW run #{} failed: {}", id, error.getMessage(), error);
            outcome.complete(new OptimizationOutcome.Failed(error));
        }
    }

    private boolean markCancelled() {
        if (state.compareAndSet(OptimizerState.RUNNING, OptimizerState.CANCELLED)) {
            log.info("MPW run #{} cancelled after {}/{} evaluations", id, completed.get(), candidates.size());
            outcome.complete(new OptimizationOutcome.Cancelled());
            return true;
        }
        return false;
    }

    /**
     * Stops the run and waits for the orchestration thread and every worker to exit. Has no effect on
     * a run that already reached a terminal state; repeated calls are no-ops.
     */
    public void cancel() {
        if (markCancelled()) {
            ExecutorService p = pool;
            if (p != null) p.shutdownNow();
            Thread t = orchestrator;
            if (t != null) t.interrupt();
        }
        awaitTermination();
    }

    private void awaitTermination() {
        Thread t = orchestrator;
        if (t == null || t == Thread.currentThread()) return;
        try {
            t.join();
            ExecutorService p = pool;
            if (p != null) p.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void shutdownPool() {
        ExecutorService p = pool;
        p.shutdownNow();
        try {
            if (!p.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("MPW run #{}: workers did not stop within 30s", id);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public CompletableFuture<OptimizationOutcome> outcome() {
        return outcome;
    }

    public OptimizerState state() {
        return state.get();
    }

    public int completedEvaluations() {
        return completed.get();
    }

    public int totalEvaluations() {
        return candidates.size();
    }

    public int id() {
        return id;
    }
}
