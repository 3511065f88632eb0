package com.identity.reconciliation.dispatch;

import com.identity.reconciliation.core.model.ChangeRow;
import com.identity.reconciliation.logging.LogContext;
import com.identity.reconciliation.metrics.MetricsService;
import com.identity.reconciliation.reconcile.EnrollmentReconciler;
import com.identity.reconciliation.reconcile.IdentityReconciler;
import com.identity.reconciliation.reconcile.ReconcileOutcome;
import com.identity.reconciliation.reconcile.RowReconciler;
import com.identity.reconciliation.reconcile.RunContext;
import com.identity.reconciliation.reconcile.RunStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the identities phase and then the enrollments phase over a bounded pool of workers.
 *
 * <p>At most {@code threads} rows are in flight; a new row is admitted only after an
 * in-flight one has reported back. With a single thread rows run in order on the calling
 * thread. The first hard error stops admission, lets in-flight rows finish, and is
 * rethrown as a {@link PhaseFailedException}.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * RunContext context = RunContext.create(store, options, metrics);
 * RunSummary summary = new Dispatcher(context).run(identityRows, enrollmentRows);
 * </pre>
 */
public class Dispatcher {
    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);
    private static final int PROGRESS_INTERVAL = 100;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final RunContext context;
    private final RowReconciler identityReconciler;
    private final RowReconciler enrollmentReconciler;
    private final ProgressCallback progress;

    private volatile PhaseState state = PhaseState.NOT_STARTED;
    private volatile Phase currentPhase;

    public Dispatcher(RunContext context) {
        this(context, new IdentityReconciler(), new EnrollmentReconciler(), ProgressCallback.NOOP);
    }

    public Dispatcher(RunContext context, ProgressCallback progress) {
        this(context, new IdentityReconciler(), new EnrollmentReconciler(), progress);
    }

    public Dispatcher(RunContext context, RowReconciler identityReconciler,
                      RowReconciler enrollmentReconciler, ProgressCallback progress) {
        this.context = Objects.requireNonNull(context, "context is required");
        this.identityReconciler = Objects.requireNonNull(identityReconciler, "identityReconciler is required");
        this.enrollmentReconciler = Objects.requireNonNull(enrollmentReconciler, "enrollmentReconciler is required");
        this.progress = progress != null ? progress : ProgressCallback.NOOP;
    }

    /**
     * Runs both phases. The enrollments phase starts only after every identity row has
     * completed without a hard error.
     *
     * @throws PhaseFailedException on the first hard error of either phase
     */
    public RunSummary run(List<ChangeRow> identityRows, List<ChangeRow> enrollmentRows) {
        long started = System.nanoTime();
        RunStatistics stats = context.statistics();

        PhaseResult identities = runPhase(Phase.IDENTITIES, identityRows, identityReconciler);
        log.info("Updated {} identities, {} uidentities, {} profiles",
                stats.updatedIdentities(), stats.updatedUidentities(), stats.updatedProfiles());

        context.lockRegistry().reset();

        PhaseResult enrollments = runPhase(Phase.ENROLLMENTS, enrollmentRows, enrollmentReconciler);
        log.info("Updated {} enrollments, {} uidentities, {} profiles",
                stats.updatedEnrollments(), stats.updatedUidentities(), stats.updatedProfiles());

        RunSummary summary = new RunSummary(identities, enrollments,
                stats.updatedIdentities(), stats.updatedEnrollments(),
                stats.updatedUidentities(), stats.updatedProfiles(),
                new ArrayList<>(context.lookupCache().missedOrganizations()),
                new ArrayList<>(context.lookupCache().missedSlugs()),
                context.lookupCache().getStats(),
                Duration.ofNanos(System.nanoTime() - started));
        log.info("run.completed summary={}", summary);
        return summary;
    }

    /**
     * Runs one phase to completion.
     *
     * @throws PhaseFailedException on the first hard error; rows admitted before it still finish
     */
    public PhaseResult runPhase(Phase phase, List<ChangeRow> rows, RowReconciler reconciler) {
        List<ChangeRow> input = rows != null ? rows : List.of();
        int threads = Math.max(1, context.options().getThreads());
        currentPhase = phase;
        state = PhaseState.RUNNING;
        log.info("phase.started phase={} rows={} threads={}", phase.label(), input.size(), threads);

        long started = System.nanoTime();
        Tally tally = new Tally(phase, input.size());
        try {
            if (threads == 1) {
                runSequential(phase, input, reconciler, tally);
            } else {
                runConcurrent(phase, input, reconciler, threads, tally);
            }
        } finally {
            state = PhaseState.DONE;
        }

        if (tally.failure != null) {
            log.error("phase.failed phase={} line={} error={}", phase.label(),
                    tally.failure.row().lineNumber(), tally.failure.error().getMessage());
            throw new PhaseFailedException(phase, tally.failure.row(), tally.failure.error());
        }

        PhaseResult result = new PhaseResult(phase, tally.processed, tally.outcomes,
                Duration.ofNanos(System.nanoTime() - started));
        progress.onProgress(phase, tally.processed, input.size(), true);
        log.info("phase.completed result={}", result);
        return result;
    }

    public PhaseState getState() {
        return state;
    }

    /**
     * The phase currently or most recently run, or null before the first phase.
     */
    public Phase getCurrentPhase() {
        return currentPhase;
    }

    private void runSequential(Phase phase, List<ChangeRow> rows, RowReconciler reconciler, Tally tally) {
        for (ChangeRow row : rows) {
            tally.add(process(phase, reconciler, row));
            if (tally.failure != null) {
                break;
            }
        }
        state = PhaseState.DRAINING;
    }

    private void runConcurrent(Phase phase, List<ChangeRow> rows, RowReconciler reconciler,
                               int threads, Tally tally) {
        ExecutorService executor = Executors.newFixedThreadPool(threads, threadFactory(phase));
        try {
            CompletionService<RowResult> completion = new ExecutorCompletionService<>(executor);
            int inFlight = 0;
            Iterator<ChangeRow> it = rows.iterator();
            while (it.hasNext() && tally.failure == null) {
                if (inFlight == threads) {
                    tally.add(take(phase, completion));
                    inFlight--;
                    continue;
                }
                ChangeRow row = it.next();
                completion.submit(() -> process(phase, reconciler, row));
                inFlight++;
            }
            state = PhaseState.DRAINING;
            while (inFlight > 0) {
                tally.add(take(phase, completion));
                inFlight--;
            }
        } finally {
            shutdown(executor);
        }
    }

    private RowResult take(Phase phase, CompletionService<RowResult> completion) {
        try {
            return completion.take().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PhaseFailedException(phase, null, e);
        } catch (ExecutionException e) {
            // process() converts runtime exceptions, so only errors get here
            throw new PhaseFailedException(phase, null, e.getCause());
        }
    }

    private RowResult process(Phase phase, RowReconciler reconciler, ChangeRow row) {
        MetricsService metrics = context.metrics();
        long started = System.nanoTime();
        try (LogContext ignored = LogContext.forRow(phase.label(), row)) {
            try {
                ReconcileOutcome outcome = reconciler.reconcile(row, context);
                metrics.recordRowOutcome(phase.label(), outcome, Duration.ofNanos(System.nanoTime() - started));
                return new RowResult(row, outcome, null);
            } catch (RuntimeException e) {
                metrics.recordRowFailure(phase.label());
                log.error("row.failed phase={} line={} error={}", phase.label(), row.lineNumber(), e.getMessage(), e);
                return new RowResult(row, null, e);
            }
        }
    }

    private void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory threadFactory(Phase phase) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "reconcile-" + phase.label() + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record RowResult(ChangeRow row, ReconcileOutcome outcome, RuntimeException error) {
    }

    /**
     * Per-phase accumulator, only touched by the dispatching thread.
     */
    private final class Tally {
        private final Phase phase;
        private final long total;
        private final Map<ReconcileOutcome, Long> outcomes = new EnumMap<>(ReconcileOutcome.class);
        private long processed;
        private RowResult failure;

        private Tally(Phase phase, long total) {
            this.phase = phase;
            this.total = total;
        }

        private void add(RowResult result) {
            processed++;
            if (result.error() != null) {
                if (failure == null) {
                    failure = result;
                }
            } else {
                outcomes.merge(result.outcome(), 1L, Long::sum);
            }
            if (processed % PROGRESS_INTERVAL == 0) {
                progress.onProgress(phase, processed, total, false);
            }
        }
    }
}
