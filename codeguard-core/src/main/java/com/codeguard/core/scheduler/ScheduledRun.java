package com.codeguard.core.scheduler;

import com.codeguard.core.analyzer.AnalysisAbortedException;
import com.codeguard.core.analyzer.AnalysisContext;
import com.codeguard.core.analyzer.AnalyzerExecutionException;
import com.codeguard.core.analyzer.DeepInspector;
import com.codeguard.core.analyzer.EscalationPolicy;
import com.codeguard.core.config.AnalysisConfig;
import com.codeguard.core.model.AnalyzerResult;
import com.codeguard.core.model.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Handle of a running analysis.
 *
 * <p>A dispatcher thread walks the task list in order and blocks on a semaphore with
 * {@code maxConcurrentTasks} permits before handing each task to a fixed pool of as many
 * workers. A permit is held for as long as the analyzer call actually runs, and is returned
 * only when that call exits or when a queued task is abandoned before it started. A task
 * that timed out but ignores the interrupt therefore keeps its slot until it returns.
 *
 * <p>Every task settles at most once. The deadline timer is armed when the worker starts the
 * task, and whichever of the worker and the timer completes the settlement future first
 * decides the outcome.
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * ScheduledRun run = scheduler.start(catalog, registry, config, List.of(progressBar));
 * ...
 * run.cancel();
 * SchedulerResult result = run.await();
 * }</pre>
 *
 * @since 1.0.0
 */
public class ScheduledRun {

    private static final Logger log = LoggerFactory.getLogger(ScheduledRun.class);

    private static final AtomicInteger RUN_COUNTER = new AtomicInteger();

    private final List<AnalysisTask> tasks;
    private final AnalysisConfig config;
    private final EscalationPolicy escalationPolicy;
    private final DeepInspector deepInspector;
    private final ProgressTracker tracker;

    private final Semaphore permits;
    private final ExecutorService workers;
    private final ScheduledExecutorService timer;
    private final Thread dispatcher;

    private final AtomicReferenceArray<Outcome> outcomes;
    private final Set<TaskExecution> inFlight = ConcurrentHashMap.newKeySet();
    private final List<CompletableFuture<Outcome>> dispatched = new ArrayList<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CompletableFuture<SchedulerResult> done = new CompletableFuture<>();
    private final long startNanos;

    ScheduledRun(List<AnalysisTask> tasks, AnalysisConfig config, EscalationPolicy escalationPolicy,
                 DeepInspector deepInspector, List<ProgressObserver> observers) {
        this.tasks = List.copyOf(tasks);
        this.config = config;
        this.escalationPolicy = escalationPolicy;
        this.deepInspector = deepInspector;
        this.tracker = new ProgressTracker(tasks.size(), observers);
        this.permits = new Semaphore(config.maxConcurrentTasks());
        this.outcomes = new AtomicReferenceArray<>(tasks.size());

        int run = RUN_COUNTER.incrementAndGet();
        AtomicInteger workerCounter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(config.maxConcurrentTasks(), runnable -> {
            Thread thread = new Thread(runnable, "codeguard-worker-" + workerCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "codeguard-timer-" + run);
            thread.setDaemon(true);
            return thread;
        });
        this.dispatcher = new Thread(this::dispatchAll, "codeguard-dispatcher-" + run);
        this.dispatcher.setDaemon(true);
        this.startNanos = System.nanoTime();
    }

    void begin() {
        log.info("Starting analysis of {} tasks with at most {} in flight", tasks.size(), config.maxConcurrentTasks());
        dispatcher.start();
    }

    // ==================== Public API ====================

    /**
     * Stops dispatching and abandons in-flight tasks. Outcomes settled so far are kept.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        log.info("Cancelling analysis run");
        dispatcher.interrupt();
        for (TaskExecution execution : inFlight) {
            execution.abandon();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isDone() {
        return done.isDone();
    }

    /**
     * @return current progress
     */
    public ProgressSnapshot snapshot() {
        return tracker.snapshot();
    }

    /**
     * Waits for the run to finish. Interrupting the waiting thread cancels the run.
     *
     * @return scheduler result
     */
    public SchedulerResult await() {
        try {
            return done.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return done.join();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Analysis dispatcher failed", e.getCause());
        }
    }

    // ==================== Dispatch ====================

    private void dispatchAll() {
        try {
            for (AnalysisTask task : tasks) {
                if (cancelled.get()) {
                    break;
                }
                try {
                    permits.acquire();
                } catch (InterruptedException e) {
                    if (!cancelled.get()) {
                        log.warn("Dispatcher interrupted, cancelling run");
                        cancelled.set(true);
                    }
                    break;
                }
                if (cancelled.get()) {
                    permits.release();
                    break;
                }
                dispatched.add(dispatch(task));
            }
            if (cancelled.get()) {
                inFlight.forEach(TaskExecution::abandon);
            }
            CompletableFuture.allOf(dispatched.toArray(CompletableFuture[]::new))
                .handle((ignored, error) -> null)
                .join();
            finish();
        } catch (RuntimeException e) {
            log.error("Analysis dispatcher failed", e);
            shutdownExecutors();
            done.completeExceptionally(e);
        }
    }

    private CompletableFuture<Outcome> dispatch(AnalysisTask task) {
        TaskExecution execution = new TaskExecution(task);
        inFlight.add(execution);
        tracker.onDispatched(task.analyzerId());
        execution.start();
        return execution.settled;
    }

    private void finish() {
        List<Outcome> settled = new ArrayList<>();
        for (int i = 0; i < outcomes.length(); i++) {
            Outcome outcome = outcomes.get(i);
            if (outcome != null) {
                settled.add(outcome);
            }
        }
        shutdownExecutors();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        ProgressSnapshot progress = tracker.snapshot();
        log.info("Analysis finished in {} ms: {} completed, {} failed, {} timed out{}",
            elapsed.toMillis(), progress.completedTasks(), progress.failedTasks(), progress.timedOutTasks(),
            cancelled.get() ? " (cancelled)" : "");
        done.complete(new SchedulerResult(settled, cancelled.get(), progress, elapsed));
    }

    private void shutdownExecutors() {
        timer.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(100, TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    // ==================== Task Execution ====================

    /**
     * Lifecycle of one dispatched task. The worker and the deadline timer race to complete the
     * single settlement future; the semaphore permit follows the worker, not the settlement.
     */
    private final class TaskExecution {

        private final AnalysisTask task;
        private final CompletableFuture<Outcome> settled = new CompletableFuture<>();
        private final AtomicBoolean stopRequested = new AtomicBoolean();
        // set by whichever of the worker and abandon() gets to the task first
        private final AtomicBoolean claimed = new AtomicBoolean();
        private volatile Future<?> work;
        private volatile ScheduledFuture<?> deadline;

        TaskExecution(AnalysisTask task) {
            this.task = task;
        }

        void start() {
            settled.whenComplete((outcome, error) -> onSettled(outcome));
            work = workers.submit(this::runOnWorker);
        }

        private void runOnWorker() {
            if (!claimed.compareAndSet(false, true)) {
                return;
            }
            tracker.onWorkerStarted();
            try {
                long started = System.nanoTime();
                Duration timeout = config.perTaskTimeout();
                AnalysisContext context = AnalysisContext.builder(config)
                    .escalationPolicy(escalationPolicy)
                    .deepInspector(deepInspector)
                    .random(new Random(AnalysisContext.deriveSeed(config.randomSeed(), task.filePath(), task.analyzerId())))
                    .deadlineNanos(started + timeout.toNanos())
                    .cancellation(stopRequested::get)
                    .build();
                if (!settled.isDone()) {
                    armDeadline(timeout);
                }
                settled.complete(execute(context, started));
            } finally {
                tracker.onWorkerFinished();
                permits.release();
            }
        }

        private void armDeadline(Duration timeout) {
            try {
                deadline = timer.schedule(this::expire, timeout.toNanos(), TimeUnit.NANOSECONDS);
            } catch (RejectedExecutionException e) {
                // run already finished after this task was abandoned
                log.debug("No deadline armed for {} on {}: {}", task.analyzerId(), task.filePath(), e.getMessage());
            }
        }

        private Outcome execute(AnalysisContext context, long started) {
            String analyzerId = task.analyzerId();
            String filePath = task.filePath();
            try {
                AnalyzerResult result = task.analyzer().analyze(task.file(), context);
                Outcome outcome = Outcome.completed(analyzerId, filePath, result, elapsedSince(started));
                log.debug("{} completed {} with {} findings", analyzerId, filePath, outcome.findings().size());
                return outcome;
            } catch (AnalyzerExecutionException e) {
                log.warn("Analyzer {} failed on {}: {}", analyzerId, filePath, e.getMessage());
                return Outcome.failed(analyzerId, filePath, e.getMessage(), elapsedSince(started));
            } catch (AnalysisAbortedException e) {
                if (context.remainingTime().isZero()) {
                    return Outcome.timedOut(analyzerId, filePath, config.perTaskTimeout());
                }
                return Outcome.failed(analyzerId, filePath, e.getMessage(), elapsedSince(started));
            } catch (RuntimeException e) {
                log.warn("Analyzer {} crashed on {}", analyzerId, filePath, e);
                return Outcome.failed(analyzerId, filePath,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), elapsedSince(started));
            } catch (StackOverflowError e) {
                log.warn("Analyzer {} overflowed the stack on {}", analyzerId, filePath);
                return Outcome.failed(analyzerId, filePath, "StackOverflowError", elapsedSince(started));
            }
        }

        private void expire() {
            Outcome outcome = Outcome.timedOut(task.analyzerId(), task.filePath(), config.perTaskTimeout());
            if (settled.complete(outcome)) {
                log.warn("Analyzer {} timed out on {} after {} ms",
                    task.analyzerId(), task.filePath(), config.perTaskTimeout().toMillis());
                interruptWorker();
            }
        }

        void abandon() {
            if (settled.cancel(false)) {
                log.debug("Abandoned {} on {}", task.analyzerId(), task.filePath());
                if (claimed.compareAndSet(false, true)) {
                    permits.release();
                } else {
                    interruptWorker();
                }
            }
        }

        private void interruptWorker() {
            stopRequested.set(true);
            Future<?> running = work;
            if (running != null) {
                running.cancel(true);
            }
        }

        private void onSettled(Outcome outcome) {
            ScheduledFuture<?> timeoutFuture = deadline;
            if (timeoutFuture != null) {
                timeoutFuture.cancel(false);
            }
            if (outcome != null) {
                outcomes.set(task.index(), outcome);
                tracker.onSettled(outcome);
            } else {
                tracker.onAbandoned();
            }
            inFlight.remove(this);
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    @Override
    public String toString() {
        return "ScheduledRun[tasks=" + tasks.size() + ", cancelled=" + cancelled.get() + "]";
    }
}
