package com.codeguard.core.scheduler;

import com.codeguard.core.model.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mutable progress state of one run.
 *
 * <p>All counters are guarded by the tracker's monitor. Observers are notified with an
 * immutable {@link ProgressSnapshot} after the lock is released.
 *
 * @since 1.0.0
 */
public class ProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private final int totalTasks;
    private final long startNanos;
    private final List<ProgressObserver> observers;

    private int dispatched;
    private int completed;
    private int failed;
    private int timedOut;
    private int abandoned;
    private int peakInFlight;
    private int runningWorkers;
    private int peakRunningWorkers;
    private int findings;
    private final Map<String, AnalyzerActivity> perAnalyzer = new TreeMap<>();

    public ProgressTracker(int totalTasks, List<ProgressObserver> observers) {
        this.totalTasks = totalTasks;
        this.startNanos = System.nanoTime();
        this.observers = observers == null ? List.of() : List.copyOf(observers);
    }

    /**
     * Records that a task was handed to a worker.
     *
     * @param analyzerId analyzer of the task
     */
    public synchronized void onDispatched(String analyzerId) {
        dispatched++;
        perAnalyzer.putIfAbsent(analyzerId, AnalyzerActivity.empty());
        peakInFlight = Math.max(peakInFlight, inFlight());
    }

    /**
     * Records that a worker started executing an analyzer call.
     */
    public synchronized void onWorkerStarted() {
        runningWorkers++;
        peakRunningWorkers = Math.max(peakRunningWorkers, runningWorkers);
    }

    /**
     * Records that an analyzer call returned. For a timed-out task this may happen long after
     * the task settled.
     */
    public synchronized void onWorkerFinished() {
        runningWorkers--;
    }

    /**
     * Records a settled task and notifies observers.
     *
     * @param outcome settled outcome
     */
    public void onSettled(Outcome outcome) {
        ProgressSnapshot snapshot;
        synchronized (this) {
            AnalyzerActivity activity = perAnalyzer.getOrDefault(outcome.analyzerId(), AnalyzerActivity.empty());
            switch (outcome.status()) {
                case COMPLETED -> {
                    completed++;
                    findings += outcome.findings().size();
                    activity = new AnalyzerActivity(activity.filesProcessed() + 1,
                        activity.findingsFound() + outcome.findings().size(), activity.failures(), activity.timeouts());
                }
                case FAILED -> {
                    failed++;
                    activity = new AnalyzerActivity(activity.filesProcessed(), activity.findingsFound(),
                        activity.failures() + 1, activity.timeouts());
                }
                case TIMED_OUT -> {
                    timedOut++;
                    activity = new AnalyzerActivity(activity.filesProcessed(), activity.findingsFound(),
                        activity.failures(), activity.timeouts() + 1);
                }
            }
            perAnalyzer.put(outcome.analyzerId(), activity);
            snapshot = snapshotLocked();
        }
        notifyObservers(snapshot);
    }

    /**
     * Records a dispatched task that was abandoned by cancellation and will never settle.
     */
    public synchronized void onAbandoned() {
        abandoned++;
    }

    public synchronized ProgressSnapshot snapshot() {
        return snapshotLocked();
    }

    private int inFlight() {
        return dispatched - completed - failed - timedOut - abandoned;
    }

    private ProgressSnapshot snapshotLocked() {
        return new ProgressSnapshot(
            totalTasks,
            dispatched,
            completed,
            failed,
            timedOut,
            inFlight(),
            peakInFlight,
            runningWorkers,
            peakRunningWorkers,
            findings,
            Duration.ofNanos(System.nanoTime() - startNanos),
            perAnalyzer);
    }

    private void notifyObservers(ProgressSnapshot snapshot) {
        for (ProgressObserver observer : observers) {
            try {
                observer.onProgress(snapshot);
            } catch (RuntimeException e) {
                log.warn("Progress observer {} failed: {}", observer.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
