package com.codeguard.core.scheduler;

/**
 * Receives progress updates of an analysis run.
 *
 * <p>Called from worker threads after every settled task, outside of the tracker's lock.
 * Implementations must be thread-safe. Exceptions are logged and ignored.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProgressObserver {

    void onProgress(ProgressSnapshot snapshot);
}
