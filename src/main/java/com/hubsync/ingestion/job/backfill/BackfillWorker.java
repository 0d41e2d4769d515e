package com.hubsync.ingestion.job.backfill;

import com.hubsync.common.Result;
import com.hubsync.common.RetryPolicy;
import com.hubsync.domain.BackfillTask;
import com.hubsync.ingestion.config.BackfillProperties;
import com.hubsync.ingestion.reconcile.ReconciliationSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drains the backfill queue with {@code concurrency} loops on the backfill executor.
 */
@Component
@Slf4j
public class BackfillWorker {

    private final BackfillTaskQueue taskQueue;
    private final FidReconciliationProcessor fidProcessor;
    private final BackfillProperties backfillProperties;
    private final RetryPolicy retryPolicy;
    private final Executor executor;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public BackfillWorker(BackfillTaskQueue taskQueue,
                          FidReconciliationProcessor fidProcessor,
                          BackfillProperties backfillProperties,
                          RetryPolicy retryPolicy,
                          @Qualifier("backfill-executor") Executor executor) {
        this.taskQueue = taskQueue;
        this.fidProcessor = fidProcessor;
        this.backfillProperties = backfillProperties;
        this.retryPolicy = retryPolicy;
        this.executor = executor;
    }

    public void run() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Backfill worker already running");
            return;
        }
        int loops = Math.max(1, backfillProperties.getConcurrency());
        for (int i = 0; i < loops; i++) {
            executor.execute(this::workerLoop);
        }
        log.info("Backfill worker loops started: {}", loops);
    }

    public void stop() {
        running.set(false);
    }

    public boolean isRunning() {
        return running.get();
    }

    private void workerLoop() {
        int failures = 0;
        while (running.get()) {
            try {
                if (processNext()) {
                    failures = 0;
                } else if (!sleep(backfillProperties.getPollIntervalMs())) {
                    break;
                }
            } catch (DataAccessException e) {
                log.warn("Backfill queue unavailable: {}", e.getMessage());
                if (!retryPolicy.sleep(failures++)) {
                    break;
                }
            } catch (RuntimeException e) {
                log.error("Backfill worker loop hit an unexpected error, retrying", e);
                if (!retryPolicy.sleep(failures++)) {
                    break;
                }
            }
        }
        log.debug("Backfill worker loop exited");
    }

    /**
     * Claims and handles one task.
     *
     * @return false when no task was due
     */
    boolean processNext() {
        Optional<BackfillTask> claimed = taskQueue.claimNext();
        if (claimed.isEmpty()) {
            return false;
        }
        BackfillTask task = claimed.get();
        if (task.isCompletionMarker()) {
            handleCompletionMarker(task);
        } else {
            handleReconcile(task);
        }
        return true;
    }

    private void handleReconcile(BackfillTask task) {
        List<Long> fids = task.getFids() != null ? task.getFids() : List.of();
        List<String> failures = new ArrayList<>();
        for (Long fid : fids) {
            Result<ReconciliationSummary> result = reconcile(fid);
            if (result.isFailure()) {
                failures.add(fid + ": " + result.getErrorMessage().orElse("unknown"));
            }
        }
        if (failures.isEmpty()) {
            taskQueue.complete(task);
            log.info("Reconciled fids {}..{} ({} fid(s))", first(fids), last(fids), fids.size());
        } else {
            taskQueue.fail(task, failures.size() + " of " + fids.size() + " fid(s) failed: " + String.join("; ", failures));
        }
    }

    private Result<ReconciliationSummary> reconcile(long fid) {
        try {
            return fidProcessor.reconcileFid(fid);
        } catch (RuntimeException e) {
            log.error("Reconciling fid {} failed unexpectedly", fid, e);
            return Result.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        }
    }

    private void handleCompletionMarker(BackfillTask task) {
        long outstanding = taskQueue.countOutstandingReconcileTasks();
        if (outstanding > 0) {
            log.debug("{} reconcile task(s) outstanding, checking completion again later", outstanding);
            taskQueue.defer(task, backfillProperties.getCompletionMarkerRecheckMs());
            return;
        }
        taskQueue.complete(task);
        Instant startedAt = task.getStartedAt() != null ? task.getStartedAt() : task.getCreatedAt();
        log.info("Backfill completed in {}", startedAt != null ? Duration.between(startedAt, Instant.now()) : "unknown time");
    }

    private static Object first(List<Long> fids) {
        return fids.isEmpty() ? "-" : fids.get(0);
    }

    private static Object last(List<Long> fids) {
        return fids.isEmpty() ? "-" : fids.get(fids.size() - 1);
    }

    private boolean sleep(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
