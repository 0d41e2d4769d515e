package com.hubsync.ingestion.job.backfill;

import com.hubsync.common.RetryPolicy;
import com.hubsync.domain.BackfillTask;
import com.hubsync.domain.BackfillTask.TaskStatus;
import com.hubsync.domain.BackfillTaskRepository;
import com.hubsync.domain.SequenceCounter;
import com.hubsync.ingestion.config.BackfillProperties;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Persistent FIFO of backfill tasks in {@code backfill_tasks}. Tasks are claimed in enqueue order; a claimed task
 * stays RUNNING until completed, failed or deferred, and is handed out again if its worker disappears.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BackfillTaskQueue {

    static final String SEQUENCE_NAME = "backfill-tasks";

    private final MongoTemplate mongoTemplate;
    private final BackfillTaskRepository repository;
    private final BackfillProperties backfillProperties;
    private final RetryPolicy retryPolicy;

    public BackfillTask enqueueReconcile(List<Long> fids) {
        return enqueue(BackfillTask.RECONCILE, List.copyOf(fids), null);
    }

    public BackfillTask enqueueCompletionMarker(Instant startedAt) {
        return enqueue(BackfillTask.COMPLETION_MARKER, null, startedAt);
    }

    BackfillTask enqueue(String name, List<Long> fids, Instant startedAt) {
        Instant now = Instant.now();
        BackfillTask task = new BackfillTask();
        task.setName(name);
        task.setSequence(nextSequence());
        task.setFids(fids);
        task.setStartedAt(startedAt);
        task.setStatus(TaskStatus.PENDING);
        task.setAttempts(0);
        task.setCreatedAt(now);
        task.setUpdatedAt(now);
        BackfillTask saved = repository.save(task);
        log.debug("Enqueued {} task {} (seq {})", name, saved.getId(), saved.getSequence());
        return saved;
    }

    /**
     * Atomically moves the oldest due PENDING task to RUNNING and counts the attempt.
     */
    public Optional<BackfillTask> claimNext() {
        Instant now = Instant.now();
        Query query = new Query(where("status").is(TaskStatus.PENDING)
                .orOperator(where("nextAttemptAt").is(null), where("nextAttemptAt").lte(now)))
                .with(Sort.by(Sort.Direction.ASC, "sequence"));
        Update update = new Update()
                .set("status", TaskStatus.RUNNING)
                .set("lockedAt", now)
                .set("updatedAt", now)
                .inc("attempts", 1);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), BackfillTask.class));
    }

    public void complete(BackfillTask task) {
        Instant now = Instant.now();
        mongoTemplate.updateFirst(byId(task), new Update()
                .set("status", TaskStatus.COMPLETE)
                .set("lockedAt", null)
                .set("lastError", null)
                .set("updatedAt", now), BackfillTask.class);
    }

    /**
     * Returns the task to PENDING with a backoff, or marks it FAILED once it used up its attempts.
     */
    public void fail(BackfillTask task, String error) {
        Instant now = Instant.now();
        Update update = new Update()
                .set("lockedAt", null)
                .set("lastError", error)
                .set("updatedAt", now);
        if (task.getAttempts() >= backfillProperties.getMaxAttempts()) {
            update.set("status", TaskStatus.FAILED);
            log.error("Backfill task {} failed permanently after {} attempts: {}", task.getId(), task.getAttempts(), error);
        } else {
            long delayMs = retryPolicy.delayMs(Math.max(0, task.getAttempts() - 1));
            update.set("status", TaskStatus.PENDING).set("nextAttemptAt", now.plusMillis(delayMs));
            log.warn("Backfill task {} failed (attempt {}), retrying in {} ms: {}", task.getId(), task.getAttempts(), delayMs, error);
        }
        mongoTemplate.updateFirst(byId(task), update, BackfillTask.class);
    }

    /**
     * Puts a claimed task back without counting the attempt.
     */
    public void defer(BackfillTask task, long delayMs) {
        Instant now = Instant.now();
        mongoTemplate.updateFirst(byId(task), new Update()
                .set("status", TaskStatus.PENDING)
                .set("lockedAt", null)
                .set("nextAttemptAt", now.plusMillis(delayMs))
                .set("updatedAt", now)
                .inc("attempts", -1), BackfillTask.class);
    }

    public long countOutstandingReconcileTasks() {
        return repository.countByNameAndStatusIn(BackfillTask.RECONCILE, List.of(TaskStatus.PENDING, TaskStatus.RUNNING));
    }

    /**
     * RUNNING tasks whose worker has not finished within {@code stale-after-ms} go back to PENDING.
     */
    @Scheduled(fixedDelayString = "${hubsync.backfill.stale-check-interval-ms:60000}",
            initialDelayString = "${hubsync.backfill.stale-check-interval-ms:60000}")
    public long recoverStale() {
        Instant now = Instant.now();
        Instant cutoff = now.minusMillis(backfillProperties.getStaleAfterMs());
        UpdateResult result = mongoTemplate.updateMulti(
                new Query(where("status").is(TaskStatus.RUNNING).and("lockedAt").lt(cutoff)),
                new Update()
                        .set("status", TaskStatus.PENDING)
                        .set("lockedAt", null)
                        .set("nextAttemptAt", null)
                        .set("updatedAt", now),
                BackfillTask.class);
        long recovered = result.getModifiedCount();
        if (recovered > 0) {
            log.warn("Returned {} stale backfill task(s) to the queue", recovered);
        }
        return recovered;
    }

    private long nextSequence() {
        SequenceCounter counter = mongoTemplate.findAndModify(
                new Query(where("_id").is(SEQUENCE_NAME)),
                new Update().inc("value", 1),
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                SequenceCounter.class);
        if (counter == null) {
            throw new IllegalStateException("Sequence counter " + SEQUENCE_NAME + " missing");
        }
        return counter.getValue();
    }

    private static Query byId(BackfillTask task) {
        return new Query(where("_id").is(task.getId()));
    }
}
