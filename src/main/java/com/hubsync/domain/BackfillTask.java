package com.hubsync.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Persistent backfill queue entry. A {@code reconcile} task carries fids; a {@code completionMarker} carries startedAt.
 */
@Document(collection = "backfill_tasks")
@CompoundIndex(name = "status_due_seq", def = "{'status': 1, 'nextAttemptAt': 1, 'sequence': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class BackfillTask {

    public static final String RECONCILE = "reconcile";
    public static final String COMPLETION_MARKER = "completionMarker";

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String name;
    /** Enqueue order. */
    private long sequence;
    private List<Long> fids;
    private Instant startedAt;

    private TaskStatus status;
    private int attempts;
    private Instant nextAttemptAt;
    private Instant lockedAt;
    private String lastError;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean isCompletionMarker() {
        return COMPLETION_MARKER.equals(name);
    }

    public enum TaskStatus {
        PENDING,
        RUNNING,
        COMPLETE,
        FAILED
    }
}
