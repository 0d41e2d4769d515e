package com.hubsync.ingestion.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Backfill queue and worker config.
 */
@ConfigurationProperties(prefix = "hubsync.backfill")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class BackfillProperties {

    /** Explicit fids to backfill; empty means every fid up to the Hub's max. */
    private List<Long> fids = new ArrayList<>();

    /** Overrides the max fid reported by the Hub. */
    private Long maxFid;

    /** Fids per reconcile task. */
    @Min(1)
    private int batchSize = 10;

    /** Worker loops draining the queue. */
    @Min(1)
    private int concurrency = 2;

    /** Pull Hub messages page by page during reconciliation instead of buffering the full set. */
    private boolean useStreamingRpcs = false;

    /** Attempts per task before it is marked FAILED. */
    @Min(1)
    private int maxAttempts = 5;

    /** RUNNING tasks not updated for this long are returned to PENDING. */
    private long staleAfterMs = 600_000;

    /** How often stale RUNNING tasks are looked for. */
    @Min(1)
    private long staleCheckIntervalMs = 60_000;

    /** Idle sleep of a worker loop when no task is due. */
    @Min(1)
    private long pollIntervalMs = 1_000;

    /** Delay before a completion marker is looked at again while reconcile tasks remain. */
    private long completionMarkerRecheckMs = 5_000;
}
