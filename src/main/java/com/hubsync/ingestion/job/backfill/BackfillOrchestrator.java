package com.hubsync.ingestion.job.backfill;

import com.hubsync.domain.BackfillTask;
import com.hubsync.ingestion.adapter.HubClient;
import com.hubsync.ingestion.adapter.HubConnectionException;
import com.hubsync.ingestion.config.BackfillProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.LongStream;

/**
 * Plans a backfill: reconcile tasks over fid batches, then one completion marker.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BackfillOrchestrator {

    private final HubClient hubClient;
    private final BackfillTaskQueue taskQueue;
    private final BackfillProperties backfillProperties;

    /**
     * With no fids, covers {@code [1, maxFid]} in batches of {@code batch-size}; otherwise one task for the given fids.
     *
     * @return the enqueued tasks, completion marker last
     * @throws MissingMetadataException when neither config nor the Hub yields a max fid
     */
    public List<BackfillTask> backfillFids(List<Long> fids) {
        Instant startedAt = Instant.now();
        List<BackfillTask> tasks = new ArrayList<>();
        if (fids == null || fids.isEmpty()) {
            long maxFid = resolveMaxFid();
            int batchSize = backfillProperties.getBatchSize();
            for (long start = 1; start <= maxFid; start += batchSize) {
                long end = Math.min(start + batchSize - 1, maxFid);
                tasks.add(taskQueue.enqueueReconcile(LongStream.rangeClosed(start, end).boxed().toList()));
            }
            log.info("Enqueued {} reconcile task(s) for fids 1..{}", tasks.size(), maxFid);
        } else {
            tasks.add(taskQueue.enqueueReconcile(fids));
            log.info("Enqueued reconcile task for {} fid(s)", fids.size());
        }
        tasks.add(taskQueue.enqueueCompletionMarker(startedAt));
        return tasks;
    }

    private long resolveMaxFid() {
        if (backfillProperties.getMaxFid() != null) {
            if (backfillProperties.getMaxFid() < 1) {
                throw new MissingMetadataException("Configured max fid " + backfillProperties.getMaxFid() + " is not positive");
            }
            return backfillProperties.getMaxFid();
        }
        long maxFid;
        try {
            maxFid = hubClient.getInfo().numFidEvents();
        } catch (HubConnectionException e) {
            throw new MissingMetadataException("Unable to get max fid from hub", e);
        }
        if (maxFid < 1) {
            throw new MissingMetadataException("Hub reported no fids");
        }
        return maxFid;
    }
}
