package com.hubsync.ingestion.reconcile;

import com.hubsync.common.Result;
import com.hubsync.domain.FarcasterTime;
import com.hubsync.domain.Message;
import com.hubsync.domain.MessageType;
import com.hubsync.domain.StoredMessage;
import com.hubsync.ingestion.adapter.HubClient;
import com.hubsync.ingestion.adapter.HubConnectionException;
import com.hubsync.ingestion.adapter.HubMessageQuery;
import com.hubsync.ingestion.adapter.MessagePage;
import com.hubsync.ingestion.config.BackfillProperties;
import com.hubsync.ingestion.config.HubProperties;
import com.hubsync.ingestion.store.MessageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Diffs the Hub's messages for a fid against the store's copy and reports every message on either side once.
 * <p>
 * Buffered mode reads the full Hub set before the store and reports nothing if the Hub fails. Streaming mode
 * loads the store side first and reports Hub pages as they arrive; a Hub failure mid-way still fails the call,
 * but pages already seen have been reported.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MessageReconciliation {

    private final HubClient hubClient;
    private final MessageStore messageStore;
    private final HubProperties hubProperties;
    private final BackfillProperties backfillProperties;

    public Result<ReconciliationSummary> reconcileMessagesForFid(long fid,
                                                                 HubMessageCallback onHubMessage,
                                                                 DbMessageCallback onDbMessage) {
        return reconcileMessagesForFid(fid, onHubMessage, onDbMessage, null, null, null);
    }

    /**
     * @param startTime inclusive lower bound in Farcaster seconds, may be null
     * @param stopTime  inclusive upper bound in Farcaster seconds, may be null
     * @param types     message types to compare; null or empty means every reconcilable type
     */
    public Result<ReconciliationSummary> reconcileMessagesForFid(long fid,
                                                                 HubMessageCallback onHubMessage,
                                                                 DbMessageCallback onDbMessage,
                                                                 Long startTime,
                                                                 Long stopTime,
                                                                 Set<MessageType> types) {
        TimeRange range;
        try {
            range = TimeRange.of(startTime, stopTime);
        } catch (InvalidTimeRangeException e) {
            log.error("Skipping message reconciliation for fid {}: {}", fid, e.getMessage());
            return Result.success(ReconciliationSummary.skipped(fid));
        }
        Set<MessageType> selected = selectTypes(types);
        List<HubMessageQuery> queries = HubMessageQuery.forTypes(selected);
        Diff diff = new Diff(fid, onHubMessage);
        try {
            if (backfillProperties.isUseStreamingRpcs()) {
                diff.load(loadStored(fid, selected, range));
                for (HubMessageQuery query : queries) {
                    forEachHubPage(fid, query, range, diff::hubMessage);
                }
            } else {
                List<Message> hubMessages = new ArrayList<>();
                for (HubMessageQuery query : queries) {
                    forEachHubPage(fid, query, range, hubMessages::add);
                }
                diff.load(loadStored(fid, selected, range));
                hubMessages.forEach(diff::hubMessage);
            }
            diff.reportStoreOnly(onDbMessage);
        } catch (HubConnectionException e) {
            log.error("Message reconciliation for fid {} failed, Hub unavailable: {}", fid, e.getMessage());
            return Result.failure("Hub unavailable for fid " + fid + ": " + e.getMessage(), e);
        } catch (DataAccessException e) {
            log.error("Message reconciliation for fid {} failed reading the store: {}", fid, e.getMessage());
            return Result.failure("Store unavailable for fid " + fid + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Message reconciliation for fid {} failed: {}", fid, e.getMessage());
            return Result.failure("Reconciliation failed for fid " + fid + ": " + e.getMessage(), e);
        }
        ReconciliationSummary summary = diff.summary();
        log.debug("Reconciled messages for fid {}: {}", fid, summary);
        return Result.success(summary);
    }

    private Set<MessageType> selectTypes(Set<MessageType> types) {
        Set<MessageType> reconcilable = HubMessageQuery.reconcilableTypes();
        if (types == null || types.isEmpty()) {
            return reconcilable;
        }
        Set<MessageType> selected = EnumSet.noneOf(MessageType.class);
        for (MessageType type : types) {
            if (reconcilable.contains(type)) {
                selected.add(type);
            } else {
                log.debug("Message type {} is not reconciled, ignoring", type);
            }
        }
        return selected;
    }

    private List<StoredMessage> loadStored(long fid, Set<MessageType> types, TimeRange range) {
        return messageStore.findForReconciliation(fid, types,
                range.start() != null ? FarcasterTime.toInstant(range.start()) : null,
                range.stop() != null ? FarcasterTime.toInstant(range.stop()) : null);
    }

    private void forEachHubPage(long fid, HubMessageQuery query, TimeRange range,
                                Consumer<Message> sink) {
        String pageToken = null;
        do {
            MessagePage page = hubClient.getMessagesByFid(query, fid, pageToken, hubProperties.getPageSize());
            for (Message message : page.messages()) {
                if (range.contains(message.timestamp())) {
                    sink.accept(message);
                }
            }
            pageToken = page.nextPageToken();
        } while (pageToken != null);
    }

    private static final class Diff {

        private final long fid;
        private final HubMessageCallback onHubMessage;
        private final Map<String, StoredMessage> stored = new LinkedHashMap<>();
        private final Set<String> seenOnHub = new HashSet<>();

        private int hubCount;
        private int missingInDb;
        private int missingInHub;
        private int pruned;
        private int revoked;

        Diff(long fid, HubMessageCallback onHubMessage) {
            this.fid = fid;
            this.onHubMessage = onHubMessage;
        }

        void load(List<StoredMessage> rows) {
            for (StoredMessage row : rows) {
                stored.putIfAbsent(row.message().hash(), row);
            }
        }

        void hubMessage(Message message) {
            if (!seenOnHub.add(message.hash())) {
                return;
            }
            hubCount++;
            StoredMessage row = stored.get(message.hash());
            if (row == null) {
                missingInDb++;
                onHubMessage.onHubMessage(message, true, false, false);
                return;
            }
            if (row.isPruned()) {
                pruned++;
            }
            if (row.isRevoked()) {
                revoked++;
            }
            onHubMessage.onHubMessage(message, false, row.isPruned(), row.isRevoked());
        }

        void reportStoreOnly(DbMessageCallback onDbMessage) {
            for (StoredMessage row : stored.values()) {
                boolean absent = !seenOnHub.contains(row.message().hash());
                if (absent) {
                    missingInHub++;
                }
                if (onDbMessage != null) {
                    onDbMessage.onDbMessage(row.message(), absent);
                }
            }
        }

        ReconciliationSummary summary() {
            return new ReconciliationSummary(fid, hubCount, stored.size(), missingInDb, missingInHub,
                    pruned, revoked, false);
        }
    }
}
