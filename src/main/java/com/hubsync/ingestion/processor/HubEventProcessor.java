package com.hubsync.ingestion.processor;

import com.hubsync.common.Result;
import com.hubsync.domain.HubEvent;
import com.hubsync.domain.HubEventBody;
import com.hubsync.domain.HubEventBody.MergeMessageBody;
import com.hubsync.domain.HubEventBody.MergeOnChainEventBody;
import com.hubsync.domain.HubEventBody.MergeUsernameProofBody;
import com.hubsync.domain.HubEventBody.PruneMessageBody;
import com.hubsync.domain.HubEventBody.RevokeMessageBody;
import com.hubsync.domain.Message;
import com.hubsync.domain.MessageState;
import com.hubsync.domain.StoreMessageOperation;
import com.hubsync.ingestion.store.HubEventLogStore;
import com.hubsync.ingestion.store.MessageDeletion;
import com.hubsync.ingestion.store.MessageStore;
import com.hubsync.ingestion.store.OnChainEventStore;
import com.hubsync.ingestion.store.UsernameProofStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Applies Hub events to the relational store. Each event (and each reconciliation repair) is one transaction:
 * bookkeeping row, message/on-chain/proof write and the application handler commit together or not at all.
 * Replaying an event leaves the store unchanged and reports {@code isNew=false}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HubEventProcessor {

    private final TransactionTemplate transactionTemplate;
    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final HubEventLogStore hubEventLogStore;
    private final MessageStore messageStore;
    private final OnChainEventStore onChainEventStore;
    private final UsernameProofStore usernameProofStore;

    public Result<AppliedEvent> processHubEvent(HubEvent event, MessageHandler handler) {
        try {
            AppliedEvent applied = transactionTemplate.execute(status -> apply(event, handler));
            return Result.success(applied);
        } catch (RuntimeException e) {
            log.warn("Failed to apply hub event {} ({}) for fid {}: {}", event.id(), event.type(), event.fid(), e.getMessage());
            return Result.failure("Hub event " + event.id() + " not applied: " + e.getMessage(),
                    new EventApplicationException("Hub event " + event.id() + " not applied", e));
        }
    }

    /**
     * Stores a message that reconciliation found on the Hub only, with {@code wasMissed=true}.
     *
     * @return whether the row was new
     */
    public Result<Boolean> handleMissingMessage(Message message, MessageHandler handler) {
        try {
            Boolean isNew = transactionTemplate.execute(status -> {
                MessageState state = message.type().isRemove() ? MessageState.DELETED : MessageState.CREATED;
                boolean inserted = messageStore.merge(message);
                handler.handleMessageMerge(message, jdbcTemplate, StoreMessageOperation.MERGE, state, inserted, true);
                return inserted;
            });
            return Result.success(Boolean.TRUE.equals(isNew));
        } catch (RuntimeException e) {
            log.warn("Failed to store missed message {} for fid {}: {}", message.hash(), message.fid(), e.getMessage());
            return Result.failure("Missed message " + message.hash() + " not stored: " + e.getMessage(),
                    new EventApplicationException("Missed message " + message.hash() + " not stored", e));
        }
    }

    private AppliedEvent apply(HubEvent event, MessageHandler handler) {
        boolean firstDelivery = hubEventLogStore.recordEvent(event.id(), event.type(), event.fid());
        if (!firstDelivery) {
            log.debug("Hub event {} was applied before, replaying idempotently", event.id());
        }
        if (handler.onHubEvent(event, jdbcTemplate)) {
            return new AppliedEvent(event.id(), firstDelivery, true);
        }

        HubEventBody body = event.body();
        if (body instanceof MergeMessageBody merge) {
            for (Message deleted : merge.deletedMessages()) {
                storeDeletion(deleted, MessageDeletion.REMOVED, handler);
            }
            Message message = merge.message();
            boolean isNew = messageStore.merge(message);
            MessageState state = message.type().isRemove() ? MessageState.DELETED : MessageState.CREATED;
            handler.handleMessageMerge(message, jdbcTemplate, StoreMessageOperation.MERGE, state, isNew, false);
        } else if (body instanceof PruneMessageBody prune) {
            storeDeletion(prune.message(), MessageDeletion.PRUNED, handler);
        } else if (body instanceof RevokeMessageBody revoke) {
            storeDeletion(revoke.message(), MessageDeletion.REVOKED, handler);
        } else if (body instanceof MergeOnChainEventBody onChain) {
            if (onChainEventStore.insertIfAbsent(onChain.onChainEvent())) {
                log.info("Recorded on-chain event {} for fid {}", onChain.onChainEvent().type(), onChain.fid());
            }
        } else if (body instanceof MergeUsernameProofBody proof) {
            if (proof.deletedUsernameProof() != null) {
                usernameProofStore.markDeleted(proof.deletedUsernameProof());
            }
            if (proof.usernameProof() != null) {
                usernameProofStore.upsert(proof.usernameProof());
            }
        } else {
            throw new IllegalStateException("Unhandled hub event body " + body.getClass().getSimpleName());
        }
        return new AppliedEvent(event.id(), firstDelivery, false);
    }

    private void storeDeletion(Message message, MessageDeletion reason, MessageHandler handler) {
        boolean isNew = messageStore.delete(message, reason);
        handler.handleMessageMerge(message, jdbcTemplate, StoreMessageOperation.DELETE, MessageState.DELETED, isNew, false);
    }
}
