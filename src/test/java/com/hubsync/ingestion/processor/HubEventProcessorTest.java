package com.hubsync.ingestion.processor;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.hubsync.HubFixtures;
import com.hubsync.common.Result;
import com.hubsync.domain.HubEvent;
import com.hubsync.domain.HubEventBody.MergeOnChainEventBody;
import com.hubsync.domain.HubEventBody.RevokeMessageBody;
import com.hubsync.domain.HubEventType;
import com.hubsync.domain.Message;
import com.hubsync.domain.MessageState;
import com.hubsync.domain.OnChainEvent;
import com.hubsync.domain.OnChainEventType;
import com.hubsync.domain.StoreMessageOperation;
import com.hubsync.domain.UserNameProof;
import com.hubsync.ingestion.store.HubEventLogStore;
import com.hubsync.ingestion.store.MessageDeletion;
import com.hubsync.ingestion.store.MessageStore;
import com.hubsync.ingestion.store.OnChainEventStore;
import com.hubsync.ingestion.store.UsernameProofStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class HubEventProcessorTest {

    @Mock private PlatformTransactionManager transactionManager;
    @Mock private NamedParameterJdbcTemplate jdbcTemplate;
    @Mock private HubEventLogStore hubEventLogStore;
    @Mock private MessageStore messageStore;
    @Mock private OnChainEventStore onChainEventStore;
    @Mock private UsernameProofStore usernameProofStore;
    @Mock private MessageHandler handler;

    private HubEventProcessor processor;

    @BeforeEach
    void setUp() {
        TransactionStatus status = new SimpleTransactionStatus();
        when(transactionManager.getTransaction(any())).thenReturn(status);
        processor = new HubEventProcessor(new TransactionTemplate(transactionManager), jdbcTemplate,
                hubEventLogStore, messageStore, onChainEventStore, usernameProofStore);
        when(hubEventLogStore.recordEvent(anyLong(), any(), anyLong())).thenReturn(true);
        when(messageStore.merge(any())).thenReturn(true);
        when(messageStore.delete(any(), any())).thenReturn(true);
    }

    @Test
    void mergeMessage_storesAndNotifiesHandlerAsCreated() {
        Message cast = HubFixtures.cast(3, "0xaa", 100);

        Result<AppliedEvent> result = processor.processHubEvent(HubFixtures.merge(1, cast), handler);

        assertThat(result.getValue()).contains(new AppliedEvent(1, true, false));
        verify(hubEventLogStore).recordEvent(1, HubEventType.MERGE_MESSAGE, 3);
        verify(messageStore).merge(cast);
        verify(handler).handleMessageMerge(cast, jdbcTemplate, StoreMessageOperation.MERGE, MessageState.CREATED, true, false);
        verify(transactionManager).commit(any());
    }

    @Test
    @DisplayName("remove message deletes its targets first and is itself merged as DELETED")
    void mergeRemoveMessage_deletesTargetsThenMergesAsDeleted() {
        Message add = HubFixtures.cast(3, "0xaa", 100);
        Message remove = HubFixtures.castRemove(3, "0xbb", "0xaa", 200);

        processor.processHubEvent(HubFixtures.merge(2, remove, add), handler);

        InOrder order = inOrder(messageStore, handler);
        order.verify(messageStore).delete(add, MessageDeletion.REMOVED);
        order.verify(handler).handleMessageMerge(add, jdbcTemplate, StoreMessageOperation.DELETE, MessageState.DELETED, true, false);
        order.verify(messageStore).merge(remove);
        order.verify(handler).handleMessageMerge(remove, jdbcTemplate, StoreMessageOperation.MERGE, MessageState.DELETED, true, false);
    }

    @Test
    void pruneAndRevoke_markDeletionReason() {
        Message cast = HubFixtures.cast(3, "0xaa", 100);

        processor.processHubEvent(HubFixtures.prune(3, cast), handler);
        processor.processHubEvent(new HubEvent(4, new RevokeMessageBody(cast)), handler);

        verify(messageStore).delete(cast, MessageDeletion.PRUNED);
        verify(messageStore).delete(cast, MessageDeletion.REVOKED);
    }

    @Test
    void redelivery_reportsNotNew() {
        Message cast = HubFixtures.cast(3, "0xaa", 100);
        when(hubEventLogStore.recordEvent(anyLong(), any(), anyLong())).thenReturn(false);
        when(messageStore.merge(cast)).thenReturn(false);

        Result<AppliedEvent> result = processor.processHubEvent(HubFixtures.merge(1, cast), handler);

        assertThat(result.getValue()).contains(new AppliedEvent(1, false, false));
        verify(handler).handleMessageMerge(cast, jdbcTemplate, StoreMessageOperation.MERGE, MessageState.CREATED, false, false);
    }

    @Test
    void onChainEvent_insertedIfAbsent() {
        OnChainEvent signer = new OnChainEvent(10, 100, 1_700_000_000L, 2, "0xtx", OnChainEventType.SIGNER, 5,
                JsonNodeFactory.instance.objectNode());
        when(onChainEventStore.insertIfAbsent(signer)).thenReturn(true);

        Result<AppliedEvent> result = processor.processHubEvent(new HubEvent(7, new MergeOnChainEventBody(signer)), handler);

        assertThat(result.isSuccess()).isTrue();
        verify(onChainEventStore).insertIfAbsent(signer);
        verify(hubEventLogStore).recordEvent(7, HubEventType.MERGE_ON_CHAIN_EVENT, 5);
    }

    @Test
    void usernameProof_deletesReplacedProofThenUpserts() {
        UserNameProof old = HubFixtures.fname("alice", 3, "0xold", 100);
        UserNameProof current = HubFixtures.fname("alice", 3, "0xnew", 200);

        processor.processHubEvent(HubFixtures.mergeProof(8, current, old), handler);

        InOrder order = inOrder(usernameProofStore);
        order.verify(usernameProofStore).markDeleted(old);
        order.verify(usernameProofStore).upsert(current);
    }

    @Test
    void handlerSkip_bypassesBuiltInProcessing() {
        when(handler.onHubEvent(any(), any())).thenReturn(true);

        Result<AppliedEvent> result = processor.processHubEvent(HubFixtures.mergeCast(9, 3), handler);

        assertThat(result.getValue()).contains(new AppliedEvent(9, true, true));
        verify(messageStore, never()).merge(any());
    }

    @Test
    @DisplayName("store failure rolls back and comes back as a failed result")
    void storeFailure_rollsBackAndReturnsFailure() {
        when(messageStore.merge(any())).thenThrow(new DataAccessResourceFailureException("connection refused"));

        Result<AppliedEvent> result = processor.processHubEvent(HubFixtures.mergeCast(10, 3), handler);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.getCause()).containsInstanceOf(EventApplicationException.class);
        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
    }

    @Test
    void handlerFailure_rollsBack() {
        doThrowFromHandler();

        Result<AppliedEvent> result = processor.processHubEvent(HubFixtures.mergeCast(11, 3), handler);

        assertThat(result.isFailure()).isTrue();
        verify(transactionManager).rollback(any());
    }

    @Test
    void handleMissingMessage_flagsWasMissed() {
        Message cast = HubFixtures.cast(3, "0xaa", 100);

        Result<Boolean> result = processor.handleMissingMessage(cast, handler);

        assertThat(result.getValue()).contains(true);
        verify(handler).handleMessageMerge(cast, jdbcTemplate, StoreMessageOperation.MERGE, MessageState.CREATED, true, true);
        verify(hubEventLogStore, never()).recordEvent(anyLong(), any(), anyLong());
    }

    private void doThrowFromHandler() {
        doThrow(new IllegalStateException("handler bug"))
                .when(handler).handleMessageMerge(any(), any(), any(), any(), anyBoolean(), eq(false));
    }
}
