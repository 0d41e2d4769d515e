package com.hubsync;

import com.hubsync.common.Result;
import com.hubsync.domain.HubEvent;
import com.hubsync.ingestion.config.BackfillProperties;
import com.hubsync.ingestion.config.StreamProperties;
import com.hubsync.ingestion.job.backfill.BackfillOrchestrator;
import com.hubsync.ingestion.job.backfill.BackfillWorker;
import com.hubsync.ingestion.processor.AppliedEvent;
import com.hubsync.ingestion.processor.HubEventProcessor;
import com.hubsync.ingestion.processor.MessageHandler;
import com.hubsync.ingestion.stream.HubEventHandler;
import com.hubsync.ingestion.stream.HubEventHandler.HandleOutcome;
import com.hubsync.ingestion.stream.HubEventStreamConsumer;
import com.hubsync.ingestion.stream.HubEventSubscriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class HubSyncCommandRunnerTest {

    @Mock
    private HubEventSubscriber subscriber;
    @Mock
    private HubEventStreamConsumer consumer;
    @Mock
    private HubEventProcessor processor;
    @Mock
    private MessageHandler messageHandler;
    @Mock
    private BackfillOrchestrator orchestrator;
    @Mock
    private BackfillWorker worker;

    private StreamProperties streamProperties;
    private BackfillProperties backfillProperties;
    private HubSyncCommandRunner runner;

    @BeforeEach
    void setUp() {
        streamProperties = new StreamProperties();
        streamProperties.setStartupDelayMs(0);
        backfillProperties = new BackfillProperties();
        runner = new HubSyncCommandRunner(subscriber, consumer, processor, messageHandler,
                orchestrator, worker, streamProperties, backfillProperties);
    }

    @Test
    void noCommand_startsNothing() throws Exception {
        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(subscriber, consumer, orchestrator, worker);
    }

    @Test
    void start_runsSubscriberThenConsumer() throws Exception {
        runner.run(new DefaultApplicationArguments("start"));

        verify(subscriber).start();
        verify(consumer).start(any(HubEventHandler.class));
        verify(worker, never()).run();
    }

    @Test
    void backfill_parsesCommaAndSpaceSeparatedFids() throws Exception {
        backfillProperties.setFids(List.of(1L));

        runner.run(new DefaultApplicationArguments("backfill", "5,6", "7", "--hubsync.hub.host=ignored"));

        verify(orchestrator).backfillFids(List.of(1L, 5L, 6L, 7L));
        verify(worker).run();
    }

    @Test
    void backfill_withoutFidsCoversAll() throws Exception {
        runner.run(new DefaultApplicationArguments("backfill"));

        verify(orchestrator).backfillFids(List.of());
    }

    @Test
    void worker_runsWorkerOnly() throws Exception {
        runner.run(new DefaultApplicationArguments("worker"));

        verify(worker).run();
        verify(orchestrator, never()).backfillFids(anyList());
    }

    @Test
    void unknownCommand_throws() {
        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments("replay")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("replay");
    }

    @Test
    void streamHandler_mapsProcessorResults() {
        HubEvent event = HubFixtures.mergeCast(3, 10);
        HubEventHandler handler = runner.streamHandler();

        when(processor.processHubEvent(event, messageHandler)).thenReturn(Result.success(new AppliedEvent(3, true, false)));
        assertThat(handler.handle(event).orElseThrow()).isEqualTo(HandleOutcome.applied());

        when(processor.processHubEvent(event, messageHandler)).thenReturn(Result.success(new AppliedEvent(3, false, true)));
        assertThat(handler.handle(event).orElseThrow()).isEqualTo(HandleOutcome.skippedEvent());

        when(processor.processHubEvent(event, messageHandler)).thenReturn(Result.failure("Postgres unavailable"));
        assertThat(handler.handle(event).isFailure()).isTrue();
    }

    @Test
    void shutdown_stopsEverything() {
        runner.shutdown();

        verify(subscriber).stop();
        verify(consumer).stop();
        verify(worker).stop();
    }
}
