package queues;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import queues.RecordingDispatcher.Batch;
import queues.dispatch.FlushScheduler;
import queues.dispatch.QueueResponse;
import queues.model.MessageBody;
import queues.wire.WireMessage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkerQueueTest {
    private static final long START = 1_000_000L;

    private ManualFlushTimers timers;
    private RecordingDispatcher dispatcher;
    private RecordingMetrics metrics;
    private QueueBroker broker;

    @BeforeEach
    void setUp() {
        timers = new ManualFlushTimers(START);
        dispatcher = new RecordingDispatcher();
        metrics = new RecordingMetrics();
        broker = QueueBroker.builder()
                .dispatcher(dispatcher)
                .timers(timers)
                .metrics(metrics)
                .build();
    }

    @AfterEach
    void tearDown() {
        broker.close();
    }

    private WorkerQueue consumed(QueueConsumer consumer) {
        broker.setConsumer(consumer);
        return broker.getOrCreateQueue(consumer.queueName());
    }

    private static void sendTexts(WorkerQueue queue, String... texts) {
        for (String text : texts) {
            queue.send(MessageBody.text(text));
        }
    }

    // ── Batching ────────────────────────────────────────────────────

    @Test
    void partialBatchFlushesAfterTimeout() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker").build());
        sendTexts(queue, "a", "b", "c");
        assertEquals(FlushScheduler.State.DELAYED, queue.flushState());

        timers.advance(999);
        assertTrue(dispatcher.batches().isEmpty());

        timers.advance(1);
        List<Batch> batches = dispatcher.batches();
        assertEquals(1, batches.size());
        assertEquals("q", batches.get(0).queue());
        assertEquals("worker", batches.get(0).worker());
        assertEquals(List.of("a", "b", "c"), batches.get(0).texts());
        assertEquals(0, queue.pendingCount());
        assertEquals(FlushScheduler.State.IDLE, queue.flushState());
    }

    @Test
    void fullBatchFlushesOnNextTick() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker").build());
        sendTexts(queue, "1", "2", "3", "4", "5");
        assertEquals(FlushScheduler.State.IMMEDIATE, queue.flushState());
        assertTrue(dispatcher.batches().isEmpty(), "ingress never dispatches synchronously");

        timers.runDue();
        assertEquals(List.of(5), dispatcher.batchSizes());
    }

    @Test
    void twelveMessagesFlushAsTwoFullBatchesThenRemainder() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker").build());
        for (int i = 1; i <= 12; i++) {
            queue.send(MessageBody.text("m" + i));
        }

        timers.runDue();
        assertEquals(List.of(5, 5), dispatcher.batchSizes());
        assertEquals(2, queue.pendingCount());

        timers.advance(999);
        assertEquals(List.of(5, 5), dispatcher.batchSizes());

        timers.advance(1);
        assertEquals(List.of(5, 5, 2), dispatcher.batchSizes());
        assertEquals(List.of("m11", "m12"), dispatcher.batches().get(2).texts());
    }

    @Test
    void zeroBatchSizeDeliversOneMessagePerBatch() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker").maxBatchSize(0).build());
        sendTexts(queue, "a", "b");

        timers.runDue();
        assertEquals(List.of(1, 1), dispatcher.batchSizes());
    }

    @Test
    void zeroTimeoutFlushesPartialBatchOnNextTick() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker")
                .maxBatchTimeoutSeconds(0)
                .build());
        sendTexts(queue, "a");
        assertEquals(FlushScheduler.State.IMMEDIATE, queue.flushState());

        timers.runDue();
        assertEquals(List.of(1), dispatcher.batchSizes());
    }

    @Test
    void fractionalTimeoutIsHonoured() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker")
                .maxBatchTimeoutSeconds(0.25)
                .build());
        sendTexts(queue, "a");

        timers.advance(249);
        assertTrue(dispatcher.batches().isEmpty());
        timers.advance(1);
        assertEquals(List.of(1), dispatcher.batchSizes());
    }

    @Test
    void sendBatchKeepsProducerOrder() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker").build());
        queue.sendBatch(List.of(MessageBody.text("x"), MessageBody.text("y")));

        assertEquals(2, queue.pendingCount());
        timers.advance(1000);
        assertEquals(List.of("x", "y"), dispatcher.batches().get(0).texts());
    }

    @Test
    void emptyBatchesDoNotArmTheTimer() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker").build());

        queue.sendBatch(List.of());
        broker.enqueueBatch("q", List.of());

        assertEquals(FlushScheduler.State.IDLE, queue.flushState());
        assertEquals(0, timers.pendingTimers());
        assertEquals(0, metrics.count("enqueued"));
    }

    // ── Enqueue during dispatch ─────────────────────────────────────

    @Test
    void messageSentByConsumerLandsInNextBatch() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker").build());
        dispatcher.respond((batch, call) -> {
            if (call == 0) {
                queue.send(MessageBody.text("from consumer"));
            }
            return CompletableFuture.completedFuture(QueueResponse.ok());
        });
        sendTexts(queue, "a", "b", "c");

        timers.advance(1000);
        assertEquals(List.of("a", "b", "c"), dispatcher.batches().get(0).texts());
        assertEquals(1, queue.pendingCount());

        timers.advance(1000);
        assertEquals(2, dispatcher.batches().size());
        assertEquals(List.of("from consumer"), dispatcher.batches().get(1).texts());
    }

    @Test
    void retriedMessagesQueueBehindMessagesSentWhileInFlight() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker").build());
        CompletableFuture<QueueResponse> firstAnswer = new CompletableFuture<>();
        dispatcher.respond((batch, call) -> call == 0
                ? firstAnswer
                : CompletableFuture.completedFuture(QueueResponse.ok()));
        sendTexts(queue, "a", "b", "c");

        timers.advance(1000);
        assertEquals(0, queue.pendingCount());

        sendTexts(queue, "d");
        firstAnswer.complete(QueueResponse.retryAllMessages());
        assertEquals(4, queue.pendingCount());

        timers.advance(1000);
        assertEquals(List.of("d", "a", "b", "c"), dispatcher.batches().get(1).texts());
    }

    // ── Retries ─────────────────────────────────────────────────────

    @Test
    void failingMessageIsDeliveredMaxRetriesPlusOneTimes() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker").maxRetries(2).build());
        dispatcher.respond((batch, call) -> CompletableFuture.completedFuture(QueueResponse.retryAllMessages()));
        sendTexts(queue, "poison");

        timers.advance(1000);
        timers.advance(1000);
        timers.advance(1000);
        timers.advance(10_000);

        List<Batch> batches = dispatcher.batches();
        assertEquals(3, batches.size());
        String id = batches.get(0).ids().get(0);
        for (Batch batch : batches) {
            assertEquals(List.of(id), batch.ids());
        }
        assertEquals(0, queue.pendingCount());
        assertEquals(FlushScheduler.State.IDLE, queue.flushState());
        assertEquals(2, metrics.count("retried"));
        assertEquals(1, metrics.count("discarded"));
    }

    @Test
    void explicitRetryRedeliversOnlyThatMessage() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker").maxBatchSize(3).build());
        dispatcher.respond((batch, call) -> CompletableFuture.completedFuture(call == 0
                ? QueueResponse.retry(List.of(batch.ids().get(1)))
                : QueueResponse.ok()));
        sendTexts(queue, "a", "b", "c");

        timers.runDue();
        assertEquals(List.of(dispatcher.batches().get(0).ids().get(1)), queue.pendingIds());

        timers.advance(1000);
        assertEquals(List.of("b"), dispatcher.batches().get(1).texts());
        assertEquals(dispatcher.batches().get(0).ids().get(1), dispatcher.batches().get(1).ids().get(0));
        assertEquals(3, metrics.count("acked"));
        assertEquals(1, metrics.count("retried"));
    }

    @Test
    void throwingDispatcherRetriesWholeBatch() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker").build());
        dispatcher.respond((batch, call) -> {
            if (call == 0) {
                throw new IllegalStateException("boom");
            }
            return CompletableFuture.completedFuture(QueueResponse.ok());
        });
        sendTexts(queue, "a", "b");

        timers.advance(1000);
        assertEquals(2, queue.pendingCount());
        assertEquals(1, metrics.count("dispatchFailure"));

        timers.advance(1000);
        assertEquals(List.of("a", "b"), dispatcher.batches().get(1).texts());
        assertEquals(0, queue.pendingCount());
    }

    @Test
    void failedFutureRetriesWholeBatch() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker").build());
        dispatcher.respond((batch, call) -> call == 0
                ? CompletableFuture.failedFuture(new IllegalStateException("worker crashed"))
                : CompletableFuture.completedFuture(QueueResponse.ok()));
        sendTexts(queue, "a");

        timers.advance(1000);
        timers.advance(1000);
        assertEquals(2, dispatcher.batches().size());
        assertEquals(1, metrics.count("acked"));
    }

    @Test
    void nonOkOutcomeRetriesWholeBatchEvenWithAckAll() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker").build());
        dispatcher.respond((batch, call) -> CompletableFuture.completedFuture(call == 0
                ? new QueueResponse("error", false, true, List.of(), List.of())
                : QueueResponse.ok()));
        sendTexts(queue, "a", "b");

        timers.advance(1000);
        assertEquals(2, queue.pendingCount());
        assertEquals(1, metrics.count("dispatchFailure"));
    }

    @Test
    void nullResponseIsTreatedAsException() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker").build());
        dispatcher.respond((batch, call) -> call == 0
                ? CompletableFuture.completedFuture(null)
                : CompletableFuture.completedFuture(QueueResponse.ok()));
        sendTexts(queue, "a");

        timers.advance(1000);
        assertEquals(1, queue.pendingCount());
    }

    // ── Dead-letter queues ──────────────────────────────────────────

    @Test
    void exhaustedMessageMovesToDeadLetterQueueWithItsIdentity() {
        consumed(QueueConsumer.builder("dlq", "dlq-worker").build());
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker")
                .maxRetries(1)
                .deadLetterQueue("dlq")
                .build());
        dispatcher.respond((batch, call) -> CompletableFuture.completedFuture(
                batch.queue().equals("q") ? QueueResponse.retryAllMessages() : QueueResponse.ok()));
        sendTexts(queue, "message1");

        timers.advance(1000);
        timers.advance(1000);
        assertEquals(2, dispatcher.batchesFor("q").size());
        assertEquals(1, broker.getOrCreateQueue("dlq").pendingCount());

        timers.advance(1000);
        List<Batch> dead = dispatcher.batchesFor("dlq");
        assertEquals(1, dead.size());
        assertEquals("dlq-worker", dead.get(0).worker());
        assertEquals(List.of("message1"), dead.get(0).texts());
        assertEquals(dispatcher.batchesFor("q").get(0).ids(), dead.get(0).ids());
        assertEquals(START, dead.get(0).messages().get(0).timestamp());
        assertEquals(1, metrics.count("deadLettered"));
        assertEquals(0, metrics.count("discarded"));
    }

    @Test
    void deadLetterForwardSkipsBatchLimits() {
        consumed(QueueConsumer.builder("dlq", "dlq-worker").build());
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker")
                .maxBatchSize(3)
                .maxRetries(0)
                .deadLetterQueue("dlq")
                .build());
        dispatcher.respond((batch, call) -> CompletableFuture.completedFuture(
                batch.queue().equals("q") ? QueueResponse.retryAllMessages() : QueueResponse.ok()));
        for (int i = 0; i < 3; i++) {
            queue.send(MessageBody.bytes(new byte[100_000]));
        }

        timers.runDue();
        assertEquals(3, broker.getOrCreateQueue("dlq").pendingCount());

        List<WireMessage> forwarded = dispatcher.batchesFor("q").get(0).messages();
        assertThrows(PayloadTooLargeException.class, () -> broker.enqueueBatch("dlq", forwarded));
    }

    @Test
    void deadLetterQueueWithoutConsumerDropsForwardedMessages() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker")
                .maxRetries(0)
                .deadLetterQueue("unwatched")
                .build());
        dispatcher.respond((batch, call) -> CompletableFuture.completedFuture(QueueResponse.retryAllMessages()));
        sendTexts(queue, "a");

        timers.advance(1000);
        assertEquals(0, broker.getOrCreateQueue("unwatched").pendingCount());
        assertEquals(1, metrics.count("droppedUnconsumed"));
        assertEquals(0, metrics.count("flushFailure"));
    }

    @Test
    void forwardFailureFailsTheFlushCycle() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker")
                .maxRetries(0)
                .deadLetterQueue("dlq")
                .build());
        CompletableFuture<QueueResponse> answer = new CompletableFuture<>();
        dispatcher.respond((batch, call) -> answer);
        sendTexts(queue, "a");

        CompletableFuture<Void> cycle = queue.flush();
        broker.close();
        answer.complete(QueueResponse.retryAllMessages());

        ExecutionException e = assertThrows(ExecutionException.class, cycle::get);
        DeadLetterForwardException cause = assertInstanceOf(DeadLetterForwardException.class, e.getCause());
        assertEquals("dlq", cause.deadLetterQueue());
        assertEquals(1, cause.messageCount());
        assertInstanceOf(IllegalStateException.class, cause.getCause());
    }

    @Test
    void forwardFailureOnTimerIsReportedAsFlushFailure() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker")
                .maxRetries(0)
                .deadLetterQueue("dlq")
                .build());
        CompletableFuture<QueueResponse> answer = new CompletableFuture<>();
        dispatcher.respond((batch, call) -> answer);
        sendTexts(queue, "a");

        timers.advance(1000);
        broker.close();
        answer.complete(QueueResponse.retryAllMessages());

        assertEquals(1, metrics.count("flushFailure"));
        assertEquals(0, metrics.count("deadLettered"));
    }

    @Test
    void queuesMayDeadLetterIntoEachOther() {
        WorkerQueue ping = consumed(QueueConsumer.builder("ping", "worker")
                .maxRetries(0)
                .deadLetterQueue("pong")
                .build());
        consumed(QueueConsumer.builder("pong", "worker")
                .maxRetries(0)
                .deadLetterQueue("ping")
                .build());
        dispatcher.respond((batch, call) -> CompletableFuture.completedFuture(
                call < 3 ? QueueResponse.retryAllMessages() : QueueResponse.ok()));
        sendTexts(ping, "ball");

        timers.advance(1000);
        timers.advance(1000);
        timers.advance(1000);
        timers.advance(1000);

        List<String> route = dispatcher.batches().stream().map(Batch::queue).toList();
        assertEquals(List.of("ping", "pong", "ping", "pong"), route);
        assertEquals(0, metrics.count("flushFailure"));
    }

    // ── Consumers ───────────────────────────────────────────────────

    @Test
    void queueWithoutConsumerDropsMessages() {
        WorkerQueue queue = broker.getOrCreateQueue("nobody");
        sendTexts(queue, "lost");

        assertEquals(0, queue.pendingCount());
        assertEquals(0, timers.pendingTimers());
        assertEquals(1, metrics.count("droppedUnconsumed"));
        timers.advance(10_000);
        assertTrue(dispatcher.batches().isEmpty());
    }

    @Test
    void consumerForAnotherQueueIsRejected() {
        WorkerQueue queue = broker.getOrCreateQueue("a");
        assertThrows(IllegalArgumentException.class, () ->
                broker.setConsumer(queue, QueueConsumer.builder("b", "worker").build()));
    }

    @Test
    void resetConsumersCancelsTimersButKeepsMessages() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker").build());
        sendTexts(queue, "a", "b", "c");

        broker.resetConsumers();
        assertEquals(FlushScheduler.State.IDLE, queue.flushState());
        assertEquals(0, timers.pendingTimers());
        timers.advance(10_000);
        assertTrue(dispatcher.batches().isEmpty());
        assertEquals(3, queue.pendingCount());

        broker.setConsumer(QueueConsumer.builder("q", "worker").build());
        assertEquals(FlushScheduler.State.IDLE, queue.flushState(), "attaching a consumer does not flush");
        sendTexts(queue, "d");
        timers.advance(1000);
        assertEquals(List.of("a", "b", "c", "d"), dispatcher.batches().get(0).texts());
    }

    @Test
    void replacedConsumerReceivesLaterBatches() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "first").build());
        sendTexts(queue, "a");
        broker.setConsumer(QueueConsumer.builder("q", "second").build());

        timers.advance(1000);
        assertEquals("second", dispatcher.batches().get(0).worker());
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    @Test
    void closeCancelsPendingFlushes() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker").build());
        sendTexts(queue, "a", "b", "c");

        broker.close();
        assertEquals(0, timers.pendingTimers());
        timers.advance(10_000);
        assertTrue(dispatcher.batches().isEmpty());

        assertThrows(IllegalStateException.class, () -> broker.getOrCreateQueue("q"));
        assertThrows(IllegalStateException.class, () -> queue.send(MessageBody.text("late")));
        broker.close();
    }

    @Test
    void retriesAreNotRescheduledAfterClose() {
        WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker").build());
        CompletableFuture<QueueResponse> answer = new CompletableFuture<>();
        dispatcher.respond((batch, call) -> answer);
        sendTexts(queue, "a");

        timers.advance(1000);
        broker.close();
        answer.complete(QueueResponse.retryAllMessages());

        assertEquals(1, queue.pendingCount());
        assertEquals(0, timers.pendingTimers());
    }

    // ── Logging ─────────────────────────────────────────────────────

    @Test
    void batchSummaryLogsPlainNumbers() {
        List<String> lines = Collections.synchronizedList(new ArrayList<>());
        SimpleFormatter formatter = new SimpleFormatter();
        Handler capture = new Handler() {
            @Override
            public void publish(LogRecord record) {
                lines.add(formatter.formatMessage(record));
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Logger logger = Logger.getLogger(WorkerQueue.class.getName());
        logger.addHandler(capture);
        try {
            WorkerQueue queue = consumed(QueueConsumer.builder("q", "worker").build());
            CompletableFuture<QueueResponse> answer = new CompletableFuture<>();
            dispatcher.respond((batch, call) -> answer);
            sendTexts(queue, "a");

            timers.advance(1000);
            timers.advance(1500);
            answer.complete(QueueResponse.ok());

            assertTrue(lines.contains("QUEUE q 1/1 (1500ms)"), lines.toString());
        } finally {
            logger.removeHandler(capture);
        }
    }
}
