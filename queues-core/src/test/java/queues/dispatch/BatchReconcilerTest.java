package queues.dispatch;

import org.junit.jupiter.api.Test;
import queues.QueueConsumer;
import queues.model.MessageBody;
import queues.model.QueueMessage;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchReconcilerTest {

    private static List<QueueMessage> messages(String... ids) {
        return Arrays.stream(ids)
                .map(id -> new QueueMessage(id, 0L, MessageBody.text(id)))
                .toList();
    }

    @Test
    void okResponseAcknowledgesEverything() {
        QueueConsumer consumer = QueueConsumer.builder("q", "w").build();
        List<QueueMessage> batch = messages("a", "b");

        BatchReconciler.Reconciliation result = BatchReconciler.reconcile(consumer, batch, QueueResponse.ok());

        assertEquals(2, result.acked());
        assertEquals(0, result.failed());
        assertEquals(0, batch.get(0).failedAttempts());
    }

    @Test
    void explicitRetryFailsOnlyListedMessages() {
        QueueConsumer consumer = QueueConsumer.builder("q", "w").build();
        List<QueueMessage> batch = messages("a", "b", "c");

        BatchReconciler.Reconciliation result =
                BatchReconciler.reconcile(consumer, batch, QueueResponse.retry(List.of("c", "a")));

        assertEquals(1, result.acked());
        assertEquals(List.of(batch.get(0), batch.get(2)), result.toRetry());
        assertEquals(1, batch.get(0).failedAttempts());
        assertEquals(0, batch.get(1).failedAttempts());
    }

    @Test
    void unknownRetryIdsAreIgnored() {
        QueueConsumer consumer = QueueConsumer.builder("q", "w").build();

        BatchReconciler.Reconciliation result =
                BatchReconciler.reconcile(consumer, messages("a"), QueueResponse.retry(List.of("zzz")));

        assertEquals(1, result.acked());
        assertTrue(result.toRetry().isEmpty());
    }

    @Test
    void exceptionOutcomeFailsWholeBatch() {
        QueueConsumer consumer = QueueConsumer.builder("q", "w").build();

        BatchReconciler.Reconciliation result =
                BatchReconciler.reconcile(consumer, messages("a", "b"), QueueResponse.EXCEPTION_RESPONSE);

        assertEquals(0, result.acked());
        assertEquals(2, result.toRetry().size());
    }

    @Test
    void exhaustedMessagesGoToDeadLetterQueue() {
        QueueConsumer consumer = QueueConsumer.builder("q", "w").maxRetries(1).deadLetterQueue("dlq").build();
        List<QueueMessage> batch = messages("old", "new");
        batch.get(0).incrementFailedAttempts();

        BatchReconciler.Reconciliation result =
                BatchReconciler.reconcile(consumer, batch, QueueResponse.retryAllMessages());

        assertEquals(List.of(batch.get(1)), result.toRetry());
        assertEquals(List.of(batch.get(0)), result.toDeadLetter());
        assertEquals(0, result.discarded());
        assertEquals(2, batch.get(0).failedAttempts());
    }

    @Test
    void exhaustedMessagesWithoutDeadLetterQueueAreDiscarded() {
        QueueConsumer consumer = QueueConsumer.builder("q", "w").maxRetries(0).build();

        BatchReconciler.Reconciliation result =
                BatchReconciler.reconcile(consumer, messages("a", "b"), QueueResponse.retryAllMessages());

        assertTrue(result.toRetry().isEmpty());
        assertTrue(result.toDeadLetter().isEmpty());
        assertEquals(2, result.discarded());
        assertEquals(2, result.failed());
    }
}
