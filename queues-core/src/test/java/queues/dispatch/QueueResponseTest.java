package queues.dispatch;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueueResponseTest {

    @Test
    void okAcknowledgesAll() {
        QueueResponse response = QueueResponse.ok();

        assertTrue(response.isOk());
        assertTrue(response.ackAll());
        assertFalse(response.shouldRetryAll());
    }

    @Test
    void anyOtherOutcomeRetriesAll() {
        assertTrue(QueueResponse.EXCEPTION_RESPONSE.shouldRetryAll());
        assertTrue(new QueueResponse("timeout", false, true, List.of(), List.of()).shouldRetryAll());
    }

    @Test
    void listsAreCopied() {
        List<String> ids = new ArrayList<>(List.of("a"));
        QueueResponse response = QueueResponse.retry(ids);
        ids.add("b");

        assertEquals(List.of("a"), response.explicitRetries());
    }

    @Test
    void nullOutcomeRejected() {
        assertThrows(NullPointerException.class, () ->
                new QueueResponse(null, false, false, List.of(), List.of()));
    }
}
