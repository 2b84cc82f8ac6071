package queues.wire;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import queues.QueueIngressException;
import queues.model.ContentType;
import queues.model.MessageBody;
import queues.model.QueueMessage;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageCodecTest {
    private final MessageCodec codec = MessageCodec.getDefault();

    private static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static String base64(byte[] value) {
        return Base64.getEncoder().encodeToString(value);
    }

    // ── Bodies ──────────────────────────────────────────────────────

    @Test
    void decodesTextAsUtf8() {
        MessageBody body = codec.decodeBody(ContentType.TEXT, utf8("héllo"));

        assertEquals(MessageBody.text("héllo"), body);
    }

    @Test
    void decodesJsonIntoTree() {
        MessageBody body = codec.decodeBody(ContentType.JSON, utf8("{\"n\":1,\"tags\":[\"a\"]}"));

        JsonNode json = assertInstanceOf(MessageBody.Json.class, body).value();
        assertEquals(1, json.get("n").asInt());
        assertEquals("a", json.get("tags").get(0).asText());
    }

    @Test
    void rejectsMalformedJson() {
        QueueIngressException e = assertThrows(QueueIngressException.class, () ->
                codec.decodeBody(ContentType.JSON, utf8("{not json")));

        assertEquals(400, e.status());
    }

    @Test
    void rejectsEmptyJsonBody() {
        assertThrows(QueueIngressException.class, () -> codec.decodeBody(ContentType.JSON, new byte[0]));
    }

    @Test
    void rejectsTrailingJsonTokens() {
        assertThrows(QueueIngressException.class, () -> codec.decodeBody(ContentType.JSON, utf8("1 2")));
    }

    @Test
    void bytesAndOpaqueKeepRawContent() {
        byte[] raw = {0, 1, (byte) 0xff};

        MessageBody bytes = codec.decodeBody(ContentType.BYTES, raw);
        MessageBody opaque = codec.decodeBody(ContentType.OPAQUE, raw);

        assertArrayEquals(raw, assertInstanceOf(MessageBody.Bytes.class, bytes).value());
        assertArrayEquals(raw, assertInstanceOf(MessageBody.Opaque.class, opaque).serialized());
        assertEquals(ContentType.OPAQUE, opaque.contentType());
    }

    @Test
    void toJsonBodyMapsJavaValues() {
        MessageBody.Json body = codec.toJsonBody(Map.of("user", "ada"));

        assertEquals("{\"user\":\"ada\"}", new String(codec.encodeBody(body), StandardCharsets.UTF_8));
    }

    // ── Wire messages ───────────────────────────────────────────────

    @Test
    void decodeFillsMissingIdAndTimestamp() {
        QueueMessage message = codec.decode(new WireMessage(null, null, null, base64(utf8("x"))), 42L);

        assertNotNull(message.id());
        assertEquals(26, message.id().length());
        assertEquals(42L, message.timestamp());
        assertEquals(ContentType.OPAQUE, message.contentType());
    }

    @Test
    void decodeKeepsCarriedIdentity() {
        QueueMessage message = codec.decode(new WireMessage("m-1", 7L, "text", base64(utf8("x"))), 42L);

        assertEquals("m-1", message.id());
        assertEquals(7L, message.timestamp());
    }

    @Test
    void encodeCarriesIdentityAndContentType() {
        QueueMessage message = new QueueMessage("m-1", 7L, MessageBody.text("hi"));

        WireMessage wire = codec.encode(message);

        assertEquals("m-1", wire.id());
        assertEquals(7L, wire.timestamp());
        assertEquals("text", wire.contentType());
        assertEquals(base64(utf8("hi")), wire.body());
    }

    @Test
    void missingOrInvalidBodyIsRejected() {
        assertEquals(400, assertThrows(QueueIngressException.class, () ->
                codec.rawBody(new WireMessage(null, null, "text", null))).status());
        assertEquals(400, assertThrows(QueueIngressException.class, () ->
                codec.rawBody(new WireMessage(null, null, "text", "***"))).status());
    }

    @Test
    void unknownContentTypeIsRejected() {
        QueueIngressException e = assertThrows(QueueIngressException.class, () ->
                codec.decode(new WireMessage(null, null, "v8", base64(utf8("x"))), 0L));

        assertEquals(400, e.status());
    }

    // ── Batch documents ─────────────────────────────────────────────

    @Test
    void readsBatchRequest() {
        String json = "{\"messages\":[{\"contentType\":\"text\",\"body\":\"" + base64(utf8("a")) + "\"},"
                + "{\"id\":\"x\",\"timestamp\":5,\"body\":\"" + base64(utf8("b")) + "\"}]}";

        List<WireMessage> messages = codec.readBatchRequest(utf8(json));

        assertEquals(2, messages.size());
        assertEquals("text", messages.get(0).contentType());
        assertEquals("x", messages.get(1).id());
        assertEquals(5L, messages.get(1).timestamp());
    }

    @Test
    void writtenBatchOmitsNullFields() {
        byte[] json = codec.writeBatchRequest(List.of(new WireMessage(null, null, "text", "YQ==")));

        String text = new String(json, StandardCharsets.UTF_8);
        assertTrue(text.contains("\"contentType\":\"text\""));
        assertFalse(text.contains("\"id\""));
    }

    @Test
    void malformedBatchRequestIsRejected() {
        assertEquals(400, assertThrows(QueueIngressException.class, () ->
                codec.readBatchRequest(utf8("{\"messages\":"))).status());
        assertEquals(400, assertThrows(QueueIngressException.class, () ->
                codec.readBatchRequest(utf8("{}"))).status());
    }
}
