package com.flagship.chain_webhooks.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.chain_webhooks.event.EventType;
import com.flagship.chain_webhooks.exception.MalformedPayloadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WebhookPayloadParserTest {

    private final WebhookPayloadParser parser = new WebhookPayloadParser(new ObjectMapper());

    private static byte[] json(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Provider payload is parsed with its opaque fields kept as data")
    void parsesProviderPayload() {
        WebhookPayload payload = parser.parse(json("""
            {"hash":"abc123","addresses":["bc1qtrade","bc1qother"],"total":150000,
             "confirmations":2,"received":"2024-05-01T10:00:00Z",
             "inputs":[{"addresses":["bc1qsender"]}],"outputs":[{"value":150000}]}
            """));

        assertEquals("abc123", payload.getTxHash());
        assertEquals(2, payload.getConfirmations());
        assertEquals(List.of("bc1qtrade", "bc1qother"), payload.getAddresses());
        assertNull(payload.getEventType());
        assertEquals(150000, payload.getData().get("total"));
        assertTrue(payload.getData().containsKey("inputs"));
        assertTrue(payload.getData().containsKey("addresses"));
        assertFalse(payload.getData().containsKey("hash"));
    }

    @Test
    @DisplayName("Explicit event_type wins over the finality depth")
    void explicitEventType() {
        WebhookPayload payload = parser.parse(json(
            "{\"hash\":\"h\",\"confirmations\":1,\"addresses\":[\"a\"],\"event_type\":\"final_confirmation\"}"));

        assertEquals(EventType.FINAL_CONFIRMATION, payload.getEventType());
        assertEquals(EventType.FINAL_CONFIRMATION, payload.resolveEventType(6));
    }

    @Test
    @DisplayName("Without event_type, reaching the finality depth means final confirmation")
    void derivedEventType() {
        WebhookPayload shallow = parser.parse(json("{\"hash\":\"h\",\"confirmations\":5,\"addresses\":[\"a\"]}"));
        WebhookPayload deep = parser.parse(json("{\"hash\":\"h\",\"confirmations\":6,\"addresses\":[\"a\"]}"));

        assertEquals(EventType.CONFIRMATION, shallow.resolveEventType(6));
        assertEquals(EventType.FINAL_CONFIRMATION, deep.resolveEventType(6));
    }

    @Test
    @DisplayName("Secret-looking keys are dropped from data, also when nested")
    void secretsStripped() {
        WebhookPayload payload = parser.parse(json("""
            {"hash":"h","confirmations":1,"addresses":["a"],
             "private_key":"L1xyz","meta":{"seed_phrase":"abandon","note":"ok"},
             "outputs":[{"wallet_secret":"s","value":1}]}
            """));

        Map<String, Object> data = payload.getData();
        assertFalse(data.containsKey("private_key"));
        @SuppressWarnings("unchecked")
        Map<String, Object> meta = (Map<String, Object>) data.get("meta");
        assertEquals(Map.of("note", "ok"), meta);
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> outputs = (List<Map<String, Object>>) data.get("outputs");
        assertEquals(Map.of("value", 1), outputs.get(0));
    }

    @Test
    @DisplayName("Secret keys are stripped inside arrays of arrays")
    void secretsStrippedInNestedArrays() {
        WebhookPayload payload = parser.parse(json("""
            {"hash":"0xabc","confirmations":1,"addresses":["a"],
             "inputs":[[{"private_key":"L1LEAKED","value":7}],[["xprv9s21"],{"n":{"mnemonic":"abandon"}}]]}
            """));

        Map<String, Object> data = payload.getData();
        assertEquals(List.of(
            List.of(Map.of("value", 7)),
            List.of(List.of("xprv9s21"), Map.of("n", Map.of()))
        ), data.get("inputs"));
        assertFalse(data.toString().contains("L1LEAKED"));
        assertFalse(data.toString().contains("abandon"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "not json",
        "[1,2,3]",
        "{\"confirmations\":1,\"addresses\":[\"a\"]}",
        "{\"hash\":\"\",\"confirmations\":1,\"addresses\":[\"a\"]}",
        "{\"hash\":\"h\",\"addresses\":[\"a\"]}",
        "{\"hash\":\"h\",\"confirmations\":-1,\"addresses\":[\"a\"]}",
        "{\"hash\":\"h\",\"confirmations\":\"3\",\"addresses\":[\"a\"]}",
        "{\"hash\":\"h\",\"confirmations\":1.5,\"addresses\":[\"a\"]}",
        "{\"hash\":\"h\",\"confirmations\":1}",
        "{\"hash\":\"h\",\"confirmations\":1,\"addresses\":[]}",
        "{\"hash\":\"h\",\"confirmations\":1,\"addresses\":[42]}",
        "{\"hash\":\"h\",\"confirmations\":1,\"addresses\":[\"a\"],\"event_type\":\"reorg\"}"
    })
    @DisplayName("Malformed payloads are rejected")
    void malformedRejected(String body) {
        assertThrows(MalformedPayloadException.class, () -> parser.parse(json(body)));
    }

    @Test
    @DisplayName("Null body is rejected")
    void nullBody() {
        assertThrows(MalformedPayloadException.class, () -> parser.parse(null));
    }
}
