package com.flagship.chain_webhooks.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.chain_webhooks.event.EventType;
import com.flagship.chain_webhooks.exception.MalformedPayloadException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parses and validates provider payloads.
 *
 * Required: hash (string), confirmations (non-negative integer), addresses
 * (non-empty array of strings). Optional: event_type. Everything else is
 * carried through as opaque data, minus any key that looks like key material.
 * Exception messages name the offending field only, never its value.
 */
@Component
@RequiredArgsConstructor
public class WebhookPayloadParser {

    static final String HASH = "hash";
    static final String CONFIRMATIONS = "confirmations";
    static final String ADDRESSES = "addresses";
    static final String EVENT_TYPE = "event_type";

    private static final Set<String> TYPED_FIELDS = Set.of(HASH, CONFIRMATIONS, EVENT_TYPE);
    private static final List<String> SECRET_KEY_MARKERS =
        List.of("private", "secret", "mnemonic", "seed", "password", "passphrase", "api_key", "apikey", "xprv");

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public WebhookPayload parse(byte[] rawBody) {
        if (rawBody == null || rawBody.length == 0) {
            throw new MalformedPayloadException("Empty body");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("Body is not valid JSON");
        } catch (IOException e) {
            throw new MalformedPayloadException("Body could not be read", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedPayloadException("Body must be a JSON object");
        }

        String txHash = requireHash(root);
        int confirmations = requireConfirmations(root);
        List<String> addresses = requireAddresses(root);
        EventType eventType = optionalEventType(root);

        return new WebhookPayload(txHash, confirmations, addresses, eventType, extractData(root));
    }

    private String requireHash(JsonNode root) {
        JsonNode hash = root.get(HASH);
        if (hash == null || !hash.isTextual() || hash.asText().isBlank()) {
            throw new MalformedPayloadException("Field 'hash' must be a non-empty string");
        }
        return hash.asText().trim();
    }

    private int requireConfirmations(JsonNode root) {
        JsonNode confirmations = root.get(CONFIRMATIONS);
        if (confirmations == null || !confirmations.isIntegralNumber() || !confirmations.canConvertToInt()) {
            throw new MalformedPayloadException("Field 'confirmations' must be an integer");
        }
        int value = confirmations.intValue();
        if (value < 0) {
            throw new MalformedPayloadException("Field 'confirmations' must not be negative");
        }
        return value;
    }

    private List<String> requireAddresses(JsonNode root) {
        JsonNode addresses = root.get(ADDRESSES);
        if (addresses == null || !addresses.isArray() || addresses.isEmpty()) {
            throw new MalformedPayloadException("Field 'addresses' must be a non-empty array");
        }
        List<String> result = new ArrayList<>(addresses.size());
        for (JsonNode address : addresses) {
            if (!address.isTextual() || address.asText().isBlank()) {
                throw new MalformedPayloadException("Field 'addresses' must contain only non-empty strings");
            }
            result.add(address.asText().trim());
        }
        return Collections.unmodifiableList(result);
    }

    private EventType optionalEventType(JsonNode root) {
        JsonNode eventType = root.get(EVENT_TYPE);
        if (eventType == null || eventType.isNull()) {
            return null;
        }
        if (!eventType.isTextual()) {
            throw new MalformedPayloadException("Field 'event_type' must be a string");
        }
        try {
            return EventType.fromWire(eventType.asText());
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException("Field 'event_type' must be confirmation or final_confirmation");
        }
    }

    private Map<String, Object> extractData(JsonNode root) {
        ObjectNode data = root.deepCopy();
        data.remove(TYPED_FIELDS);
        stripSecrets(data);
        return objectMapper.convertValue(data, MAP_TYPE);
    }

    /**
     * Removes secret-looking keys at any depth, including objects nested in
     * arrays of arrays.
     */
    static void stripSecrets(JsonNode node) {
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            List<String> secretKeys = new ArrayList<>();
            object.fieldNames().forEachRemaining(key -> {
                if (looksSecret(key)) {
                    secretKeys.add(key);
                }
            });
            object.remove(secretKeys);
            object.elements().forEachRemaining(WebhookPayloadParser::stripSecrets);
        } else if (node.isArray()) {
            node.elements().forEachRemaining(WebhookPayloadParser::stripSecrets);
        }
    }

    private static boolean looksSecret(String key) {
        String normalized = key.toLowerCase(Locale.ROOT);
        for (String marker : SECRET_KEY_MARKERS) {
            if (normalized.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
