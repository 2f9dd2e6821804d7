package com.flagship.chain_webhooks.webhook;

import com.flagship.chain_webhooks.event.EventQueue;
import com.flagship.chain_webhooks.event.Network;
import com.flagship.chain_webhooks.observability.WebhookMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.hamcrest.Matchers.notNullValue;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP contract of the webhook endpoint, with the real verifier and parser
 * and a small real queue.
 */
@WebMvcTest(WebhookController.class)
@Import({
    WebhookIngestionService.class,
    WebhookAuthenticator.class,
    SignatureVerifier.class,
    WebhookPayloadParser.class,
    WebhookControllerTest.QueueConfig.class
})
@TestPropertySource(properties = "webhook.secret=" + WebhookControllerTest.SECRET)
class WebhookControllerTest {

    static final String SECRET = "controller-test-secret";
    private static final String BODY =
        "{\"hash\":\"abc123\",\"confirmations\":2,\"addresses\":[\"bc1qtrade\"],\"total\":150000}";

    @TestConfiguration
    static class QueueConfig {
        @Bean
        EventQueue eventQueue() {
            return new EventQueue(1, 1);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private EventQueue eventQueue;

    @MockBean
    private TradeAddressResolver addressResolver;

    @MockBean
    private WebhookMetrics webhookMetrics;

    @BeforeEach
    void setUp() {
        eventQueue.drain(0);
        when(addressResolver.resolveTradeId(anyString(), eq(Network.BTC))).thenReturn(Optional.empty());
        when(addressResolver.resolveTradeId("bc1qtrade", Network.BTC)).thenReturn(Optional.of("T1"));
    }

    private static String sign(String body) {
        return SignatureVerifier.sign(body.getBytes(StandardCharsets.UTF_8), SECRET);
    }

    @Test
    @DisplayName("Valid webhook returns 200 accepted and is queued")
    void accepted() throws Exception {
        mockMvc.perform(post("/webhooks/btc")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Signature", sign(BODY))
                .content(BODY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("accepted"))
            .andExpect(jsonPath("$.trade_id").value("T1"))
            .andExpect(jsonPath("$.event_id", notNullValue()))
            .andExpect(header().exists("X-Correlation-ID"));

        assertEquals(1, eventQueue.size());
    }

    @Test
    @DisplayName("Missing or wrong signature returns 401 and nothing is queued")
    void unauthorized() throws Exception {
        mockMvc.perform(post("/webhooks/btc")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("Invalid Signature"));

        String tampered = BODY.replace("\"confirmations\":2", "\"confirmations\":9");
        mockMvc.perform(post("/webhooks/btc")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Signature", sign(BODY))
                .content(tampered))
            .andExpect(status().isUnauthorized());

        assertEquals(0, eventQueue.size());
    }

    @Test
    @DisplayName("Malformed payload returns 400")
    void malformed() throws Exception {
        String body = "{\"hash\":\"abc123\",\"addresses\":[\"bc1qtrade\"]}";

        mockMvc.perform(post("/webhooks/btc")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Signature", sign(body))
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Malformed Payload"));
    }

    @Test
    @DisplayName("Unattributed transaction returns 200 unattributed")
    void unattributed() throws Exception {
        String body = "{\"hash\":\"abc123\",\"confirmations\":2,\"addresses\":[\"bc1qstranger\"]}";

        mockMvc.perform(post("/webhooks/btc")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Signature", sign(body))
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("unattributed"));

        assertEquals(0, eventQueue.size());
    }

    @Test
    @DisplayName("Full queue returns 503 with Retry-After")
    void queueFull() throws Exception {
        String signature = sign(BODY);
        mockMvc.perform(post("/webhooks/btc")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Signature", signature)
                .content(BODY))
            .andExpect(status().isOk());

        mockMvc.perform(post("/webhooks/btc")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Signature", signature)
                .content(BODY))
            .andExpect(status().isServiceUnavailable())
            .andExpect(header().exists("Retry-After"));
    }

    @Test
    @DisplayName("Unknown network returns 404")
    void unknownNetwork() throws Exception {
        mockMvc.perform(post("/webhooks/doge")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Signature", sign(BODY))
                .content(BODY))
            .andExpect(status().isNotFound());
    }
}
