package com.flagship.chain_webhooks.integration;

import com.flagship.chain_webhooks.dlq.DeadLetterEvent;
import com.flagship.chain_webhooks.dlq.DeadLetterStatus;
import com.flagship.chain_webhooks.dlq.DeadLetterStore;
import com.flagship.chain_webhooks.event.Event;
import com.flagship.chain_webhooks.event.EventType;
import com.flagship.chain_webhooks.event.Network;
import com.flagship.chain_webhooks.trade.Trade;
import com.flagship.chain_webhooks.trade.TradeStatus;
import com.flagship.chain_webhooks.trade.TradeStore;
import com.flagship.chain_webhooks.webhook.SignatureVerifier;
import com.flagship.chain_webhooks.webhook.TradeAddressResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Runs the whole service against PostgreSQL: webhook in, processor worker,
 * trade and dead letter tables out.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class WebhookPipelineIntegrationTest {

    private static final String SECRET = "integration-secret";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_chain_webhooks")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("webhook.secret", () -> SECRET);
        registry.add("processor.poll-timeout", () -> "100ms");
        registry.add("processor.retry.initial-delay", () -> "10ms");
        registry.add("processor.retry.max-delay", () -> "20ms");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private TradeStore tradeStore;

    @Autowired
    private DeadLetterStore deadLetterStore;

    @Autowired
    private TradeAddressResolver addressResolver;

    private String registerWallet(Network network, String address) {
        String tradeId = "T-" + UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO trade_wallets (trade_id, network, address) VALUES (?, ?, ?)",
            tradeId, network.name(), address);
        return tradeId;
    }

    private void deliver(String network, String body) throws Exception {
        String signature = SignatureVerifier.sign(body.getBytes(StandardCharsets.UTF_8), SECRET);
        mockMvc.perform(post("/webhooks/" + network)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Signature", signature)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("accepted"));
    }

    private static String btcBody(String txHash, int confirmations, String address) {
        return "{\"hash\":\"" + txHash + "\",\"confirmations\":" + confirmations
            + ",\"addresses\":[\"" + address + "\"],\"total\":150000}";
    }

    private static void await(String description, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(15);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for " + description);
            }
            Thread.sleep(50);
        }
    }

    private boolean tradeIs(String tradeId, TradeStatus status) {
        return tradeStore.findById(tradeId).map(t -> t.getStatus() == status).orElse(false);
    }

    @Nested
    @DisplayName("Webhook to trade state")
    class WebhookToTrade {

        @Test
        @DisplayName("Confirmations drive the trade from CONFIRMED to COMPLETED at finality depth")
        void confirmsAndCompletes() throws Exception {
            String address = "bc1q" + UUID.randomUUID().toString().replace("-", "");
            String tradeId = registerWallet(Network.BTC, address);
            String txHash = "tx-" + UUID.randomUUID();

            deliver("btc", btcBody(txHash, 3, address));
            await("trade confirmed", () -> tradeIs(tradeId, TradeStatus.CONFIRMED));

            deliver("btc", btcBody(txHash, 6, address));
            await("trade completed", () -> tradeIs(tradeId, TradeStatus.COMPLETED));

            Trade trade = tradeStore.findById(tradeId).orElseThrow();
            assertEquals(6, trade.getConfirmations());
            assertTrue(trade.isFinalConfirmationReceived());
            assertNotNull(trade.getConfirmedAt());
            assertNotNull(trade.getCompletedAt());
            assertEquals(2, trade.getEvents().size());
            assertEquals(EventType.FINAL_CONFIRMATION, trade.getEvents().get(1).getEventType());

            mockMvc.perform(get("/api/trades/{id}", tradeId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.events.length()").value(2));

            assertTrue(tradeStore.averageConfirmationTime().isPresent());
            assertTrue(tradeStore.findRecentlyUpdated(100).stream()
                .anyMatch(t -> t.getTradeId().equals(tradeId)));
            mockMvc.perform(get("/api/admin/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.average_confirmation_time_seconds").isNumber());
        }

        @Test
        @DisplayName("Redelivered webhook does not add a second history entry")
        void redeliveryIsIdempotent() throws Exception {
            String address = "bc1q" + UUID.randomUUID().toString().replace("-", "");
            String tradeId = registerWallet(Network.BTC, address);
            String body = btcBody("tx-" + UUID.randomUUID(), 3, address);

            deliver("btc", body);
            deliver("btc", body);

            // Single shard: once a later event is applied the redelivery has been processed too
            String markerAddress = "bc1q" + UUID.randomUUID().toString().replace("-", "");
            String markerTrade = registerWallet(Network.BTC, markerAddress);
            deliver("btc", btcBody("tx-" + UUID.randomUUID(), 1, markerAddress));
            await("marker processed", () -> tradeStore.findById(markerTrade).isPresent());

            Trade trade = tradeStore.findById(tradeId).orElseThrow();
            assertEquals(TradeStatus.CONFIRMED, trade.getStatus());
            assertEquals(1, trade.getEvents().size());
        }

        @Test
        @DisplayName("Ethereum addresses resolve case-insensitively")
        void ethAddressCaseInsensitive() {
            String address = "0xAbCdEf" + UUID.randomUUID().toString().replace("-", "");
            String tradeId = registerWallet(Network.ETH, address);

            assertEquals(Optional.of(tradeId), addressResolver.resolveTradeId(address.toLowerCase(), Network.ETH));
            assertEquals(Optional.empty(), addressResolver.resolveTradeId(address, Network.BTC));
        }
    }

    @Nested
    @DisplayName("Dead letter storage and replay")
    class DeadLetters {

        private Event failedEvent(String tradeId) {
            return Event.received(tradeId, Network.LTC, "tx-" + UUID.randomUUID(), 4,
                EventType.CONFIRMATION, Map.of("total", 42, "addresses", List.of("ltc1qdead")))
                .withRetryCount(5);
        }

        @Test
        @DisplayName("Recording the same event twice updates the entry in place")
        void upsertKeepsFirstFailure() {
            Event event = failedEvent("T-" + UUID.randomUUID());

            DeadLetterEvent first = deadLetterStore.record(event, "database unavailable", 5);
            DeadLetterEvent superseded = deadLetterStore.update(event.getEventId(), DeadLetterEvent::supersede);
            DeadLetterEvent second = deadLetterStore.record(event, "still unavailable", 5);

            assertEquals(DeadLetterStatus.SUPERSEDED, superseded.getStatus());
            assertEquals(DeadLetterStatus.UNRESOLVED, second.getStatus());
            assertEquals(1, second.getReplayCount());
            assertEquals("still unavailable", second.getErrorMessage());
            assertEquals(first.getFirstFailedAt().toEpochMilli(), second.getFirstFailedAt().toEpochMilli());
            assertEquals(event.getEventId(), second.getEvent().getEventId());
            assertEquals(42, second.getEvent().getData().get("total"));
        }

        @Test
        @DisplayName("Open entries are listed by network, most recent first")
        void listsOpenEntries() {
            Event older = failedEvent("T-" + UUID.randomUUID());
            Event newer = failedEvent("T-" + UUID.randomUUID());
            deadLetterStore.record(older, "boom", 5);
            deadLetterStore.record(newer, "boom", 5);
            deadLetterStore.update(older.getEventId(), entry -> entry.resolve("handled"));

            List<DeadLetterEvent> open = deadLetterStore.findOpen(Network.LTC, 500);

            assertTrue(open.stream().anyMatch(e -> e.getEventId().equals(newer.getEventId())));
            assertTrue(open.stream().noneMatch(e -> e.getEventId().equals(older.getEventId())));
            assertTrue(deadLetterStore.findOpen(Network.SOL, 500).stream()
                .noneMatch(e -> e.getEventId().equals(newer.getEventId())));
        }

        @Test
        @DisplayName("Replay through the admin API applies the event and resolves the entry")
        void replayResolves() throws Exception {
            String tradeId = "T-" + UUID.randomUUID();
            Event event = failedEvent(tradeId);
            deadLetterStore.record(event, "database unavailable", 5);

            mockMvc.perform(post("/api/admin/dlq/{id}/replay", event.getEventId()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("SUPERSEDED"));

            await("dead letter resolved", () -> deadLetterStore.findById(event.getEventId())
                .map(e -> e.getStatus() == DeadLetterStatus.RESOLVED).orElse(false));

            Trade trade = tradeStore.findById(tradeId).orElseThrow();
            assertEquals(TradeStatus.CONFIRMED, trade.getStatus());
            assertEquals(4, trade.getConfirmations());

            mockMvc.perform(post("/api/admin/dlq/{id}/replay", event.getEventId()))
                .andExpect(status().isConflict());
        }
    }
}
