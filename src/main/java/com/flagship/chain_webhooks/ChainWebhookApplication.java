package com.flagship.chain_webhooks;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the blockchain confirmation webhook processor.
 *
 * Pipeline: webhook receiver -> bounded event queue -> event processor
 * -> trade store, with a dead letter queue for events that exhaust retries.
 */
@SpringBootApplication
@EnableScheduling
public class ChainWebhookApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChainWebhookApplication.class, args);
    }
}
