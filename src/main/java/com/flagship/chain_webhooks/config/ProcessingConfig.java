package com.flagship.chain_webhooks.config;

import com.flagship.chain_webhooks.dlq.DeadLetterQueue;
import com.flagship.chain_webhooks.dlq.DeadLetterStore;
import com.flagship.chain_webhooks.event.EventQueue;
import com.flagship.chain_webhooks.observability.WebhookMetrics;
import com.flagship.chain_webhooks.processor.EventProcessor;
import com.flagship.chain_webhooks.processor.ProcessorSettings;
import com.flagship.chain_webhooks.processor.RetryExecutor;
import com.flagship.chain_webhooks.processor.RetryPolicy;
import com.flagship.chain_webhooks.processor.Sleeper;
import com.flagship.chain_webhooks.processor.TradeUpdateStep;
import com.flagship.chain_webhooks.trade.TradeConfirmationService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires the processing pipeline: queue, retry engine, dead letter queue and
 * the event processor.
 *
 * The processor is built explicitly here rather than discovered, so tests
 * can create isolated instances with their own queue and stores.
 * Set processor.enabled=false to keep the workers from starting.
 */
@Configuration
public class ProcessingConfig {

    @Bean
    public EventQueue eventQueue(@Value("${queue.capacity:1000}") int capacity,
                                 @Value("${queue.shards:1}") int shards) {
        return new EventQueue(capacity, shards);
    }

    @Bean
    public RetryPolicy retryPolicy(@Value("${processor.retry.max-attempts:5}") int maxAttempts,
                                   @Value("${processor.retry.initial-delay:2s}") Duration initialDelay,
                                   @Value("${processor.retry.max-delay:10s}") Duration maxDelay,
                                   @Value("${processor.retry.multiplier:2.0}") double multiplier,
                                   @Value("${processor.retry.jitter-factor:0.0}") double jitterFactor) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, multiplier, jitterFactor);
    }

    @Bean
    public RetryExecutor retryExecutor(RetryPolicy retryPolicy) {
        return new RetryExecutor(retryPolicy, Sleeper.THREAD);
    }

    @Bean
    public DeadLetterQueue deadLetterQueue(DeadLetterStore deadLetterStore,
                                           EventQueue eventQueue,
                                           WebhookMetrics webhookMetrics) {
        return new DeadLetterQueue(deadLetterStore, eventQueue, webhookMetrics);
    }

    @Bean
    public TradeUpdateStep tradeUpdateStep(TradeConfirmationService confirmationService,
                                           WebhookMetrics webhookMetrics) {
        return new TradeUpdateStep(confirmationService, webhookMetrics);
    }

    @Bean
    public EventProcessor eventProcessor(EventQueue eventQueue,
                                         TradeUpdateStep tradeUpdateStep,
                                         RetryExecutor retryExecutor,
                                         DeadLetterQueue deadLetterQueue,
                                         WebhookMetrics webhookMetrics,
                                         @Value("${processor.enabled:true}") boolean enabled,
                                         @Value("${processor.poll-timeout:1s}") Duration pollTimeout,
                                         @Value("${processor.drain-timeout:30s}") Duration drainTimeout,
                                         @Value("${processor.fail-trade-on-exhaustion:false}") boolean failTrade) {
        ProcessorSettings settings = new ProcessorSettings(pollTimeout, drainTimeout, failTrade);
        return new EventProcessor(eventQueue, tradeUpdateStep, retryExecutor, deadLetterQueue,
            webhookMetrics, settings, enabled);
    }
}
