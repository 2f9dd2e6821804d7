package com.flagship.chain_webhooks.processor;

import com.flagship.chain_webhooks.dlq.DeadLetterQueue;
import com.flagship.chain_webhooks.event.Event;
import com.flagship.chain_webhooks.event.EventQueue;
import com.flagship.chain_webhooks.observability.CorrelationContext;
import com.flagship.chain_webhooks.observability.WebhookMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background worker that drains the {@link EventQueue} and applies events to
 * trades.
 *
 * One worker thread per queue shard, so events of one trade are applied
 * one at a time and in arrival order. For each event:
 * - the trade update is attempted through the {@link RetryExecutor}
 * - on success, a replayed event closes its dead letter entry
 * - on exhaustion, the event goes to the {@link DeadLetterQueue} and,
 *   if configured, its trade is marked FAILED
 * A failed event never stops the worker.
 *
 * {@link #stop()} lets every worker finish the event it is working on, then
 * moves whatever is still queued to the dead letter queue, so an accepted
 * event ends up either applied or dead lettered.
 */
@Slf4j
public class EventProcessor implements SmartLifecycle {

    static final String STOPPED_BEFORE_PROCESSING = "processor stopped before event was processed";

    private final EventQueue queue;
    private final TradeUpdateStep updateStep;
    private final RetryExecutor retryExecutor;
    private final DeadLetterQueue deadLetterQueue;
    private final WebhookMetrics metrics;
    private final ProcessorSettings settings;
    private final boolean autoStartup;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final List<Thread> workers = new ArrayList<>();

    public EventProcessor(EventQueue queue,
                          TradeUpdateStep updateStep,
                          RetryExecutor retryExecutor,
                          DeadLetterQueue deadLetterQueue,
                          WebhookMetrics metrics,
                          ProcessorSettings settings,
                          boolean autoStartup) {
        this.queue = queue;
        this.updateStep = updateStep;
        this.retryExecutor = retryExecutor;
        this.deadLetterQueue = deadLetterQueue;
        this.metrics = metrics;
        this.settings = settings;
        this.autoStartup = autoStartup;
    }

    @Override
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        workers.clear();
        for (int shard = 0; shard < queue.shardCount(); shard++) {
            final int assignedShard = shard;
            Thread worker = new Thread(() -> runWorker(assignedShard), "event-processor-" + shard);
            worker.setDaemon(false);
            workers.add(worker);
            worker.start();
        }
        log.info("Event processor started with {} worker(s), retry schedule {}",
            workers.size(), retryExecutor.getPolicy().schedule());
    }

    @Override
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping event processor, waiting up to {} for in-flight events", settings.getDrainTimeout());

        long deadline = System.nanoTime() + settings.getDrainTimeout().toNanos();
        for (Thread worker : workers) {
            joinUntil(worker, deadline);
        }
        for (Thread worker : workers) {
            if (worker.isAlive()) {
                log.warn("Worker {} still busy after drain timeout, interrupting", worker.getName());
                worker.interrupt();
                joinUntil(worker, System.nanoTime() + Duration.ofSeconds(5).toNanos());
            }
        }

        int moved = deadLetterRemaining();
        workers.clear();
        log.info("Event processor stopped ({} queued event(s) moved to dead letter queue)", moved);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    /**
     * Stops after the web server, so no new events arrive while draining.
     */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 4096;
    }

    private void runWorker(int shard) {
        log.debug("Worker for shard {} started", shard);
        while (running.get()) {
            Event event;
            try {
                event = queue.poll(shard, settings.getPollTimeout());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (event != null) {
                process(event);
            }
        }
        log.debug("Worker for shard {} exiting", shard);
    }

    /**
     * Processes one event to completion: applied, or dead lettered.
     * Package-private so tests can drive the processor without threads.
     */
    void process(Event event) {
        String network = event.getNetwork().pathName();
        CorrelationContext.putEvent(event.getEventId(), event.getTradeId(), network);
        long startNanos = System.nanoTime();
        try {
            log.info("Processing event: type={}, confirmations={}, replay={}",
                event.getEventType().wireName(), event.getConfirmationCount(), event.isReplay());

            RetryOutcome outcome = retryExecutor.execute(
                "Apply event " + event.getEventId(), () -> updateStep.apply(event));

            if (outcome.isSucceeded()) {
                boolean duplicate = outcome.getFinalResult().isDuplicate();
                metrics.recordProcessed(network, duplicate ? "duplicate" : "applied");
                if (event.isReplay()) {
                    closeReplayedDeadLetter(event);
                }
                return;
            }

            // Clear a pending interrupt so the dead letter write can still run
            boolean interrupted = Thread.interrupted() || outcome.isInterrupted();
            deadLetter(event.withRetryCount(outcome.getAttempts()), outcome.getLastError());
            if (settings.isFailTradeOnExhaustion()) {
                updateStep.markTradeFailed(event.getTradeId(),
                    "Event " + event.getEventId() + " failed after " + outcome.getAttempts() + " attempts: "
                        + outcome.getLastError());
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        } finally {
            metrics.recordProcessingLatency(network, Duration.ofNanos(System.nanoTime() - startNanos));
            CorrelationContext.clearEvent();
        }
    }

    private void deadLetter(Event event, String error) {
        RetryOutcome outcome = retryExecutor.execute("Dead letter event " + event.getEventId(), () -> {
            deadLetterQueue.add(event, error, event.getRetryCount());
            return ProcessingResult.success();
        });
        if (outcome.isSucceeded()) {
            metrics.recordDeadLettered(event.getNetwork().pathName());
        } else {
            log.error("EVENT NOT PERSISTED: could not write to dead letter queue ({}). Event: {}. Processing error: {}",
                outcome.getLastError(), event, error);
        }
    }

    private void closeReplayedDeadLetter(Event event) {
        try {
            deadLetterQueue.markReplaySucceeded(event.getEventId());
        } catch (Exception e) {
            log.warn("Replayed event applied but its dead letter entry could not be closed: {}", e.getMessage());
        }
    }

    private int deadLetterRemaining() {
        int moved = 0;
        for (int shard = 0; shard < queue.shardCount(); shard++) {
            for (Event event : queue.drain(shard)) {
                CorrelationContext.putEvent(event.getEventId(), event.getTradeId(), event.getNetwork().pathName());
                try {
                    deadLetter(event, STOPPED_BEFORE_PROCESSING);
                    moved++;
                } finally {
                    CorrelationContext.clearEvent();
                }
            }
        }
        return moved;
    }

    private static void joinUntil(Thread worker, long deadlineNanos) {
        long remainingMillis = Duration.ofNanos(deadlineNanos - System.nanoTime()).toMillis();
        if (remainingMillis <= 0) {
            return;
        }
        try {
            worker.join(remainingMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
