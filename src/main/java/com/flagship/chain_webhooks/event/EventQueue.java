package com.flagship.chain_webhooks.event;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded in-memory FIFO between the webhook receiver and the event processor.
 *
 * The queue is split into shards by trade id hash. Each shard is consumed by
 * exactly one worker, so all events of one trade are applied by a single
 * thread in arrival order. With one shard (the default) this is a plain
 * global FIFO.
 *
 * Producers never block: {@link #offer(Event)} returns false when the target
 * shard is full and the caller turns that into a backpressure response.
 * Contents are not durable; on restart the queue is empty.
 */
@Slf4j
public class EventQueue {

    private final List<BlockingQueue<Event>> shards;
    private final int capacity;

    public EventQueue(int capacity, int shardCount) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be at least 1: " + capacity);
        }
        if (shardCount < 1 || shardCount > capacity) {
            throw new IllegalArgumentException(
                "Shard count must be between 1 and the queue capacity (" + capacity + "): " + shardCount);
        }
        this.capacity = capacity;
        this.shards = new ArrayList<>(shardCount);
        int perShard = capacity / shardCount;
        int remainder = capacity % shardCount;
        for (int i = 0; i < shardCount; i++) {
            shards.add(new ArrayBlockingQueue<>(perShard + (i < remainder ? 1 : 0)));
        }
        log.info("Event queue created: capacity={}, shards={}", capacity, shardCount);
    }

    /**
     * Enqueues without blocking.
     *
     * @return false if the event's shard is at capacity
     */
    public boolean offer(Event event) {
        return shards.get(shardFor(event.getTradeId())).offer(event);
    }

    /**
     * Waits up to the timeout for the next event of a shard.
     *
     * @return the next event, or null if none arrived in time
     */
    public Event poll(int shard, Duration timeout) throws InterruptedException {
        return shards.get(shard).poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Removes and returns everything still queued in a shard.
     */
    public List<Event> drain(int shard) {
        List<Event> remaining = new ArrayList<>();
        shards.get(shard).drainTo(remaining);
        return remaining;
    }

    public int shardFor(String tradeId) {
        if (shards.size() == 1 || tradeId == null) {
            return 0;
        }
        return Math.floorMod(tradeId.hashCode(), shards.size());
    }

    public int size() {
        int total = 0;
        for (BlockingQueue<Event> shard : shards) {
            total += shard.size();
        }
        return total;
    }

    public int capacity() {
        return capacity;
    }

    public int shardCount() {
        return shards.size();
    }
}
