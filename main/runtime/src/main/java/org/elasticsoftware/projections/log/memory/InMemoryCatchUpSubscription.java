/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.projections.log.memory;

import jakarta.annotation.Nullable;
import org.elasticsoftware.projections.log.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

final class InMemoryCatchUpSubscription implements CatchUpSubscription, Runnable {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryCatchUpSubscription.class);
    private final InMemoryEventLog eventLog;
    private final CatchUpSubscriptionSettings settings;
    private final EventAppearedHandler eventAppeared;
    private final LiveProcessingStartedHandler liveProcessingStarted;
    private final SubscriptionDroppedHandler subscriptionDropped;
    private final BlockingQueue<RecordedEvent> liveQueue;
    private final AtomicReference<DropRequest> dropRequest = new AtomicReference<>();
    private Position lastPosition;

    InMemoryCatchUpSubscription(InMemoryEventLog eventLog,
                                @Nullable Position lastCheckpoint,
                                CatchUpSubscriptionSettings settings,
                                EventAppearedHandler eventAppeared,
                                LiveProcessingStartedHandler liveProcessingStarted,
                                SubscriptionDroppedHandler subscriptionDropped) {
        this.eventLog = eventLog;
        this.lastPosition = lastCheckpoint;
        this.settings = settings;
        this.eventAppeared = eventAppeared;
        this.liveProcessingStarted = liveProcessingStarted;
        this.subscriptionDropped = subscriptionDropped;
        this.liveQueue = new ArrayBlockingQueue<>(settings.maxLiveQueueSize());
    }

    @Override
    public String getSubscriptionName() {
        return settings.subscriptionName();
    }

    @Override
    public void stop() {
        requestDrop(SubscriptionDropReason.USER_INITIATED, null);
    }

    @Override
    public void run() {
        try {
            if (catchUp()) {
                liveProcessingStarted.liveProcessingStarted(this);
                while (dropRequest.get() == null) {
                    RecordedEvent record = liveQueue.poll(100, TimeUnit.MILLISECONDS);
                    if (record != null) {
                        deliver(record);
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            requestDrop(SubscriptionDropReason.CONNECTION_CLOSED, e);
        } catch (Throwable t) {
            requestDrop(SubscriptionDropReason.SERVER_ERROR, t);
        } finally {
            eventLog.unsubscribe(this);
            // no-op when a drop was already requested
            requestDrop(SubscriptionDropReason.SERVER_ERROR, null);
            DropRequest drop = dropRequest.get();
            if (settings.verboseLogging()) {
                logger.trace("{} subscription dropped ({})", getSubscriptionName(), drop.reason());
            }
            subscriptionDropped.subscriptionDropped(this, drop.reason(), drop.cause());
        }
    }

    /**
     * @return true when the subscription switched to live processing, false when it was dropped while catching up
     */
    private boolean catchUp() {
        while (dropRequest.get() == null) {
            List<RecordedEvent> batch = eventLog.readAfter(lastPosition, settings.readBatchSize());
            if (batch.isEmpty()) {
                if (eventLog.goLive(this, lastPosition)) {
                    return true;
                }
                continue;
            }
            if (settings.verboseLogging()) {
                logger.trace("{} read {} records after {}", getSubscriptionName(), batch.size(), lastPosition);
            }
            for (RecordedEvent record : batch) {
                if (!deliver(record)) {
                    return false;
                }
            }
        }
        return false;
    }

    private boolean deliver(RecordedEvent record) {
        if (dropRequest.get() != null) {
            return false;
        }
        try {
            eventAppeared.eventAppeared(this, record);
            lastPosition = record.position();
            return true;
        } catch (Throwable t) {
            requestDrop(SubscriptionDropReason.EVENT_HANDLER_EXCEPTION, t);
            return false;
        }
    }

    void enqueue(RecordedEvent record) {
        if (!liveQueue.offer(record)) {
            logger.warn("{} live queue exceeded {} records", getSubscriptionName(), settings.maxLiveQueueSize());
            requestDrop(SubscriptionDropReason.PROCESSING_QUEUE_OVERFLOW, null);
        }
    }

    void requestDrop(SubscriptionDropReason reason, @Nullable Throwable cause) {
        dropRequest.compareAndSet(null, new DropRequest(reason, cause));
    }

    private record DropRequest(SubscriptionDropReason reason, @Nullable Throwable cause) {
    }
}
