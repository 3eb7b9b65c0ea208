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
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * An append-only event log held in memory. Every subscription runs on its own thread, reads the log in batches
 * while catching up and switches to a bounded live queue once it has read the last record.
 */
public class InMemoryEventLog implements EventLogConnection, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventLog.class);
    private final List<RecordedEvent> records = new ArrayList<>();
    private final Map<String, Long> streamVersions = new HashMap<>();
    private final Set<InMemoryCatchUpSubscription> subscriptions = new HashSet<>();
    private final Set<InMemoryCatchUpSubscription> liveSubscriptions = new HashSet<>();
    private final ExecutorService executorService = Executors.newCachedThreadPool(new CustomizableThreadFactory("InMemoryEventLogThread-"));
    private final long positionIncrement;

    public InMemoryEventLog() {
        this(1L);
    }

    /**
     * @param positionIncrement the distance between the global positions of two consecutive records
     */
    public InMemoryEventLog(long positionIncrement) {
        if (positionIncrement <= 0) {
            throw new IllegalArgumentException("positionIncrement should be positive");
        }
        this.positionIncrement = positionIncrement;
    }

    public RecordedEvent append(String streamId, String eventType, byte[] data) {
        return append(streamId, eventType, data, null);
    }

    public synchronized RecordedEvent append(String streamId, String eventType, byte[] data, @Nullable byte[] metadata) {
        long eventNumber = streamVersions.merge(streamId, 0L, (current, ignored) -> current + 1);
        RecordedEvent record = new RecordedEvent(
                streamId,
                eventNumber,
                UUID.randomUUID(),
                eventType,
                data,
                metadata,
                Position.of((records.size() + 1) * positionIncrement));
        records.add(record);
        for (InMemoryCatchUpSubscription subscription : liveSubscriptions) {
            subscription.enqueue(record);
        }
        return record;
    }

    public synchronized List<RecordedEvent> getRecords() {
        return List.copyOf(records);
    }

    @Override
    public synchronized CatchUpSubscription subscribeToAllFrom(@Nullable Position lastCheckpoint,
                                                               CatchUpSubscriptionSettings settings,
                                                               EventAppearedHandler eventAppeared,
                                                               LiveProcessingStartedHandler liveProcessingStarted,
                                                               SubscriptionDroppedHandler subscriptionDropped) {
        InMemoryCatchUpSubscription subscription = new InMemoryCatchUpSubscription(
                this,
                lastCheckpoint,
                settings,
                eventAppeared,
                liveProcessingStarted,
                subscriptionDropped);
        subscriptions.add(subscription);
        executorService.execute(subscription);
        return subscription;
    }

    /**
     * Drops every open subscription with {@link SubscriptionDropReason#CONNECTION_CLOSED}.
     */
    public synchronized void disconnect() {
        logger.info("Disconnecting {} subscriptions", subscriptions.size());
        for (InMemoryCatchUpSubscription subscription : subscriptions) {
            subscription.requestDrop(SubscriptionDropReason.CONNECTION_CLOSED, null);
        }
    }

    @Override
    public void close() {
        disconnect();
        executorService.shutdown();
        try {
            if (executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.info("InMemoryEventLog has been shutdown");
            } else {
                logger.warn("InMemoryEventLog did not shutdown within 10 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    synchronized List<RecordedEvent> readAfter(@Nullable Position position, int maxCount) {
        int from = position == null ? 0 : indexAfter(position);
        int to = Math.min(records.size(), from + maxCount);
        return from >= to ? List.of() : List.copyOf(records.subList(from, to));
    }

    /**
     * Registers the subscription for live delivery when nothing was appended after the given position.
     */
    synchronized boolean goLive(InMemoryCatchUpSubscription subscription, @Nullable Position position) {
        int from = position == null ? 0 : indexAfter(position);
        if (from < records.size()) {
            return false;
        }
        liveSubscriptions.add(subscription);
        return true;
    }

    synchronized void unsubscribe(InMemoryCatchUpSubscription subscription) {
        liveSubscriptions.remove(subscription);
        subscriptions.remove(subscription);
    }

    private int indexAfter(Position position) {
        int low = 0;
        int high = records.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (records.get(mid).position().isAfter(position)) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }
}
