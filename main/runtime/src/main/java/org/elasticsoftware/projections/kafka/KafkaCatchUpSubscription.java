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

package org.elasticsoftware.projections.kafka;

import jakarta.annotation.Nullable;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.AuthenticationException;
import org.apache.kafka.common.errors.AuthorizationException;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;
import org.elasticsoftware.projections.log.*;
import org.elasticsoftware.projections.util.HostUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.ConsumerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;

import static org.elasticsoftware.projections.log.SubscriptionDropReason.*;

final class KafkaCatchUpSubscription implements CatchUpSubscription, Runnable {
    private static final Logger logger = LoggerFactory.getLogger(KafkaCatchUpSubscription.class);
    private final ConsumerFactory<String, byte[]> consumerFactory;
    private final TopicPartition topicPartition;
    private final Position lastCheckpoint;
    private final CatchUpSubscriptionSettings settings;
    private final EventAppearedHandler eventAppeared;
    private final LiveProcessingStartedHandler liveProcessingStarted;
    private final SubscriptionDroppedHandler subscriptionDropped;
    private final AtomicReference<DropRequest> dropRequest = new AtomicReference<>();
    private volatile Consumer<String, byte[]> consumer;
    private boolean live = false;
    private long endOffset;

    KafkaCatchUpSubscription(ConsumerFactory<String, byte[]> consumerFactory,
                             TopicPartition topicPartition,
                             @Nullable Position lastCheckpoint,
                             CatchUpSubscriptionSettings settings,
                             EventAppearedHandler eventAppeared,
                             LiveProcessingStartedHandler liveProcessingStarted,
                             SubscriptionDroppedHandler subscriptionDropped) {
        this.consumerFactory = consumerFactory;
        this.topicPartition = topicPartition;
        this.lastCheckpoint = lastCheckpoint;
        this.settings = settings;
        this.eventAppeared = eventAppeared;
        this.liveProcessingStarted = liveProcessingStarted;
        this.subscriptionDropped = subscriptionDropped;
    }

    @Override
    public String getSubscriptionName() {
        return settings.subscriptionName();
    }

    @Override
    public void stop() {
        requestDrop(USER_INITIATED, null);
        Consumer<String, byte[]> current = consumer;
        if (current != null) {
            current.wakeup();
        }
    }

    @Override
    public void run() {
        try {
            Properties properties = new Properties();
            properties.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, Integer.toString(settings.readBatchSize()));
            properties.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
            this.consumer = consumerFactory.createConsumer(
                    settings.subscriptionName() + "Projection",
                    settings.subscriptionName() + "Projection-" + HostUtils.getHostName(),
                    null,
                    properties);
        } catch (RuntimeException e) {
            logger.error("Unable to create consumer for {} subscription", getSubscriptionName(), e);
            requestDrop(SUBSCRIBING_ERROR, e);
            subscriptionDropped.subscriptionDropped(this, SUBSCRIBING_ERROR, e);
            return;
        }
        try {
            consumer.assign(List.of(topicPartition));
            if (lastCheckpoint == null) {
                consumer.seekToBeginning(List.of(topicPartition));
            } else {
                consumer.seek(topicPartition, lastCheckpoint.commitPosition() + 1);
            }
            endOffset = consumer.endOffsets(List.of(topicPartition)).getOrDefault(topicPartition, 0L);
            logger.info("{} subscription catching up on {} until offset {}", getSubscriptionName(), topicPartition, endOffset);
            while (dropRequest.get() == null) {
                if (!live && consumer.position(topicPartition) >= endOffset) {
                    goLive();
                }
                ConsumerRecords<String, byte[]> records = consumer.poll(Duration.ofMillis(100));
                if (settings.verboseLogging() && !records.isEmpty()) {
                    logger.trace("{} polled {} records", getSubscriptionName(), records.count());
                }
                for (ConsumerRecord<String, byte[]> record : records.records(topicPartition)) {
                    if (!deliver(record)) {
                        break;
                    }
                }
            }
        } catch (WakeupException e) {
            // stop() interrupts the poll
            requestDrop(USER_INITIATED, null);
        } catch (InterruptException e) {
            requestDrop(CONNECTION_CLOSED, e);
        } catch (AuthenticationException e) {
            requestDrop(NOT_AUTHENTICATED, e);
        } catch (AuthorizationException e) {
            requestDrop(ACCESS_DENIED, e);
        } catch (KafkaException e) {
            requestDrop(live ? SERVER_ERROR : CATCH_UP_ERROR, e);
        } catch (Throwable t) {
            requestDrop(SERVER_ERROR, t);
        } finally {
            try {
                consumer.close(Duration.ofSeconds(5));
            } catch (InterruptException e) {
                Thread.currentThread().interrupt();
            } catch (KafkaException e) {
                logger.error("Error closing consumer of {} subscription", getSubscriptionName(), e);
            }
        }
        requestDrop(SERVER_ERROR, null);
        DropRequest drop = dropRequest.get();
        subscriptionDropped.subscriptionDropped(this, drop.reason(), drop.cause());
    }

    private void goLive() {
        live = true;
        logger.info("{} subscription reached offset {} on {}, processing live", getSubscriptionName(), endOffset, topicPartition);
        liveProcessingStarted.liveProcessingStarted(this);
    }

    private boolean deliver(ConsumerRecord<String, byte[]> record) {
        if (dropRequest.get() != null) {
            return false;
        }
        try {
            eventAppeared.eventAppeared(this, KafkaRecordHeaders.toRecordedEvent(record));
        } catch (Throwable t) {
            requestDrop(EVENT_HANDLER_EXCEPTION, t);
            return false;
        }
        if (!live && record.offset() + 1 >= endOffset) {
            goLive();
        }
        return true;
    }

    private void requestDrop(SubscriptionDropReason reason, @Nullable Throwable cause) {
        dropRequest.compareAndSet(null, new DropRequest(reason, cause));
    }

    private record DropRequest(SubscriptionDropReason reason, @Nullable Throwable cause) {
    }
}
