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
import org.apache.kafka.common.TopicPartition;
import org.elasticsoftware.projections.log.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Reads the global event log from a single Kafka partition. Every subscription gets its own consumer and
 * thread. The live queue size of the settings is not used, the consumer fetches at most
 * {@link CatchUpSubscriptionSettings#readBatchSize()} records per poll in both phases.
 */
public class KafkaEventLogConnection implements EventLogConnection, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(KafkaEventLogConnection.class);
    private final ConsumerFactory<String, byte[]> consumerFactory;
    private final TopicPartition topicPartition;
    private final ExecutorService executorService = Executors.newCachedThreadPool(new CustomizableThreadFactory("KafkaEventLogThread-"));
    private final Set<KafkaCatchUpSubscription> subscriptions = ConcurrentHashMap.newKeySet();

    public KafkaEventLogConnection(ConsumerFactory<String, byte[]> consumerFactory, String topic) {
        this(consumerFactory, new TopicPartition(topic, 0));
    }

    public KafkaEventLogConnection(ConsumerFactory<String, byte[]> consumerFactory, TopicPartition topicPartition) {
        this.consumerFactory = consumerFactory;
        this.topicPartition = topicPartition;
    }

    public TopicPartition getTopicPartition() {
        return topicPartition;
    }

    @Override
    public CatchUpSubscription subscribeToAllFrom(@Nullable Position lastCheckpoint,
                                                  CatchUpSubscriptionSettings settings,
                                                  EventAppearedHandler eventAppeared,
                                                  LiveProcessingStartedHandler liveProcessingStarted,
                                                  SubscriptionDroppedHandler subscriptionDropped) {
        KafkaCatchUpSubscription subscription = new KafkaCatchUpSubscription(
                consumerFactory,
                topicPartition,
                lastCheckpoint,
                settings,
                eventAppeared,
                liveProcessingStarted,
                (s, reason, cause) -> {
                    subscriptions.remove((KafkaCatchUpSubscription) s);
                    subscriptionDropped.subscriptionDropped(s, reason, cause);
                });
        subscriptions.add(subscription);
        logger.info("Subscribing {} to {} from {}", settings.subscriptionName(), topicPartition,
                lastCheckpoint != null ? lastCheckpoint : "the beginning");
        executorService.execute(subscription);
        return subscription;
    }

    @Override
    public void close() {
        subscriptions.forEach(KafkaCatchUpSubscription::stop);
        executorService.shutdown();
        try {
            if (executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.info("KafkaEventLogConnection has been shutdown");
            } else {
                logger.warn("KafkaEventLogConnection did not shutdown within 10 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
