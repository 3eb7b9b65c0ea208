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

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.AuthenticationException;
import org.apache.kafka.common.errors.TopicAuthorizationException;
import org.apache.kafka.common.record.TimestampType;
import org.elasticsoftware.projections.log.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.ConsumerFactory;

import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class KafkaEventLogConnectionTest {
    private static final String TOPIC = "EventLog";
    private static final TopicPartition PARTITION = new TopicPartition(TOPIC, 0);

    private ConsumerFactory<String, byte[]> consumerFactory;
    private MockConsumer<String, byte[]> consumer;
    private KafkaEventLogConnection connection;
    private final List<String> observed = new CopyOnWriteArrayList<>();
    private final List<RecordedEvent> received = new CopyOnWriteArrayList<>();
    private final CompletableFuture<SubscriptionDropReason> dropReason = new CompletableFuture<>();

    @SuppressWarnings("unchecked")
    @BeforeEach
    void setUp() {
        consumerFactory = mock(ConsumerFactory.class);
        consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        consumer.updateBeginningOffsets(Map.of(PARTITION, 0L));
        when(consumerFactory.createConsumer(anyString(), anyString(), isNull(), any(Properties.class))).thenReturn(consumer);
        connection = new KafkaEventLogConnection(consumerFactory, TOPIC);
    }

    @AfterEach
    void tearDown() {
        connection.close();
    }

    private static ConsumerRecord<String, byte[]> record(long offset, String streamId, String eventType, long eventNumber) {
        return new ConsumerRecord<>(
                TOPIC,
                0,
                offset,
                System.currentTimeMillis(),
                TimestampType.CREATE_TIME,
                -1,
                -1,
                streamId,
                "{}".getBytes(StandardCharsets.UTF_8),
                KafkaRecordHeaders.create(eventType, UUID.randomUUID(), eventNumber, "{\"IsSnapshot\":false}".getBytes(StandardCharsets.UTF_8)),
                Optional.empty());
    }

    private CatchUpSubscription subscribe(Position lastCheckpoint, EventAppearedHandler handler) {
        return connection.subscribeToAllFrom(
                lastCheckpoint,
                new CatchUpSubscriptionSettings(10000, 500, false, false, "WalletBalances"),
                handler,
                subscription -> observed.add("live"),
                (subscription, reason, cause) -> {
                    observed.add("dropped:" + reason);
                    dropReason.complete(reason);
                });
    }

    private CatchUpSubscription subscribe(Position lastCheckpoint) {
        return subscribe(lastCheckpoint, (subscription, record) -> {
            received.add(record);
            observed.add(Long.toString(record.position().commitPosition()));
        });
    }

    @Test
    void testCatchUpFromCheckpointThenLive() throws Exception {
        consumer.updateEndOffsets(Map.of(PARTITION, 4L));
        consumer.schedulePollTask(() -> {
            for (long offset = 0; offset < 4; offset++) {
                consumer.addRecord(record(offset, "wallet-1", "WalletCredited", offset));
            }
        });
        CatchUpSubscription subscription = subscribe(Position.of(1));

        await().atMost(5, SECONDS).until(() -> observed.contains("live"));
        consumer.schedulePollTask(() -> consumer.addRecord(record(4, "wallet-2", "WalletCreated", 0)));
        await().atMost(5, SECONDS).until(() -> observed.contains("4"));

        subscription.stop();
        assertEquals(SubscriptionDropReason.USER_INITIATED, dropReason.get(5, SECONDS));
        assertEquals(List.of("2", "3", "live", "4", "dropped:USER_INITIATED"), observed);
        RecordedEvent live = received.get(2);
        assertEquals("wallet-2", live.streamId());
        assertEquals("WalletCreated", live.eventType());
        assertEquals(0, live.eventNumber());
        assertEquals(Position.of(4), live.position());
        assertTrue(consumer.closed());

        ArgumentCaptor<Properties> properties = ArgumentCaptor.forClass(Properties.class);
        verify(consumerFactory).createConsumer(eq("WalletBalancesProjection"), anyString(), isNull(), properties.capture());
        assertEquals("500", properties.getValue().get(ConsumerConfig.MAX_POLL_RECORDS_CONFIG));
        assertEquals("false", properties.getValue().get(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG));
    }

    @Test
    void testEmptyTopicGoesLiveImmediately() throws Exception {
        consumer.updateEndOffsets(Map.of(PARTITION, 0L));
        CatchUpSubscription subscription = subscribe(null);

        await().atMost(5, SECONDS).until(() -> observed.contains("live"));
        subscription.stop();
        dropReason.get(5, SECONDS);
        assertTrue(received.isEmpty());
    }

    @Test
    void testHandlerExceptionDropsSubscription() throws Exception {
        consumer.updateEndOffsets(Map.of(PARTITION, 1L));
        consumer.schedulePollTask(() -> consumer.addRecord(record(0, "wallet-1", "WalletCreated", 0)));
        subscribe(null, (subscription, record) -> {
            throw new IllegalStateException("cannot project");
        });

        assertEquals(SubscriptionDropReason.EVENT_HANDLER_EXCEPTION, dropReason.get(5, SECONDS));
        assertFalse(observed.contains("live"));
    }

    @Test
    void testErrorInHandlerDropsSubscription() throws Exception {
        consumer.updateEndOffsets(Map.of(PARTITION, 1L));
        consumer.schedulePollTask(() -> consumer.addRecord(record(0, "wallet-1", "WalletCreated", 0)));
        subscribe(null, (subscription, record) -> {
            throw new StackOverflowError();
        });

        assertEquals(SubscriptionDropReason.EVENT_HANDLER_EXCEPTION, dropReason.get(5, SECONDS));
        await().atMost(5, SECONDS).until(consumer::closed);
    }

    @Test
    void testRecordWithoutEventTypeDropsSubscription() throws Exception {
        consumer.updateEndOffsets(Map.of(PARTITION, 1L));
        consumer.schedulePollTask(() -> consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 0L, "wallet-1", new byte[0])));
        subscribe(null);

        assertEquals(SubscriptionDropReason.EVENT_HANDLER_EXCEPTION, dropReason.get(5, SECONDS));
    }

    @Test
    void testKafkaExceptionWhileCatchingUp() throws Exception {
        consumer.updateEndOffsets(Map.of(PARTITION, 10L));
        consumer.setPollException(new KafkaException("broker unavailable"));
        subscribe(null);

        assertEquals(SubscriptionDropReason.CATCH_UP_ERROR, dropReason.get(5, SECONDS));
    }

    @Test
    void testKafkaExceptionWhileLive() throws Exception {
        consumer.updateEndOffsets(Map.of(PARTITION, 0L));
        subscribe(null);
        await().atMost(5, SECONDS).until(() -> observed.contains("live"));
        consumer.setPollException(new KafkaException("broker unavailable"));

        assertEquals(SubscriptionDropReason.SERVER_ERROR, dropReason.get(5, SECONDS));
    }

    @Test
    void testAuthenticationFailure() throws Exception {
        consumer.updateEndOffsets(Map.of(PARTITION, 0L));
        consumer.setPollException(new AuthenticationException("bad credentials"));
        subscribe(null);

        assertEquals(SubscriptionDropReason.NOT_AUTHENTICATED, dropReason.get(5, SECONDS));
    }

    @Test
    void testAuthorizationFailure() throws Exception {
        consumer.updateEndOffsets(Map.of(PARTITION, 0L));
        consumer.setPollException(new TopicAuthorizationException(Set.of(TOPIC)));
        subscribe(null);

        assertEquals(SubscriptionDropReason.ACCESS_DENIED, dropReason.get(5, SECONDS));
    }

    @Test
    void testConsumerCreationFailure() throws Exception {
        when(consumerFactory.createConsumer(anyString(), anyString(), isNull(), any(Properties.class)))
                .thenThrow(new KafkaException("no bootstrap servers"));
        subscribe(null);

        assertEquals(SubscriptionDropReason.SUBSCRIBING_ERROR, dropReason.get(5, SECONDS));
    }
}
