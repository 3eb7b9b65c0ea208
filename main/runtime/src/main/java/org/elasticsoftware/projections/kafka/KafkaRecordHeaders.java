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
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.elasticsoftware.projections.log.Position;
import org.elasticsoftware.projections.log.RecordedEvent;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Header layout of the records on the event log topic. The record key is the stream id, the value is the event
 * payload and the offset is the global position.
 */
public final class KafkaRecordHeaders {
    public static final String EVENT_TYPE = "projections.event-type";
    public static final String EVENT_ID = "projections.event-id";
    public static final String EVENT_NUMBER = "projections.event-number";
    public static final String METADATA = "projections.metadata";

    private KafkaRecordHeaders() {
    }

    public static Headers create(String eventType, UUID eventId, long eventNumber, @Nullable byte[] metadata) {
        RecordHeaders headers = new RecordHeaders();
        headers.add(EVENT_TYPE, eventType.getBytes(StandardCharsets.UTF_8));
        headers.add(EVENT_ID, eventId.toString().getBytes(StandardCharsets.UTF_8));
        headers.add(EVENT_NUMBER, Long.toString(eventNumber).getBytes(StandardCharsets.UTF_8));
        if (metadata != null) {
            headers.add(METADATA, metadata);
        }
        return headers;
    }

    public static RecordedEvent toRecordedEvent(ConsumerRecord<String, byte[]> record) {
        String eventType = readString(record.headers(), EVENT_TYPE);
        if (eventType == null) {
            throw new IllegalArgumentException("Record at offset " + record.offset() + " of " + record.topic()
                    + " has no " + EVENT_TYPE + " header");
        }
        String eventId = readString(record.headers(), EVENT_ID);
        String eventNumber = readString(record.headers(), EVENT_NUMBER);
        Header metadata = record.headers().lastHeader(METADATA);
        return new RecordedEvent(
                record.key() != null ? record.key() : "",
                eventNumber != null ? Long.parseLong(eventNumber) : -1L,
                eventId != null
                        ? UUID.fromString(eventId)
                        : UUID.nameUUIDFromBytes((record.topic() + "-" + record.partition() + "-" + record.offset())
                        .getBytes(StandardCharsets.UTF_8)),
                eventType,
                record.value(),
                metadata != null ? metadata.value() : null,
                Position.of(record.offset()));
    }

    @Nullable
    private static String readString(Headers headers, String key) {
        Header header = headers.lastHeader(key);
        return header != null && header.value() != null ? new String(header.value(), StandardCharsets.UTF_8) : null;
    }
}
