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

package org.elasticsoftware.projections.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.projections.events.DomainEvent;
import org.elasticsoftware.projections.events.DomainEventType;
import org.elasticsoftware.projections.log.RecordedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;

public class JacksonEventDeserializer implements EventDeserializer {
    private static final Logger logger = LoggerFactory.getLogger(JacksonEventDeserializer.class);
    private final ObjectMapper objectMapper;
    private final Map<String, DomainEventType<?>> domainEventTypes;
    private final boolean ignoreUnknownEventTypes;

    private JacksonEventDeserializer(ObjectMapper objectMapper,
                                     Map<String, DomainEventType<?>> domainEventTypes,
                                     boolean ignoreUnknownEventTypes) {
        this.objectMapper = objectMapper;
        this.domainEventTypes = Collections.unmodifiableMap(domainEventTypes);
        this.ignoreUnknownEventTypes = ignoreUnknownEventTypes;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public DomainEvent deserialize(RecordedEvent record) throws EventDeserializationException {
        DomainEventType<?> domainEventType = domainEventTypes.get(record.eventType());
        if (domainEventType == null) {
            if (ignoreUnknownEventTypes) {
                logger.trace("Ignoring unregistered event type {} for stream {}", record.eventType(), record.streamId());
                return new UnregisteredDomainEvent(record.eventType(), record.streamId());
            }
            throw new UnknownEventTypeException(record.eventType(), record.eventId());
        }
        try {
            return objectMapper.readValue(record.data(), domainEventType.typeClass());
        } catch (IOException e) {
            throw new EventDeserializationException(record.eventType(), record.eventId(),
                    "Unable to deserialize " + record.eventType() + " into " + domainEventType.typeClass().getName(), e);
        }
    }

    public Set<String> getRegisteredEventTypes() {
        return domainEventTypes.keySet();
    }

    public static class Builder {
        private final Map<String, DomainEventType<?>> domainEventTypes = new HashMap<>();
        private ObjectMapper objectMapper;
        private boolean ignoreUnknownEventTypes = false;

        public Builder setObjectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder addDomainEventType(DomainEventType<?> domainEventType) {
            DomainEventType<?> existing = domainEventTypes.putIfAbsent(domainEventType.typeName(), domainEventType);
            if (existing != null && !existing.typeClass().equals(domainEventType.typeClass())) {
                throw new IllegalStateException("Event type " + domainEventType.typeName() + " is already registered to "
                        + existing.typeClass().getName());
            }
            return this;
        }

        public Builder addDomainEventClass(Class<? extends DomainEvent> eventClass) {
            return addDomainEventType(DomainEventType.of(eventClass));
        }

        public Builder setIgnoreUnknownEventTypes(boolean ignoreUnknownEventTypes) {
            this.ignoreUnknownEventTypes = ignoreUnknownEventTypes;
            return this;
        }

        public JacksonEventDeserializer build() {
            return new JacksonEventDeserializer(
                    objectMapper != null ? objectMapper : new ObjectMapper(),
                    new HashMap<>(domainEventTypes),
                    ignoreUnknownEventTypes);
        }
    }
}
