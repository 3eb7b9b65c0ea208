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

package org.elasticsoftware.projections.events;

import org.elasticsoftware.projections.annotations.DomainEventInfo;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DomainEventTypeTest {
    @DomainEventInfo(type = "OrderPlaced", version = 2)
    record OrderPlacedEvent(String orderId) implements DomainEvent {
        @Override
        public String getAggregateId() {
            return orderId;
        }
    }

    record UnannotatedEvent(String id) implements DomainEvent {
        @Override
        public String getAggregateId() {
            return id;
        }
    }

    @Test
    void testOfReadsAnnotation() {
        DomainEventType<OrderPlacedEvent> type = DomainEventType.of(OrderPlacedEvent.class);
        assertEquals("OrderPlaced", type.typeName());
        assertEquals(2, type.version());
        assertEquals(OrderPlacedEvent.class, type.typeClass());
    }

    @Test
    void testOfWithoutAnnotationFails() {
        assertThrows(IllegalArgumentException.class, () -> DomainEventType.of(UnannotatedEvent.class));
    }

    @Test
    void testEnvelopeCarriesRuntimeType() {
        DomainEvent event = new OrderPlacedEvent("o-1");
        Envelope<DomainEvent> envelope = Envelope.of(event, 42L);
        assertEquals(OrderPlacedEvent.class, envelope.eventType());
        assertEquals(42L, envelope.position());
        assertThrows(NullPointerException.class, () -> Envelope.of(null, 1L));
    }
}
