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

import jakarta.annotation.Nonnull;

import java.util.Objects;

/**
 * A deserialized {@link DomainEvent} together with the global log position it was read from.
 * <p>
 * Use {@link #of(DomainEvent, long)} to create one: the type parameter is inferred from the event value
 * so the declared event type always matches the runtime type.
 *
 * @param event    the domain event
 * @param position the commit position of the record in the global log
 * @param <E>      the event type
 */
public record Envelope<E extends DomainEvent>(@Nonnull E event, long position) {

    public Envelope {
        Objects.requireNonNull(event, "event");
    }

    public static <E extends DomainEvent> Envelope<E> of(@Nonnull E event, long position) {
        return new Envelope<>(event, position);
    }

    @SuppressWarnings("unchecked")
    public Class<? extends E> eventType() {
        return (Class<? extends E>) event.getClass();
    }
}
