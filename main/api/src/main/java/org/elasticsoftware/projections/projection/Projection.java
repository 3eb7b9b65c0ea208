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

package org.elasticsoftware.projections.projection;

import org.elasticsoftware.projections.events.DomainEvent;
import org.elasticsoftware.projections.events.Envelope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A {@link ProjectionDefinition} that dispatches envelopes to handlers registered per event class.
 * Envelopes carrying an event without a handler are ignored.
 *
 * <pre>{@code
 * Projection<BalanceRepository> balances = Projection.builder("WalletBalances", BalanceRepository.class)
 *         .when(WalletCreatedEvent.class, (repository, envelope) -> repository.create(envelope.event().id()))
 *         .when(WalletCreditedEvent.class, (repository, envelope) -> repository.credit(envelope.event()))
 *         .build();
 * }</pre>
 */
public final class Projection<T> implements ProjectionDefinition {
    private final String name;
    private final Class<T> targetType;
    private final Map<Class<? extends DomainEvent>, ProjectionHandler<T, ? extends DomainEvent>> handlers;

    private Projection(String name,
                       Class<T> targetType,
                       Map<Class<? extends DomainEvent>, ProjectionHandler<T, ? extends DomainEvent>> handlers) {
        this.name = name;
        this.targetType = targetType;
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
    }

    public static <T> Builder<T> builder(String name, Class<T> targetType) {
        return new Builder<>(name, targetType);
    }

    @Override
    public String getProjectionName() {
        return name;
    }

    @Override
    public Set<Class<? extends DomainEvent>> getHandledEventTypes() {
        return handlers.keySet();
    }

    public Class<T> getTargetType() {
        return targetType;
    }

    @Override
    public <C> Projector<C> build(Class<C> connectionType) {
        if (!targetType.isAssignableFrom(connectionType)) {
            throw new IllegalArgumentException("Projection " + name + " targets " + targetType.getName()
                    + " and cannot be bound to " + connectionType.getName());
        }
        return (target, envelope) -> dispatch(targetType.cast(target), envelope);
    }

    @SuppressWarnings("unchecked")
    private <E extends DomainEvent> void dispatch(T target, Envelope<E> envelope) throws Exception {
        ProjectionHandler<T, E> handler = (ProjectionHandler<T, E>) handlers.get(envelope.eventType());
        if (handler != null) {
            handler.handle(target, envelope);
        }
    }

    @Override
    public String toString() {
        return "Projection{" + name + "}";
    }

    public static final class Builder<T> {
        private final String name;
        private final Class<T> targetType;
        private final Map<Class<? extends DomainEvent>, ProjectionHandler<T, ? extends DomainEvent>> handlers = new LinkedHashMap<>();

        private Builder(String name, Class<T> targetType) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Projection name cannot be empty");
            }
            this.name = name;
            this.targetType = Objects.requireNonNull(targetType, "targetType");
        }

        public <E extends DomainEvent> Builder<T> when(Class<E> eventType, ProjectionHandler<T, E> handler) {
            if (handlers.putIfAbsent(eventType, Objects.requireNonNull(handler, "handler")) != null) {
                throw new IllegalStateException("Projection " + name + " already has a handler for " + eventType.getName());
            }
            return this;
        }

        public Projection<T> build() {
            return new Projection<>(name, targetType, handlers);
        }
    }
}
