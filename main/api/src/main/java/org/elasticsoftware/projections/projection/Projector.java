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

/**
 * Applies envelopes to a projection target. Records can be delivered more than once after a restart, so
 * implementations have to be idempotent or converge when the same envelope is applied again.
 *
 * @param <C> the target (connection, session, repository) the projection writes to
 */
@FunctionalInterface
public interface Projector<C> {
    void project(C target, Envelope<? extends DomainEvent> envelope) throws Exception;
}
