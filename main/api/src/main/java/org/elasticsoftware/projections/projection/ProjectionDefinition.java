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

import java.util.Set;

public interface ProjectionDefinition {
    /**
     * The unique and stable name of the projection. It is used as the checkpoint key, so renaming a projection
     * makes it replay the whole log.
     */
    String getProjectionName();

    <C> Projector<C> build(Class<C> targetType);

    Set<Class<? extends DomainEvent>> getHandledEventTypes();
}
