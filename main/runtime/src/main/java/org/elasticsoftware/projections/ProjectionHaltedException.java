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

package org.elasticsoftware.projections;

import org.elasticsoftware.projections.log.SubscriptionDropReason;

public class ProjectionHaltedException extends ProjectionsException {
    private final SubscriptionDropReason reason;

    public ProjectionHaltedException(String projectionName, SubscriptionDropReason reason, String message, Throwable cause) {
        super(projectionName, message, cause);
        this.reason = reason;
    }

    /**
     * The drop reason that halted the projection, {@code null} when it failed to start.
     */
    public SubscriptionDropReason getReason() {
        return reason;
    }
}
