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

package org.elasticsoftware.projections.log;

import jakarta.annotation.Nonnull;
import jakarta.annotation.Nullable;

/**
 * Connection to an ordered, append-only global event log.
 * <p>
 * Implementations must honour the following contract for every subscription they open:
 * <ul>
 *     <li>callbacks are invoked sequentially, the next record is only delivered after
 *     {@link EventAppearedHandler#eventAppeared} returned</li>
 *     <li>records are delivered in strictly increasing position order</li>
 *     <li>an exception thrown from {@link EventAppearedHandler#eventAppeared} ends the subscription with
 *     {@link SubscriptionDropReason#EVENT_HANDLER_EXCEPTION}</li>
 *     <li>{@link SubscriptionDroppedHandler#subscriptionDropped} is invoked at most once</li>
 * </ul>
 */
public interface EventLogConnection {
    /**
     * Subscribes to the whole log, starting with the first record after {@code lastCheckpoint}.
     *
     * @param lastCheckpoint the last processed position, or {@code null} to start from the beginning of the log
     */
    CatchUpSubscription subscribeToAllFrom(@Nullable Position lastCheckpoint,
                                           @Nonnull CatchUpSubscriptionSettings settings,
                                           @Nonnull EventAppearedHandler eventAppeared,
                                           @Nonnull LiveProcessingStartedHandler liveProcessingStarted,
                                           @Nonnull SubscriptionDroppedHandler subscriptionDropped);
}
