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

/**
 * @param maxLiveQueueSize maximum number of live records buffered before the subscription drops with
 *                         {@link SubscriptionDropReason#PROCESSING_QUEUE_OVERFLOW}
 * @param readBatchSize    number of records read per round trip while catching up
 * @param verboseLogging   whether the transport should log at trace level
 * @param resolveLinkTos   whether link records should be resolved to the records they point to
 * @param subscriptionName name of the subscription, used in logging and thread names
 */
public record CatchUpSubscriptionSettings(int maxLiveQueueSize,
                                          int readBatchSize,
                                          boolean verboseLogging,
                                          boolean resolveLinkTos,
                                          String subscriptionName) {
    public CatchUpSubscriptionSettings {
        if (maxLiveQueueSize <= 0) {
            throw new IllegalArgumentException("maxLiveQueueSize should be positive");
        }
        if (readBatchSize <= 0) {
            throw new IllegalArgumentException("readBatchSize should be positive");
        }
        if (readBatchSize > maxLiveQueueSize) {
            throw new IllegalArgumentException("readBatchSize should not exceed maxLiveQueueSize");
        }
    }
}
