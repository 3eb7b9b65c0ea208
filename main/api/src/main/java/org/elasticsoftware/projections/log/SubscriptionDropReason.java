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

public enum SubscriptionDropReason {
    USER_INITIATED,
    NOT_AUTHENTICATED,
    ACCESS_DENIED,
    SUBSCRIBING_ERROR,
    SERVER_ERROR,
    CONNECTION_CLOSED,
    CATCH_UP_ERROR,
    PROCESSING_QUEUE_OVERFLOW,
    EVENT_HANDLER_EXCEPTION,
    MAX_SUBSCRIBERS_REACHED,
    NOT_FOUND,
    UNKNOWN
}
