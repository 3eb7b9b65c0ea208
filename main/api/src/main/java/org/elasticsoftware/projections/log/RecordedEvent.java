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

import java.util.UUID;

/**
 * A raw record as delivered by the event log.
 *
 * @param streamId    the stream (aggregate instance) the record belongs to
 * @param eventNumber the sequence number of the record within its stream
 * @param eventId     the unique id of the record
 * @param eventType   the event type name, system records start with {@link #SYSTEM_EVENT_PREFIX}
 * @param data        the serialized event payload
 * @param metadata    the serialized side-channel metadata, may be empty
 * @param position    the global log position of the record
 */
public record RecordedEvent(@Nonnull String streamId,
                            long eventNumber,
                            @Nonnull UUID eventId,
                            @Nonnull String eventType,
                            byte[] data,
                            byte[] metadata,
                            @Nonnull Position position) {
    public static final String SYSTEM_EVENT_PREFIX = "$";

    public RecordedEvent {
        if (data == null) {
            data = new byte[0];
        }
        if (metadata == null) {
            metadata = new byte[0];
        }
    }

    public boolean isSystemEvent() {
        return eventType.startsWith(SYSTEM_EVENT_PREFIX);
    }
}
