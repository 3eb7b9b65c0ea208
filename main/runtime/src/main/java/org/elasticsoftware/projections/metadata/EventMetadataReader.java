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

package org.elasticsoftware.projections.metadata;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.elasticsoftware.projections.log.EventMetadata;

import java.io.IOException;

/**
 * Reads the JSON metadata that is stored next to each record. Records without metadata read as
 * {@link EventMetadata#EMPTY}.
 */
public class EventMetadataReader {
    private final ObjectReader reader;

    public EventMetadataReader(ObjectMapper objectMapper) {
        this.reader = objectMapper.readerFor(EventMetadata.class);
    }

    public EventMetadata read(byte[] metadata) throws IOException {
        if (metadata == null || metadata.length == 0) {
            return EventMetadata.EMPTY;
        }
        EventMetadata eventMetadata = reader.readValue(metadata);
        return eventMetadata != null ? eventMetadata : EventMetadata.EMPTY;
    }
}
