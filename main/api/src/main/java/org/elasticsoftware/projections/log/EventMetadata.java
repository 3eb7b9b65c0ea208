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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Side-channel metadata written next to each record by the aggregate that produced it.
 *
 * @param aggregateType                   the aggregate type tag
 * @param aggregateAssemblyQualifiedName the fully qualified aggregate type name, kept for records written by
 *                                        producers that do not emit a tag
 * @param snapshot                        true when the record is itself a snapshot
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonFormat(with = JsonFormat.Feature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
public record EventMetadata(String aggregateType, String aggregateAssemblyQualifiedName, boolean snapshot) {
    public static final EventMetadata EMPTY = new EventMetadata(null, null, false);

    @JsonCreator
    public EventMetadata(@JsonProperty("AggregateType") String aggregateType,
                         @JsonProperty("AggregateAssemblyQualifiedName") String aggregateAssemblyQualifiedName,
                         @JsonProperty("IsSnapshot") boolean snapshot) {
        this.aggregateType = aggregateType;
        this.aggregateAssemblyQualifiedName = aggregateAssemblyQualifiedName;
        this.snapshot = snapshot;
    }
}
